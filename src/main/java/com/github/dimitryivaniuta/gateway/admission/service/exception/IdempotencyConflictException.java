package com.github.dimitryivaniuta.gateway.admission.service.exception;

import lombok.Getter;

/**
 * An idempotency key was reused with a payload that differs from the admitted one.
 *
 * <p>Only raised under {@link com.github.dimitryivaniuta.gateway.admission.domain.PayloadMismatchPolicy#REJECT}.</p>
 */
@Getter
public class IdempotencyConflictException extends PaymentAdmissionException {

    private final String idempotencyKey;

    public IdempotencyConflictException(String idempotencyKey) {
        super(ErrorCode.IDEMPOTENCY_CONFLICT,
                "Idempotency key '" + idempotencyKey + "' was already used with a different request payload.");
        this.idempotencyKey = idempotencyKey;
    }
}
