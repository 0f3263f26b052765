package com.github.dimitryivaniuta.gateway.admission.service.exception;

import lombok.Getter;

/**
 * Base type for every failure the admission core reports.
 *
 * <p>Callers branch on the concrete subtype (or {@link #getErrorCode()}); the core never retries.</p>
 */
@Getter
public abstract class PaymentAdmissionException extends RuntimeException {

    private final ErrorCode errorCode;

    protected PaymentAdmissionException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected PaymentAdmissionException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
