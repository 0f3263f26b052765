package com.github.dimitryivaniuta.gateway.admission.service.exception;

import lombok.Getter;

/**
 * No payment exists for the requested id.
 */
@Getter
public class PaymentNotFoundException extends PaymentAdmissionException {

    private final String paymentId;

    public PaymentNotFoundException(String paymentId) {
        super(ErrorCode.NOT_FOUND, "Payment not found: " + paymentId);
        this.paymentId = paymentId;
    }
}
