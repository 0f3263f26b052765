package com.github.dimitryivaniuta.gateway.admission.service.exception;

/**
 * A payment request failed syntactic validation.
 */
public class PaymentValidationException extends PaymentAdmissionException {

    public PaymentValidationException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
    }

    public PaymentValidationException(String message, Throwable cause) {
        super(ErrorCode.VALIDATION_ERROR, message, cause);
    }
}
