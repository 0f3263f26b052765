package com.github.dimitryivaniuta.gateway.admission.service.exception;

/**
 * An internal invariant was broken: identifier collision, index desynchronization, or
 * invalid input that slipped past validation. The operation is aborted without touching state.
 */
public class InvariantViolationException extends PaymentAdmissionException {

    public InvariantViolationException(String message) {
        super(ErrorCode.INVARIANT_VIOLATION, message);
    }

    /**
     * Generated payment id already belongs to another payment.
     *
     * @param paymentId colliding id
     * @return exception
     */
    public static InvariantViolationException duplicateIdentifier(String paymentId) {
        return new InvariantViolationException(
                "Generated payment id '" + paymentId + "' collides with an existing payment; id generator is defective");
    }
}
