package com.github.dimitryivaniuta.gateway.admission.service.exception;

/**
 * The payment store could not complete an operation. Fatal for the current request.
 */
public class StorageFailureException extends PaymentAdmissionException {

    public StorageFailureException(String message, Throwable cause) {
        super(ErrorCode.STORAGE_FAILURE, message, cause);
    }
}
