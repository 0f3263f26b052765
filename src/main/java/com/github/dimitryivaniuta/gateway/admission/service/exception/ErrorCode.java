package com.github.dimitryivaniuta.gateway.admission.service.exception;

/**
 * Machine-readable failure codes returned to API clients.
 */
public enum ErrorCode {
    /** Input failed a syntactic precondition. */
    VALIDATION_ERROR,

    /** No payment with the requested id. */
    NOT_FOUND,

    /** Idempotency key reused with a different payload. */
    IDEMPOTENCY_CONFLICT,

    /** The store could not complete the operation. */
    STORAGE_FAILURE,

    /** Internal consistency check failed (identifier collision, index desync, bad input reaching the core). */
    INVARIANT_VIOLATION
}
