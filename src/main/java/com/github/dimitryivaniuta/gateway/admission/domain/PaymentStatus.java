package com.github.dimitryivaniuta.gateway.admission.domain;

/**
 * Payment status.
 *
 * <p>Admission only ever produces {@link #PENDING}; the other values are reserved for settlement.</p>
 */
public enum PaymentStatus {
    /** Admitted, awaiting processing. */
    PENDING,

    /** Processed successfully. */
    SUCCEEDED,

    /** Processing failed. */
    FAILED
}
