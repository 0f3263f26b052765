package com.github.dimitryivaniuta.gateway.admission.domain;

/**
 * What to do when a known idempotency key arrives with a different payload.
 */
public enum PayloadMismatchPolicy {
    /** Replay the stored payment and ignore the new payload. */
    RETURN_ORIGINAL,

    /** Reject the request with an idempotency conflict. */
    REJECT
}
