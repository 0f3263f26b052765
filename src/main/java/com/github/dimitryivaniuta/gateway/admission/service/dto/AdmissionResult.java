package com.github.dimitryivaniuta.gateway.admission.service.dto;

import com.github.dimitryivaniuta.gateway.admission.domain.Payment;

/**
 * Result of a payment admission.
 *
 * @param payment admitted payment; identical for the creating call and every replay
 * @param created whether this call created the payment
 */
public record AdmissionResult(Payment payment, boolean created) {

    /**
     * @return true if the payment already existed for the idempotency key
     */
    public boolean replayed() {
        return !created;
    }
}
