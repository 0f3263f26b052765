package com.github.dimitryivaniuta.gateway.admission.repo;

import com.github.dimitryivaniuta.gateway.admission.domain.Payment;

/**
 * Outcome of {@link PaymentStore#insertIfAbsent}.
 *
 * @param payment stored payment (new or pre-existing)
 * @param inserted true if this call created it
 */
public record InsertResult(Payment payment, boolean inserted) {}
