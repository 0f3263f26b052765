package com.github.dimitryivaniuta.gateway.admission.service;

import java.util.UUID;
import org.springframework.stereotype.Component;

/**
 * Random (version 4) UUID payment ids.
 */
@Component
public class UuidPaymentIdGenerator implements PaymentIdGenerator {

    @Override
    public String nextId() {
        return UUID.randomUUID().toString();
    }
}
