package com.github.dimitryivaniuta.gateway.admission.repo;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports the payment store under {@code /actuator/health} as {@code paymentStore}.
 */
@Component
public class PaymentStoreHealthIndicator implements HealthIndicator {

    private final PaymentStore paymentStore;

    public PaymentStoreHealthIndicator(PaymentStore paymentStore) {
        this.paymentStore = paymentStore;
    }

    @Override
    public Health health() {
        try {
            return Health.up().withDetail("payments", paymentStore.count()).build();
        } catch (RuntimeException e) {
            return Health.down(e).build();
        }
    }
}
