package com.github.dimitryivaniuta.gateway.admission.web.dto;

import com.github.dimitryivaniuta.gateway.admission.domain.Payment;
import java.time.Instant;
import java.util.Map;

/**
 * Payment representation returned by every payment endpoint.
 */
public record PaymentResponse(
        String paymentId,
        String status,
        String message,
        long amountMinor,
        String currency,
        String orderId,
        String idempotencyKey,
        Map<String, String> metadata,
        Instant createdAt
) {
    /**
     * Maps a domain {@link Payment} to an API response.
     *
     * @param p payment
     * @return response
     */
    public static PaymentResponse from(Payment p) {
        return new PaymentResponse(
                p.getId(),
                p.getStatus().name(),
                p.getMessage(),
                p.getAmountMinor(),
                p.getCurrency(),
                p.getOrderId(),
                p.getIdempotencyKey(),
                p.getMetadata(),
                p.getCreatedAt()
        );
    }
}
