package com.github.dimitryivaniuta.gateway.admission.web.dto;

import com.github.dimitryivaniuta.gateway.admission.service.dto.PaymentInput;
import jakarta.validation.constraints.NotNull;
import java.util.Map;

/**
 * Request payload for creating a payment. The idempotency key travels in the {@code X-Idempotency-Key} header.
 *
 * <p>Only presence of the amount is checked at binding time; field rules and their messages belong to
 * {@link com.github.dimitryivaniuta.gateway.admission.service.PaymentRequestValidator}.</p>
 */
public record CreatePaymentRequest(
        @NotNull Long amountMinor,
        String currency,
        String orderId,
        Map<String, String> metadata
) {

    /**
     * Combines the body with the idempotency key header.
     *
     * @param idempotencyKey idempotency key
     * @return admission input
     */
    public PaymentInput toInput(String idempotencyKey) {
        return new PaymentInput(amountMinor, currency, orderId, idempotencyKey, metadata);
    }
}
