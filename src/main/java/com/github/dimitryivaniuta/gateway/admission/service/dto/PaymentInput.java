package com.github.dimitryivaniuta.gateway.admission.service.dto;

import com.github.dimitryivaniuta.gateway.admission.domain.Payment;
import java.util.Locale;
import java.util.Map;

/**
 * Input to payment admission, already validated by the transport layer.
 *
 * @param amountMinor amount in minor units
 * @param currency currency code
 * @param orderId merchant order reference
 * @param idempotencyKey client idempotency key
 * @param metadata opaque metadata, may be null
 */
public record PaymentInput(
        long amountMinor,
        String currency,
        String orderId,
        String idempotencyKey,
        Map<String, String> metadata
) {

    /**
     * Rebuilds the input that an admitted payment was created from.
     *
     * @param payment admitted payment
     * @return canonical input
     */
    public static PaymentInput of(Payment payment) {
        return new PaymentInput(
                payment.getAmountMinor(),
                payment.getCurrency(),
                payment.getOrderId(),
                payment.getIdempotencyKey(),
                payment.getMetadata()
        );
    }

    /**
     * Same input with the normalization admission applies: upper-case currency, empty instead of null metadata.
     *
     * @return canonical input
     */
    public PaymentInput canonical() {
        return new PaymentInput(
                amountMinor,
                currency == null ? null : currency.toUpperCase(Locale.ROOT),
                orderId,
                idempotencyKey,
                metadata == null ? Map.of() : metadata
        );
    }
}
