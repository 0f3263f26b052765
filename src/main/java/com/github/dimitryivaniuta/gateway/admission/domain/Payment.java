package com.github.dimitryivaniuta.gateway.admission.domain;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Payment admitted for a single idempotency key.
 *
 * <p>Instances are immutable: every field is fixed at admission and the metadata map is an unmodifiable
 * copy of the caller's map, so a payment can be shared freely between request threads.</p>
 */
@Getter
@ToString
@EqualsAndHashCode
public final class Payment {

    /** Message attached to freshly admitted payments. */
    public static final String INITIATED_MESSAGE = "Payment initiated";

    private final String id;
    private final String idempotencyKey;
    private final String orderId;
    private final long amountMinor;
    private final String currency;
    private final PaymentStatus status;
    private final String message;
    private final Map<String, String> metadata;
    private final Instant createdAt;

    private Payment(
            String id,
            String idempotencyKey,
            String orderId,
            long amountMinor,
            String currency,
            PaymentStatus status,
            String message,
            Map<String, String> metadata,
            Instant createdAt
    ) {
        this.id = Objects.requireNonNull(id, "id");
        this.idempotencyKey = Objects.requireNonNull(idempotencyKey, "idempotencyKey");
        this.orderId = Objects.requireNonNull(orderId, "orderId");
        this.amountMinor = amountMinor;
        this.currency = Objects.requireNonNull(currency, "currency");
        this.status = Objects.requireNonNull(status, "status");
        this.message = Objects.requireNonNull(message, "message");
        this.metadata = metadata == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
    }

    /**
     * Factory method for a newly admitted payment.
     *
     * @param id generated payment id
     * @param idempotencyKey idempotency key
     * @param orderId merchant order reference
     * @param amountMinor amount in minor units
     * @param currency currency code (upper-cased here)
     * @param metadata opaque metadata, may be null
     * @param createdAt admission time
     * @return pending payment
     */
    public static Payment newPending(
            String id,
            String idempotencyKey,
            String orderId,
            long amountMinor,
            String currency,
            Map<String, String> metadata,
            Instant createdAt
    ) {
        return new Payment(
                id,
                idempotencyKey,
                orderId,
                amountMinor,
                currency.toUpperCase(Locale.ROOT),
                PaymentStatus.PENDING,
                INITIATED_MESSAGE,
                metadata,
                createdAt
        );
    }
}
