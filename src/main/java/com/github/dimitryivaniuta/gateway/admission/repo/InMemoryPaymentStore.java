package com.github.dimitryivaniuta.gateway.admission.repo;

import com.github.dimitryivaniuta.gateway.admission.domain.Payment;
import com.github.dimitryivaniuta.gateway.admission.service.exception.InvariantViolationException;
import com.github.dimitryivaniuta.gateway.admission.service.exception.PaymentAdmissionException;
import com.github.dimitryivaniuta.gateway.admission.service.exception.StorageFailureException;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

/**
 * Process-local {@link PaymentStore} backed by two {@link ConcurrentHashMap}s.
 *
 * <p>How the two indices stay consistent:
 * <ul>
 *   <li>The key index is the commit point. A payment is inserted with {@code computeIfAbsent} on the key
 *       index, which serializes concurrent inserts for the same key on that key's hash bin only.</li>
 *   <li>The id index is written inside the same {@code computeIfAbsent} call, after the factory succeeded
 *       and the id was checked for collisions. Nothing is written if the factory fails.</li>
 *   <li>{@link #findById} only returns a payment whose key-index entry is already published, so a reader
 *       never sees a payment that is present in one index and missing from the other.</li>
 * </ul>
 *
 * <p>Reads never block. Contents live for the lifetime of the process.</p>
 */
@Slf4j
@Repository
public class InMemoryPaymentStore implements PaymentStore {

    private final ConcurrentHashMap<String, Payment> byIdempotencyKey = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Payment> byId = new ConcurrentHashMap<>();

    @Override
    public Optional<Payment> findByIdempotencyKey(String idempotencyKey) {
        return Optional.ofNullable(byIdempotencyKey.get(idempotencyKey));
    }

    @Override
    public Optional<Payment> findById(String paymentId) {
        Payment payment = byId.get(paymentId);
        if (payment == null) {
            return Optional.empty();
        }
        // Not committed until the key index publishes the same instance.
        return byIdempotencyKey.get(payment.getIdempotencyKey()) == payment
                ? Optional.of(payment)
                : Optional.empty();
    }

    @Override
    public InsertResult insertIfAbsent(String idempotencyKey, Supplier<Payment> factory) {
        Objects.requireNonNull(idempotencyKey, "idempotencyKey");
        Objects.requireNonNull(factory, "factory");

        Payment existing = byIdempotencyKey.get(idempotencyKey);
        if (existing != null) {
            return new InsertResult(existing, false);
        }

        AtomicBoolean inserted = new AtomicBoolean(false);
        Payment stored;
        try {
            stored = byIdempotencyKey.computeIfAbsent(idempotencyKey, key -> {
                Payment created = factory.get();
                if (created == null) {
                    throw new InvariantViolationException("Payment factory returned null for idempotency key '" + key + "'");
                }
                if (!key.equals(created.getIdempotencyKey())) {
                    throw new InvariantViolationException("Payment factory produced idempotency key '"
                            + created.getIdempotencyKey() + "' while inserting '" + key + "'");
                }
                if (byId.putIfAbsent(created.getId(), created) != null) {
                    throw InvariantViolationException.duplicateIdentifier(created.getId());
                }
                inserted.set(true);
                return created;
            });
        } catch (PaymentAdmissionException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new StorageFailureException("Unable to insert payment for idempotency key '" + idempotencyKey + "'", e);
        }

        if (inserted.get()) {
            log.debug("Stored payment {} for idempotency key {}", stored.getId(), idempotencyKey);
        }
        return new InsertResult(stored, inserted.get());
    }

    @Override
    public long count() {
        return byIdempotencyKey.size();
    }
}
