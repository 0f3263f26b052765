package com.github.dimitryivaniuta.gateway.admission.repo;

import com.github.dimitryivaniuta.gateway.admission.domain.Payment;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Storage for admitted payments, indexed by payment id and by idempotency key.
 *
 * <p>The admission algorithm depends only on this interface, so a persistent implementation can replace
 * {@link InMemoryPaymentStore} without touching it.</p>
 */
public interface PaymentStore {

    /**
     * Finds the payment admitted for an idempotency key.
     *
     * @param idempotencyKey key
     * @return payment
     */
    Optional<Payment> findByIdempotencyKey(String idempotencyKey);

    /**
     * Finds a payment by id.
     *
     * @param paymentId payment id
     * @return payment
     */
    Optional<Payment> findById(String paymentId);

    /**
     * Atomically returns the payment stored for {@code idempotencyKey}, or creates one with {@code factory}
     * and stores it under both indices.
     *
     * <p>For a given key at most one factory invocation ever succeeds; every concurrent caller receives the
     * same stored instance. If the factory fails, nothing is stored and the failure is rethrown as a
     * {@link com.github.dimitryivaniuta.gateway.admission.service.exception.StorageFailureException}
     * (admission exceptions raised by the factory pass through unchanged).</p>
     *
     * @param idempotencyKey key
     * @param factory builds the payment to insert; must produce a payment carrying {@code idempotencyKey}
     * @return stored payment and whether this call inserted it
     */
    InsertResult insertIfAbsent(String idempotencyKey, Supplier<Payment> factory);

    /**
     * Number of stored payments.
     *
     * @return count
     */
    long count();
}
