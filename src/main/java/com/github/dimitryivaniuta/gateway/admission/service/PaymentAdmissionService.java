package com.github.dimitryivaniuta.gateway.admission.service;

import com.github.dimitryivaniuta.gateway.admission.config.AppProperties;
import com.github.dimitryivaniuta.gateway.admission.domain.PayloadMismatchPolicy;
import com.github.dimitryivaniuta.gateway.admission.domain.Payment;
import com.github.dimitryivaniuta.gateway.admission.repo.InsertResult;
import com.github.dimitryivaniuta.gateway.admission.repo.PaymentStore;
import com.github.dimitryivaniuta.gateway.admission.service.dto.AdmissionResult;
import com.github.dimitryivaniuta.gateway.admission.service.dto.PaymentInput;
import com.github.dimitryivaniuta.gateway.admission.service.exception.IdempotencyConflictException;
import com.github.dimitryivaniuta.gateway.admission.service.exception.InvariantViolationException;
import com.github.dimitryivaniuta.gateway.admission.service.exception.PaymentNotFoundException;
import com.github.dimitryivaniuta.gateway.admission.service.exception.StorageFailureException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Idempotent payment admission.
 *
 * <p>Flow for {@link #requestPayment}:
 * <ol>
 *   <li>Re-check the preconditions the transport layer already validated; violations abort.</li>
 *   <li>Call {@link PaymentStore#insertIfAbsent} with a factory that generates the id and timestamp, so id
 *       generation happens only for the caller that actually creates the payment.</li>
 *   <li>On a replay, apply the configured {@link PayloadMismatchPolicy}.</li>
 *   <li>Return the stored payment and whether this call created it.</li>
 * </ol>
 *
 * <p>Nothing is retried here; every failure reaches the caller as a typed
 * {@link com.github.dimitryivaniuta.gateway.admission.service.exception.PaymentAdmissionException}.</p>
 */
@Service
public class PaymentAdmissionService {

    private static final Logger log = LoggerFactory.getLogger(PaymentAdmissionService.class);

    private final PaymentStore paymentStore;
    private final PaymentIdGenerator idGenerator;
    private final Clock clock;
    private final RequestHashService requestHashService;
    private final AppProperties properties;

    private final Counter createdCounter;
    private final Counter replayCounter;
    private final Counter conflictCounter;

    /**
     * Creates the service.
     *
     * @param paymentStore payment store
     * @param idGenerator payment id generator
     * @param clock clock for {@code createdAt}
     * @param requestHashService payload fingerprinting
     * @param properties app properties
     * @param meterRegistry metrics
     */
    public PaymentAdmissionService(
            PaymentStore paymentStore,
            PaymentIdGenerator idGenerator,
            Clock clock,
            RequestHashService requestHashService,
            AppProperties properties,
            MeterRegistry meterRegistry
    ) {
        this.paymentStore = paymentStore;
        this.idGenerator = idGenerator;
        this.clock = clock;
        this.requestHashService = requestHashService;
        this.properties = properties;

        this.createdCounter = Counter.builder("payments.admission.created").register(meterRegistry);
        this.replayCounter = Counter.builder("payments.admission.replayed").register(meterRegistry);
        this.conflictCounter = Counter.builder("payments.admission.conflict").register(meterRegistry);
    }

    /**
     * Admits a payment, or returns the payment already admitted for the same idempotency key.
     *
     * @param input validated payment input
     * @return stored payment + created flag
     * @throws InvariantViolationException if the input breaks a precondition or the store detects an id collision
     * @throws StorageFailureException if the store could not complete the insert
     * @throws IdempotencyConflictException if the key was used with another payload and the policy is REJECT
     */
    public AdmissionResult requestPayment(PaymentInput input) {
        checkPreconditions(input);
        String key = input.idempotencyKey();

        InsertResult result;
        try {
            result = paymentStore.insertIfAbsent(key, () -> newPayment(input));
        } catch (StorageFailureException e) {
            log.error("Payment admission failed in storage. key={}", key, e);
            throw e;
        } catch (InvariantViolationException e) {
            log.error("Payment admission aborted. key={} reason={}", key, e.getMessage());
            throw e;
        }

        Payment payment = result.payment();
        if (result.inserted()) {
            createdCounter.increment();
            log.info("Payment admitted. paymentId={} key={} orderId={} amountMinor={} currency={}",
                    payment.getId(), key, payment.getOrderId(), payment.getAmountMinor(), payment.getCurrency());
            return new AdmissionResult(payment, true);
        }

        if (properties.getIdempotency().getPayloadMismatchPolicy() == PayloadMismatchPolicy.REJECT
                && !samePayload(payment, input)) {
            conflictCounter.increment();
            log.warn("Idempotency key reused with a different payload. key={} paymentId={}", key, payment.getId());
            if (log.isDebugEnabled()) {
                log.debug("Stored payload={} incoming payload={}",
                        requestHashService.canonicalJson(PaymentInput.of(payment)),
                        requestHashService.canonicalJson(input));
            }
            throw new IdempotencyConflictException(key);
        }

        replayCounter.increment();
        log.info("Returning existing payment for idempotency key. paymentId={} key={} status={}",
                payment.getId(), key, payment.getStatus());
        return new AdmissionResult(payment, false);
    }

    /**
     * Fetches a payment by id.
     *
     * @param paymentId payment id
     * @return payment
     * @throws PaymentNotFoundException if no payment has this id
     */
    public Payment getPayment(String paymentId) {
        return findPayment(paymentId).orElseThrow(() -> {
            log.info("Payment not found. paymentId={}", paymentId);
            return new PaymentNotFoundException(paymentId);
        });
    }

    /**
     * Looks up a payment by id.
     *
     * @param paymentId payment id
     * @return payment, empty if unknown
     */
    public Optional<Payment> findPayment(String paymentId) {
        if (paymentId == null || paymentId.isBlank()) {
            return Optional.empty();
        }
        return paymentStore.findById(paymentId);
    }

    private Payment newPayment(PaymentInput input) {
        String id = idGenerator.nextId();
        if (id == null || id.isBlank()) {
            throw new InvariantViolationException("Payment id generator returned a blank id");
        }
        Instant now = Instant.now(clock);
        return Payment.newPending(
                id,
                input.idempotencyKey(),
                input.orderId(),
                input.amountMinor(),
                input.currency(),
                input.metadata(),
                now
        );
    }

    private boolean samePayload(Payment stored, PaymentInput incoming) {
        return requestHashService.hash(PaymentInput.of(stored)).equals(requestHashService.hash(incoming));
    }

    private static void checkPreconditions(PaymentInput input) {
        if (input == null) {
            throw new InvariantViolationException("Payment input is required");
        }
        if (input.amountMinor() <= 0) {
            throw new InvariantViolationException("amountMinor must be positive, got " + input.amountMinor());
        }
        if (isEmpty(input.idempotencyKey())) {
            throw new InvariantViolationException("idempotencyKey must not be empty");
        }
        if (isEmpty(input.orderId())) {
            throw new InvariantViolationException("orderId must not be empty");
        }
        if (isEmpty(input.currency())) {
            throw new InvariantViolationException("currency must not be empty");
        }
    }

    private static boolean isEmpty(String s) {
        return s == null || s.isEmpty();
    }
}
