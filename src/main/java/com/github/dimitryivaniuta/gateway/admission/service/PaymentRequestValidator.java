package com.github.dimitryivaniuta.gateway.admission.service;

import com.github.dimitryivaniuta.gateway.admission.config.AppProperties;
import com.github.dimitryivaniuta.gateway.admission.service.dto.PaymentInput;
import com.github.dimitryivaniuta.gateway.admission.service.exception.PaymentValidationException;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Syntactic validation of payment requests, applied by the transport layer before admission.
 *
 * <p>Checks run in order amount, currency, order id, idempotency key; the first failure is reported.</p>
 */
@Component
public class PaymentRequestValidator {

    private final AppProperties properties;

    /**
     * Creates the validator.
     *
     * @param properties app properties
     */
    public PaymentRequestValidator(AppProperties properties) {
        this.properties = properties;
    }

    /**
     * Validates every field of a payment input.
     *
     * @param input payment input
     * @throws PaymentValidationException on the first invalid field
     */
    public void validate(PaymentInput input) {
        if (input == null) {
            throw new PaymentValidationException("Payment request is required");
        }
        prefixed("Invalid amount: ", () -> validateAmount(input.amountMinor()));
        prefixed("Invalid currency: ", () -> validateCurrency(input.currency()));
        prefixed("Invalid order ID: ", () -> validateOrderId(input.orderId()));
        prefixed("Invalid idempotency key: ", () -> validateIdempotencyKey(input.idempotencyKey()));
    }

    /**
     * Checks that the amount is strictly positive.
     *
     * @param amountMinor amount in minor units
     */
    public void validateAmount(long amountMinor) {
        if (amountMinor <= 0) {
            throw new PaymentValidationException("Payment amount must be positive, got " + amountMinor
                    + " minor units. Amount should be specified in cents (e.g., 1250 for $12.50).");
        }
    }

    /**
     * Checks that the currency is present and one of the configured allowed codes.
     *
     * @param currency currency code, compared case-insensitively
     */
    public void validateCurrency(String currency) {
        if (currency == null || currency.isEmpty()) {
            throw new PaymentValidationException("Currency code cannot be empty");
        }
        Set<String> allowed = allowedCurrencies();
        if (!allowed.contains(currency.toUpperCase(Locale.ROOT))) {
            throw new PaymentValidationException("Unsupported currency '" + currency + "'. Allowed currencies: "
                    + String.join(", ", allowed));
        }
    }

    /**
     * Checks that the order id is present and non-empty.
     *
     * @param orderId merchant order reference
     */
    public void validateOrderId(String orderId) {
        if (orderId == null) {
            throw new PaymentValidationException("Order ID is required");
        }
        if (orderId.isEmpty()) {
            throw new PaymentValidationException("Order ID cannot be empty");
        }
    }

    /**
     * Checks that the idempotency key is present and within the configured length bounds.
     *
     * @param idempotencyKey client idempotency key
     */
    public void validateIdempotencyKey(String idempotencyKey) {
        if (idempotencyKey == null) {
            throw new PaymentValidationException("Idempotency key is required");
        }
        if (idempotencyKey.isEmpty()) {
            throw new PaymentValidationException("Idempotency key cannot be empty");
        }
        AppProperties.Idempotency cfg = properties.getIdempotency();
        if (idempotencyKey.length() < cfg.getMinKeyLength()) {
            throw new PaymentValidationException("Idempotency key must be at least " + cfg.getMinKeyLength()
                    + " characters long, got " + idempotencyKey.length());
        }
        if (idempotencyKey.length() > cfg.getMaxKeyLength()) {
            throw new PaymentValidationException("Idempotency key must be at most " + cfg.getMaxKeyLength()
                    + " characters long, got " + idempotencyKey.length());
        }
    }

    private Set<String> allowedCurrencies() {
        return properties.getValidation().getAllowedCurrencies().stream()
                .map(c -> c.toUpperCase(Locale.ROOT))
                .collect(Collectors.toCollection(TreeSet::new));
    }

    private static void prefixed(String prefix, Runnable check) {
        try {
            check.run();
        } catch (PaymentValidationException e) {
            throw new PaymentValidationException(prefix + e.getMessage(), e);
        }
    }
}
