package com.github.dimitryivaniuta.gateway.admission.config;

import com.github.dimitryivaniuta.gateway.admission.domain.PayloadMismatchPolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Application-level configuration properties.
 */
@ConfigurationProperties(prefix = "app")
@Validated
@Getter
@Setter
public class AppProperties {

    @Valid
    private final Idempotency idempotency = new Idempotency();

    @Valid
    private final Validation validation = new Validation();

    @Getter
    @Setter
    public static class Idempotency {
        /**
         * Minimum accepted idempotency key length.
         */
        @Min(1)
        private int minKeyLength = 8;

        /**
         * Maximum accepted idempotency key length.
         */
        @Min(1)
        private int maxKeyLength = 128;

        /**
         * Behavior when a known key is replayed with a different payload.
         */
        @NotNull
        private PayloadMismatchPolicy payloadMismatchPolicy = PayloadMismatchPolicy.RETURN_ORIGINAL;

        @AssertTrue(message = "min-key-length must not exceed max-key-length")
        public boolean isKeyLengthRangeValid() {
            return minKeyLength <= maxKeyLength;
        }
    }

    @Getter
    @Setter
    public static class Validation {
        /**
         * ISO 4217 codes accepted by the validator (compared case-insensitively).
         */
        @NotEmpty
        private Set<String> allowedCurrencies = new LinkedHashSet<>(List.of("USD", "EUR", "GBP", "JPY", "CAD", "AUD"));
    }
}
