package com.github.dimitryivaniuta.gateway.admission.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Services injected into the admission core.
 */
@Configuration
public class AdmissionConfig {

    /**
     * Wall clock used to stamp {@code createdAt}. Tests replace it with a fixed clock.
     *
     * @return UTC system clock
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
