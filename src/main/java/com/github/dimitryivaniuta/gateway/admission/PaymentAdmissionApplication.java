package com.github.dimitryivaniuta.gateway.admission;

import com.github.dimitryivaniuta.gateway.admission.config.AppProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Application entry point for the idempotent payment admission service.
 */
@SpringBootApplication
@EnableConfigurationProperties(AppProperties.class)
public class PaymentAdmissionApplication {

    /**
     * Bootstraps the Spring Boot application.
     *
     * @param args CLI args
     */
    public static void main(String[] args) {
        SpringApplication.run(PaymentAdmissionApplication.class, args);
    }
}
