package com.github.dimitryivaniuta.gateway.admission.web;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Propagates a correlation id and exposes the idempotency key to every log line of the request.
 *
 * <p>Header: {@code X-Correlation-Id}. If missing, a new UUID is generated and echoed back.</p>
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    /** Header name for correlation id. */
    public static final String CORRELATION_ID_HEADER = "X-Correlation-Id";

    /** MDC key for the correlation id. */
    public static final String MDC_CORRELATION_ID = "correlationId";

    /** MDC key for the idempotency key, present on payment creation requests. */
    public static final String MDC_IDEMPOTENCY_KEY = "idempotencyKey";

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String correlationId = Optional.ofNullable(request.getHeader(CORRELATION_ID_HEADER))
                .filter(v -> !v.isBlank())
                .orElseGet(() -> UUID.randomUUID().toString());

        MDC.put(MDC_CORRELATION_ID, correlationId);
        String idempotencyKey = request.getHeader(PaymentsController.IDEMPOTENCY_KEY_HEADER);
        if (idempotencyKey != null) {
            MDC.put(MDC_IDEMPOTENCY_KEY, idempotencyKey);
        }
        response.setHeader(CORRELATION_ID_HEADER, correlationId);

        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(MDC_CORRELATION_ID);
            MDC.remove(MDC_IDEMPOTENCY_KEY);
        }
    }
}
