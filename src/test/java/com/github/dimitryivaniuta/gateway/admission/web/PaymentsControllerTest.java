package com.github.dimitryivaniuta.gateway.admission.web;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.gateway.admission.repo.PaymentStore;
import com.github.dimitryivaniuta.gateway.admission.web.dto.CreatePaymentRequest;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;

/**
 * End-to-end tests of the payments HTTP API over a real embedded server.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class PaymentsControllerTest {

    @LocalServerPort
    int port;

    @Autowired
    TestRestTemplate rest;

    @Autowired
    ObjectMapper objectMapper;

    @Autowired
    PaymentStore paymentStore;

    @Test
    void firstCallCreatesPayment_secondCallReplaysSameResponse() throws Exception {
        String key = "idem-" + UUID.randomUUID();
        CreatePaymentRequest req = new CreatePaymentRequest(1250L, "USD", "order-123", Map.of("user_id", "user-789"));

        ResponseEntity<String> r1 = postPayment(key, req);
        Assertions.assertEquals(201, r1.getStatusCode().value());
        Assertions.assertNull(r1.getHeaders().getFirst(PaymentsController.IDEMPOTENCY_REPLAYED_HEADER));

        ResponseEntity<String> r2 = postPayment(key, req);
        Assertions.assertEquals(201, r2.getStatusCode().value());
        Assertions.assertEquals("true", r2.getHeaders().getFirst(PaymentsController.IDEMPOTENCY_REPLAYED_HEADER));
        Assertions.assertEquals(r1.getBody(), r2.getBody(), "Replay must return identical response body");

        JsonNode body = objectMapper.readTree(r1.getBody());
        String paymentId = body.get("paymentId").asText();
        Assertions.assertEquals("/api/payments/" + paymentId, r1.getHeaders().getLocation().toString());
        Assertions.assertEquals("PENDING", body.get("status").asText());
        Assertions.assertEquals("Payment initiated", body.get("message").asText());
        Assertions.assertEquals(1250L, body.get("amountMinor").asLong());
        Assertions.assertEquals("user-789", body.get("metadata").get("user_id").asText());
        Assertions.assertEquals(paymentId, paymentStore.findByIdempotencyKey(key).orElseThrow().getId());
    }

    @Test
    void getReturnsStoredPayment() throws Exception {
        String key = "idem-" + UUID.randomUUID();
        ResponseEntity<String> created = postPayment(key, new CreatePaymentRequest(99L, "eur", "order-9", null));
        String paymentId = objectMapper.readTree(created.getBody()).get("paymentId").asText();

        ResponseEntity<String> fetched = rest.getForEntity(url("/api/payments/" + paymentId), String.class);

        Assertions.assertEquals(200, fetched.getStatusCode().value());
        JsonNode body = objectMapper.readTree(fetched.getBody());
        Assertions.assertEquals(paymentId, body.get("paymentId").asText());
        Assertions.assertEquals("EUR", body.get("currency").asText());
        Assertions.assertEquals("order-9", body.get("orderId").asText());
        Assertions.assertEquals(key, body.get("idempotencyKey").asText());
        Assertions.assertTrue(body.get("metadata").isEmpty());
        Assertions.assertEquals(objectMapper.readTree(created.getBody()), body);
    }

    @Test
    void unknownPaymentIsNotFound() throws Exception {
        ResponseEntity<String> r = rest.getForEntity(url("/api/payments/nonexistent-id"), String.class);

        Assertions.assertEquals(404, r.getStatusCode().value());
        Assertions.assertEquals("NOT_FOUND", objectMapper.readTree(r.getBody()).get("code").asText());
    }

    @Test
    void validationFailuresAreBadRequests() throws Exception {
        ResponseEntity<String> badCurrency = postPayment("idem-" + UUID.randomUUID(),
                new CreatePaymentRequest(100L, "XYZ", "order-1", null));
        Assertions.assertEquals(400, badCurrency.getStatusCode().value());
        JsonNode body = objectMapper.readTree(badCurrency.getBody());
        Assertions.assertEquals("VALIDATION_ERROR", body.get("code").asText());
        Assertions.assertTrue(body.get("message").asText().startsWith("Invalid currency"));

        ResponseEntity<String> shortKey = postPayment("short", new CreatePaymentRequest(100L, "USD", "order-1", null));
        Assertions.assertEquals(400, shortKey.getStatusCode().value());

        ResponseEntity<String> missingKey = postPayment(null, new CreatePaymentRequest(100L, "USD", "order-1", null));
        Assertions.assertEquals(400, missingKey.getStatusCode().value());

        ResponseEntity<String> negativeAmount = postPayment("idem-" + UUID.randomUUID(),
                new CreatePaymentRequest(-1L, "USD", "order-1", null));
        Assertions.assertEquals(400, negativeAmount.getStatusCode().value());
        Assertions.assertEquals("VALIDATION_ERROR", objectMapper.readTree(negativeAmount.getBody()).get("code").asText());
    }

    @Test
    void fractionalAmountIsRejectedNotTruncated() throws Exception {
        String key = "idem-" + UUID.randomUUID();
        ResponseEntity<String> r = postRaw(key, "{\"amountMinor\":12.99,\"currency\":\"USD\",\"orderId\":\"o-1\"}");

        Assertions.assertEquals(400, r.getStatusCode().value());
        Assertions.assertEquals("VALIDATION_ERROR", objectMapper.readTree(r.getBody()).get("code").asText());
        Assertions.assertTrue(paymentStore.findByIdempotencyKey(key).isEmpty());
    }

    @Test
    void stringAmountIsRejected() throws Exception {
        String key = "idem-" + UUID.randomUUID();
        ResponseEntity<String> r = postRaw(key, "{\"amountMinor\":\"1250\",\"currency\":\"USD\",\"orderId\":\"o-1\"}");

        Assertions.assertEquals(400, r.getStatusCode().value());
        Assertions.assertEquals("VALIDATION_ERROR", objectMapper.readTree(r.getBody()).get("code").asText());
        Assertions.assertTrue(paymentStore.findByIdempotencyKey(key).isEmpty());
    }

    @Test
    void orderIdRulesReportTheOrderIdPrefix() throws Exception {
        ResponseEntity<String> empty = postPayment("idem-" + UUID.randomUUID(), new CreatePaymentRequest(100L, "USD", "", null));
        Assertions.assertEquals(400, empty.getStatusCode().value());
        Assertions.assertEquals("Invalid order ID: Order ID cannot be empty",
                objectMapper.readTree(empty.getBody()).get("message").asText());

        ResponseEntity<String> missing = postRaw("idem-" + UUID.randomUUID(), "{\"amountMinor\":100,\"currency\":\"USD\"}");
        Assertions.assertEquals(400, missing.getStatusCode().value());
        Assertions.assertEquals("Invalid order ID: Order ID is required",
                objectMapper.readTree(missing.getBody()).get("message").asText());

        ResponseEntity<String> missingCurrency = postRaw("idem-" + UUID.randomUUID(), "{\"amountMinor\":100,\"orderId\":\"o-1\"}");
        Assertions.assertEquals(400, missingCurrency.getStatusCode().value());
        Assertions.assertEquals("Invalid currency: Currency code cannot be empty",
                objectMapper.readTree(missingCurrency.getBody()).get("message").asText());
    }

    @Test
    void whitespaceOrderIdIsOpaqueAndAdmitted() throws Exception {
        ResponseEntity<String> r = postPayment("idem-" + UUID.randomUUID(), new CreatePaymentRequest(100L, "USD", "   ", null));

        Assertions.assertEquals(201, r.getStatusCode().value());
        Assertions.assertEquals("   ", objectMapper.readTree(r.getBody()).get("orderId").asText());
    }

    @Test
    void unacceptableMediaTypeIsNotAServerError() {
        HttpHeaders h = new HttpHeaders();
        h.setAccept(List.of(MediaType.APPLICATION_XML));
        ResponseEntity<String> r = rest.exchange(url("/api/payments/any-id"), HttpMethod.GET, new HttpEntity<>(h), String.class);

        Assertions.assertEquals(406, r.getStatusCode().value());
    }

    @Test
    void malformedBodyIsBadRequest() {
        HttpHeaders h = headers("idem-" + UUID.randomUUID());
        ResponseEntity<String> r = rest.exchange(url("/api/payments"), HttpMethod.POST,
                new HttpEntity<>("{not json", h), String.class);

        Assertions.assertEquals(400, r.getStatusCode().value());
    }

    @Test
    void concurrentDoubleSubmitCreatesSinglePayment_allReceiveSameResponse() throws Exception {
        int callers = 16;
        String key = "idem-" + UUID.randomUUID();
        CreatePaymentRequest req = new CreatePaymentRequest(777L, "GBP", "order-dbl", Map.of());

        ExecutorService exec = Executors.newFixedThreadPool(callers);
        CountDownLatch ready = new CountDownLatch(callers);
        CountDownLatch go = new CountDownLatch(1);
        String[] bodies = new String[callers];
        int[] statuses = new int[callers];
        boolean[] replayed = new boolean[callers];

        for (int i = 0; i < callers; i++) {
            final int idx = i;
            exec.submit(() -> {
                ready.countDown();
                try {
                    go.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                ResponseEntity<String> resp = postPayment(key, req);
                statuses[idx] = resp.getStatusCode().value();
                bodies[idx] = resp.getBody();
                replayed[idx] = "true".equals(resp.getHeaders().getFirst(PaymentsController.IDEMPOTENCY_REPLAYED_HEADER));
            });
        }

        Assertions.assertTrue(ready.await(5, TimeUnit.SECONDS));
        go.countDown();
        exec.shutdown();
        Assertions.assertTrue(exec.awaitTermination(20, TimeUnit.SECONDS));

        int creators = 0;
        for (int i = 0; i < callers; i++) {
            Assertions.assertEquals(201, statuses[i]);
            Assertions.assertEquals(bodies[0], bodies[i], "All callers must see the same response");
            if (!replayed[i]) {
                creators++;
            }
        }
        Assertions.assertEquals(1, creators, "Exactly one caller creates the payment");
    }

    @Test
    void correlationIdIsEchoed() {
        HttpHeaders h = new HttpHeaders();
        h.set(CorrelationIdFilter.CORRELATION_ID_HEADER, "corr-123");
        ResponseEntity<String> r = rest.exchange(url("/api/payments/nonexistent-id"), HttpMethod.GET,
                new HttpEntity<>(h), String.class);

        Assertions.assertEquals("corr-123", r.getHeaders().getFirst(CorrelationIdFilter.CORRELATION_ID_HEADER));
    }

    @Test
    void healthReportsPaymentStore() throws Exception {
        ResponseEntity<String> r = rest.getForEntity(url("/actuator/health"), String.class);

        Assertions.assertEquals(200, r.getStatusCode().value());
        JsonNode body = objectMapper.readTree(r.getBody());
        Assertions.assertEquals("UP", body.get("status").asText());
        Assertions.assertEquals("UP", body.get("components").get("paymentStore").get("status").asText());
    }

    private ResponseEntity<String> postPayment(String idempotencyKey, CreatePaymentRequest req) {
        return rest.exchange(url("/api/payments"), HttpMethod.POST, new HttpEntity<>(req, headers(idempotencyKey)), String.class);
    }

    private ResponseEntity<String> postRaw(String idempotencyKey, String json) {
        return rest.exchange(url("/api/payments"), HttpMethod.POST, new HttpEntity<>(json, headers(idempotencyKey)), String.class);
    }

    private HttpHeaders headers(String idempotencyKey) {
        HttpHeaders h = new HttpHeaders();
        h.setContentType(MediaType.APPLICATION_JSON);
        if (idempotencyKey != null) {
            h.set(PaymentsController.IDEMPOTENCY_KEY_HEADER, idempotencyKey);
        }
        h.set(CorrelationIdFilter.CORRELATION_ID_HEADER, "test-" + UUID.randomUUID());
        return h;
    }

    private String url(String path) {
        return "http://localhost:" + port + path;
    }
}
