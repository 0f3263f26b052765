package com.github.dimitryivaniuta.gateway.admission.web;

import com.github.dimitryivaniuta.gateway.admission.domain.Payment;
import com.github.dimitryivaniuta.gateway.admission.service.PaymentAdmissionService;
import com.github.dimitryivaniuta.gateway.admission.service.PaymentRequestValidator;
import com.github.dimitryivaniuta.gateway.admission.service.dto.AdmissionResult;
import com.github.dimitryivaniuta.gateway.admission.service.dto.PaymentInput;
import com.github.dimitryivaniuta.gateway.admission.web.dto.CreatePaymentRequest;
import com.github.dimitryivaniuta.gateway.admission.web.dto.PaymentResponse;
import jakarta.validation.Valid;
import java.net.URI;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for payments.
 *
 * <p>A replayed request gets the same status and body as the request that created the payment, plus the
 * {@value #IDEMPOTENCY_REPLAYED_HEADER} header.</p>
 */
@RestController
@RequestMapping("/api/payments")
public class PaymentsController {

    /** Header used to provide an idempotency key. */
    public static final String IDEMPOTENCY_KEY_HEADER = "X-Idempotency-Key";

    /** Header returned when the response was replayed. */
    public static final String IDEMPOTENCY_REPLAYED_HEADER = "X-Idempotency-Replayed";

    private final PaymentAdmissionService admissionService;
    private final PaymentRequestValidator validator;

    /**
     * Creates the controller.
     *
     * @param admissionService admission service
     * @param validator request validator
     */
    public PaymentsController(PaymentAdmissionService admissionService, PaymentRequestValidator validator) {
        this.admissionService = admissionService;
        this.validator = validator;
    }

    /**
     * Requests a payment idempotently.
     *
     * @param idempotencyKey idempotency key (required, checked by the validator)
     * @param request request body
     * @return created (or replayed) payment
     */
    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<PaymentResponse> requestPayment(
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey,
            @Valid @RequestBody CreatePaymentRequest request
    ) {
        PaymentInput input = request.toInput(idempotencyKey);
        validator.validate(input);

        AdmissionResult result = admissionService.requestPayment(input);
        Payment payment = result.payment();

        HttpHeaders headers = new HttpHeaders();
        headers.set(IDEMPOTENCY_KEY_HEADER, payment.getIdempotencyKey());
        if (result.replayed()) {
            headers.set(IDEMPOTENCY_REPLAYED_HEADER, "true");
        }

        return ResponseEntity.created(URI.create("/api/payments/" + payment.getId()))
                .headers(headers)
                .body(PaymentResponse.from(payment));
    }

    /**
     * Fetches a payment by id.
     *
     * @param paymentId payment id
     * @return payment response
     */
    @GetMapping(value = "/{paymentId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<PaymentResponse> getPayment(@PathVariable String paymentId) {
        return ResponseEntity.ok(PaymentResponse.from(admissionService.getPayment(paymentId)));
    }
}
