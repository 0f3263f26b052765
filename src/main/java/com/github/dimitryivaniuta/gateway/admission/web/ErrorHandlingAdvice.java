package com.github.dimitryivaniuta.gateway.admission.web;

import com.github.dimitryivaniuta.gateway.admission.service.exception.ErrorCode;
import com.github.dimitryivaniuta.gateway.admission.service.exception.PaymentAdmissionException;
import com.github.dimitryivaniuta.gateway.admission.web.dto.ErrorResponse;
import java.time.Instant;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponseException;
import org.springframework.web.HttpMediaTypeNotAcceptableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Global exception mapping for HTTP APIs. Every admission failure type gets its own code and status.
 */
@Slf4j
@RestControllerAdvice
public class ErrorHandlingAdvice {

    /**
     * Bean validation errors on the request body.
     *
     * @param ex exception
     * @return error response
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleInvalidBody(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(fe -> fe.getField() + " " + fe.getDefaultMessage())
                .sorted()
                .collect(Collectors.joining("; "));
        return error(HttpStatus.BAD_REQUEST, ErrorCode.VALIDATION_ERROR.name(), message);
    }

    /**
     * Malformed or missing JSON body.
     *
     * @param ex exception
     * @return error response
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
        return error(HttpStatus.BAD_REQUEST, ErrorCode.VALIDATION_ERROR.name(), "Malformed request body");
    }

    /**
     * Admission failures.
     *
     * @param ex exception
     * @return error response
     */
    @ExceptionHandler(PaymentAdmissionException.class)
    public ResponseEntity<ErrorResponse> handleAdmissionFailure(PaymentAdmissionException ex) {
        HttpStatus status = statusOf(ex.getErrorCode());
        if (status.is5xxServerError()) {
            log.error("Payment request failed. code={}", ex.getErrorCode(), ex);
        } else {
            log.info("Payment request rejected. code={} message={}", ex.getErrorCode(), ex.getMessage());
        }
        return error(status, ex.getErrorCode().name(), ex.getMessage());
    }

    /**
     * Framework-level HTTP errors: unknown route, wrong method, unsupported or unacceptable media type,
     * missing required header.
     *
     * @param ex exception
     * @return error response
     */
    @ExceptionHandler({
            ErrorResponseException.class,
            NoResourceFoundException.class,
            HttpRequestMethodNotSupportedException.class,
            HttpMediaTypeNotSupportedException.class,
            HttpMediaTypeNotAcceptableException.class,
            MissingRequestHeaderException.class
    })
    public ResponseEntity<ErrorResponse> handleFrameworkError(Exception ex) {
        org.springframework.web.ErrorResponse er = (org.springframework.web.ErrorResponse) ex;
        return ResponseEntity.status(er.getStatusCode())
                .body(new ErrorResponse("REQUEST_ERROR", er.getBody().getDetail(), Instant.now()));
    }

    /**
     * Fallback.
     *
     * @param ex exception
     * @return error response
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleFallback(Exception ex) {
        log.error("Unhandled error", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", ex.getMessage());
    }

    private static HttpStatus statusOf(ErrorCode code) {
        switch (code) {
            case VALIDATION_ERROR:
                return HttpStatus.BAD_REQUEST;
            case NOT_FOUND:
                return HttpStatus.NOT_FOUND;
            case IDEMPOTENCY_CONFLICT:
                return HttpStatus.CONFLICT;
            default:
                return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }

    private static ResponseEntity<ErrorResponse> error(HttpStatus status, String code, String message) {
        return ResponseEntity.status(status).body(new ErrorResponse(code, message, Instant.now()));
    }
}
