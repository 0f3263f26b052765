package com.github.dimitryivaniuta.gateway.admission.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.gateway.admission.service.dto.PaymentInput;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Computes stable fingerprints of payment inputs, used to detect a reused idempotency key with a changed payload.
 *
 * <p>The fingerprint is Base64(SHA-256(canonical JSON)) of the {@linkplain PaymentInput#canonical() canonical}
 * input, so currency case and null-vs-empty metadata do not count as differences.</p>
 */
@Service
public class RequestHashService {

    private final ObjectMapper canonicalObjectMapper;

    /**
     * Creates the service.
     *
     * @param canonicalObjectMapper canonical mapper
     */
    public RequestHashService(@Qualifier("canonicalObjectMapper") ObjectMapper canonicalObjectMapper) {
        this.canonicalObjectMapper = canonicalObjectMapper;
    }

    /**
     * Fingerprints a payment input.
     *
     * @param input payment input
     * @return Base64-encoded SHA-256 hash
     */
    public String hash(PaymentInput input) {
        try {
            byte[] json = canonicalObjectMapper.writeValueAsBytes(input.canonical());
            return Base64.getEncoder().encodeToString(MessageDigest.getInstance("SHA-256").digest(json));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize payment input for hashing", e);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    /**
     * Produces the canonical JSON of an input, suitable for debug logging.
     *
     * @param input payment input
     * @return canonical json string
     */
    public String canonicalJson(PaymentInput input) {
        try {
            return canonicalObjectMapper.writeValueAsString(input.canonical());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize payment input", e);
        }
    }
}
