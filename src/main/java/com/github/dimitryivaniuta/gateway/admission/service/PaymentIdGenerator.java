package com.github.dimitryivaniuta.gateway.admission.service;

/**
 * Source of payment identifiers. Implementations must never return the same value twice within a process.
 */
@FunctionalInterface
public interface PaymentIdGenerator {

    /**
     * Generates the next payment id.
     *
     * @return unique, non-blank id
     */
    String nextId();
}
