package com.store.connection.circuit;

/**
 * States of the {@link CircuitBreaker} guarding the backing store.
 */
public enum CircuitState {

    /**
     * Normal operation, calls reach the store.
     */
    CLOSED,

    /**
     * Failing fast, no calls reach the store.
     */
    OPEN,

    /**
     * Trial window after the recovery timeout; the next success closes the circuit.
     */
    HALF_OPEN
}
