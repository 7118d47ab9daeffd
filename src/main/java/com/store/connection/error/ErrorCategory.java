package com.store.connection.error;

/**
 * How the connection manager treats a failure raised by a store operation.
 */
public enum ErrorCategory {

    /**
     * The store is unreachable, slow or temporarily unable to serve: retried,
     * counted toward the circuit breaker, then answered by the fallback.
     */
    TRANSIENT,

    /**
     * The request itself is wrong (auth, malformed command, programming error):
     * never retried and propagated to the caller unchanged.
     */
    NON_TRANSIENT
}
