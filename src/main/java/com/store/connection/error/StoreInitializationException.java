package com.store.connection.error;

/**
 * Runtime exception thrown when the connection pool cannot be built or fails its
 * initial liveness probe.
 */
public class StoreInitializationException extends RuntimeException {

    public StoreInitializationException(String message) {
        super(message);
    }

    public StoreInitializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
