package com.store.connection.api;

/**
 * A unit of work against the backing store.
 *
 * <p>Implementations receive the shared client and either return a value or throw a
 * runtime exception. The manager classifies the exception: transient failures are
 * retried and answered by the fallback, anything else propagates to the caller.</p>
 *
 * @param <C> the store client type
 * @param <T> the result type
 */
@FunctionalInterface
public interface StoreOperation<C, T> {

    T execute(C client);
}
