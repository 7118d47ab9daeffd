package com.store.connection.error;

import redis.clients.jedis.exceptions.JedisAccessControlException;
import redis.clients.jedis.exceptions.JedisBusyException;
import redis.clients.jedis.exceptions.JedisConnectionException;
import redis.clients.jedis.exceptions.JedisDataException;
import redis.clients.jedis.exceptions.JedisException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

/**
 * Maps exceptions raised by store operations to an {@link ErrorCategory}.
 *
 * <table>
 *   <caption>Default mapping</caption>
 *   <tr><th>Exception</th><th>Category</th></tr>
 *   <tr><td>{@link JedisConnectionException} (refused, reset, socket timeout)</td><td>TRANSIENT</td></tr>
 *   <tr><td>{@link JedisBusyException}, data errors replying LOADING / TRYAGAIN / MASTERDOWN / CLUSTERDOWN</td><td>TRANSIENT</td></tr>
 *   <tr><td>{@link JedisAccessControlException} (NOAUTH, WRONGPASS, NOPERM)</td><td>NON_TRANSIENT</td></tr>
 *   <tr><td>other {@link JedisDataException} (WRONGTYPE, syntax errors)</td><td>NON_TRANSIENT</td></tr>
 *   <tr><td>other {@link JedisException} (generic backend error, pool exhausted)</td><td>TRANSIENT</td></tr>
 *   <tr><td>I/O or timeout anywhere in the cause chain</td><td>TRANSIENT</td></tr>
 *   <tr><td>{@link StoreInitializationException}</td><td>TRANSIENT</td></tr>
 *   <tr><td>anything else</td><td>NON_TRANSIENT</td></tr>
 * </table>
 */
public class StoreErrorClassifier {

    private static final List<String> TRANSIENT_REPLY_PREFIXES =
            List.of("LOADING", "TRYAGAIN", "MASTERDOWN", "CLUSTERDOWN");

    public ErrorCategory classify(Throwable error) {
        if (error == null) {
            return ErrorCategory.NON_TRANSIENT;
        }
        if (error instanceof JedisConnectionException
                || error instanceof JedisBusyException
                || error instanceof StoreInitializationException) {
            return ErrorCategory.TRANSIENT;
        }
        if (error instanceof JedisAccessControlException) {
            return ErrorCategory.NON_TRANSIENT;
        }
        if (error instanceof JedisDataException) {
            return hasTransientReply(error.getMessage())
                    ? ErrorCategory.TRANSIENT : ErrorCategory.NON_TRANSIENT;
        }
        if (error instanceof JedisException) {
            return ErrorCategory.TRANSIENT;
        }
        return hasIoCause(error) ? ErrorCategory.TRANSIENT : ErrorCategory.NON_TRANSIENT;
    }

    public boolean isTransient(Throwable error) {
        return classify(error) == ErrorCategory.TRANSIENT;
    }

    private boolean hasTransientReply(String message) {
        if (message == null) {
            return false;
        }
        String reply = message.trim().toUpperCase(Locale.ROOT);
        for (String prefix : TRANSIENT_REPLY_PREFIXES) {
            if (reply.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    private boolean hasIoCause(Throwable error) {
        Throwable current = error;
        // bounded walk; cause chains can be cyclic
        for (int depth = 0; current != null && depth < 16; depth++) {
            if (current instanceof IOException
                    || current instanceof UncheckedIOException
                    || current instanceof TimeoutException) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }
}
