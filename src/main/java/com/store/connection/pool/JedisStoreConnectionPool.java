package com.store.connection.pool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.ConnectionPoolConfig;
import redis.clients.jedis.DefaultJedisClientConfig;
import redis.clients.jedis.HostAndPort;
import redis.clients.jedis.JedisClientConfig;
import redis.clients.jedis.JedisPooled;
import redis.clients.jedis.Protocol;
import redis.clients.jedis.UnifiedJedis;
import redis.clients.jedis.util.Pool;
import redis.clients.jedis.util.SafeEncoder;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Jedis-backed {@link StoreConnectionPool}.
 *
 * <p>Wraps a {@link JedisPooled} client, which borrows a connection from its internal
 * commons-pool2 pool per command and is therefore safe to share across threads.
 * The store address is a {@code redis://[user:password@]host[:port][/db]} URI;
 * {@code rediss://} enables TLS.</p>
 */
public class JedisStoreConnectionPool implements StoreConnectionPool<UnifiedJedis> {
    private static final Logger log = LoggerFactory.getLogger(JedisStoreConnectionPool.class);

    private static final int DEFAULT_PORT = 6379;

    private final JedisPooled client;
    private final int maxConnections;
    private final String address;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public JedisStoreConnectionPool(StoreConfig config) {
        URI uri = URI.create(config.getStoreAddress());
        HostAndPort hostAndPort = new HostAndPort(uri.getHost(), uri.getPort() > 0 ? uri.getPort() : DEFAULT_PORT);

        ConnectionPoolConfig poolConfig = new ConnectionPoolConfig();
        poolConfig.setMaxTotal(config.getMaxConnections());
        poolConfig.setMaxIdle(config.getMaxConnections());
        poolConfig.setMinIdle(0);
        poolConfig.setMaxWait(config.getConnectTimeout());
        poolConfig.setTestOnBorrow(false);
        poolConfig.setJmxEnabled(false);

        this.client = new JedisPooled(hostAndPort, clientConfig(uri, config), poolConfig);
        this.maxConnections = config.getMaxConnections();
        this.address = config.redactedAddress();
        log.info("Jedis connection pool created: address={} maxConnections={}", address, maxConnections);
    }

    @Override
    public UnifiedJedis client() {
        return client;
    }

    @Override
    public boolean ping() {
        Object reply = client.sendCommand(Protocol.Command.PING);
        String text = reply instanceof byte[] bytes ? SafeEncoder.encode(bytes) : String.valueOf(reply);
        return "PONG".equalsIgnoreCase(text);
    }

    @Override
    public PoolStats getStats() {
        Pool<?> pool = client.getPool();
        int active = pool.getNumActive();
        int idle = pool.getNumIdle();
        return new PoolStats(
                maxConnections,
                active + idle,
                active,
                idle,
                pool.getBorrowedCount(),
                pool.getReturnedCount(),
                pool.getCreatedCount()
        );
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            client.close();
            log.info("Jedis connection pool closed: address={}", address);
        }
    }

    static JedisClientConfig clientConfig(URI uri, StoreConfig config) {
        DefaultJedisClientConfig.Builder builder = DefaultJedisClientConfig.builder()
                .connectionTimeoutMillis((int) config.getConnectTimeout().toMillis())
                .socketTimeoutMillis((int) config.getSocketTimeout().toMillis())
                .database(databaseIndex(uri))
                .ssl("rediss".equalsIgnoreCase(uri.getScheme()));

        String userInfo = uri.getRawUserInfo();
        if (userInfo != null && !userInfo.isEmpty()) {
            int separator = userInfo.indexOf(':');
            if (separator < 0) {
                builder.password(decode(userInfo));
            } else {
                String user = userInfo.substring(0, separator);
                if (!user.isEmpty()) {
                    builder.user(decode(user));
                }
                builder.password(decode(userInfo.substring(separator + 1)));
            }
        }
        return builder.build();
    }

    static int databaseIndex(URI uri) {
        String path = uri.getPath();
        if (path == null || path.length() <= 1) {
            return Protocol.DEFAULT_DATABASE;
        }
        try {
            return Integer.parseInt(path.substring(1));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid database index in store address: " + path, e);
        }
    }

    private static String decode(String value) {
        return URLDecoder.decode(value, StandardCharsets.UTF_8);
    }
}
