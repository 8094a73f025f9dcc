package io.kvcache.store;

import io.kvcache.exception.BackendException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPoolConfig;
import redis.clients.jedis.Transaction;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Redis storage backend with native TTL support.
 * Uses connection pooling for efficient resource management.
 * Keys are written as given, so counters and histories stay readable by other Redis clients.
 */
public final class RedisBackend implements StorageBackend {

    private static final Logger log = LoggerFactory.getLogger(RedisBackend.class);

    private final JedisPool pool;

    /**
     * Creates a Redis backend from a URI.
     *
     * @param uri the Redis URI (e.g., "redis://localhost:6379")
     */
    public RedisBackend(String uri) {
        try {
            JedisPoolConfig config = new JedisPoolConfig();
            config.setMaxTotal(10);
            config.setMaxIdle(5);
            config.setMinIdle(1);
            config.setTestOnBorrow(true);

            this.pool = new JedisPool(config, URI.create(uri));
        } catch (Exception e) {
            throw new BackendException("Failed to connect to Redis: " + uri, e);
        }
        log.debug("Opened Redis pool for {}", uri);
    }

    /**
     * Creates a Redis backend with an existing JedisPool.
     *
     * @param pool the JedisPool
     */
    public RedisBackend(JedisPool pool) {
        this.pool = pool;
    }

    @Override
    public void set(String key, byte[] value) {
        try (Jedis jedis = pool.getResource()) {
            jedis.set(bytes(key), value);
        } catch (Exception e) {
            throw new BackendException("Redis SET failed for key: " + key, e);
        }
    }

    @Override
    public void set(String key, byte[] value, Duration ttl) {
        try (Jedis jedis = pool.getResource()) {
            long millis = ttl.toMillis();
            if (millis <= 0) {
                millis = 1; // Redis rejects non-positive expiry
            }
            jedis.psetex(bytes(key), millis, value);
        } catch (Exception e) {
            throw new BackendException("Redis PSETEX failed for key: " + key, e);
        }
    }

    @Override
    public Optional<byte[]> get(String key) {
        try (Jedis jedis = pool.getResource()) {
            return Optional.ofNullable(jedis.get(bytes(key)));
        } catch (Exception e) {
            throw new BackendException("Redis GET failed for key: " + key, e);
        }
    }

    @Override
    public long increment(String key) {
        try (Jedis jedis = pool.getResource()) {
            return jedis.incr(key);
        } catch (Exception e) {
            throw new BackendException("Redis INCR failed for key: " + key, e);
        }
    }

    @Override
    public long append(String key, String value) {
        try (Jedis jedis = pool.getResource()) {
            return jedis.rpush(key, value);
        } catch (Exception e) {
            throw new BackendException("Redis RPUSH failed for key: " + key, e);
        }
    }

    @Override
    public void appendPair(String firstKey, String firstValue, String secondKey, String secondValue) {
        try (Jedis jedis = pool.getResource(); Transaction transaction = jedis.multi()) {
            transaction.rpush(firstKey, firstValue);
            transaction.rpush(secondKey, secondValue);
            transaction.exec();
        } catch (Exception e) {
            throw new BackendException("Redis MULTI/RPUSH failed for keys: " + firstKey + ", " + secondKey, e);
        }
    }

    @Override
    public List<String> range(String key, long start, long end) {
        try (Jedis jedis = pool.getResource()) {
            return jedis.lrange(key, start, end);
        } catch (Exception e) {
            throw new BackendException("Redis LRANGE failed for key: " + key, e);
        }
    }

    @Override
    public boolean delete(String key) {
        try (Jedis jedis = pool.getResource()) {
            return jedis.del(key) > 0;
        } catch (Exception e) {
            throw new BackendException("Redis DEL failed for key: " + key, e);
        }
    }

    @Override
    public boolean exists(String key) {
        try (Jedis jedis = pool.getResource()) {
            return jedis.exists(key);
        } catch (Exception e) {
            throw new BackendException("Redis EXISTS failed for key: " + key, e);
        }
    }

    @Override
    public Optional<Duration> ttl(String key) {
        try (Jedis jedis = pool.getResource()) {
            long millis = jedis.pttl(key);
            if (millis < 0) {
                return Optional.empty(); // Key doesn't exist or has no TTL
            }
            return Optional.of(Duration.ofMillis(millis));
        } catch (Exception e) {
            throw new BackendException("Redis PTTL failed for key: " + key, e);
        }
    }

    @Override
    public void flush() {
        try (Jedis jedis = pool.getResource()) {
            jedis.flushDB();
        } catch (Exception e) {
            throw new BackendException("Redis FLUSHDB failed", e);
        }
        log.info("Flushed Redis database");
    }

    @Override
    public String getBackendName() {
        return "redis";
    }

    @Override
    public void close() {
        if (pool != null && !pool.isClosed()) {
            pool.close();
            log.debug("Closed Redis pool");
        }
    }

    /**
     * Checks if the Redis connection is healthy.
     *
     * @return true if the connection is healthy
     */
    public boolean isHealthy() {
        try (Jedis jedis = pool.getResource()) {
            return "PONG".equals(jedis.ping());
        } catch (Exception e) {
            log.debug("Redis health check failed", e);
            return false;
        }
    }

    private static byte[] bytes(String key) {
        return key.getBytes(StandardCharsets.UTF_8);
    }
}
