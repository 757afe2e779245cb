package io.github.social.nostr.shard.datasource;

import java.time.Duration;

import io.github.social.nostr.shard.utilities.AppProperties;
import io.github.social.nostr.shard.utilities.LogService;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPoolConfig;

/**
 * Redis connection pool holding event bodies and subscription bookkeeping.
 */
public class CacheDS {
    private final LogService logger = LogService.getInstance(getClass().getCanonicalName());

    private boolean closed = false;

    private final JedisPool jedisPool;
    public CacheDS(final String host, final int port, final String secret) {
        final int timeout = 2000;
        final String password = secret == null || secret.isEmpty() ? null : secret;
        jedisPool = new JedisPool(buildPoolConfig(), host, port, timeout, password);

        logger.info("[Redis] Pool created for {}:{}", host, port);
    }

    public static CacheDS fromProperties() {
        return new CacheDS(
            AppProperties.getRedisHost(),
            AppProperties.getRedisPort(),
            AppProperties.getRedisSecret());
    }

    public Jedis connect() {
        return jedisPool.getResource();
    }

    public synchronized byte close() {
        if(this.closed) return 0;

        this.closed = true;
        this.jedisPool.close();

        return logger.info("[Redis] Pool closed.");
    }

    private static JedisPoolConfig buildPoolConfig() {
        final JedisPoolConfig poolConfig = new JedisPoolConfig();
        poolConfig.setMaxTotal(64);
        poolConfig.setMaxIdle(16);
        poolConfig.setMinIdle(2);
        poolConfig.setTestOnBorrow(true);
        poolConfig.setTestWhileIdle(true);
        poolConfig.setMinEvictableIdleTime(Duration.ofMillis(60000));
        poolConfig.setTimeBetweenEvictionRuns(Duration.ofMillis(30000));
        poolConfig.setNumTestsPerEvictionRun(3);
        poolConfig.setBlockWhenExhausted(true);
        poolConfig.setMaxWait(Duration.ofMillis(5000));
        return poolConfig;
    }

}
