package io.bastion.core.cache;

import io.bastion.api.cache.SharedCacheBackend;
import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisURI;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.sync.RedisCommands;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Shared tier backed by a Redis server through Lettuce.
 * <p>
 * The connection is opened on first use so a runtime can start while Redis is down;
 * until it comes up every call throws and the cache degrades to a miss.
 */
public class LettuceSharedCache implements SharedCacheBackend {

    private static final Logger log = LoggerFactory.getLogger(LettuceSharedCache.class);

    private final RedisURI redisUri;
    private RedisClient client;
    private StatefulRedisConnection<String, String> connection;

    public LettuceSharedCache(String uri, Duration commandTimeout) {
        this.redisUri = RedisURI.create(uri);
        this.redisUri.setTimeout(commandTimeout);
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(commands().get(key));
    }

    @Override
    public Optional<Duration> ttl(String key) {
        Long millis = commands().pttl(key);
        // -2 means no such key, -1 means no expiry
        if (millis == null || millis < 0) {
            return Optional.empty();
        }
        return Optional.of(Duration.ofMillis(millis));
    }

    @Override
    public boolean setex(String key, Duration ttl, String value) {
        return "OK".equals(commands().psetex(key, ttl.toMillis(), value));
    }

    @Override
    public long delete(String... keys) {
        if (keys.length == 0) {
            return 0;
        }
        Long removed = commands().del(keys);
        return removed == null ? 0 : removed;
    }

    @Override
    public List<String> keys(String pattern) {
        return commands().keys(pattern);
    }

    @Override
    public boolean ping() {
        try {
            return "PONG".equalsIgnoreCase(commands().ping());
        } catch (RuntimeException e) {
            log.debug("Redis ping failed: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public synchronized void close() {
        if (connection != null) {
            connection.close();
            connection = null;
        }
        if (client != null) {
            client.shutdown();
            client = null;
        }
        log.info("Redis shared cache closed");
    }

    private synchronized RedisCommands<String, String> commands() {
        if (connection == null || !connection.isOpen()) {
            if (client == null) {
                client = RedisClient.create(redisUri);
            }
            connection = client.connect();
            log.info("Connected to Redis at {}:{}", redisUri.getHost(), redisUri.getPort());
        }
        return connection.sync();
    }
}
