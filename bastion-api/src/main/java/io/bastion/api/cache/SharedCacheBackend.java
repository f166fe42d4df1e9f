package io.bastion.api.cache;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * The shared (cross-process) cache tier. Implementations handle their own concurrency
 * and report failures by throwing; callers treat any failure as a cache miss.
 */
public interface SharedCacheBackend extends AutoCloseable {

    Optional<String> get(String key);

    /**
     * @return time left before {@code key} expires, or empty if the key is absent or has no expiry
     */
    Optional<Duration> ttl(String key);

    /**
     * Store {@code value} under {@code key}, expiring after {@code ttl}.
     *
     * @return true if the value was stored
     */
    boolean setex(String key, Duration ttl, String value);

    /**
     * @return number of keys removed
     */
    long delete(String... keys);

    /**
     * @param pattern glob-style pattern, e.g. {@code orders*}
     * @return keys matching the pattern
     */
    List<String> keys(String pattern);

    /**
     * @return true if the backend answered
     */
    boolean ping();

    @Override
    void close();
}
