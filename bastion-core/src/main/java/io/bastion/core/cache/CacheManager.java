package io.bastion.core.cache;

import io.bastion.api.cache.SharedCacheBackend;
import io.bastion.core.breaker.CircuitBreaker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Two-tier response cache.
 * <p>
 * The shared tier is the source of truth. The process-local tier only saves the hop to
 * the shared tier for hot keys; a local entry never outlives its shared counterpart
 * because its TTL is the smaller of the shared TTL and {@code localTtlCap}.
 * <p>
 * Shared-tier failures are logged and count against the {@code cache-backend} circuit
 * breaker. While that breaker is open the shared tier is skipped entirely. No method of
 * this class throws on a cache failure; reads degrade to a miss, writes report false.
 */
public class CacheManager {

    private static final Logger log = LoggerFactory.getLogger(CacheManager.class);

    private final SharedCacheBackend shared;
    private final CircuitBreaker breaker;
    private final Duration localTtlCap;
    private final Clock clock;

    private final Map<String, LocalEntry> local = new HashMap<>();

    public CacheManager(SharedCacheBackend shared, CircuitBreaker breaker, Duration localTtlCap, Clock clock) {
        this.shared = shared;
        this.breaker = breaker;
        this.localTtlCap = localTtlCap;
        this.clock = clock;
    }

    public Optional<String> get(String key) {
        Optional<String> hit = getLocal(key);
        if (hit.isPresent()) {
            return hit;
        }
        if (!breaker.allowRequest()) {
            return Optional.empty();
        }

        try {
            Optional<String> value = shared.get(key);
            if (value.isPresent()) {
                Duration remaining = shared.ttl(key).orElse(localTtlCap);
                putLocal(key, value.get(), remaining);
            }
            breaker.recordSuccess();
            return value;
        } catch (RuntimeException e) {
            breaker.recordFailure();
            log.warn("Shared cache read failed for key '{}': {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Store a value in both tiers. The shared tier is written first; the local tier is
     * written only if that succeeded.
     *
     * @return true if the shared tier accepted the value
     */
    public boolean set(String key, String value, Duration ttl) {
        if (!breaker.allowRequest()) {
            log.debug("Shared cache unavailable, not caching key '{}'", key);
            return false;
        }
        try {
            if (!shared.setex(key, ttl, value)) {
                return false;
            }
            breaker.recordSuccess();
        } catch (RuntimeException e) {
            breaker.recordFailure();
            log.warn("Shared cache write failed for key '{}': {}", key, e.getMessage());
            return false;
        }
        putLocal(key, value, ttl);
        return true;
    }

    public boolean delete(String key) {
        synchronized (local) {
            local.remove(key);
        }
        if (!breaker.allowRequest()) {
            return false;
        }
        try {
            shared.delete(key);
            breaker.recordSuccess();
            return true;
        } catch (RuntimeException e) {
            breaker.recordFailure();
            log.warn("Shared cache delete failed for key '{}': {}", key, e.getMessage());
            return false;
        }
    }

    /**
     * Remove every key starting with {@code prefix} from both tiers.
     *
     * @return number of keys removed from the shared tier
     */
    public long invalidatePattern(String prefix) {
        int localRemoved;
        synchronized (local) {
            int before = local.size();
            local.keySet().removeIf(k -> k.startsWith(prefix));
            localRemoved = before - local.size();
        }

        long sharedRemoved = 0;
        if (breaker.allowRequest()) {
            try {
                List<String> keys = shared.keys(escapeGlob(prefix) + "*");
                if (!keys.isEmpty()) {
                    sharedRemoved = shared.delete(keys.toArray(new String[0]));
                }
                breaker.recordSuccess();
            } catch (RuntimeException e) {
                breaker.recordFailure();
                log.warn("Shared cache invalidation failed for prefix '{}': {}", prefix, e.getMessage());
            }
        }
        log.debug("Invalidated prefix '{}': {} local, {} shared", prefix, localRemoved, sharedRemoved);
        return sharedRemoved;
    }

    /**
     * Drop expired local entries.
     *
     * @return number of entries dropped
     */
    public int purgeExpired() {
        Instant now = clock.instant();
        int removed = 0;
        synchronized (local) {
            Iterator<LocalEntry> it = local.values().iterator();
            while (it.hasNext()) {
                if (it.next().isExpired(now)) {
                    it.remove();
                    removed++;
                }
            }
        }
        return removed;
    }

    public int localSize() {
        synchronized (local) {
            return local.size();
        }
    }

    private Optional<String> getLocal(String key) {
        Instant now = clock.instant();
        synchronized (local) {
            LocalEntry entry = local.get(key);
            if (entry == null) {
                return Optional.empty();
            }
            if (entry.isExpired(now)) {
                local.remove(key);
                return Optional.empty();
            }
            return Optional.of(entry.value());
        }
    }

    private void putLocal(String key, String value, Duration sharedTtl) {
        Duration ttl = sharedTtl.compareTo(localTtlCap) < 0 ? sharedTtl : localTtlCap;
        if (ttl.isNegative() || ttl.isZero()) {
            return;
        }
        Instant expiresAt = clock.instant().plus(ttl);
        synchronized (local) {
            local.put(key, new LocalEntry(value, expiresAt));
        }
    }

    static String escapeGlob(String literal) {
        StringBuilder escaped = new StringBuilder(literal.length());
        for (char c : literal.toCharArray()) {
            if (c == '*' || c == '?' || c == '[' || c == ']' || c == '\\') {
                escaped.append('\\');
            }
            escaped.append(c);
        }
        return escaped.toString();
    }

    private record LocalEntry(String value, Instant expiresAt) {

        boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }
}
