package io.bastion.core.cache;

import io.bastion.api.cache.SharedCacheBackend;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Shared tier kept in this process. Used when no Redis server is configured, and in tests.
 */
public class InMemorySharedCache implements SharedCacheBackend {

    private final Clock clock;
    private final Map<String, Entry> entries = new ConcurrentHashMap<>();

    public InMemorySharedCache(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<String> get(String key) {
        return live(key).map(Entry::value);
    }

    @Override
    public Optional<Duration> ttl(String key) {
        Instant now = clock.instant();
        return live(key).map(e -> Duration.between(now, e.expiresAt()));
    }

    @Override
    public boolean setex(String key, Duration ttl, String value) {
        entries.put(key, new Entry(value, clock.instant().plus(ttl)));
        return true;
    }

    @Override
    public long delete(String... keys) {
        long removed = 0;
        for (String key : keys) {
            if (entries.remove(key) != null) {
                removed++;
            }
        }
        return removed;
    }

    @Override
    public List<String> keys(String pattern) {
        Pattern regex = globToRegex(pattern);
        Instant now = clock.instant();
        List<String> matches = new ArrayList<>();
        entries.forEach((key, entry) -> {
            if (now.isBefore(entry.expiresAt()) && regex.matcher(key).matches()) {
                matches.add(key);
            }
        });
        return matches;
    }

    @Override
    public boolean ping() {
        return true;
    }

    @Override
    public void close() {
        entries.clear();
    }

    private Optional<Entry> live(String key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (!clock.instant().isBefore(entry.expiresAt())) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry);
    }

    // supports the '*' and '?' wildcards; a backslash makes the next character literal
    private static Pattern globToRegex(String glob) {
        StringBuilder regex = new StringBuilder();
        StringBuilder literal = new StringBuilder();
        for (int i = 0; i < glob.length(); i++) {
            char c = glob.charAt(i);
            if (c == '\\' && i + 1 < glob.length()) {
                literal.append(glob.charAt(++i));
            } else if (c == '*' || c == '?') {
                if (literal.length() > 0) {
                    regex.append(Pattern.quote(literal.toString()));
                    literal.setLength(0);
                }
                regex.append(c == '*' ? ".*" : ".");
            } else {
                literal.append(c);
            }
        }
        if (literal.length() > 0) {
            regex.append(Pattern.quote(literal.toString()));
        }
        return Pattern.compile(regex.toString());
    }

    private record Entry(String value, Instant expiresAt) {}
}
