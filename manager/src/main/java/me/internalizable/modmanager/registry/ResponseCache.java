package me.internalizable.modmanager.registry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Time-bounded cache of registry response bodies.
 *
 * <p>Entries are keyed by endpoint plus sorted query parameters and are
 * immutable once written. Expiry is checked on read; there is no other
 * eviction.</p>
 */
public class ResponseCache {

    private static final Logger LOGGER = LoggerFactory.getLogger(ResponseCache.class);

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final Duration ttl;
    private final Clock clock;

    /**
     * Create a response cache.
     *
     * @param ttl time an entry stays valid
     * @param clock clock used to stamp and expire entries
     */
    public ResponseCache(@Nonnull Duration ttl, @Nonnull Clock clock) {
        this.ttl = Objects.requireNonNull(ttl, "ttl");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Build the cache key for a request.
     *
     * @param endpoint endpoint path
     * @param params query parameters, may be empty
     * @return cache key
     */
    @Nonnull
    public static String key(@Nonnull String endpoint, @Nonnull Map<String, String> params) {
        if (params.isEmpty()) {
            return endpoint;
        }
        return endpoint + "?" + new TreeMap<>(params).entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining("&"));
    }

    /**
     * Get a cached body if still valid.
     *
     * @param key cache key
     * @return the body, or null on miss or expiry
     */
    @Nullable
    public String get(@Nonnull String key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return null;
        }
        if (Duration.between(entry.storedAt(), clock.instant()).compareTo(ttl) >= 0) {
            return null;
        }
        LOGGER.debug("Cache hit for {}", key);
        return entry.body();
    }

    /**
     * Store a body, replacing any previous entry.
     *
     * @param key cache key
     * @param body response body
     */
    public void put(@Nonnull String key, @Nonnull String body) {
        entries.put(key, new Entry(clock.instant(), body));
    }

    /**
     * Drop every entry.
     */
    public void clear() {
        entries.clear();
        LOGGER.debug("Registry cache cleared");
    }

    public int size() {
        return entries.size();
    }

    private record Entry(Instant storedAt, String body) {}
}
