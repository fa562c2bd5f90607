package com.lineupadvisor.advisor.provider;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory cache of provider responses keyed by request signature.
 *
 * <p>Thread-safe via {@link ConcurrentHashMap}. Lookups are synchronous and non-blocking so they
 * compose inside reactive chains. Expired entries are evicted on read. When the entry limit is
 * reached, expired entries are purged first and, failing that, the oldest entry is dropped.
 */
public class ResponseCache {

    private static final Logger log = LoggerFactory.getLogger(ResponseCache.class);

    private final ConcurrentHashMap<String, CachedResponse> store = new ConcurrentHashMap<>();
    private final Clock clock;
    private final int maxEntries;

    public ResponseCache(Clock clock, int maxEntries) {
        if (maxEntries < 1) {
            throw new IllegalArgumentException("maxEntries must be positive, got " + maxEntries);
        }
        this.clock = clock;
        this.maxEntries = maxEntries;
    }

    /**
     * Returns the live entry for {@code key}, or {@code null} if absent or expired.
     */
    public CachedResponse get(String key) {
        CachedResponse entry = store.get(key);
        if (entry == null) {
            return null;
        }
        if (entry.isExpired(clock.instant())) {
            store.remove(key, entry);
            log.debug("CACHE_EXPIRED key={} fetchedAt={}", key, entry.fetchedAt());
            return null;
        }
        return entry;
    }

    public void put(String key, Map<String, ProviderPayload> data, Duration ttl) {
        if (store.size() >= maxEntries && !store.containsKey(key)) {
            evict();
        }
        store.put(key, new CachedResponse(Map.copyOf(data), clock.instant(), ttl));
        log.info("CACHE_REFRESH key={} entries={} ttlSeconds={}", key, data.size(), ttl.toSeconds());
    }

    public int size() {
        return store.size();
    }

    public void clear() {
        store.clear();
    }

    private void evict() {
        Instant now = clock.instant();
        store.entrySet().removeIf(e -> e.getValue().isExpired(now));
        if (store.size() < maxEntries) {
            return;
        }
        store.entrySet().stream()
            .min(Map.Entry.comparingByValue((a, b) -> a.fetchedAt().compareTo(b.fetchedAt())))
            .ifPresent(oldest -> {
                store.remove(oldest.getKey(), oldest.getValue());
                log.debug("CACHE_EVICT key={} fetchedAt={}", oldest.getKey(), oldest.getValue().fetchedAt());
            });
    }
}
