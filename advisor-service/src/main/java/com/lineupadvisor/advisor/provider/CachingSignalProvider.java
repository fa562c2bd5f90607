package com.lineupadvisor.advisor.provider;

import com.lineupadvisor.common.model.PlayerSignals;
import com.lineupadvisor.common.model.ScoringPeriod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Decorates a {@link SignalProvider} with the response cache and the outbound rate limit.
 *
 * <p><strong>Flow:</strong>
 * <ol>
 *   <li>Cache hit for the request signature → returned without calling the provider.</li>
 *   <li>Miss and the rate limiter refuses → {@link ProviderUnavailableException}; the caller
 *       degrades to the data it already has.</li>
 *   <li>Miss and allowed → delegate call, result cached with the provider's TTL.</li>
 * </ol>
 */
public class CachingSignalProvider implements SignalProvider {

    private static final Logger log = LoggerFactory.getLogger(CachingSignalProvider.class);

    private final SignalProvider delegate;
    private final ResponseCache cache;
    private final SlidingWindowRateLimiter limiter;
    private final Duration ttl;

    public CachingSignalProvider(SignalProvider delegate, ResponseCache cache,
                                 SlidingWindowRateLimiter limiter, Duration ttl) {
        this.delegate = delegate;
        this.cache = cache;
        this.limiter = limiter;
        this.ttl = ttl;
    }

    @Override
    public String name() {
        return delegate.name();
    }

    @Override
    public Mono<Map<String, ProviderPayload>> fetch(List<PlayerSignals> players, ScoringPeriod period) {
        String key = signature(name(), players, period);

        return Mono.defer(() -> {
            CachedResponse cached = cache.get(key);
            if (cached != null) {
                log.info("CACHE_HIT provider={} players={} fetchedAt={}", name(), players.size(), cached.fetchedAt());
                return Mono.just(cached.data());
            }
            if (!limiter.tryAcquire()) {
                return Mono.error(new ProviderUnavailableException(name(),
                    "rate limit reached, retry in " + limiter.retryAfter().toSeconds() + "s"));
            }
            log.info("CACHE_MISS provider={} players={}", name(), players.size());
            return delegate.fetch(players, period)
                .doOnNext(data -> cache.put(key, data, ttl));
        });
    }

    /** Provider, season, week and the sorted player identities. */
    static String signature(String provider, List<PlayerSignals> players, ScoringPeriod period) {
        String ids = players.stream()
            .map(PlayerSignals::identityKey)
            .sorted()
            .collect(Collectors.joining(","));
        return provider + ":" + period.season() + ":" + period.week() + ":"
            + UUID.nameUUIDFromBytes(ids.getBytes(StandardCharsets.UTF_8));
    }
}
