package com.lineupadvisor.advisor.provider;

import com.lineupadvisor.common.model.PlayerSignals;
import com.lineupadvisor.common.model.ScoringPeriod;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Upstream source of player signals (projection sites, matchup tables, trending feeds).
 * Implementations own their network clients and credentials.
 */
public interface SignalProvider {

    /** Stable name; used as the projection key and for cache TTL lookup. */
    String name();

    /**
     * @return payloads keyed by {@link PlayerSignals#identityKey()}; players the provider does
     *         not know are simply absent
     */
    Mono<Map<String, ProviderPayload>> fetch(List<PlayerSignals> players, ScoringPeriod period);
}
