package com.lineupadvisor.advisor.provider;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * One cached provider response with the time it was fetched and how long it stays valid.
 */
public record CachedResponse(
    Map<String, ProviderPayload> data,
    Instant fetchedAt,
    Duration ttl
) {
    public boolean isExpired(Instant now) {
        return !now.isBefore(fetchedAt.plus(ttl));
    }
}
