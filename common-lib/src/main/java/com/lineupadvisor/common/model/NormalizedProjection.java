package com.lineupadvisor.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Output of {@code SignalNormalizer} for one player's provider projections.
 *
 * <p>{@code known = false} means every provider was missing. In that case
 * {@code providerAverage} is {@code null}: it is "unknown", never zero, and callers
 * substitute the position's replacement baseline.
 *
 * @param perProvider     provider name → position-scaled value on 0..100
 * @param providerAverage mean of the present providers in raw points, {@code null} when unknown
 * @param providerCount   number of providers that contributed
 * @param known           whether at least one provider contributed
 */
public record NormalizedProjection(
    @JsonProperty("perProvider") Map<String, Double> perProvider,
    @JsonProperty("providerAverage") Double providerAverage,
    @JsonProperty("providerCount") int providerCount,
    @JsonProperty("known") boolean known
) {
    public static NormalizedProjection unknown() {
        return new NormalizedProjection(Map.of(), null, 0, false);
    }

    /** Provider average, or the supplied replacement value when unknown. */
    public double averageOr(double replacement) {
        return known ? providerAverage : replacement;
    }
}
