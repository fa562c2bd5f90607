package com.lineupadvisor.common.strategy;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Weights of the three draft rank-score components. Must sum to 1.0.
 */
public record DraftWeights(
    @JsonProperty("vor") double vor,
    @JsonProperty("scarcity") double scarcity,
    @JsonProperty("need") double need
) {
    public double sum() {
        return vor + scarcity + need;
    }

    public boolean anyNegative() {
        return vor < 0 || scarcity < 0 || need < 0;
    }
}
