package com.lineupadvisor.common.strategy;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Weights applied to the four 0..100 signals when computing a player's blended score.
 * A valid set sums to 1.0 within {@link StrategyProfile#WEIGHT_TOLERANCE}; validation lives in
 * {@link StrategyProfile} so that the offending profile can be named.
 */
public record BlendWeights(
    @JsonProperty("projection") double projection,
    @JsonProperty("matchup") double matchup,
    @JsonProperty("trending") double trending,
    @JsonProperty("momentum") double momentum
) {
    public double sum() {
        return projection + matchup + trending + momentum;
    }

    public boolean anyNegative() {
        return projection < 0 || matchup < 0 || trending < 0 || momentum < 0;
    }
}
