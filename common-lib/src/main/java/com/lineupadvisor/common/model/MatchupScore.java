package com.lineupadvisor.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Bounded matchup favourability, 0..100 where higher favours the offensive player.
 *
 * @param score       transformed score; exactly 50 when {@code known} is false
 * @param known       false when no raw difficulty input was available
 * @param description short human-readable tier, e.g. "Great matchup vs DAL (#8/32)"
 */
public record MatchupScore(
    @JsonProperty("score") double score,
    @JsonProperty("known") boolean known,
    @JsonProperty("description") String description
) {
    public static final double NEUTRAL = 50.0;

    public static MatchupScore unknown() {
        return new MatchupScore(NEUTRAL, false, "Unknown matchup");
    }
}
