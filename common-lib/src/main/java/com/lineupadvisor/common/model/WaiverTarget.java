package com.lineupadvisor.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One ranked free agent.
 *
 * @param player            the candidate's raw signals
 * @param tier              the candidate's tier this week
 * @param projection        adjusted projection in points
 * @param pointImprovement  starting-lineup points with the candidate minus without
 * @param upsideFactor      {@code min(ceiling / projection, 2)}, 1 without a projection
 * @param consistencyFactor {@code max(floor / projection, 0.5)}, 1 without a projection
 * @param impactScore       {@code pointImprovement × upsideFactor × consistencyFactor}
 * @param startingSlot      slot the candidate would start in, {@code null} if benched
 * @param replaces          current starter the candidate would push out, {@code null} if none
 * @param rank              1-based position in the returned list
 * @param reasoning         short explanation
 */
public record WaiverTarget(
    @JsonProperty("player") PlayerSignals player,
    @JsonProperty("tier") Tier tier,
    @JsonProperty("projection") double projection,
    @JsonProperty("pointImprovement") double pointImprovement,
    @JsonProperty("upsideFactor") double upsideFactor,
    @JsonProperty("consistencyFactor") double consistencyFactor,
    @JsonProperty("impactScore") double impactScore,
    @JsonProperty("startingSlot") String startingSlot,
    @JsonProperty("replaces") String replaces,
    @JsonProperty("rank") int rank,
    @JsonProperty("reasoning") String reasoning
) {
    public WaiverTarget withRank(int newRank) {
        return new WaiverTarget(player, tier, projection, pointImprovement, upsideFactor, consistencyFactor,
            impactScore, startingSlot, replaces, newRank, reasoning);
    }
}
