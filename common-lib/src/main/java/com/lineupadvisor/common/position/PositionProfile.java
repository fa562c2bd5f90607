package com.lineupadvisor.common.position;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Configured constants for one position.
 *
 * @param baseline         replacement-level weekly points
 * @param normalizationMax weekly points that map to 100 on the normalized scale
 * @param scarcity         base scarcity multiplier for lineup flex value
 * @param draftScarcity    base scarcity used by the draft ranker
 * @param mean             typical weekly points of a fantasy-relevant starter
 * @param stdDev           spread of the same
 * @param tiers            fixed tier cut-offs
 * @param roster           draft roster requirements
 */
public record PositionProfile(
    @JsonProperty("baseline") double baseline,
    @JsonProperty("normalizationMax") double normalizationMax,
    @JsonProperty("scarcity") double scarcity,
    @JsonProperty("draftScarcity") double draftScarcity,
    @JsonProperty("mean") double mean,
    @JsonProperty("stdDev") double stdDev,
    @JsonProperty("tiers") TierThresholds tiers,
    @JsonProperty("roster") RosterRequirement roster
) {
}
