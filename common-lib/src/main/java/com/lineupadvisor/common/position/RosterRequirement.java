package com.lineupadvisor.common.position;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Draft roster targets for a position: starters required, optimal depth, and the count
 * beyond which another player adds nothing.
 */
public record RosterRequirement(
    @JsonProperty("starters") int starters,
    @JsonProperty("optimal") int optimal,
    @JsonProperty("maxUseful") int maxUseful
) {
    boolean isOrdered() {
        return starters >= 0 && starters <= optimal && optimal <= maxUseful;
    }
}
