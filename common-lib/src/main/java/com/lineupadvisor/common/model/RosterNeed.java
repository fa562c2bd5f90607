package com.lineupadvisor.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Current roster fill for one position during a draft.
 *
 * @param position  the position
 * @param have      players already drafted at the position
 * @param starters  starters the league requires
 * @param optimal   depth a well-built roster carries
 * @param maxUseful beyond this, additional picks add nothing
 * @param level     derived need level
 */
public record RosterNeed(
    @JsonProperty("position") Position position,
    @JsonProperty("have") int have,
    @JsonProperty("starters") int starters,
    @JsonProperty("optimal") int optimal,
    @JsonProperty("maxUseful") int maxUseful,
    @JsonProperty("level") NeedLevel level
) {
    public boolean isOpenStarter() {
        return have < starters;
    }
}
