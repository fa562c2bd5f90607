package com.lineupadvisor.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** One recently completed scoring period and the points actually scored in it. */
public record RecentGame(
    @JsonProperty("week") int week,
    @JsonProperty("points") double points
) {}
