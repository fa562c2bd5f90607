package com.lineupadvisor.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Free agents ranked by how much they would lift this week's starting lineup.
 *
 * @param strategy      profile name used
 * @param currentPoints projected points of the current roster's best lineup
 * @param targets       ranked candidates, capped at the requested count
 * @param warnings      non-fatal problems
 */
public record WaiverRanking(
    @JsonProperty("strategy") String strategy,
    @JsonProperty("currentPoints") double currentPoints,
    @JsonProperty("targets") List<WaiverTarget> targets,
    @JsonProperty("warnings") List<String> warnings
) {
    public WaiverRanking {
        targets = List.copyOf(targets);
        warnings = List.copyOf(warnings);
    }
}
