package com.lineupadvisor.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Outcome of one lineup assignment.
 *
 * @param strategy        profile name used
 * @param assignments     every non-bench slot in input order; empty ones have a {@code null} player
 * @param bench           all players not assigned to a starting slot, best first
 * @param totalValue      sum of starters' composite scores
 * @param recommendations human-readable start/sit advice
 * @param warnings        non-fatal problems (unfilled slots, bye starters, missing data)
 * @param dataQuality     signal coverage of the pool
 */
public record LineupResult(
    @JsonProperty("strategy") String strategy,
    @JsonProperty("assignments") List<SlotAssignment> assignments,
    @JsonProperty("bench") List<ScoredPlayer> bench,
    @JsonProperty("totalValue") double totalValue,
    @JsonProperty("recommendations") List<String> recommendations,
    @JsonProperty("warnings") List<String> warnings,
    @JsonProperty("dataQuality") DataQualitySummary dataQuality
) {
    public LineupResult {
        assignments = List.copyOf(assignments);
        bench = List.copyOf(bench);
        recommendations = List.copyOf(recommendations);
        warnings = List.copyOf(warnings);
    }

    public boolean hasEmptySlots() {
        return assignments.stream().anyMatch(SlotAssignment::isEmpty);
    }
}
