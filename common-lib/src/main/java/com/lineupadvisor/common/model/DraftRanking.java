package com.lineupadvisor.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Full draft recommendation: ranked candidates plus context.
 */
public record DraftRanking(
    @JsonProperty("strategy") String strategy,
    @JsonProperty("position") DraftPosition position,
    @JsonProperty("phase") String phase,
    @JsonProperty("entries") List<DraftRankingEntry> entries,
    @JsonProperty("needs") List<RosterNeed> needs,
    @JsonProperty("insights") List<String> insights,
    @JsonProperty("warnings") List<String> warnings
) {
    public DraftRanking {
        entries = List.copyOf(entries);
        needs = List.copyOf(needs);
        insights = List.copyOf(insights);
        warnings = List.copyOf(warnings);
    }
}
