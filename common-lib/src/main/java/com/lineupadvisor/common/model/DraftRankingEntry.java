package com.lineupadvisor.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One ranked draft candidate.
 *
 * @param player      the candidate's raw signals
 * @param projection  projection the VOR was computed from (baseline when unknown)
 * @param vor         value over replacement; 0 when the projection is unknown
 * @param scarcity    scarcity adjustment in rank-score points
 * @param need        roster-need adjustment in rank-score points
 * @param rankScore   weighted combination used for ordering
 * @param rank        1-based position in the returned list
 * @param reasoning   short explanation
 */
public record DraftRankingEntry(
    @JsonProperty("player") PlayerSignals player,
    @JsonProperty("projection") double projection,
    @JsonProperty("vor") double vor,
    @JsonProperty("scarcity") double scarcity,
    @JsonProperty("need") double need,
    @JsonProperty("rankScore") double rankScore,
    @JsonProperty("rank") int rank,
    @JsonProperty("reasoning") String reasoning
) {
    public DraftRankingEntry withRank(int newRank) {
        return new DraftRankingEntry(player, projection, vor, scarcity, need, rankScore, newRank, reasoning);
    }
}
