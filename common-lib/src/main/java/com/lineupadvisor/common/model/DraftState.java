package com.lineupadvisor.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Snapshot of a draft at the moment a recommendation is requested.
 *
 * @param roster      players the requesting team already drafted
 * @param available   players still on the board
 * @param currentPick 1-based overall pick number
 * @param teams       league size
 * @param count       maximum number of recommendations to return
 */
public record DraftState(
    @JsonProperty("roster") List<PlayerSignals> roster,
    @JsonProperty("available") List<PlayerSignals> available,
    @JsonProperty("currentPick") int currentPick,
    @JsonProperty("teams") int teams,
    @JsonProperty("count") int count
) {
    public DraftState {
        roster = roster == null ? List.of() : List.copyOf(roster);
        available = available == null ? List.of() : List.copyOf(available);
        if (teams < 1) {
            throw new IllegalArgumentException("teams must be at least 1, got " + teams);
        }
        if (currentPick < 1) {
            throw new IllegalArgumentException("currentPick must be at least 1, got " + currentPick);
        }
        if (count < 0) {
            throw new IllegalArgumentException("count must not be negative, got " + count);
        }
    }
}
