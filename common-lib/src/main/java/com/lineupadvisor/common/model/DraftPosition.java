package com.lineupadvisor.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Where a pick sits in a snake draft.
 *
 * <pre>
 *   round       = ceil(overallPick / teams)
 *   pickInRound = ((overallPick − 1) mod teams) + 1
 *   draftSlot   = pickInRound in odd rounds, teams − pickInRound + 1 in even rounds
 *   picksUntilNext (overall picks until this team's next turn)
 *               = 2·(teams − draftSlot) + 1 in odd rounds, 2·draftSlot − 1 in even rounds
 * </pre>
 *
 * @param overallPick    1-based overall pick number
 * @param round          1-based round
 * @param pickInRound    1-based order of the pick within its round
 * @param draftSlot      the drafting team's slot in the round-one order
 * @param picksUntilNext overall picks between now and the team's next pick, counting that pick
 */
public record DraftPosition(
    @JsonProperty("overallPick") int overallPick,
    @JsonProperty("round") int round,
    @JsonProperty("pickInRound") int pickInRound,
    @JsonProperty("draftSlot") int draftSlot,
    @JsonProperty("picksUntilNext") int picksUntilNext
) {
    public static DraftPosition snake(int overallPick, int teams) {
        if (overallPick < 1 || teams < 1) {
            throw new IllegalArgumentException(
                "overallPick and teams must be positive, got " + overallPick + "/" + teams);
        }
        int round = (overallPick - 1) / teams + 1;
        int pickInRound = (overallPick - 1) % teams + 1;
        if (round % 2 == 1) {
            return new DraftPosition(overallPick, round, pickInRound, pickInRound,
                2 * (teams - pickInRound) + 1);
        }
        int slot = teams - pickInRound + 1;
        return new DraftPosition(overallPick, round, pickInRound, slot, 2 * slot - 1);
    }

    /** early ≤ 3, middle ≤ 8, late otherwise. */
    public String phase() {
        if (round <= 3) return "early";
        if (round <= 8) return "middle";
        return "late";
    }
}
