package com.lineupadvisor.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A slot and the player placed in it. {@code player == null} marks a required slot that
 * could not be filled; it is reported, never silently dropped.
 */
public record SlotAssignment(
    @JsonProperty("slot") RosterSlot slot,
    @JsonProperty("player") ScoredPlayer player
) {
    public static SlotAssignment empty(RosterSlot slot) {
        return new SlotAssignment(slot, null);
    }

    @JsonProperty("empty")
    public boolean isEmpty() {
        return player == null;
    }
}
