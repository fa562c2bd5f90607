package com.lineupadvisor.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * One named lineup requirement, e.g. {@code QB}, {@code FLEX} (RB/WR/TE) or {@code BN}.
 *
 * <p>Bench slots accept any position and are never "required": unfilled bench slots
 * produce no warning.
 */
public record RosterSlot(
    @JsonProperty("label") String label,
    @JsonProperty("eligible") Set<Position> eligible,
    @JsonProperty("bench") boolean bench
) {
    public RosterSlot {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("Roster slot label must not be blank");
        }
        if (bench) {
            eligible = Collections.unmodifiableSet(EnumSet.allOf(Position.class));
        } else if (eligible == null || eligible.isEmpty()) {
            throw new IllegalArgumentException("Slot " + label + " has no eligible positions");
        } else {
            eligible = Collections.unmodifiableSet(EnumSet.copyOf(eligible));
        }
    }

    public static RosterSlot of(Position position) {
        return new RosterSlot(position.name(), EnumSet.of(position), false);
    }

    public static RosterSlot flex(String label, Position first, Position... rest) {
        return new RosterSlot(label, EnumSet.of(first, rest), false);
    }

    public static RosterSlot bench(String label) {
        return new RosterSlot(label, null, true);
    }

    public boolean accepts(Position position) {
        return eligible.contains(position);
    }

    /** A slot that accepts exactly one position. */
    @JsonIgnore
    public boolean isExact() {
        return !bench && eligible.size() == 1;
    }
}
