package com.lineupadvisor.common.lineup;

import com.lineupadvisor.common.model.Position;
import com.lineupadvisor.common.model.RosterSlot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RosterTemplatesTest {

    @Test
    @DisplayName("standard template numbers duplicate labels")
    void standardLabels() {
        List<String> labels = RosterTemplates.template("standard").stream().map(RosterSlot::label).toList();
        assertEquals(List.of("QB", "RB1", "RB2", "WR1", "WR2", "TE", "FLEX", "K", "DEF",
            "BN1", "BN2", "BN3", "BN4", "BN5", "BN6"), labels);
    }

    @Test
    @DisplayName("template names are case-insensitive, unknown names rejected")
    void templateLookup() {
        assertEquals(RosterTemplates.template("superflex"), RosterTemplates.template(" SuperFlex "));
        assertThrows(IllegalArgumentException.class, () -> RosterTemplates.template("dynasty"));
    }

    @Test
    @DisplayName("host flex labels map to their eligible positions")
    void flexLabels() {
        assertEquals(EnumSet.of(Position.RB, Position.WR, Position.TE),
            RosterTemplates.slot("w/r/t").orElseThrow().eligible());
        assertEquals(EnumSet.of(Position.QB, Position.RB, Position.WR, Position.TE),
            RosterTemplates.slot("OP").orElseThrow().eligible());
        assertEquals(EnumSet.of(Position.RB, Position.TE),
            RosterTemplates.slot("R/T").orElseThrow().eligible());
    }

    @Test
    @DisplayName("bench labels accept every position and are not exact")
    void benchSlot() {
        RosterSlot bn = RosterTemplates.slot("BE").orElseThrow();
        assertTrue(bn.bench());
        assertFalse(bn.isExact());
        assertTrue(bn.accepts(Position.K));
    }

    @Test
    @DisplayName("unknown label → empty for slot(), exception for fromLabels()")
    void unknownLabel() {
        assertTrue(RosterTemplates.slot("IDP").isEmpty());
        assertTrue(RosterTemplates.slot(" ").isEmpty());
        assertThrows(IllegalArgumentException.class, () -> RosterTemplates.fromLabels(List.of("QB", "IDP")));
    }
}
