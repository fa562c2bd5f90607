package com.lineupadvisor.common.lineup;

import com.lineupadvisor.common.model.LineupResult;
import com.lineupadvisor.common.model.MatchupScore;
import com.lineupadvisor.common.model.NormalizedProjection;
import com.lineupadvisor.common.model.PlayerFlag;
import com.lineupadvisor.common.model.PlayerSignals;
import com.lineupadvisor.common.model.Position;
import com.lineupadvisor.common.model.RosterSlot;
import com.lineupadvisor.common.model.ScoredPlayer;
import com.lineupadvisor.common.model.SlotAssignment;
import com.lineupadvisor.common.model.Tier;
import com.lineupadvisor.common.strategy.StrategyProfile;
import com.lineupadvisor.common.strategy.StrategyProfiles;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Deterministic verification of {@link LineupAssigner}, using hand-built scored players so that
 * composite and FLEX values are exact.
 */
class LineupAssignerTest {

    private static final StrategyProfiles PROFILES = StrategyProfiles.defaults();
    private static final StrategyProfile BALANCED = PROFILES.get("balanced");

    private static ScoredPlayer player(String name, Position pos, double composite, double flexValue) {
        return builder(name, pos).composite(composite).flex(flexValue).build();
    }

    private static Builder builder(String name, Position pos) {
        return new Builder(name, pos);
    }

    private static String nameIn(LineupResult r, String slotLabel) {
        return r.assignments().stream()
            .filter(a -> a.slot().label().equals(slotLabel))
            .findFirst()
            .map(a -> a.isEmpty() ? null : a.player().name())
            .orElseThrow();
    }

    // ── Completeness ──────────────────────────────────────────────────────

    @Nested
    @DisplayName("completeness")
    class CompletenessTests {

        @Test
        @DisplayName("every player is either a starter or on the bench, never both")
        void everyPlayerAccountedFor() {
            List<ScoredPlayer> pool = List.of(
                player("QB1", Position.QB, 90, 20),
                player("RB1", Position.RB, 80, 15),
                player("RB2", Position.RB, 70, 12),
                player("RB3", Position.RB, 60, 11),
                player("WR1", Position.WR, 75, 13),
                player("WR2", Position.WR, 65, 10),
                player("WR3", Position.WR, 55, 9),
                player("TE1", Position.TE, 50, 8),
                player("K1", Position.K, 40, 7),
                player("D1", Position.DEF, 40, 7),
                player("QB2", Position.QB, 30, 10));

            LineupResult r = LineupAssigner.assign(pool, RosterTemplates.template("standard"), BALANCED);

            List<String> starters = r.assignments().stream().filter(a -> !a.isEmpty()).map(a -> a.player().name()).toList();
            List<String> bench = r.bench().stream().map(ScoredPlayer::name).toList();
            assertEquals(9, starters.size());
            assertEquals(2, bench.size());
            List<String> all = new ArrayList<>(starters);
            all.addAll(bench);
            assertEquals(pool.size(), all.stream().distinct().count());
            assertFalse(r.hasEmptySlots());
            assertTrue(r.warnings().isEmpty());
        }

        @Test
        @DisplayName("a slot nobody can fill stays as an explicit empty assignment")
        void emptyKickerSlot() {
            List<ScoredPlayer> pool = List.of(
                player("QB1", Position.QB, 90, 20),
                player("RB1", Position.RB, 80, 15));
            List<RosterSlot> slots = List.of(RosterSlot.of(Position.QB), RosterSlot.of(Position.K));

            LineupResult r = LineupAssigner.assign(pool, slots, BALANCED);

            assertEquals(2, r.assignments().size());
            assertTrue(r.assignments().get(1).isEmpty());
            assertEquals("K", r.assignments().get(1).slot().label());
            assertTrue(r.warnings().contains("No eligible player for slot K"));
            assertEquals(List.of("RB1"), r.bench().stream().map(ScoredPlayer::name).toList());
            assertEquals(90.0, r.totalValue(), 1e-9);
        }

        @Test
        @DisplayName("assignments keep the input slot order")
        void slotOrderPreserved() {
            List<RosterSlot> slots = RosterTemplates.fromLabels(List.of("FLEX", "RB", "WR"));
            List<ScoredPlayer> pool = List.of(
                player("R", Position.RB, 80, 15),
                player("W", Position.WR, 70, 12),
                player("T", Position.TE, 60, 9));

            LineupResult r = LineupAssigner.assign(pool, slots, BALANCED);

            assertEquals(List.of("FLEX", "RB", "WR"),
                r.assignments().stream().map(a -> a.slot().label()).toList());
            assertEquals("R", nameIn(r, "RB"));
            assertEquals("W", nameIn(r, "WR"));
            assertEquals("T", nameIn(r, "FLEX"));
        }
    }

    // ── Bye handling ──────────────────────────────────────────────────────

    @Nested
    @DisplayName("bye weeks")
    class ByeTests {

        @Test
        @DisplayName("bye player is benched when an alternative exists")
        void byeAvoided() {
            List<ScoredPlayer> pool = List.of(
                builder("Star", Position.QB).composite(0).flex(0).tier(Tier.ELITE).bye().build(),
                player("Backup", Position.QB, 40, 12));

            LineupResult r = LineupAssigner.assign(pool, List.of(RosterSlot.of(Position.QB)), BALANCED);

            assertEquals("Backup", nameIn(r, "QB"));
            assertTrue(r.warnings().isEmpty());
            assertTrue(r.recommendations().stream().noneMatch(s -> s.contains("Star")));
        }

        @Test
        @DisplayName("bye player fills a slot only as the last resort, with a warning")
        void byeFallback() {
            List<ScoredPlayer> pool = List.of(
                builder("Tucker", Position.K).composite(0).flex(0).bye().build());

            LineupResult r = LineupAssigner.assign(pool, List.of(RosterSlot.of(Position.K)), BALANCED);

            assertEquals("Tucker", nameIn(r, "K"));
            assertTrue(r.warnings().contains("Tucker is on bye but is the only eligible player for slot K"));
            assertTrue(r.recommendations().contains("Tucker is on bye - replace before kickoff"));
        }
    }

    // ── Tie-breaks ────────────────────────────────────────────────────────

    @Nested
    @DisplayName("tie-breaks")
    class TieBreakTests {

        @Test
        @DisplayName("equal value and equal data → input order wins")
        void inputOrder() {
            List<ScoredPlayer> pool = List.of(
                player("First", Position.WR, 60, 10),
                player("Second", Position.WR, 60, 10));

            LineupResult r = LineupAssigner.assign(pool, List.of(RosterSlot.of(Position.WR)), BALANCED);
            assertEquals("First", nameIn(r, "WR"));

            LineupResult reversed = LineupAssigner.assign(List.of(pool.get(1), pool.get(0)),
                List.of(RosterSlot.of(Position.WR)), BALANCED);
            assertEquals("Second", nameIn(reversed, "WR"));
        }

        @Test
        @DisplayName("equal value → fewer missing-data flags wins")
        void dataGaps() {
            List<ScoredPlayer> pool = List.of(
                builder("Sparse", Position.WR).composite(60).flex(10).flags(PlayerFlag.MATCHUP_UNKNOWN).build(),
                player("Complete", Position.WR, 60, 10));

            LineupResult r = LineupAssigner.assign(pool, List.of(RosterSlot.of(Position.WR)), BALANCED);
            assertEquals("Complete", nameIn(r, "WR"));
        }

        @Test
        @DisplayName("equal value → conservative prefers the higher floor")
        void floorTieBreak() {
            List<ScoredPlayer> pool = List.of(
                builder("Boom", Position.RB).composite(60).flex(10).range(4, 25).build(),
                builder("Steady", Position.RB).composite(60).flex(10).range(9, 15).build());

            LineupResult r = LineupAssigner.assign(pool, List.of(RosterSlot.of(Position.RB)), PROFILES.get("conservative"));
            assertEquals("Steady", nameIn(r, "RB"));
        }

        @Test
        @DisplayName("equal value → aggressive prefers the higher ceiling")
        void ceilingTieBreak() {
            List<ScoredPlayer> pool = List.of(
                builder("Steady", Position.RB).composite(60).flex(10).range(9, 15).build(),
                builder("Boom", Position.RB).composite(60).flex(10).range(4, 25).build());

            LineupResult r = LineupAssigner.assign(pool, List.of(RosterSlot.of(Position.RB)), PROFILES.get("aggressive"));
            assertEquals("Boom", nameIn(r, "RB"));
        }
    }

    // ── Flexible slots ────────────────────────────────────────────────────

    @Nested
    @DisplayName("flexible slots")
    class FlexTests {

        @Test
        @DisplayName("FLEX compares FLEX value, not composite")
        void flexUsesFlexValue() {
            List<ScoredPlayer> pool = List.of(
                player("HighComposite", Position.WR, 95, 9),
                player("HighFlex", Position.TE, 60, 12));

            LineupResult r = LineupAssigner.assign(pool, RosterTemplates.fromLabels(List.of("FLEX")), BALANCED);
            assertEquals("HighFlex", nameIn(r, "FLEX"));
        }

        @Test
        @DisplayName("consistency bonus follows the risk direction")
        void consistencyBonus() {
            ScoredPlayer steady = builder("S", Position.WR).composite(50).flex(10).consistency(80).build();
            ScoredPlayer swingy = builder("V", Position.WR).composite(50).flex(10).consistency(20).build();

            assertEquals(100 + 0.5 + 0.6, LineupAssigner.flexScore(steady,
                PROFILES.get("conservative").risk()), 1e-9);
            assertEquals(100 + 0.5 + 0.6, LineupAssigner.flexScore(swingy,
                PROFILES.get("aggressive").risk()), 1e-9);
            assertEquals(100 + 0.5 + 0.3, LineupAssigner.flexScore(steady, BALANCED.risk()), 1e-9);
        }

        @Test
        @DisplayName("narrower flexible slots are filled before wider ones")
        void processingOrder() {
            List<RosterSlot> slots = RosterTemplates.fromLabels(List.of("SUPERFLEX", "FLEX", "QB", "BN"));
            assertEquals(List.of(2, 1, 0), LineupAssigner.processingOrder(slots));
        }

        @Test
        @DisplayName("an open slot pulls its only candidate out of a flexible slot that can be back-filled")
        void repair() {
            List<RosterSlot> slots = RosterTemplates.fromLabels(List.of("W/T", "R/T"));
            List<ScoredPlayer> pool = List.of(
                player("Tight", Position.TE, 60, 12),
                player("Wide", Position.WR, 55, 10));

            LineupResult r = LineupAssigner.assign(pool, slots, BALANCED);

            assertEquals("Wide", nameIn(r, "W/T"));
            assertEquals("Tight", nameIn(r, "R/T"));
            assertFalse(r.hasEmptySlots());
            assertTrue(r.warnings().isEmpty());
        }

        @Test
        @DisplayName("an open slot is filled through a chain of moves across two flexible slots")
        void chainedRepair() {
            List<RosterSlot> slots = List.of(
                RosterSlot.flex("RB/WR", Position.RB, Position.WR),
                RosterSlot.flex("WR/TE", Position.WR, Position.TE),
                RosterSlot.flex("TE/QB", Position.TE, Position.QB));
            List<ScoredPlayer> pool = List.of(
                player("Chase", Position.WR, 90, 25),
                player("Kelce", Position.TE, 70, 14),
                player("Dowdle", Position.RB, 40, 6));

            LineupResult r = LineupAssigner.assign(pool, slots, BALANCED);

            assertFalse(r.hasEmptySlots());
            assertEquals("Dowdle", nameIn(r, "RB/WR"));
            assertEquals("Chase", nameIn(r, "WR/TE"));
            assertEquals("Kelce", nameIn(r, "TE/QB"));
            assertTrue(r.warnings().isEmpty());
            assertTrue(r.bench().isEmpty());
        }

        @Test
        @DisplayName("no complete assignment → greedy choices kept and the open slot reported")
        void repairImpossible() {
            List<RosterSlot> slots = List.of(
                RosterSlot.flex("RB/WR", Position.RB, Position.WR),
                RosterSlot.flex("WR/TE", Position.WR, Position.TE));
            List<ScoredPlayer> pool = List.of(player("Chase", Position.WR, 90, 25));

            LineupResult r = LineupAssigner.assign(pool, slots, BALANCED);

            assertEquals("Chase", nameIn(r, "RB/WR"));
            assertTrue(r.assignments().get(1).isEmpty());
            assertEquals(List.of("No eligible player for slot WR/TE"), r.warnings());
        }
    }

    // ── Recommendations ───────────────────────────────────────────────────

    @Nested
    @DisplayName("recommendations")
    class RecommendationTests {

        @Test
        @DisplayName("an ELITE player left on the bench is called out")
        void eliteOnBench() {
            List<ScoredPlayer> pool = List.of(
                builder("Starter", Position.RB).composite(130).flex(20).tier(Tier.ELITE).build(),
                builder("Benched", Position.RB).composite(120).flex(19).tier(Tier.ELITE).build());

            LineupResult r = LineupAssigner.assign(pool, List.of(RosterSlot.of(Position.RB)), BALANCED);

            assertEquals("Starter", nameIn(r, "RB"));
            assertTrue(r.recommendations().contains("Benched (ELITE) on bench! Must start regardless of matchup"));
        }

        @Test
        @DisplayName("starters with no projection raise a data warning")
        void missingProjectionWarning() {
            List<ScoredPlayer> pool = List.of(
                builder("Ghost", Position.TE).composite(30).flex(5).unknownProjection().build());

            LineupResult r = LineupAssigner.assign(pool, List.of(RosterSlot.of(Position.TE)), BALANCED);

            assertTrue(r.warnings().stream().anyMatch(w -> w.startsWith("1 starter(s) have no provider projection")));
        }
    }

    // ── Fixture builder ───────────────────────────────────────────────────

    private static final class Builder {
        private final String name;
        private final Position position;
        private double composite;
        private double flex;
        private double floor = 8;
        private double ceiling = 14;
        private double consistency = 50;
        private boolean onBye;
        private boolean projectionKnown = true;
        private Tier tier = Tier.SOLID;
        private final List<PlayerFlag> flags = new ArrayList<>();

        Builder(String name, Position position) {
            this.name = name;
            this.position = position;
        }

        Builder composite(double v) { this.composite = v; return this; }
        Builder flex(double v) { this.flex = v; return this; }
        Builder range(double f, double c) { this.floor = f; this.ceiling = c; return this; }
        Builder consistency(double v) { this.consistency = v; return this; }
        Builder tier(Tier t) { this.tier = t; return this; }
        Builder flags(PlayerFlag... f) { this.flags.addAll(List.of(f)); return this; }

        Builder bye() {
            this.onBye = true;
            this.flags.add(0, PlayerFlag.ON_BYE);
            return this;
        }

        Builder unknownProjection() {
            this.projectionKnown = false;
            this.flags.add(PlayerFlag.PROJECTION_UNKNOWN);
            this.flags.add(PlayerFlag.LOW_DATA_CONFIDENCE);
            return this;
        }

        ScoredPlayer build() {
            PlayerSignals signals = PlayerSignals.of(name, position, "SEA",
                projectionKnown ? Map.of("a", 10.0) : Map.of());
            NormalizedProjection projection = projectionKnown
                ? new NormalizedProjection(Map.of("a", 40.0), 10.0, 1, true)
                : NormalizedProjection.unknown();
            return new ScoredPlayer(signals, projection, 10.0, MatchupScore.unknown(), 0, 50, flex, tier,
                composite, composite, floor, ceiling, consistency, onBye, flags, "", "");
        }
    }
}
