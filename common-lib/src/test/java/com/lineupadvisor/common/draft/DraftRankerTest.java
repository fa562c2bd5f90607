package com.lineupadvisor.common.draft;

import com.lineupadvisor.common.bye.ByeWeekResolver;
import com.lineupadvisor.common.bye.ByeWeekTable;
import com.lineupadvisor.common.model.DraftPosition;
import com.lineupadvisor.common.model.DraftRanking;
import com.lineupadvisor.common.model.DraftRankingEntry;
import com.lineupadvisor.common.model.DraftState;
import com.lineupadvisor.common.model.NeedLevel;
import com.lineupadvisor.common.model.PlayerSignals;
import com.lineupadvisor.common.model.Position;
import com.lineupadvisor.common.position.PositionBaselines;
import com.lineupadvisor.common.position.RosterRequirement;
import com.lineupadvisor.common.strategy.StrategyProfile;
import com.lineupadvisor.common.strategy.StrategyProfiles;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Deterministic verification of {@link DraftRanker} and {@link RosterNeedAnalyzer}.
 */
class DraftRankerTest {

    private static final PositionBaselines BASELINES = PositionBaselines.defaults();
    private static final StrategyProfile BALANCED = StrategyProfiles.defaults().get("balanced");
    private static final ByeWeekTable BYES = new ByeWeekTable(
        Map.of("ATL", 5, "CHI", 5, "GB", 5, "PIT", 5, "KC", 10), "test");

    private final DraftRanker ranker = new DraftRanker(BASELINES, new ByeWeekResolver(BYES));

    private static PlayerSignals p(String name, Position pos, double projection) {
        return PlayerSignals.of(name, pos, "KC", Map.of("a", projection));
    }

    private DraftRanking rank(List<PlayerSignals> roster, List<PlayerSignals> available, int count) {
        return ranker.rank(new DraftState(roster, available, 1, 12, count), BALANCED);
    }

    // ── Snake positions ───────────────────────────────────────────────────

    @Nested
    @DisplayName("snake draft position")
    class SnakeTests {

        @Test
        @DisplayName("12 teams: turn picks wait 1, end picks wait 23")
        void picksUntilNext() {
            assertEquals(23, DraftPosition.snake(1, 12).picksUntilNext());
            assertEquals(1, DraftPosition.snake(12, 12).picksUntilNext());
            assertEquals(23, DraftPosition.snake(13, 12).picksUntilNext());
            assertEquals(1, DraftPosition.snake(24, 12).picksUntilNext());
        }

        @Test
        @DisplayName("even rounds reverse the draft slot")
        void evenRoundSlot() {
            DraftPosition pos = DraftPosition.snake(14, 12);
            assertEquals(2, pos.round());
            assertEquals(2, pos.pickInRound());
            assertEquals(11, pos.draftSlot());
            assertEquals(21, pos.picksUntilNext());
        }

        @Test
        @DisplayName("phase by round: early ≤ 3, middle ≤ 8, late after")
        void phases() {
            assertEquals("early", DraftPosition.snake(36, 12).phase());
            assertEquals("middle", DraftPosition.snake(37, 12).phase());
            assertEquals("late", DraftPosition.snake(97, 12).phase());
        }

        @Test
        @DisplayName("non-positive pick rejected")
        void invalidPick() {
            assertThrows(IllegalArgumentException.class, () -> DraftPosition.snake(0, 12));
        }
    }

    // ── Components ────────────────────────────────────────────────────────

    @Nested
    @DisplayName("rank score components")
    class ComponentTests {

        @Test
        @DisplayName("scarcity shrinks as high-value players remain")
        void scarcity() {
            assertEquals(13.0, DraftRanker.scarcityAdjustment(1.3, 0), 1e-9);
            assertEquals(6.5, DraftRanker.scarcityAdjustment(1.3, 4), 1e-9);
        }

        @Test
        @DisplayName("lone 18-point RB on an empty roster, balanced → 10.12")
        void balancedScore() {
            DraftRankingEntry e = rank(List.of(), List.of(p("Bijan", Position.RB, 18)), 10).entries().get(0);

            assertEquals(10.0, e.vor(), 1e-9);
            assertEquals(10.4, e.scarcity(), 1e-9);
            assertEquals(10.0, e.need(), 1e-9);
            // 0.4 × 10 + 0.3 × 10.4 + 0.3 × 10
            assertEquals(10.12, e.rankScore(), 1e-9);
        }

        @Test
        @DisplayName("VOR rises with projection at a position")
        void vorMonotonic() {
            DraftRanking r = rank(List.of(), List.of(
                p("Low", Position.WR, 9), p("High", Position.WR, 17), p("Mid", Position.WR, 12)), 10);

            assertEquals(List.of("High", "Mid", "Low"),
                r.entries().stream().map(e -> e.player().name()).toList());
            assertTrue(r.entries().get(0).vor() > r.entries().get(1).vor());
            assertTrue(r.entries().get(1).vor() > r.entries().get(2).vor());
        }

        @Test
        @DisplayName("unknown projection → VOR 0 and a warning")
        void unknownProjection() {
            DraftRanking r = rank(List.of(),
                List.of(PlayerSignals.of("Mystery", Position.TE, "NYJ", Map.of())), 10);

            assertEquals(0.0, r.entries().get(0).vor());
            assertEquals(5.0, r.entries().get(0).projection(), 1e-9);
            assertTrue(r.warnings().stream().anyMatch(w -> w.startsWith("1 available player(s) have no provider projection")));
        }
    }

    // ── Ordering ──────────────────────────────────────────────────────────

    @Nested
    @DisplayName("ordering")
    class OrderingTests {

        @Test
        @DisplayName("capped at count with contiguous 1-based ranks")
        void cappedAndNumbered() {
            DraftRanking r = rank(List.of(), List.of(
                p("A", Position.QB, 24), p("B", Position.RB, 16), p("C", Position.WR, 14),
                p("D", Position.TE, 10), p("E", Position.K, 8)), 3);

            assertEquals(3, r.entries().size());
            assertEquals(List.of(1, 2, 3), r.entries().stream().map(DraftRankingEntry::rank).toList());
            for (int i = 1; i < r.entries().size(); i++) {
                assertTrue(r.entries().get(i - 1).rankScore() >= r.entries().get(i).rankScore());
            }
        }

        @Test
        @DisplayName("exact ties fall back to player identity, independent of input order")
        void identityTieBreak() {
            PlayerSignals beta = p("Beta", Position.WR, 12);
            PlayerSignals alpha = p("Alpha", Position.WR, 12);

            assertEquals("Alpha", rank(List.of(), List.of(beta, alpha), 10).entries().get(0).player().name());
            assertEquals("Alpha", rank(List.of(), List.of(alpha, beta), 10).entries().get(0).player().name());
        }

        @Test
        @DisplayName("count 0 → empty list")
        void zeroCount() {
            assertTrue(rank(List.of(), List.of(p("A", Position.QB, 24)), 0).entries().isEmpty());
        }
    }

    // ── Roster context ────────────────────────────────────────────────────

    @Nested
    @DisplayName("roster needs and bye clustering")
    class RosterContextTests {

        @Test
        @DisplayName("RB need level follows roster depth")
        void needLevels() {
            RosterRequirement rb = BASELINES.get(Position.RB).roster();
            assertEquals(NeedLevel.CRITICAL, RosterNeedAnalyzer.level(0, rb));
            assertEquals(NeedLevel.HIGH, RosterNeedAnalyzer.level(1, rb));
            assertEquals(NeedLevel.MEDIUM, RosterNeedAnalyzer.level(2, rb));
            assertEquals(NeedLevel.LOW, RosterNeedAnalyzer.level(5, rb));
            assertEquals(NeedLevel.SATURATED, RosterNeedAnalyzer.level(7, rb));
        }

        @Test
        @DisplayName("three rostered players sharing a bye week raise a warning")
        void byeCluster() {
            List<PlayerSignals> roster = List.of(
                PlayerSignals.of("A", Position.RB, "ATL", Map.of("a", 15.0)),
                PlayerSignals.of("B", Position.WR, "CHI", Map.of("a", 12.0)),
                PlayerSignals.of("C", Position.TE, "GB", Map.of("a", 9.0)),
                PlayerSignals.of("D", Position.QB, "KC", Map.of("a", 20.0)));

            DraftRanking r = rank(roster, List.of(p("E", Position.WR, 11)), 5);

            assertTrue(r.warnings().contains(
                "Bye week clustering detected: 3 rostered players share week 5 - diversify bye weeks"));
            assertEquals(1, r.warnings().size());
        }

        @Test
        @DisplayName("critical needs surface in the insights")
        void criticalInsight() {
            DraftRanking r = rank(List.of(p("Q", Position.QB, 20)), List.of(p("E", Position.WR, 11)), 5);

            assertTrue(r.insights().contains("Critical needs: RB, WR, TE, K, DEF"));
            assertEquals("early", r.phase());
        }
    }
}
