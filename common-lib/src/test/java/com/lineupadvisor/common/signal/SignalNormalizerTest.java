package com.lineupadvisor.common.signal;

import com.lineupadvisor.common.model.NormalizedProjection;
import com.lineupadvisor.common.model.Position;
import com.lineupadvisor.common.model.RecentGame;
import com.lineupadvisor.common.position.PositionBaselines;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Deterministic verification of {@link SignalNormalizer} and {@link MomentumCalculator}.
 */
class SignalNormalizerTest {

    private static final PositionBaselines BASELINES = PositionBaselines.defaults();

    // ── Projection normalization ──────────────────────────────────────────

    @Nested
    @DisplayName("normalize(): provider projections")
    class NormalizeTests {

        @Test
        @DisplayName("two providers → position-scaled values and raw-point average")
        void twoProviders() {
            NormalizedProjection p = SignalNormalizer.normalize(
                Map.of("sleeper", 15.0, "yahoo", 25.0), Position.RB, BASELINES);

            assertTrue(p.known());
            assertEquals(2, p.providerCount());
            assertEquals(20.0, p.providerAverage(), 1e-9);
            assertEquals(60.0, p.perProvider().get("sleeper"), 1e-9);
            assertEquals(100.0, p.perProvider().get("yahoo"), 1e-9);
        }

        @Test
        @DisplayName("scaled value caps at 100")
        void capsAtHundred() {
            NormalizedProjection p = SignalNormalizer.normalize(Map.of("a", 45.0), Position.QB, BASELINES);
            assertEquals(100.0, p.perProvider().get("a"), 1e-9);
            assertEquals(45.0, p.providerAverage(), 1e-9);
        }

        @Test
        @DisplayName("null, NaN, infinite and negative values are dropped")
        void invalidValuesDropped() {
            Map<String, Double> raw = new HashMap<>();
            raw.put("a", null);
            raw.put("b", Double.NaN);
            raw.put("c", -3.0);
            raw.put("d", Double.POSITIVE_INFINITY);
            raw.put("e", 11.0);

            NormalizedProjection p = SignalNormalizer.normalize(raw, Position.WR, BASELINES);
            assertEquals(1, p.providerCount());
            assertEquals(11.0, p.providerAverage(), 1e-9);
            assertEquals(List.of("e"), List.copyOf(p.perProvider().keySet()));
        }

        @Test
        @DisplayName("no valid provider → unknown, never zero")
        void allMissing_unknown() {
            Map<String, Double> raw = new HashMap<>();
            raw.put("a", null);
            raw.put("b", Double.NaN);

            NormalizedProjection p = SignalNormalizer.normalize(raw, Position.TE, BASELINES);
            assertFalse(p.known());
            assertNull(p.providerAverage());
            assertEquals(5.0, p.averageOr(BASELINES.baseline(Position.TE)), 1e-9);
        }

        @Test
        @DisplayName("empty and null maps → unknown")
        void emptyMap_unknown() {
            assertFalse(SignalNormalizer.normalize(Map.of(), Position.K, BASELINES).known());
            assertFalse(SignalNormalizer.normalize(null, Position.K, BASELINES).known());
        }

        @Test
        @DisplayName("zero points is a real projection")
        void zeroIsKnown() {
            NormalizedProjection p = SignalNormalizer.normalize(Map.of("a", 0.0), Position.DEF, BASELINES);
            assertTrue(p.known());
            assertEquals(0.0, p.providerAverage(), 1e-9);
        }
    }

    // ── Trending ──────────────────────────────────────────────────────────

    @Nested
    @DisplayName("trendingScore()")
    class TrendingTests {

        @Test
        @DisplayName("delta scales linearly to 10 000 adds")
        void linear() {
            assertEquals(50.0, SignalNormalizer.trendingScore(5_000.0), 1e-9);
        }

        @Test
        @DisplayName("clamped to [0, 100]")
        void clamped() {
            assertEquals(100.0, SignalNormalizer.trendingScore(25_000.0), 1e-9);
            assertEquals(0.0, SignalNormalizer.trendingScore(-400.0), 1e-9);
        }

        @Test
        @DisplayName("absent or non-finite → 0")
        void absent() {
            assertEquals(0.0, SignalNormalizer.trendingScore(null), 1e-9);
            assertEquals(0.0, SignalNormalizer.trendingScore(Double.NaN), 1e-9);
        }
    }

    // ── Momentum ──────────────────────────────────────────────────────────

    @Nested
    @DisplayName("MomentumCalculator")
    class MomentumTests {

        @Test
        @DisplayName("fewer than two games → neutral 50")
        void tooFewGames() {
            assertEquals(50.0, MomentumCalculator.momentum(List.of()), 1e-9);
            assertEquals(50.0, MomentumCalculator.momentum(List.of(18.0)), 1e-9);
            assertEquals(50.0, MomentumCalculator.momentum(null), 1e-9);
        }

        @Test
        @DisplayName("flat scores → neutral 50")
        void flatScores() {
            assertEquals(50.0, MomentumCalculator.momentum(List.of(12.0, 12.0, 12.0)), 1e-9);
        }

        @Test
        @DisplayName("hot newest game → above 50")
        void hotStreak() {
            // ewma: 20 → 17 → 14.9, mean 13.33, ratio 1.1175
            assertEquals(55.875, MomentumCalculator.momentum(List.of(20.0, 10.0, 10.0)), 1e-9);
        }

        @Test
        @DisplayName("cold newest game → below 50")
        void coldStreak() {
            assertTrue(MomentumCalculator.momentum(List.of(10.0, 20.0, 20.0)) < 50.0);
        }

        @Test
        @DisplayName("all-zero window → neutral 50")
        void zeroMean() {
            assertEquals(50.0, MomentumCalculator.momentum(List.of(0.0, 0.0)), 1e-9);
        }

        @Test
        @DisplayName("games are ordered newest week first regardless of input order")
        void ordersByWeek() {
            List<RecentGame> games = List.of(new RecentGame(3, 10.0), new RecentGame(5, 20.0), new RecentGame(4, 10.0));
            assertEquals(List.of(20.0, 10.0, 10.0), MomentumCalculator.newestFirst(games));
            assertEquals(55.875, MomentumCalculator.fromGames(games), 1e-9);
        }
    }
}
