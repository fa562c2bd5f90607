package com.lineupadvisor.common.position;

import com.lineupadvisor.common.model.Position;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Converts raw projections into position-relative value so that players of different
 * positions can compete for one flexible slot.
 *
 * <h3>Formulas</h3>
 * <pre>
 *   vor        = projection − baseline(position)
 *   flexValue  = (vor × scarcity × 0.3) + (projection × 0.7)
 *   zScore     = (projection − mean(position)) / std(position)
 *   percentile = clamp(50 + zScore × 33.3, 0, 100)
 * </pre>
 *
 * <p>The dynamic scarcity multiplier looks at the week's pool for a position: the average of
 * the top tier (top 12, at most half the pool) relative to the replacement baseline.
 * <pre>
 *   ratio ≥ 2.5 → base × 1.3     ratio ≥ 2.0 → base × 1.2
 *   ratio ≥ 1.5 → base × 1.1     otherwise   → base × 0.95
 * </pre>
 * A pool too small to have a top tier keeps the base multiplier.
 *
 * <p>Stateless and pure; no Spring dependencies.
 */
public final class PositionValueModel {

    static final double VOR_WEIGHT = 0.3;
    static final double PROJECTION_WEIGHT = 0.7;

    /** FLEX values closer than this fall back to raw projection. */
    public static final double FLEX_TIEBREAK_MARGIN = 0.3;

    private static final int TOP_TIER_SIZE = 12;
    private static final double PERCENTILE_PER_SIGMA = 33.3;

    private PositionValueModel() {}

    public static double vor(double projection, Position position, PositionBaselines baselines) {
        return projection - baselines.baseline(position);
    }

    /** Exactly {@code (vor × scarcity × 0.3) + (projection × 0.7)}. */
    public static double flexValue(double projection, double baseline, double scarcity) {
        double vor = projection - baseline;
        return (vor * scarcity * VOR_WEIGHT) + (projection * PROJECTION_WEIGHT);
    }

    public static double flexValue(double projection, Position position, double scarcity,
                                   PositionBaselines baselines) {
        return flexValue(projection, baselines.baseline(position), scarcity);
    }

    /**
     * Pool-aware scarcity multiplier for one position.
     *
     * @param pool known projections at the position this week, any order
     */
    public static double scarcity(Position position, Collection<Double> pool, PositionBaselines baselines) {
        PositionProfile profile = baselines.get(position);
        double base = profile.scarcity();
        if (pool == null || pool.isEmpty()) {
            return base;
        }
        List<Double> sorted = new ArrayList<>(pool);
        sorted.sort(Comparator.reverseOrder());
        int topTier = Math.min(TOP_TIER_SIZE, sorted.size() / 2);
        if (topTier == 0 || profile.baseline() <= 0) {
            return base;
        }
        double topAvg = sorted.subList(0, topTier).stream().mapToDouble(Double::doubleValue).average().orElse(0);
        double ratio = topAvg / profile.baseline();

        if (ratio >= 2.5) return base * 1.3;
        if (ratio >= 2.0) return base * 1.2;
        if (ratio >= 1.5) return base * 1.1;
        return base * 0.95;
    }

    public static double zScore(double projection, Position position, PositionBaselines baselines) {
        PositionProfile p = baselines.get(position);
        return (projection - p.mean()) / p.stdDev();
    }

    public static double percentile(double projection, Position position, PositionBaselines baselines) {
        double pct = 50 + zScore(projection, position, baselines) * PERCENTILE_PER_SIGMA;
        return Math.max(0, Math.min(100, pct));
    }

    /**
     * Head-to-head FLEX comparison using each position's base scarcity.
     *
     * @return negative when {@code a} is the better FLEX play, positive when {@code b} is, zero on
     *         an exact tie. Within {@link #FLEX_TIEBREAK_MARGIN} the higher raw projection wins.
     */
    public static int compareForFlex(double projA, Position posA, double projB, Position posB,
                                     PositionBaselines baselines) {
        double flexA = flexValue(projA, posA, baselines.get(posA).scarcity(), baselines);
        double flexB = flexValue(projB, posB, baselines.get(posB).scarcity(), baselines);
        if (Math.abs(flexA - flexB) < FLEX_TIEBREAK_MARGIN) {
            return Double.compare(projB, projA);
        }
        return Double.compare(flexB, flexA);
    }

    /** Human-readable explanation of a FLEX comparison. */
    public static String explainComparison(String nameA, double projA, Position posA,
                                           String nameB, double projB, Position posB,
                                           PositionBaselines baselines) {
        double flexA = flexValue(projA, posA, baselines.get(posA).scarcity(), baselines);
        double flexB = flexValue(projB, posB, baselines.get(posB).scarcity(), baselines);
        boolean tiebreak = Math.abs(flexA - flexB) < FLEX_TIEBREAK_MARGIN;
        String winner = compareForFlex(projA, posA, projB, posB, baselines) <= 0 ? nameA : nameB;

        return String.format(Locale.ROOT,
            "FLEX comparison: %s (%s) vs %s (%s)%n%s%n%s%nWinner: %s (%s)",
            nameA, posA, nameB, posB,
            describe(nameA, projA, posA, flexA, baselines),
            describe(nameB, projB, posB, flexB, baselines),
            winner,
            tiebreak ? "higher raw projection, FLEX values within 0.3"
                     : "higher FLEX value accounting for position and scarcity");
    }

    private static String describe(String name, double proj, Position pos, double flex,
                                   PositionBaselines baselines) {
        double z = zScore(proj, pos, baselines);
        return String.format(Locale.ROOT,
            "  %s: projection %.1f, %.0fth percentile at %s, z %+.2f, FLEX value %.1f",
            name, proj, percentile(proj, pos, baselines), pos, z, flex);
    }
}
