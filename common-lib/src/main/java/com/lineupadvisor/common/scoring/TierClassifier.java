package com.lineupadvisor.common.scoring;

import com.lineupadvisor.common.model.Position;
import com.lineupadvisor.common.model.Tier;
import com.lineupadvisor.common.position.PositionBaselines;
import com.lineupadvisor.common.position.TierThresholds;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Assigns ELITE/STUD/SOLID/FLEX/BENCH from a player's projection.
 *
 * <p>With fewer than {@value #MIN_POOL_FOR_PERCENTILES} known projections at a position the
 * configured fixed cut-offs apply. With a larger pool the week's own distribution is used:
 * ELITE at the 90th percentile, STUD 75th, SOLID 50th, FLEX 25th.
 */
public final class TierClassifier {

    public static final int MIN_POOL_FOR_PERCENTILES = 10;

    private TierClassifier() {}

    public static TierThresholds thresholds(Position position, Collection<Double> pool,
                                            PositionBaselines baselines) {
        if (pool == null || pool.size() < MIN_POOL_FOR_PERCENTILES) {
            return baselines.get(position).tiers();
        }
        List<Double> sorted = new ArrayList<>(pool);
        sorted.sort(null);
        return new TierThresholds(
            percentile(sorted, 90),
            percentile(sorted, 75),
            percentile(sorted, 50),
            percentile(sorted, 25));
    }

    public static Tier classify(double projection, TierThresholds thresholds) {
        return thresholds.classify(projection);
    }

    /** Linear interpolation between closest ranks over an ascending list. */
    static double percentile(List<Double> ascending, double pct) {
        if (ascending.size() == 1) {
            return ascending.get(0);
        }
        double rank = pct / 100.0 * (ascending.size() - 1);
        int lower = (int) Math.floor(rank);
        int upper = (int) Math.ceil(rank);
        double frac = rank - lower;
        return ascending.get(lower) + (ascending.get(upper) - ascending.get(lower)) * frac;
    }
}
