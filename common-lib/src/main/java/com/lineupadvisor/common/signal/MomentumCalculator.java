package com.lineupadvisor.common.signal;

import com.lineupadvisor.common.model.RecentGame;

import java.util.Comparator;
import java.util.List;

/**
 * Exponentially weighted momentum over recent games.
 *
 * <p>Scores are ordered newest first. The average is seeded with the newest score and
 * folded through the older ones with α = {@value #ALPHA}; the result is compared to the plain
 * mean of the same window:
 * <pre>
 *   ratio = ewma / mean
 *   ratio ≥ 1 → min(100, 50 + (ratio − 1) × 50)     (hot)
 *   ratio < 1 → max(0, ratio × 50)                  (cold)
 * </pre>
 * Fewer than two games, or a zero mean, is neutral (50).
 */
public final class MomentumCalculator {

    public static final double ALPHA = 0.3;
    public static final double NEUTRAL = 50.0;

    private MomentumCalculator() {}

    public static double momentum(List<Double> newestFirst) {
        if (newestFirst == null || newestFirst.size() < 2) {
            return NEUTRAL;
        }
        double ewma = newestFirst.get(0);
        double sum = ewma;
        for (int i = 1; i < newestFirst.size(); i++) {
            double score = newestFirst.get(i);
            ewma = ALPHA * score + (1 - ALPHA) * ewma;
            sum += score;
        }
        double mean = sum / newestFirst.size();
        if (mean == 0) {
            return NEUTRAL;
        }

        double ratio = ewma / mean;
        if (ratio >= 1.0) {
            return Math.min(100.0, 50.0 + (ratio - 1.0) * 50.0);
        }
        return Math.max(0.0, ratio * 50.0);
    }

    /** Momentum from game records in any order; invalid point values are skipped. */
    public static double fromGames(List<RecentGame> games) {
        return momentum(newestFirst(games));
    }

    /** Finite point values of the given games, newest week first. */
    public static List<Double> newestFirst(List<RecentGame> games) {
        if (games == null) {
            return List.of();
        }
        return games.stream()
            .filter(g -> Double.isFinite(g.points()))
            .sorted(Comparator.comparingInt(RecentGame::week).reversed())
            .map(RecentGame::points)
            .toList();
    }
}
