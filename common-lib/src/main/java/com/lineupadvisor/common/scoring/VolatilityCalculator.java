package com.lineupadvisor.common.scoring;

import java.util.List;

/**
 * Floor, ceiling and consistency from recent history and matchup.
 *
 * <h3>With at least three games</h3>
 * <pre>
 *   floor   = mean − 0.8σ      ceiling = mean + 1.2σ        (population σ)
 *   matchup ≥ 70 → floor × 1.10, ceiling × 1.20
 *   matchup ≤ 30 → floor × 0.85, ceiling × 0.95
 * </pre>
 * <h3>Otherwise, banded multiples of the projection</h3>
 * <pre>
 *   matchup ≥ 70 → 0.75 / 1.35     ≥ 50 → 0.80 / 1.25
 *   matchup ≥ 30 → 0.70 / 1.15     else → 0.60 / 1.10
 * </pre>
 * Consistency is {@code clamp((1 − σ/mean) × 100, 0, 100)}, 50 without three games.
 */
public final class VolatilityCalculator {

    static final int MIN_GAMES = 3;

    private VolatilityCalculator() {}

    public static Volatility compute(double projection, double matchupScore, List<Double> recentScores) {
        if (recentScores != null && recentScores.size() >= MIN_GAMES) {
            double mean = mean(recentScores);
            double std = stdDev(recentScores, mean);
            double floor = mean - 0.8 * std;
            double ceiling = mean + 1.2 * std;
            if (matchupScore >= 70) {
                floor *= 1.1;
                ceiling *= 1.2;
            } else if (matchupScore <= 30) {
                floor *= 0.85;
                ceiling *= 0.95;
            }
            return new Volatility(Math.max(0.0, floor), ceiling, consistency(recentScores));
        }

        if (projection <= 0) {
            return Volatility.none();
        }
        double floorMult;
        double ceilingMult;
        if (matchupScore >= 70) {
            floorMult = 0.75;
            ceilingMult = 1.35;
        } else if (matchupScore >= 50) {
            floorMult = 0.80;
            ceilingMult = 1.25;
        } else if (matchupScore >= 30) {
            floorMult = 0.70;
            ceilingMult = 1.15;
        } else {
            floorMult = 0.60;
            ceilingMult = 1.10;
        }
        return new Volatility(projection * floorMult, projection * ceilingMult, Volatility.DEFAULT_CONSISTENCY);
    }

    public static double consistency(List<Double> scores) {
        if (scores == null || scores.size() < MIN_GAMES) {
            return Volatility.DEFAULT_CONSISTENCY;
        }
        double mean = mean(scores);
        if (mean == 0) {
            return Volatility.DEFAULT_CONSISTENCY;
        }
        double cv = stdDev(scores, mean) / mean;
        return Math.max(0.0, Math.min(100.0, (1 - cv) * 100.0));
    }

    private static double mean(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    }

    private static double stdDev(List<Double> values, double mean) {
        double sumSq = 0;
        for (double v : values) {
            sumSq += (v - mean) * (v - mean);
        }
        return Math.sqrt(sumSq / values.size());
    }
}
