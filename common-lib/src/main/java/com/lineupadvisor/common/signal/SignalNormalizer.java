package com.lineupadvisor.common.signal;

import com.lineupadvisor.common.model.NormalizedProjection;
import com.lineupadvisor.common.model.Position;
import com.lineupadvisor.common.position.PositionBaselines;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Turns sparse provider projections and ownership trends into comparable 0..100 signals.
 *
 * <h3>Projection scaling</h3>
 * <pre>
 *   scaled = min(100, points / normalizationMax(position) × 100)
 * </pre>
 * Null, NaN, infinite and negative values are dropped before averaging. When no provider
 * remains the result is {@link NormalizedProjection#unknown()}, never zero.
 *
 * <h3>Trending scale</h3>
 * <pre>
 *   trending = clamp(delta / 10 000 × 100, 0, 100)      absent → 0, flagged TRENDING_UNKNOWN by the scorer
 * </pre>
 */
public final class SignalNormalizer {

    /** Ownership delta that maps to a full trending score. */
    static final double TRENDING_FULL_SCALE = 10_000.0;

    private SignalNormalizer() {}

    public static NormalizedProjection normalize(Map<String, Double> projections, Position position,
                                                 PositionBaselines baselines) {
        if (projections == null || projections.isEmpty()) {
            return NormalizedProjection.unknown();
        }
        double max = baselines.get(position).normalizationMax();

        Map<String, Double> scaled = new TreeMap<>();
        double sum = 0;
        int count = 0;
        for (Map.Entry<String, Double> e : projections.entrySet()) {
            Double v = e.getValue();
            if (!isValidProjection(v)) {
                continue;
            }
            scaled.put(e.getKey(), scale(v, max));
            sum += v;
            count++;
        }
        if (count == 0) {
            return NormalizedProjection.unknown();
        }
        return new NormalizedProjection(Collections.unmodifiableMap(scaled), sum / count, count, true);
    }

    /** Points on the position's 0..100 scale. */
    public static double scaleProjection(double points, Position position, PositionBaselines baselines) {
        return scale(points, baselines.get(position).normalizationMax());
    }

    public static double trendingScore(Double delta) {
        if (delta == null || !Double.isFinite(delta)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(100.0, delta / TRENDING_FULL_SCALE * 100.0));
    }

    public static boolean isValidProjection(Double value) {
        return value != null && Double.isFinite(value) && value >= 0.0;
    }

    private static double scale(double points, double max) {
        return Math.max(0.0, Math.min(100.0, points / max * 100.0));
    }
}
