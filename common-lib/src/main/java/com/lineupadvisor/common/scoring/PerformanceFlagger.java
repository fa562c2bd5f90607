package com.lineupadvisor.common.scoring;

import com.lineupadvisor.common.model.PlayerFlag;
import com.lineupadvisor.common.model.RecentGame;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Compares recent production with the projection and blends the two.
 *
 * <p>Only games with positive points count, newest three at most. Evaluated top to bottom,
 * first match wins:
 * <pre>
 *   avg &gt; 1.50 × proj  → BREAKOUT_CANDIDATE   adjusted = 0.6·avg + 0.4·proj  (1–2 games)
 *                                                         0.7·avg + 0.3·proj  (3 games)
 *   avg &gt; 1.20 × proj  → TRENDING_UP          same blend as breakout
 *   avg &lt; 0.70 × proj  → DECLINING_ROLE       adjusted = 0.7·avg + 0.3·proj
 *   avg &lt; 0.85 × proj  → UNDERPERFORMING      adjusted = 0.3·avg + 0.7·proj
 *   otherwise                                  adjusted = 0.3·avg + 0.7·proj
 * </pre>
 * Independently, any game above 2 × proj adds HIGH_CEILING, and a tight spread
 * ({@code high / avg < 1.5}) with the average within 10% of the projection adds CONSISTENT.
 */
public final class PerformanceFlagger {

    static final int WINDOW = 3;

    static final double BREAKOUT_RATIO = 1.5;
    static final double TRENDING_RATIO = 1.2;
    static final double DECLINING_RATIO = 0.7;
    static final double UNDERPERFORMING_RATIO = 0.85;
    static final double HIGH_CEILING_RATIO = 2.0;

    private PerformanceFlagger() {}

    /**
     * @param projection      projection in points
     * @param projectionKnown false when the projection is a substituted baseline; no flags are
     *                        raised and the projection is returned unchanged
     * @param games           recent games in any order
     */
    public static PerformanceAssessment assess(double projection, boolean projectionKnown, List<RecentGame> games) {
        if (!projectionKnown) {
            return new PerformanceAssessment(List.of(), projection, null, 0, "No projection available, using replacement level");
        }
        List<Double> window = recentWindow(games);
        if (window.isEmpty()) {
            return new PerformanceAssessment(List.of(), projection, null, 0, "No recent performance data available");
        }

        double avg = window.stream().mapToDouble(Double::doubleValue).average().orElse(0);
        double high = window.stream().mapToDouble(Double::doubleValue).max().orElse(0);
        int n = window.size();

        List<PlayerFlag> flags = new ArrayList<>();
        double adjusted;
        String context;

        if (projection <= 0) {
            // Nothing to compare against; recent form is all there is.
            adjusted = 0.3 * avg + 0.7 * projection;
            context = String.format(Locale.ROOT, "L%dW avg: %.1f pts", n, avg);
            return new PerformanceAssessment(flags, adjusted, avg, n, context);
        }

        if (avg > projection * BREAKOUT_RATIO) {
            flags.add(PlayerFlag.BREAKOUT_CANDIDATE);
            adjusted = upsideBlend(avg, projection, n);
            context = String.format(Locale.ROOT,
                "Recent breakout: averaging %.1f pts over last %d weeks (projection: %.1f)", avg, n, projection);
        } else if (avg > projection * TRENDING_RATIO) {
            flags.add(PlayerFlag.TRENDING_UP);
            adjusted = upsideBlend(avg, projection, n);
            context = String.format(Locale.ROOT,
                "Trending up: averaging %.1f pts over last %d weeks (projection: %.1f)", avg, n, projection);
        } else if (avg < projection * DECLINING_RATIO) {
            flags.add(PlayerFlag.DECLINING_ROLE);
            adjusted = 0.7 * avg + 0.3 * projection;
            context = String.format(Locale.ROOT,
                "Declining role: averaging %.1f pts over last %d weeks (projection: %.1f)", avg, n, projection);
        } else {
            if (avg < projection * UNDERPERFORMING_RATIO) {
                flags.add(PlayerFlag.UNDERPERFORMING);
            }
            adjusted = 0.3 * avg + 0.7 * projection;
            context = String.format(Locale.ROOT, "L%dW avg: %.1f pts", n, avg);
        }

        if (high > projection * HIGH_CEILING_RATIO) {
            flags.add(PlayerFlag.HIGH_CEILING);
        }
        if (high / avg < 1.5 && avg > projection * 0.9 && avg < projection * 1.1) {
            flags.add(PlayerFlag.CONSISTENT);
        }
        return new PerformanceAssessment(flags, adjusted, avg, n, context);
    }

    /** Positive-point games, newest first, at most {@value #WINDOW}. */
    static List<Double> recentWindow(List<RecentGame> games) {
        if (games == null) {
            return List.of();
        }
        return games.stream()
            .filter(g -> Double.isFinite(g.points()) && g.points() > 0)
            .sorted(Comparator.comparingInt(RecentGame::week).reversed())
            .limit(WINDOW)
            .map(RecentGame::points)
            .toList();
    }

    private static double upsideBlend(double avg, double projection, int games) {
        return games >= WINDOW
            ? 0.7 * avg + 0.3 * projection
            : 0.6 * avg + 0.4 * projection;
    }
}
