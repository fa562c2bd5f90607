package com.lineupadvisor.common.matchup;

import com.lineupadvisor.common.model.MatchupScore;
import com.lineupadvisor.common.model.Position;

import java.util.Locale;

/**
 * Maps an opponent's difficulty rank against a position onto a bounded favourability score.
 *
 * <p>Rank 1 is the most generous defense and 32 the toughest; a higher raw rank is a harder
 * matchup. Ranks outside [1, 32] are clamped first.
 * <pre>
 *   percentile = (32 − rank + 1) / 32 × 100
 *   score      = 100 / (1 + e^(−0.05 × (percentile − 50)))     clamped to [0, 100]
 * </pre>
 * The sigmoid flattens the middle of the league and separates the extremes. A missing rank is
 * exactly {@link MatchupScore#NEUTRAL}, flagged as unknown by the caller.
 */
public final class MatchupTransformer {

    public static final int TEAMS = 32;
    static final double STEEPNESS = 0.05;

    private MatchupTransformer() {}

    public static MatchupScore transform(Double rank, String opponent) {
        if (rank == null || !Double.isFinite(rank)) {
            return MatchupScore.unknown();
        }
        double clamped = Math.max(1.0, Math.min(TEAMS, rank));
        double score = score(clamped);
        return new MatchupScore(score, true, describe(score, opponent, clamped));
    }

    /** Sigmoid score for an already clamped rank. */
    static double score(double rank) {
        double percentile = (TEAMS - rank + 1) / TEAMS * 100.0;
        double score = 100.0 / (1.0 + Math.exp(-STEEPNESS * (percentile - 50.0)));
        return Math.max(0.0, Math.min(100.0, score));
    }

    static String describe(double score, String opponent, double rank) {
        String vs = " vs " + (opponent == null || opponent.isBlank() ? "opponent" : opponent)
            + String.format(Locale.ROOT, " (#%d/%d)", Math.round(rank), TEAMS);
        if (score >= 90) return "SMASH SPOT" + vs;
        if (score >= 80) return "Elite matchup" + vs;
        if (score >= 70) return "Great matchup" + vs;
        if (score >= 60) return "Good matchup" + vs;
        if (score >= 50) return "Neutral matchup" + vs;
        if (score >= 40) return "Below average" + vs;
        if (score >= 30) return "Tough matchup" + vs;
        if (score >= 20) return "Bad matchup" + vs;
        if (score >= 10) return "Terrible matchup" + vs;
        return "AVOID - Elite defense" + vs;
    }

    /**
     * Start/sit hint from the matchup alone. Single-starter positions (QB, TE, K, DEF) use
     * more conservative cut-offs than RB and WR.
     */
    public static String startSitHint(MatchupScore matchup, Position position) {
        double s = matchup.score();
        if (position.isSingleStarter()) {
            if (s >= 70) return "START - Great matchup";
            if (s >= 40) return "START - Decent matchup";
            if (s >= 25) return "RISKY - Monitor for better options";
            return "SIT - Find alternative if possible";
        }
        if (s >= 80) return "MUST START - Elite matchup";
        if (s >= 65) return "START - Favorable matchup";
        if (s >= 50) return "FLEX - Solid play";
        if (s >= 35) return "BENCH - Only if desperate";
        return "SIT - Avoid this matchup";
    }
}
