package com.lineupadvisor.common.scoring;

import com.lineupadvisor.common.bye.ByeWeekResolver;
import com.lineupadvisor.common.matchup.MatchupTransformer;
import com.lineupadvisor.common.model.MatchupScore;
import com.lineupadvisor.common.model.NormalizedProjection;
import com.lineupadvisor.common.model.PlayerFlag;
import com.lineupadvisor.common.model.PlayerSignals;
import com.lineupadvisor.common.model.Position;
import com.lineupadvisor.common.model.ScoredPlayer;
import com.lineupadvisor.common.model.ScoringPeriod;
import com.lineupadvisor.common.model.Tier;
import com.lineupadvisor.common.position.PositionBaselines;
import com.lineupadvisor.common.position.PositionValueModel;
import com.lineupadvisor.common.signal.MomentumCalculator;
import com.lineupadvisor.common.signal.SignalNormalizer;
import com.lineupadvisor.common.strategy.BlendWeights;
import com.lineupadvisor.common.strategy.StrategyProfile;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Produces a {@link ScoredPlayer} from raw signals, the active strategy and the pool context.
 *
 * <h3>Pipeline (per player)</h3>
 * <ol>
 *   <li><strong>Bye</strong>: a player on bye scores exactly 0 with the ON_BYE flag and the
 *       "BYE WEEK - DO NOT START" recommendation; nothing else is computed.</li>
 *   <li><strong>Recent form</strong>: {@link PerformanceFlagger} flags and adjusts the projection.
 *       An unknown projection is replaced by the position's replacement baseline.</li>
 *   <li><strong>Blend</strong>: on the 0..100 scale:
 *       <pre>
 *   blended = w_proj·scaled(adjusted) + w_matchup·matchup + w_trend·trending + w_momentum·momentum
 *       </pre></li>
 *   <li><strong>Tier &amp; composite</strong>:
 *       <pre>
 *   composite = min(150, blended × tierMultiplier × (1 − 0.3·e^(−blended/50)))
 *   ELITE → at least 120, STUD → at least 100
 *       </pre></li>
 *   <li><strong>Rest risk</strong>: {@link RestRiskPolicy} may scale composite and projection.</li>
 *   <li><strong>Range</strong>: floor, ceiling and consistency from {@link VolatilityCalculator}.</li>
 * </ol>
 * The FLEX value ({@link PositionValueModel#flexValue}) is carried alongside in points and is
 * never folded into the composite.
 *
 * <p>Stateless after construction and safe to share between requests.
 */
public final class CompositeScorer {

    public static final String BYE_RECOMMENDATION = "BYE WEEK - DO NOT START";

    static final double DIMINISHING_FACTOR = 0.3;
    static final double DIMINISHING_SCALE = 50.0;
    static final double COMPOSITE_CAP = 150.0;
    static final double ELITE_FLOOR = 120.0;
    static final double STUD_FLOOR = 100.0;

    private final PositionBaselines baselines;
    private final ByeWeekResolver byeWeeks;
    private final RestRiskPolicy restRisk;

    public CompositeScorer(PositionBaselines baselines, ByeWeekResolver byeWeeks, RestRiskPolicy restRisk) {
        this.baselines = baselines;
        this.byeWeeks = byeWeeks;
        this.restRisk = restRisk;
    }

    /**
     * Scores every player against a context built from the same pool. Output order matches input.
     */
    public List<ScoredPlayer> scorePool(List<PlayerSignals> players, StrategyProfile profile, ScoringPeriod period) {
        PoolContext context = PoolContext.of(players, baselines);
        List<ScoredPlayer> scored = new ArrayList<>(players.size());
        for (PlayerSignals p : players) {
            scored.add(score(p, profile, period, context));
        }
        return scored;
    }

    public ScoredPlayer score(PlayerSignals p, StrategyProfile profile, ScoringPeriod period, PoolContext context) {
        Position position = p.position();
        double baseline = baselines.baseline(position);

        // ── Signals ────────────────────────────────────────────────
        NormalizedProjection projection = SignalNormalizer.normalize(p.projections(), position, baselines);
        double effective = projection.averageOr(baseline);
        MatchupScore matchup = MatchupTransformer.transform(p.matchupRank(), p.opponent());
        double trending = SignalNormalizer.trendingScore(p.trendingDelta());
        List<Double> history = MomentumCalculator.newestFirst(p.recentGames());
        double momentum = MomentumCalculator.momentum(history);

        List<PlayerFlag> flags = new ArrayList<>();
        if (!projection.known()) {
            flags.add(PlayerFlag.PROJECTION_UNKNOWN);
            flags.add(PlayerFlag.LOW_DATA_CONFIDENCE);
        }
        if (!matchup.known()) {
            flags.add(PlayerFlag.MATCHUP_UNKNOWN);
        }
        if (p.trendingDelta() == null) {
            flags.add(PlayerFlag.TRENDING_UNKNOWN);
        }

        // ── Bye ────────────────────────────────────────────────────
        if (byeWeeks.isOnBye(p.team(), p.reportedByeWeek(), period.week())) {
            flags.add(0, PlayerFlag.ON_BYE);
            Tier tier = projection.known() ? context.thresholds(position).classify(effective) : Tier.FLEX;
            return new ScoredPlayer(p, projection, 0.0, matchup, trending, momentum, 0.0, tier,
                0.0, 0.0, 0.0, 0.0, VolatilityCalculator.consistency(history), true, flags,
                BYE_RECOMMENDATION, "On bye in week " + period.week());
        }

        // ── Recent form ────────────────────────────────────────────
        PerformanceAssessment form = PerformanceFlagger.assess(effective, projection.known(), p.recentGames());
        flags.addAll(form.flags());
        double adjusted = form.adjustedProjection();

        // ── Tier & composite ───────────────────────────────────────
        Tier tier = projection.known() ? context.thresholds(position).classify(adjusted) : Tier.FLEX;
        double blended = blend(profile.blend(),
            SignalNormalizer.scaleProjection(adjusted, position, baselines),
            matchup.score(), trending, momentum);
        double composite = composite(blended, profile.multiplier(tier), tier);

        // ── Rest risk ──────────────────────────────────────────────
        if (restRisk.applies(period, p.team())) {
            composite *= restRisk.factor();
            adjusted *= restRisk.factor();
            flags.add(PlayerFlag.REST_RISK);
        }

        double flexValue = PositionValueModel.flexValue(adjusted, baseline, context.scarcity(position));
        Volatility range = VolatilityCalculator.compute(adjusted, matchup.score(), history);

        String recommendation = recommend(tier, matchup, position, flags.contains(PlayerFlag.REST_RISK));
        String reasoning = reasoning(tier, projection, adjusted, form, matchup, flags);

        return new ScoredPlayer(p, projection, adjusted, matchup, trending, momentum, flexValue, tier,
            blended, composite, range.floor(), range.ceiling(), range.consistency(), false, flags,
            recommendation, reasoning);
    }

    // ── Formulas ───────────────────────────────────────────────────

    public static double blend(BlendWeights w, double projection, double matchup, double trending, double momentum) {
        return w.projection() * projection
            + w.matchup() * matchup
            + w.trending() * trending
            + w.momentum() * momentum;
    }

    /**
     * Tier-multiplied composite with diminishing returns, capped at {@value #COMPOSITE_CAP}
     * and floored for the starter-lock tiers.
     */
    public static double composite(double blended, double multiplier, Tier tier) {
        double raw = blended * multiplier * (1 - DIMINISHING_FACTOR * Math.exp(-blended / DIMINISHING_SCALE));
        double score = Math.min(COMPOSITE_CAP, raw);
        if (tier == Tier.ELITE) {
            score = Math.max(score, ELITE_FLOOR);
        } else if (tier == Tier.STUD) {
            score = Math.max(score, STUD_FLOOR);
        }
        return score;
    }

    // ── Text ───────────────────────────────────────────────────────

    static String recommend(Tier tier, MatchupScore matchup, Position position, boolean restRisk) {
        String base;
        if (tier.isStarterLock()) {
            base = "MUST START - " + tier.name()
                + (matchup.known() && matchup.score() <= 30 ? " despite tough matchup" : "");
        } else if (matchup.known()) {
            base = MatchupTransformer.startSitHint(matchup, position);
        } else {
            base = switch (tier) {
                case SOLID -> "START - Solid option";
                case FLEX -> "FLEX - Depth play";
                default -> "BENCH - Low projection";
            };
        }
        return restRisk ? base + " (monitor rest risk)" : base;
    }

    private static String reasoning(Tier tier, NormalizedProjection projection, double adjusted,
                                    PerformanceAssessment form, MatchupScore matchup, List<PlayerFlag> flags) {
        StringBuilder sb = new StringBuilder();
        sb.append(tier.name()).append(" tier. ");
        if (projection.known()) {
            sb.append(String.format(Locale.ROOT, "Projection %.1f pts from %d provider%s",
                projection.providerAverage(), projection.providerCount(), projection.providerCount() == 1 ? "" : "s"));
            if (Math.abs(adjusted - projection.providerAverage()) > 1e-9) {
                sb.append(String.format(Locale.ROOT, ", adjusted to %.1f", adjusted));
            }
            sb.append(". ");
        } else {
            sb.append(String.format(Locale.ROOT, "No provider projection, replacement level %.1f pts used. ", adjusted));
        }
        if (form.gamesUsed() > 0) {
            sb.append(form.context()).append(". ");
        }
        sb.append(matchup.description()).append('.');
        if (!flags.isEmpty()) {
            sb.append(" Flags: ")
              .append(flags.stream().map(PlayerFlag::label).collect(Collectors.joining(", ")))
              .append('.');
        }
        return sb.toString();
    }
}
