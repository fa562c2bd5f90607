package com.lineupadvisor.common.waiver;

import com.lineupadvisor.common.lineup.LineupAssigner;
import com.lineupadvisor.common.model.LineupResult;
import com.lineupadvisor.common.model.PlayerSignals;
import com.lineupadvisor.common.model.RosterSlot;
import com.lineupadvisor.common.model.ScoredPlayer;
import com.lineupadvisor.common.model.ScoringPeriod;
import com.lineupadvisor.common.model.SlotAssignment;
import com.lineupadvisor.common.model.WaiverRanking;
import com.lineupadvisor.common.model.WaiverTarget;
import com.lineupadvisor.common.scoring.CompositeScorer;
import com.lineupadvisor.common.strategy.StrategyProfile;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Ranks free agents by their effect on this week's lineup.
 *
 * <p>Roster and candidates are scored together, so tiers and scarcity come from one pool. Each
 * candidate is then added to the roster on its own and the lineup is re-assigned:
 * <pre>
 *   pointImprovement  = startingPoints(roster + candidate) − startingPoints(roster)
 *   upsideFactor      = min(ceiling / projection, 2.0)
 *   consistencyFactor = max(floor / projection, 0.5)
 *   impactScore       = pointImprovement × upsideFactor × consistencyFactor
 * </pre>
 * Starting points are the sum of the starters' adjusted projections. Sorted by impact
 * descending, ties by player identity, capped at the requested count.
 */
public final class WaiverRanker {

    public static final int DEFAULT_COUNT = 20;

    static final double MAX_UPSIDE = 2.0;
    static final double MIN_CONSISTENCY = 0.5;

    private final CompositeScorer scorer;

    public WaiverRanker(CompositeScorer scorer) {
        this.scorer = scorer;
    }

    public WaiverRanking rank(List<PlayerSignals> roster, List<PlayerSignals> available, List<RosterSlot> slots,
                              StrategyProfile profile, ScoringPeriod period, int count) {
        List<PlayerSignals> pool = new ArrayList<>(roster);
        pool.addAll(available);
        List<ScoredPlayer> scored = scorer.scorePool(pool, profile, period);
        List<ScoredPlayer> current = scored.subList(0, roster.size());

        LineupResult without = LineupAssigner.assign(current, slots, profile);
        double currentPoints = startingPoints(without);
        Set<ScoredPlayer> currentStarters = starters(without);

        List<WaiverTarget> targets = new ArrayList<>(available.size());
        int unknown = 0;
        for (ScoredPlayer candidate : scored.subList(roster.size(), scored.size())) {
            List<ScoredPlayer> extended = new ArrayList<>(current);
            extended.add(candidate);
            LineupResult with = LineupAssigner.assign(extended, slots, profile);

            double improvement = startingPoints(with) - currentPoints;
            double upside = upsideFactor(candidate);
            double consistency = consistencyFactor(candidate);
            String slot = slotOf(with, candidate);
            String replaces = slot == null ? null : displaced(currentStarters, starters(with));
            if (!candidate.projection().known()) {
                unknown++;
            }
            targets.add(new WaiverTarget(candidate.signals(), candidate.tier(), candidate.adjustedProjection(),
                improvement, upside, consistency, improvement * upside * consistency, slot, replaces, 0,
                reasoning(candidate, improvement, upside, consistency, slot, replaces)));
        }

        targets.sort(Comparator.comparingDouble(WaiverTarget::impactScore).reversed()
            .thenComparing(t -> t.player().identityKey()));
        List<WaiverTarget> ranked = new ArrayList<>();
        for (int i = 0; i < Math.min(count, targets.size()); i++) {
            ranked.add(targets.get(i).withRank(i + 1));
        }

        List<String> warnings = new ArrayList<>();
        if (unknown > 0) {
            warnings.add(unknown + " waiver candidate(s) have no provider projection; replacement-level values used");
        }
        long open = without.assignments().stream().filter(SlotAssignment::isEmpty).count();
        if (open > 0) {
            warnings.add("Current roster leaves " + open + " starting slot(s) empty");
        }
        return new WaiverRanking(profile.name(), currentPoints, ranked, warnings);
    }

    static double upsideFactor(ScoredPlayer p) {
        double projection = p.adjustedProjection();
        return projection > 0 ? Math.min(p.ceiling() / projection, MAX_UPSIDE) : 1.0;
    }

    static double consistencyFactor(ScoredPlayer p) {
        double projection = p.adjustedProjection();
        return projection > 0 ? Math.max(p.floor() / projection, MIN_CONSISTENCY) : 1.0;
    }

    static double startingPoints(LineupResult lineup) {
        return lineup.assignments().stream()
            .filter(a -> !a.isEmpty())
            .mapToDouble(a -> a.player().adjustedProjection())
            .sum();
    }

    private static Set<ScoredPlayer> starters(LineupResult lineup) {
        Set<ScoredPlayer> set = Collections.newSetFromMap(new IdentityHashMap<>());
        lineup.assignments().stream().filter(a -> !a.isEmpty()).forEach(a -> set.add(a.player()));
        return set;
    }

    private static String slotOf(LineupResult lineup, ScoredPlayer candidate) {
        return lineup.assignments().stream()
            .filter(a -> a.player() == candidate)
            .map(a -> a.slot().label())
            .findFirst()
            .orElse(null);
    }

    private static String displaced(Set<ScoredPlayer> before, Set<ScoredPlayer> after) {
        return before.stream()
            .filter(p -> !after.contains(p))
            .map(ScoredPlayer::name)
            .sorted()
            .findFirst()
            .orElse(null);
    }

    private static String reasoning(ScoredPlayer candidate, double improvement, double upside, double consistency,
                                    String slot, String replaces) {
        StringBuilder sb = new StringBuilder(String.format(Locale.ROOT,
            "Projected %+.1f point improvement, %.1fx upside, %.1fx consistency", improvement, upside, consistency));
        if (candidate.onBye()) {
            sb.append("; on bye this week");
        } else if (slot == null) {
            sb.append("; would not start this week");
        } else if (replaces == null) {
            sb.append("; fills open ").append(slot).append(" slot");
        } else {
            sb.append("; starts at ").append(slot).append(" over ").append(replaces);
        }
        if (!candidate.projection().known()) {
            sb.append(" (low data confidence)");
        }
        return sb.toString();
    }
}
