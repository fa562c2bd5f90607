package com.lineupadvisor.common.draft;

import com.lineupadvisor.common.bye.ByeWeekResolver;
import com.lineupadvisor.common.model.DraftPosition;
import com.lineupadvisor.common.model.DraftRanking;
import com.lineupadvisor.common.model.DraftRankingEntry;
import com.lineupadvisor.common.model.DraftState;
import com.lineupadvisor.common.model.NeedLevel;
import com.lineupadvisor.common.model.NormalizedProjection;
import com.lineupadvisor.common.model.PlayerSignals;
import com.lineupadvisor.common.model.Position;
import com.lineupadvisor.common.model.RosterNeed;
import com.lineupadvisor.common.position.PositionBaselines;
import com.lineupadvisor.common.signal.SignalNormalizer;
import com.lineupadvisor.common.strategy.DraftWeights;
import com.lineupadvisor.common.strategy.StrategyProfile;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalInt;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Ranks available players for the next pick.
 *
 * <h3>Components (rank-score points)</h3>
 * <pre>
 *   vor       = projection − baseline(position)            unknown projection → 0
 *   scarcity  = 10 × draftScarcity(position) × 4 / (4 + highValueRemaining)
 *               highValueRemaining = available players at the position with vor &gt; 0
 *   need      = CRITICAL 10 | HIGH 7.5 | MEDIUM 5 | LOW 2.5 | SATURATED 0
 *   rankScore = w_vor × vor + w_scarcity × scarcity + w_need × need
 * </pre>
 * Sorted by rank score descending; exact ties keep a stable order by player identity
 * (id, else name/team/position). The list is capped at the requested count.
 */
public final class DraftRanker {

    static final double SCARCITY_SCALE = 10.0;
    static final double SCARCITY_POOL_DAMPING = 4.0;
    static final int BYE_CLUSTER_SIZE = 3;

    private final PositionBaselines baselines;
    private final ByeWeekResolver byeWeeks;

    public DraftRanker(PositionBaselines baselines, ByeWeekResolver byeWeeks) {
        this.baselines = baselines;
        this.byeWeeks = byeWeeks;
    }

    public DraftRanking rank(DraftState state, StrategyProfile profile) {
        DraftPosition position = DraftPosition.snake(state.currentPick(), state.teams());
        List<RosterNeed> needs = RosterNeedAnalyzer.analyze(state.roster(), baselines);
        Map<Position, NeedLevel> needByPosition = new EnumMap<>(Position.class);
        needs.forEach(n -> needByPosition.put(n.position(), n.level()));

        // ── Projections & high-value counts ────────────────────────
        List<NormalizedProjection> projections = new ArrayList<>(state.available().size());
        Map<Position, Integer> highValue = new EnumMap<>(Position.class);
        for (PlayerSignals p : state.available()) {
            NormalizedProjection proj = SignalNormalizer.normalize(p.projections(), p.position(), baselines);
            projections.add(proj);
            if (proj.known() && proj.providerAverage() - baselines.baseline(p.position()) > 0) {
                highValue.merge(p.position(), 1, Integer::sum);
            }
        }

        // ── Entries ────────────────────────────────────────────────
        DraftWeights w = profile.draft();
        List<DraftRankingEntry> entries = new ArrayList<>();
        int unknown = 0;
        for (int i = 0; i < state.available().size(); i++) {
            PlayerSignals p = state.available().get(i);
            NormalizedProjection proj = projections.get(i);
            double baseline = baselines.baseline(p.position());
            double projected = proj.averageOr(baseline);
            double vor = proj.known() ? projected - baseline : 0.0;
            int remaining = highValue.getOrDefault(p.position(), 0);
            double scarcity = scarcityAdjustment(baselines.get(p.position()).draftScarcity(), remaining);
            NeedLevel needLevel = needByPosition.get(p.position());
            double need = needLevel.adjustment();
            double score = w.vor() * vor + w.scarcity() * scarcity + w.need() * need;
            if (!proj.known()) {
                unknown++;
            }
            entries.add(new DraftRankingEntry(p, projected, vor, scarcity, need, score, 0,
                reasoning(p, proj.known(), vor, remaining, needLevel)));
        }

        entries.sort(Comparator.comparingDouble(DraftRankingEntry::rankScore).reversed()
            .thenComparing(e -> e.player().identityKey()));
        List<DraftRankingEntry> ranked = new ArrayList<>();
        for (int i = 0; i < Math.min(state.count(), entries.size()); i++) {
            ranked.add(entries.get(i).withRank(i + 1));
        }

        // ── Context ────────────────────────────────────────────────
        List<String> warnings = new ArrayList<>();
        if (unknown > 0) {
            warnings.add(unknown + " available player(s) have no provider projection; VOR set to 0 (low data confidence)");
        }
        byeClusters(state.roster()).forEach((week, count) ->
            warnings.add("Bye week clustering detected: " + count + " rostered players share week " + week
                + " - diversify bye weeks"));

        return new DraftRanking(profile.name(), position, position.phase(), ranked, needs,
            insights(position, needs), warnings);
    }

    public static double scarcityAdjustment(double baseScarcity, int highValueRemaining) {
        return SCARCITY_SCALE * baseScarcity * SCARCITY_POOL_DAMPING
            / (SCARCITY_POOL_DAMPING + Math.max(0, highValueRemaining));
    }

    /** Bye weeks shared by at least {@value #BYE_CLUSTER_SIZE} rostered players. */
    Map<Integer, Integer> byeClusters(List<PlayerSignals> roster) {
        Map<Integer, Integer> perWeek = new TreeMap<>();
        for (PlayerSignals p : roster) {
            OptionalInt bye = byeWeeks.resolve(p.team(), p.reportedByeWeek());
            bye.ifPresent(week -> perWeek.merge(week, 1, Integer::sum));
        }
        perWeek.values().removeIf(count -> count < BYE_CLUSTER_SIZE);
        return perWeek;
    }

    static List<String> insights(DraftPosition position, List<RosterNeed> needs) {
        List<String> out = new ArrayList<>();
        switch (position.phase()) {
            case "early" -> {
                out.add("Early draft: prioritize best player available and elite tier players");
                out.add("Don't reach for positional needs yet");
            }
            case "middle" -> {
                out.add("Mid draft: balance positional needs with player value");
                out.add("Look for value players that fell in tier");
            }
            default -> {
                out.add("Late draft: focus on upside players and bye week management");
                out.add("Stream K/DEF - don't draft too early");
            }
        }
        String critical = needs.stream()
            .filter(n -> n.level() == NeedLevel.CRITICAL)
            .map(n -> n.position().name())
            .collect(Collectors.joining(", "));
        if (!critical.isEmpty()) {
            out.add("Critical needs: " + critical);
        }
        out.add(String.format(Locale.ROOT, "Round %d, pick %d: next pick in %d",
            position.round(), position.pickInRound(), position.picksUntilNext()));
        return out;
    }

    private static String reasoning(PlayerSignals p, boolean known, double vor, int remaining, NeedLevel need) {
        if (!known) {
            return "No projection available, VOR 0 (low data confidence); " + p.position() + " need " + need;
        }
        return String.format(Locale.ROOT, "VOR %+.1f over %s replacement; %d %s above replacement left; need %s",
            vor, p.position(), remaining, p.position(), need);
    }
}
