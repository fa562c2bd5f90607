package com.lineupadvisor.common.lineup;

import com.lineupadvisor.common.model.DataQualitySummary;
import com.lineupadvisor.common.model.LineupResult;
import com.lineupadvisor.common.model.RosterSlot;
import com.lineupadvisor.common.model.ScoredPlayer;
import com.lineupadvisor.common.model.SlotAssignment;
import com.lineupadvisor.common.strategy.RiskDirection;
import com.lineupadvisor.common.strategy.StrategyProfile;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.IntStream;

/**
 * Fills roster slots from a scored pool. A greedy pass by value, then an augmenting-path pass
 * that guarantees every slot is filled whenever a complete assignment of non-bye players exists.
 * Deterministic for a given input; the total value is not guaranteed globally optimal.
 *
 * <h3>Slot order</h3>
 * <ol>
 *   <li>exact-position slots, in input order</li>
 *   <li>flexible slots by ascending eligibility size (FLEX before SUPERFLEX), input order within a size</li>
 *   <li>everyone left over goes to the bench</li>
 * </ol>
 *
 * <h3>Candidate value</h3>
 * <pre>
 *   exact slot    composite
 *   flexible slot flexValue × 10 + composite × 0.01 + consistencyBonus
 *                   FLOOR   (consistency − 50) × 0.02
 *                   CEILING (50 − consistency) × 0.02
 *                   NEUTRAL (consistency − 50) × 0.01
 * </pre>
 * Values within {@value #EPSILON} tie and fall through to: fewer missing-data flags, then
 * floor / ceiling / consistency by the profile's risk direction, then input order.
 *
 * <p>A slot left open by the greedy pass is filled along a chain of moves: it takes a player from
 * another filled slot, which takes one from a third, and so on until a slot is back-filled from
 * the unassigned pool. A player on bye is only placed when nobody else can fill a required slot,
 * and a warning says so. A slot nobody can fill is kept as an explicit empty assignment with the
 * warning {@code "No eligible player for slot X"}.
 */
public final class LineupAssigner {

    public static final double EPSILON = 1e-9;

    static final double FLEX_VALUE_WEIGHT = 10.0;
    static final double COMPOSITE_WEIGHT = 0.01;

    private LineupAssigner() {}

    public static LineupResult assign(List<ScoredPlayer> pool, List<RosterSlot> slots, StrategyProfile profile) {
        int n = pool.size();
        boolean[] used = new boolean[n];

        List<Integer> order = processingOrder(slots);
        Integer[] filled = new Integer[slots.size()];
        List<String> warnings = new ArrayList<>();

        for (int slotIdx : order) {
            Integer pick = best(pool, used, slots.get(slotIdx), profile, false);
            if (pick != null) {
                used[pick] = true;
                filled[slotIdx] = pick;
            }
        }

        for (int slotIdx : order) {
            if (filled[slotIdx] != null) {
                continue;
            }
            boolean[] visited = new boolean[slots.size()];
            visited[slotIdx] = true;
            Integer pick = augment(pool, used, slots, filled, slotIdx, visited, profile);
            if (pick != null) {
                used[pick] = true;
                filled[slotIdx] = pick;
            }
        }

        for (int slotIdx : order) {
            if (filled[slotIdx] != null) {
                continue;
            }
            RosterSlot slot = slots.get(slotIdx);
            Integer pick = best(pool, used, slot, profile, true);
            if (pick == null) {
                warnings.add("No eligible player for slot " + slot.label());
                continue;
            }
            warnings.add(String.format(Locale.ROOT,
                "%s is on bye but is the only eligible player for slot %s", pool.get(pick).name(), slot.label()));
            used[pick] = true;
            filled[slotIdx] = pick;
        }

        // ── Result assembly ────────────────────────────────────────
        List<SlotAssignment> assignments = new ArrayList<>();
        double total = 0;
        for (int i = 0; i < slots.size(); i++) {
            RosterSlot slot = slots.get(i);
            if (slot.bench()) {
                continue;
            }
            if (filled[i] == null) {
                assignments.add(SlotAssignment.empty(slot));
            } else {
                ScoredPlayer p = pool.get(filled[i]);
                assignments.add(new SlotAssignment(slot, p));
                total += p.compositeScore();
            }
        }

        List<ScoredPlayer> bench = IntStream.range(0, n)
            .filter(i -> !used[i])
            .boxed()
            .sorted(Comparator.<Integer>comparingDouble(i -> pool.get(i).compositeScore()).reversed()
                .thenComparingInt(i -> i))
            .map(pool::get)
            .toList();

        List<ScoredPlayer> startersWithData = assignments.stream()
            .filter(a -> !a.isEmpty())
            .map(SlotAssignment::player)
            .toList();
        long noProjection = startersWithData.stream().filter(p -> !p.projection().known()).count();
        if (noProjection > 0) {
            warnings.add(noProjection + " starter(s) have no provider projection; replacement-level values used");
        }

        DataQualitySummary quality = DataQualitySummary.of(pool.stream().map(ScoredPlayer::signals).toList());
        List<String> recommendations = LineupRecommendations.generate(assignments, bench);
        return new LineupResult(profile.name(), assignments, bench, total, recommendations, warnings, quality);
    }

    // ── Slot ordering ──────────────────────────────────────────────

    static List<Integer> processingOrder(List<RosterSlot> slots) {
        List<Integer> exact = new ArrayList<>();
        List<Integer> flexible = new ArrayList<>();
        for (int i = 0; i < slots.size(); i++) {
            RosterSlot s = slots.get(i);
            if (s.bench()) continue;
            if (s.isExact()) exact.add(i);
            else flexible.add(i);
        }
        flexible.sort(Comparator.<Integer>comparingInt(i -> slots.get(i).eligible().size()).thenComparingInt(i -> i));
        List<Integer> order = new ArrayList<>(exact);
        order.addAll(flexible);
        return order;
    }

    // ── Candidate selection ────────────────────────────────────────

    private static Integer best(List<ScoredPlayer> pool, boolean[] used, RosterSlot slot,
                                StrategyProfile profile, boolean byeOnly) {
        Integer best = null;
        for (int i = 0; i < pool.size(); i++) {
            ScoredPlayer p = pool.get(i);
            if (used[i] || !slot.accepts(p.position()) || p.onBye() != byeOnly) {
                continue;
            }
            if (best == null || compare(p, pool.get(best), slot, profile.risk()) < 0) {
                best = i;
            }
        }
        return best;
    }

    /**
     * Augmenting-path search for an open slot. Returns a player for {@code target}: an unassigned
     * non-bye candidate if one exists, otherwise one taken from another filled slot whose own
     * replacement is found recursively. Slots on the current path are marked in {@code visited}.
     * On success every slot along the path has already been re-filled; {@code null} leaves the
     * assignment untouched.
     */
    private static Integer augment(List<ScoredPlayer> pool, boolean[] used, List<RosterSlot> slots,
                                   Integer[] filled, int target, boolean[] visited, StrategyProfile profile) {
        RosterSlot slot = slots.get(target);
        List<Integer> candidates = IntStream.range(0, pool.size())
            .filter(i -> !pool.get(i).onBye() && slot.accepts(pool.get(i).position()))
            .boxed()
            .sorted((a, b) -> {
                int c = compare(pool.get(a), pool.get(b), slot, profile.risk());
                return c != 0 ? c : Integer.compare(a, b);
            })
            .toList();

        for (int i : candidates) {
            if (!used[i]) {
                return i;
            }
        }
        for (int i : candidates) {
            int holder = holderOf(filled, i);
            if (holder < 0 || visited[holder]) {
                continue;
            }
            visited[holder] = true;
            Integer replacement = augment(pool, used, slots, filled, holder, visited, profile);
            if (replacement != null) {
                used[replacement] = true;
                filled[holder] = replacement;
                return i;
            }
        }
        return null;
    }

    private static int holderOf(Integer[] filled, int player) {
        for (int s = 0; s < filled.length; s++) {
            if (filled[s] != null && filled[s] == player) {
                return s;
            }
        }
        return -1;
    }

    /**
     * Orders two candidates for one slot; negative means {@code a} is preferred. Input order is
     * the caller's final tie-break (the earlier index is kept on a zero result).
     */
    static int compare(ScoredPlayer a, ScoredPlayer b, RosterSlot slot, RiskDirection risk) {
        double va = slotValue(a, slot, risk);
        double vb = slotValue(b, slot, risk);
        if (Math.abs(va - vb) > EPSILON) {
            return Double.compare(vb, va);
        }
        int gaps = Integer.compare(a.dataGapCount(), b.dataGapCount());
        if (gaps != 0) {
            return gaps;
        }
        return switch (risk) {
            case FLOOR -> Double.compare(b.floor(), a.floor());
            case CEILING -> Double.compare(b.ceiling(), a.ceiling());
            case NEUTRAL -> Double.compare(b.consistency(), a.consistency());
        };
    }

    static double slotValue(ScoredPlayer p, RosterSlot slot, RiskDirection risk) {
        if (slot.isExact()) {
            return p.compositeScore();
        }
        return flexScore(p, risk);
    }

    public static double flexScore(ScoredPlayer p, RiskDirection risk) {
        double c = p.consistency();
        double bonus = switch (risk) {
            case FLOOR -> (c - 50) * 0.02;
            case CEILING -> (50 - c) * 0.02;
            case NEUTRAL -> (c - 50) * 0.01;
        };
        return p.flexValue() * FLEX_VALUE_WEIGHT + p.compositeScore() * COMPOSITE_WEIGHT + bonus;
    }
}
