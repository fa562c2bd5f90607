package com.lineupadvisor.common.lineup;

import com.lineupadvisor.common.model.PlayerFlag;
import com.lineupadvisor.common.model.ScoredPlayer;
import com.lineupadvisor.common.model.SlotAssignment;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Start/sit advice derived from a finished assignment. Pure text generation; never changes
 * the lineup.
 */
final class LineupRecommendations {

    static final double BENCH_MATCHUP_ALERT = 85.0;
    static final double BENCH_COMPOSITE_ALERT = 70.0;
    static final double TRENDING_ADDS_ALERT = 10_000.0;

    private LineupRecommendations() {}

    static List<String> generate(List<SlotAssignment> assignments, List<ScoredPlayer> bench) {
        List<String> out = new ArrayList<>();
        List<ScoredPlayer> starters = assignments.stream()
            .filter(a -> !a.isEmpty())
            .map(SlotAssignment::player)
            .toList();

        // ── Bench alerts ───────────────────────────────────────────
        for (ScoredPlayer p : bench) {
            if (p.onBye()) {
                continue;
            }
            if (p.tier().isStarterLock()) {
                out.add(p.name() + " (" + p.tier() + ") on bench! Must start regardless of matchup");
            } else if (p.matchup().known() && p.matchup().score() >= BENCH_MATCHUP_ALERT
                       && p.compositeScore() > BENCH_COMPOSITE_ALERT) {
                out.add(p.name() + " on bench has ELITE matchup vs " + opponent(p) + " - consider starting");
            }
        }

        // ── Starter matchups ───────────────────────────────────────
        for (ScoredPlayer p : starters) {
            if (p.onBye()) {
                out.add(p.name() + " is on bye - replace before kickoff");
                continue;
            }
            if (p.matchup().known()) {
                double m = p.matchup().score();
                if (p.tier().isStarterLock() && m <= 30) {
                    out.add(p.name() + " is " + p.tier() + " - starting despite tough matchup vs " + opponent(p));
                } else if (!p.tier().isStarterLock() && m <= 20) {
                    out.add(String.format(Locale.ROOT,
                        "%s faces tough matchup vs %s (score: %.0f/100) - consider alternatives",
                        p.name(), opponent(p), m));
                }
            }
            if (p.hasFlag(PlayerFlag.REST_RISK)) {
                out.add(p.name() + " may be rested: " + p.signals().team() + " has clinched");
            }
        }

        // ── Trending bench players ─────────────────────────────────
        for (ScoredPlayer p : bench) {
            Double delta = p.signals().trendingDelta();
            if (delta != null && delta > TRENDING_ADDS_ALERT) {
                out.add(String.format(Locale.ROOT, "%s is trending (%,.0f adds) - monitor for breakout", p.name(), delta));
            }
        }

        // ── Best matchup ───────────────────────────────────────────
        Optional<ScoredPlayer> best = starters.stream()
            .filter(p -> !p.onBye() && p.matchup().known())
            .max(Comparator.comparingDouble(p -> p.matchup().score()));
        best.filter(p -> p.matchup().score() >= 80).ifPresent(p -> {
            if (p.tier().isStarterLock()) {
                out.add("SMASH PLAY: " + p.name() + " (" + p.tier().label() + ") vs " + opponent(p)
                    + " - elite player + elite matchup!");
            } else {
                out.add(String.format(Locale.ROOT, "Great matchup: %s vs %s (matchup score: %.0f/100)",
                    p.name(), opponent(p), p.matchup().score()));
            }
        });
        return out;
    }

    private static String opponent(ScoredPlayer p) {
        String opp = p.signals().opponent();
        return opp == null || opp.isBlank() ? "opponent" : opp;
    }
}
