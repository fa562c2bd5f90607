package com.lineupadvisor.common.draft;

import com.lineupadvisor.common.model.NeedLevel;
import com.lineupadvisor.common.model.PlayerSignals;
import com.lineupadvisor.common.model.Position;
import com.lineupadvisor.common.model.RosterNeed;
import com.lineupadvisor.common.position.PositionBaselines;
import com.lineupadvisor.common.position.RosterRequirement;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Need level per position from the drafted roster.
 *
 * <pre>
 *   have = 0            → CRITICAL
 *   have &lt; starters     → HIGH
 *   have &lt; optimal      → MEDIUM
 *   have &lt; maxUseful    → LOW
 *   otherwise           → SATURATED
 * </pre>
 */
public final class RosterNeedAnalyzer {

    private RosterNeedAnalyzer() {}

    public static List<RosterNeed> analyze(Collection<PlayerSignals> roster, PositionBaselines baselines) {
        Map<Position, Integer> counts = new EnumMap<>(Position.class);
        for (PlayerSignals p : roster) {
            counts.merge(p.position(), 1, Integer::sum);
        }
        List<RosterNeed> needs = new ArrayList<>();
        for (Position position : Position.values()) {
            RosterRequirement req = baselines.get(position).roster();
            int have = counts.getOrDefault(position, 0);
            needs.add(new RosterNeed(position, have, req.starters(), req.optimal(), req.maxUseful(),
                level(have, req)));
        }
        return needs;
    }

    static NeedLevel level(int have, RosterRequirement req) {
        if (have == 0) return NeedLevel.CRITICAL;
        if (have < req.starters()) return NeedLevel.HIGH;
        if (have < req.optimal()) return NeedLevel.MEDIUM;
        if (have < req.maxUseful()) return NeedLevel.LOW;
        return NeedLevel.SATURATED;
    }
}
