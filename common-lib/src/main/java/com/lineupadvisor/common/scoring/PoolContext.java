package com.lineupadvisor.common.scoring;

import com.lineupadvisor.common.model.NormalizedProjection;
import com.lineupadvisor.common.model.PlayerSignals;
import com.lineupadvisor.common.model.Position;
import com.lineupadvisor.common.position.PositionBaselines;
import com.lineupadvisor.common.position.PositionValueModel;
import com.lineupadvisor.common.position.TierThresholds;
import com.lineupadvisor.common.signal.SignalNormalizer;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Per-request, per-position context derived from the whole player pool: the scarcity
 * multiplier and the tier cut-offs in force this week. Players whose projection is unknown
 * do not contribute.
 */
public final class PoolContext {

    private final Map<Position, Double> scarcity;
    private final Map<Position, TierThresholds> thresholds;

    private PoolContext(Map<Position, Double> scarcity, Map<Position, TierThresholds> thresholds) {
        this.scarcity = scarcity;
        this.thresholds = thresholds;
    }

    public static PoolContext of(Collection<PlayerSignals> players, PositionBaselines baselines) {
        Map<Position, List<Double>> known = new EnumMap<>(Position.class);
        for (PlayerSignals p : players) {
            NormalizedProjection proj = SignalNormalizer.normalize(p.projections(), p.position(), baselines);
            if (proj.known()) {
                known.computeIfAbsent(p.position(), k -> new ArrayList<>()).add(proj.providerAverage());
            }
        }

        Map<Position, Double> scarcity = new EnumMap<>(Position.class);
        Map<Position, TierThresholds> thresholds = new EnumMap<>(Position.class);
        for (Position position : Position.values()) {
            List<Double> pool = known.getOrDefault(position, List.of());
            scarcity.put(position, PositionValueModel.scarcity(position, pool, baselines));
            thresholds.put(position, TierClassifier.thresholds(position, pool, baselines));
        }
        return new PoolContext(Collections.unmodifiableMap(scarcity), Collections.unmodifiableMap(thresholds));
    }

    /** Context with no pool information: base scarcity and fixed cut-offs. */
    public static PoolContext empty(PositionBaselines baselines) {
        return of(List.of(), baselines);
    }

    public double scarcity(Position position) {
        return scarcity.get(position);
    }

    public TierThresholds thresholds(Position position) {
        return thresholds.get(position);
    }
}
