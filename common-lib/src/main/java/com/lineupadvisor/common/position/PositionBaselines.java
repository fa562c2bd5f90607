package com.lineupadvisor.common.position;

import com.lineupadvisor.common.exception.ConfigurationException;
import com.lineupadvisor.common.model.Position;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Per-position constant table: replacement baselines, normalization ranges, scarcity,
 * tier cut-offs and draft roster requirements.
 *
 * <p>Every {@link Position} must be present. Validation runs on construction and throws
 * {@link ConfigurationException}; the table is immutable afterwards and shared process-wide.
 *
 * <h3>Defaults</h3>
 * <pre>
 *        baseline  max  scarcity  draft  mean  std   tiers (elite/stud/solid/flex)  roster
 *   QB   15        30   1.00      1.0    18    6.0   22/18/15/12                    1/2/3
 *   RB    8        25   1.00      1.3    11    5.0   18/14/10/7                     2/5/7
 *   WR    7        22   0.95      1.1    10    4.5   16/12/9/6                      2/5/7
 *   TE    5        18   1.05      1.5     7    3.5   12/9/6/4                       1/2/3
 *   K     6        12   0.80      0.8     8    3.0   10/8/6/5                       1/1/2
 *   DEF   6        12   0.90      0.9     8    4.0   10/8/6/4                       1/1/2
 * </pre>
 */
public final class PositionBaselines {

    private final Map<Position, PositionProfile> profiles;

    public PositionBaselines(Map<Position, PositionProfile> profiles) {
        this(profiles, "position-baselines");
    }

    public PositionBaselines(Map<Position, PositionProfile> profiles, String source) {
        if (profiles == null) {
            throw new ConfigurationException(source, "baseline table is missing");
        }
        EnumMap<Position, PositionProfile> copy = new EnumMap<>(Position.class);
        for (Position position : Position.values()) {
            PositionProfile p = profiles.get(position);
            if (p == null) {
                throw new ConfigurationException(source, "missing entry for position " + position);
            }
            validate(source, position, p);
            copy.put(position, p);
        }
        this.profiles = Collections.unmodifiableMap(copy);
    }

    public static PositionBaselines defaults() {
        Map<Position, PositionProfile> m = new EnumMap<>(Position.class);
        m.put(Position.QB, new PositionProfile(15, 30, 1.00, 1.0, 18, 6.0,
            new TierThresholds(22, 18, 15, 12), new RosterRequirement(1, 2, 3)));
        m.put(Position.RB, new PositionProfile(8, 25, 1.00, 1.3, 11, 5.0,
            new TierThresholds(18, 14, 10, 7), new RosterRequirement(2, 5, 7)));
        m.put(Position.WR, new PositionProfile(7, 22, 0.95, 1.1, 10, 4.5,
            new TierThresholds(16, 12, 9, 6), new RosterRequirement(2, 5, 7)));
        m.put(Position.TE, new PositionProfile(5, 18, 1.05, 1.5, 7, 3.5,
            new TierThresholds(12, 9, 6, 4), new RosterRequirement(1, 2, 3)));
        m.put(Position.K, new PositionProfile(6, 12, 0.80, 0.8, 8, 3.0,
            new TierThresholds(10, 8, 6, 5), new RosterRequirement(1, 1, 2)));
        m.put(Position.DEF, new PositionProfile(6, 12, 0.90, 0.9, 8, 4.0,
            new TierThresholds(10, 8, 6, 4), new RosterRequirement(1, 1, 2)));
        return new PositionBaselines(m, "defaults");
    }

    private static void validate(String source, Position position, PositionProfile p) {
        if (!Double.isFinite(p.baseline()) || p.baseline() < 0) {
            throw new ConfigurationException(source, position + ": baseline must be a non-negative number");
        }
        if (!(p.normalizationMax() > 0)) {
            throw new ConfigurationException(source, position + ": normalizationMax must be positive");
        }
        if (!(p.scarcity() > 0) || !(p.draftScarcity() > 0)) {
            throw new ConfigurationException(source, position + ": scarcity multipliers must be positive");
        }
        if (!(p.stdDev() > 0)) {
            throw new ConfigurationException(source, position + ": stdDev must be positive");
        }
        if (p.tiers() == null || !p.tiers().isOrdered()) {
            throw new ConfigurationException(source, position + ": tier thresholds must be non-negative and descending");
        }
        if (p.roster() == null || !p.roster().isOrdered()) {
            throw new ConfigurationException(source, position + ": roster requirement must satisfy starters <= optimal <= maxUseful");
        }
    }

    public PositionProfile get(Position position) {
        return profiles.get(position);
    }

    public double baseline(Position position) {
        return profiles.get(position).baseline();
    }

    public Map<Position, PositionProfile> all() {
        return profiles;
    }
}
