package com.lineupadvisor.common.strategy;

import com.lineupadvisor.common.exception.ConfigurationException;
import com.lineupadvisor.common.model.Tier;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Immutable registry of loaded {@link StrategyProfile}s, looked up case-insensitively.
 *
 * <h3>Built-in profiles</h3>
 * <pre>
 *                 proj   matchup  trend  momentum   risk      draft (vor/scarcity/need)
 *   balanced      0.80   0.10     0.05   0.05       NEUTRAL   0.40 / 0.30 / 0.30
 *   conservative  0.70   0.20     0.05   0.05       FLOOR     0.50 / 0.25 / 0.25
 *   aggressive    0.40   0.35     0.15   0.10       CEILING   0.30 / 0.40 / 0.30
 * </pre>
 * All three share the tier multipliers ELITE 3.0, STUD 2.0, SOLID 1.3, FLEX 1.0, BENCH 0.5.
 */
public final class StrategyProfiles {

    public static final String DEFAULT_PROFILE = "balanced";

    private final Map<String, StrategyProfile> byName;

    public StrategyProfiles(Collection<StrategyProfile> profiles) {
        Map<String, StrategyProfile> map = new LinkedHashMap<>();
        for (StrategyProfile p : profiles) {
            String key = p.name().toLowerCase(Locale.ROOT);
            if (map.putIfAbsent(key, p) != null) {
                throw new ConfigurationException("strategy", "duplicate profile name " + p.name());
            }
        }
        if (map.isEmpty()) {
            throw new ConfigurationException("strategy", "no strategy profiles configured");
        }
        this.byName = Collections.unmodifiableMap(map);
    }

    public static StrategyProfiles defaults() {
        return new StrategyProfiles(List.of(
            new StrategyProfile("balanced", "Projection-led with light matchup and trend input",
                new BlendWeights(0.80, 0.10, 0.05, 0.05), RiskDirection.NEUTRAL,
                defaultTierMultipliers(), new DraftWeights(0.40, 0.30, 0.30)),
            new StrategyProfile("conservative", "Floor-focused, favours safe matchups and proven value",
                new BlendWeights(0.70, 0.20, 0.05, 0.05), RiskDirection.FLOOR,
                defaultTierMultipliers(), new DraftWeights(0.50, 0.25, 0.25)),
            new StrategyProfile("aggressive", "Ceiling-focused, chases matchups, trends and scarcity",
                new BlendWeights(0.40, 0.35, 0.15, 0.10), RiskDirection.CEILING,
                defaultTierMultipliers(), new DraftWeights(0.30, 0.40, 0.30))
        ));
    }

    public static Map<Tier, Double> defaultTierMultipliers() {
        Map<Tier, Double> m = new EnumMap<>(Tier.class);
        m.put(Tier.ELITE, 3.0);
        m.put(Tier.STUD, 2.0);
        m.put(Tier.SOLID, 1.3);
        m.put(Tier.FLEX, 1.0);
        m.put(Tier.BENCH, 0.5);
        return m;
    }

    /**
     * @throws IllegalArgumentException for an unknown name; {@code null} or blank selects the default
     */
    public StrategyProfile get(String name) {
        String key = (name == null || name.isBlank() ? DEFAULT_PROFILE : name.trim()).toLowerCase(Locale.ROOT);
        StrategyProfile profile = byName.get(key);
        if (profile == null) {
            throw new IllegalArgumentException("Unknown strategy '" + name + "', expected one of " + byName.keySet());
        }
        return profile;
    }

    public Collection<StrategyProfile> all() {
        return byName.values();
    }
}
