package com.lineupadvisor.common.strategy;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.lineupadvisor.common.exception.ConfigurationException;
import com.lineupadvisor.common.model.Tier;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Named weighting scheme selected per request.
 *
 * <p>Validated on construction; an invalid profile is never renormalized, it is rejected with
 * a {@link ConfigurationException} naming the profile:
 * <ul>
 *   <li>blend weights and draft weights each sum to 1.0 ± {@value #WEIGHT_TOLERANCE}, none negative</li>
 *   <li>a multiplier is present for every {@link Tier} and strictly decreases from ELITE to BENCH</li>
 * </ul>
 */
public record StrategyProfile(
    @JsonProperty("name") String name,
    @JsonProperty("description") String description,
    @JsonProperty("blend") BlendWeights blend,
    @JsonProperty("risk") RiskDirection risk,
    @JsonProperty("tierMultipliers") Map<Tier, Double> tierMultipliers,
    @JsonProperty("draft") DraftWeights draft
) {
    public static final double WEIGHT_TOLERANCE = 1e-6;

    public StrategyProfile {
        String source = "strategy:" + name;
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("strategy", "profile name must not be blank");
        }
        if (blend == null || draft == null || risk == null || tierMultipliers == null) {
            throw new ConfigurationException(source, "blend, draft, risk and tierMultipliers are required");
        }
        if (blend.anyNegative() || Math.abs(blend.sum() - 1.0) > WEIGHT_TOLERANCE) {
            throw new ConfigurationException(source, "blend weights must be non-negative and sum to 1.0, got " + blend.sum());
        }
        if (draft.anyNegative() || Math.abs(draft.sum() - 1.0) > WEIGHT_TOLERANCE) {
            throw new ConfigurationException(source, "draft weights must be non-negative and sum to 1.0, got " + draft.sum());
        }

        EnumMap<Tier, Double> copy = new EnumMap<>(Tier.class);
        Double previous = null;
        for (Tier tier : Tier.values()) {
            Double m = tierMultipliers.get(tier);
            if (m == null || !Double.isFinite(m) || m <= 0) {
                throw new ConfigurationException(source, "missing or non-positive multiplier for tier " + tier);
            }
            if (previous != null && m >= previous) {
                throw new ConfigurationException(source,
                    "tier multipliers must strictly decrease, " + tier + "=" + m + " after " + previous);
            }
            copy.put(tier, m);
            previous = m;
        }
        tierMultipliers = Collections.unmodifiableMap(copy);
    }

    public double multiplier(Tier tier) {
        return tierMultipliers.get(tier);
    }
}
