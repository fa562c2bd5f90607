package com.lineupadvisor.common.position;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.lineupadvisor.common.model.Tier;

/**
 * Projection cut-offs (points) for one position. A projection at or above {@code elite} is
 * ELITE, at or above {@code stud} STUD, and so on; below {@code flex} it is BENCH.
 */
public record TierThresholds(
    @JsonProperty("elite") double elite,
    @JsonProperty("stud") double stud,
    @JsonProperty("solid") double solid,
    @JsonProperty("flex") double flex
) {
    public Tier classify(double projection) {
        if (projection >= elite) return Tier.ELITE;
        if (projection >= stud) return Tier.STUD;
        if (projection >= solid) return Tier.SOLID;
        if (projection >= flex) return Tier.FLEX;
        return Tier.BENCH;
    }

    boolean isOrdered() {
        return elite >= stud && stud >= solid && solid >= flex && flex >= 0;
    }
}
