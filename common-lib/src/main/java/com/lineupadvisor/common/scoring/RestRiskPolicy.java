package com.lineupadvisor.common.scoring;

import com.lineupadvisor.common.model.ScoringPeriod;

import java.util.Set;

/**
 * Late-season starters on teams that have clinched may be rested. In a rest-risk week, a
 * player whose team has clinched has composite and adjusted projection multiplied by
 * {@code factor}.
 *
 * @param weeks  weeks in which the policy applies
 * @param factor multiplier in (0, 1]
 */
public record RestRiskPolicy(Set<Integer> weeks, double factor) {

    public static final double DEFAULT_FACTOR = 0.85;

    public RestRiskPolicy {
        weeks = weeks == null ? Set.of() : Set.copyOf(weeks);
        if (!(factor > 0 && factor <= 1)) {
            throw new IllegalArgumentException("rest-risk factor must be in (0, 1], got " + factor);
        }
    }

    public static RestRiskPolicy defaults() {
        return new RestRiskPolicy(Set.of(17, 18), DEFAULT_FACTOR);
    }

    public boolean applies(ScoringPeriod period, String team) {
        return period != null && weeks.contains(period.week()) && period.hasClinched(team);
    }
}
