package com.lineupadvisor.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The week being scored.
 *
 * @param season        season year
 * @param week          week number 1..18
 * @param clinchedTeams teams that have already secured a playoff seed (upper-case abbreviations)
 */
public record ScoringPeriod(
    @JsonProperty("season") int season,
    @JsonProperty("week") int week,
    @JsonProperty("clinchedTeams") Set<String> clinchedTeams
) {
    public ScoringPeriod {
        clinchedTeams = clinchedTeams == null
            ? Set.of()
            : clinchedTeams.stream()
                .filter(t -> t != null && !t.isBlank())
                .map(t -> t.trim().toUpperCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    public static ScoringPeriod of(int season, int week) {
        return new ScoringPeriod(season, week, Set.of());
    }

    public boolean hasClinched(String team) {
        return team != null && clinchedTeams.contains(team.toUpperCase(Locale.ROOT));
    }
}
