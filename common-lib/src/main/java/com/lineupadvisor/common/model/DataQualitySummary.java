package com.lineupadvisor.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collection;

/**
 * How much real provider data the request had.
 *
 * @param totalPlayers             players considered
 * @param playersWithProjection    players with at least one real provider projection
 * @param playersWithCompleteData  players with projection, matchup and trending inputs
 * @param projectionCoverage       {@code playersWithProjection / totalPlayers}, 0 when empty
 * @param completeCoverage         {@code playersWithCompleteData / totalPlayers}, 0 when empty
 */
public record DataQualitySummary(
    @JsonProperty("totalPlayers") int totalPlayers,
    @JsonProperty("playersWithProjection") int playersWithProjection,
    @JsonProperty("playersWithCompleteData") int playersWithCompleteData,
    @JsonProperty("projectionCoverage") double projectionCoverage,
    @JsonProperty("completeCoverage") double completeCoverage
) {
    public static DataQualitySummary of(Collection<PlayerSignals> players) {
        int total = players.size();
        int withProjection = 0;
        int complete = 0;
        for (PlayerSignals p : players) {
            boolean hasProjection = p.projections().values().stream()
                .anyMatch(v -> v != null && Double.isFinite(v) && v >= 0.0);
            if (hasProjection) {
                withProjection++;
                if (p.matchupRank() != null && p.trendingDelta() != null) {
                    complete++;
                }
            }
        }
        return new DataQualitySummary(total, withProjection, complete,
            total == 0 ? 0.0 : (double) withProjection / total,
            total == 0 ? 0.0 : (double) complete / total);
    }

    /** True when every player had at least one real projection. */
    public boolean isComplete() {
        return totalPlayers > 0 && playersWithProjection == totalPlayers;
    }
}
