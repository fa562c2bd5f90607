package com.lineupadvisor.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Validated raw signals for one player and one scoring period.
 *
 * <p>Built by the service's payload parser; every field other than identity may be absent.
 * Provider projections are copied into a {@link TreeMap} so that iteration order (and
 * therefore every derived number) is independent of the order providers responded in.
 *
 * @param playerId        provider-neutral identifier, may be {@code null}
 * @param name            display name
 * @param position        canonical position
 * @param team            team abbreviation, upper case
 * @param opponent        opponent abbreviation with any "@" stripped, may be {@code null}
 * @param projections     provider name → projected points; absent providers are simply missing
 * @param matchupRank     opponent difficulty rank 1..32 (higher = harder), {@code null} if unknown
 * @param trendingDelta   recent ownership adds minus drops, {@code null} if unknown
 * @param recentGames     completed periods, any order
 * @param reportedByeWeek bye week as reported by a provider, already parsed; validity is
 *                        decided by {@code ByeWeekResolver}
 */
public record PlayerSignals(
    @JsonProperty("playerId") String playerId,
    @JsonProperty("name") String name,
    @JsonProperty("position") Position position,
    @JsonProperty("team") String team,
    @JsonProperty("opponent") String opponent,
    @JsonProperty("projections") Map<String, Double> projections,
    @JsonProperty("matchupRank") Double matchupRank,
    @JsonProperty("trendingDelta") Double trendingDelta,
    @JsonProperty("recentGames") List<RecentGame> recentGames,
    @JsonProperty("reportedByeWeek") Integer reportedByeWeek
) {
    public PlayerSignals {
        projections = projections == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new TreeMap<>(projections));
        recentGames = recentGames == null ? List.of() : List.copyOf(recentGames);
    }

    public static PlayerSignals of(String name, Position position, String team,
                                   Map<String, Double> projections) {
        return new PlayerSignals(null, name, position, team, null, projections,
            null, null, List.of(), null);
    }

    public PlayerSignals withMatchupRank(Double rank) {
        return new PlayerSignals(playerId, name, position, team, opponent, projections,
            rank, trendingDelta, recentGames, reportedByeWeek);
    }

    public PlayerSignals withTrendingDelta(Double delta) {
        return new PlayerSignals(playerId, name, position, team, opponent, projections,
            matchupRank, delta, recentGames, reportedByeWeek);
    }

    public PlayerSignals withRecentGames(List<RecentGame> games) {
        return new PlayerSignals(playerId, name, position, team, opponent, projections,
            matchupRank, trendingDelta, games, reportedByeWeek);
    }

    public PlayerSignals withOpponent(String opp) {
        return new PlayerSignals(playerId, name, position, team, opp, projections,
            matchupRank, trendingDelta, recentGames, reportedByeWeek);
    }

    public PlayerSignals withReportedByeWeek(Integer week) {
        return new PlayerSignals(playerId, name, position, team, opponent, projections,
            matchupRank, trendingDelta, recentGames, week);
    }

    public PlayerSignals withProjections(Map<String, Double> merged) {
        return new PlayerSignals(playerId, name, position, team, opponent, merged,
            matchupRank, trendingDelta, recentGames, reportedByeWeek);
    }

    /**
     * Stable identity used for deterministic tie-breaking: id when present, else name/team/position.
     */
    @JsonIgnore
    public String identityKey() {
        if (playerId != null && !playerId.isBlank()) {
            return playerId;
        }
        return name + "|" + team + "|" + position;
    }
}
