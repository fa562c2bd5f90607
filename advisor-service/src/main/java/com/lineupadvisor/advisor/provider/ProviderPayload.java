package com.lineupadvisor.advisor.provider;

import com.lineupadvisor.common.model.RecentGame;

import java.util.List;

/**
 * What one provider knows about one player. Every field is optional; {@code null} means the
 * provider did not supply it.
 */
public record ProviderPayload(
    Double projection,
    Double matchupRank,
    Double trendingDelta,
    String opponent,
    Integer byeWeek,
    List<RecentGame> recentGames
) {
    public ProviderPayload {
        recentGames = recentGames == null ? List.of() : List.copyOf(recentGames);
    }

    public static ProviderPayload projection(double points) {
        return new ProviderPayload(points, null, null, null, null, List.of());
    }
}
