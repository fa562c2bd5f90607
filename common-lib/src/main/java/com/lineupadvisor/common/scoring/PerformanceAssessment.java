package com.lineupadvisor.common.scoring;

import com.lineupadvisor.common.model.PlayerFlag;

import java.util.List;

/**
 * Recent-form verdict for one player.
 *
 * @param flags              performance flags in evaluation order
 * @param adjustedProjection projection after blending in recent form, in points
 * @param recentAverage      mean of the games used, {@code null} when none were usable
 * @param gamesUsed          number of positive-point games considered (at most three)
 * @param context            one-line explanation of the adjustment
 */
public record PerformanceAssessment(
    List<PlayerFlag> flags,
    double adjustedProjection,
    Double recentAverage,
    int gamesUsed,
    String context
) {
    public PerformanceAssessment {
        flags = List.copyOf(flags);
    }
}
