package com.lineupadvisor.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Every derived value for one player in one request. Produced only by {@code CompositeScorer}.
 *
 * <p>Two scores coexist and answer different questions:
 * <ul>
 *   <li>{@code compositeScore}: blended 0..100 signal, tier-multiplied; used for tier and
 *       intra-position ranking.</li>
 *   <li>{@code flexValue}: position-relative points ({@code (VOR × scarcity × 0.3) + (projection × 0.7)});
 *       used when players of different positions compete for one flexible slot.</li>
 * </ul>
 */
public record ScoredPlayer(
    @JsonProperty("signals") PlayerSignals signals,
    @JsonProperty("projection") NormalizedProjection projection,
    @JsonProperty("adjustedProjection") double adjustedProjection,
    @JsonProperty("matchup") MatchupScore matchup,
    @JsonProperty("trendingScore") double trendingScore,
    @JsonProperty("momentumScore") double momentumScore,
    @JsonProperty("flexValue") double flexValue,
    @JsonProperty("tier") Tier tier,
    @JsonProperty("blendedScore") double blendedScore,
    @JsonProperty("compositeScore") double compositeScore,
    @JsonProperty("floor") double floor,
    @JsonProperty("ceiling") double ceiling,
    @JsonProperty("consistency") double consistency,
    @JsonProperty("onBye") boolean onBye,
    @JsonProperty("flags") List<PlayerFlag> flags,
    @JsonProperty("recommendation") String recommendation,
    @JsonProperty("reasoning") String reasoning
) {
    private static final Set<PlayerFlag> DATA_GAP_FLAGS = EnumSet.of(
        PlayerFlag.LOW_DATA_CONFIDENCE, PlayerFlag.PROJECTION_UNKNOWN, PlayerFlag.MATCHUP_UNKNOWN);

    public ScoredPlayer {
        flags = flags == null ? List.of() : List.copyOf(flags);
    }

    @JsonIgnore
    public String name() {
        return signals.name();
    }

    @JsonIgnore
    public Position position() {
        return signals.position();
    }

    public boolean hasFlag(PlayerFlag flag) {
        return flags.contains(flag);
    }

    /**
     * Number of missing-data annotations; fewer is preferred when breaking ties. An unknown
     * trending signal is flagged but not counted.
     */
    @JsonIgnore
    public int dataGapCount() {
        return (int) flags.stream().filter(DATA_GAP_FLAGS::contains).count();
    }

    @JsonIgnore
    public String label() {
        return signals.name() + " (" + signals.position() + ", " + signals.team() + ")";
    }
}
