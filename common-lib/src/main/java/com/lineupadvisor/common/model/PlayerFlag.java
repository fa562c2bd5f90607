package com.lineupadvisor.common.model;

/**
 * Qualitative annotations attached to a scored player. Flags never change a score on their
 * own; the only flag-driven numeric effects are the adjusted-projection blend, the bye zeroing
 * and the rest-risk reduction, each applied by {@code CompositeScorer}.
 */
public enum PlayerFlag {
    ON_BYE("on bye"),
    BREAKOUT_CANDIDATE("breakout candidate"),
    TRENDING_UP("trending up"),
    DECLINING_ROLE("declining role"),
    UNDERPERFORMING("underperforming"),
    HIGH_CEILING("high ceiling"),
    CONSISTENT("consistent"),
    MATCHUP_UNKNOWN("matchup unknown"),
    TRENDING_UNKNOWN("trending unknown"),
    PROJECTION_UNKNOWN("projection unknown"),
    LOW_DATA_CONFIDENCE("low data confidence"),
    REST_RISK("possible rest risk");

    private final String label;

    PlayerFlag(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
