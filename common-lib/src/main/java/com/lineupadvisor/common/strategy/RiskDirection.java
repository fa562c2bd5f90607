package com.lineupadvisor.common.strategy;

/**
 * Which side of a player's outcome distribution a strategy prefers when values tie
 * or when consistency is rewarded in flexible slots.
 */
public enum RiskDirection {
    /** Prefer safe floors and consistent players. */
    FLOOR,
    /** Prefer upside and volatile ceilings. */
    CEILING,
    /** Mild preference for consistency. */
    NEUTRAL
}
