package com.lineupadvisor.common.model;

import java.util.Locale;

/**
 * Ordered classification bucket, best first. Declaration order is the ranking order
 * and is relied on by the tier-multiplier validation in {@code StrategyProfile}.
 */
public enum Tier {
    ELITE,
    STUD,
    SOLID,
    FLEX,
    BENCH;

    public boolean isStarterLock() {
        return this == ELITE || this == STUD;
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
