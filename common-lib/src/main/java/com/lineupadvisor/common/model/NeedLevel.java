package com.lineupadvisor.common.model;

/**
 * How badly a drafting roster still needs a position. Each level carries its fixed
 * need adjustment in rank-score points.
 */
public enum NeedLevel {
    CRITICAL(10.0),
    HIGH(7.5),
    MEDIUM(5.0),
    LOW(2.5),
    SATURATED(0.0);

    private final double adjustment;

    NeedLevel(double adjustment) {
        this.adjustment = adjustment;
    }

    public double adjustment() {
        return adjustment;
    }
}
