package com.lineupadvisor.common.scoring;

/**
 * Outcome range for one player.
 *
 * @param floor       low-end outcome in points, never negative
 * @param ceiling     high-end outcome in points
 * @param consistency 0 (boom/bust) .. 100 (steady); 50 without enough history
 */
public record Volatility(double floor, double ceiling, double consistency) {

    public static final double DEFAULT_CONSISTENCY = 50.0;

    public static Volatility none() {
        return new Volatility(0.0, 0.0, DEFAULT_CONSISTENCY);
    }
}
