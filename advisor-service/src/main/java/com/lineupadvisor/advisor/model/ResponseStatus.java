package com.lineupadvisor.advisor.model;

/**
 * Outcome of an advisor request. PARTIAL means an answer was produced from incomplete data.
 */
public enum ResponseStatus {
    SUCCESS,
    PARTIAL,
    ERROR
}
