package com.lineupadvisor.advisor.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Body of {@code POST /api/v1/lineup}. Either {@code template} or {@code slots} selects the
 * roster layout; {@code players} is a loose provider payload array.
 */
public record LineupRequest(
    String strategy,
    Integer season,
    Integer week,
    List<String> clinchedTeams,
    String template,
    List<String> slots,
    JsonNode players
) {
}
