package com.lineupadvisor.advisor.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Body of {@code POST /api/v1/waivers}. {@code roster} is the team's current players,
 * {@code available} the free agents to evaluate; the lineup layout is chosen as for a lineup request.
 */
public record WaiverRequest(
    String strategy,
    Integer season,
    Integer week,
    List<String> clinchedTeams,
    String template,
    List<String> slots,
    Integer count,
    JsonNode roster,
    JsonNode available
) {
}
