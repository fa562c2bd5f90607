package com.lineupadvisor.advisor.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Body of {@code POST /api/v1/draft}. {@code roster} holds the team's drafted players,
 * {@code available} the players still on the board, both as loose payload arrays.
 */
public record DraftRequest(
    String strategy,
    Integer currentPick,
    Integer teams,
    Integer count,
    JsonNode roster,
    JsonNode available
) {
}
