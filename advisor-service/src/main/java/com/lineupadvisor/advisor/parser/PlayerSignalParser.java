package com.lineupadvisor.advisor.parser;

import com.fasterxml.jackson.databind.JsonNode;
import com.lineupadvisor.common.bye.ByeWeekResolver;
import com.lineupadvisor.common.model.PlayerSignals;
import com.lineupadvisor.common.model.Position;
import com.lineupadvisor.common.model.RecentGame;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Turns loosely typed provider payloads into validated {@link PlayerSignals}.
 *
 * <p>Providers disagree on shapes: numbers arrive as strings, ranks as {@code "N/A"}, bye weeks
 * as {@code "7.0"}. Anything that does not parse is dropped and reported as a warning, and
 * the player is kept with that signal missing. Only a player without a usable name or position
 * is skipped entirely.
 *
 * <pre>
 *   { "id": "4046", "name": "Patrick Mahomes", "position": "QB", "team": "KC", "opponent": "LV",
 *     "projections": { "sleeper": 21.4, "yahoo": "19.8" },   // or "projection": 20.5
 *     "matchupRank": 28, "trending": 1500,
 *     "recent": [ { "week": 3, "points": 24.1 }, 18.2 ],     // bare numbers: oldest first
 *     "byeWeek": 10 }
 * </pre>
 */
@Component
public class PlayerSignalParser {

    static final String DEFAULT_PROVIDER = "default";

    public ParsedPlayers parse(JsonNode payload) {
        List<PlayerSignals> players = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        if (payload == null || payload.isNull() || payload.isMissingNode()) {
            return new ParsedPlayers(players, warnings);
        }
        if (!payload.isArray()) {
            throw new IllegalArgumentException("players must be an array");
        }
        int index = 0;
        for (JsonNode node : payload) {
            index++;
            PlayerSignals parsed = parsePlayer(node, index, warnings);
            if (parsed != null) {
                players.add(parsed);
            }
        }
        return new ParsedPlayers(players, warnings);
    }

    PlayerSignals parsePlayer(JsonNode node, int index, List<String> warnings) {
        if (node == null || !node.isObject()) {
            warnings.add("Player #" + index + " skipped: not an object");
            return null;
        }
        String name = text(node, "name");
        if (name == null) {
            warnings.add("Player #" + index + " skipped: missing name");
            return null;
        }
        String rawPosition = text(node, "position");
        Position position = Position.parse(rawPosition).orElse(null);
        if (position == null) {
            warnings.add(name + " skipped: unknown position '" + rawPosition + "'");
            return null;
        }

        String team = upper(text(node, "team"));
        String id = text(node, "id");
        if (id == null) {
            id = text(node, "playerId");
        }

        Map<String, Double> projections = projections(node, name, warnings);
        Double matchupRank = number(node, "matchupRank", name, warnings);
        Double trending = node.has("trending")
            ? number(node, "trending", name, warnings)
            : number(node, "trendingDelta", name, warnings);
        List<RecentGame> recent = recentGames(node.path("recent"), name, warnings);

        Integer byeWeek = null;
        JsonNode byeNode = node.has("byeWeek") ? node.get("byeWeek") : node.get("bye_week");
        if (byeNode != null && !byeNode.isNull()) {
            OptionalInt week = ByeWeekResolver.parseWeek(scalar(byeNode));
            if (week.isPresent()) {
                byeWeek = week.getAsInt();
            } else {
                warnings.add("Invalid bye week '" + byeNode.asText() + "' for " + name + " discarded");
            }
        }

        return new PlayerSignals(id, name, position, team, upper(text(node, "opponent")), projections,
            matchupRank, trending, recent, byeWeek);
    }

    // ── Fields ─────────────────────────────────────────────────────

    private Map<String, Double> projections(JsonNode node, String name, List<String> warnings) {
        Map<String, Double> result = new LinkedHashMap<>();
        JsonNode projections = node.get("projections");
        if (projections != null && projections.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = projections.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> e = fields.next();
                addProjection(result, e.getKey(), e.getValue(), name, warnings);
            }
        } else if (node.has("projection")) {
            addProjection(result, DEFAULT_PROVIDER, node.get("projection"), name, warnings);
        }
        return result;
    }

    private void addProjection(Map<String, Double> target, String provider, JsonNode value,
                               String name, List<String> warnings) {
        if (value == null || value.isNull()) {
            return;
        }
        Double parsed = toDouble(value);
        if (parsed == null || parsed < 0) {
            warnings.add("Invalid projection '" + value.asText() + "' from " + provider + " for " + name + " discarded");
            return;
        }
        target.put(provider, parsed);
    }

    private List<RecentGame> recentGames(JsonNode recent, String name, List<String> warnings) {
        List<RecentGame> games = new ArrayList<>();
        if (!recent.isArray()) {
            return games;
        }
        int position = 0;
        int discarded = 0;
        for (JsonNode g : recent) {
            position++;
            Double points;
            int week;
            if (g.isObject()) {
                points = toDouble(g.path("points"));
                Double w = toDouble(g.path("week"));
                week = w == null ? position : w.intValue();
            } else {
                points = toDouble(g);
                week = position;
            }
            if (points == null) {
                discarded++;
                continue;
            }
            games.add(new RecentGame(week, points));
        }
        if (discarded > 0) {
            warnings.add(discarded + " unreadable recent game(s) for " + name + " discarded");
        }
        return games;
    }

    private Double number(JsonNode node, String field, String name, List<String> warnings) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        Double parsed = toDouble(value);
        if (parsed == null) {
            warnings.add("Invalid " + field + " '" + value.asText() + "' for " + name + " discarded");
        }
        return parsed;
    }

    // ── Scalars ────────────────────────────────────────────────────

    /** Finite number from a numeric node or numeric text, else {@code null}. */
    static Double toDouble(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return null;
        }
        double d;
        if (value.isNumber()) {
            d = value.doubleValue();
        } else if (value.isTextual()) {
            String s = value.asText().trim();
            if (s.isEmpty()) {
                return null;
            }
            try {
                d = Double.parseDouble(s);
            } catch (NumberFormatException e) {
                return null;
            }
        } else {
            return null;
        }
        return Double.isFinite(d) ? d : null;
    }

    private static Object scalar(JsonNode node) {
        return node.isNumber() ? node.numberValue() : node.asText();
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return null;
        }
        String s = value.asText().trim();
        return s.isEmpty() ? null : s;
    }

    private static String upper(String s) {
        return s == null ? null : s.toUpperCase(Locale.ROOT);
    }
}
