package com.lineupadvisor.advisor.parser;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lineupadvisor.common.model.PlayerSignals;
import com.lineupadvisor.common.model.Position;
import com.lineupadvisor.common.model.RecentGame;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PlayerSignalParserTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final PlayerSignalParser parser = new PlayerSignalParser();

    private ParsedPlayers parse(String json) throws Exception {
        JsonNode node = mapper.readTree(json);
        return parser.parse(node);
    }

    @Nested
    @DisplayName("well-formed payloads")
    class WellFormedTests {

        @Test
        @DisplayName("all fields parsed, numeric strings accepted")
        void fullPlayer() throws Exception {
            ParsedPlayers result = parse("""
                [{ "id": "4046", "name": "Patrick Mahomes", "position": "qb", "team": "kc", "opponent": "lv",
                   "projections": { "sleeper": 21.4, "yahoo": "19.8" },
                   "matchupRank": "28", "trending": 1500,
                   "recent": [ { "week": 3, "points": 24.1 }, { "week": 4, "points": "18.2" } ],
                   "byeWeek": "10" }]
                """);

            assertTrue(result.warnings().isEmpty());
            PlayerSignals p = result.players().get(0);
            assertEquals("4046", p.playerId());
            assertEquals(Position.QB, p.position());
            assertEquals("KC", p.team());
            assertEquals("LV", p.opponent());
            assertEquals(Map.of("sleeper", 21.4, "yahoo", 19.8), p.projections());
            assertEquals(28.0, p.matchupRank());
            assertEquals(1500.0, p.trendingDelta());
            assertEquals(List.of(new RecentGame(3, 24.1), new RecentGame(4, 18.2)), p.recentGames());
            assertEquals(10, p.reportedByeWeek());
        }

        @Test
        @DisplayName("single projection field → 'default' provider; bare recent numbers are oldest first")
        void shorthand() throws Exception {
            PlayerSignals p = parse("""
                [{ "name": "Tyreek Hill", "position": "WR", "team": "MIA", "projection": 14.5, "recent": [9.0, 21.0] }]
                """).players().get(0);

            assertEquals(Map.of("default", 14.5), p.projections());
            assertEquals(List.of(new RecentGame(1, 9.0), new RecentGame(2, 21.0)), p.recentGames());
            assertNull(p.matchupRank());
            assertNull(p.trendingDelta());
        }

        @Test
        @DisplayName("D/ST and PK aliases map to DEF and K")
        void aliases() throws Exception {
            ParsedPlayers result = parse("""
                [{ "name": "49ers", "position": "D/ST", "team": "SF" }, { "name": "Butker", "position": "PK", "team": "KC" }]
                """);
            assertEquals(Position.DEF, result.players().get(0).position());
            assertEquals(Position.K, result.players().get(1).position());
        }

        @Test
        @DisplayName("null payload → no players, no warnings")
        void nullPayload() {
            ParsedPlayers result = parser.parse(null);
            assertTrue(result.players().isEmpty());
            assertTrue(result.warnings().isEmpty());
        }
    }

    @Nested
    @DisplayName("invalid signals are discarded, not fatal")
    class InvalidSignalTests {

        @Test
        @DisplayName("'N/A' rank, negative projection and bad bye week → dropped with warnings, player kept")
        void invalidValues() throws Exception {
            ParsedPlayers result = parse("""
                [{ "name": "Saquon Barkley", "position": "RB", "team": "PHI",
                   "projections": { "sleeper": -3, "espn": 17.1, "yahoo": "n/a" },
                   "matchupRank": "N/A", "byeWeek": 19 }]
                """);

            PlayerSignals p = result.players().get(0);
            assertEquals(Map.of("espn", 17.1), p.projections());
            assertNull(p.matchupRank());
            assertNull(p.reportedByeWeek());
            assertEquals(4, result.warnings().size());
            assertTrue(result.warnings().contains("Invalid matchupRank 'N/A' for Saquon Barkley discarded"));
            assertTrue(result.warnings().contains("Invalid bye week '19' for Saquon Barkley discarded"));
        }

        @Test
        @DisplayName("fractional and zero bye weeks rejected")
        void fractionalBye() throws Exception {
            ParsedPlayers result = parse("""
                [{ "name": "A", "position": "TE", "byeWeek": 7.5 }, { "name": "B", "position": "TE", "byeWeek": 0 },
                 { "name": "C", "position": "TE", "byeWeek": "7.0" }]
                """);
            assertNull(result.players().get(0).reportedByeWeek());
            assertNull(result.players().get(1).reportedByeWeek());
            assertEquals(7, result.players().get(2).reportedByeWeek());
        }

        @Test
        @DisplayName("unreadable recent games dropped")
        void badRecent() throws Exception {
            ParsedPlayers result = parse("""
                [{ "name": "A", "position": "WR", "recent": [12.0, "DNP", { "week": 3 }] }]
                """);
            assertEquals(List.of(new RecentGame(1, 12.0)), result.players().get(0).recentGames());
            assertTrue(result.warnings().contains("2 unreadable recent game(s) for A discarded"));
        }

        @Test
        @DisplayName("missing name or unknown position → player skipped with a warning")
        void skipped() throws Exception {
            ParsedPlayers result = parse("""
                [{ "position": "QB" }, { "name": "Linebacker", "position": "LB" }, "junk", { "name": "Ok", "position": "K" }]
                """);

            assertEquals(1, result.players().size());
            assertEquals("Ok", result.players().get(0).name());
            assertEquals(List.of(
                "Player #1 skipped: missing name",
                "Linebacker skipped: unknown position 'LB'",
                "Player #3 skipped: not an object"), result.warnings());
        }

        @Test
        @DisplayName("players that is not an array → request error")
        void notArray() throws Exception {
            JsonNode node = mapper.readTree("{\"name\": \"x\"}");
            assertThrows(IllegalArgumentException.class, () -> parser.parse(node));
        }
    }
}
