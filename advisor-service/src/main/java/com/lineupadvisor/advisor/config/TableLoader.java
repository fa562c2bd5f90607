package com.lineupadvisor.advisor.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lineupadvisor.common.bye.ByeWeekResolver;
import com.lineupadvisor.common.bye.ByeWeekTable;
import com.lineupadvisor.common.exception.ConfigurationException;
import com.lineupadvisor.common.model.Position;
import com.lineupadvisor.common.position.PositionBaselines;
import com.lineupadvisor.common.position.PositionProfile;
import com.lineupadvisor.common.strategy.StrategyProfile;
import com.lineupadvisor.common.strategy.StrategyProfiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Reads the JSON tables the engine is configured from. Every failure (missing resource,
 * malformed JSON, values the engine rejects) surfaces as a {@link ConfigurationException}
 * naming the resource, so a bad table stops the application context from starting.
 */
public class TableLoader {

    private static final Logger log = LoggerFactory.getLogger(TableLoader.class);

    private final ResourceLoader resources;
    private final ObjectMapper objectMapper;

    public TableLoader(ResourceLoader resources, ObjectMapper objectMapper) {
        this.resources = resources;
        this.objectMapper = objectMapper;
    }

    public StrategyProfiles loadStrategyProfiles(String location) {
        JsonNode root = read(location);
        JsonNode profiles = root.isArray() ? root : root.path("profiles");
        if (!profiles.isArray() || profiles.isEmpty()) {
            throw new ConfigurationException(location, "expected a non-empty 'profiles' array");
        }
        List<StrategyProfile> parsed = convert(location, profiles, new TypeReference<List<StrategyProfile>>() {});
        StrategyProfiles registry = new StrategyProfiles(parsed);
        log.info("TABLE_LOADED table=strategy-profiles source={} profiles={}", location, parsed.size());
        return registry;
    }

    public PositionBaselines loadPositionBaselines(String location) {
        JsonNode root = read(location);
        JsonNode positions = root.has("positions") ? root.path("positions") : root;
        Map<Position, PositionProfile> parsed = convert(location, positions,
            new TypeReference<Map<Position, PositionProfile>>() {});
        PositionBaselines baselines = new PositionBaselines(parsed, location);
        log.info("TABLE_LOADED table=position-baselines source={} positions={}", location, parsed.size());
        return baselines;
    }

    /**
     * Expects {@code {"season": 2025, "weeks": {"ATL": 5, ...}}}. A week that is not an integer
     * in 1..18 is a configuration error, not a silently dropped entry.
     */
    public ByeWeekTable loadByeWeeks(String location) {
        JsonNode root = read(location);
        JsonNode weeks = root.path("weeks");
        if (!weeks.isObject()) {
            throw new ConfigurationException(location, "expected a 'weeks' object of team → week");
        }
        Map<String, Integer> parsed = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = weeks.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> e = fields.next();
            Object raw = e.getValue().isNumber() ? e.getValue().numberValue() : e.getValue().asText(null);
            OptionalInt week = ByeWeekResolver.parseWeek(raw);
            if (week.isEmpty()) {
                throw new ConfigurationException(location, "invalid bye week for " + e.getKey() + ": " + e.getValue());
            }
            parsed.put(e.getKey(), week.getAsInt());
        }
        ByeWeekTable table = new ByeWeekTable(parsed, location);
        log.info("TABLE_LOADED table=bye-weeks source={} season={} teams={}",
                 location, root.path("season").asText("?"), table.size());
        return table;
    }

    // ── IO ─────────────────────────────────────────────────────────

    private JsonNode read(String location) {
        Resource resource = resources.getResource(location);
        if (!resource.exists()) {
            throw new ConfigurationException(location, "resource not found");
        }
        try (InputStream in = resource.getInputStream()) {
            JsonNode root = objectMapper.readTree(in);
            if (root == null || root.isMissingNode() || root.isNull()) {
                throw new ConfigurationException(location, "resource is empty");
            }
            return root;
        } catch (IOException e) {
            throw new ConfigurationException(location, "unreadable JSON: " + e.getMessage(), e);
        }
    }

    private <T> T convert(String location, JsonNode node, TypeReference<T> type) {
        try {
            return objectMapper.readerFor(type).readValue(node);
        } catch (IOException e) {
            ConfigurationException engineRejection = findConfigurationException(e);
            if (engineRejection != null) {
                throw new ConfigurationException(location, engineRejection.getMessage(), engineRejection);
            }
            throw new ConfigurationException(location, "malformed table: " + e.getMessage(), e);
        }
    }

    private static ConfigurationException findConfigurationException(Throwable t) {
        for (Throwable c = t; c != null; c = c.getCause()) {
            if (c instanceof ConfigurationException ce) {
                return ce;
            }
        }
        return null;
    }
}
