package com.lineupadvisor.common.bye;

import com.lineupadvisor.common.exception.ConfigurationException;

import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalInt;
import java.util.TreeMap;

/**
 * Curated team → bye-week table for one season. Authoritative for every team it lists.
 *
 * <p>Keys are stored upper case; every week must lie in [{@value #FIRST_WEEK}, {@value #LAST_WEEK}]
 * or construction fails with {@link ConfigurationException}.
 */
public final class ByeWeekTable {

    public static final int FIRST_WEEK = 1;
    public static final int LAST_WEEK = 18;

    private final Map<String, Integer> weeks;
    private final String source;

    public ByeWeekTable(Map<String, Integer> weeks, String source) {
        if (weeks == null) {
            throw new ConfigurationException(source, "bye-week table is missing");
        }
        Map<String, Integer> copy = new TreeMap<>();
        for (Map.Entry<String, Integer> e : weeks.entrySet()) {
            String team = e.getKey();
            Integer week = e.getValue();
            if (team == null || team.isBlank()) {
                throw new ConfigurationException(source, "blank team abbreviation");
            }
            if (week == null || week < FIRST_WEEK || week > LAST_WEEK) {
                throw new ConfigurationException(source,
                    "bye week for " + team + " must be within " + FIRST_WEEK + ".." + LAST_WEEK + ", got " + week);
            }
            copy.put(team.trim().toUpperCase(Locale.ROOT), week);
        }
        this.weeks = Collections.unmodifiableMap(copy);
        this.source = source;
    }

    public static ByeWeekTable empty() {
        return new ByeWeekTable(Map.of(), "empty");
    }

    public OptionalInt lookup(String team) {
        if (team == null) {
            return OptionalInt.empty();
        }
        Integer week = weeks.get(team.trim().toUpperCase(Locale.ROOT));
        return week == null ? OptionalInt.empty() : OptionalInt.of(week);
    }

    public boolean contains(String team) {
        return lookup(team).isPresent();
    }

    public Map<String, Integer> asMap() {
        return weeks;
    }

    public int size() {
        return weeks.size();
    }

    public String source() {
        return source;
    }
}
