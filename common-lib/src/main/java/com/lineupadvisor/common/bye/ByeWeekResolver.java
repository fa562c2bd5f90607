package com.lineupadvisor.common.bye;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalInt;
import java.util.TreeMap;

/**
 * Decides a team's bye week from the curated table and an optional provider-reported value.
 *
 * <h3>Precedence</h3>
 * <ol>
 *   <li>The static table wins for every team it lists, whatever the provider says.</li>
 *   <li>For unlisted teams a reported value is used only when it is an integer in [1, 18].
 *       {@code null}, blank, {@code "N/A"}, non-numeric text, fractions, 0 and 19 all mean
 *       "no data".</li>
 * </ol>
 * Absence is {@link OptionalInt#empty()}, never week 0.
 */
public final class ByeWeekResolver {

    private final ByeWeekTable table;

    public ByeWeekResolver(ByeWeekTable table) {
        this.table = table;
    }

    public OptionalInt resolve(String team, Object reported) {
        OptionalInt fromTable = table.lookup(team);
        if (fromTable.isPresent()) {
            return fromTable;
        }
        return parseWeek(reported);
    }

    public boolean isOnBye(String team, Object reported, int week) {
        OptionalInt bye = resolve(team, reported);
        return bye.isPresent() && bye.getAsInt() == week;
    }

    /**
     * Complete team → week map: the static table, plus valid reported values for teams it does
     * not list. Invalid reported values are ignored.
     */
    public Map<String, Integer> merged(Map<String, ?> reported) {
        Map<String, Integer> result = new TreeMap<>(table.asMap());
        if (reported == null) {
            return result;
        }
        reported.forEach((team, value) -> {
            if (team == null || team.isBlank()) {
                return;
            }
            String key = team.trim().toUpperCase(Locale.ROOT);
            if (!result.containsKey(key)) {
                parseWeek(value).ifPresent(w -> result.put(key, w));
            }
        });
        return result;
    }

    /**
     * Lenient parse of a provider-reported bye week. Accepts integral numbers and numeric
     * strings ({@code "7"}, {@code " 7 "}, {@code "7.0"}); anything else, or a value outside
     * [1, 18], is empty.
     */
    public static OptionalInt parseWeek(Object raw) {
        if (raw == null) {
            return OptionalInt.empty();
        }
        BigDecimal value;
        try {
            if (raw instanceof Number n) {
                double d = n.doubleValue();
                if (!Double.isFinite(d)) {
                    return OptionalInt.empty();
                }
                value = new BigDecimal(n.toString());
            } else if (raw instanceof CharSequence cs) {
                String s = cs.toString().trim();
                if (s.isEmpty()) {
                    return OptionalInt.empty();
                }
                value = new BigDecimal(s);
            } else {
                return OptionalInt.empty();
            }
        } catch (NumberFormatException e) {
            return OptionalInt.empty();
        }
        if (value.stripTrailingZeros().scale() > 0) {
            return OptionalInt.empty();
        }
        if (value.compareTo(BigDecimal.valueOf(ByeWeekTable.FIRST_WEEK)) < 0
            || value.compareTo(BigDecimal.valueOf(ByeWeekTable.LAST_WEEK)) > 0) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(value.intValueExact());
    }

    public ByeWeekTable table() {
        return table;
    }
}
