package com.lineupadvisor.common.lineup;

import com.lineupadvisor.common.model.Position;
import com.lineupadvisor.common.model.RosterSlot;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Common league roster layouts and the slot-label vocabulary used by league hosts.
 *
 * <pre>
 *   standard / yahoo  QB, RB×2, WR×2, TE, FLEX, K, DEF, BN×6
 *   espn              QB, RB×2, WR×2, TE, FLEX, DEF, K, BN×7
 *   superflex         QB, RB×2, WR×3, TE, FLEX, SUPERFLEX, DEF, K, BN×6
 *   2qb               QB×2, RB×2, WR×3, TE, FLEX, DEF, K, BN×5
 * </pre>
 */
public final class RosterTemplates {

    private static final Set<Position> FLEX = EnumSet.of(Position.RB, Position.WR, Position.TE);
    private static final Set<Position> SUPERFLEX = EnumSet.of(Position.QB, Position.RB, Position.WR, Position.TE);

    private static final Map<String, Set<Position>> FLEX_LABELS = Map.ofEntries(
        Map.entry("FLEX", FLEX),
        Map.entry("W/R/T", FLEX),
        Map.entry("UTIL", FLEX),
        Map.entry("SUPERFLEX", SUPERFLEX),
        Map.entry("Q/W/R/T", SUPERFLEX),
        Map.entry("OP", SUPERFLEX),
        Map.entry("W/R", EnumSet.of(Position.WR, Position.RB)),
        Map.entry("RB/WR", EnumSet.of(Position.WR, Position.RB)),
        Map.entry("W/T", EnumSet.of(Position.WR, Position.TE)),
        Map.entry("WR/TE", EnumSet.of(Position.WR, Position.TE)),
        Map.entry("R/T", EnumSet.of(Position.RB, Position.TE))
    );

    private static final Set<String> BENCH_LABELS = Set.of("BN", "BE", "BENCH");

    private static final Map<String, List<RosterSlot>> TEMPLATES;

    static {
        Map<String, List<RosterSlot>> t = new LinkedHashMap<>();
        List<RosterSlot> yahoo = build("QB", "RB", "RB", "WR", "WR", "TE", "FLEX", "K", "DEF",
            "BN", "BN", "BN", "BN", "BN", "BN");
        t.put("standard", yahoo);
        t.put("yahoo", yahoo);
        t.put("espn", build("QB", "RB", "RB", "WR", "WR", "TE", "FLEX", "DEF", "K",
            "BN", "BN", "BN", "BN", "BN", "BN", "BN"));
        t.put("superflex", build("QB", "RB", "RB", "WR", "WR", "WR", "TE", "FLEX", "SUPERFLEX", "DEF", "K",
            "BN", "BN", "BN", "BN", "BN", "BN"));
        t.put("2qb", build("QB", "QB", "RB", "RB", "WR", "WR", "WR", "TE", "FLEX", "DEF", "K",
            "BN", "BN", "BN", "BN", "BN"));
        TEMPLATES = Collections.unmodifiableMap(t);
    }

    private RosterTemplates() {}

    /**
     * @throws IllegalArgumentException for an unknown template name
     */
    public static List<RosterSlot> template(String name) {
        String key = name == null ? "standard" : name.trim().toLowerCase(Locale.ROOT);
        List<RosterSlot> slots = TEMPLATES.get(key);
        if (slots == null) {
            throw new IllegalArgumentException("Unknown roster template '" + name + "', expected one of " + TEMPLATES.keySet());
        }
        return slots;
    }

    public static Set<String> names() {
        return TEMPLATES.keySet();
    }

    /**
     * Builds a slot from a host label such as {@code "RB"}, {@code "W/R/T"}, {@code "OP"},
     * {@code "D/ST"} or {@code "BN"}. Unrecognised labels are empty.
     */
    public static Optional<RosterSlot> slot(String label) {
        if (label == null || label.isBlank()) {
            return Optional.empty();
        }
        String key = label.trim().toUpperCase(Locale.ROOT);
        if (BENCH_LABELS.contains(key)) {
            return Optional.of(RosterSlot.bench(key));
        }
        Set<Position> flex = FLEX_LABELS.get(key);
        if (flex != null) {
            return Optional.of(new RosterSlot(key, flex, false));
        }
        return Position.parse(key).map(RosterSlot::of);
    }

    /** Parses labels in order; duplicate labels for exact positions are numbered RB1, RB2. */
    public static List<RosterSlot> fromLabels(List<String> labels) {
        List<RosterSlot> parsed = new ArrayList<>();
        for (String label : labels) {
            parsed.add(slot(label).orElseThrow(() ->
                new IllegalArgumentException("Unknown roster slot label '" + label + "'")));
        }
        return numberDuplicates(parsed);
    }

    private static List<RosterSlot> build(String... labels) {
        return Collections.unmodifiableList(fromLabels(List.of(labels)));
    }

    private static List<RosterSlot> numberDuplicates(List<RosterSlot> slots) {
        Map<String, Integer> totals = new LinkedHashMap<>();
        for (RosterSlot s : slots) {
            totals.merge(s.label(), 1, Integer::sum);
        }
        Map<String, Integer> seen = new LinkedHashMap<>();
        List<RosterSlot> result = new ArrayList<>(slots.size());
        for (RosterSlot s : slots) {
            if (totals.get(s.label()) == 1) {
                result.add(s);
                continue;
            }
            int n = seen.merge(s.label(), 1, Integer::sum);
            result.add(new RosterSlot(s.label() + n, s.eligible(), s.bench()));
        }
        return result;
    }
}
