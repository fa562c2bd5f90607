package com.lineupadvisor.common.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Fantasy-relevant positions. Provider aliases ({@code DST}, {@code D/ST}, {@code PK})
 * collapse onto the canonical constant via {@link #parse(String)}.
 */
public enum Position {
    QB,
    RB,
    WR,
    TE,
    K,
    DEF;

    /**
     * Lenient lookup used by payload parsing. Unknown or blank input yields empty.
     */
    public static Optional<Position> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String key = raw.trim().toUpperCase(Locale.ROOT);
        return switch (key) {
            case "QB" -> Optional.of(QB);
            case "RB" -> Optional.of(RB);
            case "WR" -> Optional.of(WR);
            case "TE" -> Optional.of(TE);
            case "K", "PK" -> Optional.of(K);
            case "DEF", "DST", "D/ST" -> Optional.of(DEF);
            default -> Optional.empty();
        };
    }

    /** True for the single-starter positions in a standard lineup. */
    public boolean isSingleStarter() {
        return this == QB || this == TE || this == K || this == DEF;
    }
}
