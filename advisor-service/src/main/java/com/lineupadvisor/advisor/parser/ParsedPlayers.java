package com.lineupadvisor.advisor.parser;

import com.lineupadvisor.common.model.PlayerSignals;

import java.util.List;

/**
 * Players that survived parsing plus one warning per discarded player or signal.
 */
public record ParsedPlayers(List<PlayerSignals> players, List<String> warnings) {

    public ParsedPlayers {
        players = List.copyOf(players);
        warnings = List.copyOf(warnings);
    }
}
