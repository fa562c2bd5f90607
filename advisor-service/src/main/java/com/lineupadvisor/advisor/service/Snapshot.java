package com.lineupadvisor.advisor.service;

import com.lineupadvisor.common.model.PlayerSignals;

import java.util.List;

/**
 * Merged, immutable view of every player's signals for one request.
 *
 * @param players         request players with provider data folded in, input order
 * @param warnings        provider failures and degraded fetches
 * @param failedProviders providers that contributed nothing because they failed or timed out
 */
public record Snapshot(List<PlayerSignals> players, List<String> warnings, List<String> failedProviders) {

    public Snapshot {
        players = List.copyOf(players);
        warnings = List.copyOf(warnings);
        failedProviders = List.copyOf(failedProviders);
    }

    public boolean isDegraded() {
        return !failedProviders.isEmpty();
    }
}
