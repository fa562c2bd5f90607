package com.lineupadvisor.advisor.service;

import com.lineupadvisor.advisor.provider.ProviderPayload;
import com.lineupadvisor.advisor.provider.SignalProvider;
import com.lineupadvisor.common.model.PlayerSignals;
import com.lineupadvisor.common.model.ScoringPeriod;
import com.lineupadvisor.common.signal.SignalNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Asks every configured {@link SignalProvider} for the request's players in parallel and folds the
 * answers into one {@link Snapshot}.
 *
 * <p>Each provider call is bounded by the fetch timeout. A provider that errors or times out
 * contributes nothing and leaves a warning; the request continues with what the others returned.
 * Results are merged in provider-name order, so the snapshot does not depend on which call
 * finished first. Values sent inline with the request take precedence over provider values.
 */
public class SnapshotAssembler {

    private static final Logger log = LoggerFactory.getLogger(SnapshotAssembler.class);

    private final List<SignalProvider> providers;
    private final Duration timeout;

    public SnapshotAssembler(List<SignalProvider> providers, Duration timeout) {
        this.providers = List.copyOf(providers);
        this.timeout = timeout;
    }

    public Mono<Snapshot> assemble(List<PlayerSignals> players, ScoringPeriod period) {
        if (providers.isEmpty() || players.isEmpty()) {
            return Mono.just(new Snapshot(players, List.of(), List.of()));
        }
        log.info("Fetching signals providers={} players={} season={} week={}",
                 providers.size(), players.size(), period.season(), period.week());

        return Flux.fromIterable(providers)
            .flatMap(provider -> provider.fetch(players, period)
                .timeout(timeout)
                .map(data -> ProviderResult.ok(provider.name(), data))
                .defaultIfEmpty(ProviderResult.ok(provider.name(), Map.of()))
                .doOnNext(result -> log.info("PROVIDER_OK provider={} players={}", provider.name(), result.data().size()))
                .onErrorResume(e -> {
                    log.warn("PROVIDER_FAILED provider={} reason={}", provider.name(), describe(e));
                    return Mono.just(ProviderResult.failed(provider.name(), describe(e)));
                }))
            .collectList()
            .map(results -> merge(players, results));
    }

    // ── Merge ──────────────────────────────────────────────────────

    Snapshot merge(List<PlayerSignals> players, List<ProviderResult> results) {
        List<ProviderResult> ordered = new ArrayList<>(results);
        ordered.sort(Comparator.comparing(ProviderResult::provider));

        List<String> warnings = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        for (ProviderResult r : ordered) {
            if (r.failure() != null) {
                failed.add(r.provider());
                warnings.add("Provider " + r.provider() + " unavailable (" + r.failure()
                    + ") - continuing with remaining data");
            }
        }

        List<PlayerSignals> merged = new ArrayList<>(players.size());
        for (PlayerSignals p : players) {
            PlayerSignals current = p;
            for (ProviderResult r : ordered) {
                ProviderPayload payload = r.data().get(p.identityKey());
                if (payload != null) {
                    current = apply(current, r.provider(), payload);
                }
            }
            merged.add(current);
        }
        return new Snapshot(merged, warnings, failed);
    }

    static PlayerSignals apply(PlayerSignals p, String provider, ProviderPayload payload) {
        PlayerSignals out = p;
        if (SignalNormalizer.isValidProjection(payload.projection()) && !p.projections().containsKey(provider)) {
            Map<String, Double> projections = new LinkedHashMap<>(p.projections());
            projections.put(provider, payload.projection());
            out = out.withProjections(projections);
        }
        if (out.matchupRank() == null && payload.matchupRank() != null) {
            out = out.withMatchupRank(payload.matchupRank());
        }
        if (out.trendingDelta() == null && payload.trendingDelta() != null) {
            out = out.withTrendingDelta(payload.trendingDelta());
        }
        if (out.opponent() == null && payload.opponent() != null) {
            out = out.withOpponent(payload.opponent());
        }
        if (out.reportedByeWeek() == null && payload.byeWeek() != null) {
            out = out.withReportedByeWeek(payload.byeWeek());
        }
        if (out.recentGames().isEmpty() && !payload.recentGames().isEmpty()) {
            out = out.withRecentGames(payload.recentGames());
        }
        return out;
    }

    private String describe(Throwable e) {
        if (e instanceof TimeoutException) {
            return "timeout after " + timeout.toMillis() + "ms";
        }
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    }

    record ProviderResult(String provider, Map<String, ProviderPayload> data, String failure) {

        static ProviderResult ok(String provider, Map<String, ProviderPayload> data) {
            return new ProviderResult(provider, data == null ? Map.of() : data, null);
        }

        static ProviderResult failed(String provider, String reason) {
            return new ProviderResult(provider, Map.of(), reason);
        }
    }
}
