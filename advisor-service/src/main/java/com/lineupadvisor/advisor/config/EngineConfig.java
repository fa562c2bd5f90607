package com.lineupadvisor.advisor.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lineupadvisor.advisor.provider.CachingSignalProvider;
import com.lineupadvisor.advisor.provider.ResponseCache;
import com.lineupadvisor.advisor.provider.SignalProvider;
import com.lineupadvisor.advisor.provider.SlidingWindowRateLimiter;
import com.lineupadvisor.advisor.service.SnapshotAssembler;
import com.lineupadvisor.common.bye.ByeWeekResolver;
import com.lineupadvisor.common.bye.ByeWeekTable;
import com.lineupadvisor.common.draft.DraftRanker;
import com.lineupadvisor.common.position.PositionBaselines;
import com.lineupadvisor.common.scoring.CompositeScorer;
import com.lineupadvisor.common.scoring.RestRiskPolicy;
import com.lineupadvisor.common.strategy.StrategyProfiles;
import com.lineupadvisor.common.waiver.WaiverRanker;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

import java.time.Clock;
import java.util.List;

/**
 * Wires the engine from the configured tables. Table problems throw
 * {@code ConfigurationException} here, before the server accepts a request.
 */
@Configuration
public class EngineConfig {

    @Bean
    public TableLoader tableLoader(ResourceLoader resourceLoader, ObjectMapper objectMapper) {
        return new TableLoader(resourceLoader, objectMapper);
    }

    @Bean
    public StrategyProfiles strategyProfiles(TableLoader loader, AdvisorProperties props) {
        return loader.loadStrategyProfiles(props.getTables().getStrategyProfiles());
    }

    @Bean
    public PositionBaselines positionBaselines(TableLoader loader, AdvisorProperties props) {
        return loader.loadPositionBaselines(props.getTables().getPositionBaselines());
    }

    @Bean
    public ByeWeekTable byeWeekTable(TableLoader loader, AdvisorProperties props) {
        return loader.loadByeWeeks(props.getTables().getByeWeeks());
    }

    @Bean
    public ByeWeekResolver byeWeekResolver(ByeWeekTable table) {
        return new ByeWeekResolver(table);
    }

    @Bean
    public CompositeScorer compositeScorer(PositionBaselines baselines, ByeWeekResolver byeWeekResolver) {
        return new CompositeScorer(baselines, byeWeekResolver, RestRiskPolicy.defaults());
    }

    @Bean
    public DraftRanker draftRanker(PositionBaselines baselines, ByeWeekResolver byeWeekResolver) {
        return new DraftRanker(baselines, byeWeekResolver);
    }

    @Bean
    public WaiverRanker waiverRanker(CompositeScorer compositeScorer) {
        return new WaiverRanker(compositeScorer);
    }

    // ── Provider boundary ──────────────────────────────────────────

    @Bean
    public Clock advisorClock() {
        return Clock.systemUTC();
    }

    @Bean
    public ResponseCache responseCache(Clock advisorClock, AdvisorProperties props) {
        return new ResponseCache(advisorClock, props.getCache().getMaxEntries());
    }

    @Bean
    public SlidingWindowRateLimiter providerRateLimiter(Clock advisorClock, AdvisorProperties props) {
        AdvisorProperties.RateLimit limit = props.getRateLimit();
        return new SlidingWindowRateLimiter(limit.getMaxRequests(), limit.getWindow(), advisorClock);
    }

    /**
     * Every {@link SignalProvider} bean, each behind the shared cache and rate limit.
     */
    @Bean
    public SnapshotAssembler snapshotAssembler(ObjectProvider<SignalProvider> providers, ResponseCache cache,
                                               SlidingWindowRateLimiter limiter, AdvisorProperties props) {
        List<SignalProvider> wrapped = providers.orderedStream()
            .<SignalProvider>map(p -> new CachingSignalProvider(p, cache, limiter, props.getCache().ttlFor(p.name())))
            .toList();
        return new SnapshotAssembler(wrapped, props.getFetch().getTimeout());
    }
}
