package com.lineupadvisor.advisor.service;

import com.lineupadvisor.advisor.config.AdvisorProperties;
import com.lineupadvisor.advisor.model.AdvisorResponse;
import com.lineupadvisor.advisor.model.DraftRequest;
import com.lineupadvisor.advisor.model.LineupRequest;
import com.lineupadvisor.advisor.model.WaiverRequest;
import com.lineupadvisor.advisor.parser.ParsedPlayers;
import com.lineupadvisor.advisor.parser.PlayerSignalParser;
import com.lineupadvisor.common.bye.ByeWeekTable;
import com.lineupadvisor.common.draft.DraftRanker;
import com.lineupadvisor.common.lineup.LineupAssigner;
import com.lineupadvisor.common.lineup.RosterTemplates;
import com.lineupadvisor.common.model.DataQualitySummary;
import com.lineupadvisor.common.model.DraftRanking;
import com.lineupadvisor.common.model.DraftState;
import com.lineupadvisor.common.model.LineupResult;
import com.lineupadvisor.common.model.PlayerSignals;
import com.lineupadvisor.common.model.RosterSlot;
import com.lineupadvisor.common.model.ScoredPlayer;
import com.lineupadvisor.common.model.ScoringPeriod;
import com.lineupadvisor.common.model.WaiverRanking;
import com.lineupadvisor.common.scoring.CompositeScorer;
import com.lineupadvisor.common.strategy.StrategyProfile;
import com.lineupadvisor.common.strategy.StrategyProfiles;
import com.lineupadvisor.common.waiver.WaiverRanker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;

/**
 * Request-level orchestration: validate, parse, fetch, score, assign or rank, wrap.
 *
 * <p>Invalid requests fail with {@link IllegalArgumentException} inside the returned
 * {@code Mono}; missing or invalid player data never does, it lowers the data quality and the
 * response status becomes PARTIAL.
 */
@Service
public class AdvisorService {

    private static final Logger log = LoggerFactory.getLogger(AdvisorService.class);

    static final int DEFAULT_TEAMS = 12;
    static final int DEFAULT_DRAFT_COUNT = 10;

    private final StrategyProfiles profiles;
    private final PlayerSignalParser parser;
    private final SnapshotAssembler assembler;
    private final CompositeScorer scorer;
    private final DraftRanker draftRanker;
    private final WaiverRanker waiverRanker;
    private final AdvisorProperties props;

    public AdvisorService(StrategyProfiles profiles, PlayerSignalParser parser, SnapshotAssembler assembler,
                          CompositeScorer scorer, DraftRanker draftRanker, WaiverRanker waiverRanker,
                          AdvisorProperties props) {
        this.profiles = profiles;
        this.parser = parser;
        this.assembler = assembler;
        this.scorer = scorer;
        this.draftRanker = draftRanker;
        this.waiverRanker = waiverRanker;
        this.props = props;
    }

    public Mono<AdvisorResponse<LineupResult>> lineup(LineupRequest request) {
        return Mono.defer(() -> {
            if (request == null) {
                return Mono.error(new IllegalArgumentException("request body is required"));
            }
            StrategyProfile profile = profiles.get(request.strategy());
            ScoringPeriod period = period(request.week(), request.season(), request.clinchedTeams());
            List<RosterSlot> slots = slots(request.template(), request.slots());
            ParsedPlayers parsed = parser.parse(request.players());

            log.info("Scoring lineup strategy={} players={} season={} week={} slots={}",
                     profile.name(), parsed.players().size(), period.season(), period.week(), slots.size());

            return assembler.assemble(parsed.players(), period)
                .map(snapshot -> {
                    List<ScoredPlayer> scored = scorer.scorePool(snapshot.players(), profile, period);
                    LineupResult result = LineupAssigner.assign(scored, slots, profile);

                    List<String> warnings = new ArrayList<>(parsed.warnings());
                    warnings.addAll(snapshot.warnings());
                    warnings.addAll(result.warnings());

                    boolean partial = !result.dataQuality().isComplete()
                        || result.hasEmptySlots()
                        || snapshot.isDegraded();
                    log.info("LINEUP_COMPLETE strategy={} status={} totalValue={} projectionCoverage={} warnings={}",
                             profile.name(), partial ? "PARTIAL" : "SUCCESS",
                             String.format(Locale.ROOT, "%.2f", result.totalValue()),
                             String.format(Locale.ROOT, "%.2f", result.dataQuality().projectionCoverage()), warnings.size());
                    return AdvisorResponse.of(partial, result, warnings, result.dataQuality());
                });
        });
    }

    public Mono<AdvisorResponse<DraftRanking>> draft(DraftRequest request) {
        return Mono.fromCallable(() -> {
            if (request == null) {
                throw new IllegalArgumentException("request body is required");
            }
            if (request.currentPick() == null) {
                throw new IllegalArgumentException("currentPick is required");
            }
            StrategyProfile profile = profiles.get(request.strategy());
            int teams = request.teams() == null ? DEFAULT_TEAMS : request.teams();
            int count = request.count() == null ? DEFAULT_DRAFT_COUNT : request.count();

            ParsedPlayers roster = parser.parse(request.roster());
            ParsedPlayers available = parser.parse(request.available());
            DraftState state = new DraftState(roster.players(), available.players(), request.currentPick(), teams, count);

            log.info("Ranking draft strategy={} pick={} teams={} roster={} available={}",
                     profile.name(), state.currentPick(), teams, roster.players().size(), available.players().size());

            DraftRanking ranking = draftRanker.rank(state, profile);
            DataQualitySummary quality = DataQualitySummary.of(available.players());

            List<String> warnings = new ArrayList<>(roster.warnings());
            warnings.addAll(available.warnings());
            warnings.addAll(ranking.warnings());

            boolean partial = !quality.isComplete();
            log.info("DRAFT_COMPLETE strategy={} status={} round={} returned={}",
                     profile.name(), partial ? "PARTIAL" : "SUCCESS", ranking.position().round(), ranking.entries().size());
            return AdvisorResponse.of(partial, ranking, warnings, quality);
        });
    }

    /**
     * Ranks free agents by lineup impact. Roster and candidates share one provider fetch.
     */
    public Mono<AdvisorResponse<WaiverRanking>> waivers(WaiverRequest request) {
        return Mono.defer(() -> {
            if (request == null) {
                return Mono.error(new IllegalArgumentException("request body is required"));
            }
            StrategyProfile profile = profiles.get(request.strategy());
            ScoringPeriod period = period(request.week(), request.season(), request.clinchedTeams());
            List<RosterSlot> slots = slots(request.template(), request.slots());
            int count = request.count() == null ? WaiverRanker.DEFAULT_COUNT : request.count();
            ParsedPlayers roster = parser.parse(request.roster());
            ParsedPlayers available = parser.parse(request.available());

            List<PlayerSignals> everyone = new ArrayList<>(roster.players());
            everyone.addAll(available.players());
            log.info("Ranking waivers strategy={} roster={} available={} season={} week={}",
                     profile.name(), roster.players().size(), available.players().size(), period.season(), period.week());

            return assembler.assemble(everyone, period)
                .map(snapshot -> {
                    int split = roster.players().size();
                    List<PlayerSignals> merged = snapshot.players();
                    WaiverRanking ranking = waiverRanker.rank(merged.subList(0, split),
                        merged.subList(split, merged.size()), slots, profile, period, count);
                    DataQualitySummary quality = DataQualitySummary.of(merged.subList(split, merged.size()));

                    List<String> warnings = new ArrayList<>(roster.warnings());
                    warnings.addAll(available.warnings());
                    warnings.addAll(snapshot.warnings());
                    warnings.addAll(ranking.warnings());

                    boolean partial = !quality.isComplete() || snapshot.isDegraded();
                    log.info("WAIVERS_COMPLETE strategy={} status={} currentPoints={} returned={}",
                             profile.name(), partial ? "PARTIAL" : "SUCCESS",
                             String.format(Locale.ROOT, "%.2f", ranking.currentPoints()), ranking.targets().size());
                    return AdvisorResponse.of(partial, ranking, warnings, quality);
                });
        });
    }

    public Collection<StrategyProfile> strategies() {
        return profiles.all();
    }

    // ── Request validation ─────────────────────────────────────────

    private ScoringPeriod period(Integer requestedWeek, Integer requestedSeason, List<String> clinchedTeams) {
        if (requestedWeek == null) {
            throw new IllegalArgumentException("week is required");
        }
        int week = requestedWeek;
        if (week < ByeWeekTable.FIRST_WEEK || week > ByeWeekTable.LAST_WEEK) {
            throw new IllegalArgumentException("week must be between " + ByeWeekTable.FIRST_WEEK
                + " and " + ByeWeekTable.LAST_WEEK + ", got " + week);
        }
        int season = requestedSeason == null ? props.getSeason() : requestedSeason;
        return new ScoringPeriod(season, week, clinchedTeams == null ? null : new HashSet<>(clinchedTeams));
    }

    private List<RosterSlot> slots(String template, List<String> labels) {
        if (labels != null && !labels.isEmpty()) {
            return RosterTemplates.fromLabels(labels);
        }
        return RosterTemplates.template(template);
    }
}
