package com.lineupadvisor.advisor.controller;

import com.lineupadvisor.advisor.model.AdvisorResponse;
import com.lineupadvisor.advisor.model.DraftRequest;
import com.lineupadvisor.advisor.model.LineupRequest;
import com.lineupadvisor.advisor.model.WaiverRequest;
import com.lineupadvisor.advisor.service.AdvisorService;
import com.lineupadvisor.common.bye.ByeWeekTable;
import com.lineupadvisor.common.model.DraftRanking;
import com.lineupadvisor.common.model.LineupResult;
import com.lineupadvisor.common.model.WaiverRanking;
import com.lineupadvisor.common.strategy.StrategyProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1")
public class AdvisorController {

    private static final Logger log = LoggerFactory.getLogger(AdvisorController.class);

    private final AdvisorService service;
    private final ByeWeekTable byeWeeks;

    public AdvisorController(AdvisorService service, ByeWeekTable byeWeeks) {
        this.service = service;
        this.byeWeeks = byeWeeks;
    }

    @PostMapping("/lineup")
    public Mono<ResponseEntity<AdvisorResponse<LineupResult>>> lineup(@RequestBody LineupRequest request) {
        return service.lineup(request)
            .map(ResponseEntity::ok)
            .onErrorResume(e -> Mono.just(failure("lineup", e)));
    }

    @PostMapping("/draft")
    public Mono<ResponseEntity<AdvisorResponse<DraftRanking>>> draft(@RequestBody DraftRequest request) {
        return service.draft(request)
            .map(ResponseEntity::ok)
            .onErrorResume(e -> Mono.just(failure("draft", e)));
    }

    @PostMapping("/waivers")
    public Mono<ResponseEntity<AdvisorResponse<WaiverRanking>>> waivers(@RequestBody WaiverRequest request) {
        return service.waivers(request)
            .map(ResponseEntity::ok)
            .onErrorResume(e -> Mono.just(failure("waivers", e)));
    }

    @GetMapping("/strategies")
    public ResponseEntity<AdvisorResponse<List<StrategyProfile>>> strategies() {
        return ResponseEntity.ok(AdvisorResponse.success(new ArrayList<>(service.strategies())));
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "UP");
        body.put("strategies", service.strategies().size());
        body.put("byeWeekTeams", byeWeeks.size());
        return ResponseEntity.ok(body);
    }

    /** Unparseable request bodies never reach the service. */
    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<AdvisorResponse<Void>> malformedBody(ServerWebInputException e) {
        log.warn("REQUEST_REJECTED reason={}", e.getReason());
        return ResponseEntity.badRequest().body(AdvisorResponse.error("Malformed request body: " + e.getReason()));
    }

    private static <T> ResponseEntity<AdvisorResponse<T>> failure(String operation, Throwable e) {
        if (e instanceof IllegalArgumentException) {
            log.warn("REQUEST_REJECTED operation={} reason={}", operation, e.getMessage());
            return ResponseEntity.badRequest().body(AdvisorResponse.error(e.getMessage()));
        }
        log.error("REQUEST_FAILED operation={}", operation, e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(AdvisorResponse.error("Internal error while computing " + operation));
    }
}
