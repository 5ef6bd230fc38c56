package com.cvrfplatform.belief.controller;

import com.cvrfplatform.belief.dto.CloseEpisodeRequest;
import com.cvrfplatform.belief.dto.CvrfHealthDTO;
import com.cvrfplatform.belief.dto.DecisionRequest;
import com.cvrfplatform.belief.dto.RiskCheckRequest;
import com.cvrfplatform.belief.service.CvrfService;
import com.cvrfplatform.common.model.BeliefState;
import com.cvrfplatform.common.model.BeliefTimeline;
import com.cvrfplatform.common.model.CvrfCycleResult;
import com.cvrfplatform.common.model.CvrfPerformanceMetrics;
import com.cvrfplatform.common.model.CycleMetaPrompt;
import com.cvrfplatform.common.model.Decision;
import com.cvrfplatform.common.model.Episode;
import com.cvrfplatform.common.model.EpisodeCloseResult;
import com.cvrfplatform.common.model.EpisodeSummary;
import com.cvrfplatform.common.model.OptimizationConstraints;
import com.cvrfplatform.common.model.RiskControlResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@RequestMapping("/api/v1/cvrf/{userId}")
public class CvrfController {

    private static final Logger log = LoggerFactory.getLogger(CvrfController.class);

    private final CvrfService cvrfService;

    public CvrfController(CvrfService cvrfService) {
        this.cvrfService = cvrfService;
    }

    // ── episode lifecycle ────────────────────────────────────────────────────

    @PostMapping("/episodes/start")
    public Mono<ResponseEntity<Episode>> startEpisode(@PathVariable String userId) {
        log.info("Episode start requested. userId={}", userId);
        return cvrfService.startEpisode(userId)
            .map(ResponseEntity::ok);
    }

    @PostMapping("/decisions")
    public Mono<ResponseEntity<Decision>> recordDecision(@PathVariable String userId,
                                                         @RequestBody DecisionRequest request) {
        log.info("Decision received. userId={} symbol={} action={}",
                 userId, request.symbol(), request.action());
        return cvrfService.recordDecision(userId, request.toDecision())
            .map(ResponseEntity::ok);
    }

    @PostMapping("/episodes/close")
    public Mono<ResponseEntity<EpisodeCloseResult>> closeEpisode(@PathVariable String userId,
                                                                 @RequestBody CloseEpisodeRequest request) {
        log.info("Episode close requested. userId={} return={} runCvrf={}",
                 userId, request.portfolioReturn(), request.runCvrfOrDefault());
        return cvrfService.closeEpisode(userId, request.toMetrics(), request.runCvrfOrDefault())
            .map(ResponseEntity::ok);
    }

    @GetMapping("/episodes/active")
    public Mono<ResponseEntity<Episode>> activeEpisode(@PathVariable String userId) {
        log.info("Active episode query received. userId={}", userId);
        return cvrfService.getActiveEpisode(userId)
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @GetMapping("/episodes")
    public Flux<EpisodeSummary> completedEpisodes(@PathVariable String userId,
                                                  @RequestParam(defaultValue = "10") int limit) {
        log.info("Completed episodes query received. userId={} limit={}", userId, limit);
        return cvrfService.getCompletedEpisodes(userId, limit);
    }

    // ── beliefs ──────────────────────────────────────────────────────────────

    @GetMapping("/beliefs")
    public Mono<ResponseEntity<BeliefState>> beliefs(@PathVariable String userId) {
        log.info("Beliefs query received. userId={}", userId);
        return cvrfService.getCurrentBeliefs(userId)
            .map(ResponseEntity::ok);
    }

    @GetMapping("/constraints")
    public Mono<ResponseEntity<OptimizationConstraints>> constraints(@PathVariable String userId) {
        log.info("Constraints query received. userId={}", userId);
        return cvrfService.getOptimizationConstraints(userId)
            .map(ResponseEntity::ok);
    }

    @GetMapping("/history")
    public Flux<CvrfCycleResult> history(@PathVariable String userId) {
        log.info("Cycle history query received. userId={}", userId);
        return cvrfService.getCycleHistory(userId);
    }

    @GetMapping("/stats")
    public Mono<ResponseEntity<CvrfPerformanceMetrics>> stats(@PathVariable String userId) {
        log.info("Performance metrics query received. userId={}", userId);
        return cvrfService.getPerformanceMetrics(userId)
            .map(ResponseEntity::ok);
    }

    @PostMapping("/risk")
    public Mono<ResponseEntity<RiskControlResult>> risk(@PathVariable String userId,
                                                        @RequestBody RiskCheckRequest request) {
        log.info("Within-episode risk check received. userId={} returns={} positions={}", userId,
                 request.returns() == null ? 0 : request.returns().size(),
                 request.positions() == null ? 0 : request.positions().size());
        return cvrfService.checkWithinEpisodeRisk(userId, request.returns(), request.positions())
            .map(ResponseEntity::ok);
    }

    @GetMapping("/beliefs/timeline")
    public Mono<ResponseEntity<BeliefTimeline>> timeline(@PathVariable String userId,
                                                         @RequestParam(defaultValue = "30") int days) {
        log.info("Belief timeline query received. userId={} days={}", userId, days);
        return cvrfService.getBeliefTimeline(userId, days)
            .map(ResponseEntity::ok);
    }

    /** 204 before the first cycle. */
    @GetMapping("/meta-prompt")
    public Mono<ResponseEntity<CycleMetaPrompt>> metaPrompt(@PathVariable String userId) {
        log.info("Meta-prompt query received. userId={}", userId);
        return cvrfService.getLatestMetaPrompt(userId)
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.noContent().build());
    }

    /** Runs every owed cycle, oldest first. 204 when nothing was owed. */
    @PostMapping("/cycles/run")
    public Mono<ResponseEntity<List<CvrfCycleResult>>> runCycles(@PathVariable String userId) {
        log.info("Manual cycle requested. userId={}", userId);
        return cvrfService.runDeferredCycles(userId)
            .map(results -> results.isEmpty()
                ? ResponseEntity.noContent().<List<CvrfCycleResult>>build()
                : ResponseEntity.ok(results));
    }

    @GetMapping("/health")
    public Mono<ResponseEntity<CvrfHealthDTO>> health(@PathVariable String userId) {
        return cvrfService.getHealth(userId)
            .map(ResponseEntity::ok);
    }
}
