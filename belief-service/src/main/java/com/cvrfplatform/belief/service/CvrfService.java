package com.cvrfplatform.belief.service;

import com.cvrfplatform.belief.dto.CvrfHealthDTO;
import com.cvrfplatform.belief.trace.UserLogContext;
import com.cvrfplatform.common.cvrf.BeliefHandleRegistry;
import com.cvrfplatform.common.cvrf.CvrfManager;
import com.cvrfplatform.common.episode.EpisodeManager;
import com.cvrfplatform.common.model.BeliefState;
import com.cvrfplatform.common.model.BeliefTimeline;
import com.cvrfplatform.common.model.CvrfCycleResult;
import com.cvrfplatform.common.model.CvrfPerformanceMetrics;
import com.cvrfplatform.common.model.CycleMetaPrompt;
import com.cvrfplatform.common.model.Decision;
import com.cvrfplatform.common.model.Episode;
import com.cvrfplatform.common.model.EpisodeCloseResult;
import com.cvrfplatform.common.model.EpisodeMetrics;
import com.cvrfplatform.common.model.EpisodeSummary;
import com.cvrfplatform.common.model.OptimizationConstraints;
import com.cvrfplatform.common.model.PortfolioPosition;
import com.cvrfplatform.common.model.RiskControlResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * Reactive façade over the synchronous engine.
 *
 * <p>Every call is wrapped in {@code Mono.fromCallable} and subscribed on
 * {@link Schedulers#boundedElastic()}: the engine holds per-user locks and blocks on
 * the R2DBC store, neither of which may happen on an event-loop thread. The userId is
 * written into the Reactor Context last, so the {@link UserLogContext} consumers
 * upstream of it can put it into MDC.
 *
 * <p>Domain exceptions pass through unchanged; the controller advice maps them to
 * HTTP statuses.
 */
@Service
public class CvrfService {

    private static final Logger log = LoggerFactory.getLogger(CvrfService.class);

    private final EpisodeManager       episodeManager;
    private final CvrfManager          cvrfManager;
    private final BeliefHandleRegistry registry;
    private final DeferredCycleQueue   deferredQueue;

    public CvrfService(EpisodeManager episodeManager, CvrfManager cvrfManager,
                       BeliefHandleRegistry registry, DeferredCycleQueue deferredQueue) {
        this.episodeManager = episodeManager;
        this.cvrfManager    = cvrfManager;
        this.registry       = registry;
        this.deferredQueue  = deferredQueue;
    }

    // ── episode lifecycle ────────────────────────────────────────────────────

    public Mono<Episode> startEpisode(String userId) {
        return engine(() -> episodeManager.startEpisode(userId))
            .doOnEach(UserLogContext.onError(e ->
                log.warn("Episode start rejected. userId={} reason={}", userId, e.getMessage())))
            .contextWrite(UserLogContext.of(userId));
    }

    public Mono<Decision> recordDecision(String userId, Decision decision) {
        return engine(() -> episodeManager.recordDecision(userId, decision))
            .doOnEach(UserLogContext.onError(e ->
                log.warn("Decision rejected. userId={} reason={}", userId, e.getMessage())))
            .contextWrite(UserLogContext.of(userId));
    }

    /**
     * Closes the active episode. A deferred close queues the user for the batch job.
     */
    public Mono<EpisodeCloseResult> closeEpisode(String userId, EpisodeMetrics metrics, boolean runCvrf) {
        return engine(() -> episodeManager.closeEpisode(userId, metrics, runCvrf))
            .doOnNext(r -> {
                if (r.cycleDeferred()) {
                    deferredQueue.enqueue(userId);
                }
            })
            .doOnEach(UserLogContext.onValue(r ->
                log.info("Close handled. userId={} episode={} coldStart={} deferred={} cycle={}",
                    userId, r.episode().id(), r.coldStart(), r.cycleDeferred(),
                    r.cycleResult() == null ? null : r.cycleResult().cycleNumber())))
            .doOnEach(UserLogContext.onError(e ->
                log.warn("Episode close failed. userId={} reason={}", userId, e.getMessage())))
            .contextWrite(UserLogContext.of(userId));
    }

    /** Empty when the user has no active episode. */
    public Mono<Episode> getActiveEpisode(String userId) {
        return engine(() -> episodeManager.getActiveEpisode(userId));
    }

    public Flux<EpisodeSummary> getCompletedEpisodes(String userId, int limit) {
        return engine(() -> episodeManager.getCompletedEpisodes(userId, limit))
            .flatMapIterable(episodes -> episodes)
            .map(EpisodeManager::summarize);
    }

    // ── beliefs ──────────────────────────────────────────────────────────────

    public Mono<BeliefState> getCurrentBeliefs(String userId) {
        return engine(() -> cvrfManager.getCurrentBeliefs(userId));
    }

    public Mono<OptimizationConstraints> getOptimizationConstraints(String userId) {
        return engine(() -> cvrfManager.getOptimizationConstraints(userId));
    }

    public Flux<CvrfCycleResult> getCycleHistory(String userId) {
        return engine(() -> cvrfManager.getCycleHistory(userId))
            .flatMapIterable(history -> history);
    }

    public Mono<BeliefTimeline> getBeliefTimeline(String userId, int days) {
        return engine(() -> cvrfManager.getBeliefTimeline(userId, days));
    }

    /** Empty before the user's first cycle. */
    public Mono<CycleMetaPrompt> getLatestMetaPrompt(String userId) {
        return engine(() -> cvrfManager.getLatestMetaPrompt(userId));
    }

    public Mono<CvrfPerformanceMetrics> getPerformanceMetrics(String userId) {
        return engine(() -> cvrfManager.getPerformanceMetrics(userId));
    }

    public Mono<RiskControlResult> checkWithinEpisodeRisk(String userId, List<Double> returns,
                                                          List<PortfolioPosition> positions) {
        return engine(() -> cvrfManager.checkWithinEpisodeRisk(userId, returns, positions));
    }

    /**
     * Runs every cycle owed by deferred closes, oldest first.
     * The list is empty when nothing was owed.
     */
    public Mono<List<CvrfCycleResult>> runDeferredCycles(String userId) {
        return engine(() -> cvrfManager.runDeferredCycles(userId))
            .doOnEach(UserLogContext.onValue(results -> {
                if (results.isEmpty()) {
                    log.info("Deferred cycles: nothing owed. userId={}", userId);
                } else {
                    log.info("Deferred cycles committed. userId={} count={} lastCycle={}",
                        userId, results.size(), results.get(results.size() - 1).cycleNumber());
                }
            }))
            .doOnEach(UserLogContext.onError(e ->
                log.warn("Deferred cycles failed. userId={} reason={}", userId, e.getMessage())))
            .contextWrite(UserLogContext.of(userId));
    }

    public Mono<CvrfHealthDTO> getHealth(String userId) {
        return engine(() -> {
            BeliefState beliefs = cvrfManager.getCurrentBeliefs(userId);
            Episode active = episodeManager.getActiveEpisode(userId);
            return new CvrfHealthDTO(
                userId,
                "UP",
                beliefs.version(),
                beliefs.currentRegime(),
                active == null ? null : active.episodeNumber(),
                cvrfManager.getCycleHistory(userId).size(),
                deferredQueue.contains(userId),
                registry.handle(userId).isCycleInFlight());
        });
    }

    // ── helpers ──────────────────────────────────────────────────────────────

    private static <T> Mono<T> engine(Callable<T> action) {
        return Mono.fromCallable(action).subscribeOn(Schedulers.boundedElastic());
    }
}
