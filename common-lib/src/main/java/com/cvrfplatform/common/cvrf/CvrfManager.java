package com.cvrfplatform.common.cvrf;

import com.cvrfplatform.common.belief.BeliefUpdater;
import com.cvrfplatform.common.concept.ConceptExtractor;
import com.cvrfplatform.common.config.CvrfConfig;
import com.cvrfplatform.common.exception.ConcurrentCycleException;
import com.cvrfplatform.common.exception.ValidationException;
import com.cvrfplatform.common.model.BeliefState;
import com.cvrfplatform.common.model.BeliefTimeline;
import com.cvrfplatform.common.model.ConceptualInsight;
import com.cvrfplatform.common.model.CvrfCycleResult;
import com.cvrfplatform.common.model.CvrfPerformanceMetrics;
import com.cvrfplatform.common.model.CycleMetaPrompt;
import com.cvrfplatform.common.model.Episode;
import com.cvrfplatform.common.model.EpisodeComparison;
import com.cvrfplatform.common.model.OptimizationConstraints;
import com.cvrfplatform.common.model.PortfolioPosition;
import com.cvrfplatform.common.model.RiskControlResult;
import com.cvrfplatform.common.risk.BeliefTimelineCalculator;
import com.cvrfplatform.common.risk.ConstraintCalculator;
import com.cvrfplatform.common.risk.PerformanceMetricsCalculator;
import com.cvrfplatform.common.risk.WithinEpisodeRiskCheck;
import com.cvrfplatform.common.store.CvrfStore;
import com.cvrfplatform.common.store.CycleCommit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Orchestrates one comparison/update cycle per user and exposes read-only views of
 * the committed beliefs.
 *
 * <h3>Cycle rules</h3>
 * <ul>
 *   <li>at most one cycle in flight per user; a second caller is rejected, not queued</li>
 *   <li>the version is bumped only when the update carried signal</li>
 *   <li>episode close, belief state and cycle result are committed together with an
 *       optimistic check against the version read at cycle start</li>
 *   <li>the in-memory snapshot is replaced only after the commit succeeded</li>
 *   <li>each consecutive pair of completed episodes is compared exactly once, in
 *       episode order; pairs skipped by deferred closes are owed until run</li>
 * </ul>
 *
 * <p>Cycles of distinct users never contend.
 */
public class CvrfManager {

    private static final Logger log = LoggerFactory.getLogger(CvrfManager.class);

    public static final int MAX_TIMELINE_DAYS = 365;

    private final CvrfStore            store;
    private final BeliefHandleRegistry registry;
    private final ConceptExtractor     extractor;
    private final BeliefUpdater        updater;
    private final CvrfConfig           config;
    private final Clock                clock;

    public CvrfManager(CvrfStore store, BeliefHandleRegistry registry, CvrfConfig config, Clock clock) {
        this.store     = store;
        this.registry  = registry;
        this.extractor = new ConceptExtractor(config);
        this.updater   = new BeliefUpdater(config);
        this.config    = config;
        this.clock     = clock;
    }

    /**
     * Compares two completed episodes and commits the resulting belief change.
     *
     * @throws ConcurrentCycleException if a cycle for this user is already running or
     *                                  another writer committed first
     */
    public CvrfCycleResult runCycle(String userId, Episode earlier, Episode later) {
        UserBeliefHandle handle = begin(userId);
        try {
            return cycle(handle, userId, earlier, later, null);
        } finally {
            handle.endCycle();
        }
    }

    /**
     * Same as {@link #runCycle} but also commits {@code closing} (the completed copy of
     * the user's active episode) in the same atomic unit. Cycles still owed by earlier
     * deferred closes run first, so history stays in episode order.
     */
    public CvrfCycleResult runCycleClosing(String userId, Episode earlier, Episode closing) {
        UserBeliefHandle handle = begin(userId);
        try {
            runOwed(handle, userId);
            return cycle(handle, userId, earlier, closing, closing);
        } finally {
            handle.endCycle();
        }
    }

    /**
     * Runs every cycle that deferred closes skipped: each consecutive pair of completed
     * episodes whose later episode was never compared, oldest pair first.
     *
     * @return the committed results in order, empty when nothing is owed
     */
    public List<CvrfCycleResult> runDeferredCycles(String userId) {
        UserBeliefHandle handle = begin(userId);
        try {
            return runOwed(handle, userId);
        } finally {
            handle.endCycle();
        }
    }

    public BeliefState getCurrentBeliefs(String userId) {
        return registry.handle(userId).snapshot();
    }

    public OptimizationConstraints getOptimizationConstraints(String userId) {
        return ConstraintCalculator.fromBeliefs(getCurrentBeliefs(userId));
    }

    /** Oldest first. Each call re-reads the store, so the sequence is restartable. */
    public List<CvrfCycleResult> getCycleHistory(String userId) {
        return store.loadCycleHistory(userId);
    }

    /**
     * @param days trailing window, 1 to {@value #MAX_TIMELINE_DAYS}
     * @throws ValidationException if {@code days} is out of range
     */
    public BeliefTimeline getBeliefTimeline(String userId, int days) {
        if (days < 1 || days > MAX_TIMELINE_DAYS) {
            throw new ValidationException(userId, "days", "must be within [1, " + MAX_TIMELINE_DAYS + "], was " + days);
        }
        return BeliefTimelineCalculator.compute(store.loadCycleHistory(userId), days, clock.instant());
    }

    /** @return the latest cycle's meta-prompt, or {@code null} before the first cycle */
    public CycleMetaPrompt getLatestMetaPrompt(String userId) {
        List<CvrfCycleResult> history = store.loadCycleHistory(userId);
        return history.isEmpty() ? null : CycleMetaPrompt.of(history.get(history.size() - 1));
    }

    public RiskControlResult checkWithinEpisodeRisk(String userId, List<Double> returns,
                                                    List<PortfolioPosition> positions) {
        BeliefState beliefs = getCurrentBeliefs(userId);
        if (!config.withinEpisodeCvarEnabled()) {
            return RiskControlResult.notTriggered(0.0, beliefs.maxDrawdownThreshold());
        }
        RiskControlResult result = WithinEpisodeRiskCheck.evaluate(beliefs, returns, positions,
            config.cvarConfidenceLevel());
        if (result.triggered()) {
            log.warn("Within-episode CVaR breach. userId={} cvar={} threshold={} action={} magnitude={}",
                userId, result.currentCvar(), result.threshold(), result.adjustmentType(), result.magnitude());
        }
        return result;
    }

    public CvrfPerformanceMetrics getPerformanceMetrics(String userId) {
        return PerformanceMetricsCalculator.compute(store.loadCycleHistory(userId));
    }

    // ── cycle ──────────────────────────────────────────────────────────────

    private UserBeliefHandle begin(String userId) {
        UserBeliefHandle handle = registry.handle(userId);
        if (!handle.tryBeginCycle()) {
            throw new ConcurrentCycleException(userId, "A CVRF cycle is already running for this user");
        }
        return handle;
    }

    /**
     * Each consecutive pair is compared exactly once, so the number of owed cycles is
     * (completed episodes - 1) - history size. Episodes are loaded only when that is positive.
     */
    private List<CvrfCycleResult> runOwed(UserBeliefHandle handle, String userId) {
        int completed = store.countCompletedEpisodes(userId);
        List<CvrfCycleResult> history = store.loadCycleHistory(userId);
        if (completed - 1 <= history.size()) {
            return List.of();
        }

        Set<String> compared = new HashSet<>();
        history.forEach(c -> compared.add(c.episodeComparison().laterEpisodeId()));

        List<Episode> episodes = new ArrayList<>(store.loadCompletedEpisodes(userId, completed));
        Collections.reverse(episodes);

        List<CvrfCycleResult> results = new ArrayList<>();
        for (int i = 1; i < episodes.size(); i++) {
            Episode later = episodes.get(i);
            if (!compared.contains(later.id())) {
                log.info("Running owed cycle. userId={} earlier={} later={}",
                    userId, episodes.get(i - 1).id(), later.id());
                results.add(cycle(handle, userId, episodes.get(i - 1), later, null));
            }
        }
        return results;
    }

    private CvrfCycleResult cycle(UserBeliefHandle handle, String userId, Episode earlier, Episode later,
                                  Episode closing) {
        BeliefState current = handle.snapshot();
        List<CvrfCycleResult> history = store.loadCycleHistory(userId);

        Double previousDelta = history.isEmpty()
            ? null
            : history.get(history.size() - 1).episodeComparison().performanceDelta();

        ConceptExtractor.ExtractionResult extraction = extractor.extract(earlier, later, previousDelta);
        EpisodeComparison comparison = extraction.comparison();

        BeliefUpdater.UpdateResult update = updater.update(current, comparison,
            extraction.insights(), deltaWindow(history, comparison.performanceDelta()));

        BeliefState next = update.changed()
            ? update.newState().withVersion(current.version() + 1, update.newState().updatedAt())
            : current;

        CvrfCycleResult result = new CvrfCycleResult(
            UUID.randomUUID().toString(),
            history.size() + 1,
            userId,
            clock.instant(),
            comparison,
            extraction.insights(),
            update.metaPrompt(),
            update.updates(),
            next,
            explain(comparison, extraction.insights(), update, next),
            update.learningRate(),
            update.changed());

        try {
            store.commit(new CycleCommit(userId, closing,
                update.changed() ? next : null, current.version(), result));
        } catch (ConcurrentCycleException e) {
            registry.refresh(handle);
            throw e;
        }
        handle.publish(next);

        log.info("CVRF cycle committed. userId={} cycle={} delta={} overlap={} insights={} lr={} version={}",
            userId, result.cycleNumber(), comparison.performanceDelta(), comparison.decisionOverlap(),
            extraction.insights().size(), update.learningRate(), next.version());
        return result;
    }

    /** Previous cycle deltas, oldest first, ending with the current one. */
    private List<Double> deltaWindow(List<CvrfCycleResult> history, double currentDelta) {
        int keep = Math.max(0, config.regimeWindow() - 1);
        List<Double> window = new ArrayList<>();
        for (int i = Math.max(0, history.size() - keep); i < history.size(); i++) {
            window.add(history.get(i).episodeComparison().performanceDelta());
        }
        window.add(currentDelta);
        return window;
    }

    private static String explain(EpisodeComparison comparison, List<ConceptualInsight> insights,
                                  BeliefUpdater.UpdateResult update, BeliefState next) {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format(Locale.ROOT,
            "Compared episodes %s -> %s: performance delta %.2f%%, decision overlap %.1f%%, learning rate %.3f. ",
            comparison.earlierEpisodeId(), comparison.laterEpisodeId(),
            comparison.performanceDelta() * 100, comparison.decisionOverlap() * 100, update.learningRate()));

        if (insights.isEmpty()) {
            sb.append("No significant insight; beliefs unchanged.");
            return sb.toString();
        }

        sb.append(insights.size()).append(" insight(s); top: ").append(insights.get(0).concept()).append(". ");
        Map<String, Double> adjustments = update.metaPrompt().factorAdjustments();
        if (!adjustments.isEmpty()) {
            List<String> parts = new ArrayList<>();
            adjustments.forEach((factor, change) -> parts.add(String.format(Locale.ROOT, "%s %s%.4f",
                factor, change > 0 ? "+" : "", change)));
            sb.append("Factor adjustments: ").append(String.join(", ", parts)).append(". ");
        }
        sb.append(String.format(Locale.ROOT, "Regime %s (%.0f%% confidence), belief version %d.",
            next.currentRegime().name().toLowerCase(Locale.ROOT), next.regimeConfidence() * 100,
            next.version()));
        return sb.toString();
    }
}
