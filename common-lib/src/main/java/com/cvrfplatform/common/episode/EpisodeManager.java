package com.cvrfplatform.common.episode;

import com.cvrfplatform.common.cvrf.BeliefHandleRegistry;
import com.cvrfplatform.common.cvrf.CvrfManager;
import com.cvrfplatform.common.exception.StateException;
import com.cvrfplatform.common.exception.ValidationException;
import com.cvrfplatform.common.model.CvrfCycleResult;
import com.cvrfplatform.common.model.Decision;
import com.cvrfplatform.common.model.Episode;
import com.cvrfplatform.common.model.EpisodeCloseResult;
import com.cvrfplatform.common.model.EpisodeMetrics;
import com.cvrfplatform.common.model.EpisodeSummary;
import com.cvrfplatform.common.model.TradeAction;
import com.cvrfplatform.common.store.CvrfStore;
import com.cvrfplatform.common.store.CycleCommit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Owns the per-user episode lifecycle:
 * NoEpisode → start → Active → (decision)* → close → NoEpisode → start → Active[next].
 *
 * <p>All mutations for one user run under that user's lifecycle lock. A close that
 * fails for any reason commits nothing, so the episode stays ACTIVE.
 */
public class EpisodeManager {

    private static final Logger log = LoggerFactory.getLogger(EpisodeManager.class);

    private final CvrfStore            store;
    private final CvrfManager          cvrfManager;
    private final BeliefHandleRegistry registry;
    private final Clock                clock;

    public EpisodeManager(CvrfStore store, CvrfManager cvrfManager, BeliefHandleRegistry registry,
                          Clock clock) {
        this.store       = store;
        this.cvrfManager = cvrfManager;
        this.registry    = registry;
        this.clock       = clock;
    }

    /**
     * @throws StateException if the user already has an active episode; that episode
     *                        is left untouched
     */
    public Episode startEpisode(String userId) {
        requireUser(userId);
        return withLock(userId, () -> {
            Episode active = store.loadActiveEpisode(userId);
            if (active != null) {
                throw new StateException(userId,
                    "Episode " + active.episodeNumber() + " is already active (id=" + active.id() + ")");
            }
            Episode episode = Episode.start(UUID.randomUUID().toString(), userId,
                store.lastEpisodeNumber(userId) + 1, clock.instant());
            store.createEpisode(episode);
            log.info("Episode started. userId={} episode={} number={}", userId, episode.id(),
                episode.episodeNumber());
            return episode;
        });
    }

    /**
     * Appends to the active episode in call order. Assigns an id and a timestamp when absent.
     *
     * @return the decision as stored
     */
    public Decision recordDecision(String userId, Decision decision) {
        requireUser(userId);
        validate(userId, decision);
        return withLock(userId, () -> {
            Episode active = store.loadActiveEpisode(userId);
            if (active == null) {
                throw new StateException(userId, "No active episode to record a decision in");
            }
            Decision stored = decision.id() == null || decision.id().isBlank()
                ? decision.withId(UUID.randomUUID().toString())
                : decision;
            if (stored.timestamp() == null) {
                stored = stored.withTimestamp(clock.instant());
            }
            store.appendDecision(userId, active.id(), stored);
            log.debug("Decision recorded. userId={} episode={} symbol={} action={}",
                userId, active.id(), stored.symbol(), stored.action());
            return stored;
        });
    }

    /**
     * Completes the active episode and, when {@code runCvrf} is set and an earlier
     * completed episode exists, runs the comparison cycle in the same commit. Cycles
     * still owed by earlier deferred closes are run first.
     *
     * <p>The next episode is not started here: after a close the user has no active
     * episode until the caller invokes {@link #startEpisode}. Callers that want the
     * close → next-episode transition as one step call both in sequence; keeping them
     * apart lets a failed start be retried without re-closing.
     *
     * @param runCvrf false defers learning to the batch job
     */
    public EpisodeCloseResult closeEpisode(String userId, EpisodeMetrics metrics, boolean runCvrf) {
        requireUser(userId);
        validate(userId, metrics);
        return withLock(userId, () -> {
            Episode active = store.loadActiveEpisode(userId);
            if (active == null) {
                throw new StateException(userId, "No active episode to close");
            }
            Instant closedAt = metrics.endDate() != null ? metrics.endDate() : clock.instant();
            if (closedAt.isBefore(active.startDate())) {
                throw new ValidationException(userId, "endDate", "precedes episode start " + active.startDate());
            }
            Episode completed = active.complete(metrics, closedAt);

            List<Episode> previous = store.loadCompletedEpisodes(userId, 1);
            if (previous.isEmpty()) {
                store.commit(CycleCommit.episodeOnly(completed));
                log.info("Episode closed, cold start. userId={} episode={} return={}",
                    userId, completed.id(), completed.portfolioReturn());
                return EpisodeCloseResult.coldStart(completed);
            }
            if (!runCvrf) {
                store.commit(CycleCommit.episodeOnly(completed));
                log.info("Episode closed, cycle deferred. userId={} episode={} return={}",
                    userId, completed.id(), completed.portfolioReturn());
                return EpisodeCloseResult.deferred(completed);
            }

            CvrfCycleResult result = cvrfManager.runCycleClosing(userId, previous.get(0), completed);
            log.info("Episode closed. userId={} episode={} return={} cycle={} beliefChanged={}",
                userId, completed.id(), completed.portfolioReturn(), result.cycleNumber(),
                result.beliefChanged());
            return EpisodeCloseResult.withCycle(completed, result);
        });
    }

    public Episode getActiveEpisode(String userId) {
        return store.loadActiveEpisode(userId);
    }

    /** Most recent first. */
    public List<Episode> getCompletedEpisodes(String userId, int limit) {
        if (limit <= 0) {
            throw new ValidationException(userId, "limit", "must be positive, was " + limit);
        }
        return store.loadCompletedEpisodes(userId, limit);
    }

    public static EpisodeSummary summarize(Episode episode) {
        long buys = episode.decisions().stream().filter(d -> d.action() == TradeAction.BUY).count();
        long sells = episode.decisions().stream().filter(d -> d.action() == TradeAction.SELL).count();
        String headline = episode.isActive()
            ? String.format(Locale.ROOT, "Episode %d in progress: %d decisions (%d buys, %d sells)",
                episode.episodeNumber(), episode.decisions().size(), buys, sells)
            : String.format(Locale.ROOT,
                "Episode %d: %.2f%% return, Sharpe %.2f, max drawdown %.2f%%, %d decisions (%d buys, %d sells)",
                episode.episodeNumber(), episode.portfolioReturn() * 100, episode.sharpeRatio(),
                episode.maxDrawdown() * 100, episode.decisions().size(), buys, sells);
        return new EpisodeSummary(episode.id(), episode.episodeNumber(), episode.status(),
            episode.startDate(), episode.endDate(), episode.decisions().size(),
            episode.portfolioReturn(), episode.sharpeRatio(), episode.maxDrawdown(), headline);
    }

    // ── validation ─────────────────────────────────────────────────────────

    private static void requireUser(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new ValidationException(String.valueOf(userId), "userId", "must not be blank");
        }
    }

    private static void validate(String userId, Decision d) {
        if (d == null) {
            throw new ValidationException(userId, "decision", "must not be null");
        }
        if (d.symbol() == null || d.symbol().isBlank()) {
            throw new ValidationException(userId, "symbol", "must not be blank");
        }
        if (d.action() == null) {
            throw new ValidationException(userId, "action", "must not be null");
        }
        if (!Double.isFinite(d.confidence()) || d.confidence() < 0.0 || d.confidence() > 1.0) {
            throw new ValidationException(userId, "confidence", "must be within [0, 1], was " + d.confidence());
        }
        if (d.sentiment() != null) {
            if (d.sentiment().label() == null) {
                throw new ValidationException(userId, "sentiment.label", "must not be null");
            }
            double sc = d.sentiment().confidence();
            if (!Double.isFinite(sc) || sc < 0.0 || sc > 1.0) {
                throw new ValidationException(userId, "sentiment.confidence", "must be within [0, 1], was " + sc);
            }
        }
        requireFinite(userId, "weightBefore", d.weightBefore());
        requireFinite(userId, "weightAfter", d.weightAfter());
        for (Map.Entry<String, Double> e : d.factors().entrySet()) {
            if (e.getKey() == null || e.getKey().isBlank()) {
                throw new ValidationException(userId, "factors", "factor name must not be blank");
            }
            if (e.getValue() == null || !Double.isFinite(e.getValue())) {
                throw new ValidationException(userId, "factors." + e.getKey(), "exposure must be finite");
            }
        }
    }

    private static void validate(String userId, EpisodeMetrics m) {
        if (m == null) {
            throw new ValidationException(userId, "metrics", "must not be null");
        }
        requireFinite(userId, "portfolioReturn", m.portfolioReturn());
        requireFinite(userId, "sharpeRatio", m.sharpeRatio());
        requireFinite(userId, "maxDrawdown", m.maxDrawdown());
        for (Map.Entry<String, Double> e : m.decisionOutcomes().entrySet()) {
            if (e.getValue() == null || !Double.isFinite(e.getValue())) {
                throw new ValidationException(userId, "decisionOutcomes." + e.getKey(), "outcome must be finite");
            }
        }
    }

    private static void requireFinite(String userId, String field, double value) {
        if (!Double.isFinite(value)) {
            throw new ValidationException(userId, field, "must be finite, was " + value);
        }
    }

    private <T> T withLock(String userId, Supplier<T> action) {
        ReentrantLock lock = registry.handle(userId).lifecycleLock();
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
