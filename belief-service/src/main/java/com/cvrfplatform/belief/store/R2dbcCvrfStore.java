package com.cvrfplatform.belief.store;

import com.cvrfplatform.belief.model.BeliefRecord;
import com.cvrfplatform.belief.model.EpisodeRecord;
import com.cvrfplatform.belief.repository.BeliefRecordRepository;
import com.cvrfplatform.belief.repository.CycleRecordRepository;
import com.cvrfplatform.belief.repository.DecisionRecordRepository;
import com.cvrfplatform.belief.repository.EpisodeRecordRepository;
import com.cvrfplatform.common.exception.ConcurrentCycleException;
import com.cvrfplatform.common.exception.StateException;
import com.cvrfplatform.common.exception.ValidationException;
import com.cvrfplatform.common.model.BeliefState;
import com.cvrfplatform.common.model.CvrfCycleResult;
import com.cvrfplatform.common.model.Decision;
import com.cvrfplatform.common.model.Episode;
import com.cvrfplatform.common.model.EpisodeStatus;
import com.cvrfplatform.common.store.CvrfStore;
import com.cvrfplatform.common.store.CycleCommit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.r2dbc.core.R2dbcEntityTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

/**
 * PostgreSQL-backed {@link CvrfStore} over Spring Data R2DBC.
 *
 * <p>The engine calls the store synchronously, so every pipeline is blocked on with
 * the configured timeout. Callers must therefore run on a thread that may block
 * (the service layer schedules all engine work on {@code boundedElastic}).
 *
 * <p>{@link #commit(CycleCommit)} runs in one R2DBC transaction:
 * <pre>
 *   lock belief row (FOR UPDATE) → verify expected version
 *     → complete episode (guarded by status = 'ACTIVE') → stamp decision outcomes
 *     → insert/update belief row → append cycle row
 * </pre>
 * Any failure rolls the whole unit back. Unique-key violations (a racing belief
 * insert or a duplicate cycle number) surface as {@link ConcurrentCycleException}.
 */
@Component
public class R2dbcCvrfStore implements CvrfStore {

    private static final Logger log = LoggerFactory.getLogger(R2dbcCvrfStore.class);

    private static final long NO_ROW = -1L;

    private final EpisodeRecordRepository  episodeRepository;
    private final DecisionRecordRepository decisionRepository;
    private final BeliefRecordRepository   beliefRepository;
    private final CycleRecordRepository    cycleRepository;
    private final R2dbcEntityTemplate      template;
    private final TransactionalOperator    transactionalOperator;
    private final CvrfRecordMapper         mapper;
    private final Duration                 timeout;

    public R2dbcCvrfStore(EpisodeRecordRepository episodeRepository,
                          DecisionRecordRepository decisionRepository,
                          BeliefRecordRepository beliefRepository,
                          CycleRecordRepository cycleRepository,
                          R2dbcEntityTemplate template,
                          TransactionalOperator transactionalOperator,
                          CvrfRecordMapper mapper,
                          @Value("${cvrf.persistence.timeout-ms:5000}") long timeoutMs) {
        this.episodeRepository     = episodeRepository;
        this.decisionRepository    = decisionRepository;
        this.beliefRepository      = beliefRepository;
        this.cycleRepository       = cycleRepository;
        this.template              = template;
        this.transactionalOperator = transactionalOperator;
        this.mapper                = mapper;
        this.timeout               = Duration.ofMillis(timeoutMs);
    }

    // ── reads ────────────────────────────────────────────────────────────────

    @Override
    public BeliefState loadBeliefs(String userId) {
        return beliefRepository.findById(userId)
            .map(mapper::toState)
            .block(timeout);
    }

    @Override
    public Episode loadActiveEpisode(String userId) {
        return episodeRepository.findFirstByUserIdAndStatus(userId, EpisodeStatus.ACTIVE.name())
            .flatMap(this::withDecisions)
            .block(timeout);
    }

    @Override
    public List<Episode> loadCompletedEpisodes(String userId, int limit) {
        return episodeRepository.findRecentCompleted(userId, limit)
            .concatMap(this::withDecisions)
            .collectList()
            .block(timeout);
    }

    @Override
    public int countCompletedEpisodes(String userId) {
        Long count = episodeRepository.countByUserIdAndStatus(userId, EpisodeStatus.COMPLETED.name())
            .defaultIfEmpty(0L)
            .block(timeout);
        return count == null ? 0 : count.intValue();
    }

    @Override
    public List<CvrfCycleResult> loadCycleHistory(String userId) {
        return cycleRepository.findHistory(userId)
            .map(mapper::toCycleResult)
            .collectList()
            .block(timeout);
    }

    @Override
    public int lastEpisodeNumber(String userId) {
        Integer last = episodeRepository.findLastEpisodeNumber(userId)
            .defaultIfEmpty(0)
            .block(timeout);
        return last == null ? 0 : last;
    }

    // ── writes ───────────────────────────────────────────────────────────────

    @Override
    public void createEpisode(Episode episode) {
        String userId = episode.userId();
        episodeRepository.findFirstByUserIdAndStatus(userId, EpisodeStatus.ACTIVE.name())
            .flatMap(existing -> Mono.<EpisodeRecord>error(() ->
                new StateException(userId, "Episode " + existing.getId() + " is already active")))
            .then(template.insert(mapper.toRecord(episode)))
            .as(transactionalOperator::transactional)
            .onErrorMap(DataIntegrityViolationException.class,
                e -> new StateException(userId, "An episode is already active"))
            .doOnSuccess(r -> log.debug("Episode row inserted. userId={} episode={} number={}",
                userId, episode.id(), episode.episodeNumber()))
            .block(timeout);
    }

    @Override
    public void appendDecision(String userId, String episodeId, Decision decision) {
        episodeRepository.findById(episodeId)
            .filter(r -> userId.equals(r.getUserId()) && EpisodeStatus.ACTIVE.name().equals(r.getStatus()))
            .switchIfEmpty(Mono.error(() -> new StateException(userId, "Episode " + episodeId + " is not active")))
            .flatMap(r -> decisionRepository.findLastSeq(episodeId).defaultIfEmpty(0))
            .flatMap(last -> template.insert(mapper.toRecord(userId, episodeId, last + 1, decision)))
            .as(transactionalOperator::transactional)
            .onErrorMap(DataIntegrityViolationException.class,
                e -> new ValidationException(userId, "id", "decision id " + decision.id() + " is already in use"))
            .block(timeout);
    }

    @Override
    public void commit(CycleCommit commit) {
        String userId = commit.userId();
        checkVersionAndWriteBeliefs(commit)
            .then(completeEpisode(commit))
            .then(appendCycle(commit))
            .as(transactionalOperator::transactional)
            .onErrorMap(DataIntegrityViolationException.class,
                e -> new ConcurrentCycleException(userId, "Concurrent write rejected: " + e.getMessage()))
            .doOnSuccess(v -> log.debug("Commit applied. userId={} closedEpisode={} beliefVersion={} cycle={}",
                userId,
                commit.hasClosedEpisode() ? commit.closedEpisode().id() : null,
                commit.hasBeliefState() ? commit.beliefState().version() : null,
                commit.hasCycleResult() ? commit.cycleResult().cycleNumber() : null))
            .block(timeout);
    }

    // ── commit steps ─────────────────────────────────────────────────────────

    private Mono<Void> checkVersionAndWriteBeliefs(CycleCommit commit) {
        if (commit.expectedVersion() == null && !commit.hasBeliefState()) {
            return Mono.empty();
        }
        String userId = commit.userId();
        return beliefRepository.lockByUserId(userId)
            .map(BeliefRecord::getVersion)
            .defaultIfEmpty(NO_ROW)
            .flatMap(stored -> {
                long current = stored == NO_ROW ? BeliefState.INITIAL_VERSION : stored;
                if (commit.expectedVersion() != null && current != commit.expectedVersion()) {
                    return Mono.<Void>error(new ConcurrentCycleException(userId,
                        "Belief version changed: expected=" + commit.expectedVersion() + " actual=" + current));
                }
                if (!commit.hasBeliefState()) {
                    return Mono.<Void>empty();
                }
                BeliefRecord record = mapper.toRecord(commit.beliefState());
                return stored == NO_ROW
                    ? template.insert(record).then()
                    : template.update(record).then();
            });
    }

    private Mono<Void> completeEpisode(CycleCommit commit) {
        if (!commit.hasClosedEpisode()) {
            return Mono.empty();
        }
        Episode episode = commit.closedEpisode();
        return episodeRepository.complete(episode.id(), CvrfRecordMapper.toUtc(episode.endDate()),
                episode.portfolioReturn(), episode.sharpeRatio(), episode.maxDrawdown())
            .flatMap(rows -> rows == 0
                ? Mono.<Void>error(new StateException(commit.userId(), "Episode " + episode.id() + " is not active"))
                : Mono.<Void>empty())
            .thenMany(Flux.fromIterable(episode.decisions())
                .filter(d -> d.outcomeReturn() != null)
                .concatMap(d -> decisionRepository.updateOutcome(d.id(), episode.id(), d.outcomeReturn())))
            .then();
    }

    private Mono<Void> appendCycle(CycleCommit commit) {
        if (!commit.hasCycleResult()) {
            return Mono.empty();
        }
        return template.insert(mapper.toRecord(commit.cycleResult())).then();
    }

    private Mono<Episode> withDecisions(EpisodeRecord record) {
        return decisionRepository.findByEpisodeIdOrderBySeqAsc(record.getId())
            .collectList()
            .map(rows -> mapper.toEpisode(record, rows));
    }
}
