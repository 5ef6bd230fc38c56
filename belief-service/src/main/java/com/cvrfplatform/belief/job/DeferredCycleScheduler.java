package com.cvrfplatform.belief.job;

import com.cvrfplatform.belief.service.CvrfService;
import com.cvrfplatform.belief.service.DeferredCycleQueue;
import com.cvrfplatform.common.exception.ConcurrentCycleException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

/**
 * Batch path for closes with {@code runCvrf=false}: periodically drains
 * {@link DeferredCycleQueue} and runs every cycle each user is owed.
 *
 * <pre>
 *   delay(interval) → drain queue → run cycles one user at a time → repeat
 * </pre>
 *
 * <p>Each round is a fresh {@link Mono} pipeline that reschedules itself when it
 * terminates, so the loop never stops. A user whose cycle is rejected because another
 * cycle is in flight is re-queued for the next round; any other failure is logged and
 * the user is re-queued as well, since the pending comparison is still owed.
 */
@Component
public class DeferredCycleScheduler {

    private static final Logger log = LoggerFactory.getLogger(DeferredCycleScheduler.class);

    private final CvrfService        cvrfService;
    private final DeferredCycleQueue queue;

    @Value("${cvrf.batch.enabled:true}")
    private boolean enabled;

    @Value("${cvrf.batch.interval-seconds:60}")
    private long intervalSeconds;

    private volatile Disposable pendingRound;
    private volatile boolean    stopped;

    public DeferredCycleScheduler(CvrfService cvrfService, DeferredCycleQueue queue) {
        this.cvrfService = cvrfService;
        this.queue       = queue;
    }

    @PostConstruct
    public void start() {
        if (!enabled) {
            log.info("Deferred cycle batch disabled.");
            return;
        }
        log.info("Deferred cycle batch started. intervalSeconds={}", intervalSeconds);
        scheduleNextRound(Duration.ofSeconds(intervalSeconds));
    }

    @PreDestroy
    public void stop() {
        stopped = true;
        Disposable round = pendingRound;
        if (round != null) {
            round.dispose();
        }
    }

    /**
     * Runs one round immediately: drains the queue and processes every user in it.
     *
     * @return number of cycles committed in this round
     */
    public Mono<Long> runRound() {
        List<String> users = queue.drain();
        if (users.isEmpty()) {
            return Mono.just(0L);
        }
        log.info("Deferred cycle round. users={}", users.size());
        return Flux.fromIterable(users)
            .concatMap(this::runForUser)
            .reduce(0L, Long::sum);
    }

    // ── loop ─────────────────────────────────────────────────────────────────

    private void scheduleNextRound(Duration delay) {
        if (stopped) {
            return;
        }
        pendingRound = Mono.delay(delay)
            .then(Mono.defer(this::runRound))
            .subscribe(
                committed -> {
                    if (committed > 0) {
                        log.info("Deferred cycle round complete. committed={}", committed);
                    }
                    scheduleNextRound(delay);
                },
                err -> {
                    log.error("Deferred cycle round failed. rescheduling", err);
                    scheduleNextRound(delay);
                }
            );
    }

    private Mono<Long> runForUser(String userId) {
        return cvrfService.runDeferredCycles(userId)
            .map(results -> (long) results.size())
            .onErrorResume(ConcurrentCycleException.class, e -> {
                log.warn("Deferred cycle contended, re-queued. userId={}", userId);
                queue.enqueue(userId);
                return Mono.just(0L);
            })
            .onErrorResume(e -> {
                log.error("Deferred cycle failed, re-queued. userId={}", userId, e);
                queue.enqueue(userId);
                return Mono.just(0L);
            });
    }
}
