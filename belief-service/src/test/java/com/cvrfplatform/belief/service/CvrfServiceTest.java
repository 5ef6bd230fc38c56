package com.cvrfplatform.belief.service;

import com.cvrfplatform.belief.dto.CvrfHealthDTO;
import com.cvrfplatform.common.config.CvrfConfig;
import com.cvrfplatform.common.cvrf.BeliefHandleRegistry;
import com.cvrfplatform.common.cvrf.CvrfManager;
import com.cvrfplatform.common.episode.EpisodeManager;
import com.cvrfplatform.common.exception.StateException;
import com.cvrfplatform.common.exception.ValidationException;
import com.cvrfplatform.common.model.BeliefState;
import com.cvrfplatform.common.model.Decision;
import com.cvrfplatform.common.model.EpisodeCloseResult;
import com.cvrfplatform.common.model.EpisodeMetrics;
import com.cvrfplatform.common.model.EpisodeStatus;
import com.cvrfplatform.common.model.MarketRegime;
import com.cvrfplatform.common.model.TradeAction;
import com.cvrfplatform.common.store.InMemoryCvrfStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CvrfServiceTest {

    private static final String USER = "user-42";
    private static final Instant T0 = Instant.parse("2024-03-01T00:00:00Z");

    private DeferredCycleQueue queue;
    private CvrfService service;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(T0, ZoneOffset.UTC);
        InMemoryCvrfStore store = new InMemoryCvrfStore();
        BeliefHandleRegistry registry = new BeliefHandleRegistry(store, clock);
        CvrfManager cvrfManager = new CvrfManager(store, registry, CvrfConfig.defaults(), clock);
        EpisodeManager episodeManager = new EpisodeManager(store, cvrfManager, registry, clock);
        queue = new DeferredCycleQueue();
        service = new CvrfService(episodeManager, cvrfManager, registry, queue);
    }

    @Test
    @DisplayName("first close on a fresh user → cold start, defaults untouched")
    void coldStart() {
        service.startEpisode(USER).block();
        service.recordDecision(USER, decision("AAPL", TradeAction.BUY)).block();

        StepVerifier.create(service.closeEpisode(USER, EpisodeMetrics.of(0.05, 1.1, 0.02), true))
            .assertNext(r -> {
                assertThat(r.coldStart()).isTrue();
                assertThat(r.cycleResult()).isNull();
                assertThat(r.episode().status()).isEqualTo(EpisodeStatus.COMPLETED);
            })
            .verifyComplete();

        StepVerifier.create(service.getCurrentBeliefs(USER))
            .assertNext(b -> {
                assertThat(b.version()).isEqualTo(BeliefState.INITIAL_VERSION);
                assertThat(b.currentRegime()).isEqualTo(MarketRegime.SIDEWAYS);
            })
            .verifyComplete();
    }

    @Test
    @DisplayName("second start while active → StateException")
    void secondStartRejected() {
        service.startEpisode(USER).block();

        StepVerifier.create(service.startEpisode(USER))
            .expectError(StateException.class)
            .verify();
    }

    @Test
    @DisplayName("decision with confidence outside [0,1] → ValidationException naming the field")
    void invalidDecision() {
        service.startEpisode(USER).block();
        Decision bad = Decision.of("AAPL", TradeAction.BUY, 0.0, 0.1, "x", 1.5, Map.of(), null);

        StepVerifier.create(service.recordDecision(USER, bad))
            .expectErrorSatisfies(e -> {
                assertThat(e).isInstanceOf(ValidationException.class);
                assertThat(((ValidationException) e).getField()).isEqualTo("confidence");
            })
            .verify();
    }

    @Test
    @DisplayName("runCvrf=false → user queued; manual run commits the pending cycle once")
    void deferredClose() {
        completeEpisode(0.02, true);
        EpisodeCloseResult second = completeEpisode(0.05, false);

        assertThat(second.cycleDeferred()).isTrue();
        assertThat(queue.contains(USER)).isTrue();

        StepVerifier.create(service.runDeferredCycles(USER))
            .assertNext(results -> {
                assertThat(results).hasSize(1);
                assertThat(results.get(0).cycleNumber()).isEqualTo(1);
                assertThat(results.get(0).episodeComparison().laterEpisodeId()).isEqualTo(second.episode().id());
            })
            .verifyComplete();

        StepVerifier.create(service.runDeferredCycles(USER))
            .assertNext(results -> assertThat(results).isEmpty())
            .verifyComplete();

        StepVerifier.create(service.getCycleHistory(USER))
            .expectNextCount(1)
            .verifyComplete();
    }

    @Test
    @DisplayName("two deferred closes → one manual run commits both cycles in episode order")
    void twoDeferredCloses() {
        EpisodeCloseResult first = completeEpisode(0.02, true);
        EpisodeCloseResult second = completeEpisode(0.05, false);
        EpisodeCloseResult third = completeEpisode(-0.01, false);

        StepVerifier.create(service.runDeferredCycles(USER))
            .assertNext(results -> assertThat(results)
                .extracting(r -> r.episodeComparison().earlierEpisodeId() + ">" + r.episodeComparison().laterEpisodeId())
                .containsExactly(
                    first.episode().id() + ">" + second.episode().id(),
                    second.episode().id() + ">" + third.episode().id()))
            .verifyComplete();

        StepVerifier.create(service.getCycleHistory(USER))
            .expectNextCount(2)
            .verifyComplete();
    }

    @Test
    @DisplayName("meta-prompt is empty before the first cycle; timeline lists committed cycles")
    void metaPromptAndTimeline() {
        StepVerifier.create(service.getLatestMetaPrompt(USER))
            .verifyComplete();

        completeEpisode(0.02, true);
        completeEpisode(-0.01, true);

        StepVerifier.create(service.getLatestMetaPrompt(USER))
            .assertNext(p -> {
                assertThat(p.cycleNumber()).isEqualTo(1);
                assertThat(p.metaPrompt()).isNotNull();
            })
            .verifyComplete();

        StepVerifier.create(service.getBeliefTimeline(USER, 7))
            .assertNext(t -> {
                assertThat(t.days()).isEqualTo(7);
                assertThat(t.snapshots()).hasSize(1);
            })
            .verifyComplete();

        StepVerifier.create(service.getBeliefTimeline(USER, 0))
            .expectError(ValidationException.class)
            .verify();
    }

    @Test
    @DisplayName("no active episode → empty, not an error")
    void activeEpisodeEmpty() {
        StepVerifier.create(service.getActiveEpisode(USER))
            .verifyComplete();
    }

    @Test
    @DisplayName("completed episodes are summarized most recent first")
    void completedSummaries() {
        completeEpisode(0.01, true);
        completeEpisode(-0.02, true);

        StepVerifier.create(service.getCompletedEpisodes(USER, 10))
            .assertNext(s -> {
                assertThat(s.episodeNumber()).isEqualTo(2);
                assertThat(s.headline()).startsWith("Episode 2: -2.00% return");
            })
            .assertNext(s -> assertThat(s.episodeNumber()).isEqualTo(1))
            .verifyComplete();
    }

    @Test
    @DisplayName("health reflects active episode, pending cycle and cycle count")
    void health() {
        completeEpisode(0.02, true);
        completeEpisode(0.03, false);
        service.startEpisode(USER).block();

        CvrfHealthDTO health = service.getHealth(USER).block();

        assertThat(health).isNotNull();
        assertThat(health.status()).isEqualTo("UP");
        assertThat(health.activeEpisodeNumber()).isEqualTo(3);
        assertThat(health.cyclePending()).isTrue();
        assertThat(health.totalCycles()).isZero();
        assertThat(health.cycleInFlight()).isFalse();
    }

    // ── helpers ──────────────────────────────────────────────────────────────

    private EpisodeCloseResult completeEpisode(double portfolioReturn, boolean runCvrf) {
        service.startEpisode(USER).block();
        Decision stored = service.recordDecision(USER, decision("MSFT", TradeAction.BUY)).block();
        EpisodeMetrics metrics = EpisodeMetrics.of(portfolioReturn, 1.0, 0.03)
            .withOutcomes(Map.of(stored.id(), portfolioReturn));
        return service.closeEpisode(USER, metrics, runCvrf).block();
    }

    private static Decision decision(String symbol, TradeAction action) {
        return Decision.of(symbol, action, 0.05, 0.08, "rebalance", 0.7,
            Map.of("momentum", 0.6, "value", -0.2), null);
    }
}
