package com.cvrfplatform.common.episode;

import com.cvrfplatform.common.config.CvrfConfig;
import com.cvrfplatform.common.cvrf.BeliefHandleRegistry;
import com.cvrfplatform.common.cvrf.CvrfManager;
import com.cvrfplatform.common.exception.StateException;
import com.cvrfplatform.common.exception.ValidationException;
import com.cvrfplatform.common.model.Decision;
import com.cvrfplatform.common.model.Episode;
import com.cvrfplatform.common.model.EpisodeCloseResult;
import com.cvrfplatform.common.model.EpisodeStatus;
import com.cvrfplatform.common.model.EpisodeSummary;
import com.cvrfplatform.common.model.SentimentLabel;
import com.cvrfplatform.common.model.SentimentSignal;
import com.cvrfplatform.common.model.TradeAction;
import com.cvrfplatform.common.support.ControllableStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.cvrfplatform.common.support.EpisodeFixtures.T0;
import static com.cvrfplatform.common.support.EpisodeFixtures.buy;
import static com.cvrfplatform.common.support.EpisodeFixtures.decision;
import static com.cvrfplatform.common.support.EpisodeFixtures.metrics;
import static org.junit.jupiter.api.Assertions.*;

class EpisodeManagerTest {

    private static final String USER = "user-1";

    private ControllableStore store;
    private CvrfManager cvrfManager;
    private EpisodeManager episodes;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(T0, ZoneOffset.UTC);
        store = new ControllableStore();
        BeliefHandleRegistry registry = new BeliefHandleRegistry(store, clock);
        cvrfManager = new CvrfManager(store, registry, CvrfConfig.defaults(), clock);
        episodes = new EpisodeManager(store, cvrfManager, registry, clock);
    }

    @Nested
    @DisplayName("startEpisode()")
    class Start {

        @Test
        @DisplayName("numbers episodes from 1 per user")
        void numbering() {
            assertEquals(1, episodes.startEpisode(USER).episodeNumber());
            episodes.closeEpisode(USER, metrics(0.01, Map.of()), true);
            assertEquals(2, episodes.startEpisode(USER).episodeNumber());
            assertEquals(1, episodes.startEpisode("someone-else").episodeNumber());
        }

        @Test
        @DisplayName("second start fails and leaves the active episode untouched")
        void secondStartFails() {
            Episode first = episodes.startEpisode(USER);
            episodes.recordDecision(USER, buy("AAPL"));
            Episode before = episodes.getActiveEpisode(USER);

            assertThrows(StateException.class, () -> episodes.startEpisode(USER));

            Episode after = episodes.getActiveEpisode(USER);
            assertEquals(before, after);
            assertEquals(first.id(), after.id());
        }

        @Test
        @DisplayName("blank user id → ValidationException on userId")
        void blankUser() {
            ValidationException e = assertThrows(ValidationException.class, () -> episodes.startEpisode(" "));
            assertEquals("userId", e.getField());
        }
    }

    @Nested
    @DisplayName("recordDecision()")
    class Record {

        @Test
        @DisplayName("no active episode → StateException")
        void noActive() {
            assertThrows(StateException.class, () -> episodes.recordDecision(USER, buy("AAPL")));
        }

        @Test
        @DisplayName("preserves call order and length, assigns ids")
        void orderPreserved() {
            episodes.startEpisode(USER);
            List<String> symbols = new ArrayList<>();
            for (int i = 0; i < 25; i++) {
                String symbol = "SYM" + i;
                symbols.add(symbol);
                Decision stored = episodes.recordDecision(USER, buy(symbol));
                assertNotNull(stored.id());
            }
            List<Decision> decisions = episodes.getActiveEpisode(USER).decisions();
            assertEquals(25, decisions.size());
            assertEquals(symbols, decisions.stream().map(Decision::symbol).toList());
        }

        @Test
        @DisplayName("confidence outside [0, 1] → ValidationException naming the field")
        void badConfidence() {
            episodes.startEpisode(USER);
            Decision bad = new Decision(null, "AAPL", TradeAction.BUY, 0, 0.1, "r", 1.5, null, null, T0, null);
            ValidationException e = assertThrows(ValidationException.class, () -> episodes.recordDecision(USER, bad));
            assertEquals("confidence", e.getField());
            assertTrue(episodes.getActiveEpisode(USER).decisions().isEmpty());
        }

        @Test
        @DisplayName("non-finite factor exposure → ValidationException")
        void badFactor() {
            episodes.startEpisode(USER);
            Decision bad = decision(null, "AAPL", TradeAction.BUY, Map.of("momentum", Double.NaN), null);
            ValidationException e = assertThrows(ValidationException.class, () -> episodes.recordDecision(USER, bad));
            assertEquals("factors.momentum", e.getField());
        }

        @Test
        @DisplayName("sentiment is stored with the decision; out-of-range sentiment confidence is rejected")
        void sentiment() {
            episodes.startEpisode(USER);
            Decision read = buy("AAPL").withSentiment(new SentimentSignal(SentimentLabel.POSITIVE, 0.8));
            Decision stored = episodes.recordDecision(USER, read);
            assertEquals(new SentimentSignal(SentimentLabel.POSITIVE, 0.8), stored.sentiment());

            Decision bad = buy("MSFT").withSentiment(new SentimentSignal(SentimentLabel.NEGATIVE, 1.2));
            ValidationException e = assertThrows(ValidationException.class, () -> episodes.recordDecision(USER, bad));
            assertEquals("sentiment.confidence", e.getField());

            Decision unlabeled = buy("MSFT").withSentiment(new SentimentSignal(null, 0.5));
            e = assertThrows(ValidationException.class, () -> episodes.recordDecision(USER, unlabeled));
            assertEquals("sentiment.label", e.getField());
            assertEquals(1, episodes.getActiveEpisode(USER).decisions().size());
        }
    }

    @Nested
    @DisplayName("closeEpisode()")
    class Close {

        @Test
        @DisplayName("no active episode → StateException")
        void noActive() {
            assertThrows(StateException.class, () -> episodes.closeEpisode(USER, metrics(0.01, Map.of()), true));
        }

        @Test
        @DisplayName("stamps metrics and decision outcomes")
        void stamps() {
            episodes.startEpisode(USER);
            Decision d = episodes.recordDecision(USER, buy("AAPL"));

            EpisodeCloseResult result = episodes.closeEpisode(USER, metrics(0.03, Map.of(d.id(), 0.05)), true);

            assertEquals(EpisodeStatus.COMPLETED, result.episode().status());
            assertEquals(0.03, result.episode().portfolioReturn());
            assertEquals(T0, result.episode().endDate());
            assertEquals(0.05, result.episode().decisions().get(0).outcomeReturn());
            assertNull(episodes.getActiveEpisode(USER));
        }

        @Test
        @DisplayName("close leaves no episode active; the next start continues the numbering")
        void nextEpisodeIsExplicit() {
            episodes.startEpisode(USER);
            episodes.closeEpisode(USER, metrics(0.01, Map.of()), true);

            assertNull(episodes.getActiveEpisode(USER));
            assertThrows(StateException.class, () -> episodes.recordDecision(USER, buy("AAPL")));
            assertEquals(2, episodes.startEpisode(USER).episodeNumber());
        }

        @Test
        @DisplayName("runCvrf=false after a prior episode → deferred, no cycle")
        void deferred() {
            episodes.startEpisode(USER);
            episodes.closeEpisode(USER, metrics(0.01, Map.of()), true);
            episodes.startEpisode(USER);

            EpisodeCloseResult result = episodes.closeEpisode(USER, metrics(0.02, Map.of()), false);

            assertTrue(result.cycleDeferred());
            assertFalse(result.coldStart());
            assertNull(result.cycleResult());
            assertTrue(cvrfManager.getCycleHistory(USER).isEmpty());
        }

        @Test
        @DisplayName("commit failure propagates unmodified and leaves the episode ACTIVE")
        void failedCloseStaysActive() {
            episodes.startEpisode(USER);
            episodes.closeEpisode(USER, metrics(0.01, Map.of()), true);
            Episode active = episodes.startEpisode(USER);
            episodes.recordDecision(USER, buy("AAPL"));
            long versionBefore = cvrfManager.getCurrentBeliefs(USER).version();

            RuntimeException storageDown = new RuntimeException("storage down");
            store.failNextCommit(storageDown);

            RuntimeException thrown = assertThrows(RuntimeException.class,
                () -> episodes.closeEpisode(USER, metrics(0.02, Map.of()), true));

            assertSame(storageDown, thrown);
            Episode still = episodes.getActiveEpisode(USER);
            assertNotNull(still);
            assertEquals(active.id(), still.id());
            assertEquals(EpisodeStatus.ACTIVE, still.status());
            assertEquals(versionBefore, cvrfManager.getCurrentBeliefs(USER).version());
            assertTrue(cvrfManager.getCycleHistory(USER).isEmpty());
        }
    }

    @Test
    @DisplayName("summarize() renders a one-line headline")
    void summarize() {
        episodes.startEpisode(USER);
        episodes.recordDecision(USER, buy("AAPL"));
        episodes.recordDecision(USER, decision(null, "MSFT", TradeAction.SELL, null, null));
        Episode closed = episodes.closeEpisode(USER, metrics(0.0312, Map.of()), true).episode();

        EpisodeSummary summary = EpisodeManager.summarize(closed);

        assertEquals(2, summary.decisionCount());
        assertEquals("Episode 1: 3.12% return, Sharpe 1.20, max drawdown 4.00%, 2 decisions (1 buys, 1 sells)",
            summary.headline());
    }
}
