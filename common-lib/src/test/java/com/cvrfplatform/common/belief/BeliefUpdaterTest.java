package com.cvrfplatform.common.belief;

import com.cvrfplatform.common.config.CvrfConfig;
import com.cvrfplatform.common.model.BeliefState;
import com.cvrfplatform.common.model.BeliefUpdate;
import com.cvrfplatform.common.model.ConceptualInsight;
import com.cvrfplatform.common.model.EpisodeComparison;
import com.cvrfplatform.common.model.ImpactDirection;
import com.cvrfplatform.common.model.InsightType;
import com.cvrfplatform.common.model.MarketRegime;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Deterministic verification of {@link BeliefUpdater}: step sizes, bounds, regime
 * and risk nudges, purity.
 */
class BeliefUpdaterTest {

    private static final Instant T0 = Instant.parse("2024-01-02T00:00:00Z");
    private static final Instant COMPARED_AT = Instant.parse("2024-02-01T00:00:00Z");

    private final CvrfConfig config = CvrfConfig.defaults();
    private final BeliefUpdater updater = new BeliefUpdater(config);

    private static EpisodeComparison comparison(double delta, double overlap) {
        return new EpisodeComparison("ep-1", "ep-2", delta >= 0 ? "ep-2" : "ep-1",
            delta >= 0 ? "ep-1" : "ep-2", delta, overlap, List.of(), List.of(), COMPARED_AT);
    }

    private static ConceptualInsight factor(String subject, double confidence, ImpactDirection direction) {
        return new ConceptualInsight("ep-2:factor:" + subject, InsightType.FACTOR, subject,
            subject + " mattered", List.of(), confidence, "ep-2", direction);
    }

    @Nested
    @DisplayName("learningRate()")
    class LearningRate {

        @Test
        @DisplayName("0.1 × (2 − 0.4) × (1 − 0.25) = 0.12")
        void defaultState() {
            assertEquals(0.12, BeliefUpdater.learningRate(config, 0.4, 0.5), 1e-12);
        }

        @Test
        @DisplayName("clamped to [0.02, 0.3]")
        void clamped() {
            CvrfConfig hot = new CvrfConfig(1.0, 0.02, 0.3, 0.3, 0.1, 10, 0.5, 4, 0.03, 0.02,
                0.02, 0.05, 0.40, 0.03, 0.30, 0.8, 0.95, 0.6, 10, true, 0.95);
            CvrfConfig cold = new CvrfConfig(0.01, 0.02, 0.3, 0.3, 0.1, 10, 0.5, 4, 0.03, 0.02,
                0.02, 0.05, 0.40, 0.03, 0.30, 0.8, 0.95, 0.6, 10, true, 0.95);
            assertEquals(0.3, BeliefUpdater.learningRate(hot, 0.0, 0.0), 1e-12);
            assertEquals(0.02, BeliefUpdater.learningRate(cold, 1.0, 1.0), 1e-12);
        }
    }

    @Nested
    @DisplayName("update()")
    class Update {

        @Test
        @DisplayName("empty insights → same state, no updates, not changed")
        void noSignal() {
            BeliefState state = BeliefState.defaults("user-1", T0);
            BeliefUpdater.UpdateResult result = updater.update(state, comparison(0.01, 0.5), List.of(),
                List.of(0.02, 0.01));

            assertSame(state, result.newState());
            assertTrue(result.updates().isEmpty());
            assertFalse(result.changed());
        }

        @Test
        @DisplayName("positive momentum insight raises weight by lr × confidence")
        void factorStep() {
            BeliefState state = BeliefState.defaults("user-1", T0);
            BeliefUpdater.UpdateResult result = updater.update(state, comparison(-0.05, 0.4),
                List.of(factor("momentum", 0.48, ImpactDirection.POSITIVE)), List.of(-0.05));

            double lr = 0.12;
            assertEquals(lr, result.learningRate(), 1e-12);
            assertEquals(0.2 + lr * 0.48, result.newState().factorWeight("momentum"), 1e-12);
            assertEquals(0.5 + lr * (0.48 - 0.5), result.newState().factorConfidence("momentum"), 1e-12);
            assertEquals(0.2, result.newState().factorWeight("value"), 1e-12);
            assertEquals(state.version(), result.newState().version(), "version is the caller's concern");
            assertEquals(COMPARED_AT, result.newState().updatedAt());
            assertTrue(result.changed());

            BeliefUpdate weightUpdate = result.updates().get(0);
            assertEquals("factorWeights.momentum", weightUpdate.field());
            assertEquals(lr * 0.48, weightUpdate.delta(), 1e-12);
            assertEquals(lr * 0.48, result.metaPrompt().factorAdjustments().get("momentum"), 1e-12);
        }

        @Test
        @DisplayName("unknown factor starts at weight 0, confidence 0.5")
        void unknownFactor() {
            BeliefState state = BeliefState.defaults("user-1", T0);
            BeliefUpdater.UpdateResult result = updater.update(state, comparison(0.01, 0.5),
                List.of(factor("carry", 1.0, ImpactDirection.NEGATIVE)), List.of(0.01));

            double lr = BeliefUpdater.learningRate(config, 0.5, 0.5);
            assertEquals(-lr, result.newState().factorWeight("carry"), 1e-12);
            assertEquals(0.5 + lr * 0.5, result.newState().factorConfidence("carry"), 1e-12);
        }

        @Test
        @DisplayName("losing cycle tightens risk targets, winning cycle loosens them")
        void riskNudges() {
            BeliefState state = BeliefState.defaults("user-1", T0);
            List<ConceptualInsight> insights = List.of(factor("value", 0.5, ImpactDirection.POSITIVE));

            BeliefState tightened = updater.update(state, comparison(-0.02, 0.5), insights, List.of()).newState();
            BeliefState loosened  = updater.update(state, comparison(0.02, 0.5), insights, List.of()).newState();

            assertTrue(tightened.volatilityTarget() < state.volatilityTarget());
            assertTrue(tightened.maxDrawdownThreshold() < state.maxDrawdownThreshold());
            assertTrue(loosened.volatilityTarget() > state.volatilityTarget());
            assertTrue(loosened.maxDrawdownThreshold() > state.maxDrawdownThreshold());
        }

        @Test
        @DisplayName("window [+0.02, +0.01] → bull at full confidence, emitted as updates")
        void regimeFromWindow() {
            BeliefState state = BeliefState.defaults("user-1", T0);
            BeliefUpdater.UpdateResult result = updater.update(state, comparison(0.01, 0.5),
                List.of(factor("quality", 0.5, ImpactDirection.POSITIVE)), List.of(0.02, 0.01));

            assertEquals(MarketRegime.BULL, result.newState().currentRegime());
            assertEquals(1.0, result.newState().regimeConfidence(), 1e-12);
            BeliefUpdate regime = result.updates().stream()
                .filter(u -> u.field().equals("currentRegime"))
                .findFirst()
                .orElseThrow();
            assertEquals("SIDEWAYS", regime.oldValue());
            assertEquals("BULL", regime.newValue());
            assertNull(regime.delta());
        }

        @Test
        @DisplayName("high-confidence insights become conceptual priors; old priors decay")
        void priors() {
            BeliefState state = BeliefState.defaults("user-1", T0);
            BeliefState first = updater.update(state, comparison(0.01, 0.0),
                List.of(factor("momentum", 0.9, ImpactDirection.POSITIVE),
                        factor("value", 0.5, ImpactDirection.POSITIVE)), List.of()).newState();
            assertEquals(1, first.conceptualPriors().size());
            assertEquals("momentum", first.conceptualPriors().get(0).subject());

            BeliefState second = updater.update(first, comparison(0.01, 0.0),
                List.of(factor("quality", 0.5, ImpactDirection.POSITIVE)), List.of()).newState();
            assertEquals(0.9 * 0.95, second.conceptualPriors().get(0).confidence(), 1e-12);
        }
    }

    private static ConceptualInsight insight(InsightType type, String subject, double confidence,
                                             ImpactDirection direction) {
        return new ConceptualInsight("ep-2:" + type.name().toLowerCase() + ":" + subject, type, subject,
            subject + " mattered", List.of(), confidence, "ep-2", direction);
    }

    private static BeliefUpdate updateFor(BeliefUpdater.UpdateResult result, String field) {
        return result.updates().stream()
            .filter(u -> u.field().equals(field))
            .findFirst()
            .orElseThrow(() -> new AssertionError("no update for " + field));
    }

    @Nested
    @DisplayName("positioning")
    class Positioning {

        private final BeliefState state = BeliefState.defaults("user-1", T0);
        private final double lr = BeliefUpdater.learningRate(CvrfConfig.defaults(), 0.5, 0.5);

        @Test
        @DisplayName("drawdown breach lowers risk tolerance by lr × 0.02 × confidence")
        void riskInsightLowersTolerance() {
            BeliefUpdater.UpdateResult result = updater.update(state, comparison(-0.02, 0.5),
                List.of(insight(InsightType.RISK, "drawdown_breach", 0.85, ImpactDirection.NEGATIVE)), List.of());

            double expected = 0.15 - lr * 0.02 * 0.85;
            assertEquals(expected, result.newState().riskTolerance(), 1e-12);
            BeliefUpdate update = updateFor(result, "riskTolerance");
            assertEquals(0.15, (Double) update.oldValue(), 1e-12);
            assertEquals(expected - 0.15, update.delta(), 1e-12);
            assertTrue(result.metaPrompt().riskGuidance().contains("risk tolerance"));
        }

        @Test
        @DisplayName("earlier entries paying off shorten the momentum horizon and raise the mean-reversion bar")
        void timingInsight() {
            BeliefUpdater.UpdateResult result = updater.update(state, comparison(0.02, 0.5),
                List.of(insight(InsightType.TIMING, "entry_timing", 0.8, ImpactDirection.POSITIVE)), List.of());

            assertEquals(20, result.newState().momentumHorizon(), "moves at least one day");
            assertEquals(2.0 + lr * 0.1 * 0.8, result.newState().meanReversionThreshold(), 1e-12);
            assertEquals(-1.0, updateFor(result, "momentumHorizon").delta(), 1e-12);
            assertTrue(result.metaPrompt().timingInsights().contains("momentum horizon 21 -> 20"));
            assertEquals(0.15, result.newState().riskTolerance(), 1e-12, "no risk insight, no move");
        }

        @Test
        @DisplayName("over-concentration tightens concentration and rebalance limits; concentration that paid loosens them")
        void allocationInsight() {
            BeliefState tightened = updater.update(state, comparison(-0.02, 0.5),
                List.of(insight(InsightType.ALLOCATION, "over_concentration:TSLA", 0.8, ImpactDirection.NEGATIVE)),
                List.of()).newState();
            BeliefState loosened = updater.update(state, comparison(0.02, 0.5),
                List.of(insight(InsightType.ALLOCATION, "concentration:AAPL", 0.7, ImpactDirection.POSITIVE)),
                List.of()).newState();

            assertEquals(0.20 * (1 - lr * 0.8 * 0.10), tightened.concentrationLimit(), 1e-12);
            assertEquals(0.05 * (1 - lr * 0.8 * 0.10), tightened.rebalanceThreshold(), 1e-12);
            assertEquals(0.20 * (1 + lr * 0.7 * 0.05), loosened.concentrationLimit(), 1e-12);
            assertEquals(0.05 * (1 + lr * 0.7 * 0.05), loosened.rebalanceThreshold(), 1e-12);
        }

        @Test
        @DisplayName("sentiment insights leave positioning untouched")
        void sentimentOnlyFeedsPriors() {
            BeliefUpdater.UpdateResult result = updater.update(state, comparison(0.0, 0.5),
                List.of(insight(InsightType.SENTIMENT, "followed_positive", 0.7, ImpactDirection.POSITIVE)),
                List.of());

            assertEquals(state.riskTolerance(), result.newState().riskTolerance());
            assertEquals(state.momentumHorizon(), result.newState().momentumHorizon());
            assertEquals(state.concentrationLimit(), result.newState().concentrationLimit());
            assertTrue(result.updates().stream().noneMatch(u -> u.field().equals("riskTolerance")));
        }

        @Test
        @DisplayName("repeated adverse insights pin every positioning field at its bound")
        void boundsHold() {
            BeliefState current = state;
            List<ConceptualInsight> adverse = List.of(
                insight(InsightType.RISK, "drawdown_breach", 1.0, ImpactDirection.NEGATIVE),
                insight(InsightType.TIMING, "entry_timing", 1.0, ImpactDirection.NEGATIVE),
                insight(InsightType.ALLOCATION, "over_concentration:TSLA", 1.0, ImpactDirection.NEGATIVE));
            for (int i = 0; i < 2000; i++) {
                current = updater.update(current, comparison(-0.01, 0.5), adverse, List.of()).newState();
            }

            assertEquals(0.05, current.riskTolerance(), 1e-12);
            assertEquals(63, current.momentumHorizon());
            assertEquals(1.0, current.meanReversionThreshold(), 1e-12);
            assertEquals(0.10, current.concentrationLimit(), 1e-12);
            assertEquals(0.02, current.rebalanceThreshold(), 1e-12);
        }
    }

    @Nested
    @DisplayName("conceptual priors updates")
    class PriorUpdates {

        @Test
        @DisplayName("an admitted prior is reported with the prior ids before and after")
        void admission() {
            BeliefState state = BeliefState.defaults("user-1", T0);
            BeliefUpdater.UpdateResult result = updater.update(state, comparison(0.01, 0.0),
                List.of(factor("momentum", 0.9, ImpactDirection.POSITIVE)), List.of());

            BeliefUpdate update = updateFor(result, "conceptualPriors");
            assertEquals(List.of(), update.oldValue());
            assertEquals(List.of("ep-2:factor:momentum"), update.newValue());
            assertNull(update.delta());
        }

        @Test
        @DisplayName("decay alone is reported as a priors change")
        void decay() {
            BeliefState state = BeliefState.defaults("user-1", T0);
            BeliefState first = updater.update(state, comparison(0.01, 0.0),
                List.of(factor("momentum", 0.9, ImpactDirection.POSITIVE)), List.of()).newState();

            BeliefUpdater.UpdateResult second = updater.update(first, comparison(0.01, 0.0),
                List.of(factor("quality", 0.5, ImpactDirection.POSITIVE)), List.of());

            BeliefUpdate update = updateFor(second, "conceptualPriors");
            assertEquals(update.oldValue(), update.newValue(), "same prior, lower confidence");
        }

        @Test
        @DisplayName("no priors before or after → no priors update")
        void unchanged() {
            BeliefUpdater.UpdateResult result = updater.update(BeliefState.defaults("user-1", T0),
                comparison(0.01, 0.5), List.of(factor("value", 0.5, ImpactDirection.POSITIVE)), List.of());
            assertTrue(result.updates().stream().noneMatch(u -> u.field().equals("conceptualPriors")));
        }
    }

    @Test
    @DisplayName("weights stay in [-3, 3] and confidences in [0, 1] under randomized cycles")
    void boundsHoldUnderRandomCycles() {
        Random random = new Random(42);
        String[] factors = {"momentum", "value", "quality", "volatility", "sentiment", "carry"};
        BeliefState state = BeliefState.defaults("user-1", T0);
        List<Double> deltas = new ArrayList<>();

        for (int cycle = 0; cycle < 500; cycle++) {
            List<ConceptualInsight> insights = new ArrayList<>();
            int count = random.nextInt(4);
            for (int i = 0; i < count; i++) {
                insights.add(factor(factors[random.nextInt(factors.length)], random.nextDouble(),
                    random.nextBoolean() ? ImpactDirection.POSITIVE : ImpactDirection.NEGATIVE));
            }
            double delta = random.nextGaussian() * 0.05;
            deltas.add(delta);
            state = updater.update(state, comparison(delta, random.nextDouble()), insights, deltas).newState();

            state.factorWeights().values().forEach(w -> assertTrue(w >= -3.0 && w <= 3.0, "weight " + w));
            state.factorConfidences().values().forEach(c -> assertTrue(c >= 0.0 && c <= 1.0, "confidence " + c));
            assertTrue(state.regimeConfidence() >= 0.0 && state.regimeConfidence() <= 1.0);
            assertTrue(state.volatilityTarget() >= config.minVolatilityTarget()
                && state.volatilityTarget() <= config.maxVolatilityTarget());
        }
    }

    @Test
    @DisplayName("pure: identical inputs yield identical outputs")
    void pure() {
        BeliefState state = BeliefState.defaults("user-1", T0);
        EpisodeComparison c = comparison(-0.03, 0.3);
        List<ConceptualInsight> insights = List.of(
            factor("momentum", 0.7, ImpactDirection.POSITIVE),
            factor("value", 0.4, ImpactDirection.NEGATIVE));
        List<Double> window = List.of(0.01, -0.02, -0.03);

        assertEquals(updater.update(state, c, insights, window), updater.update(state, c, insights, window));
    }
}
