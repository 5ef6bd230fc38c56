package com.cvrfplatform.common.belief;

import com.cvrfplatform.common.classifier.RegimeClassifier;
import com.cvrfplatform.common.config.CvrfConfig;
import com.cvrfplatform.common.model.BeliefState;
import com.cvrfplatform.common.model.BeliefUpdate;
import com.cvrfplatform.common.model.ConceptualInsight;
import com.cvrfplatform.common.model.EpisodeComparison;
import com.cvrfplatform.common.model.InsightType;
import com.cvrfplatform.common.model.MarketRegime;
import com.cvrfplatform.common.model.MetaPrompt;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.SortedMap;
import java.util.StringJoiner;
import java.util.TreeMap;

/**
 * Pure logic class: applies a cycle's insights to a {@link BeliefState} with bounded,
 * smoothed steps and explains every change.
 *
 * <h3>Update rules</h3>
 * <ul>
 *   <li>learning rate: base × (2 − overlap) × (1 − 0.5 × regimeConfidence), clamped</li>
 *   <li>factor weight: w + lr × direction × confidence, clamped to [-3, 3]</li>
 *   <li>factor confidence: EMA toward the insight confidence, clamped to [0, 1]</li>
 *   <li>regime: {@link RegimeClassifier} over the rolling delta window</li>
 *   <li>risk targets: tightened after a losing cycle, loosened after a winning one</li>
 *   <li>positioning: the net signed confidence of the RISK, TIMING and ALLOCATION
 *       insights moves risk tolerance, momentum horizon, mean-reversion threshold,
 *       concentration limit and rebalance threshold, each within its bounds</li>
 *   <li>conceptual priors: decayed, refreshed with strong insights, capped</li>
 * </ul>
 *
 * <p>Every changed field yields exactly one {@link BeliefUpdate}. SENTIMENT insights
 * only feed the priors and the meta-prompt.
 *
 * <p>An empty insight list returns the input state unchanged; this is the only branch.
 * The version is left to the caller. {@code updatedAt} comes from the comparison,
 * never from a clock.
 *
 * <p>No logging. No side-effects.
 */
public final class BeliefUpdater {

    public static final double MIN_WEIGHT = -3.0;
    public static final double MAX_WEIGHT = 3.0;

    private static final double NEW_FACTOR_WEIGHT     = 0.0;
    private static final double NEW_FACTOR_CONFIDENCE = 0.5;
    private static final int    MAX_KEY_LEARNINGS     = 5;

    private static final double MIN_RISK_TOLERANCE    = 0.05;
    private static final double MAX_RISK_TOLERANCE    = 0.30;
    private static final double RISK_TOLERANCE_STEP   = 0.02;
    private static final int    MIN_MOMENTUM_HORIZON  = 5;
    private static final int    MAX_MOMENTUM_HORIZON  = 63;
    private static final double HORIZON_RATE          = 0.1;
    private static final double MIN_MEAN_REVERSION    = 1.0;
    private static final double MAX_MEAN_REVERSION    = 3.0;
    private static final double MEAN_REVERSION_STEP   = 0.1;
    private static final double MIN_CONCENTRATION     = 0.10;
    private static final double MAX_CONCENTRATION     = 0.30;
    private static final double MIN_REBALANCE         = 0.02;
    private static final double MAX_REBALANCE         = 0.10;
    private static final double LOOSEN_RATE           = 0.05;
    private static final double TIGHTEN_RATE          = 0.10;

    private static final Comparator<ConceptualInsight> PRIOR_ORDER =
        Comparator.comparingDouble(ConceptualInsight::confidence).reversed()
            .thenComparing(ConceptualInsight::subject)
            .thenComparing(ConceptualInsight::id);

    private final CvrfConfig config;

    public BeliefUpdater(CvrfConfig config) {
        this.config = config;
    }

    /**
     * New state plus the field-level changes and explainability summary that produced it.
     * {@code changed} is false only for the no-signal branch.
     */
    public record UpdateResult(
        BeliefState        newState,
        List<BeliefUpdate> updates,
        MetaPrompt         metaPrompt,
        double             learningRate,
        boolean            changed
    ) {}

    /**
     * @param deltaWindow recent cycle performance deltas, oldest first, ending with this
     *                    comparison's delta
     */
    public UpdateResult update(BeliefState state, EpisodeComparison comparison,
                               List<ConceptualInsight> insights, List<Double> deltaWindow) {
        double lr = learningRate(config, comparison.decisionOverlap(), state.regimeConfidence());

        if (insights == null || insights.isEmpty()) {
            return new UpdateResult(state, List.of(), MetaPrompt.noSignal(), lr, false);
        }

        List<BeliefUpdate> updates = new ArrayList<>();

        // ── factors ────────────────────────────────────────────────────────
        SortedMap<String, Double> weights = new TreeMap<>(state.factorWeights());
        SortedMap<String, Double> confidences = new TreeMap<>(state.factorConfidences());
        SortedMap<String, Double> adjustments = new TreeMap<>();

        for (ConceptualInsight insight : insights) {
            if (insight.type() != InsightType.FACTOR) {
                continue;
            }
            String factor = insight.subject();
            double oldWeight = weights.getOrDefault(factor, NEW_FACTOR_WEIGHT);
            double oldConf = confidences.getOrDefault(factor, NEW_FACTOR_CONFIDENCE);

            double newWeight = clamp(
                oldWeight + lr * insight.impactDirection().sign() * insight.confidence(),
                MIN_WEIGHT, MAX_WEIGHT);
            double newConf = clamp(oldConf + lr * (insight.confidence() - oldConf), 0.0, 1.0);

            weights.put(factor, newWeight);
            confidences.put(factor, newConf);

            if (newWeight != oldWeight) {
                adjustments.put(factor, newWeight - oldWeight);
                updates.add(BeliefUpdate.numeric("factorWeights." + factor, oldWeight, newWeight, lr,
                    insight.concept()));
            }
            if (newConf != oldConf) {
                updates.add(BeliefUpdate.numeric("factorConfidences." + factor, oldConf, newConf, lr,
                    fmt("Confidence moved toward insight confidence %.2f", insight.confidence())));
            }
        }
        BeliefState next = state.withFactors(weights, confidences);

        // ── regime ─────────────────────────────────────────────────────────
        RegimeClassifier.Classification regime = RegimeClassifier.classify(
            window(deltaWindow), config.volatileStdDev(), config.lowVarianceStdDev());
        if (regime != null) {
            if (regime.regime() != state.currentRegime()) {
                updates.add(BeliefUpdate.categorical("currentRegime", state.currentRegime(),
                    regime.regime(), lr, "Rolling performance deltas reclassified the regime"));
            }
            if (regime.confidence() != state.regimeConfidence()) {
                updates.add(BeliefUpdate.numeric("regimeConfidence", state.regimeConfidence(),
                    regime.confidence(), lr, "Agreement fraction of the rolling delta window"));
            }
            next = next.withRegime(regime.regime(), regime.confidence());
        }

        // ── risk targets ───────────────────────────────────────────────────
        double delta = comparison.performanceDelta();
        double step = delta < 0 ? -lr * config.riskStep() : delta > 0 ? lr * config.riskStep() : 0.0;
        double newVol = clamp(state.volatilityTarget() + step,
            config.minVolatilityTarget(), config.maxVolatilityTarget());
        double newDd = clamp(state.maxDrawdownThreshold() + step,
            config.minDrawdownThreshold(), config.maxDrawdownThreshold());
        String riskRationale = delta < 0 ? "Losing cycle: risk tightened" : "Winning cycle: risk loosened";
        if (newVol != state.volatilityTarget()) {
            updates.add(BeliefUpdate.numeric("volatilityTarget", state.volatilityTarget(), newVol, lr,
                riskRationale));
        }
        if (newDd != state.maxDrawdownThreshold()) {
            updates.add(BeliefUpdate.numeric("maxDrawdownThreshold", state.maxDrawdownThreshold(), newDd,
                lr, riskRationale));
        }
        next = next.withRiskTargets(newVol, newDd);

        // ── positioning ────────────────────────────────────────────────────
        double riskSignal = netSignal(insights, InsightType.RISK);
        double timingSignal = netSignal(insights, InsightType.TIMING);
        double allocationSignal = netSignal(insights, InsightType.ALLOCATION);

        double newTolerance = clamp(state.riskTolerance() + lr * RISK_TOLERANCE_STEP * riskSignal,
            MIN_RISK_TOLERANCE, MAX_RISK_TOLERANCE);
        int newHorizon = stepHorizon(state.momentumHorizon(), timingSignal, lr);
        double newMeanReversion = clamp(state.meanReversionThreshold() + lr * MEAN_REVERSION_STEP * timingSignal,
            MIN_MEAN_REVERSION, MAX_MEAN_REVERSION);
        double allocationScale = 1.0 + lr * allocationSignal * (allocationSignal > 0 ? LOOSEN_RATE : TIGHTEN_RATE);
        double newConcentration = clamp(state.concentrationLimit() * allocationScale,
            MIN_CONCENTRATION, MAX_CONCENTRATION);
        double newRebalance = clamp(state.rebalanceThreshold() * allocationScale, MIN_REBALANCE, MAX_REBALANCE);

        if (newTolerance != state.riskTolerance()) {
            updates.add(BeliefUpdate.numeric("riskTolerance", state.riskTolerance(), newTolerance, lr,
                riskSignal < 0 ? "Drawdown insights: risk tolerance reduced"
                               : "Drawdown was contained: risk tolerance raised"));
        }
        if (newHorizon != state.momentumHorizon()) {
            updates.add(BeliefUpdate.numeric("momentumHorizon", state.momentumHorizon(), newHorizon, lr,
                timingSignal > 0 ? "Earlier entries paid: momentum horizon shortened for faster signals"
                                 : "Early entries were premature: momentum horizon extended"));
        }
        if (newMeanReversion != state.meanReversionThreshold()) {
            updates.add(BeliefUpdate.numeric("meanReversionThreshold", state.meanReversionThreshold(),
                newMeanReversion, lr, timingSignal > 0 ? "Trends persisted: fade only larger moves"
                                                       : "Moves reverted: fade smaller deviations"));
        }
        if (newConcentration != state.concentrationLimit()) {
            updates.add(BeliefUpdate.numeric("concentrationLimit", state.concentrationLimit(), newConcentration,
                lr, allocationSignal > 0 ? "High-conviction concentration paid: limit raised"
                                         : "Over-concentration amplified a loss: limit reduced"));
        }
        if (newRebalance != state.rebalanceThreshold()) {
            updates.add(BeliefUpdate.numeric("rebalanceThreshold", state.rebalanceThreshold(), newRebalance, lr,
                allocationSignal > 0 ? "Allow more drift before rebalancing"
                                     : "Rebalance earlier to cap position drift"));
        }
        next = next.withPositioning(newTolerance, newHorizon, newMeanReversion, newConcentration, newRebalance);

        // ── conceptual priors ──────────────────────────────────────────────
        List<ConceptualInsight> priors = mergePriors(state.conceptualPriors(), insights);
        if (!priors.equals(state.conceptualPriors())) {
            updates.add(BeliefUpdate.membership("conceptualPriors", priorIds(state.conceptualPriors()),
                priorIds(priors), lr, fmt("Priors decayed by %.2f; %d retained", config.priorDecay(), priors.size())));
        }
        next = next.withPriors(priors);
        next = next.withVersion(state.version(), comparison.comparedAt());

        MetaPrompt metaPrompt = buildMetaPrompt(insights, adjustments, state, next, delta, regime);
        return new UpdateResult(next, List.copyOf(updates), metaPrompt, lr, true);
    }

    /**
     * Effective learning rate: higher for novel decision sets, lower when the regime
     * assessment is already confident.
     */
    public static double learningRate(CvrfConfig config, double decisionOverlap, double regimeConfidence) {
        double raw = config.baseLearningRate() * (2.0 - decisionOverlap) * (1.0 - 0.5 * regimeConfidence);
        return clamp(raw, config.minLearningRate(), config.maxLearningRate());
    }

    // ── helpers ────────────────────────────────────────────────────────────

    /** Sum of direction × confidence over the insights of one type. */
    private static double netSignal(List<ConceptualInsight> insights, InsightType type) {
        double sum = 0.0;
        for (ConceptualInsight insight : insights) {
            if (insight.type() == type) {
                sum += insight.impactDirection().sign() * insight.confidence();
            }
        }
        return sum;
    }

    /** Positive signal shortens the horizon, negative lengthens it; at least one day per move. */
    private static int stepHorizon(int horizon, double signal, double lr) {
        if (signal == 0.0) {
            return horizon;
        }
        int days = (int) Math.max(1, Math.round(horizon * lr * HORIZON_RATE * Math.abs(signal)));
        int moved = signal > 0 ? horizon - days : horizon + days;
        return Math.max(MIN_MOMENTUM_HORIZON, Math.min(MAX_MOMENTUM_HORIZON, moved));
    }

    private static List<String> priorIds(List<ConceptualInsight> priors) {
        List<String> ids = new ArrayList<>(priors.size());
        priors.forEach(p -> ids.add(p.id()));
        return ids;
    }

    private List<Double> window(List<Double> deltas) {
        if (deltas == null) {
            return List.of();
        }
        int from = Math.max(0, deltas.size() - config.regimeWindow());
        return deltas.subList(from, deltas.size());
    }

    private List<ConceptualInsight> mergePriors(List<ConceptualInsight> existing,
                                                List<ConceptualInsight> insights) {
        Map<String, ConceptualInsight> byId = new LinkedHashMap<>();
        for (ConceptualInsight prior : existing) {
            double decayed = prior.confidence() * config.priorDecay();
            if (decayed >= config.priorFloor()) {
                byId.put(prior.id(), prior.withConfidence(decayed));
            }
        }
        for (ConceptualInsight insight : insights) {
            if (insight.confidence() > config.priorAdmissionConfidence()) {
                byId.put(insight.id(), insight);
            }
        }
        List<ConceptualInsight> merged = new ArrayList<>(byId.values());
        merged.sort(PRIOR_ORDER);
        return merged.size() > config.maxPriors() ? merged.subList(0, config.maxPriors()) : merged;
    }

    private static MetaPrompt buildMetaPrompt(List<ConceptualInsight> insights,
                                              SortedMap<String, Double> adjustments,
                                              BeliefState before, BeliefState after, double delta,
                                              RegimeClassifier.Classification regime) {
        StringJoiner increase = new StringJoiner(", ");
        StringJoiner decrease = new StringJoiner(", ");
        adjustments.forEach((factor, change) -> (change > 0 ? increase : decrease).add(factor));

        String direction;
        if (adjustments.isEmpty()) {
            direction = "Keep factor tilts; act on regime and risk guidance";
        } else {
            List<String> parts = new ArrayList<>();
            if (increase.length() > 0) parts.add("increase " + increase);
            if (decrease.length() > 0) parts.add("decrease " + decrease);
            direction = "Tilt factors: " + String.join("; ", parts);
        }

        List<String> learnings = new ArrayList<>();
        for (int i = 0; i < insights.size() && i < MAX_KEY_LEARNINGS; i++) {
            learnings.add(insights.get(i).concept());
        }

        String risk;
        if (after.volatilityTarget() == before.volatilityTarget()
                && after.maxDrawdownThreshold() == before.maxDrawdownThreshold()) {
            risk = "Risk parameters unchanged";
        } else {
            risk = fmt("%s risk: volatility target %.4f -> %.4f, max drawdown %.4f -> %.4f",
                delta < 0 ? "Tighten" : "Loosen",
                before.volatilityTarget(), after.volatilityTarget(),
                before.maxDrawdownThreshold(), after.maxDrawdownThreshold());
        }
        if (after.riskTolerance() != before.riskTolerance()) {
            risk += fmt("; risk tolerance %.4f -> %.4f", before.riskTolerance(), after.riskTolerance());
        }
        if (after.concentrationLimit() != before.concentrationLimit()) {
            risk += fmt("; concentration limit %.4f -> %.4f", before.concentrationLimit(), after.concentrationLimit());
        }

        String timing = regime == null
            ? "Not enough cycles to reassess the regime; keep " + label(before.currentRegime())
            : fmt("Regime %s (%.0f%% agreement)", label(regime.regime()), regime.confidence() * 100);
        if (after.momentumHorizon() != before.momentumHorizon()) {
            timing += fmt("; momentum horizon %d -> %d days", before.momentumHorizon(), after.momentumHorizon());
        }

        return new MetaPrompt(direction, learnings, adjustments, risk, timing);
    }

    private static String label(MarketRegime regime) {
        return regime.name().toLowerCase(Locale.ROOT);
    }

    private static double clamp(double v, double min, double max) {
        return Math.max(min, Math.min(max, v));
    }

    private static String fmt(String pattern, Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }
}
