package com.cvrfplatform.common.risk;

import com.cvrfplatform.common.model.BeliefState;
import com.cvrfplatform.common.model.MarketRegime;
import com.cvrfplatform.common.model.OptimizationConstraints;
import com.cvrfplatform.common.model.OptimizationConstraints.FactorTarget;

import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Projects a {@link BeliefState} onto optimizer constraints.
 *
 * <p>Factor tolerance is {@code 0.3 × (1 − confidence)}: confident beliefs pin the
 * optimizer closer to the target. Volatility target and risk budget scale with the
 * regime: bull 1.1, bear 0.8, volatile 0.7, sideways 1.0.
 *
 * <p>No logging. No side-effects.
 */
public final class ConstraintCalculator {

    private static final double BASE_TOLERANCE = 0.3;

    private ConstraintCalculator() {}

    public static OptimizationConstraints fromBeliefs(BeliefState beliefs) {
        SortedMap<String, FactorTarget> targets = new TreeMap<>();
        for (Map.Entry<String, Double> entry : beliefs.factorWeights().entrySet()) {
            double confidence = beliefs.factorConfidence(entry.getKey());
            targets.put(entry.getKey(), new FactorTarget(entry.getValue(), BASE_TOLERANCE * (1.0 - confidence)));
        }

        double multiplier = riskMultiplier(beliefs.currentRegime());
        return new OptimizationConstraints(
            beliefs.version(),
            beliefs.currentRegime(),
            targets,
            beliefs.concentrationLimit(),
            beliefs.minPositionSize(),
            beliefs.volatilityTarget() * multiplier,
            beliefs.riskTolerance() * multiplier);
    }

    static double riskMultiplier(MarketRegime regime) {
        return switch (regime) {
            case BULL     -> 1.1;
            case BEAR     -> 0.8;
            case VOLATILE -> 0.7;
            case SIDEWAYS -> 1.0;
        };
    }
}
