package com.cvrfplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * The canonical, versioned investment beliefs of one user.
 *
 * <p>Exactly one current instance exists per user. It is replaced (never mutated)
 * by a committed cycle; every committed version is retained in the cycle history.
 *
 * <h3>Bounds</h3>
 * <ul>
 *   <li>{@code factorWeights}    : sorted map, each value in [-3.0, 3.0]</li>
 *   <li>{@code factorConfidences}: sorted map, each value in [0.0, 1.0]</li>
 *   <li>{@code regimeConfidence} : [0.0, 1.0]</li>
 *   <li>{@code riskTolerance}    : [0.05, 0.30]</li>
 *   <li>{@code momentumHorizon}  : [5, 63] trading days</li>
 *   <li>{@code meanReversionThreshold}: [1.0, 3.0] standard deviations</li>
 *   <li>{@code concentrationLimit}: [0.10, 0.30]</li>
 *   <li>{@code rebalanceThreshold}: [0.02, 0.10]</li>
 *   <li>{@code version}          : starts at 1, +1 per committed belief change</li>
 * </ul>
 *
 * <p>{@code conceptualPriors} keeps the highest-confidence insights of past cycles,
 * decayed each cycle, as long-lived memory for explanations.
 */
public record BeliefState(
    @JsonProperty("userId")                 String                    userId,
    @JsonProperty("version")                long                      version,
    @JsonProperty("updatedAt")              Instant                   updatedAt,
    @JsonProperty("factorWeights")          SortedMap<String, Double> factorWeights,
    @JsonProperty("factorConfidences")      SortedMap<String, Double> factorConfidences,
    @JsonProperty("currentRegime")          MarketRegime              currentRegime,
    @JsonProperty("regimeConfidence")       double                    regimeConfidence,
    @JsonProperty("riskTolerance")          double                    riskTolerance,
    @JsonProperty("maxDrawdownThreshold")   double                    maxDrawdownThreshold,
    @JsonProperty("volatilityTarget")       double                    volatilityTarget,
    @JsonProperty("momentumHorizon")        int                       momentumHorizon,
    @JsonProperty("meanReversionThreshold") double                    meanReversionThreshold,
    @JsonProperty("concentrationLimit")     double                    concentrationLimit,
    @JsonProperty("minPositionSize")        double                    minPositionSize,
    @JsonProperty("rebalanceThreshold")     double                    rebalanceThreshold,
    @JsonProperty("conceptualPriors")       List<ConceptualInsight>   conceptualPriors
) {

    public static final long INITIAL_VERSION = 1L;

    public static final List<String> DEFAULT_FACTORS =
        List.of("momentum", "quality", "sentiment", "value", "volatility");

    public BeliefState {
        factorWeights     = sorted(factorWeights);
        factorConfidences = sorted(factorConfidences);
        conceptualPriors  = conceptualPriors == null ? List.of() : List.copyOf(conceptualPriors);
    }

    /** Defaults used on first use: equal factor tilts, neutral confidence, sideways regime. */
    public static BeliefState defaults(String userId, Instant createdAt) {
        SortedMap<String, Double> weights = new TreeMap<>();
        SortedMap<String, Double> confidences = new TreeMap<>();
        for (String factor : DEFAULT_FACTORS) {
            weights.put(factor, 0.2);
            confidences.put(factor, 0.5);
        }
        return new BeliefState(userId, INITIAL_VERSION, createdAt, weights, confidences,
            MarketRegime.SIDEWAYS, 0.5,
            0.15, 0.10, 0.15,
            21, 2.0,
            0.20, 0.02, 0.05,
            List.of());
    }

    public BeliefState withFactors(SortedMap<String, Double> weights, SortedMap<String, Double> confidences) {
        return new BeliefState(userId, version, updatedAt, weights, confidences, currentRegime,
            regimeConfidence, riskTolerance, maxDrawdownThreshold, volatilityTarget, momentumHorizon,
            meanReversionThreshold, concentrationLimit, minPositionSize, rebalanceThreshold,
            conceptualPriors);
    }

    public BeliefState withRegime(MarketRegime regime, double confidence) {
        return new BeliefState(userId, version, updatedAt, factorWeights, factorConfidences, regime,
            confidence, riskTolerance, maxDrawdownThreshold, volatilityTarget, momentumHorizon,
            meanReversionThreshold, concentrationLimit, minPositionSize, rebalanceThreshold,
            conceptualPriors);
    }

    public BeliefState withRiskTargets(double newVolatilityTarget, double newMaxDrawdownThreshold) {
        return new BeliefState(userId, version, updatedAt, factorWeights, factorConfidences,
            currentRegime, regimeConfidence, riskTolerance, newMaxDrawdownThreshold,
            newVolatilityTarget, momentumHorizon, meanReversionThreshold, concentrationLimit,
            minPositionSize, rebalanceThreshold, conceptualPriors);
    }

    public BeliefState withPositioning(double newRiskTolerance, int newMomentumHorizon,
                                       double newMeanReversionThreshold, double newConcentrationLimit,
                                       double newRebalanceThreshold) {
        return new BeliefState(userId, version, updatedAt, factorWeights, factorConfidences,
            currentRegime, regimeConfidence, newRiskTolerance, maxDrawdownThreshold, volatilityTarget,
            newMomentumHorizon, newMeanReversionThreshold, newConcentrationLimit, minPositionSize,
            newRebalanceThreshold, conceptualPriors);
    }

    public BeliefState withPriors(List<ConceptualInsight> priors) {
        return new BeliefState(userId, version, updatedAt, factorWeights, factorConfidences,
            currentRegime, regimeConfidence, riskTolerance, maxDrawdownThreshold, volatilityTarget,
            momentumHorizon, meanReversionThreshold, concentrationLimit, minPositionSize,
            rebalanceThreshold, priors);
    }

    public BeliefState withVersion(long newVersion, Instant newUpdatedAt) {
        return new BeliefState(userId, newVersion, newUpdatedAt, factorWeights, factorConfidences,
            currentRegime, regimeConfidence, riskTolerance, maxDrawdownThreshold, volatilityTarget,
            momentumHorizon, meanReversionThreshold, concentrationLimit, minPositionSize,
            rebalanceThreshold, conceptualPriors);
    }

    public double factorWeight(String factor) {
        return factorWeights.getOrDefault(factor, 0.0);
    }

    public double factorConfidence(String factor) {
        return factorConfidences.getOrDefault(factor, 0.5);
    }

    private static SortedMap<String, Double> sorted(SortedMap<String, Double> source) {
        return source == null
            ? Collections.emptySortedMap()
            : Collections.unmodifiableSortedMap(new TreeMap<>(source));
    }
}
