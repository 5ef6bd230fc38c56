package com.cvrfplatform.common.config;

/**
 * Tunables of the learning loop. {@link #defaults()} holds the production values;
 * the enclosing service overrides them from {@code cvrf.*} properties.
 *
 * <h3>Learning rate</h3>
 * {@code base × (2 − overlap) × (1 − 0.5 × regimeConfidence)}, clamped to
 * [{@code minLearningRate}, {@code maxLearningRate}].
 *
 * <h3>Regime window</h3>
 * The last {@code regimeWindow} performance deltas, oldest first. Volatile above
 * {@code volatileStdDev}; bull requires std dev at most {@code lowVarianceStdDev}.
 */
public record CvrfConfig(
    double  baseLearningRate,
    double  minLearningRate,
    double  maxLearningRate,
    double  factorSignificanceThreshold,
    double  minInsightConfidence,
    int     maxInsightsPerCycle,
    double  lowOverlapThreshold,
    int     regimeWindow,
    double  volatileStdDev,
    double  lowVarianceStdDev,
    double  riskStep,
    double  minVolatilityTarget,
    double  maxVolatilityTarget,
    double  minDrawdownThreshold,
    double  maxDrawdownThreshold,
    double  priorAdmissionConfidence,
    double  priorDecay,
    double  priorFloor,
    int     maxPriors,
    boolean withinEpisodeCvarEnabled,
    double  cvarConfidenceLevel
) {

    public static CvrfConfig defaults() {
        return new CvrfConfig(
            0.1, 0.02, 0.3,
            0.3, 0.1, 10,
            0.5,
            4, 0.03, 0.02,
            0.02, 0.05, 0.40, 0.03, 0.30,
            0.8, 0.95, 0.6, 10,
            true, 0.95);
    }
}
