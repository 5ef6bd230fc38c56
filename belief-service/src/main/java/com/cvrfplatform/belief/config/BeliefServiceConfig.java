package com.cvrfplatform.belief.config;

import com.cvrfplatform.common.config.CvrfConfig;
import com.cvrfplatform.common.cvrf.BeliefHandleRegistry;
import com.cvrfplatform.common.cvrf.CvrfManager;
import com.cvrfplatform.common.episode.EpisodeManager;
import com.cvrfplatform.common.store.CvrfStore;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the framework-free engine from {@code common-lib} into the Spring context.
 * Every tunable is overridable through {@code cvrf.*}; the fallbacks equal
 * {@link CvrfConfig#defaults()}.
 */
@Configuration
public class BeliefServiceConfig {

    @Value("${cvrf.learning-rate.base:0.1}")
    private double baseLearningRate;

    @Value("${cvrf.learning-rate.min:0.02}")
    private double minLearningRate;

    @Value("${cvrf.learning-rate.max:0.3}")
    private double maxLearningRate;

    @Value("${cvrf.insight.factor-significance:0.3}")
    private double factorSignificanceThreshold;

    @Value("${cvrf.insight.min-confidence:0.1}")
    private double minInsightConfidence;

    @Value("${cvrf.insight.max-per-cycle:10}")
    private int maxInsightsPerCycle;

    @Value("${cvrf.insight.low-overlap:0.5}")
    private double lowOverlapThreshold;

    @Value("${cvrf.regime.window:4}")
    private int regimeWindow;

    @Value("${cvrf.regime.volatile-std-dev:0.03}")
    private double volatileStdDev;

    @Value("${cvrf.regime.low-variance-std-dev:0.02}")
    private double lowVarianceStdDev;

    @Value("${cvrf.risk.step:0.02}")
    private double riskStep;

    @Value("${cvrf.risk.min-volatility-target:0.05}")
    private double minVolatilityTarget;

    @Value("${cvrf.risk.max-volatility-target:0.40}")
    private double maxVolatilityTarget;

    @Value("${cvrf.risk.min-drawdown-threshold:0.03}")
    private double minDrawdownThreshold;

    @Value("${cvrf.risk.max-drawdown-threshold:0.30}")
    private double maxDrawdownThreshold;

    @Value("${cvrf.priors.admission-confidence:0.8}")
    private double priorAdmissionConfidence;

    @Value("${cvrf.priors.decay:0.95}")
    private double priorDecay;

    @Value("${cvrf.priors.floor:0.6}")
    private double priorFloor;

    @Value("${cvrf.priors.max:10}")
    private int maxPriors;

    @Value("${cvrf.cvar.enabled:true}")
    private boolean withinEpisodeCvarEnabled;

    @Value("${cvrf.cvar.confidence-level:0.95}")
    private double cvarConfidenceLevel;

    @Bean
    public CvrfConfig cvrfConfig() {
        return new CvrfConfig(
            baseLearningRate, minLearningRate, maxLearningRate,
            factorSignificanceThreshold, minInsightConfidence, maxInsightsPerCycle,
            lowOverlapThreshold,
            regimeWindow, volatileStdDev, lowVarianceStdDev,
            riskStep, minVolatilityTarget, maxVolatilityTarget, minDrawdownThreshold, maxDrawdownThreshold,
            priorAdmissionConfidence, priorDecay, priorFloor, maxPriors,
            withinEpisodeCvarEnabled, cvarConfidenceLevel);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public BeliefHandleRegistry beliefHandleRegistry(CvrfStore store, Clock clock) {
        return new BeliefHandleRegistry(store, clock);
    }

    @Bean
    public CvrfManager cvrfManager(CvrfStore store, BeliefHandleRegistry registry, CvrfConfig config,
                                   Clock clock) {
        return new CvrfManager(store, registry, config, clock);
    }

    @Bean
    public EpisodeManager episodeManager(CvrfStore store, CvrfManager cvrfManager,
                                         BeliefHandleRegistry registry, Clock clock) {
        return new EpisodeManager(store, cvrfManager, registry, clock);
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }
}
