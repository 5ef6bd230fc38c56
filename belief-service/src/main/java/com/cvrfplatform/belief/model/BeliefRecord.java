package com.cvrfplatform.belief.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Canonical belief state, one row per user. {@code version} is the optimistic
 * concurrency token checked by every commit.
 *
 * factor_weights / factor_confidences: JSON object or array of [name, value] pairs
 * conceptual_priors                  : JSON-serialised {@code List<ConceptualInsight>}
 */
@Data
@NoArgsConstructor
@Table("cvrf_beliefs")
public class BeliefRecord {

    @Id
    private String userId;

    private long version;

    private String factorWeights;

    private String factorConfidences;

    private String currentRegime;

    private double regimeConfidence;

    private double riskTolerance;

    private double maxDrawdownThreshold;

    private double volatilityTarget;

    private int momentumHorizon;

    private double meanReversionThreshold;

    private double concentrationLimit;

    private double minPositionSize;

    private double rebalanceThreshold;

    private String conceptualPriors;

    private LocalDateTime updatedAt;
}
