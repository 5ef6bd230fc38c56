package com.cvrfplatform.common.risk;

import com.cvrfplatform.common.model.ConceptualInsight;
import com.cvrfplatform.common.model.CvrfCycleResult;
import com.cvrfplatform.common.model.CvrfPerformanceMetrics;
import com.cvrfplatform.common.model.ImpactDirection;

import java.util.List;
import java.util.Map;

/**
 * Learning-loop health over a user's cycle history (oldest first).
 *
 * <ul>
 *   <li>beliefStability: 1 − summed factor-weight movement over the last 5 cycles,
 *       normalised by window × 5</li>
 *   <li>insightQuality: share of insights whose direction matched the next cycle's delta sign</li>
 *   <li>overfitRisk: average belief updates per cycle / 10</li>
 *   <li>adaptationSpeed: regime changes per cycle × 5</li>
 * </ul>
 *
 * <p>No logging. No side-effects.
 */
public final class PerformanceMetricsCalculator {

    private static final int STABILITY_WINDOW = 5;

    private PerformanceMetricsCalculator() {}

    public static CvrfPerformanceMetrics compute(List<CvrfCycleResult> history) {
        int n = history.size();
        if (n < 2) {
            return new CvrfPerformanceMetrics(n,
                n == 1 ? history.get(0).learningRate() : 0.0,
                1.0, 0.0, 0.0, 0.0);
        }

        double avgLearningRate = history.stream()
            .mapToDouble(CvrfCycleResult::learningRate)
            .average()
            .orElse(0.0);

        return new CvrfPerformanceMetrics(n, avgLearningRate,
            beliefStability(history), insightQuality(history),
            overfitRisk(history), adaptationSpeed(history));
    }

    // ── helpers ────────────────────────────────────────────────────────────

    private static double beliefStability(List<CvrfCycleResult> history) {
        List<CvrfCycleResult> recent = history.subList(Math.max(0, history.size() - STABILITY_WINDOW),
            history.size());
        double totalChange = 0.0;
        for (int i = 1; i < recent.size(); i++) {
            Map<String, Double> prev = recent.get(i - 1).newBeliefState().factorWeights();
            for (Map.Entry<String, Double> e : recent.get(i).newBeliefState().factorWeights().entrySet()) {
                double before = prev.getOrDefault(e.getKey(), e.getValue());
                totalChange += Math.abs(e.getValue() - before);
            }
        }
        return Math.max(0.0, 1.0 - totalChange / (recent.size() * 5.0));
    }

    private static double insightQuality(List<CvrfCycleResult> history) {
        if (history.size() < 3) {
            return 0.5;
        }
        int correct = 0;
        int total = 0;
        for (int i = 1; i < history.size(); i++) {
            double nextDelta = history.get(i).episodeComparison().performanceDelta();
            for (ConceptualInsight insight : history.get(i - 1).extractedInsights()) {
                if (insight.impactDirection() == ImpactDirection.POSITIVE && nextDelta > 0
                        || insight.impactDirection() == ImpactDirection.NEGATIVE && nextDelta < 0) {
                    correct++;
                }
                total++;
            }
        }
        return total > 0 ? (double) correct / total : 0.5;
    }

    private static double overfitRisk(List<CvrfCycleResult> history) {
        if (history.size() < 3) {
            return 0.0;
        }
        double avgUpdates = history.stream().mapToInt(c -> c.beliefUpdates().size()).average().orElse(0.0);
        return Math.min(1.0, avgUpdates / 10.0);
    }

    private static double adaptationSpeed(List<CvrfCycleResult> history) {
        int regimeChanges = 0;
        for (int i = 1; i < history.size(); i++) {
            if (history.get(i).newBeliefState().currentRegime()
                    != history.get(i - 1).newBeliefState().currentRegime()) {
                regimeChanges++;
            }
        }
        return Math.min(1.0, (double) regimeChanges / history.size() * 5.0);
    }
}
