package com.cvrfplatform.common.risk;

import com.cvrfplatform.common.model.BeliefState;
import com.cvrfplatform.common.model.PortfolioPosition;
import com.cvrfplatform.common.model.RiskAdjustmentType;
import com.cvrfplatform.common.model.RiskControlResult;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Historical CVaR check run during an episode.
 *
 * <p>Triggered when |CVaR| exceeds the belief's {@code maxDrawdownThreshold}. The
 * response escalates with severity = |CVaR| / threshold:
 * <ol>
 *   <li>severity &gt; 1.5 → REDUCE_EXPOSURE on the three largest positions</li>
 *   <li>severity &gt; 1.2 → HEDGE with index protection</li>
 *   <li>otherwise      → REBALANCE positions above the concentration limit</li>
 * </ol>
 *
 * <p>No logging. No side-effects.
 */
public final class WithinEpisodeRiskCheck {

    public static final List<String> HEDGE_INSTRUMENTS = List.of("SPY_PUT", "VIX_CALL");

    private static final int REDUCE_TOP_N = 3;

    private WithinEpisodeRiskCheck() {}

    public static RiskControlResult evaluate(BeliefState beliefs, List<Double> returns,
                                             List<PortfolioPosition> positions,
                                             double confidenceLevel) {
        double threshold = beliefs.maxDrawdownThreshold();
        if (returns == null || returns.isEmpty()) {
            return RiskControlResult.notTriggered(0.0, threshold);
        }

        double cvar = cvar(returns, confidenceLevel);
        if (Math.abs(cvar) <= threshold) {
            return RiskControlResult.notTriggered(cvar, threshold);
        }

        List<PortfolioPosition> held = positions == null ? List.of() : positions;
        double severity = Math.abs(cvar) / threshold;

        if (severity > 1.5) {
            List<String> largest = held.stream()
                .sorted(Comparator.comparingDouble(PortfolioPosition::weight).reversed()
                    .thenComparing(PortfolioPosition::symbol))
                .limit(REDUCE_TOP_N)
                .map(PortfolioPosition::symbol)
                .toList();
            return new RiskControlResult(cvar, threshold, true, RiskAdjustmentType.REDUCE_EXPOSURE,
                Math.min(0.3, (severity - 1) * 0.2), largest);
        }
        if (severity > 1.2) {
            return new RiskControlResult(cvar, threshold, true, RiskAdjustmentType.HEDGE,
                Math.min(0.2, (severity - 1) * 0.15), HEDGE_INSTRUMENTS);
        }

        List<String> concentrated = new ArrayList<>();
        for (PortfolioPosition p : held) {
            if (p.weight() > beliefs.concentrationLimit()) {
                concentrated.add(p.symbol());
            }
        }
        return new RiskControlResult(cvar, threshold, true, RiskAdjustmentType.REBALANCE,
            Math.min(0.1, (severity - 1) * 0.1), concentrated);
    }

    /**
     * Mean of the worst {@code (1 − confidenceLevel)} share of returns, at least one.
     */
    static double cvar(List<Double> returns, double confidenceLevel) {
        List<Double> sorted = new ArrayList<>(returns);
        sorted.sort(Comparator.naturalOrder());
        int tail = Math.max(1, (int) Math.floor(sorted.size() * (1.0 - confidenceLevel)));
        double sum = 0.0;
        for (int i = 0; i < tail; i++) {
            sum += sorted.get(i);
        }
        return sum / tail;
    }
}
