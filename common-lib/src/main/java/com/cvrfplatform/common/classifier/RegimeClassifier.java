package com.cvrfplatform.common.classifier;

import com.cvrfplatform.common.model.MarketRegime;

import java.util.List;

/**
 * Pure stateless classifier that maps a rolling window of cycle performance
 * deltas (oldest first, current last) to a {@link MarketRegime}.
 *
 * <p>Classification rules (evaluated in priority order):
 * <ol>
 *   <li>stdDev &gt; volatileStdDev                               → {@link MarketRegime#VOLATILE}</li>
 *   <li>≥2 trailing positive deltas AND stdDev ≤ lowVarianceStdDev → {@link MarketRegime#BULL}</li>
 *   <li>≥2 trailing negative deltas                              → {@link MarketRegime#BEAR}</li>
 *   <li>otherwise                                                → {@link MarketRegime#SIDEWAYS}</li>
 * </ol>
 *
 * <p>Confidence is the agreement fraction of the window: positives/n for bull,
 * negatives/n for bear, the share of sign flips between neighbours for volatile,
 * and {@code 1 − |positives − negatives| / n} for sideways.
 *
 * <p>No logging. No side-effects.
 */
public final class RegimeClassifier {

    static final int MIN_WINDOW = 2;

    public record Classification(MarketRegime regime, double confidence) {}

    private RegimeClassifier() {}

    /**
     * @param deltas oldest first; may be null
     * @return the classification, or {@code null} when fewer than {@link #MIN_WINDOW}
     *         deltas are available (the caller keeps its current regime)
     */
    public static Classification classify(List<Double> deltas, double volatileStdDev,
                                          double lowVarianceStdDev) {
        if (deltas == null || deltas.size() < MIN_WINDOW) {
            return null;
        }

        int n = deltas.size();
        int positives = 0;
        int negatives = 0;
        for (double d : deltas) {
            if (d > 0) positives++;
            else if (d < 0) negatives++;
        }

        // ── dispersion first: high variance wins regardless of sign ────────
        double stdDev = stdDev(deltas);
        if (stdDev > volatileStdDev) {
            return new Classification(MarketRegime.VOLATILE, signFlipFraction(deltas));
        }

        int trailingUp   = trailing(deltas, true);
        int trailingDown = trailing(deltas, false);

        if (trailingUp >= MIN_WINDOW && stdDev <= lowVarianceStdDev) {
            return new Classification(MarketRegime.BULL, (double) positives / n);
        }
        if (trailingDown >= MIN_WINDOW) {
            return new Classification(MarketRegime.BEAR, (double) negatives / n);
        }

        return new Classification(MarketRegime.SIDEWAYS,
            1.0 - (double) Math.abs(positives - negatives) / n);
    }

    // ── helpers ────────────────────────────────────────────────────────────

    private static int trailing(List<Double> deltas, boolean positive) {
        int count = 0;
        for (int i = deltas.size() - 1; i >= 0; i--) {
            double d = deltas.get(i);
            if (positive ? d > 0 : d < 0) {
                count++;
            } else {
                break;
            }
        }
        return count;
    }

    private static double signFlipFraction(List<Double> deltas) {
        int flips = 0;
        for (int i = 1; i < deltas.size(); i++) {
            if (Math.signum(deltas.get(i)) != Math.signum(deltas.get(i - 1))) {
                flips++;
            }
        }
        return (double) flips / (deltas.size() - 1);
    }

    static double stdDev(List<Double> values) {
        double mean = values.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        double variance = values.stream()
            .mapToDouble(v -> (v - mean) * (v - mean))
            .average()
            .orElse(0.0);
        return Math.sqrt(variance);
    }
}
