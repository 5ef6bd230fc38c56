package com.cvrfplatform.common.concept;

import com.cvrfplatform.common.config.CvrfConfig;
import com.cvrfplatform.common.model.ConceptualInsight;
import com.cvrfplatform.common.model.Decision;
import com.cvrfplatform.common.model.Episode;
import com.cvrfplatform.common.model.EpisodeComparison;
import com.cvrfplatform.common.model.ImpactDirection;
import com.cvrfplatform.common.model.InsightType;
import com.cvrfplatform.common.model.SentimentLabel;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Pure logic class: diffs two completed episodes and turns the difference into
 * a bounded, ordered list of {@link ConceptualInsight}s.
 *
 * <p>Steps:
 * <ol>
 *   <li>performanceDelta = later.portfolioReturn − earlier.portfolioReturn</li>
 *   <li>decisionOverlap = Jaccard similarity of (symbol, action) pairs</li>
 *   <li>later decisions split by outcome sign into profitable / losing</li>
 *   <li>per factor, mean exposure of profitable vs losing trades; a gap above the
 *       significance threshold becomes a FACTOR insight</li>
 *   <li>sentiment readings on profitable / losing trades become SENTIMENT insights</li>
 *   <li>a mean entry-time gap of more than a day between winners and losers
 *       becomes a TIMING insight</li>
 *   <li>a drawdown gap between the better and worse episode, or a drawdown above
 *       10% in the worse one, becomes a RISK insight</li>
 *   <li>a large position behind a profitable or losing trade becomes an
 *       ALLOCATION insight</li>
 *   <li>a sign flip of the delta against the previous cycle under low overlap
 *       becomes a REGIME insight</li>
 *   <li>every insight below the minimum confidence is dropped</li>
 *   <li>sort by confidence desc, subject asc; cap</li>
 * </ol>
 *
 * <p>No logging. No side-effects. Same inputs always yield the same output,
 * insight ids included.
 */
public final class ConceptExtractor {

    public static final String REGIME_SHIFT_SUBJECT      = "regime_shift";
    public static final String ENTRY_TIMING_SUBJECT      = "entry_timing";
    public static final String DRAWDOWN_CONTROL_SUBJECT  = "drawdown_control";
    public static final String DRAWDOWN_BREACH_SUBJECT   = "drawdown_breach";

    private static final double TIMING_MIN_DAYS          = 1.0;
    private static final double DRAWDOWN_GAP             = 0.02;
    private static final double DRAWDOWN_BREACH          = 0.10;
    private static final double BREACH_CONFIDENCE        = 0.85;
    private static final double PROFITABLE_CONCENTRATION = 0.10;
    private static final double LOSING_CONCENTRATION     = 0.15;
    private static final double OVER_CONCENTRATION_CONF  = 0.80;
    private static final double MILLIS_PER_DAY           = 86_400_000.0;

    private static final Comparator<ConceptualInsight> INSIGHT_ORDER =
        Comparator.comparingDouble(ConceptualInsight::confidence).reversed()
            .thenComparing(ConceptualInsight::subject);

    private final CvrfConfig config;

    public ConceptExtractor(CvrfConfig config) {
        this.config = config;
    }

    /**
     * Comparison plus the insights it produced.
     */
    public record ExtractionResult(
        EpisodeComparison       comparison,
        List<ConceptualInsight> insights
    ) {}

    /**
     * @param previousDelta performance delta of the user's previous cycle, or {@code null}
     *                      when this is the first comparison
     */
    public ExtractionResult extract(Episode earlier, Episode later, Double previousDelta) {
        double delta = later.portfolioReturn() - earlier.portfolioReturn();
        double overlap = decisionOverlap(earlier.decisions(), later.decisions());

        List<Decision> profitable = new ArrayList<>();
        List<Decision> losing = new ArrayList<>();
        for (Decision d : later.decisions()) {
            if (d.isProfitable()) profitable.add(d);
            else if (d.isLosing()) losing.add(d);
        }

        boolean laterBetter = delta >= 0;
        EpisodeComparison comparison = new EpisodeComparison(
            earlier.id(), later.id(),
            laterBetter ? later.id() : earlier.id(),
            laterBetter ? earlier.id() : later.id(),
            delta, overlap, profitable, losing, later.endDate());

        if (earlier.decisions().isEmpty() || later.decisions().isEmpty()) {
            return new ExtractionResult(comparison, List.of());
        }

        Episode better = laterBetter ? later : earlier;
        Episode worse = laterBetter ? earlier : later;

        List<ConceptualInsight> insights = new ArrayList<>(factorInsights(later, profitable, losing, overlap, delta));
        insights.addAll(sentimentInsights(later, better, worse, profitable, losing));
        insights.addAll(timingInsights(later, better, profitable, losing));
        insights.addAll(riskInsights(later, better, worse));
        insights.addAll(allocationInsights(later, better, worse, profitable, losing));

        ConceptualInsight regime = regimeInsight(later, previousDelta, delta, overlap);
        if (regime != null) {
            insights.add(regime);
        }

        insights.removeIf(i -> i.confidence() < config.minInsightConfidence());
        insights.sort(INSIGHT_ORDER);
        if (insights.size() > config.maxInsightsPerCycle()) {
            insights = new ArrayList<>(insights.subList(0, config.maxInsightsPerCycle()));
        }
        return new ExtractionResult(comparison, List.copyOf(insights));
    }

    /**
     * Jaccard similarity of the two decision sets keyed by (symbol, action).
     * Symmetric; 0 when both are empty, never NaN.
     */
    public static double decisionOverlap(List<Decision> a, List<Decision> b) {
        Set<String> left = signatures(a);
        Set<String> right = signatures(b);
        Set<String> union = new HashSet<>(left);
        union.addAll(right);
        if (union.isEmpty()) {
            return 0.0;
        }
        Set<String> intersection = new HashSet<>(left);
        intersection.retainAll(right);
        return (double) intersection.size() / union.size();
    }

    // ── factor insights ────────────────────────────────────────────────────

    private List<ConceptualInsight> factorInsights(Episode later, List<Decision> profitable,
                                                   List<Decision> losing, double overlap,
                                                   double delta) {
        List<ConceptualInsight> insights = new ArrayList<>();
        if (profitable.isEmpty() || losing.isEmpty()) {
            return insights;
        }

        SortedSet<String> factors = new TreeSet<>();
        profitable.forEach(d -> factors.addAll(d.factors().keySet()));
        losing.forEach(d -> factors.addAll(d.factors().keySet()));

        for (String factor : factors) {
            Double profitableAvg = meanExposure(profitable, factor);
            Double losingAvg = meanExposure(losing, factor);
            if (profitableAvg == null || losingAvg == null) {
                continue;
            }

            double diff = profitableAvg - losingAvg;
            if (Math.abs(diff) <= config.factorSignificanceThreshold()) {
                continue;
            }

            double confidence = Math.min(1.0, Math.abs(diff) * overlap);

            ImpactDirection direction = ImpactDirection.of(diff);
            String concept = direction == ImpactDirection.POSITIVE
                ? fmt("Higher %s exposure (%.2f vs %.2f) separated winning from losing trades",
                      factor, profitableAvg, losingAvg)
                : fmt("Higher %s exposure (%.2f vs %.2f) concentrated in losing trades",
                      factor, losingAvg, profitableAvg);

            insights.add(new ConceptualInsight(
                insightId(later, InsightType.FACTOR, factor),
                InsightType.FACTOR, factor, concept,
                List.of(
                    fmt("Profitable trades avg %s: %.2f (n=%d)", factor, profitableAvg, profitable.size()),
                    fmt("Losing trades avg %s: %.2f (n=%d)", factor, losingAvg, losing.size()),
                    fmt("Decision overlap: %.2f, performance delta: %.4f", overlap, delta)),
                confidence, later.id(), direction));
        }
        return insights;
    }

    private static Double meanExposure(List<Decision> decisions, String factor) {
        double sum = 0.0;
        int count = 0;
        for (Decision d : decisions) {
            Double exposure = d.factors().get(factor);
            if (exposure != null) {
                sum += exposure;
                count++;
            }
        }
        return count > 0 ? sum / count : null;
    }

    // ── sentiment insights ─────────────────────────────────────────────────

    private List<ConceptualInsight> sentimentInsights(Episode later, Episode better, Episode worse,
                                                      List<Decision> profitable, List<Decision> losing) {
        List<ConceptualInsight> insights = new ArrayList<>();
        List<Decision> followed = withSentiment(profitable);
        if (!followed.isEmpty()) {
            SentimentLabel label = dominantLabel(followed);
            double confidence = meanSentimentConfidence(followed);
            insights.add(new ConceptualInsight(
                insightId(later, InsightType.SENTIMENT, "followed_" + label(label)),
                InsightType.SENTIMENT, "followed_" + label(label),
                fmt("Following %s sentiment signals (avg %.0f%% confidence) led to profitable trades",
                    label(label), confidence * 100),
                sentimentEvidence(followed), confidence, better.id(), ImpactDirection.POSITIVE));
        }
        List<Decision> ignored = withSentiment(losing);
        if (!ignored.isEmpty()) {
            SentimentLabel label = dominantLabel(ignored);
            insights.add(new ConceptualInsight(
                insightId(later, InsightType.SENTIMENT, "ignored_" + label(label)),
                InsightType.SENTIMENT, "ignored_" + label(label),
                fmt("Trading against %s sentiment signals resulted in losses", label(label)),
                sentimentEvidence(ignored), meanSentimentConfidence(ignored), worse.id(),
                ImpactDirection.NEGATIVE));
        }
        return insights;
    }

    private static List<Decision> withSentiment(List<Decision> decisions) {
        List<Decision> out = new ArrayList<>();
        decisions.forEach(d -> {
            if (d.sentiment() != null) out.add(d);
        });
        return out;
    }

    /** Most frequent label; ties go to the earlier enum constant. */
    private static SentimentLabel dominantLabel(List<Decision> decisions) {
        Map<SentimentLabel, Integer> counts = new EnumMap<>(SentimentLabel.class);
        decisions.forEach(d -> counts.merge(d.sentiment().label(), 1, Integer::sum));
        SentimentLabel best = null;
        for (SentimentLabel label : SentimentLabel.values()) {
            int n = counts.getOrDefault(label, 0);
            if (best == null || n > counts.getOrDefault(best, 0)) {
                best = label;
            }
        }
        return best;
    }

    private static double meanSentimentConfidence(List<Decision> decisions) {
        return decisions.stream().mapToDouble(d -> d.sentiment().confidence()).average().orElse(0.0);
    }

    private static List<String> sentimentEvidence(List<Decision> decisions) {
        List<String> evidence = new ArrayList<>();
        decisions.forEach(d -> evidence.add(fmt("%s %s: %s (%.0f%%)", d.action(), d.symbol(),
            label(d.sentiment().label()), d.sentiment().confidence() * 100)));
        return evidence;
    }

    // ── timing insight ─────────────────────────────────────────────────────

    private List<ConceptualInsight> timingInsights(Episode later, Episode better,
                                                   List<Decision> profitable, List<Decision> losing) {
        Double profitableAt = meanEpochMillis(profitable);
        Double losingAt = meanEpochMillis(losing);
        if (profitableAt == null || losingAt == null) {
            return List.of();
        }
        double days = (losingAt - profitableAt) / MILLIS_PER_DAY;
        if (Math.abs(days) <= TIMING_MIN_DAYS) {
            return List.of();
        }
        ImpactDirection direction = ImpactDirection.of(days);
        String concept = direction == ImpactDirection.POSITIVE
            ? fmt("Earlier entries (%.1f days ahead of losing trades) captured more upside", days)
            : fmt("Winning trades came %.1f days after losing ones: early entries were premature", -days);
        return List.of(new ConceptualInsight(
            insightId(later, InsightType.TIMING, ENTRY_TIMING_SUBJECT),
            InsightType.TIMING, ENTRY_TIMING_SUBJECT, concept,
            List.of(
                fmt("Profitable trades: %d, losing trades: %d", profitable.size(), losing.size()),
                fmt("Losing trades entered %.1f days after profitable ones on average", days)),
            Math.min(0.9, 0.5 + Math.abs(days) / 10.0), better.id(), direction));
    }

    private static Double meanEpochMillis(List<Decision> decisions) {
        double sum = 0.0;
        int count = 0;
        for (Decision d : decisions) {
            if (d.timestamp() != null) {
                sum += d.timestamp().toEpochMilli();
                count++;
            }
        }
        return count > 0 ? sum / count : null;
    }

    // ── risk insights ──────────────────────────────────────────────────────

    private List<ConceptualInsight> riskInsights(Episode later, Episode better, Episode worse) {
        List<ConceptualInsight> insights = new ArrayList<>();
        double gap = worse.maxDrawdown() - better.maxDrawdown();
        if (gap > DRAWDOWN_GAP) {
            insights.add(new ConceptualInsight(
                insightId(later, InsightType.RISK, DRAWDOWN_CONTROL_SUBJECT),
                InsightType.RISK, DRAWDOWN_CONTROL_SUBJECT,
                fmt("Risk management limited drawdown to %.1f%% in the better episode", better.maxDrawdown() * 100),
                List.of(
                    fmt("Better episode max drawdown: %.1f%%", better.maxDrawdown() * 100),
                    fmt("Worse episode max drawdown: %.1f%%", worse.maxDrawdown() * 100)),
                Math.min(0.95, 0.6 + gap * 5), better.id(), ImpactDirection.POSITIVE));
        }
        if (worse.maxDrawdown() > DRAWDOWN_BREACH) {
            insights.add(new ConceptualInsight(
                insightId(later, InsightType.RISK, DRAWDOWN_BREACH_SUBJECT),
                InsightType.RISK, DRAWDOWN_BREACH_SUBJECT,
                fmt("Drawdown of %.1f%% exceeded the 10%% alarm level", worse.maxDrawdown() * 100),
                List.of(fmt("Worse episode max drawdown: %.1f%%", worse.maxDrawdown() * 100)),
                BREACH_CONFIDENCE, worse.id(), ImpactDirection.NEGATIVE));
        }
        return insights;
    }

    // ── allocation insights ────────────────────────────────────────────────

    private List<ConceptualInsight> allocationInsights(Episode later, Episode better, Episode worse,
                                                       List<Decision> profitable, List<Decision> losing) {
        List<ConceptualInsight> insights = new ArrayList<>();
        Decision topWinner = largestPosition(profitable);
        if (topWinner != null && topWinner.weightAfter() > PROFITABLE_CONCENTRATION) {
            String subject = "concentration:" + topWinner.symbol();
            insights.add(new ConceptualInsight(
                insightId(later, InsightType.ALLOCATION, subject),
                InsightType.ALLOCATION, subject,
                fmt("Concentration in %s (%.1f%%) drove the gain", topWinner.symbol(), topWinner.weightAfter() * 100),
                List.of(
                    fmt("%s weight: %.1f%%", topWinner.symbol(), topWinner.weightAfter() * 100),
                    fmt("Decision confidence: %.0f%%", topWinner.confidence() * 100)),
                topWinner.confidence(), better.id(), ImpactDirection.POSITIVE));
        }
        Decision topLoser = largestPosition(losing);
        if (topLoser != null && topLoser.weightAfter() > LOSING_CONCENTRATION) {
            String subject = "over_concentration:" + topLoser.symbol();
            insights.add(new ConceptualInsight(
                insightId(later, InsightType.ALLOCATION, subject),
                InsightType.ALLOCATION, subject,
                fmt("Over-concentration in %s (%.1f%%) amplified the loss", topLoser.symbol(),
                    topLoser.weightAfter() * 100),
                List.of(fmt("%s weight: %.1f%%", topLoser.symbol(), topLoser.weightAfter() * 100)),
                OVER_CONCENTRATION_CONF, worse.id(), ImpactDirection.NEGATIVE));
        }
        return insights;
    }

    /** First decision with the largest post-trade weight. */
    private static Decision largestPosition(List<Decision> decisions) {
        Decision top = null;
        for (Decision d : decisions) {
            if (top == null || d.weightAfter() > top.weightAfter()) {
                top = d;
            }
        }
        return top;
    }

    // ── regime insight ─────────────────────────────────────────────────────

    private ConceptualInsight regimeInsight(Episode later, Double previousDelta, double delta,
                                            double overlap) {
        if (previousDelta == null || previousDelta == 0.0 || delta == 0.0) {
            return null;
        }
        if (Math.signum(previousDelta) == Math.signum(delta)) {
            return null;
        }
        if (overlap >= config.lowOverlapThreshold()) {
            return null;
        }

        ImpactDirection direction = ImpactDirection.of(delta);
        String concept = direction == ImpactDirection.POSITIVE
            ? "Performance recovered after repositioning: structural shift, not noise"
            : "Performance reversed while the decision set changed: failed to adapt to a regime shift";

        return new ConceptualInsight(
            insightId(later, InsightType.REGIME, REGIME_SHIFT_SUBJECT),
            InsightType.REGIME, REGIME_SHIFT_SUBJECT, concept,
            List.of(
                fmt("Previous cycle delta: %.4f", previousDelta),
                fmt("Current cycle delta: %.4f", delta),
                fmt("Decision overlap: %.2f", overlap)),
            1.0 - overlap, later.id(), direction);
    }

    // ── helpers ────────────────────────────────────────────────────────────

    private static Set<String> signatures(List<Decision> decisions) {
        Set<String> out = new HashSet<>();
        if (decisions != null) {
            decisions.forEach(d -> out.add(d.signature()));
        }
        return out;
    }

    private static String insightId(Episode later, InsightType type, String subject) {
        return later.id() + ":" + type.name().toLowerCase(Locale.ROOT) + ":" + subject;
    }

    private static String label(SentimentLabel label) {
        return label.name().toLowerCase(Locale.ROOT);
    }

    private static String fmt(String pattern, Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }
}
