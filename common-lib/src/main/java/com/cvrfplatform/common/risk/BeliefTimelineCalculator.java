package com.cvrfplatform.common.risk;

import com.cvrfplatform.common.model.BeliefSnapshot;
import com.cvrfplatform.common.model.BeliefState;
import com.cvrfplatform.common.model.BeliefTimeline;
import com.cvrfplatform.common.model.CvrfCycleResult;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Builds a {@link BeliefTimeline} from a user's cycle history (oldest first): one
 * snapshot per cycle whose timestamp is not older than {@code now − days}.
 *
 * <p>No logging. No side-effects.
 */
public final class BeliefTimelineCalculator {

    private BeliefTimelineCalculator() {}

    public static BeliefTimeline compute(List<CvrfCycleResult> history, int days, Instant now) {
        Instant cutoff = now.minus(Duration.ofDays(days));
        List<BeliefSnapshot> snapshots = new ArrayList<>();
        SortedSet<String> factors = new TreeSet<>();
        int transitions = 0;

        for (CvrfCycleResult cycle : history) {
            if (cycle.timestamp().isBefore(cutoff)) {
                continue;
            }
            BeliefState s = cycle.newBeliefState();
            BeliefSnapshot snapshot = new BeliefSnapshot(
                LocalDate.ofInstant(cycle.timestamp(), ZoneOffset.UTC),
                cycle.timestamp(),
                cycle.cycleId(),
                cycle.cycleNumber(),
                s.version(),
                s.factorWeights(),
                s.factorConfidences(),
                s.currentRegime(),
                s.regimeConfidence(),
                s.riskTolerance(),
                s.volatilityTarget(),
                cycle.episodeComparison().performanceDelta(),
                cycle.extractedInsights().size());

            if (!snapshots.isEmpty() && snapshots.get(snapshots.size() - 1).regime() != snapshot.regime()) {
                transitions++;
            }
            snapshots.add(snapshot);
            factors.addAll(s.factorWeights().keySet());
        }
        return new BeliefTimeline(days, snapshots, new ArrayList<>(factors), transitions);
    }
}
