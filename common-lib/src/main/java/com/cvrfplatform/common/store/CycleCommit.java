package com.cvrfplatform.common.store;

import com.cvrfplatform.common.model.BeliefState;
import com.cvrfplatform.common.model.CvrfCycleResult;
import com.cvrfplatform.common.model.Episode;

/**
 * The unit of atomic persistence: every present part is applied, or none is.
 *
 * <ul>
 *   <li>{@code closedEpisode}   completed copy replacing the user's active episode</li>
 *   <li>{@code beliefState}     new canonical state; null leaves beliefs untouched</li>
 *   <li>{@code expectedVersion} belief version read at cycle start; null skips the check</li>
 *   <li>{@code cycleResult}     appended to the cycle history</li>
 * </ul>
 */
public record CycleCommit(
    String          userId,
    Episode         closedEpisode,
    BeliefState     beliefState,
    Long            expectedVersion,
    CvrfCycleResult cycleResult
) {

    public static CycleCommit episodeOnly(Episode closedEpisode) {
        return new CycleCommit(closedEpisode.userId(), closedEpisode, null, null, null);
    }

    public boolean hasClosedEpisode() {
        return closedEpisode != null;
    }

    public boolean hasBeliefState() {
        return beliefState != null;
    }

    public boolean hasCycleResult() {
        return cycleResult != null;
    }
}
