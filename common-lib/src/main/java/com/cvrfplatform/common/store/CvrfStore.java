package com.cvrfplatform.common.store;

import com.cvrfplatform.common.model.BeliefState;
import com.cvrfplatform.common.model.CvrfCycleResult;
import com.cvrfplatform.common.model.Decision;
import com.cvrfplatform.common.model.Episode;

import java.util.List;

/**
 * Persistence port of the engine. Reads happen before any mutation; all cycle
 * writes go through {@link #commit(CycleCommit)}.
 *
 * <p>Implementations propagate their own storage failures unmodified. The only
 * domain exceptions they raise are
 * {@link com.cvrfplatform.common.exception.ConcurrentCycleException} for a stale
 * expected version and {@link com.cvrfplatform.common.exception.StateException}
 * when the episode to close is no longer active.
 */
public interface CvrfStore {

    /** @return the stored canonical beliefs, or {@code null} if none were ever committed */
    BeliefState loadBeliefs(String userId);

    /** @return the user's active episode with its decisions in order, or {@code null} */
    Episode loadActiveEpisode(String userId);

    /** @return up to {@code limit} completed episodes, most recent first */
    List<Episode> loadCompletedEpisodes(String userId, int limit);

    int countCompletedEpisodes(String userId);

    /** @return every committed cycle result, oldest first */
    List<CvrfCycleResult> loadCycleHistory(String userId);

    /** @return the highest episode number used by the user, 0 if none */
    int lastEpisodeNumber(String userId);

    void createEpisode(Episode episode);

    void appendDecision(String userId, String episodeId, Decision decision);

    /**
     * Applies the commit atomically or rejects it entirely.
     */
    void commit(CycleCommit commit);
}
