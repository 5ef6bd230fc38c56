package com.cvrfplatform.common.store;

import com.cvrfplatform.common.exception.ConcurrentCycleException;
import com.cvrfplatform.common.exception.StateException;
import com.cvrfplatform.common.model.BeliefState;
import com.cvrfplatform.common.model.CvrfCycleResult;
import com.cvrfplatform.common.model.Decision;
import com.cvrfplatform.common.model.Episode;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Heap-backed {@link CvrfStore} for embedded use and tests.
 * Every operation holds the store monitor, so a commit is observed whole or not at all.
 */
public class InMemoryCvrfStore implements CvrfStore {

    private final Map<String, BeliefState>           beliefs  = new HashMap<>();
    private final Map<String, List<Episode>>         episodes = new HashMap<>();
    private final Map<String, List<CvrfCycleResult>> cycles   = new HashMap<>();

    @Override
    public synchronized BeliefState loadBeliefs(String userId) {
        return beliefs.get(userId);
    }

    @Override
    public synchronized Episode loadActiveEpisode(String userId) {
        return episodesOf(userId).stream()
            .filter(Episode::isActive)
            .findFirst()
            .orElse(null);
    }

    @Override
    public synchronized List<Episode> loadCompletedEpisodes(String userId, int limit) {
        List<Episode> completed = new ArrayList<>();
        List<Episode> all = episodesOf(userId);
        for (int i = all.size() - 1; i >= 0 && completed.size() < limit; i--) {
            if (all.get(i).isCompleted()) {
                completed.add(all.get(i));
            }
        }
        return completed;
    }

    @Override
    public synchronized int countCompletedEpisodes(String userId) {
        return (int) episodesOf(userId).stream().filter(Episode::isCompleted).count();
    }

    @Override
    public synchronized List<CvrfCycleResult> loadCycleHistory(String userId) {
        return List.copyOf(cycles.getOrDefault(userId, List.of()));
    }

    @Override
    public synchronized int lastEpisodeNumber(String userId) {
        return episodesOf(userId).stream().mapToInt(Episode::episodeNumber).max().orElse(0);
    }

    @Override
    public synchronized void createEpisode(Episode episode) {
        if (loadActiveEpisode(episode.userId()) != null) {
            throw new StateException(episode.userId(), "An episode is already active");
        }
        episodes.computeIfAbsent(episode.userId(), k -> new ArrayList<>()).add(episode);
    }

    @Override
    public synchronized void appendDecision(String userId, String episodeId, Decision decision) {
        List<Episode> all = episodesOf(userId);
        int idx = indexOfActive(all, episodeId);
        if (idx < 0) {
            throw new StateException(userId, "Episode " + episodeId + " is not active");
        }
        all.set(idx, all.get(idx).withDecision(decision));
    }

    @Override
    public synchronized void commit(CycleCommit commit) {
        String userId = commit.userId();

        // ── validate everything before touching state ──────────────────────
        if (commit.expectedVersion() != null) {
            BeliefState stored = beliefs.get(userId);
            long current = stored == null ? BeliefState.INITIAL_VERSION : stored.version();
            if (current != commit.expectedVersion()) {
                throw new ConcurrentCycleException(userId,
                    "Belief version changed: expected=" + commit.expectedVersion() + " actual=" + current);
            }
        }
        int closeIdx = -1;
        if (commit.hasClosedEpisode()) {
            closeIdx = indexOfActive(episodesOf(userId), commit.closedEpisode().id());
            if (closeIdx < 0) {
                throw new StateException(userId,
                    "Episode " + commit.closedEpisode().id() + " is not active");
            }
        }

        // ── apply ──────────────────────────────────────────────────────────
        if (closeIdx >= 0) {
            episodes.get(userId).set(closeIdx, commit.closedEpisode());
        }
        if (commit.hasBeliefState()) {
            beliefs.put(userId, commit.beliefState());
        }
        if (commit.hasCycleResult()) {
            cycles.computeIfAbsent(userId, k -> new ArrayList<>()).add(commit.cycleResult());
        }
    }

    private List<Episode> episodesOf(String userId) {
        return episodes.getOrDefault(userId, new ArrayList<>());
    }

    private static int indexOfActive(List<Episode> all, String episodeId) {
        for (int i = 0; i < all.size(); i++) {
            Episode e = all.get(i);
            if (e.id().equals(episodeId) && e.isActive()) {
                return i;
            }
        }
        return -1;
    }
}
