package com.cvrfplatform.common.cvrf;

import com.cvrfplatform.common.model.BeliefState;
import com.cvrfplatform.common.store.CvrfStore;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns one {@link UserBeliefHandle} per user. A handle is created on first access
 * from the stored beliefs, or from defaults when the user has none yet.
 */
public class BeliefHandleRegistry {

    private final CvrfStore store;
    private final Clock     clock;
    private final Map<String, UserBeliefHandle> handles = new ConcurrentHashMap<>();

    public BeliefHandleRegistry(CvrfStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    public UserBeliefHandle handle(String userId) {
        return handles.computeIfAbsent(userId, id -> new UserBeliefHandle(id, loadOrDefault(id)));
    }

    /** Re-reads the stored beliefs into the handle, e.g. after another writer won a commit. */
    void refresh(UserBeliefHandle handle) {
        handle.publish(loadOrDefault(handle.userId()));
    }

    private BeliefState loadOrDefault(String userId) {
        BeliefState stored = store.loadBeliefs(userId);
        return stored != null ? stored : BeliefState.defaults(userId, clock.instant());
    }
}
