package com.cvrfplatform.common.cvrf;

import com.cvrfplatform.common.model.BeliefState;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-user owned state: the last committed belief snapshot plus the primitives that
 * serialize that user's lifecycle and cycles. Passed explicitly through the
 * orchestrator; there is no process-wide "current belief".
 *
 * <p>Readers take {@link #snapshot()} without locking and never wait on a running cycle.
 */
public final class UserBeliefHandle {

    private final String        userId;
    private final ReentrantLock lifecycleLock = new ReentrantLock();
    private final AtomicBoolean cycleInFlight = new AtomicBoolean(false);

    private volatile BeliefState snapshot;

    UserBeliefHandle(String userId, BeliefState initial) {
        this.userId = userId;
        this.snapshot = initial;
    }

    public String userId() {
        return userId;
    }

    public BeliefState snapshot() {
        return snapshot;
    }

    /** Serializes start/record/close for this user. */
    public ReentrantLock lifecycleLock() {
        return lifecycleLock;
    }

    boolean tryBeginCycle() {
        return cycleInFlight.compareAndSet(false, true);
    }

    void endCycle() {
        cycleInFlight.set(false);
    }

    public boolean isCycleInFlight() {
        return cycleInFlight.get();
    }

    void publish(BeliefState committed) {
        this.snapshot = committed;
    }
}
