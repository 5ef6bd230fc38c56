package com.cvrfplatform.belief.service;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Users whose last episode closed with {@code runCvrf=false} and whose comparison
 * cycle is still pending. A user is queued at most once; draining empties the queue
 * in insertion order.
 *
 * <p>In-memory only: pending work lost on restart is recovered by
 * {@code POST /cycles/run}, which compares the two latest episodes on demand.
 */
@Component
public class DeferredCycleQueue {

    private final Set<String> pending = new LinkedHashSet<>();

    public synchronized void enqueue(String userId) {
        pending.add(userId);
    }

    public synchronized List<String> drain() {
        List<String> users = new ArrayList<>(pending);
        pending.clear();
        return users;
    }

    public synchronized boolean contains(String userId) {
        return pending.contains(userId);
    }

    public synchronized int size() {
        return pending.size();
    }
}
