package com.jay.valuator.layer4_pipeline;

import com.jay.valuator.model.StepEvent;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-run progress log. One writer (the pipeline) appends step events; one reader
 * drains them through a single cursor. Events come out in append order and are
 * never handed to the reader twice.
 */
public class StatusEventBus {

    private final String runId;
    private final Clock clock;
    private final List<StepEvent> events = new ArrayList<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();

    private int cursor = 0;
    private boolean complete = false;
    private Instant completedAt;

    public StatusEventBus(String runId) {
        this(runId, Clock.systemUTC());
    }

    public StatusEventBus(String runId, Clock clock) {
        this.runId = runId;
        this.clock = clock;
    }

    public String runId() {
        return runId;
    }

    public void publish(StepEvent event) {
        lock.lock();
        try {
            events.add(event);
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public void markComplete() {
        lock.lock();
        try {
            if (!complete) {
                complete = true;
                completedAt = clock.instant();
            }
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public boolean isComplete() {
        lock.lock();
        try {
            return complete;
        } finally {
            lock.unlock();
        }
    }

    /** When {@link #markComplete} was first called; null while the run is live. */
    public Instant completedAt() {
        lock.lock();
        try {
            return completedAt;
        } finally {
            lock.unlock();
        }
    }

    /** Complete and every event already handed to the reader. */
    public boolean isDrained() {
        lock.lock();
        try {
            return complete && cursor == events.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the events appended since the previous call. Returns at once when unread
     * events exist; otherwise waits up to {@code timeout} for an event or completion and
     * returns whatever arrived, possibly nothing.
     */
    public List<StepEvent> awaitEvents(Duration timeout) throws InterruptedException {
        lock.lock();
        try {
            long remaining = timeout.toNanos();
            while (cursor == events.size() && !complete && remaining > 0) {
                remaining = changed.awaitNanos(remaining);
            }
            List<StepEvent> unread = new ArrayList<>(events.subList(cursor, events.size()));
            cursor = events.size();
            return unread;
        } finally {
            lock.unlock();
        }
    }

    /** Copy of every event so far; does not move the cursor. */
    public List<StepEvent> snapshot() {
        lock.lock();
        try {
            return List.copyOf(events);
        } finally {
            lock.unlock();
        }
    }
}
