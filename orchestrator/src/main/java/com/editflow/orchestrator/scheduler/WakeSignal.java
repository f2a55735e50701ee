package com.editflow.orchestrator.scheduler;

import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Wakes idle workers when something that could make a job selectable happens:
 * a submission, a retry re-entering PENDING, or a governor state change.
 *
 * Uses a generation counter so a signal raised between a worker's failed
 * selection and its wait is never lost: read {@link #generation()} before
 * selecting, then pass it to {@link #awaitChange}.
 */
@Component
public class WakeSignal {

    private final ReentrantLock lock    = new ReentrantLock();
    private final Condition     changed = lock.newCondition();
    private long generation = 0;

    public void signal() {
        lock.lock();
        try {
            generation++;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public long generation() {
        lock.lock();
        try {
            return generation;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Block until the generation moves past {@code seen} or the timeout elapses.
     *
     * @return true if a signal arrived, false on timeout
     */
    public boolean awaitChange(long seen, Duration timeout) throws InterruptedException {
        long remaining = timeout.toNanos();
        lock.lock();
        try {
            while (generation == seen) {
                if (remaining <= 0) return false;
                remaining = changed.awaitNanos(remaining);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }
}
