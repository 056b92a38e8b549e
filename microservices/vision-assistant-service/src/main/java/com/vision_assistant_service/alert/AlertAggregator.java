package com.vision_assistant_service.alert;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.PriorityQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.vision_assistant_service.safety.SafetyEventType;

/**
 * Merges proximity and safety alerts into one severity-ordered stream.
 *
 * <p>Producers call {@link #publish(Alert)}, which never waits for the announcer. The
 * announcer calls {@link #next()} and receives the most severe pending alert, oldest
 * first within a severity. Alerts still queued are re-ranked whenever something more
 * severe arrives; an alert already handed out is gone from the queue and cannot be
 * recalled. FAR alerts are passed to the sinks but never queued.
 */
public class AlertAggregator {

    private static final Logger log = LoggerFactory.getLogger(AlertAggregator.class);

    private static final Comparator<Pending> ORDER = Comparator
            .comparing((Pending p) -> p.alert().severity())
            .thenComparingLong(Pending::sequence);

    private final List<AlertSink> sinks;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition available = lock.newCondition();
    private final PriorityQueue<Pending> pending = new PriorityQueue<>(ORDER);
    private long sequence;
    private boolean closed;
    private Alert lastDelivered;

    public AlertAggregator(List<AlertSink> sinks) {
        this.sinks = List.copyOf(sinks);
    }

    /**
     * Accepts an alert. Announceable alerts are queued; every alert goes to the sinks.
     *
     * @return true if the alert was queued for announcement
     */
    public boolean publish(Alert alert) {
        boolean queued = false;
        lock.lock();
        try {
            if (!closed && alert.severity().isAnnounceable()) {
                pending.add(new Pending(sequence++, alert));
                available.signal();
                queued = true;
            }
        } finally {
            lock.unlock();
        }

        for (AlertSink sink : sinks) {
            try {
                sink.recordAlert(alert);
            } catch (RuntimeException e) {
                log.warn("Alert sink {} rejected '{}'", sink.getClass().getSimpleName(), alert.message(), e);
            }
        }
        return queued;
    }

    /**
     * Blocks until an alert is available.
     *
     * @return the most severe pending alert, or null once the aggregator is closed
     */
    public Alert next() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (pending.isEmpty() && !closed) {
                available.await();
            }
            return takeLocked();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Like {@link #next()} but gives up after the timeout.
     *
     * @return the alert, or null on timeout or close
     */
    public Alert next(long timeout, TimeUnit unit) throws InterruptedException {
        long nanos = unit.toNanos(timeout);
        lock.lockInterruptibly();
        try {
            while (pending.isEmpty() && !closed) {
                if (nanos <= 0) {
                    return null;
                }
                nanos = available.awaitNanos(nanos);
            }
            return takeLocked();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drops queued, not yet announced raise alerts of the given type.
     *
     * @return how many were dropped
     */
    public int withdraw(SafetyEventType type) {
        int removed = 0;
        lock.lock();
        try {
            Iterator<Pending> it = pending.iterator();
            while (it.hasNext()) {
                if (it.next().alert().isSafetyRaise(type)) {
                    it.remove();
                    removed++;
                }
            }
        } finally {
            lock.unlock();
        }
        if (removed > 0) {
            log.debug("Withdrew {} queued {} announcement(s)", removed, type.getKey());
        }
        return removed;
    }

    /** Queued alerts in the order they would be announced. */
    public List<Alert> pendingSnapshot() {
        List<Pending> copy;
        lock.lock();
        try {
            copy = new ArrayList<>(pending);
        } finally {
            lock.unlock();
        }
        copy.sort(ORDER);
        List<Alert> alerts = new ArrayList<>(copy.size());
        for (Pending p : copy) {
            alerts.add(p.alert());
        }
        return alerts;
    }

    public int pendingCount() {
        lock.lock();
        try {
            return pending.size();
        } finally {
            lock.unlock();
        }
    }

    public Alert lastDelivered() {
        lock.lock();
        try {
            return lastDelivered;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stops the stream. Waiting consumers wake up and receive null; queued alerts are
     * discarded.
     */
    public void close() {
        lock.lock();
        try {
            closed = true;
            pending.clear();
            available.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    private Alert takeLocked() {
        if (closed) {
            return null;
        }
        Pending head = pending.poll();
        if (head == null) {
            return null;
        }
        lastDelivered = head.alert();
        return head.alert();
    }

    private record Pending(long sequence, Alert alert) {
    }
}
