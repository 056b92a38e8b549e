package com.vision_assistant_service.safety;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds one independent state machine per {@link SafetyEventType}.
 *
 * <p>Each type has its own lock, so an acknowledgement of a fall never waits on an
 * assistance poll. Transitions are queued under that lock and delivered to listeners after
 * it is released, one type at a time and in the order the state changed. Whichever caller
 * holds a type's delivery lock delivers everything queued for it; the others return at once.
 */
public class SafetyEventMonitor {

    private static final Logger log = LoggerFactory.getLogger(SafetyEventMonitor.class);

    private final Clock clock;
    private final Map<SafetyEventType, Slot> slots = new EnumMap<>(SafetyEventType.class);
    private final List<SafetyTransitionListener> listeners = new CopyOnWriteArrayList<>();

    public SafetyEventMonitor(Clock clock) {
        this.clock = clock;
        for (SafetyEventType type : SafetyEventType.values()) {
            slots.put(type, new Slot(type.getHistorySize()));
        }
    }

    public void addListener(SafetyTransitionListener listener) {
        listeners.add(listener);
    }

    public Optional<SafetyTransition> raise(SafetyEventType type) {
        return raise(type, null, null);
    }

    /**
     * Raises an event. Raising an active event only refreshes its timestamp and, for
     * assistance, the requested type when the reading names one.
     *
     * @param assistanceType  subtype for {@link SafetyEventType#ASSISTANCE}, ignored otherwise
     * @param sensorTimestamp when the sensor saw the incident; an acknowledged incident is not
     *                        re-opened by a reading that is not newer than it
     * @return the transition, or empty when nothing announceable changed
     */
    public Optional<SafetyTransition> raise(SafetyEventType type, AssistanceType assistanceType,
                                            Instant sensorTimestamp) {
        Instant now = clock.instant();
        AssistanceType subtype = type == SafetyEventType.ASSISTANCE
                ? (assistanceType != null ? assistanceType : AssistanceType.GENERAL)
                : null;
        AssistanceType reported = type == SafetyEventType.ASSISTANCE ? assistanceType : null;
        Slot slot = slots.get(type);
        SafetyTransition transition = null;
        AssistanceType replaced = null;
        slot.lock.lock();
        try {
            switch (slot.state) {
                case ACTIVE:
                    if (reported != null && reported != slot.current.assistanceType()) {
                        replaced = slot.current.assistanceType();
                    }
                    slot.current = slot.current.refreshed(now, sensorTimestamp, reported);
                    slot.replaceLatest(slot.current);
                    break;
                case ACKNOWLEDGED:
                    if (isStale(slot.current, sensorTimestamp)) {
                        break;
                    }
                    // fall through: a newer reading is a new incident
                case IDLE:
                    slot.state = slot.state.transitionTo(SafetyState.ACTIVE);
                    slot.current = new SafetyIncident(now, sensorTimestamp, subtype, null);
                    slot.append(slot.current);
                    transition = new SafetyTransition(type, SafetyTransition.Kind.RAISED, subtype, now, null);
                    slot.outbox.addLast(transition);
                    break;
                default:
                    throw new IllegalStateException("Unknown state " + slot.state);
            }
        } finally {
            slot.lock.unlock();
        }

        if (replaced != null) {
            log.info("{} request changed from {} to {}", type.getDisplayName(), replaced.getLabel(),
                    reported.getLabel());
        }
        if (transition == null) {
            return Optional.empty();
        }
        log.info("{} raised{}", type.getDisplayName(), subtype != null ? " (" + subtype.getLabel() + ")" : "");
        deliver(slot);
        return Optional.of(transition);
    }

    /**
     * Acknowledges the active incident of a type. Idempotent: acknowledging an idle or
     * already acknowledged type changes nothing.
     */
    public Optional<SafetyTransition> acknowledge(SafetyEventType type) {
        Instant now = clock.instant();
        Slot slot = slots.get(type);
        SafetyTransition transition;

        slot.lock.lock();
        try {
            if (!slot.state.isActive()) {
                return Optional.empty();
            }
            slot.state = slot.state.transitionTo(SafetyState.ACKNOWLEDGED);
            slot.current = slot.current.acknowledged(now);
            slot.replaceLatest(slot.current);
            transition = new SafetyTransition(type, SafetyTransition.Kind.ACKNOWLEDGED,
                    slot.current.assistanceType(), slot.current.raisedAt(), now);
            slot.outbox.addLast(transition);
        } finally {
            slot.lock.unlock();
        }

        log.info("{} acknowledged", type.getDisplayName());
        deliver(slot);
        return Optional.of(transition);
    }

    public SafetyStatus status(SafetyEventType type) {
        Slot slot = slots.get(type);
        slot.lock.lock();
        try {
            SafetyIncident current = slot.current;
            return new SafetyStatus(
                    type,
                    slot.state,
                    current != null ? current.assistanceType() : null,
                    current != null ? current.raisedAt() : null,
                    current != null ? current.acknowledgedAt() : null,
                    new ArrayList<>(slot.history));
        } finally {
            slot.lock.unlock();
        }
    }

    public boolean isActive(SafetyEventType type) {
        Slot slot = slots.get(type);
        slot.lock.lock();
        try {
            return slot.state.isActive();
        } finally {
            slot.lock.unlock();
        }
    }

    public List<SafetyEventType> activeTypes() {
        List<SafetyEventType> active = new ArrayList<>();
        for (SafetyEventType type : SafetyEventType.values()) {
            if (isActive(type)) {
                active.add(type);
            }
        }
        return active;
    }

    private static boolean isStale(SafetyIncident acknowledged, Instant sensorTimestamp) {
        return sensorTimestamp != null
                && acknowledged != null
                && acknowledged.sensorTimestamp() != null
                && !sensorTimestamp.isAfter(acknowledged.sensorTimestamp());
    }

    private void deliver(Slot slot) {
        if (slot.delivery.isHeldByCurrentThread()) {
            // raised from inside a listener; the outer loop delivers it next
            return;
        }
        while (slot.delivery.tryLock()) {
            try {
                SafetyTransition next;
                while ((next = slot.nextQueued()) != null) {
                    notifyListeners(next);
                }
            } finally {
                slot.delivery.unlock();
            }
            // a transition queued after the last poll but before the unlock
            if (!slot.hasQueued()) {
                return;
            }
        }
    }

    private void notifyListeners(SafetyTransition transition) {
        for (SafetyTransitionListener listener : listeners) {
            try {
                listener.onTransition(transition);
            } catch (RuntimeException e) {
                log.warn("Safety listener {} failed on {} {}", listener.getClass().getSimpleName(),
                        transition.type(), transition.kind(), e);
            }
        }
    }

    private static final class Slot {
        private final ReentrantLock lock = new ReentrantLock();
        private final ReentrantLock delivery = new ReentrantLock();
        private final int historySize;
        private final Deque<SafetyIncident> history = new ArrayDeque<>();
        private final Deque<SafetyTransition> outbox = new ArrayDeque<>();
        private SafetyState state = SafetyState.IDLE;
        private SafetyIncident current;

        private Slot(int historySize) {
            this.historySize = historySize;
        }

        private void append(SafetyIncident incident) {
            history.addLast(incident);
            while (history.size() > historySize) {
                history.removeFirst();
            }
        }

        private void replaceLatest(SafetyIncident incident) {
            history.pollLast();
            history.addLast(incident);
        }

        private SafetyTransition nextQueued() {
            lock.lock();
            try {
                return outbox.pollFirst();
            } finally {
                lock.unlock();
            }
        }

        private boolean hasQueued() {
            lock.lock();
            try {
                return !outbox.isEmpty();
            } finally {
                lock.unlock();
            }
        }
    }
}
