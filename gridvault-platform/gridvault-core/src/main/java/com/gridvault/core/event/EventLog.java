package com.gridvault.core.event;

import com.gridvault.core.model.Address;
import com.gridvault.core.runtime.LedgerClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Append-only log of vault events.
 *
 * Events emitted inside an open frame stay pending until the outermost frame
 * commits; a failed frame drops its own events. Subscribers only ever see
 * committed events.
 */
public class EventLog {

    private static final Logger log = LoggerFactory.getLogger(EventLog.class);

    private final LedgerClock clock;
    private final List<LedgerEvent> committed = new ArrayList<>();
    private final List<LedgerEvent> pending = new ArrayList<>();
    private final Map<LedgerEventType, CopyOnWriteArrayList<Subscription>> subscriptions = new ConcurrentHashMap<>();
    private final Map<String, Subscription> subscriptionById = new ConcurrentHashMap<>();
    private int openFrames;

    public EventLog(LedgerClock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("Clock cannot be null");
        }
        this.clock = clock;
    }

    /**
     * Emits an event. Field names and values alternate in {@code keyValues}.
     *
     * @return the event as recorded
     */
    public LedgerEvent emit(LedgerEventType type, Address emitter, Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("Event fields must be name/value pairs");
        }
        Map<String, Object> fields = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            fields.put((String) keyValues[i], keyValues[i + 1]);
        }
        LedgerEvent event = new LedgerEvent(type, emitter, clock.now(), Collections.unmodifiableMap(fields));
        if (openFrames == 0) {
            committed.add(event);
            dispatch(event);
        } else {
            pending.add(event);
        }
        return event;
    }

    /**
     * Opens a frame and returns the mark to roll back to.
     */
    public int openFrame() {
        openFrames++;
        return pending.size();
    }

    /**
     * Closes the innermost frame. On failure every event emitted since {@code mark} is dropped.
     */
    public void closeFrame(int mark, boolean success) {
        if (openFrames == 0) {
            throw new IllegalStateException("No open event frame");
        }
        if (!success) {
            pending.subList(mark, pending.size()).clear();
        }
        openFrames--;
        if (openFrames == 0) {
            List<LedgerEvent> released = new ArrayList<>(pending);
            pending.clear();
            committed.addAll(released);
            released.forEach(this::dispatch);
        }
    }

    public List<LedgerEvent> events() {
        return List.copyOf(committed);
    }

    public List<LedgerEvent> events(Address emitter, LedgerEventType type) {
        return committed.stream()
                .filter(e -> e.emitter().equals(emitter))
                .filter(e -> type == LedgerEventType.ALL || e.type() == type)
                .toList();
    }

    public int size() {
        return committed.size();
    }

    /**
     * Subscribes to committed events of a type, or all of them with {@link LedgerEventType#ALL}.
     *
     * @return subscription id
     */
    public String subscribe(LedgerEventType type, Consumer<LedgerEvent> handler) {
        if (type == null || handler == null) {
            throw new IllegalArgumentException("Type and handler cannot be null");
        }
        String id = UUID.randomUUID().toString();
        Subscription subscription = new Subscription(id, type, handler);
        subscriptions.computeIfAbsent(type, k -> new CopyOnWriteArrayList<>()).add(subscription);
        subscriptionById.put(id, subscription);
        return id;
    }

    public boolean unsubscribe(String subscriptionId) {
        Subscription subscription = subscriptionById.remove(subscriptionId);
        if (subscription == null) {
            return false;
        }
        CopyOnWriteArrayList<Subscription> subs = subscriptions.get(subscription.type());
        return subs != null && subs.remove(subscription);
    }

    private void dispatch(LedgerEvent event) {
        deliver(subscriptions.get(event.type()), event);
        deliver(subscriptions.get(LedgerEventType.ALL), event);
    }

    private void deliver(List<Subscription> subs, LedgerEvent event) {
        if (subs == null) {
            return;
        }
        for (Subscription sub : subs) {
            try {
                sub.handler().accept(event);
            } catch (RuntimeException e) {
                // Indexer failures never undo a committed operation
                log.warn("Event handler {} failed on {}", sub.id(), event.type().eventName(), e);
            }
        }
    }

    private record Subscription(String id, LedgerEventType type, Consumer<LedgerEvent> handler) {}
}
