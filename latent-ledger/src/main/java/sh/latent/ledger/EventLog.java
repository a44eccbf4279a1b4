// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.latent.ledger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.latent.core.DebugLogger;
import sh.latent.core.LatentDebug;
import sh.latent.core.LogFormatter;
import sh.latent.core.error.EventEncodingException;
import sh.latent.core.event.LedgerEvent;
import sh.latent.core.event.LedgerEventCodec;

/**
 * Append-only log of ledger notifications.
 *
 * <p>Appends are journaled, so events of an aborted operation disappear together
 * with the state changes they described. Listeners are notified once the outermost
 * operation commits, in append order. Every listener sees an event before any
 * listener sees the next one, including events appended by a listener.
 *
 * @since 0.1.0
 */
public final class EventLog {

    private static final Logger log = LoggerFactory.getLogger(EventLog.class);

    private final Journal journal;
    private final List<LedgerEvent> events = new ArrayList<>();
    private final List<EventListener> listeners = new CopyOnWriteArrayList<>();
    private int delivered;
    private boolean delivering;

    public EventLog(final Journal journal) {
        this.journal = Objects.requireNonNull(journal, "journal");
        journal.onCommit(this::deliver);
    }

    /**
     * Appends an event to the log.
     *
     * @param event the event
     */
    public void append(final LedgerEvent event) {
        Objects.requireNonNull(event, "event");
        events.add(event);
        journal.record(() -> events.remove(events.size() - 1));
        if (LatentDebug.isEventLoggingEnabled()) {
            trace(event);
        }
        if (!journal.inUnit()) {
            deliver();
        }
    }

    /** Returns a snapshot of all events in append order. */
    public List<LedgerEvent> events() {
        return List.copyOf(events);
    }

    /**
     * Returns the events of the given type in append order.
     *
     * @param type the event record class
     * @param <T>  event type
     * @return the matching events
     */
    public <T extends LedgerEvent> List<T> ofType(final Class<T> type) {
        Objects.requireNonNull(type, "type");
        final List<T> matching = new ArrayList<>();
        for (LedgerEvent event : events) {
            if (type.isInstance(event)) {
                matching.add(type.cast(event));
            }
        }
        return matching;
    }

    public int size() {
        return events.size();
    }

    /**
     * Registers a listener for events committed from now on.
     *
     * @param listener the listener
     */
    public void addListener(final EventListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(final EventListener listener) {
        listeners.remove(listener);
    }

    private void trace(final LedgerEvent event) {
        try {
            DebugLogger.logEvent(LogFormatter.formatEvent(LedgerEventCodec.toJson(event)));
        } catch (EventEncodingException e) {
            log.warn("Could not trace {}", event, e);
        }
    }

    private void deliver() {
        // Events appended by a listener are picked up by the running loop.
        if (delivering) {
            return;
        }
        delivering = true;
        try {
            while (delivered < events.size()) {
                final LedgerEvent event = events.get(delivered++);
                for (EventListener listener : listeners) {
                    try {
                        listener.onEvent(event);
                    } catch (RuntimeException e) {
                        log.error("Event listener failed for {}", event, e);
                    }
                }
            }
        } finally {
            delivering = false;
        }
    }
}
