package com.isolend.core.journal;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.springframework.context.ApplicationEvent;
import org.springframework.stereotype.Component;

/**
 * Undo log shared by every piece of protocol state.
 *
 * <p>Journaled containers ({@link JournaledMap}, {@link JournaledValue}) record an inverse
 * operation for each mutation made while a call is open. A failed call rewinds the log to the
 * savepoint taken when it started, so the whole call (nested sub-calls included) leaves no trace.
 * Events raised during a call are held back until the outermost call commits, so listeners never
 * observe a state change that was later rolled back.
 *
 * <p>Not thread-safe on its own: {@link CallExecutor} serializes all access.
 */
@Component
public class StateJournal {

    private final List<Runnable> undoLog = new ArrayList<>();
    private final List<ApplicationEvent> pendingEvents = new ArrayList<>();
    private int depth;

    /** Marks the current position of the log; a rollback to it discards everything after. */
    public record Savepoint(int undoSize, int eventCount) {}

    public Savepoint begin() {
        depth++;
        return new Savepoint(undoLog.size(), pendingEvents.size());
    }

    /**
     * Closes the call opened by the matching {@link #begin()}.
     *
     * @return the events to publish, non-empty only when the outermost call commits
     */
    public List<ApplicationEvent> commit(Savepoint savepoint) {
        depth--;
        if (depth > 0) {
            return Collections.emptyList();
        }
        undoLog.clear();
        List<ApplicationEvent> events = new ArrayList<>(pendingEvents);
        pendingEvents.clear();
        return events;
    }

    public void rollback(Savepoint savepoint) {
        for (int i = undoLog.size() - 1; i >= savepoint.undoSize(); i--) {
            undoLog.remove(i).run();
        }
        while (pendingEvents.size() > savepoint.eventCount()) {
            pendingEvents.remove(pendingEvents.size() - 1);
        }
        depth--;
        if (depth == 0) {
            undoLog.clear();
            pendingEvents.clear();
        }
    }

    /** Records the inverse of a mutation. Outside a call there is nothing to roll back to. */
    void record(Runnable undo) {
        if (depth > 0) {
            undoLog.add(undo);
        }
    }

    /** Queues an event for publication on commit. Returns false when no call is open. */
    public boolean defer(ApplicationEvent event) {
        if (depth == 0) {
            return false;
        }
        pendingEvents.add(event);
        return true;
    }

    public boolean inCall() {
        return depth > 0;
    }

    public <K, V> JournaledMap<K, V> newMap() {
        return new JournaledMap<>(this);
    }

    public <V> JournaledValue<V> newValue(V initial) {
        return new JournaledValue<>(this, initial);
    }
}
