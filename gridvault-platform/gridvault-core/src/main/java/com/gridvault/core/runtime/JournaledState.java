package com.gridvault.core.runtime;

import java.util.Map;
import java.util.Set;

/**
 * Base for stores that record an undo entry for each change they make.
 * Until attached, changes are not journaled.
 */
public abstract class JournaledState implements Journaled {

    private UndoLog undoLog = new UndoLog();
    private boolean attached;

    @Override
    public void attach(UndoLog undoLog) {
        if (undoLog == null) {
            throw new IllegalArgumentException("Undo log cannot be null");
        }
        if (attached) {
            throw new IllegalStateException(getClass().getSimpleName() + " is already attached");
        }
        this.undoLog = undoLog;
        this.attached = true;
    }

    protected void onUndo(Runnable undo) {
        undoLog.record(undo);
    }

    /**
     * Records how to restore {@code key} in {@code map}. Call before writing or removing it.
     */
    protected <K, V> void journalEntry(Map<K, V> map, K key) {
        if (!undoLog.recording()) {
            return;
        }
        if (map.containsKey(key)) {
            V previous = map.get(key);
            undoLog.record(() -> map.put(key, previous));
        } else {
            undoLog.record(() -> map.remove(key));
        }
    }

    protected <E> void journalAdded(Set<E> set, E element) {
        undoLog.record(() -> set.remove(element));
    }

    protected <E> void journalRemoved(Set<E> set, E element) {
        undoLog.record(() -> set.add(element));
    }
}
