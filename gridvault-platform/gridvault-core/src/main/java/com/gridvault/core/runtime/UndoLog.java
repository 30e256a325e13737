package com.gridvault.core.runtime;

import java.util.ArrayList;
import java.util.List;

/**
 * Undo entries recorded by journaled state while invocations are open.
 *
 * Each frame remembers where its entries start. A failing frame replays its own entries
 * newest first; a succeeding inner frame leaves them for the enclosing frame, and the
 * outermost commit discards everything. Outside any frame nothing is recorded.
 */
public class UndoLog {

    private final List<Runnable> entries = new ArrayList<>();
    private int depth;

    /**
     * Opens a frame.
     *
     * @return mark to pass to {@link #commit(int)} or {@link #rollback(int)}
     */
    public int begin() {
        depth++;
        return entries.size();
    }

    public void commit(int mark) {
        close(mark);
        if (depth == 0) {
            entries.clear();
        }
    }

    /**
     * Undoes every change recorded since {@code mark}, newest first.
     */
    public void rollback(int mark) {
        close(mark);
        for (int i = entries.size() - 1; i >= mark; i--) {
            entries.remove(i).run();
        }
    }

    public boolean recording() {
        return depth > 0;
    }

    public void record(Runnable undo) {
        if (undo == null) {
            throw new IllegalArgumentException("Undo action cannot be null");
        }
        if (depth > 0) {
            entries.add(undo);
        }
    }

    /**
     * Entries held for the open frames.
     */
    public int pending() {
        return entries.size();
    }

    private void close(int mark) {
        if (depth == 0) {
            throw new IllegalStateException("No open frame");
        }
        if (mark < 0 || mark > entries.size()) {
            throw new IllegalStateException("Frame mark " + mark + " outside journal of " + entries.size());
        }
        depth--;
    }
}
