package com.gridvault.core.runtime;

/**
 * State that the runtime rolls back when an operation fails.
 */
public interface Journaled {

    /**
     * Connects the state to the journal its changes are recorded in.
     */
    void attach(UndoLog undoLog);
}
