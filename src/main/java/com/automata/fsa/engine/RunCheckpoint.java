package com.automata.fsa.engine;

import com.automata.fsa.graph.StateSet;

/**
 * Everything needed to resume a suspended run: the active state set and the
 * position of the next unconsumed symbol. Together with the remaining input it
 * fully determines the rest of the run.
 */
public record RunCheckpoint(StateSet activeStates, int cursor) {

    public RunCheckpoint {
        if (activeStates == null)
            throw new IllegalArgumentException("activeStates must not be null");
        if (cursor < 0)
            throw new IllegalArgumentException("Negative cursor: " + cursor);
    }
}
