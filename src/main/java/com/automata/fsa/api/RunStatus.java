package com.automata.fsa.api;

/**
 * Lifecycle of a single automaton run.
 *
 * IDLE -> RUNNING on the first consumed symbol, RUNNING -> ACCEPTED / REJECTED
 * once the input is exhausted. ACCEPTED and REJECTED are terminal: a new run
 * needs an explicit reset.
 */
public enum RunStatus {
    IDLE,
    RUNNING,
    ACCEPTED,
    REJECTED;

    public boolean isTerminal() {
        return this == ACCEPTED || this == REJECTED;
    }
}
