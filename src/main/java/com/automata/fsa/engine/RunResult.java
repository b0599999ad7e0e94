package com.automata.fsa.engine;

import com.automata.fsa.api.RunStatus;
import com.automata.fsa.graph.StateSet;

/**
 * Outcome of a completed run.
 *
 * @param status      ACCEPTED or REJECTED.
 * @param finalStates The closed active state set after the last symbol.
 * @param steps       Number of symbols consumed.
 */
public record RunResult(RunStatus status, StateSet finalStates, long steps) {

    public boolean accepted() {
        return status == RunStatus.ACCEPTED;
    }
}
