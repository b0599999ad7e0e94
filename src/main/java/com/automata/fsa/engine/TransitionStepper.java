package com.automata.fsa.engine;

import com.automata.fsa.graph.Alphabet;
import com.automata.fsa.graph.StateGraph;
import com.automata.fsa.graph.StateSet;

/**
 * Computes the raw successor set of an active state set for one symbol.
 *
 * The result is the union of the successor sets of every active state. States
 * with no transition on the symbol contribute nothing: that branch of the
 * computation simply dies. An empty result is a normal outcome, not an error.
 *
 * The result is not epsilon-closed; see {@link EpsilonClosure}.
 */
public final class TransitionStepper {
    private final StateGraph graph;

    public TransitionStepper(StateGraph graph) {
        this.graph = graph;
    }

    public StateSet step(StateSet states, String symbol) {
        if (states.capacity() != graph.stateCount())
            throw new IllegalArgumentException("State set does not belong to this graph");

        StateSet.Builder next = StateSet.builder(graph.stateCount());
        int symbolId = graph.alphabet().indexOf(symbol);
        if (symbolId == Alphabet.UNKNOWN)
            return next.build();

        for (int s = states.nextState(0); s >= 0; s = states.nextState(s + 1)) {
            for (int target : graph.successors(s, symbolId))
                next.add(target);
        }
        return next.build();
    }
}
