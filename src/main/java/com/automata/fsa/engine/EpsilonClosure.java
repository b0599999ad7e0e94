package com.automata.fsa.engine;

import com.automata.fsa.graph.StateGraph;
import com.automata.fsa.graph.StateSet;

/**
 * Expands a state set with every state reachable through epsilon edges only.
 *
 * Algorithm: the result and a work list both start as the input set. A state
 * is popped from the work list and each of its epsilon successors that is not
 * yet in the result is added to both. A state therefore enters the work list at
 * most once per call, which bounds the loop at N iterations and makes epsilon
 * cycles harmless.
 *
 * The resolver never touches the graph's storage and always answers with an
 * immutable set, so callers can keep both the input and the result.
 */
public final class EpsilonClosure {
    private final StateGraph graph;

    public EpsilonClosure(StateGraph graph) {
        this.graph = graph;
    }

    public StateSet closure(StateSet states) {
        if (states.capacity() != graph.stateCount())
            throw new IllegalArgumentException("State set does not belong to this graph");
        if (!graph.hasEpsilonTransitions() || states.isEmpty())
            return states;

        StateSet.Builder result = StateSet.builder(graph.stateCount());
        result.addAll(states);

        // Each state is enqueued at most once, so N slots are enough.
        int[] stack = new int[graph.stateCount()];
        int top = 0;
        for (int s = states.nextState(0); s >= 0; s = states.nextState(s + 1))
            stack[top++] = s;

        while (top > 0) {
            int current = stack[--top];
            final int end = graph.epsilonEnd(current);
            for (int i = graph.epsilonStart(current); i < end; i++) {
                int next = graph.epsilonAt(i);
                if (result.add(next))
                    stack[top++] = next;
            }
        }
        return result.build();
    }

    public StateGraph graph() {
        return graph;
    }
}
