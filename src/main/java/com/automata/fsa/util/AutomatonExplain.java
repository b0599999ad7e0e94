package com.automata.fsa.util;

import com.automata.fsa.api.Automaton;
import com.automata.fsa.dfa.DeterministicAutomaton;
import com.automata.fsa.graph.StateGraph;
import com.automata.fsa.graph.StateSet;

/**
 * Diagnostic utility for inspecting automaton structure and run state.
 *
 * <p>
 * Generates human-readable renderings: state sets by name, a per-state summary
 * and a Mermaid {@code stateDiagram-v2} of the whole automaton.
 *
 * <p>
 * <b>Usage:</b> intended for logging and debugging. Allocates strings; keep it
 * off the stepping path.
 */
public final class AutomatonExplain {
    private final Automaton automaton;

    public AutomatonExplain(Automaton automaton) {
        this.automaton = automaton;
    }

    /** Renders a state set by state name, e.g. {@code {q0, q2}}. */
    public String describe(StateSet states) {
        StringBuilder sb = new StringBuilder(16 + states.size() * 8).append('{');
        for (int s = states.nextState(0); s >= 0; s = states.nextState(s + 1)) {
            if (sb.length() > 1)
                sb.append(", ");
            sb.append(automaton.stateName(s));
        }
        return sb.append('}').toString();
    }

    /**
     * Dumps a single state: flags and outgoing edges.
     */
    public String explainState(int state) {
        StringBuilder sb = new StringBuilder(256);
        sb.append("State: ").append(automaton.stateName(state)).append('\n')
                .append("  Index: ").append(state).append('\n')
                .append("  Start: ").append(state == automaton.startState()).append('\n')
                .append("  Accepting: ").append(automaton.isAccepting(state)).append('\n');
        forEachEdge(state, (symbol, target) -> sb.append("  --").append(symbol == null ? "ε" : symbol)
                .append("--> ").append(automaton.stateName(target)).append('\n'));
        return sb.toString();
    }

    /**
     * Exports the automaton as a Mermaid state diagram. States are keyed by
     * index since display names may repeat.
     */
    public String toMermaid() {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("stateDiagram-v2\n");
        for (int s = 0; s < automaton.stateCount(); s++) {
            sb.append("  s").append(s).append(" : ").append(automaton.stateName(s)).append('\n');
        }
        sb.append("  [*] --> s").append(automaton.startState()).append('\n');
        for (int s = 0; s < automaton.stateCount(); s++) {
            final int from = s;
            forEachEdge(s, (symbol, target) -> sb.append("  s").append(from).append(" --> s").append(target)
                    .append(" : ").append(symbol == null ? "ε" : symbol).append('\n'));
            if (automaton.isAccepting(s))
                sb.append("  s").append(s).append(" --> [*]\n");
        }
        return sb.toString();
    }

    private void forEachEdge(int state, EdgeVisitor visitor) {
        if (automaton instanceof StateGraph g) {
            for (String symbol : g.alphabet().symbols())
                for (int target : g.successors(state, symbol))
                    visitor.visit(symbol, target);
            for (int i = g.epsilonStart(state); i < g.epsilonEnd(state); i++)
                visitor.visit(null, g.epsilonAt(i));
        } else if (automaton instanceof DeterministicAutomaton d) {
            // Edges into the error state are implied; only the declared ones are shown.
            if (d.isError(state))
                return;
            for (String symbol : d.alphabet().symbols()) {
                int target = d.step(state, symbol);
                if (!d.isError(target))
                    visitor.visit(symbol, target);
            }
        }
    }

    @FunctionalInterface
    private interface EdgeVisitor {
        /** @param symbol null for an epsilon edge. */
        void visit(String symbol, int target);
    }
}
