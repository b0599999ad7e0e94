package com.automata.fsa.api;

/**
 * Read-only view of an automaton's state arena.
 *
 * Both the nondeterministic {@link com.automata.fsa.graph.StateGraph} and the
 * {@link com.automata.fsa.dfa.DeterministicAutomaton} expose their states as a
 * dense integer range 0..N-1. States are identified by index only: two states
 * may carry the same display name without being the same state.
 *
 * Implementations are immutable once built and can be shared freely between
 * runners.
 */
public interface Automaton {

    /**
     * Returns the number of states owned by this automaton.
     *
     * @return The size of the state arena.
     */
    int stateCount();

    /**
     * Returns the display name of a state. Names are for diagnostics only and
     * are not guaranteed to be unique.
     *
     * @param state The state index.
     * @return The state's display name.
     */
    String stateName(int state);

    /**
     * @param state The state index.
     * @return true if the state is an accept state.
     */
    boolean isAccepting(int state);

    /**
     * @return The index of the designated start state.
     */
    int startState();
}
