package com.automata.fsa.dfa;

import com.automata.fsa.api.Automaton;
import com.automata.fsa.graph.Alphabet;
import com.automata.fsa.graph.StateSet;

import java.util.*;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * A total deterministic automaton over a fixed alphabet.
 *
 * The transition function is a dense table {@code next[state][symbolId]}.
 * Every pair that the definition leaves out, and every symbol outside the
 * alphabet, leads to a distinguished absorbing error state that the builder
 * appends as the last state of the arena. The error state loops to itself on
 * every symbol and is never accepting, so the function is total and
 * {@link #step(int, String)} never throws on unexpected input. Callers that
 * need a hard failure compare the result against {@link #errorState()}.
 */
public final class DeterministicAutomaton implements Automaton {
    private static final Logger log = LogManager.getLogger(DeterministicAutomaton.class);

    public static final String DEFAULT_ERROR_STATE = "error";

    private final String[] names;
    private final boolean[] accepting;
    private final int start;
    private final int error;
    private final Alphabet alphabet;
    private final int[][] next;

    // Pre-built singleton sets, one per state, so runners never allocate them.
    private final StateSet[] singletons;

    private DeterministicAutomaton(String[] names, boolean[] accepting, int start, int error, Alphabet alphabet,
            int[][] next) {
        this.names = names;
        this.accepting = accepting;
        this.start = start;
        this.error = error;
        this.alphabet = alphabet;
        this.next = next;
        this.singletons = new StateSet[names.length];
        for (int s = 0; s < names.length; s++)
            singletons[s] = StateSet.of(names.length, s);
    }

    /**
     * The transition function. Total: absent pairs and unknown symbols go to
     * the error state.
     */
    public int step(int state, String symbol) {
        if (state < 0 || state >= names.length)
            throw new IllegalArgumentException("Unknown state index " + state);
        int symbolId = alphabet.indexOf(symbol);
        if (symbolId == Alphabet.UNKNOWN)
            return error;
        return next[state][symbolId];
    }

    /** Runs the function over a whole sequence starting at the start state. */
    public int walk(Iterable<String> symbols) {
        int state = start;
        for (String symbol : symbols)
            state = step(state, symbol);
        return state;
    }

    public boolean accepts(Iterable<String> symbols) {
        return accepting[walk(symbols)];
    }

    public int errorState() {
        return error;
    }

    public boolean isError(int state) {
        return state == error;
    }

    public StateSet singleton(int state) {
        return singletons[state];
    }

    public Alphabet alphabet() {
        return alphabet;
    }

    @Override
    public int stateCount() {
        return names.length;
    }

    @Override
    public String stateName(int state) {
        return names[state];
    }

    @Override
    public boolean isAccepting(int state) {
        return accepting[state];
    }

    @Override
    public int startState() {
        return start;
    }

    /**
     * Resolves a state by display name. Only meaningful for automata whose
     * names are unique, which the builder does not enforce.
     *
     * @throws IllegalArgumentException if no state carries that name.
     */
    public int stateIndex(String name) {
        for (int s = 0; s < names.length; s++)
            if (names[s].equals(name))
                return s;
        throw new IllegalArgumentException("Unknown state: " + name);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for a DeterministicAutomaton.
     *
     * Adding a second, different target for an existing (state, symbol) pair is
     * rejected: that would make the automaton nondeterministic. Re-adding the
     * same edge is a no-op.
     */
    public static final class Builder {
        private final List<String> names = new ArrayList<>();
        private final List<Boolean> accepting = new ArrayList<>();
        private final List<Map<Integer, Integer>> edges = new ArrayList<>();
        private final Alphabet.Builder alphabet = Alphabet.builder();
        private String errorName = DEFAULT_ERROR_STATE;
        private int start = -1;
        private boolean built;

        public int addState(String name, boolean isAccepting) {
            checkNotBuilt();
            int idx = names.size();
            names.add(Objects.requireNonNull(name, "name"));
            accepting.add(isAccepting);
            edges.add(new HashMap<>());
            return idx;
        }

        public int addState(String name) {
            return addState(name, false);
        }

        public Builder addTransition(int from, String symbol, int to) {
            checkNotBuilt();
            requireState(from);
            requireState(to);
            int symbolId = alphabet.intern(symbol);
            Integer existing = edges.get(from).putIfAbsent(symbolId, to);
            if (existing != null && existing != to)
                throw new IllegalArgumentException("State " + names.get(from) + " already moves to "
                        + names.get(existing) + " on '" + symbol + "'; cannot also move to " + names.get(to));
            return this;
        }

        /** Adds a symbol to the alphabet without any explicit transition. */
        public Builder addSymbol(String symbol) {
            checkNotBuilt();
            alphabet.intern(symbol);
            return this;
        }

        public Builder start(int state) {
            checkNotBuilt();
            requireState(state);
            this.start = state;
            return this;
        }

        public Builder errorStateName(String name) {
            checkNotBuilt();
            this.errorName = Objects.requireNonNull(name, "name");
            return this;
        }

        private void requireState(int state) {
            if (state < 0 || state >= names.size())
                throw new IllegalArgumentException(
                        "Unknown state index " + state + " (automaton owns " + names.size() + " states)");
        }

        private void checkNotBuilt() {
            if (built)
                throw new IllegalStateException("Builder already used to build an automaton");
        }

        public DeterministicAutomaton build() {
            checkNotBuilt();
            if (start < 0)
                throw new IllegalStateException("No start state designated");
            built = true;

            int declared = names.size();
            int error = declared;
            int n = declared + 1;
            Alphabet symbols = alphabet.build();

            String[] allNames = names.toArray(new String[n]);
            allNames[error] = errorName;
            boolean[] acc = new boolean[n];
            for (int s = 0; s < declared; s++)
                acc[s] = accepting.get(s);

            int[][] table = new int[n][symbols.size()];
            for (int s = 0; s < n; s++)
                Arrays.fill(table[s], error);
            for (int s = 0; s < declared; s++)
                for (Map.Entry<Integer, Integer> e : edges.get(s).entrySet())
                    table[s][e.getKey()] = e.getValue();

            log.debug("Built DFA: {} states (+{}), {} symbols", declared, errorName, symbols.size());
            return new DeterministicAutomaton(allNames, acc, start, error, symbols, table);
        }
    }
}
