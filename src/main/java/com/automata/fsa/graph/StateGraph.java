package com.automata.fsa.graph;

import com.automata.fsa.api.Automaton;

import java.util.*;

import lombok.extern.log4j.Log4j2;

/**
 * StateGraph -- immutable, index-encoded nondeterministic automaton.
 *
 * This class represents the structure of an automaton after it has been built.
 * States live in a dense arena 0..N-1; everything the runner needs during a
 * step is reachable through array accesses on that index.
 *
 * Data layout:
 * - names / accepting: per-state metadata, indexed by state.
 * - successors[state][symbolId]: sorted, de-duplicated successor indices for a
 * labeled transition, or null when the pair has no transition.
 * - epsilonTargets: a single flattened int array containing the epsilon
 * successors of all states. epsilonOffset[i] points to the start of state i's
 * epsilon successors; they run up to epsilonOffset[i+1] exclusive.
 *
 * Invariant: every successor index stored anywhere in the graph is a valid
 * state of the same graph. The {@link Builder} rejects dangling references
 * eagerly, so a built graph never needs to check them again.
 */
@Log4j2
public final class StateGraph implements Automaton {
    private static final int[] NONE = new int[0];

    private final String[] names;
    private final int start;
    private final StateSet acceptStates;
    private final Alphabet alphabet;
    private final int[][][] successors;

    // CSR Index and Data for epsilon edges
    private final int[] epsilonOffset;
    private final int[] epsilonTargets;

    private StateGraph(String[] names, int start, StateSet acceptStates, Alphabet alphabet,
            int[][][] successors, int[] epsilonOffset, int[] epsilonTargets) {
        this.names = names;
        this.start = start;
        this.acceptStates = acceptStates;
        this.alphabet = alphabet;
        this.successors = successors;
        this.epsilonOffset = epsilonOffset;
        this.epsilonTargets = epsilonTargets;
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
        return acceptStates.contains(state);
    }

    @Override
    public int startState() {
        return start;
    }

    public StateSet acceptStates() {
        return acceptStates;
    }

    public Alphabet alphabet() {
        return alphabet;
    }

    /**
     * Successors of {@code state} on {@code symbol}. Never null; an absent
     * transition (including a symbol outside the alphabet) is the empty array.
     * The returned array is shared and must not be modified.
     */
    public int[] successors(int state, String symbol) {
        return successors(state, alphabet.indexOf(symbol));
    }

    /** Successors by interned symbol id. See {@link #successors(int, String)}. */
    public int[] successors(int state, int symbolId) {
        if (symbolId == Alphabet.UNKNOWN)
            return NONE;
        int[] targets = successors[state][symbolId];
        return targets == null ? NONE : targets;
    }

    public boolean hasEpsilonTransitions() {
        return epsilonTargets.length > 0;
    }

    public int epsilonStart(int state) {
        return epsilonOffset[state];
    }

    public int epsilonEnd(int state) {
        return epsilonOffset[state + 1];
    }

    public int epsilonAt(int flatIndex) {
        return epsilonTargets[flatIndex];
    }

    public int epsilonCount(int state) {
        return epsilonOffset[state + 1] - epsilonOffset[state];
    }

    /** Number of labeled (state, symbol, successor) edges after de-duplication. */
    public int transitionCount() {
        int n = 0;
        for (int[][] row : successors)
            for (int[] targets : row)
                if (targets != null)
                    n += targets.length;
        return n;
    }

    /** The singleton set holding the start state, before any closure. */
    public StateSet startSet() {
        return StateSet.of(names.length, start);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for constructing a StateGraph.
     *
     * States are created with {@link #addState(String, boolean)}, which returns
     * the index used by every other method. Adding the same edge twice is
     * harmless: edges are de-duplicated when the graph is built.
     */
    public static final class Builder {
        private final List<String> names = new ArrayList<>();
        private final Set<Integer> acceptIndices = new HashSet<>();
        private final List<Map<Integer, SortedSet<Integer>>> labeled = new ArrayList<>();
        private final List<SortedSet<Integer>> epsilon = new ArrayList<>();
        private final Alphabet.Builder alphabet = Alphabet.builder();
        private int start = -1;
        private boolean built;

        /**
         * Adds a state to the arena.
         *
         * @param name      Display name. Need not be unique.
         * @param accepting Whether the state is an accept state.
         * @return The index of the new state.
         */
        public int addState(String name, boolean accepting) {
            checkNotBuilt();
            int idx = names.size();
            names.add(Objects.requireNonNull(name, "name"));
            labeled.add(new HashMap<>());
            epsilon.add(new TreeSet<>());
            if (accepting)
                acceptIndices.add(idx);
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
            labeled.get(from).computeIfAbsent(symbolId, k -> new TreeSet<>()).add(to);
            return this;
        }

        public Builder addEpsilon(int from, int to) {
            checkNotBuilt();
            requireState(from);
            requireState(to);
            epsilon.get(from).add(to);
            return this;
        }

        /**
         * Registers a symbol without adding a transition for it, so that it is
         * part of the alphabet even if no state consumes it.
         */
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

        public Builder accept(int state) {
            checkNotBuilt();
            requireState(state);
            acceptIndices.add(state);
            return this;
        }

        public int stateCount() {
            return names.size();
        }

        private void requireState(int state) {
            if (state < 0 || state >= names.size())
                throw new IllegalArgumentException(
                        "Unknown state index " + state + " (graph owns " + names.size() + " states)");
        }

        private void checkNotBuilt() {
            if (built)
                throw new IllegalStateException("Builder already used to build a graph");
        }

        /**
         * Compiles the graph.
         *
         * @throws IllegalStateException if no start state was designated.
         */
        public StateGraph build() {
            checkNotBuilt();
            if (start < 0)
                throw new IllegalStateException("No start state designated");
            built = true;

            int n = names.size();
            Alphabet symbols = alphabet.build();

            // 1. Labeled transitions as [state][symbolId] -> sorted targets
            int[][][] table = new int[n][symbols.size()][];
            for (int s = 0; s < n; s++) {
                for (Map.Entry<Integer, SortedSet<Integer>> e : labeled.get(s).entrySet()) {
                    table[s][e.getKey()] = toArray(e.getValue());
                }
            }

            // 2. Epsilon edges in CSR form
            int[] offsets = new int[n + 1];
            for (int s = 0; s < n; s++)
                offsets[s + 1] = offsets[s] + epsilon.get(s).size();
            int[] flat = new int[offsets[n]];
            for (int s = 0; s < n; s++) {
                int base = offsets[s];
                for (int target : epsilon.get(s))
                    flat[base++] = target;
            }

            StateSet.Builder accepts = StateSet.builder(n);
            for (int a : acceptIndices)
                accepts.add(a);

            StateGraph graph = new StateGraph(names.toArray(new String[0]), start, accepts.build(), symbols,
                    table, offsets, flat);
            log.debug("Built state graph: {} states, {} symbols, {} transitions, {} epsilon edges",
                    n, symbols.size(), graph.transitionCount(), flat.length);
            return graph;
        }

        private static int[] toArray(SortedSet<Integer> set) {
            int[] out = new int[set.size()];
            int i = 0;
            for (int v : set)
                out[i++] = v;
            return out;
        }
    }
}
