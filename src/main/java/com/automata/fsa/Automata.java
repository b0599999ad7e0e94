package com.automata.fsa;

import com.automata.fsa.dfa.DeterministicAutomaton;
import com.automata.fsa.engine.AutomatonRunner;
import com.automata.fsa.graph.StateGraph;
import com.automata.fsa.io.AutomatonCompiler;
import com.automata.fsa.io.DefinitionLoader;

/**
 * fsa-engine: finite automaton simulation.
 *
 * <h2>Model</h2>
 * <ul>
 * <li><b>States</b> live in a dense index arena; an active configuration is a
 * bitset over it.</li>
 * <li><b>Nondeterministic</b> automata ({@link StateGraph}) have a partial
 * transition relation and epsilon edges; missing transitions kill a
 * branch.</li>
 * <li><b>Deterministic</b> automata ({@link DeterministicAutomaton}) are total
 * over their alphabet through an absorbing error state.</li>
 * </ul>
 *
 * <h3>Running</h3>
 * <ul>
 * <li>{@link AutomatonRunner#run(CharSequence)} for a whole input at once.</li>
 * <li>{@link AutomatonRunner#step(String)} or
 * {@link AutomatonRunner#cooperative(java.util.List)} when symbols arrive one
 * at a time. See {@link com.automata.fsa.wiring.SymbolPublisher} for a ring
 * buffer driven run.</li>
 * </ul>
 */
public final class Automata {
    public static final String LOGIN_NFA_RESOURCE = "automata/login_nfa.json";

    private Automata() {
        // Prevent instantiation of utility class
    }

    /** Entry point: a builder for a nondeterministic automaton. */
    public static StateGraph.Builder nfa() {
        return StateGraph.builder();
    }

    /** Entry point: a builder for a deterministic automaton. */
    public static DeterministicAutomaton.Builder dfa() {
        return DeterministicAutomaton.builder();
    }

    /**
     * Builds an automaton accepting exactly {@code target}, one state per
     * consumed character: q0 -c0-> q1 -c1-> ... -> qn, with qn accepting.
     * The empty target yields a single accepting start state.
     */
    public static StateGraph literal(String target) {
        StateGraph.Builder b = StateGraph.builder();
        var symbols = AutomatonRunner.symbols(target);
        int prev = b.addState("q0", symbols.isEmpty());
        b.start(prev);
        for (int i = 0; i < symbols.size(); i++) {
            int next = b.addState("q" + (i + 1), i == symbols.size() - 1);
            b.addTransition(prev, symbols.get(i), next);
            prev = next;
        }
        return b.build();
    }

    /**
     * The login automaton over validated submissions: {@code u}/{@code x} for a
     * valid/invalid identifier, {@code p}/{@code y} for a valid/invalid
     * credential. {@code qf} absorbs every symbol.
     */
    public static StateGraph loginNfa() {
        return new AutomatonCompiler().compileGraph(DefinitionLoader.fromClasspath(LOGIN_NFA_RESOURCE));
    }

    /** Compiles a bundled definition resource into a nondeterministic automaton. */
    public static StateGraph graphFromClasspath(String resource) {
        return new AutomatonCompiler().compileGraph(DefinitionLoader.fromClasspath(resource));
    }

    /** Compiles a bundled definition resource into a deterministic automaton. */
    public static DeterministicAutomaton dfaFromClasspath(String resource) {
        return new AutomatonCompiler().compileDeterministic(DefinitionLoader.fromClasspath(resource));
    }

    public static AutomatonRunner runner(StateGraph graph) {
        return new AutomatonRunner(graph);
    }
}
