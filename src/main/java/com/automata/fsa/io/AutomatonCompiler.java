package com.automata.fsa.io;

import com.automata.fsa.api.Automaton;
import com.automata.fsa.dfa.DeterministicAutomaton;
import com.automata.fsa.graph.StateGraph;

import java.util.*;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Compiles an {@link AutomatonDefinition} into a runnable automaton.
 *
 * All validation happens here, before anything can be run: unknown state
 * references, duplicate state names, a missing start state, epsilon edges on a
 * dfa or more than one dfa target for a (state, symbol) pair all throw
 * {@link IllegalArgumentException}.
 */
public final class AutomatonCompiler {
    private static final Logger log = LogManager.getLogger(AutomatonCompiler.class);

    /**
     * Compiles the definition according to its declared type.
     *
     * @param def The automaton definition.
     * @return A container holding the automaton and its name lookup map.
     */
    public CompiledAutomaton compile(AutomatonDefinition def) {
        AutomatonDefinition.AutomatonInfo info = requireInfo(def);
        AutomatonType type = AutomatonType.fromString(info.getType() == null ? "nfa" : info.getType());
        return switch (type) {
            case NFA -> compileNfa(info);
            case DFA -> compileDfa(info);
        };
    }

    public StateGraph compileGraph(AutomatonDefinition def) {
        return compile(def).asGraph();
    }

    public DeterministicAutomaton compileDeterministic(AutomatonDefinition def) {
        return compile(def).asDeterministic();
    }

    private CompiledAutomaton compileNfa(AutomatonDefinition.AutomatonInfo info) {
        StateGraph.Builder b = StateGraph.builder();
        Map<String, Integer> index = new LinkedHashMap<>();
        for (AutomatonDefinition.StateDef sd : requireStates(info)) {
            requireUniqueName(index, sd.getName(), info.getName());
            index.put(sd.getName(), b.addState(sd.getName(), sd.isAccepting()));
        }
        for (String symbol : nullSafe(info.getAlphabet()))
            b.addSymbol(symbol);

        for (AutomatonDefinition.TransitionDef td : nullSafe(info.getTransitions())) {
            int from = resolve(index, td.getFrom(), info.getName());
            for (String to : nullSafe(td.getTo()))
                b.addTransition(from, td.getSymbol(), resolve(index, to, info.getName()));
        }
        for (AutomatonDefinition.EpsilonDef ed : nullSafe(info.getEpsilon())) {
            int from = resolve(index, ed.getFrom(), info.getName());
            for (String to : nullSafe(ed.getTo()))
                b.addEpsilon(from, resolve(index, to, info.getName()));
        }
        b.start(resolve(index, requireStart(info), info.getName()));

        StateGraph graph = b.build();
        log.info("Compiled nfa '{}': {} states, {} symbols", info.getName(), graph.stateCount(),
                graph.alphabet().size());
        return new CompiledAutomaton(info.getName(), AutomatonType.NFA, graph,
                Collections.unmodifiableMap(index), info.getDescription());
    }

    private CompiledAutomaton compileDfa(AutomatonDefinition.AutomatonInfo info) {
        if (info.getEpsilon() != null && !info.getEpsilon().isEmpty())
            throw new IllegalArgumentException("Epsilon edges are not allowed in dfa '" + info.getName() + "'");

        DeterministicAutomaton.Builder b = DeterministicAutomaton.builder();
        if (info.getErrorState() != null)
            b.errorStateName(info.getErrorState());
        Map<String, Integer> index = new LinkedHashMap<>();
        for (AutomatonDefinition.StateDef sd : requireStates(info)) {
            requireUniqueName(index, sd.getName(), info.getName());
            index.put(sd.getName(), b.addState(sd.getName(), sd.isAccepting()));
        }
        requireUniqueName(index,
                info.getErrorState() != null ? info.getErrorState() : DeterministicAutomaton.DEFAULT_ERROR_STATE,
                info.getName());
        for (String symbol : nullSafe(info.getAlphabet()))
            b.addSymbol(symbol);

        for (AutomatonDefinition.TransitionDef td : nullSafe(info.getTransitions())) {
            List<String> targets = nullSafe(td.getTo());
            if (targets.size() != 1)
                throw new IllegalArgumentException("Dfa '" + info.getName() + "' needs exactly one target for "
                        + td.getFrom() + " on '" + td.getSymbol() + "', got " + targets.size());
            b.addTransition(resolve(index, td.getFrom(), info.getName()), td.getSymbol(),
                    resolve(index, targets.get(0), info.getName()));
        }
        b.start(resolve(index, requireStart(info), info.getName()));

        DeterministicAutomaton dfa = b.build();
        log.info("Compiled dfa '{}': {} states, {} symbols", info.getName(), dfa.stateCount(),
                dfa.alphabet().size());
        Map<String, Integer> withError = new LinkedHashMap<>(index);
        withError.put(dfa.stateName(dfa.errorState()), dfa.errorState());
        return new CompiledAutomaton(info.getName(), AutomatonType.DFA, dfa,
                Collections.unmodifiableMap(withError), info.getDescription());
    }

    private static AutomatonDefinition.AutomatonInfo requireInfo(AutomatonDefinition def) {
        if (def == null || def.getAutomaton() == null)
            throw new IllegalArgumentException("Missing 'automaton' key");
        return def.getAutomaton();
    }

    private static List<AutomatonDefinition.StateDef> requireStates(AutomatonDefinition.AutomatonInfo info) {
        if (info.getStates() == null || info.getStates().isEmpty())
            throw new IllegalArgumentException("Automaton '" + info.getName() + "' declares no states");
        return info.getStates();
    }

    private static String requireStart(AutomatonDefinition.AutomatonInfo info) {
        if (info.getStart() == null)
            throw new IllegalArgumentException("Automaton '" + info.getName() + "' has no start state");
        return info.getStart();
    }

    private static void requireUniqueName(Map<String, Integer> index, String name, String automaton) {
        if (name == null)
            throw new IllegalArgumentException("State without a name in '" + automaton + "'");
        if (index.containsKey(name))
            throw new IllegalArgumentException("Duplicate state name in '" + automaton + "': " + name);
    }

    private static int resolve(Map<String, Integer> index, String name, String automaton) {
        Integer idx = index.get(name);
        if (idx == null)
            throw new IllegalArgumentException("Unknown state '" + name + "' referenced in '" + automaton + "'");
        return idx;
    }

    private static <T> List<T> nullSafe(List<T> list) {
        return list == null ? List.of() : list;
    }

    /** The result of compilation: an automaton ready to run. */
    public record CompiledAutomaton(String name, AutomatonType type, Automaton automaton,
            Map<String, Integer> stateIndex, String description) {

        public StateGraph asGraph() {
            if (automaton instanceof StateGraph g)
                return g;
            throw new IllegalStateException("Automaton '" + name + "' is a " + type + ", not an nfa");
        }

        public DeterministicAutomaton asDeterministic() {
            if (automaton instanceof DeterministicAutomaton d)
                return d;
            throw new IllegalStateException("Automaton '" + name + "' is a " + type + ", not a dfa");
        }

        /** Resolves a state by its definition name. */
        public int state(String stateName) {
            Integer idx = stateIndex.get(stateName);
            if (idx == null)
                throw new IllegalArgumentException("Unknown state: " + stateName);
            return idx;
        }
    }
}
