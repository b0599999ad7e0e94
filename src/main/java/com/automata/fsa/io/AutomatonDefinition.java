package com.automata.fsa.io;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;

/**
 * POJO representation of an automaton definition file.
 *
 * <pre>
 * { "automaton": {
 *     "name": "login", "type": "nfa", "start": "q0",
 *     "alphabet": ["u", "x"],
 *     "states": [ { "name": "q0" }, { "name": "q1", "accepting": true } ],
 *     "transitions": [ { "from": "q0", "symbol": "u", "to": ["q1"] } ],
 *     "epsilon": [ { "from": "q1", "to": ["q0"] } ] } }
 * </pre>
 *
 * State names are the references used by transitions, so within a definition
 * they must be unique.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class AutomatonDefinition {
    private AutomatonInfo automaton;

    /** The automaton itself. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class AutomatonInfo {
        private String name, type, start, description;
        /** Name of the absorbing error state (dfa only). */
        private String errorState;
        private List<String> alphabet;
        private List<StateDef> states;
        private List<TransitionDef> transitions;
        private List<EpsilonDef> epsilon;
    }

    /** A single state. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class StateDef {
        private String name;
        private boolean accepting;
    }

    /** Labeled edges from one state on one symbol. A dfa allows one target. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class TransitionDef {
        private String from, symbol;
        private List<String> to;
    }

    /** Epsilon edges from one state (nfa only). */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class EpsilonDef {
        private String from;
        private List<String> to;
    }
}
