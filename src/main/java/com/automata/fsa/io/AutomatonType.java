package com.automata.fsa.io;

/**
 * Kinds of automata a definition file can describe.
 */
public enum AutomatonType {
    /** Nondeterministic, partial transition relation, epsilon edges allowed. */
    NFA,
    /** Deterministic, total over its alphabet via an absorbing error state. */
    DFA;

    public static AutomatonType fromString(String text) {
        for (AutomatonType t : AutomatonType.values()) {
            if (t.name().equalsIgnoreCase(text)) {
                return t;
            }
        }
        throw new IllegalArgumentException("Unknown AutomatonType: " + text);
    }
}
