package com.automata.fsa.login;

/**
 * States of the login automaton.
 *
 * RETRYING and ERROR are separate states: RETRYING is the legitimate
 * loop back to credential entry while budget remains, ERROR is the absorbing
 * state a deterministic automaton falls into on an event it has no transition
 * for (an out-of-order call).
 */
public enum LoginState {
    START("start", false),
    AWAITING_CREDENTIAL("awaiting_credential", false),
    RETRYING("retrying", false),
    SUCCESS("success", true),
    FAILURE("failure", true),
    ERROR("error", true);

    private final String stateName;
    private final boolean terminal;

    LoginState(String stateName, boolean terminal) {
        this.stateName = stateName;
        this.terminal = terminal;
    }

    /** Name of the corresponding automaton state. */
    public String stateName() {
        return stateName;
    }

    public boolean isTerminal() {
        return terminal;
    }

    public static LoginState fromStateName(String name) {
        for (LoginState s : values())
            if (s.stateName.equals(name))
                return s;
        throw new IllegalArgumentException("Not a login state: " + name);
    }
}
