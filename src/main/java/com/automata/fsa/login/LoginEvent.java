package com.automata.fsa.login;

/**
 * Input alphabet of the login automaton. Each event is what the login layer
 * concluded from one submission; the automaton itself never sees identifiers or
 * secrets.
 */
public enum LoginEvent {
    IDENTIFIER_KNOWN("identifier_known"),
    IDENTIFIER_UNKNOWN("identifier_unknown"),
    CREDENTIAL_VALID("credential_valid"),
    CREDENTIAL_INVALID("credential_invalid"),
    /** A wrong credential on the last attempt the budget allows. */
    RETRIES_EXHAUSTED("retries_exhausted");

    private final String symbol;

    LoginEvent(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }
}
