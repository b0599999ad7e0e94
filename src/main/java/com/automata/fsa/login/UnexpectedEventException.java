package com.automata.fsa.login;

import lombok.Getter;

/**
 * Raised when a login operation is called in a state that does not accept it,
 * e.g. a credential before any identifier, or any submission after the login
 * has ended. The attempt has already been counted and audited when this is
 * thrown, and the login is left in {@link LoginState#ERROR} until reset.
 */
@Getter
public class UnexpectedEventException extends IllegalStateException {
    private final LoginState state;
    private final LoginEvent event;

    public UnexpectedEventException(LoginState state, LoginEvent event) {
        super("Unexpected " + event + " in state " + state);
        this.state = state;
        this.event = event;
    }
}
