package com.automata.fsa.login;

import com.automata.fsa.api.TransitionListener;
import com.automata.fsa.dfa.DeterministicAutomaton;
import com.automata.fsa.dfa.DfaRunner;

import lombok.extern.log4j.Log4j2;

/**
 * Strictly ordered login protocol on top of a {@link DeterministicAutomaton}.
 *
 * Protocol: collect an identifier, then collect and validate a credential; a
 * wrong credential loops back through RETRYING while the retry budget lasts.
 *
 * <pre>
 * start               --identifier_known-->   awaiting_credential
 * start               --identifier_unknown--> failure
 * awaiting_credential --credential_valid-->   success
 * awaiting_credential --credential_invalid--> retrying
 * awaiting_credential --retries_exhausted-->  failure
 * retrying            --credential_valid-->   success
 * retrying            --credential_invalid--> retrying
 * retrying            --retries_exhausted-->  failure
 * </pre>
 *
 * The budget is a hard ceiling: the failed submission that uses up the last
 * attempt is translated to {@code retries_exhausted}, which has only one
 * target. Every submission, including ones that end up rejected, is one
 * transition attempt on the underlying runner, so the step counter and the
 * audit listener see all of them.
 *
 * Submissions the protocol does not allow in the current state drive the
 * automaton into its absorbing error state and are reported as
 * {@link UnexpectedEventException}.
 */
@Log4j2
public final class LoginAutomaton {
    public static final int DEFAULT_MAX_ATTEMPTS = 3;

    private static final DeterministicAutomaton PROTOCOL = buildProtocol();

    private final CredentialStore credentials;
    private final int maxAttempts;
    private final DfaRunner runner;

    private String identifier;
    private int attempts;

    public LoginAutomaton(CredentialStore credentials) {
        this(credentials, DEFAULT_MAX_ATTEMPTS);
    }

    /**
     * @param credentials Table the submissions are validated against.
     * @param maxAttempts Number of credential submissions allowed, at least 1.
     */
    public LoginAutomaton(CredentialStore credentials, int maxAttempts) {
        if (maxAttempts < 1)
            throw new IllegalArgumentException("maxAttempts must be >= 1, got " + maxAttempts);
        this.credentials = credentials;
        this.maxAttempts = maxAttempts;
        this.runner = new DfaRunner(PROTOCOL);
    }

    /** The protocol automaton shared by every login instance. */
    public static DeterministicAutomaton protocol() {
        return PROTOCOL;
    }

    private static DeterministicAutomaton buildProtocol() {
        var b = DeterministicAutomaton.builder().errorStateName(LoginState.ERROR.stateName());
        int start = b.addState(LoginState.START.stateName());
        int awaiting = b.addState(LoginState.AWAITING_CREDENTIAL.stateName());
        int retrying = b.addState(LoginState.RETRYING.stateName());
        int success = b.addState(LoginState.SUCCESS.stateName(), true);
        int failure = b.addState(LoginState.FAILURE.stateName());

        b.addTransition(start, LoginEvent.IDENTIFIER_KNOWN.symbol(), awaiting)
                .addTransition(start, LoginEvent.IDENTIFIER_UNKNOWN.symbol(), failure);
        for (int collecting : new int[] { awaiting, retrying }) {
            b.addTransition(collecting, LoginEvent.CREDENTIAL_VALID.symbol(), success)
                    .addTransition(collecting, LoginEvent.CREDENTIAL_INVALID.symbol(), retrying)
                    .addTransition(collecting, LoginEvent.RETRIES_EXHAUSTED.symbol(), failure);
        }
        return b.start(start).build();
    }

    public void setListener(TransitionListener listener) {
        runner.setListener(listener);
    }

    /**
     * Step 1: submit the identifier. Unknown identifiers end the login in
     * FAILURE immediately; the retry budget covers the credential step only.
     *
     * @return The state after the transition.
     * @throws UnexpectedEventException if an identifier was already submitted.
     */
    public LoginState submitIdentifier(String id) {
        LoginEvent event = credentials.isKnown(id) ? LoginEvent.IDENTIFIER_KNOWN : LoginEvent.IDENTIFIER_UNKNOWN;
        LoginState next = fire(event);
        identifier = id;
        if (next == LoginState.FAILURE)
            log.warn("Login failed: unknown identifier '{}'", id);
        return next;
    }

    /**
     * Step 2: submit and validate a credential for the collected identifier.
     *
     * @return SUCCESS, RETRYING while attempts remain, or FAILURE once the
     *         budget is spent.
     * @throws UnexpectedEventException if no identifier has been accepted yet or
     *                                  the login already ended.
     */
    public LoginState submitCredential(String secret) {
        LoginState current = state();
        boolean collecting = current == LoginState.AWAITING_CREDENTIAL || current == LoginState.RETRYING;

        LoginEvent event;
        if (collecting && credentials.matches(identifier, secret)) {
            event = LoginEvent.CREDENTIAL_VALID;
        } else if (collecting && attempts + 1 >= maxAttempts) {
            event = LoginEvent.RETRIES_EXHAUSTED;
        } else {
            event = LoginEvent.CREDENTIAL_INVALID;
        }

        LoginState next = fire(event);
        attempts++;
        switch (next) {
            case SUCCESS -> log.info("Login succeeded for '{}' after {} attempt(s)", identifier, attempts);
            case RETRYING -> log.info("Wrong credential for '{}', {} attempt(s) left", identifier,
                    maxAttempts - attempts);
            case FAILURE -> log.warn("Login failed for '{}': {} attempt(s) used", identifier, attempts);
            default -> {
            }
        }
        return next;
    }

    private LoginState fire(LoginEvent event) {
        LoginState before = state();
        runner.step(event.symbol());
        LoginState after = state();
        if (after == LoginState.ERROR)
            throw new UnexpectedEventException(before, event);
        return after;
    }

    /** Returns to START with the step counter and attempts cleared. */
    public void reset() {
        runner.reset();
        identifier = null;
        attempts = 0;
    }

    public LoginState state() {
        return LoginState.fromStateName(PROTOCOL.stateName(runner.currentState()));
    }

    public boolean isAuthenticated() {
        return state() == LoginState.SUCCESS;
    }

    /** Transition attempts so far, failed and out-of-order ones included. */
    public long stepCount() {
        return runner.stepCount();
    }

    /** Credential submissions accepted for validation so far. */
    public int attempts() {
        return attempts;
    }

    public int remainingAttempts() {
        return Math.max(0, maxAttempts - attempts);
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public String identifier() {
        return identifier;
    }
}
