package com.automata.fsa.dfa;

import com.automata.fsa.api.RunStatus;
import com.automata.fsa.api.TransitionListener;
import com.automata.fsa.engine.RunResult;
import com.automata.fsa.graph.StateSet;

/**
 * Single-path runner for a {@link DeterministicAutomaton}.
 *
 * The active configuration is one state, reported to listeners as a singleton
 * {@link StateSet} so that deterministic and nondeterministic runs share one
 * audit format. Unexpected symbols are not errors here: they move the run into
 * the absorbing error state, where it stays until {@link #reset()}.
 *
 * Not thread-safe.
 */
public final class DfaRunner {
    private final DeterministicAutomaton dfa;

    private int current;
    private long steps;
    private RunStatus status;
    private TransitionListener listener;

    public DfaRunner(DeterministicAutomaton dfa) {
        this.dfa = dfa;
        reset();
    }

    public void setListener(TransitionListener listener) {
        this.listener = listener;
    }

    public void reset() {
        current = dfa.startState();
        steps = 0;
        status = RunStatus.IDLE;
        if (listener != null)
            listener.onReset(dfa.singleton(current));
    }

    /**
     * Applies the transition function to the current state.
     *
     * @return The new current state (possibly the error state).
     * @throws IllegalStateException if the run already finished.
     */
    public int step(String symbol) {
        requireOpen("step");
        final int before = current;
        final int after = dfa.step(before, symbol);

        current = after;
        steps++;
        status = RunStatus.RUNNING;

        final TransitionListener l = this.listener;
        if (l != null)
            l.onTransition(steps, symbol, dfa.singleton(before), dfa.singleton(after));
        return after;
    }

    public RunResult finish() {
        requireOpen("finish");
        boolean accepted = dfa.isAccepting(current);
        status = accepted ? RunStatus.ACCEPTED : RunStatus.REJECTED;
        if (listener != null)
            listener.onRunComplete(steps, accepted, dfa.singleton(current));
        return new RunResult(status, dfa.singleton(current), steps);
    }

    public RunResult run(Iterable<String> symbols) {
        requireOpen("run");
        for (String symbol : symbols)
            step(symbol);
        return finish();
    }

    private void requireOpen(String operation) {
        if (status.isTerminal())
            throw new IllegalStateException(
                    "Cannot " + operation + ": run already " + status + ". Reset required.");
    }

    public boolean isAccepting() {
        return dfa.isAccepting(current);
    }

    public boolean inErrorState() {
        return dfa.isError(current);
    }

    public int currentState() {
        return current;
    }

    public StateSet activeStates() {
        return dfa.singleton(current);
    }

    public long stepCount() {
        return steps;
    }

    public RunStatus status() {
        return status;
    }

    public DeterministicAutomaton automaton() {
        return dfa;
    }
}
