package com.automata.fsa.engine;

import com.automata.fsa.api.RunStatus;
import com.automata.fsa.api.TransitionListener;
import com.automata.fsa.graph.StateGraph;
import com.automata.fsa.graph.StateSet;

import java.util.ArrayList;
import java.util.List;

/**
 * The core engine that drives an automaton over its input.
 *
 * The runner owns the only mutable piece of a run: the active state set and
 * the input cursor. The graph is shared and read-only, so any number of
 * runners may simulate the same graph, each on its own thread.
 *
 * Algorithm per symbol:
 * 1. Step: the {@link TransitionStepper} maps the active set to the raw
 * successor set (union over all active states).
 * 2. Close: the {@link EpsilonClosure} expands the raw set.
 * 3. Commit: the closed set replaces the active set, the cursor advances and
 * the listener (if any) sees the transition.
 *
 * The commit happens only after both computations have completed, so a run
 * abandoned between symbols never holds a half-applied step.
 *
 * Acceptance: once the input is exhausted ({@link #finish()}), the run is
 * ACCEPTED if the active set intersects the accept states and REJECTED
 * otherwise. Both are terminal; {@link #reset()} starts a fresh run.
 *
 * Not thread-safe. One runner per logical thread of control.
 */
public final class AutomatonRunner {
    private final StateGraph graph;
    private final TransitionStepper stepper;
    private final EpsilonClosure closure;
    private final StateSet initial;

    private StateSet active;
    private int cursor;
    private long steps;
    private RunStatus status;
    private TransitionListener listener;

    public AutomatonRunner(StateGraph graph) {
        this.graph = graph;
        this.stepper = new TransitionStepper(graph);
        this.closure = new EpsilonClosure(graph);
        this.initial = closure.closure(graph.startSet());
        reset();
    }

    public void setListener(TransitionListener listener) {
        this.listener = listener;
    }

    /**
     * Discards the current run. The active set becomes the epsilon-closure of
     * the start state, regardless of what happened before.
     */
    public void reset() {
        active = initial;
        cursor = 0;
        steps = 0;
        status = RunStatus.IDLE;
        if (listener != null)
            listener.onReset(active);
    }

    /**
     * Consumes one symbol.
     *
     * @return The closed active state set after the symbol.
     * @throws IllegalStateException if the run already finished.
     */
    public StateSet step(String symbol) {
        requireOpen("step");

        final StateSet before = active;
        final StateSet after = closure.closure(stepper.step(before, symbol));

        active = after;
        cursor++;
        steps++;
        status = RunStatus.RUNNING;

        final TransitionListener l = this.listener;
        if (l != null)
            l.onTransition(steps, symbol, before, after);
        return after;
    }

    /**
     * Marks the input as exhausted and decides the run.
     *
     * @throws IllegalStateException if the run already finished.
     */
    public RunResult finish() {
        requireOpen("finish");
        boolean accepted = isAccepting();
        status = accepted ? RunStatus.ACCEPTED : RunStatus.REJECTED;
        if (listener != null)
            listener.onRunComplete(steps, accepted, active);
        return new RunResult(status, active, steps);
    }

    /** Batch convenience: steps through every symbol, then finishes. */
    public RunResult run(Iterable<String> symbols) {
        requireOpen("run");
        for (String symbol : symbols)
            step(symbol);
        return finish();
    }

    /** Runs over a character sequence, one symbol per code point. */
    public RunResult run(CharSequence input) {
        return run(symbols(input));
    }

    /**
     * True if the current active set contains an accept state. Does not change
     * the status of the run.
     */
    public boolean isAccepting() {
        return active.intersects(graph.acceptStates());
    }

    /**
     * Starts a cooperative run over {@code input}. Each
     * {@link CooperativeRun#advance()} consumes exactly one symbol and returns
     * control to the caller.
     *
     * @throws IllegalStateException if symbols were already consumed. Continue
     *                               such a run with
     *                               {@link #resume(RunCheckpoint, List)}.
     */
    public CooperativeRun cooperative(List<String> input) {
        requireOpen("cooperative");
        if (cursor != 0)
            throw new IllegalStateException("Cannot start a cooperative run after " + cursor
                    + " consumed symbol(s); resume from a checkpoint or reset first");
        return new CooperativeRun(this, input, 0);
    }

    /** Captures the active set and cursor of the current run. */
    public RunCheckpoint checkpoint() {
        return new RunCheckpoint(active, cursor);
    }

    /**
     * Reconstructs a suspended run from a checkpoint and continues it
     * cooperatively over the same input the checkpoint was taken on.
     *
     * @param checkpoint The suspended state.
     * @param input      The complete input sequence; consumption resumes at
     *                   {@code checkpoint.cursor()}.
     */
    public CooperativeRun resume(RunCheckpoint checkpoint, List<String> input) {
        if (checkpoint.activeStates().capacity() != graph.stateCount())
            throw new IllegalArgumentException("Checkpoint does not belong to this graph");
        if (checkpoint.cursor() > input.size())
            throw new IllegalArgumentException(
                    "Checkpoint cursor " + checkpoint.cursor() + " is past the end of a " + input.size()
                            + "-symbol input");
        active = checkpoint.activeStates();
        cursor = checkpoint.cursor();
        steps = checkpoint.cursor();
        status = cursor == 0 ? RunStatus.IDLE : RunStatus.RUNNING;
        return new CooperativeRun(this, input, cursor);
    }

    private void requireOpen(String operation) {
        if (status.isTerminal())
            throw new IllegalStateException(
                    "Cannot " + operation + ": run already " + status + ". Reset required.");
    }

    /** Splits a character sequence into one symbol per code point. */
    public static List<String> symbols(CharSequence input) {
        List<String> out = new ArrayList<>(input.length());
        input.codePoints().forEach(cp -> out.add(new String(Character.toChars(cp))));
        return out;
    }

    public StateSet activeStates() {
        return active;
    }

    public int cursor() {
        return cursor;
    }

    public long stepCount() {
        return steps;
    }

    public RunStatus status() {
        return status;
    }

    public StateGraph graph() {
        return graph;
    }

    public EpsilonClosure closure() {
        return closure;
    }

    public TransitionStepper stepper() {
        return stepper;
    }
}
