package com.automata.fsa.engine;

import java.util.List;

/**
 * A run that yields to its caller after every symbol.
 *
 * This is the single-step face of {@link AutomatonRunner} for callers that
 * interleave a run with other work, such as waiting for the next interactive
 * input. The class embeds no scheduler: whoever holds it decides when to call
 * {@link #advance()} again. Suspension happens only between symbols.
 *
 * Abandoning a run is just dropping this object; {@link #checkpoint()} can be
 * used to resume it later through {@link AutomatonRunner#resume}.
 */
public final class CooperativeRun {
    private final AutomatonRunner runner;
    private final List<String> input;
    private int position;
    private RunResult result;

    CooperativeRun(AutomatonRunner runner, List<String> input, int position) {
        this.runner = runner;
        this.input = List.copyOf(input);
        this.position = position;
    }

    /**
     * Consumes the next symbol, or decides the run once the input is exhausted.
     *
     * @return true while the run is still open and another call is needed.
     */
    public boolean advance() {
        if (result != null)
            return false;
        if (position < input.size()) {
            runner.step(input.get(position++));
            return true;
        }
        result = runner.finish();
        return false;
    }

    /** Drives the run to completion without further suspension. */
    public RunResult complete() {
        while (advance()) {
            // keep stepping
        }
        return result;
    }

    public boolean isDone() {
        return result != null;
    }

    /** The result, or null while the run is still open. */
    public RunResult result() {
        return result;
    }

    public int remaining() {
        return Math.max(0, input.size() - position);
    }

    public RunCheckpoint checkpoint() {
        return runner.checkpoint();
    }
}
