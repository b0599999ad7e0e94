package com.automata.fsa.api;

import com.automata.fsa.graph.StateSet;

/**
 * Audit interface for monitoring automaton runs.
 *
 * Implementations can be registered with a runner to receive one callback per
 * transition attempt. This is the only observability hook of the engine: the
 * runners never log or format anything themselves, and their results are
 * identical whether a listener is attached or not.
 *
 * Callbacks execute on the runner's thread, inside the step loop. Keep them
 * cheap; anything that blocks here stalls the run.
 *
 * The {@link StateSet} arguments are immutable and may be retained.
 */
public interface TransitionListener {

    /**
     * Called after the runner has been reset to the closure of its start state.
     *
     * @param initial The active state set the next run starts from.
     */
    void onReset(StateSet initial);

    /**
     * Called once per transition attempt, after the successor set (including
     * its epsilon-closure) has been computed.
     *
     * @param step   Sequential index of the attempt, starting at 1.
     * @param symbol The symbol consumed.
     * @param before The active state set prior to the attempt.
     * @param after  The active state set after the attempt.
     */
    void onTransition(long step, String symbol, StateSet before, StateSet after);

    /**
     * Called when the input has been exhausted and the run decided.
     *
     * @param steps       Total transition attempts of the run.
     * @param accepted    true if the final set intersects the accept states.
     * @param finalStates The final active state set.
     */
    void onRunComplete(long steps, boolean accepted, StateSet finalStates);
}
