package com.automata.fsa.util;

import com.automata.fsa.api.TransitionListener;
import com.automata.fsa.graph.StateSet;
import java.util.Arrays;

/**
 * Aggregates multiple {@link TransitionListener} instances with
 * zero-allocation iteration.
 */
public class CompositeTransitionListener implements TransitionListener {
    private TransitionListener[] listeners = new TransitionListener[0];

    public CompositeTransitionListener add(TransitionListener listener) {
        TransitionListener[] old = listeners;
        TransitionListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
        return this;
    }

    public int size() {
        return listeners.length;
    }

    @Override
    public void onReset(StateSet initial) {
        for (TransitionListener l : listeners)
            l.onReset(initial);
    }

    @Override
    public void onTransition(long step, String symbol, StateSet before, StateSet after) {
        for (TransitionListener l : listeners)
            l.onTransition(step, symbol, before, after);
    }

    @Override
    public void onRunComplete(long steps, boolean accepted, StateSet finalStates) {
        for (TransitionListener l : listeners)
            l.onRunComplete(steps, accepted, finalStates);
    }
}
