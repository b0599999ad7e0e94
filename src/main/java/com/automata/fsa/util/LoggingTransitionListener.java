package com.automata.fsa.util;

import com.automata.fsa.api.Automaton;
import com.automata.fsa.api.TransitionListener;
import com.automata.fsa.graph.StateSet;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Audit sink that writes every transition attempt to Log4j2.
 *
 * <p>
 * One line per step: step index, consumed symbol, prior and resulting active
 * sets by state name. Steps that kill every branch (empty resulting set) are
 * logged at WARN so they stand out in a long trace.
 */
public final class LoggingTransitionListener implements TransitionListener {
    private static final Logger log = LogManager.getLogger(LoggingTransitionListener.class);

    private final String runName;
    private final AutomatonExplain explain;
    private final Level level;

    public LoggingTransitionListener(String runName, Automaton automaton) {
        this(runName, automaton, Level.INFO);
    }

    public LoggingTransitionListener(String runName, Automaton automaton, Level level) {
        this.runName = runName;
        this.explain = new AutomatonExplain(automaton);
        this.level = level;
    }

    @Override
    public void onReset(StateSet initial) {
        if (log.isEnabled(level))
            log.log(level, "[{}] Step 0: initial states {}", runName, explain.describe(initial));
    }

    @Override
    public void onTransition(long step, String symbol, StateSet before, StateSet after) {
        Level l = after.isEmpty() && !before.isEmpty() ? Level.WARN : level;
        if (log.isEnabled(l))
            log.log(l, "[{}] Step {}: symbol='{}' {} -> {}", runName, step, symbol, explain.describe(before),
                    explain.describe(after));
    }

    @Override
    public void onRunComplete(long steps, boolean accepted, StateSet finalStates) {
        if (log.isEnabled(level))
            log.log(level, "[{}] Run finished after {} step(s): {} in {}", runName, steps,
                    accepted ? "ACCEPTED" : "REJECTED", explain.describe(finalStates));
    }
}
