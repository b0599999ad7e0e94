package com.automata.fsa.util;

import com.automata.fsa.api.TransitionListener;
import com.automata.fsa.graph.StateSet;

/**
 * A listener that tracks run metrics.
 *
 * <p>
 * Captures:
 * <ul>
 * <li><b>Throughput:</b> runs completed, steps taken.</li>
 * <li><b>Outcomes:</b> accepted vs rejected runs.</li>
 * <li><b>Branching:</b> largest active set seen, steps that left no active
 * state.</li>
 * <li><b>Latency:</b> wall time from reset to run completion (in
 * nanoseconds).</li>
 * </ul>
 */
public final class RunStatsListener implements TransitionListener {
    private long runStartNanos, lastRunNanos, totalRunNanos;
    private long runs, accepted, totalSteps, deadSteps;
    private int maxActiveStates;

    @Override
    public void onReset(StateSet initial) {
        runStartNanos = System.nanoTime();
        if (initial.size() > maxActiveStates)
            maxActiveStates = initial.size();
    }

    @Override
    public void onTransition(long step, String symbol, StateSet before, StateSet after) {
        totalSteps++;
        if (after.isEmpty())
            deadSteps++;
        if (after.size() > maxActiveStates)
            maxActiveStates = after.size();
    }

    @Override
    public void onRunComplete(long steps, boolean acc, StateSet finalStates) {
        lastRunNanos = System.nanoTime() - runStartNanos;
        totalRunNanos += lastRunNanos;
        runs++;
        if (acc)
            accepted++;
    }

    public long runs() {
        return runs;
    }

    public long accepted() {
        return accepted;
    }

    public long rejected() {
        return runs - accepted;
    }

    public long totalSteps() {
        return totalSteps;
    }

    /** Steps whose resulting active set was empty. */
    public long deadSteps() {
        return deadSteps;
    }

    public int maxActiveStates() {
        return maxActiveStates;
    }

    public long lastRunNanos() {
        return lastRunNanos;
    }

    public double avgRunMicros() {
        return runs > 0 ? totalRunNanos / 1000.0 / runs : 0;
    }

    public void reset() {
        runs = accepted = totalSteps = deadSteps = 0;
        totalRunNanos = lastRunNanos = 0;
        maxActiveStates = 0;
    }

    public String dump() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%-12s | %10s | %10s | %10s | %10s | %10s\n", "Runs", "Accepted", "Rejected",
                "Steps", "Dead", "Avg (us)"));
        sb.append("------------------------------------------------------------------------------\n");
        sb.append(String.format("%-12d | %10d | %10d | %10d | %10d | %10.2f\n", runs, accepted, rejected(),
                totalSteps, deadSteps, avgRunMicros()));
        return sb.toString();
    }
}
