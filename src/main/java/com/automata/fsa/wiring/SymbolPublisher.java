package com.automata.fsa.wiring;

import com.automata.fsa.engine.AutomatonRunner;
import com.automata.fsa.engine.RunResult;
import com.lmax.disruptor.EventHandler;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Disruptor EventHandler that consumes SymbolEvents and drives a runner.
 *
 * This class is the external scheduler for cooperative runs: producers publish
 * symbols into the ring buffer as they become available (for example, one per
 * prompt answered), and the single consumer thread advances the run by exactly
 * one symbol per event. Between events the run is suspended with nothing but
 * its active state set and cursor, and symbols are applied in ring-buffer
 * order.
 *
 * The runner is confined to the consumer thread; producers never touch it.
 *
 * On END_OF_INPUT the run is decided, the completion callback is invoked and
 * the runner is reset for the next run.
 */
public final class SymbolPublisher implements EventHandler<SymbolEvent> {
    private static final Logger log = LogManager.getLogger(SymbolPublisher.class);

    private final AutomatonRunner runner;
    private RunCompletionCallback onComplete;
    private long runsCompleted;

    public SymbolPublisher(AutomatonRunner runner) {
        this.runner = runner;
    }

    /**
     * Sets a callback to be invoked after every completed run.
     */
    public void setRunCompletionCallback(RunCompletionCallback cb) {
        this.onComplete = cb;
    }

    /**
     * Process a single event from the ring buffer.
     *
     * @param event      The event carried by the ring buffer.
     * @param sequence   The sequence ID of the event.
     * @param endOfBatch Flag indicating if this is the last event in the current
     *                   batch. Runs are driven per symbol, so batching does not
     *                   change behavior here.
     */
    @Override
    public void onEvent(SymbolEvent event, long sequence, boolean endOfBatch) {
        try {
            switch (event.kind()) {
                case SYMBOL -> runner.step(event.symbol());
                case RESET -> runner.reset();
                case END_OF_INPUT -> {
                    RunResult result = runner.finish();
                    runsCompleted++;
                    if (onComplete != null)
                        onComplete.onRunComplete(event.sequenceId(), result);
                    runner.reset();
                }
            }
        } catch (Exception e) {
            // Do not rethrow, to keep the consumer thread alive. The run is
            // discarded; the next event starts from a clean state.
            log.error("Dropping run at sequence {} ({} event): {}", sequence, event.kind(), e.getMessage(), e);
            discardRun();
        }
    }

    private void discardRun() {
        try {
            runner.reset();
        } catch (Exception e) {
            // The runner state is already back at the start; only the listener failed.
            log.error("Listener failed during reset: {}", e.getMessage(), e);
        }
    }

    public long runsCompleted() {
        return runsCompleted;
    }

    public AutomatonRunner runner() {
        return runner;
    }

    /**
     * Callback interface for completed runs.
     */
    @FunctionalInterface
    public interface RunCompletionCallback {
        /**
         * Called on the consumer thread after a run has been decided.
         *
         * @param sequenceId The sequence ID of the END_OF_INPUT event.
         * @param result     Outcome of the run.
         */
        void onRunComplete(long sequenceId, RunResult result);
    }
}
