package com.automata.fsa.wiring;

/**
 * A mutable data holder for automaton input, used within the LMAX Disruptor
 * RingBuffer.
 *
 * Pattern: Flyweight / Mutable Event
 *
 * Instances are pre-allocated when the ring buffer is created and reused for
 * every symbol, so feeding a run allocates nothing per event.
 *
 * Kinds:
 * - SYMBOL: one input symbol for the current run.
 * - END_OF_INPUT: the input is exhausted; the run is decided.
 * - RESET: abandon the current run and start over from the start state.
 */
public final class SymbolEvent {
    public enum Kind {
        SYMBOL,
        END_OF_INPUT,
        RESET
    }

    private Kind kind = Kind.SYMBOL;
    private String symbol;
    private long sequenceId;

    /**
     * Configures the event to carry one symbol.
     *
     * @param symbol The symbol to consume.
     * @param seqId  The sequence ID (for correlation/logging).
     */
    public void setSymbol(String symbol, long seqId) {
        this.kind = Kind.SYMBOL;
        this.symbol = symbol;
        this.sequenceId = seqId;
    }

    public void setEndOfInput(long seqId) {
        this.kind = Kind.END_OF_INPUT;
        this.symbol = null;
        this.sequenceId = seqId;
    }

    public void setReset(long seqId) {
        this.kind = Kind.RESET;
        this.symbol = null;
        this.sequenceId = seqId;
    }

    public Kind kind() {
        return kind;
    }

    public String symbol() {
        return symbol;
    }

    public long sequenceId() {
        return sequenceId;
    }

    public void clear() {
        kind = Kind.SYMBOL;
        symbol = null;
        sequenceId = 0;
    }
}
