package com.automata.fsa.graph;

import java.util.Arrays;
import java.util.NoSuchElementException;
import java.util.PrimitiveIterator;

/**
 * Immutable set of state indices over the dense range 0..capacity-1.
 *
 * Stored as a bitset: one bit per state, 64 states per long word, the same
 * packing the engine uses elsewhere for per-state flags. Membership, union and
 * intersection tests are word-wise and never allocate per element.
 *
 * Instances are never mutated after construction, so a set handed to a
 * listener or returned by the closure can be kept without copying. Use
 * {@link Builder} to assemble a new set.
 */
public final class StateSet {
    private static final long[] NO_WORDS = new long[0];

    private final int capacity;
    private final long[] words;
    private final int size;

    private StateSet(int capacity, long[] words) {
        this.capacity = capacity;
        this.words = words;
        int n = 0;
        for (long w : words)
            n += Long.bitCount(w);
        this.size = n;
    }

    /** Returns the empty set for an automaton with {@code capacity} states. */
    public static StateSet empty(int capacity) {
        return new StateSet(capacity, capacity == 0 ? NO_WORDS : new long[wordCount(capacity)]);
    }

    /** Returns a set holding exactly the given states. */
    public static StateSet of(int capacity, int... states) {
        Builder b = builder(capacity);
        for (int s : states)
            b.add(s);
        return b.build();
    }

    public static Builder builder(int capacity) {
        return new Builder(capacity);
    }

    private static int wordCount(int capacity) {
        return (capacity + 63) >> 6;
    }

    /** Size of the state arena this set ranges over. */
    public int capacity() {
        return capacity;
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    public boolean contains(int state) {
        if (state < 0 || state >= capacity)
            return false;
        return (words[state >> 6] & (1L << state)) != 0;
    }

    /** True if at least one state is a member of both sets. */
    public boolean intersects(StateSet other) {
        checkCompatible(other);
        for (int i = 0; i < words.length; i++)
            if ((words[i] & other.words[i]) != 0)
                return true;
        return false;
    }

    public StateSet union(StateSet other) {
        checkCompatible(other);
        long[] merged = words.clone();
        for (int i = 0; i < merged.length; i++)
            merged[i] |= other.words[i];
        return new StateSet(capacity, merged);
    }

    /**
     * Returns the lowest member at or after {@code from}, or -1 if there is
     * none.
     */
    public int nextState(int from) {
        if (from < 0)
            from = 0;
        if (from >= capacity)
            return -1;
        int wi = from >> 6;
        long word = words[wi] & (-1L << from);
        while (true) {
            if (word != 0)
                return (wi << 6) + Long.numberOfTrailingZeros(word);
            if (++wi == words.length)
                return -1;
            word = words[wi];
        }
    }

    /** Members in ascending index order. */
    public int[] toArray() {
        int[] out = new int[size];
        int i = 0;
        for (int s = nextState(0); s >= 0; s = nextState(s + 1))
            out[i++] = s;
        return out;
    }

    public PrimitiveIterator.OfInt iterator() {
        return new PrimitiveIterator.OfInt() {
            private int next = nextState(0);

            @Override
            public boolean hasNext() {
                return next >= 0;
            }

            @Override
            public int nextInt() {
                if (next < 0)
                    throw new NoSuchElementException();
                int current = next;
                next = nextState(current + 1);
                return current;
            }
        };
    }

    private void checkCompatible(StateSet other) {
        if (other.capacity != capacity)
            throw new IllegalArgumentException(
                    "State sets range over different automata: capacity " + capacity + " vs " + other.capacity);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof StateSet other))
            return false;
        return capacity == other.capacity && Arrays.equals(words, other.words);
    }

    @Override
    public int hashCode() {
        return 31 * capacity + Arrays.hashCode(words);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder().append('{');
        for (int s = nextState(0); s >= 0; s = nextState(s + 1)) {
            if (sb.length() > 1)
                sb.append(", ");
            sb.append(s);
        }
        return sb.append('}').toString();
    }

    /**
     * Mutable accumulator for a {@link StateSet}. Not thread-safe; a builder
     * can be reused after {@link #build()} since build copies the words.
     */
    public static final class Builder {
        private final int capacity;
        private final long[] words;

        private Builder(int capacity) {
            if (capacity < 0)
                throw new IllegalArgumentException("Negative capacity: " + capacity);
            this.capacity = capacity;
            this.words = new long[wordCount(capacity)];
        }

        /**
         * Adds a state.
         *
         * @return true if the state was not already present.
         */
        public boolean add(int state) {
            if (state < 0 || state >= capacity)
                throw new IllegalArgumentException("State " + state + " outside 0.." + (capacity - 1));
            int wi = state >> 6;
            long bit = 1L << state;
            if ((words[wi] & bit) != 0)
                return false;
            words[wi] |= bit;
            return true;
        }

        public Builder addAll(StateSet set) {
            if (set.capacity != capacity)
                throw new IllegalArgumentException(
                        "State set capacity " + set.capacity + " does not match builder capacity " + capacity);
            for (int i = 0; i < words.length; i++)
                words[i] |= set.words[i];
            return this;
        }

        public boolean contains(int state) {
            return state >= 0 && state < capacity && (words[state >> 6] & (1L << state)) != 0;
        }

        public StateSet build() {
            return new StateSet(capacity, words.clone());
        }
    }
}
