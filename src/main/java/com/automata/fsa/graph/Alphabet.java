package com.automata.fsa.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Interning table for input symbols.
 *
 * Every distinct symbol seen while building an automaton gets a dense integer
 * id so that transition tables can be plain arrays indexed by
 * {@code [state][symbolId]}. Symbols that were never interned resolve to
 * {@link #UNKNOWN}; callers treat that as "no transition".
 */
public final class Alphabet {
    public static final int UNKNOWN = -1;

    private final Map<String, Integer> ids;
    private final List<String> symbols;

    private Alphabet(Map<String, Integer> ids, List<String> symbols) {
        this.ids = ids;
        this.symbols = symbols;
    }

    /** Resolves a symbol to its id, or {@link #UNKNOWN}. O(1) hash lookup. */
    public int indexOf(String symbol) {
        Integer id = ids.get(symbol);
        return id == null ? UNKNOWN : id;
    }

    public String symbol(int id) {
        return symbols.get(id);
    }

    public boolean contains(String symbol) {
        return ids.containsKey(symbol);
    }

    public int size() {
        return symbols.size();
    }

    /** Symbols in id order. */
    public List<String> symbols() {
        return symbols;
    }

    @Override
    public String toString() {
        return symbols.toString();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Accumulates symbols in first-seen order. */
    public static final class Builder {
        private final Map<String, Integer> ids = new HashMap<>();
        private final List<String> symbols = new ArrayList<>();

        public int intern(String symbol) {
            if (symbol == null || symbol.isEmpty())
                throw new IllegalArgumentException("Symbol must be a non-empty string");
            Integer id = ids.get(symbol);
            if (id != null)
                return id;
            int next = symbols.size();
            ids.put(symbol, next);
            symbols.add(symbol);
            return next;
        }

        public int size() {
            return symbols.size();
        }

        public Alphabet build() {
            return new Alphabet(new HashMap<>(ids), Collections.unmodifiableList(new ArrayList<>(symbols)));
        }
    }
}
