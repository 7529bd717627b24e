package org.relaypad.core.id;

import it.unimi.dsi.fastutil.chars.Char2IntOpenHashMap;

/**
 * SymbolIndex backed by a fastutil primitive map.
 * Immutable and safe for concurrent reads.
 */
public class FastUtilSymbolIndex implements SymbolIndex {

    private static final int MISSING = -1;

    // char -> index, no boxing on lookup
    private final Char2IntOpenHashMap forward;
    private final char[] reverse;

    /**
     * Builds the index from an alphabet in index order.
     * Rejects duplicate symbols.
     */
    public FastUtilSymbolIndex(char[] symbols) {
        if (symbols == null) {
            throw new IllegalArgumentException("Symbols cannot be null");
        }
        this.forward = new Char2IntOpenHashMap(symbols.length);
        this.forward.defaultReturnValue(MISSING);
        this.reverse = symbols.clone();

        for (int i = 0; i < reverse.length; i++) {
            char symbol = reverse[i];
            if (forward.containsKey(symbol)) {
                throw new IllegalArgumentException("Duplicate symbol detected in alphabet: '" + symbol + "'");
            }
            forward.put(symbol, i);
        }
        this.forward.trim();
    }

    @Override
    public int toIndex(char symbol) throws UnknownSymbolException {
        int index = forward.get(symbol);
        if (index == MISSING) {
            throw new UnknownSymbolException("Symbol not in alphabet: '" + symbol + "'");
        }
        return index;
    }

    @Override
    public char toSymbol(int index) {
        try {
            return reverse[index];
        } catch (ArrayIndexOutOfBoundsException e) {
            throw new IndexOutOfBoundsException("Symbol index out of bounds: " + index);
        }
    }

    @Override
    public boolean contains(char symbol) {
        return forward.containsKey(symbol);
    }

    @Override
    public boolean containsIndex(int index) {
        return index >= 0 && index < reverse.length;
    }

    @Override
    public int size() {
        return reverse.length;
    }
}
