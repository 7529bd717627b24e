package org.relaypad.core.id;

import lombok.experimental.StandardException;

/**
 * Bidirectional mapping contract between keypad symbols and dense integer indices.
 */
public interface SymbolIndex {

    /**
     * Converts a keypad symbol to its dense index.
     * @param symbol The key symbol.
     * @return The index in {@code [0, size)}.
     * @throws UnknownSymbolException If the symbol is not part of the alphabet.
     */
    int toIndex(char symbol) throws UnknownSymbolException;

    /**
     * Converts a dense index back to its keypad symbol.
     * @param index The dense index.
     * @return The key symbol.
     * @throws IndexOutOfBoundsException If the index is invalid.
     */
    char toSymbol(int index);

    /**
     * Checks whether a symbol belongs to the alphabet.
     *
     * @param symbol symbol to test.
     * @return true when the symbol is mapped.
     */
    boolean contains(char symbol);

    /**
     * Checks whether an index is within bounds.
     *
     * @param index index to test.
     * @return true when the index is mapped.
     */
    boolean containsIndex(int index);

    /**
     * Returns the alphabet size.
     *
     * @return number of mapped symbols.
     */
    int size();

    /**
     * Exception thrown when a symbol is not part of the alphabet.
     */
    @StandardException
    class UnknownSymbolException extends RuntimeException {
    }

    /**
     * Factory method to create the default immutable implementation.
     *
     * @param symbols alphabet in index order; the symbol at position i receives index i.
     * @return An immutable SymbolIndex instance.
     */
    static SymbolIndex createImmutable(char[] symbols) {
        return new FastUtilSymbolIndex(symbols);
    }
}
