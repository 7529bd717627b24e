package org.relaypad.keypad;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.relaypad.core.id.SymbolIndex;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable keypad: a symbol alphabet with integer positions and exactly one gap cell.
 *
 * <p>Symbols are addressed by dense index (see {@link SymbolIndex}) so cost matrices can be laid
 * out as flat {@code |alphabet|²} arrays. The gap cell is not a symbol; no arm traversal may
 * cross it.</p>
 */
@Accessors(fluent = true)
public final class KeypadLayout {

    /** Row-text marker for the gap cell. */
    public static final char GAP_MARKER = ' ';

    @Getter
    private final String id;
    @Getter
    private final KeyPosition gap;
    private final SymbolIndex symbolIndex;
    private final KeyPosition[] positions;

    private KeypadLayout(String id, char[] symbols, KeyPosition[] positions, KeyPosition gap) {
        this.id = id;
        this.symbolIndex = SymbolIndex.createImmutable(symbols);
        this.positions = positions;
        this.gap = gap;
        for (KeyPosition position : positions) {
            if (position.equals(gap)) {
                throw new IllegalArgumentException("layout " + id + " places a key on the gap cell " + gap);
            }
        }
        if (!symbolIndex.contains(KeypadLayouts.ACTIVATE)) {
            throw new IllegalArgumentException(
                    "layout " + id + " must contain activate key '" + KeypadLayouts.ACTIVATE + "'"
            );
        }
    }

    /**
     * Parses a layout from row strings.
     *
     * <p>Row {@code y} character {@code x} becomes the key at {@code (x, y)}. Exactly one
     * {@link #GAP_MARKER} cell is required; every other character must be unique.</p>
     *
     * @param id layout identifier.
     * @param rows keypad rows, top to bottom.
     * @return parsed immutable layout.
     */
    public static KeypadLayout fromRows(String id, List<String> rows) {
        String layoutId = normalizeId(id);
        Objects.requireNonNull(rows, "rows");
        if (rows.isEmpty()) {
            throw new IllegalArgumentException("layout " + layoutId + " must have at least one row");
        }

        StringBuilder symbols = new StringBuilder();
        List<KeyPosition> keyPositions = new ArrayList<>();
        KeyPosition gap = null;
        for (int y = 0; y < rows.size(); y++) {
            String row = Objects.requireNonNull(rows.get(y), "row");
            for (int x = 0; x < row.length(); x++) {
                char c = row.charAt(x);
                if (c == GAP_MARKER) {
                    if (gap != null) {
                        throw new IllegalArgumentException(
                                "layout " + layoutId + " has more than one gap cell: " + gap + " and (" + x + ", " + y + ")"
                        );
                    }
                    gap = new KeyPosition(x, y);
                    continue;
                }
                symbols.append(c);
                keyPositions.add(new KeyPosition(x, y));
            }
        }
        if (gap == null) {
            throw new IllegalArgumentException("layout " + layoutId + " must have exactly one gap cell");
        }
        return new KeypadLayout(
                layoutId,
                symbols.toString().toCharArray(),
                keyPositions.toArray(new KeyPosition[0]),
                gap
        );
    }

    /**
     * Returns the position of a symbol.
     *
     * @throws SymbolIndex.UnknownSymbolException when the symbol is not on this keypad.
     */
    public KeyPosition positionOf(char symbol) {
        return positions[indexOf(symbol)];
    }

    /**
     * Returns the position of the symbol at a dense index.
     */
    public KeyPosition positionAt(int index) {
        if (!symbolIndex.containsIndex(index)) {
            throw new IndexOutOfBoundsException("Symbol index out of bounds: " + index);
        }
        return positions[index];
    }

    /**
     * Returns the dense index of a symbol.
     *
     * @throws SymbolIndex.UnknownSymbolException when the symbol is not on this keypad.
     */
    public int indexOf(char symbol) {
        try {
            return symbolIndex.toIndex(symbol);
        } catch (SymbolIndex.UnknownSymbolException e) {
            throw new SymbolIndex.UnknownSymbolException(
                    "Symbol '" + symbol + "' is not on keypad " + id, e
            );
        }
    }

    /**
     * Returns the symbol at a dense index.
     */
    public char symbolAt(int index) {
        return symbolIndex.toSymbol(index);
    }

    public boolean contains(char symbol) {
        return symbolIndex.contains(symbol);
    }

    /**
     * Returns true iff {@code (x, y)} is the forbidden gap cell.
     */
    public boolean isGap(int x, int y) {
        return gap.isAt(x, y);
    }

    public int size() {
        return symbolIndex.size();
    }

    /**
     * Returns a copy of the alphabet in index order.
     */
    public char[] symbols() {
        char[] out = new char[size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = symbolIndex.toSymbol(i);
        }
        return out;
    }

    /**
     * Returns true when this keypad can steer another arm: it carries all four
     * direction keys plus activate.
     */
    public boolean isDirectional() {
        for (char key : KeypadLayouts.DIRECTIONAL_KEYS) {
            if (!contains(key)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return "KeypadLayout{" + id + ", keys=" + new String(symbols()) + ", gap=" + gap + "}";
    }

    private static String normalizeId(String id) {
        String normalized = Objects.requireNonNull(id, "id").trim();
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("id must be non-blank");
        }
        return normalized;
    }
}
