package org.relaypad.keypad;

/**
 * Integer key coordinate on a keypad: {@code x} grows to the right, {@code y} grows downwards.
 */
public record KeyPosition(int x, int y) {

    /**
     * Returns true when this position is at {@code (x, y)}.
     */
    public boolean isAt(int x, int y) {
        return this.x == x && this.y == y;
    }
}
