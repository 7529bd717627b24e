package org.relaypad.chain.core;

/**
 * Explained response: one concrete minimal sequence of physical presses.
 *
 * @param targetSequence symbols typed on the numeric keypad.
 * @param depth number of indirection layers.
 * @param pressCount minimal press count; equals {@code bottomPresses.length()}.
 * @param bottomPresses presses of the physical hand, in order.
 */
public record PressPlan(String targetSequence, int depth, long pressCount, String bottomPresses) {
}
