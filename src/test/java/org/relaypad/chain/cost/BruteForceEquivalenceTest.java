package org.relaypad.chain.cost;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.relaypad.testutil.BruteForceExpansion;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Table recurrence vs. literal expansion")
class BruteForceEquivalenceTest {

    private final TransitionCostEngine engine = new TransitionCostEngine();

    @ParameterizedTest
    @ValueSource(strings = {"029A", "980A", "179A", "456A", "379A", "A", "0A", "1A", "7A", "3A", "147A", "70A"})
    @DisplayName("Interleaved move orders are never cheaper than the table cost for depths 0 to 3")
    void testTableMatchesBruteForce(String target) {
        for (int depth = 0; depth <= 3; depth++) {
            assertEquals(
                    BruteForceExpansion.minimalPresses(target, depth),
                    engine.pressCount(target, depth),
                    target + " at depth " + depth
            );
        }
    }

    @Test
    @DisplayName("Literal expansion enumerates interleaved paths and skips the gap")
    void testOracleEnumeratesInterleavedPaths() {
        List<String> paths = BruteForceExpansion.monotonePaths(List.of("789", "456", "123", " 0A"), 'A', '7');

        assertEquals(9, paths.size());
        assertTrue(paths.contains("^^^<<A"));
        assertTrue(paths.contains("<^<^^A"));
        assertFalse(paths.contains("<<^^^A"));
    }
}
