package org.relaypad.chain.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.relaypad.chain.cost.LayerEvaluationMode;
import org.relaypad.chain.cost.TransitionCostException;
import org.relaypad.core.id.SymbolIndex;
import org.relaypad.keypad.KeypadLayout;
import org.relaypad.keypad.KeypadLayoutCatalog;
import org.relaypad.keypad.KeypadLayouts;
import org.relaypad.testutil.KeypadChainSimulator;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ChainCore Tests")
class ChainCoreTest {

    private static ChainRequest request(String target, int depth) {
        return ChainRequest.builder().targetSequence(target).depth(depth).build();
    }

    @Test
    @DisplayName("Press counts for the reference door codes")
    void testReferencePressCounts() {
        ChainCore core = ChainCore.defaultCore();

        ChainResponse response = core.pressCount(request("029A", 3));
        assertEquals("029A", response.getTargetSequence());
        assertEquals(3, response.getDepth());
        assertEquals(68L, response.getPressCount());

        assertEquals(60L, core.pressCount(request("980A", 3)).getPressCount());
        assertEquals(4L, core.pressCount(request("179A", 0)).getPressCount());
        assertEquals(82050061710L, core.pressCount(request("029A", 26)).getPressCount());
    }

    @Test
    @DisplayName("Directional prefix is retained and reused across depths")
    void testDirectionalPrefixRetention() {
        ChainCore core = ChainCore.defaultCore();
        assertEquals(0, core.retainedDirectionalLayers());

        core.pressCount(request("029A", 0));
        core.pressCount(request("029A", 1));
        assertEquals(0, core.retainedDirectionalLayers());

        long deep = core.pressCount(request("029A", 6)).getPressCount();
        assertEquals(5, core.retainedDirectionalLayers());

        long shallow = core.pressCount(request("029A", 3)).getPressCount();
        assertEquals(5, core.retainedDirectionalLayers());
        assertEquals(68L, shallow);
        assertEquals(ChainCore.defaultCore().pressCount(request("029A", 6)).getPressCount(), deep);
        assertSame(core.table(4).layer(2), core.table(6).layer(2));
    }

    @Test
    @DisplayName("Explain returns a replayable minimal press sequence")
    void testExplain() {
        ChainCore core = ChainCore.defaultCore();
        PressPlan plan = core.explain(request("379A", 3));

        assertEquals("379A", plan.targetSequence());
        assertEquals(3, plan.depth());
        assertEquals(64L, plan.pressCount());
        assertEquals(64, plan.bottomPresses().length());
        assertEquals("379A", KeypadChainSimulator.replay(plan.bottomPresses(), 3));
    }

    @Test
    @DisplayName("Explain refuses expansions beyond the configured limit")
    void testExplainLimit() {
        ChainCore core = ChainCore.builder()
                .runtimeConfig(ChainRuntimeConfig.defaultRuntime().toBuilder().maxExplainPresses(100L).build())
                .build();

        assertEquals(68L, core.explain(request("029A", 3)).pressCount());
        ChainCoreException ex = assertThrows(ChainCoreException.class, () -> core.explain(request("029A", 4)));
        assertEquals(ChainCore.REASON_EXPLAIN_LIMIT_EXCEEDED, ex.reasonCode());
    }

    @Test
    @DisplayName("Request validation uses stable reason codes")
    void testRequestValidation() {
        ChainCore core = ChainCore.defaultCore();

        ChainCoreException nullRequest = assertThrows(ChainCoreException.class, () -> core.pressCount(null));
        assertEquals(ChainCore.REASON_REQUEST_REQUIRED, nullRequest.reasonCode());

        ChainCoreException nullTarget = assertThrows(ChainCoreException.class, () -> core.pressCount(request(null, 2)));
        assertEquals(ChainCore.REASON_TARGET_REQUIRED, nullTarget.reasonCode());

        ChainCoreException negativeDepth = assertThrows(ChainCoreException.class, () -> core.explain(request("0A", -1)));
        assertEquals(ChainCore.REASON_INVALID_DEPTH, negativeDepth.reasonCode());
        assertTrue(negativeDepth.getMessage().startsWith("[" + ChainCore.REASON_INVALID_DEPTH + "]"));

        assertThrows(ChainCoreException.class, () -> core.table(-3));
    }

    @Test
    @DisplayName("Unknown symbols propagate unchanged")
    void testUnknownSymbolPropagates() {
        ChainCore core = ChainCore.defaultCore();
        assertThrows(SymbolIndex.UnknownSymbolException.class, () -> core.pressCount(request("12X", 3)));
        assertThrows(SymbolIndex.UnknownSymbolException.class, () -> core.pressCount(request("v", 0)));
    }

    @Test
    @DisplayName("Overflow surfaces as a cost failure")
    void testOverflowPropagates() {
        ChainCore core = ChainCore.defaultCore();
        TransitionCostException ex = assertThrows(TransitionCostException.class, () -> core.pressCount(request("029A", 64)));
        assertEquals(TransitionCostException.REASON_PRESS_COUNT_OVERFLOW, ex.reasonCode());
    }

    @Test
    @DisplayName("Maximum depth overflows without corrupting the retained prefix")
    void testMaximumDepthOverflow() {
        ChainCore core = ChainCore.defaultCore();
        TransitionCostException ex = assertThrows(TransitionCostException.class,
                () -> core.pressCount(request("029A", Integer.MAX_VALUE)));
        assertEquals(TransitionCostException.REASON_PRESS_COUNT_OVERFLOW, ex.reasonCode());
        assertEquals(0, core.retainedDirectionalLayers());
        assertEquals(68L, core.pressCount(request("029A", 3)).getPressCount());
    }

    @Test
    @DisplayName("Runtime config binds keypads by catalog id")
    void testRuntimeBinding() {
        ChainCoreException unknown = assertThrows(ChainCoreException.class, () -> ChainCore.builder()
                .runtimeConfig(ChainRuntimeConfig.defaultRuntime().toBuilder().numericLayoutId("MISSING").build())
                .build());
        assertEquals(ChainCore.REASON_UNKNOWN_LAYOUT, unknown.reasonCode());

        ChainCoreException badLimit = assertThrows(ChainCoreException.class, () -> ChainCore.builder()
                .runtimeConfig(ChainRuntimeConfig.defaultRuntime().toBuilder().maxExplainPresses(0L).build())
                .build());
        assertEquals(ChainCore.REASON_INVALID_CONFIG, badLimit.reasonCode());

        KeypadLayout phone = KeypadLayout.fromRows("PHONE", List.of("123", "456", "789", " 0A"));
        ChainCore phoneCore = ChainCore.builder()
                .runtimeConfig(ChainRuntimeConfig.defaultRuntime().toBuilder().numericLayoutId("PHONE").build())
                .layoutCatalog(new KeypadLayoutCatalog(List.of(phone)))
                .build();
        // 1 and 7 swap rows, so the press count differs from the calculator keypad at depth 1.
        assertEquals(4L, phoneCore.pressCount(request("0A", 1)).getPressCount());
        assertEquals(
                ChainCore.defaultCore().pressCount(request("7A", 1)).getPressCount(),
                phoneCore.pressCount(request("1A", 1)).getPressCount()
        );
        assertSame(phone, phoneCore.table(2).targetLayout());
    }

    @Test
    @DisplayName("Parallel runtime agrees with the sequential runtime")
    void testParallelRuntime() {
        ChainCore sequential = ChainCore.defaultCore();
        ChainCore parallel = ChainCore.builder().runtimeConfig(ChainRuntimeConfig.parallelRuntime()).build();
        assertEquals(LayerEvaluationMode.PARALLEL, parallel.runtimeConfig().getLayerEvaluationMode());
        for (int depth = 0; depth <= 25; depth += 5) {
            assertEquals(sequential.table(depth), parallel.table(depth));
        }
    }

    @Test
    @DisplayName("Concurrent callers observe identical results")
    void testConcurrentCallers() throws Exception {
        ChainCore core = ChainCore.defaultCore();
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Callable<Long>> tasks = new ArrayList<>();
            for (int i = 0; i < 32; i++) {
                int depth = 1 + (i % 26);
                tasks.add(() -> core.pressCount(request("179A", depth)).getPressCount());
            }
            List<Future<Long>> futures = pool.invokeAll(tasks);
            ChainCore reference = ChainCore.defaultCore();
            for (int i = 0; i < futures.size(); i++) {
                int depth = 1 + (i % 26);
                assertEquals(reference.pressCount(request("179A", depth)).getPressCount(), futures.get(i).get().longValue());
            }
            assertEquals(25, core.retainedDirectionalLayers());
        } finally {
            pool.shutdown();
            assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));
        }
    }

    @Test
    @DisplayName("Default runtime binds the two fixed keypads")
    void testDefaultRuntime() {
        ChainRuntimeConfig config = ChainRuntimeConfig.defaultRuntime();
        assertEquals(KeypadLayouts.DIRECTIONAL_ID, config.getDirectionalLayoutId());
        assertEquals(KeypadLayouts.NUMERIC_ID, config.getNumericLayoutId());
        assertEquals(LayerEvaluationMode.SEQUENTIAL, config.getLayerEvaluationMode());
        assertEquals(ChainRuntimeConfig.DEFAULT_MAX_EXPLAIN_PRESSES, config.getMaxExplainPresses());
    }
}
