package io.dataquest.transform;

import io.dataquest.core.Record;
import io.dataquest.core.Transform;
import io.dataquest.metrics.Metrics;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TransformChainTest {
    @Test
    void applies_stages_in_order_and_keeps_provenance() throws Exception {
        var metrics = Metrics.detached();
        Transform<String, String> stage1 = r -> r.withPayload(r.payload() + "A");
        Transform<String, Integer> stage2 = r -> r.withPayload((r.payload() + "B").length());
        TransformChain<String, Integer> chain = TransformChain.<String>start("demo", metrics)
                .then("append", stage1)
                .then("length", stage2);
        Record<Integer> out = chain.apply(new Record<>(42, "k", "xy"));
        assertEquals(42, out.seq());
        assertEquals("k", out.key());
        assertEquals(4, out.payload());
        assertEquals(List.of("append", "length"), chain.stageNames());
        assertEquals(1, metrics.registry().timer("stage.demo.append.time").getCount());
        assertEquals(1, metrics.registry().timer("stage.demo.length.time").getCount());
    }

    @Test
    void empty_chain_passes_through() throws Exception {
        var chain = TransformChain.<String>start("noop", Metrics.detached());
        assertEquals("x", chain.apply(new Record<>(0, "k", "x")).payload());
    }

    @Test
    void stage_failure_propagates() {
        Transform<String, String> boom = r -> { throw new IllegalStateException("boom"); };
        var chain = TransformChain.<String>start("fail", Metrics.detached()).then("boom", boom);
        assertThrows(IllegalStateException.class, () -> chain.apply(new Record<>(0, "k", "x")));
    }
}
