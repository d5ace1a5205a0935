package io.dataquest.sink;

import io.dataquest.core.Record;
import io.dataquest.error.DeadLetterSink;
import io.dataquest.error.TransferException;
import io.dataquest.metrics.Metrics;
import io.dataquest.store.ObjectStore;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ObjectStoreSinkTest {
    /** Accepts every key except the ones listed as refused. */
    static class FlakyStore implements ObjectStore {
        final Map<String, byte[]> objects = new HashMap<>();
        final List<String> refused;

        FlakyStore(List<String> refused) { this.refused = refused; }

        @Override
        public byte[] fetch(String bucket, String key) {
            byte[] b = objects.get(key);
            if (b == null) throw new TransferException(bucket, key, "object not found");
            return b;
        }

        @Override
        public void store(String bucket, String key, byte[] data) {
            if (refused.contains(key)) throw new TransferException(bucket, key, "access denied");
            objects.put(key, data);
        }

        @Override
        public List<String> list(String bucket) { return List.copyOf(objects.keySet()); }
    }

    @Test
    void uploads_under_prefix() throws Exception {
        var store = new FlakyStore(List.of());
        var metrics = Metrics.detached();
        var sink = new ObjectStoreSink(store, "quest", "results/", null, metrics);
        sink.accept(new Record<>(0, "a.csv", new byte[]{1}));
        assertArrayEquals(new byte[]{1}, store.objects.get("results/a.csv"));
        assertEquals(List.of("results/a.csv"), sink.uploaded());
        assertEquals(1, metrics.count("store.uploads"));
    }

    @Test
    void failed_upload_is_dead_lettered_and_the_next_one_still_runs() throws Exception {
        var store = new FlakyStore(List.of("results/a.csv"));
        var metrics = Metrics.detached();
        List<String> dead = new ArrayList<>();
        DeadLetterSink<byte[]> dlq = (stage, r, e) -> dead.add(stage + ":" + r.key() + ":" + e.getMessage());
        var sink = new ObjectStoreSink(store, "quest", "results/", dlq, metrics);
        sink.accept(new Record<>(0, "a.csv", new byte[]{1}));
        sink.accept(new Record<>(1, "b.csv", new byte[]{2}));
        assertEquals(List.of("results/a.csv"), sink.failed());
        assertEquals(List.of("results/b.csv"), sink.uploaded());
        assertEquals(List.of("store:a.csv:access denied (quest/results/a.csv)"), dead);
        assertEquals(1, metrics.count("store.failures"));
    }
}
