package io.dataquest.sink;

import io.dataquest.core.Record;
import io.dataquest.core.Sink;
import io.dataquest.error.DeadLetterSink;
import io.dataquest.error.TransferException;
import io.dataquest.metrics.Metrics;
import io.dataquest.store.ObjectStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Uploads each record under {@code <prefix><key>}. Best effort: a failed upload is logged, handed to the
 * dead-letter sink and counted, and the next record is still attempted.
 */
public class ObjectStoreSink implements Sink<byte[]> {
    private static final Logger log = LoggerFactory.getLogger(ObjectStoreSink.class);

    private final ObjectStore store;
    private final String bucket;
    private final String prefix;
    private final DeadLetterSink<byte[]> deadLetters;
    private final Metrics metrics;
    private final List<String> uploaded = new ArrayList<>();
    private final List<String> failed = new ArrayList<>();

    public ObjectStoreSink(ObjectStore store, String bucket, String prefix, DeadLetterSink<byte[]> deadLetters, Metrics metrics) {
        this.store = store;
        this.bucket = bucket;
        this.prefix = prefix == null ? "" : prefix;
        this.deadLetters = deadLetters;
        this.metrics = metrics;
    }

    @Override
    public void accept(Record<byte[]> record) {
        String key = prefix + record.key();
        try {
            store.store(bucket, key, record.payload());
            uploaded.add(key);
            metrics.counter("store.uploads").inc();
            log.info("Uploaded to {}/{}", bucket, key);
        } catch (TransferException e) {
            failed.add(key);
            metrics.counter("store.failures").inc();
            log.warn("Failed to upload {} to {}/{}: {}", record.key(), bucket, key, e.getMessage());
            if (deadLetters != null) deadLetters.acceptFailure("store", record, e);
        }
    }

    public List<String> uploaded() { return List.copyOf(uploaded); }
    public List<String> failed() { return List.copyOf(failed); }
}
