package io.dataquest.source;

import io.dataquest.core.Record;
import io.dataquest.core.Source;
import io.dataquest.error.TransferException;
import io.dataquest.store.ObjectStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Emits one record per configured key with the whole object as payload, in the order the keys were given.
 * A key that cannot be fetched fails the poll with {@link TransferException}; it is not skipped.
 */
public class ObjectStoreSource implements Source<byte[]> {
    private static final Logger log = LoggerFactory.getLogger(ObjectStoreSource.class);

    private final ObjectStore store;
    private final String bucket;
    private final List<String> keys;
    private int idx = 0;

    public ObjectStoreSource(ObjectStore store, String bucket, List<String> keys) {
        this.store = store;
        this.bucket = bucket;
        this.keys = List.copyOf(keys);
    }

    @Override
    public Optional<Record<byte[]>> poll() {
        if (idx >= keys.size()) return Optional.empty();
        String key = keys.get(idx);
        log.info("Fetching {}/{}", bucket, key);
        byte[] data = store.fetch(bucket, key);
        Record<byte[]> r = new Record<>(idx, key, data);
        idx++;
        return Optional.of(r);
    }

    @Override
    public boolean isFinished() {
        return idx >= keys.size();
    }
}
