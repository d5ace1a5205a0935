package io.dataquest.core;

import java.util.Objects;

/**
 * Carries a payload through the ingestion stages together with its provenance: the order in which the
 * source produced it and the logical key (object key or artifact name) it belongs to.
 */
public final class Record<T> {
    private final long seq; // assigned by the source, increasing
    private final String key;
    private final T payload;

    public Record(long seq, String key, T payload) {
        this.seq = seq;
        this.key = Objects.requireNonNull(key, "key");
        this.payload = payload;
    }

    public long seq() { return seq; }
    public String key() { return key; }
    public T payload() { return payload; }

    /** Same provenance, new payload. Stages use this so the source key survives every hop. */
    public <R> Record<R> withPayload(R next) {
        return new Record<>(seq, key, next);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Record<?> that)) return false;
        return seq == that.seq && key.equals(that.key) && Objects.equals(payload, that.payload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(seq, key, payload);
    }

    @Override
    public String toString() {
        return "Record{" +
                "seq=" + seq +
                ", key=" + key +
                ", payload=" + payload +
                '}';
    }
}
