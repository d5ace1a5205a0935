package io.dataquest.error;

import io.dataquest.core.Record;

/**
 * Receives records a best-effort stage gave up on, together with the failure.
 */
public interface DeadLetterSink<T> extends AutoCloseable {
    void acceptFailure(String stage, Record<T> record, Exception e);

    @Override default void close() {}
}
