package io.dataquest.core;

import java.io.Closeable;
import java.util.Optional;

/**
 * A finite producer of records. Sources in this project are pulled synchronously: the caller polls until
 * {@link #isFinished()} and every poll either yields a record or fails.
 */
public interface Source<T> extends Closeable {
    /**
     * Produce the next record, or empty once the source is exhausted. Failures to obtain the underlying
     * data propagate as unchecked exceptions; a source never skips an item silently.
     */
    Optional<Record<T>> poll();

    boolean isFinished();

    @Override
    default void close() {}
}
