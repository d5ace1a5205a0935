package io.dataquest.core;

/**
 * Transform converts one input record into one output record. Implementations keep the input's seq and key
 * (see {@link Record#withPayload(Object)}) so later stages can report where a payload came from.
 */
@FunctionalInterface
public interface Transform<I, O> {
    Record<O> apply(Record<I> input) throws Exception;
}
