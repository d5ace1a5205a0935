package io.dataquest.sniff;

import io.dataquest.table.Table;

/**
 * One way of reading an unknown text as a table. {@link FormatSniffer} tries strategies in a fixed order
 * and keeps the first table produced.
 */
public interface ParseStrategy {
    /** Short name used in logs, metrics and failure reports. */
    String name();

    /** Cheap precondition; a strategy that does not accept the text is skipped, not counted as failed. */
    default boolean accepts(String text) { return true; }

    /** Parse the whole text or throw; never returns a partial table. */
    Table parse(String text) throws Exception;
}
