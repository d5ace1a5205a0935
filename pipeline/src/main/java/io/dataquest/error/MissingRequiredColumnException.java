package io.dataquest.error;

import java.util.List;

/**
 * Normalization left one or more required canonical columns unresolved.
 */
public class MissingRequiredColumnException extends IngestException {
    private final String sourceKey;
    private final List<String> missing;
    private final List<String> resolvedColumns;

    public MissingRequiredColumnException(String sourceKey, List<String> missing, List<String> resolvedColumns) {
        super(sourceKey + " must contain " + missing + " after normalization. Found: " + resolvedColumns);
        this.sourceKey = sourceKey;
        this.missing = List.copyOf(missing);
        this.resolvedColumns = List.copyOf(resolvedColumns);
    }

    public String sourceKey() { return sourceKey; }
    public List<String> missing() { return missing; }
    public List<String> resolvedColumns() { return resolvedColumns; }
}
