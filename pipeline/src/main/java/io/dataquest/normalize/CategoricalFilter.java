package io.dataquest.normalize;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Keep rows whose {@code column} equals {@code expected}, ignoring case and surrounding whitespace.
 */
public record CategoricalFilter(String column, String expected) {
    public CategoricalFilter {
        Objects.requireNonNull(column, "column");
        Objects.requireNonNull(expected, "expected");
    }

    public boolean matches(Object cell) {
        return cell != null && String.valueOf(cell).strip().equalsIgnoreCase(expected.strip());
    }

    /** Name of the table column this filter reads: an exact match first, otherwise one differing only in case. */
    public Optional<String> columnIn(List<String> columns) {
        if (columns.contains(column)) return Optional.of(column);
        String lower = column.toLowerCase(Locale.ROOT);
        return columns.stream().filter(c -> c.toLowerCase(Locale.ROOT).equals(lower)).findFirst();
    }

    @Override
    public String toString() { return column + " = '" + expected + "'"; }
}
