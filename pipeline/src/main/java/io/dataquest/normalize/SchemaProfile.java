package io.dataquest.normalize;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * What one source must look like after normalization, and how to get it there.
 *
 * @param name           label used in logs and metric names
 * @param aliases        accepted spellings per canonical column
 * @param targetColumns  columns that must exist afterwards
 * @param numericColumns columns coerced to Double
 * @param yearColumn     column coerced to Integer, or null
 * @param filters        candidate row filters; the first whose column exists is applied
 * @param envelopeColumn column whose cells hold the real rows, or null
 */
public record SchemaProfile(
        String name,
        AliasTable aliases,
        List<String> targetColumns,
        List<String> numericColumns,
        String yearColumn,
        List<CategoricalFilter> filters,
        String envelopeColumn
) {
    public SchemaProfile {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(aliases, "aliases");
        targetColumns = List.copyOf(targetColumns);
        numericColumns = List.copyOf(numericColumns);
        filters = List.copyOf(filters);
    }

    public static Builder builder(String name) { return new Builder(name); }

    public static final class Builder {
        private final String name;
        private AliasTable aliases = AliasTable.builder().build();
        private List<String> targets = List.of();
        private List<String> numeric = List.of();
        private String year;
        private final List<CategoricalFilter> filters = new ArrayList<>();
        private String envelope;

        private Builder(String name) { this.name = name; }

        public Builder aliases(AliasTable a) { this.aliases = a; return this; }
        public Builder targets(String... cols) { this.targets = List.of(cols); return this; }
        public Builder numeric(String... cols) { this.numeric = List.of(cols); return this; }
        public Builder year(String col) { this.year = col; return this; }
        public Builder filter(String column, String expected) { this.filters.add(new CategoricalFilter(column, expected)); return this; }
        public Builder envelope(String col) { this.envelope = col; return this; }

        public SchemaProfile build() {
            return new SchemaProfile(name, aliases, targets, numeric, year, filters, envelope);
        }
    }
}
