package io.dataquest.normalize;

import io.dataquest.error.MissingRequiredColumnException;
import io.dataquest.metrics.Metrics;
import io.dataquest.table.Table;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class SchemaNormalizerTest {
    private static final AliasTable SERIES_ALIASES = AliasTable.builder()
            .put("series_id", "series_id", "seriesid", "series")
            .put("year", "year", "yr")
            .put("value", "value", "val", "amount")
            .build();

    private static final SchemaProfile SERIES = SchemaProfile.builder("series")
            .aliases(SERIES_ALIASES)
            .targets("series_id", "year", "value")
            .numeric("value")
            .year("year")
            .build();

    private static final SchemaProfile POPULATION = SchemaProfile.builder("population")
            .aliases(AliasTable.builder().put("year", "year", "yr").put("population", "population", "pop").build())
            .targets("year", "population")
            .numeric("population")
            .year("year")
            .filter("Nation", "united states")
            .filter("Nation ID", "01000US")
            .envelope("data")
            .build();

    private static Map<String, Object> row(Object... kv) {
        Map<String, Object> m = new LinkedHashMap<>();
        for (int i = 0; i < kv.length; i += 2) m.put((String) kv[i], kv[i + 1]);
        return m;
    }

    @Test
    void trims_names_resolves_aliases_and_coerces() {
        Table raw = Table.fromRows(List.of(
                row("SeriesID   ", " PRS30006011 ", "  YR", "1995", "Amount", "  2.6"),
                row("SeriesID   ", "PRS30006011", "  YR", "1996", "Amount", "-")));
        var metrics = Metrics.detached();
        Table t = new SchemaNormalizer(SERIES, metrics).normalize(raw);
        assertEquals(List.of("series_id", "year", "value"), t.columns());
        assertEquals("PRS30006011", t.rows().get(0).get("series_id"));
        assertEquals(1995, t.rows().get(0).get("year"));
        assertEquals(2.6, t.rows().get(0).get("value"));
        assertNull(t.rows().get(1).get("value"));
        assertEquals(1, metrics.count("normalize.series.value.nulled"));
    }

    @Test
    void verbatim_target_is_kept_over_aliases() {
        Table raw = Table.fromRows(List.of(row("series", "A", "series_id", "B", "year", 2000, "value", 1)));
        Table t = new SchemaNormalizer(SERIES).normalize(raw);
        assertEquals("B", t.rows().get(0).get("series_id"));
        assertEquals("A", t.rows().get(0).get("series"));
    }

    @Test
    void missing_target_lists_missing_and_resolved_columns() {
        Table raw = Table.fromRows(List.of(row("series_id", "A", "when", 2000, "value", 1)));
        var e = assertThrows(MissingRequiredColumnException.class, () -> new SchemaNormalizer(SERIES).normalize("ts.txt", raw));
        assertEquals(List.of("year"), e.missing());
        assertEquals(List.of("series_id", "when", "value"), e.resolvedColumns());
        assertEquals("ts.txt", e.sourceKey());
    }

    @Test
    void first_available_filter_column_applies() {
        Table raw = Table.fromRows(List.of(
                row("Nation", " United States ", "Year", "2013", "Population", 316128839L),
                row("Nation", "Canada", "Year", "2013", "Population", 35000000L)));
        Table t = new SchemaNormalizer(POPULATION).normalize(raw);
        assertEquals(1, t.size());
        assertEquals(316128839.0, t.rows().get(0).get("population"));
    }

    @Test
    void falls_back_to_second_filter_column() {
        Table raw = Table.fromRows(List.of(
                row("nation id", "01000US", "year", 2014, "pop", 318857056L),
                row("nation id", "04000US06", "year", 2014, "pop", 38000000L)));
        Table t = new SchemaNormalizer(POPULATION).normalize(raw);
        assertEquals(1, t.size());
        assertEquals(2014, t.rows().get(0).get("year"));
    }

    @Test
    void no_filter_column_keeps_every_row() {
        Table raw = Table.fromRows(List.of(row("year", 2013, "population", 1), row("year", 2014, "population", 2)));
        assertEquals(2, new SchemaNormalizer(POPULATION).normalize(raw).size());
    }

    @Test
    void envelope_cells_become_rows() {
        Map<String, Object> us2013 = row("Nation", "United States", "Year", "2013", "Population", 316128839L, "Meta", Map.of("slug", "us"));
        Map<String, Object> us2014 = row("Nation", "United States", "Year", "2014", "Population", 318857056L, "Meta", Map.of("slug", "us"));
        Table wrapped = Table.fromRows(List.of(
                row("data", us2013, "source", Map.of("name", "acs")),
                row("data", us2014, "source", null)));
        Table t = new SchemaNormalizer(POPULATION).normalize(wrapped);
        assertEquals(List.of("Nation", "year", "population", "Meta.slug"), t.columns());
        assertEquals(Arrays.asList(2013, 2014), t.column("year"));
    }

    @Test
    void envelope_list_cell_contributes_each_element() {
        Table wrapped = Table.fromRows(List.of(row("data", List.of(
                row("Year", 2015, "Population", 1L),
                row("Year", 2016, "Population", 2L)))));
        Table t = new SchemaNormalizer(POPULATION).normalize(wrapped);
        assertEquals(2, t.size());
        assertEquals(Arrays.asList(1.0, 2.0), t.column("population"));
    }

    @Test
    void non_year_values_become_null_without_failing() {
        Table raw = Table.fromRows(List.of(row("year", "2015.5", "population", "abc")));
        Table t = new SchemaNormalizer(POPULATION).normalize(raw);
        assertNull(t.rows().get(0).get("year"));
        assertNull(t.rows().get(0).get("population"));
    }

    @Test
    void normalizing_twice_changes_nothing() {
        Table raw = Table.fromRows(List.of(
                row(" Nation ", "united states", "YR", " 2013 ", "Pop", "316128839"),
                row(" Nation ", "Mexico", "YR", "2013", "Pop", "1")));
        var normalizer = new SchemaNormalizer(POPULATION);
        Table once = normalizer.normalize(raw);
        assertEquals(once, normalizer.normalize(once));
    }

    @Test
    void names_colliding_after_trim_get_a_suffix() {
        Table raw = Table.fromRows(List.of(row("year", "2013", "population", "1", "population ", "2")));
        var normalizer = new SchemaNormalizer(POPULATION);
        Table t = normalizer.normalize(raw);
        assertEquals(List.of("year", "population", "population.1"), t.columns());
        assertEquals(1.0, t.rows().get(0).get("population"));
        assertEquals("2", t.rows().get(0).get("population.1"));
        assertEquals(t, normalizer.normalize(t));
    }
}
