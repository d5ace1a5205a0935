package io.dataquest.normalize;

import io.dataquest.table.Table;
import net.jqwik.api.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SchemaNormalizerPropertyTest {
    private static final SchemaProfile PROFILE = SchemaProfile.builder("population")
            .aliases(AliasTable.builder().put("year", "year", "yr").put("population", "population", "pop").build())
            .targets("year", "population")
            .numeric("population")
            .year("year")
            .filter("Nation", "united states")
            .build();

    @Provide
    Arbitrary<Table> messyTables() {
        Arbitrary<String> cells = Arbitraries.of(" 2013 ", "2014.0", "2015.5", "x", "", "316128839", " United States", "canada", "1e3")
                .injectNull(0.1);
        Arbitrary<Map<String, Object>> rows = Combinators.combine(cells, cells, cells, cells).as((y, p, n, o) -> {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put(" Yr ", y);
            row.put("POP", p);
            row.put("nation", n);
            row.put("other ", o);
            return row;
        });
        return rows.list().ofMaxSize(20).map(Table::fromRows);
    }

    @Property(tries = 200)
    void normalizing_is_idempotent(@ForAll("messyTables") Table raw) {
        Assume.that(!raw.isEmpty());
        var normalizer = new SchemaNormalizer(PROFILE);
        Table once = normalizer.normalize(raw);
        assertEquals(once, normalizer.normalize(once));
        assertEquals(List.of("year", "population", "nation", "other"), once.columns());
    }
}
