package io.dataquest.normalize;

import io.dataquest.core.Record;
import io.dataquest.core.Transform;
import io.dataquest.error.MissingRequiredColumnException;
import io.dataquest.metrics.Metrics;
import io.dataquest.sniff.JsonTables;
import io.dataquest.table.Table;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Brings a sniffed table to its canonical shape:
 * <ol>
 *   <li>unwrap the envelope column, if the profile names one and the table has it;</li>
 *   <li>trim column names;</li>
 *   <li>rename the first matching alias of every target column that is not already present;</li>
 *   <li>trim text cells;</li>
 *   <li>apply the first categorical filter whose column exists;</li>
 *   <li>coerce numeric columns to Double and the year column to Integer, unreadable cells becoming null;</li>
 *   <li>check every target column is present.</li>
 * </ol>
 * Running it over its own output changes nothing.
 */
public class SchemaNormalizer implements Transform<Table, Table> {
    private static final Logger log = LoggerFactory.getLogger(SchemaNormalizer.class);

    private final SchemaProfile profile;
    private final Metrics metrics;

    public SchemaNormalizer(SchemaProfile profile) { this(profile, Metrics.detached()); }

    public SchemaNormalizer(SchemaProfile profile, Metrics metrics) {
        this.profile = profile;
        this.metrics = metrics;
    }

    @Override
    public Record<Table> apply(Record<Table> input) {
        return input.withPayload(normalize(input.key(), input.payload()));
    }

    public Table normalize(Table table) {
        return normalize(profile.name(), table);
    }

    public Table normalize(String key, Table table) {
        Table t = unwrapEnvelope(key, table);
        t = trimColumnNames(t);
        t = resolveAliases(key, t);
        t = t.mapCells(Coercions::trimText);
        t = applyFilter(key, t);
        for (String col : profile.numericColumns()) {
            if (t.hasColumn(col)) t = coerce(t, col, Coercions::toDouble);
        }
        if (profile.yearColumn() != null && t.hasColumn(profile.yearColumn())) {
            t = coerce(t, profile.yearColumn(), Coercions::toYear);
        }
        List<String> missing = new ArrayList<>();
        for (String target : profile.targetColumns()) {
            if (!t.hasColumn(target)) missing.add(target);
        }
        if (!missing.isEmpty()) {
            log.warn("Columns of {} after normalization: {}", key, t.columns());
            throw new MissingRequiredColumnException(key, missing, t.columns());
        }
        return t;
    }

    private Table unwrapEnvelope(String key, Table t) {
        String env = profile.envelopeColumn();
        if (env == null || !t.hasColumn(env)) return t;
        List<Map<String, Object>> rows = new ArrayList<>();
        for (Object cell : t.column(env)) {
            if (cell == null) continue;
            if (cell instanceof Map<?, ?> m) {
                rows.add(JsonTables.flattenCell(m));
            } else if (cell instanceof List<?> items) {
                for (Object item : items) {
                    if (!(item instanceof Map<?, ?> m)) {
                        log.debug("Envelope column {} of {} holds non-object items; left as is", env, key);
                        return t;
                    }
                    rows.add(JsonTables.flattenCell(m));
                }
            } else {
                log.debug("Envelope column {} of {} holds {} cells; left as is", env, key, cell.getClass().getSimpleName());
                return t;
            }
        }
        Table unwrapped = Table.fromRows(rows);
        log.info("Unwrapped '{}' envelope of {}: {} rows, columns {}", env, key, unwrapped.size(), unwrapped.columns());
        return unwrapped;
    }

    /** A trimmed name that clashes with another column gets a {@code .1}, {@code .2} suffix. */
    private static Table trimColumnNames(Table t) {
        Set<String> taken = new HashSet<>();
        for (String c : t.columns()) {
            if (c.strip().equals(c)) taken.add(c);
        }
        Map<String, String> renames = new LinkedHashMap<>();
        for (String c : t.columns()) {
            String base = c.strip();
            if (base.equals(c)) continue;
            String name = base;
            for (int n = 1; !taken.add(name); n++) name = base + "." + n;
            renames.put(c, name);
        }
        return t.renameColumns(renames);
    }

    private Table resolveAliases(String key, Table t) {
        Map<String, String> renames = new LinkedHashMap<>();
        Set<String> unavailable = new HashSet<>(profile.targetColumns());
        for (String target : profile.targetColumns()) {
            if (t.hasColumn(target)) continue;
            Optional<String> hit = profile.aliases().resolve(target, t.columns(), unavailable);
            if (hit.isPresent()) {
                renames.put(hit.get(), target);
                unavailable.add(hit.get());
            }
        }
        if (!renames.isEmpty()) log.debug("Renaming columns of {}: {}", key, renames);
        return t.renameColumns(renames);
    }

    private Table applyFilter(String key, Table t) {
        for (CategoricalFilter f : profile.filters()) {
            Optional<String> col = f.columnIn(t.columns());
            if (col.isEmpty()) continue;
            String name = col.get();
            Table kept = t.filter(row -> f.matches(row.get(name)));
            log.info("Filtered {} on {}: kept {} of {} rows", key, f, kept.size(), t.size());
            return kept;
        }
        return t;
    }

    private Table coerce(Table t, String col, Function<Object, Object> fn) {
        String counter = "normalize." + profile.name() + "." + col + ".nulled";
        return t.mapColumn(col, cell -> {
            Object out = fn.apply(cell);
            if (out == null && cell != null) metrics.counter(counter).inc();
            return out;
        });
    }
}
