package io.dataquest.table;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Ordered rows of named cells. The column list is fixed when the table is built and every row carries every
 * column; a key a row did not supply holds {@code null}. Cells are whatever the producing parser yielded
 * (String, Number, Boolean, nested List or Map) or null.
 * <p>
 * Tables are immutable. Every operation returns a new table and leaves the receiver untouched.
 */
public final class Table {
    private final List<String> columns;
    private final List<Map<String, Object>> rows;

    private Table(List<String> columns, List<Map<String, Object>> rows) {
        this.columns = columns;
        this.rows = rows;
    }

    /**
     * Builds a table over the given columns. Row keys outside {@code columns} are rejected so the column set
     * cannot drift after construction.
     */
    public static Table of(List<String> columns, List<? extends Map<String, ?>> rows) {
        List<String> cols = List.copyOf(new LinkedHashSet<>(columns));
        Set<String> known = new LinkedHashSet<>(cols);
        List<Map<String, Object>> out = new ArrayList<>(rows.size());
        for (Map<String, ?> row : rows) {
            for (String k : row.keySet()) {
                if (!known.contains(k)) {
                    throw new IllegalArgumentException("row has column '" + k + "' not in " + cols);
                }
            }
            Map<String, Object> full = new LinkedHashMap<>();
            for (String c : cols) full.put(c, row.get(c));
            out.add(Collections.unmodifiableMap(full));
        }
        return new Table(cols, Collections.unmodifiableList(out));
    }

    /** Column set is the union of all row keys, in first-seen order. */
    public static Table fromRows(List<? extends Map<String, ?>> rows) {
        LinkedHashSet<String> cols = new LinkedHashSet<>();
        for (Map<String, ?> row : rows) cols.addAll(row.keySet());
        return of(new ArrayList<>(cols), rows);
    }

    public List<String> columns() { return columns; }
    public List<Map<String, Object>> rows() { return rows; }
    public int size() { return rows.size(); }
    public boolean isEmpty() { return rows.isEmpty(); }
    public boolean hasColumn(String name) { return columns.contains(name); }

    public List<Object> column(String name) {
        if (!hasColumn(name)) throw new IllegalArgumentException("no column '" + name + "' in " + columns);
        List<Object> out = new ArrayList<>(rows.size());
        for (Map<String, Object> r : rows) out.add(r.get(name));
        return out;
    }

    /**
     * Renames columns; names absent from {@code renames} keep their name. Two columns ending up with the same
     * name is an error rather than a silent overwrite.
     */
    public Table renameColumns(Map<String, String> renames) {
        if (renames.isEmpty()) return this;
        List<String> next = new ArrayList<>(columns.size());
        for (String c : columns) next.add(renames.getOrDefault(c, c));
        if (new LinkedHashSet<>(next).size() != next.size()) {
            throw new IllegalArgumentException("renaming " + renames + " makes column names collide: " + next);
        }
        List<Map<String, Object>> out = new ArrayList<>(rows.size());
        for (Map<String, Object> r : rows) {
            Map<String, Object> m = new LinkedHashMap<>();
            for (int i = 0; i < columns.size(); i++) m.put(next.get(i), r.get(columns.get(i)));
            out.add(m);
        }
        return of(next, out);
    }

    /** Applies {@code fn} to every cell of every column. */
    public Table mapCells(Function<Object, Object> fn) {
        List<Map<String, Object>> out = new ArrayList<>(rows.size());
        for (Map<String, Object> r : rows) {
            Map<String, Object> m = new LinkedHashMap<>();
            for (String c : columns) m.put(c, fn.apply(r.get(c)));
            out.add(m);
        }
        return of(columns, out);
    }

    /** Applies {@code fn} to the cells of one column. */
    public Table mapColumn(String name, Function<Object, Object> fn) {
        if (!hasColumn(name)) throw new IllegalArgumentException("no column '" + name + "' in " + columns);
        List<Map<String, Object>> out = new ArrayList<>(rows.size());
        for (Map<String, Object> r : rows) {
            Map<String, Object> m = new LinkedHashMap<>(r);
            m.put(name, fn.apply(r.get(name)));
            out.add(m);
        }
        return of(columns, out);
    }

    public Table filter(Predicate<Map<String, Object>> keep) {
        List<Map<String, Object>> out = new ArrayList<>();
        for (Map<String, Object> r : rows) {
            if (keep.test(r)) out.add(r);
        }
        return new Table(columns, Collections.unmodifiableList(out));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Table that)) return false;
        return columns.equals(that.columns) && rows.equals(that.rows);
    }

    @Override
    public int hashCode() {
        return Objects.hash(columns, rows);
    }

    @Override
    public String toString() {
        return "Table{columns=" + columns + ", rows=" + rows.size() + '}';
    }
}
