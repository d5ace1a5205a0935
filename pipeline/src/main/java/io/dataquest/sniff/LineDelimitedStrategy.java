package io.dataquest.sniff;

import io.dataquest.table.Table;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * One JSON document per non-blank line (JSON Lines). Every line must parse; one bad line fails the lot.
 */
public class LineDelimitedStrategy implements ParseStrategy {
    @Override
    public String name() { return "json-lines"; }

    /** Only worth trying when there is more than one line to read. */
    @Override
    public boolean accepts(String text) {
        return nonBlankLines(text).size() > 1;
    }

    @Override
    public Table parse(String text) throws Exception {
        List<String> lines = nonBlankLines(text);
        List<Map<String, Object>> rows = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            try {
                rows.addAll(JsonTables.rowsOf(JsonTables.read(lines.get(i))));
            } catch (Exception e) {
                throw new IllegalArgumentException("line " + (i + 1) + ": " + e.getMessage(), e);
            }
        }
        return Table.fromRows(rows);
    }

    static List<String> nonBlankLines(String text) {
        List<String> out = new ArrayList<>();
        for (String ln : text.split("\\R")) {
            String t = ln.strip();
            if (!t.isEmpty()) out.add(t);
        }
        return out;
    }
}
