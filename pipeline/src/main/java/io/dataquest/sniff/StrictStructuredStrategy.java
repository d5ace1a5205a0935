package io.dataquest.sniff;

import io.dataquest.table.Table;

/**
 * The whole text is a single JSON document.
 */
public class StrictStructuredStrategy implements ParseStrategy {
    @Override
    public String name() { return "json"; }

    @Override
    public Table parse(String text) throws Exception {
        return JsonTables.toTable(JsonTables.read(text));
    }
}
