package io.dataquest.sniff;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import io.dataquest.table.Table;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Shapes parsed JSON documents into tables.
 * <ul>
 *   <li>array of objects: one row per element, nested objects flattened to dotted names ({@code a.b});</li>
 *   <li>object holding arrays: row {@code i} takes element {@code i} of every array (null once an array is
 *       exhausted) and the same value of every non-array field;</li>
 *   <li>any other object: a single row.</li>
 * </ul>
 */
public final class JsonTables {
    static final ObjectMapper MAPPER = JsonMapper.builder()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .enable(JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS)
            .build();

    private JsonTables() {}

    /** Reads exactly one JSON document; empty input and trailing content are errors. */
    public static JsonNode read(String text) throws JsonProcessingException {
        JsonNode node = MAPPER.readTree(text);
        if (node == null || node.isMissingNode()) {
            throw new IllegalArgumentException("no JSON document in input");
        }
        return node;
    }

    public static Table toTable(JsonNode node) {
        if (node.isArray()) return Table.fromRows(rowsOf(node));
        if (node.isObject()) return objectToTable(node);
        throw new IllegalArgumentException("top-level JSON " + node.getNodeType() + " is not tabular");
    }

    /** Rows contributed by one document: an object is one row, an array contributes each object element. */
    static List<Map<String, Object>> rowsOf(JsonNode node) {
        List<Map<String, Object>> rows = new ArrayList<>();
        if (node.isObject()) {
            rows.add(flatten(node));
        } else if (node.isArray()) {
            int i = 0;
            for (JsonNode el : node) {
                if (!el.isObject()) {
                    throw new IllegalArgumentException("array element " + i + " is " + el.getNodeType() + ", expected an object");
                }
                rows.add(flatten(el));
                i++;
            }
        } else {
            throw new IllegalArgumentException("JSON " + node.getNodeType() + " is not a record");
        }
        return rows;
    }

    private static Table objectToTable(JsonNode obj) {
        int longest = -1;
        for (JsonNode v : obj) {
            if (v.isArray()) longest = Math.max(longest, v.size());
        }
        List<String> columns = new ArrayList<>();
        obj.fieldNames().forEachRemaining(columns::add);
        List<Map<String, Object>> rows = new ArrayList<>();
        if (longest < 0) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (String c : columns) row.put(c, toCell(obj.get(c)));
            rows.add(row);
            return Table.of(columns, rows);
        }
        for (int i = 0; i < longest; i++) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (String c : columns) {
                JsonNode v = obj.get(c);
                if (v.isArray()) {
                    row.put(c, i < v.size() ? toCell(v.get(i)) : null);
                } else {
                    row.put(c, toCell(v));
                }
            }
            rows.add(row);
        }
        return Table.of(columns, rows);
    }

    /** Flattens nested objects into dotted column names; arrays stay as list cells. */
    public static Map<String, Object> flatten(JsonNode obj) {
        Map<String, Object> out = new LinkedHashMap<>();
        flattenInto("", obj, out);
        return out;
    }

    /** Same as {@link #flatten(JsonNode)} for a map cell that came out of an earlier parse. */
    public static Map<String, Object> flattenCell(Map<?, ?> cell) {
        JsonNode node = MAPPER.valueToTree(cell);
        return flatten(node);
    }

    private static void flattenInto(String prefix, JsonNode obj, Map<String, Object> out) {
        Iterator<Map.Entry<String, JsonNode>> it = obj.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            JsonNode v = e.getValue();
            if (v.isObject() && v.size() > 0) {
                flattenInto(prefix + e.getKey() + ".", v, out);
            } else {
                out.put(prefix + e.getKey(), toCell(v));
            }
        }
    }

    static Object toCell(JsonNode v) {
        if (v == null || v.isNull() || v.isMissingNode()) return null;
        if (v.isTextual()) return v.asText();
        if (v.isBoolean()) return v.booleanValue();
        if (v.isIntegralNumber()) return v.canConvertToLong() ? (Object) v.longValue() : v.bigIntegerValue();
        if (v.isNumber()) return v.doubleValue();
        return MAPPER.convertValue(v, Object.class);
    }
}
