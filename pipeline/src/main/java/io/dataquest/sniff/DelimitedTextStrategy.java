package io.dataquest.sniff;

import io.dataquest.table.Table;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Character-delimited text with a header line.
 * <p>
 * Two policies exist. {@link #sniffing()} tries an auto-detected delimiter, then comma, tab, pipe and
 * semicolon, keeping the first one that gives every sampled record the same number of fields (at least two).
 * {@link #commaGuarded(int)} only runs when the first sampled lines all carry the same, sufficiently large
 * number of commas, which keeps JSON-looking text from being misread as CSV.
 * <p>
 * Header names that are empty become {@code Unnamed: <index>}; repeated names get {@code .1}, {@code .2}
 * suffixes. The usual NA spellings read as null.
 */
public final class DelimitedTextStrategy implements ParseStrategy {
    static final int SAMPLE_LINES = 20;
    static final List<Character> DETECTABLE = List.of(',', '\t', '|', ';', ':');
    static final Set<String> NA_TOKENS = Set.of(
            "", "#N/A", "#N/A N/A", "#NA", "-1.#IND", "-1.#QNAN", "-NaN", "-nan", "1.#IND", "1.#QNAN",
            "<NA>", "N/A", "NA", "NULL", "NaN", "None", "n/a", "nan", "null");

    private final boolean autoDetect;
    private final List<Character> delimiters;
    private final int minUniformCommas; // 0 disables the guard

    private DelimitedTextStrategy(boolean autoDetect, List<Character> delimiters, int minUniformCommas) {
        this.autoDetect = autoDetect;
        this.delimiters = List.copyOf(delimiters);
        this.minUniformCommas = minUniformCommas;
    }

    public static DelimitedTextStrategy sniffing() {
        return new DelimitedTextStrategy(true, List.of(',', '\t', '|', ';'), 0);
    }

    public static DelimitedTextStrategy commaGuarded(int minCommas) {
        return new DelimitedTextStrategy(false, List.of(','), Math.max(1, minCommas));
    }

    @Override
    public String name() { return "delimited"; }

    @Override
    public boolean accepts(String text) {
        if (text.isBlank()) return false;
        if (minUniformCommas == 0) return true;
        Set<Long> counts = new HashSet<>();
        for (String ln : sample(text)) counts.add(ln.chars().filter(ch -> ch == ',').count());
        return counts.size() == 1 && counts.iterator().next() >= minUniformCommas;
    }

    @Override
    public Table parse(String text) {
        LinkedHashSet<Character> order = new LinkedHashSet<>();
        if (autoDetect) detect(text).ifPresent(order::add);
        order.addAll(delimiters);
        Map<String, String> failures = new LinkedHashMap<>();
        for (char d : order) {
            try {
                return parseWith(text, d);
            } catch (Exception e) {
                failures.put(display(d), e.getMessage());
            }
        }
        throw new IllegalArgumentException("no delimiter gave a consistent table: " + failures);
    }

    /**
     * The detectable delimiter that occurs the same non-zero number of times on every sampled line; the
     * highest such count wins, then the earlier candidate.
     */
    static Optional<Character> detect(String text) {
        List<String> lines = sample(text);
        if (lines.isEmpty()) return Optional.empty();
        Character best = null;
        long bestCount = 0;
        for (char c : DETECTABLE) {
            long first = countOutsideQuotes(lines.get(0), c);
            if (first == 0) continue;
            boolean uniform = true;
            for (String ln : lines) {
                if (countOutsideQuotes(ln, c) != first) { uniform = false; break; }
            }
            if (uniform && first > bestCount) {
                best = c;
                bestCount = first;
            }
        }
        return Optional.ofNullable(best);
    }

    static Table parseWith(String text, char delimiter) throws Exception {
        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setDelimiter(delimiter)
                .setIgnoreEmptyLines(true)
                .build();
        List<CSVRecord> records;
        try (CSVParser parser = CSVParser.parse(text, format)) {
            records = parser.getRecords();
        }
        if (records.isEmpty()) throw new IllegalArgumentException("no records");
        List<String> header = headerNames(records.get(0));
        int width = header.size();
        if (width < 2) throw new IllegalArgumentException("only one column with delimiter " + display(delimiter));
        int sampled = Math.min(records.size(), SAMPLE_LINES);
        for (int i = 1; i < sampled; i++) {
            if (records.get(i).size() != width) {
                throw new IllegalArgumentException("record " + i + " has " + records.get(i).size() + " fields, header has " + width);
            }
        }
        List<Map<String, Object>> rows = new ArrayList<>(records.size() - 1);
        for (int i = 1; i < records.size(); i++) {
            CSVRecord rec = records.get(i);
            if (rec.size() > width) {
                throw new IllegalArgumentException("Expected " + width + " fields in line " + rec.getRecordNumber() + ", saw " + rec.size());
            }
            Map<String, Object> row = new LinkedHashMap<>();
            for (int c = 0; c < width; c++) {
                row.put(header.get(c), c < rec.size() ? na(rec.get(c)) : null);
            }
            rows.add(row);
        }
        return Table.of(header, rows);
    }

    private static List<String> headerNames(CSVRecord first) {
        List<String> names = new ArrayList<>(first.size());
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < first.size(); i++) {
            String base = first.get(i).isEmpty() ? "Unnamed: " + i : first.get(i);
            String name = base;
            for (int n = 1; !seen.add(name); n++) name = base + "." + n;
            names.add(name);
        }
        return names;
    }

    private static String na(String field) {
        return NA_TOKENS.contains(field) ? null : field;
    }

    private static List<String> sample(String text) {
        List<String> out = new ArrayList<>();
        for (String ln : text.strip().split("\\R")) {
            if (ln.isBlank()) continue;
            out.add(ln);
            if (out.size() == SAMPLE_LINES) break;
        }
        return out;
    }

    private static long countOutsideQuotes(String line, char c) {
        long n = 0;
        boolean quoted = false;
        for (int i = 0; i < line.length(); i++) {
            char ch = line.charAt(i);
            if (ch == '"') quoted = !quoted;
            else if (ch == c && !quoted) n++;
        }
        return n;
    }

    private static String display(char d) {
        return d == '\t' ? "\\t" : String.valueOf(d);
    }
}
