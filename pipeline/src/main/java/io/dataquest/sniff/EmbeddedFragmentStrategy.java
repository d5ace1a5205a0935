package io.dataquest.sniff;

import io.dataquest.table.Table;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

/**
 * Finds the first balanced {@code {...}} or {@code [...]} span inside otherwise unusable text (a log banner
 * around a payload, an HTML wrapper) and reads that span as a JSON document.
 */
public class EmbeddedFragmentStrategy implements ParseStrategy {
    @Override
    public String name() { return "json-fragment"; }

    @Override
    public boolean accepts(String text) {
        return text.indexOf('{') >= 0 || text.indexOf('[') >= 0;
    }

    @Override
    public Table parse(String text) throws Exception {
        String fragment = locate(text)
                .orElseThrow(() -> new IllegalArgumentException("no balanced {...} or [...] fragment"));
        return JsonTables.toTable(JsonTables.read(fragment));
    }

    /**
     * Earliest opening bracket whose span closes properly, found in one pass. Brackets of both kinds nest; a
     * mismatched closer abandons every bracket still open. Inside an open span anything between double quotes
     * is skipped, honouring backslash escapes.
     */
    static Optional<String> locate(String text) {
        Deque<Integer> open = new ArrayDeque<>();
        int bestStart = -1;
        int bestEnd = -1;
        boolean inString = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (c == '\\') i++;
                else if (c == '"') inString = false;
                continue;
            }
            switch (c) {
                case '"' -> inString = !open.isEmpty();
                case '{', '[' -> open.push(i);
                case '}', ']' -> {
                    if (open.isEmpty()) continue;
                    int from = open.pop();
                    if (closer(text.charAt(from)) != c) {
                        open.clear();
                    } else if (bestStart < 0 || from < bestStart) {
                        bestStart = from;
                        bestEnd = i;
                    }
                    if (open.isEmpty() && bestStart >= 0) return Optional.of(text.substring(bestStart, bestEnd + 1));
                }
                default -> { }
            }
        }
        return bestStart < 0 ? Optional.empty() : Optional.of(text.substring(bestStart, bestEnd + 1));
    }

    private static char closer(char opener) {
        return opener == '{' ? '}' : ']';
    }
}
