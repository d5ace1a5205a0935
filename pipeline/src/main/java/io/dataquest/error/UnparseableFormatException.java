package io.dataquest.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * No parse strategy could turn a text into a table. Carries every strategy's failure, in the order the
 * strategies were tried, and a bounded preview of the input for operators.
 */
public class UnparseableFormatException extends IngestException {
    public static final int PREVIEW_CHARS = 2000;

    private final String sourceKey;
    private final Map<String, String> strategyErrors;
    private final String preview;

    public UnparseableFormatException(String sourceKey, Map<String, String> strategyErrors, String text) {
        super(describe(sourceKey, strategyErrors, preview(text)));
        this.sourceKey = sourceKey;
        this.strategyErrors = Collections.unmodifiableMap(new LinkedHashMap<>(strategyErrors));
        this.preview = preview(text);
    }

    public String sourceKey() { return sourceKey; }
    public Map<String, String> strategyErrors() { return strategyErrors; }
    public String preview() { return preview; }

    /** First {@value #PREVIEW_CHARS} characters with line breaks escaped, so the preview stays on one log line. */
    public static String preview(String text) {
        if (text == null) return "";
        String head = text.length() > PREVIEW_CHARS ? text.substring(0, PREVIEW_CHARS) : text;
        return head.replace("\r", "\\r").replace("\n", "\\n");
    }

    private static String describe(String sourceKey, Map<String, String> errors, String preview) {
        StringBuilder sb = new StringBuilder("Failed to parse ").append(sourceKey).append(" as a table.\n");
        for (Map.Entry<String, String> e : errors.entrySet()) {
            sb.append(e.getKey()).append(" parse error: ").append(e.getValue()).append('\n');
        }
        sb.append("\nFile preview:\n").append(preview);
        return sb.toString();
    }
}
