package io.dataquest.sniff;

import io.dataquest.core.Record;
import io.dataquest.core.Transform;
import io.dataquest.error.UnparseableFormatException;
import io.dataquest.metrics.Metrics;
import io.dataquest.table.Table;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads text of unknown shape as a table by trying its strategies in order; the first success wins. When
 * every applicable strategy fails, the failure lists each strategy's error and a preview of the input.
 */
public class FormatSniffer implements Transform<String, Table> {
    private static final Logger log = LoggerFactory.getLogger(FormatSniffer.class);

    private final List<ParseStrategy> strategies;
    private final Metrics metrics;

    public FormatSniffer(List<ParseStrategy> strategies, Metrics metrics) {
        if (strategies.isEmpty()) throw new IllegalArgumentException("at least one strategy required");
        this.strategies = List.copyOf(strategies);
        this.metrics = metrics;
    }

    /** Whole document, JSON Lines, embedded fragment, then the given delimited-text policy. */
    public static FormatSniffer standard(DelimitedTextStrategy delimited, Metrics metrics) {
        return new FormatSniffer(List.of(
                new StrictStructuredStrategy(),
                new LineDelimitedStrategy(),
                new EmbeddedFragmentStrategy(),
                delimited), metrics);
    }

    public static FormatSniffer standard(DelimitedTextStrategy delimited) {
        return standard(delimited, Metrics.detached());
    }

    @Override
    public Record<Table> apply(Record<String> input) {
        return input.withPayload(sniff(input.key(), input.payload()));
    }

    public Table sniff(String text) {
        return sniff("input", text);
    }

    public Table sniff(String key, String text) {
        Map<String, String> errors = new LinkedHashMap<>();
        for (ParseStrategy s : strategies) {
            if (!s.accepts(text)) {
                log.debug("Skipping {} strategy for {}", s.name(), key);
                continue;
            }
            try {
                Table t = s.parse(text);
                metrics.counter("sniff.strategy." + s.name()).inc();
                log.info("Read {} with {} strategy: {} rows, columns {}", key, s.name(), t.size(), t.columns());
                return t;
            } catch (Exception e) {
                log.debug("{} strategy failed for {}: {}", s.name(), key, e.toString());
                errors.put(s.name(), e.getMessage() == null ? e.toString() : e.getMessage());
            }
        }
        metrics.counter("sniff.unparseable").inc();
        UnparseableFormatException failure = new UnparseableFormatException(key, errors, text);
        log.warn("No parse strategy accepted {}; preview: {}", key, failure.preview());
        throw failure;
    }
}
