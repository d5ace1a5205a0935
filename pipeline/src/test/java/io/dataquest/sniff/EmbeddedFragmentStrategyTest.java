package io.dataquest.sniff;

import io.dataquest.table.Table;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class EmbeddedFragmentStrategyTest {
    @Test
    void locates_first_balanced_span() {
        assertEquals(Optional.of("{\"a\":[1,{\"b\":2}]}"), EmbeddedFragmentStrategy.locate("x {\"a\":[1,{\"b\":2}]} y {\"c\":3}"));
    }

    @Test
    void brackets_inside_strings_are_ignored() {
        String text = "log: {\"msg\":\"odd } ] \\\" quote\",\"n\":1} trailing";
        assertEquals(Optional.of("{\"msg\":\"odd } ] \\\" quote\",\"n\":1}"), EmbeddedFragmentStrategy.locate(text));
    }

    @Test
    void mismatched_opening_is_skipped_for_a_later_balanced_one() {
        assertEquals(Optional.of("[{\"a\":1}]"), EmbeddedFragmentStrategy.locate("{ broken ] then [{\"a\":1}]"));
    }

    @Test
    void unbalanced_text_has_no_fragment() {
        assertEquals(Optional.empty(), EmbeddedFragmentStrategy.locate("{\"a\":1"));
        assertFalse(new EmbeddedFragmentStrategy().accepts("plain text"));
    }

    @Test
    void parses_located_span() throws Exception {
        Table t = new EmbeddedFragmentStrategy().parse("<pre>[{\"year\":2013},{\"year\":2014}]</pre>");
        assertEquals(2, t.size());
        assertEquals(2014L, t.rows().get(1).get("year"));
    }

    @Test
    void closed_span_inside_an_unclosed_one_is_found() {
        assertEquals(Optional.of("[1,2]"), EmbeddedFragmentStrategy.locate("{ \"a\": [1,2] and nothing closes"));
    }

    @Test
    void many_stray_openers_are_scanned_once() {
        StringBuilder text = new StringBuilder("series_id\tyear\tvalue\n");
        for (int i = 0; i < 40_000; i++) text.append("PRS3000601").append(i % 10).append("\t2013\t{ stray\n");
        Optional<String> found = assertTimeout(Duration.ofSeconds(2), () -> EmbeddedFragmentStrategy.locate(text.toString()));
        assertEquals(Optional.empty(), found);
    }
}
