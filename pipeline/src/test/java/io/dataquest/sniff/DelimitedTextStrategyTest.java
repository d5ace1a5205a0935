package io.dataquest.sniff;

import io.dataquest.table.Table;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class DelimitedTextStrategyTest {
    @Test
    void detects_the_uniform_delimiter_with_highest_count() {
        assertEquals(Optional.of('|'), DelimitedTextStrategy.detect("a|b|c\n1|2|3\n"));
        assertEquals(Optional.of(';'), DelimitedTextStrategy.detect("a;b;c,d\n1;2;3,4\n"));
        assertEquals(Optional.empty(), DelimitedTextStrategy.detect("a,b\n1,2,3\n"));
    }

    @Test
    void quoted_delimiters_do_not_count() {
        assertEquals(Optional.of(','), DelimitedTextStrategy.detect("name,city\n\"Doe, J\",Boston\n"));
    }

    @Test
    void empty_and_duplicate_header_names_are_renamed() throws Exception {
        Table t = DelimitedTextStrategy.parseWith(",a,a,b\n0,1,2,3\n", ',');
        assertEquals(List.of("Unnamed: 0", "a", "a.1", "b"), t.columns());
        assertEquals("2", t.rows().get(0).get("a.1"));
    }

    @Test
    void na_tokens_read_as_null() throws Exception {
        Table t = DelimitedTextStrategy.parseWith("k,v\na,NA\nb,\nc,nan\nd,7\n", ',');
        assertNull(t.rows().get(0).get("v"));
        assertNull(t.rows().get(1).get("v"));
        assertNull(t.rows().get(2).get("v"));
        assertEquals("7", t.rows().get(3).get("v"));
    }

    @Test
    void short_records_past_the_sample_are_padded() throws Exception {
        StringBuilder sb = new StringBuilder("a,b,c\n");
        for (int i = 0; i < 25; i++) sb.append(i).append(",x,y\n");
        sb.append("99,z\n");
        Table t = DelimitedTextStrategy.parseWith(sb.toString(), ',');
        assertEquals(26, t.size());
        assertNull(t.rows().get(25).get("c"));
    }

    @Test
    void long_records_fail_the_delimiter() {
        assertThrows(IllegalArgumentException.class, () -> DelimitedTextStrategy.parseWith("a,b\n1,2\n3,4,5\n", ','));
    }

    @Test
    void single_column_is_not_a_table() {
        assertThrows(IllegalArgumentException.class, () -> DelimitedTextStrategy.parseWith("a\n1\n2\n", ','));
    }

    @Test
    void sniffing_prefers_detected_delimiter_over_irregular_commas() {
        Table t = DelimitedTextStrategy.sniffing().parse("name;note\nx;a,b\ny;c\n");
        assertEquals(List.of("name", "note"), t.columns());
        assertEquals("a,b", t.rows().get(0).get("note"));
    }

    @Test
    void comma_guard_needs_uniform_count_at_threshold() {
        var guarded = DelimitedTextStrategy.commaGuarded(3);
        assertTrue(guarded.accepts("a,b,c,d\n1,2,3,4\n"));
        assertFalse(guarded.accepts("a,b,c\n1,2,3\n"));
        assertFalse(guarded.accepts("a,b,c,d\n1,2,3,4,5\n"));
        assertFalse(guarded.accepts("   \n"));
    }
}
