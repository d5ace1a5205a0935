package io.dataquest.error;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.dataquest.core.Record;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class FileDeadLetterSinkTest {
    @Test
    void appends_one_json_line_per_failure() throws Exception {
        Path file = Files.createTempDirectory("dlq").resolve("out").resolve("upload_failures.jsonl");
        var dlq = new FileDeadLetterSink<byte[]>(file);
        dlq.acceptFailure("store", new Record<>(2, "a.csv", new byte[]{1}), new TransferException("quest", "results/a.csv", "denied"));
        dlq.acceptFailure("store", new Record<>(3, "b.csv", new byte[]{2}), new IllegalStateException("x"));

        List<String> lines = Files.readAllLines(file);
        assertEquals(2, lines.size());
        JsonNode first = new ObjectMapper().readTree(lines.get(0));
        assertEquals("store", first.get("stage").asText());
        assertEquals("a.csv", first.get("key").asText());
        assertEquals(2, first.get("seq").asLong());
        assertTrue(first.get("error").asText().contains("denied"));
        assertTrue(first.hasNonNull("ts"));
    }
}
