package io.dataquest.sink;

import io.dataquest.core.Record;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class LocalFileSinkTest {
    @Test
    void writes_and_replaces_files_by_key() throws Exception {
        Path out = Files.createTempDirectory("out").resolve("nested");
        var sink = new LocalFileSink(out);
        sink.accept(new Record<>(0, "report.csv", "old".getBytes(StandardCharsets.UTF_8)));
        sink.accept(new Record<>(1, "report.csv", "new".getBytes(StandardCharsets.UTF_8)));
        assertEquals("new", Files.readString(out.resolve("report.csv")));
    }

    @Test
    void keys_cannot_escape_the_output_directory() throws Exception {
        var sink = new LocalFileSink(Files.createTempDirectory("out"));
        assertThrows(IOException.class, () -> sink.accept(new Record<>(0, "../evil.txt", new byte[0])));
    }
}
