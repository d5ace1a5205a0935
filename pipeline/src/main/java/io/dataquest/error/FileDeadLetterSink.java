package io.dataquest.error;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.dataquest.core.Record;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;

/**
 * Appends one JSON object per failure to a file: {@code {"ts":..,"stage":..,"key":..,"seq":..,"error":..}}.
 * Payloads are not written; the key is enough to find the artifact again.
 */
public class FileDeadLetterSink<T> implements DeadLetterSink<T> {
    private static final Logger log = LoggerFactory.getLogger(FileDeadLetterSink.class);
    private static final ObjectMapper mapper = new ObjectMapper();

    private final Path file;

    public FileDeadLetterSink(Path file) throws IOException {
        this.file = file;
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        if (!Files.exists(file)) {
            Files.writeString(file, "", StandardCharsets.UTF_8, StandardOpenOption.CREATE);
        }
    }

    @Override
    public synchronized void acceptFailure(String stage, Record<T> record, Exception e) {
        ObjectNode line = mapper.createObjectNode();
        line.put("ts", Instant.now().toString());
        line.put("stage", stage);
        line.put("key", record == null ? null : record.key());
        line.put("seq", record == null ? -1 : record.seq());
        line.put("error", String.valueOf(e));
        try {
            Files.writeString(file, mapper.writeValueAsString(line) + "\n", StandardCharsets.UTF_8, StandardOpenOption.APPEND);
        } catch (IOException io) {
            log.warn("Could not record {} failure for {} in {}: {}", stage, record == null ? "-" : record.key(), file, io.toString());
        }
    }
}
