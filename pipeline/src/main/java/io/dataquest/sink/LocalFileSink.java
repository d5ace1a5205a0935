package io.dataquest.sink;

import io.dataquest.core.Record;
import io.dataquest.core.Sink;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Writes each record's bytes to {@code <outDir>/<key>}, replacing what was there.
 */
public class LocalFileSink implements Sink<byte[]> {
    private final Path outDir;

    public LocalFileSink(Path outDir) throws IOException {
        this.outDir = outDir.toAbsolutePath().normalize();
        Files.createDirectories(this.outDir);
    }

    public Path outDir() { return outDir; }

    @Override
    public void accept(Record<byte[]> record) throws IOException {
        Path out = outDir.resolve(record.key()).normalize();
        if (!out.startsWith(outDir)) throw new IOException("artifact key escapes output directory: " + record.key());
        Files.createDirectories(out.getParent());
        Files.write(out, record.payload(), StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
    }
}
