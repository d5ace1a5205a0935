package io.dataquest.store;

import io.dataquest.error.TransferException;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.stream.Stream;

/**
 * Buckets are directories under a root; keys are relative paths inside them ({@code results/a.csv} lives at
 * {@code <root>/<bucket>/results/a.csv}). Writes go to a temporary sibling first and are moved into place.
 */
public class FileSystemObjectStore implements ObjectStore {
    private final Path root;

    public FileSystemObjectStore(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    public Path root() { return root; }

    @Override
    public byte[] fetch(String bucket, String key) {
        Path p = resolve(bucket, key);
        try {
            return Files.readAllBytes(p);
        } catch (NoSuchFileException e) {
            throw new TransferException(bucket, key, "object not found", e);
        } catch (IOException e) {
            throw new TransferException(bucket, key, "read failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void store(String bucket, String key, byte[] data) {
        Path p = resolve(bucket, key);
        try {
            Files.createDirectories(p.getParent());
            Path tmp = Files.createTempFile(p.getParent(), ".upload-", ".tmp");
            Files.write(tmp, data);
            try {
                Files.move(tmp, p, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, p, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new TransferException(bucket, key, "write failed: " + e.getMessage(), e);
        }
    }

    @Override
    public List<String> list(String bucket) {
        Path dir = bucketDir(bucket);
        if (!Files.isDirectory(dir)) throw new TransferException(bucket, null, "bucket not found");
        try (Stream<Path> stream = Files.walk(dir)) {
            return stream
                    .filter(Files::isRegularFile)
                    .map(p -> dir.relativize(p).toString().replace('\\', '/'))
                    .filter(k -> !k.endsWith(".tmp"))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new TransferException(bucket, null, "listing failed: " + e.getMessage(), e);
        }
    }

    private Path bucketDir(String bucket) {
        if (bucket == null || bucket.isBlank() || bucket.contains("/") || bucket.contains("\\") || bucket.startsWith(".")) {
            throw new TransferException(String.valueOf(bucket), null, "invalid bucket name");
        }
        return root.resolve(bucket);
    }

    private Path resolve(String bucket, String key) {
        Path dir = bucketDir(bucket);
        if (key == null || key.isBlank()) throw new TransferException(bucket, key, "empty key");
        Path p = dir.resolve(key).normalize();
        if (!p.startsWith(dir) || p.equals(dir)) throw new TransferException(bucket, key, "key escapes bucket");
        return p;
    }
}
