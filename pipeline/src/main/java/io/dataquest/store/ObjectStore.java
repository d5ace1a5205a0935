package io.dataquest.store;

import io.dataquest.error.TransferException;

import java.util.List;

/**
 * Bucketed blob storage addressed by key. Every call is all-or-nothing: a fetch returns the complete object
 * or throws, a store either lands the complete object or throws.
 */
public interface ObjectStore {
    byte[] fetch(String bucket, String key) throws TransferException;

    void store(String bucket, String key, byte[] data) throws TransferException;

    /** Keys in the bucket, sorted. */
    List<String> list(String bucket) throws TransferException;
}
