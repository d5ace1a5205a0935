package io.dataquest.error;

/**
 * An object could not be fetched, stored or listed.
 */
public class TransferException extends IngestException {
    private final String bucket;
    private final String key;

    public TransferException(String bucket, String key, String message, Throwable cause) {
        super(message + " (" + bucket + "/" + (key == null ? "" : key) + ")", cause);
        this.bucket = bucket;
        this.key = key;
    }

    public TransferException(String bucket, String key, String message) {
        this(bucket, key, message, null);
    }

    public String bucket() { return bucket; }

    /** Null for bucket-level operations such as listing. */
    public String key() { return key; }
}
