package io.dataquest.error;

/**
 * Base of the failures that end an ingestion run. Cell-level problems never surface as this type; they turn
 * into null cells instead.
 */
public class IngestException extends RuntimeException {
    public IngestException(String message) {
        super(message);
    }

    public IngestException(String message, Throwable cause) {
        super(message, cause);
    }
}
