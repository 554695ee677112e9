package net.imagecraft.exception;

/**
 * The asset record file could not be read or written.
 */
public class RecordStoreException extends RuntimeException {

    public RecordStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
