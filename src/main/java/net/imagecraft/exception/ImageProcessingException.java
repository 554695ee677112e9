package net.imagecraft.exception;

/**
 * Raster bytes could not be decoded or encoded (corrupt data, unsupported format, codec failure).
 * RETRYABLE: No (the same bytes will fail again)
 */
public class ImageProcessingException extends RuntimeException {

    public ImageProcessingException(String message) {
        super(message);
    }

    public ImageProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
