package net.imagecraft.exception;

/**
 * A request parameter is out of range or names an unknown option (size, scale, opacity, effect...).
 * RETRYABLE: No. Raised before any backend is contacted.
 */
public class ImageValidationException extends RuntimeException {

    public ImageValidationException(String message) {
        super(message);
    }

    public ImageValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
