package net.imagecraft.exception;

/**
 * A single backend attempt failed. Always absorbed by the fallback chain, which moves on to the
 * next strategy.
 */
public class ModelAdapterException extends RuntimeException {

    private final String adapterId;

    public ModelAdapterException(String adapterId, String message) {
        super(adapterId + ": " + message);
        this.adapterId = adapterId;
    }

    public ModelAdapterException(String adapterId, String message, Throwable cause) {
        super(adapterId + ": " + message, cause);
        this.adapterId = adapterId;
    }

    public String getAdapterId() {
        return adapterId;
    }
}
