package net.imagecraft.exception;

import java.util.List;

/**
 * Every strategy of a fallback chain failed.
 * RETRYABLE: Caller's decision; the chain itself never retries.
 *
 * <p>The cause is always the error raised by the last attempted strategy. {@link #getAttempted()}
 * lists the strategy identities in the order they were tried.</p>
 */
public class AllAdaptersFailedException extends RuntimeException {

    private final List<String> attempted;

    public AllAdaptersFailedException(List<String> attempted, Throwable lastError) {
        super(buildMessage(attempted, lastError), lastError);
        this.attempted = attempted == null ? List.of() : List.copyOf(attempted);
    }

    public List<String> getAttempted() {
        return attempted;
    }

    private static String buildMessage(List<String> attempted, Throwable lastError) {
        String lastMessage = lastError == null
            ? "no strategies were attempted"
            : (lastError.getMessage() != null ? lastError.getMessage() : lastError.getClass().getSimpleName());
        return "All image models failed (attempted: " + (attempted == null ? List.of() : attempted) + "). Last error: " + lastMessage;
    }
}
