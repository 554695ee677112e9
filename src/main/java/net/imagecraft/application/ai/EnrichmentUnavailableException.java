package net.imagecraft.application.ai;

/**
 * Enrichment could not produce text: not configured, transport failure or an empty reply.
 * Never escapes {@link PromptComposer}.
 */
public class EnrichmentUnavailableException extends RuntimeException {

    public EnrichmentUnavailableException(String message) {
        super(message);
    }

    public EnrichmentUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
