package net.imagecraft.application.ai;

import jakarta.annotation.Nullable;

/**
 * Chat/vision text service used to enrich prompts.
 *
 * <p>Implementations may throw on any failure. Callers go through {@link PromptComposer}, which
 * substitutes the unenriched input instead of propagating.</p>
 */
public interface PromptEnrichmentService {

    /**
     * @param kind  task whose instructions frame the request
     * @param text  user-side text
     * @param image optional image to attach for vision tasks
     * @return the model's reply, trimmed and never blank
     */
    String enrich(EnrichmentKind kind, String text, @Nullable byte[] image);
}
