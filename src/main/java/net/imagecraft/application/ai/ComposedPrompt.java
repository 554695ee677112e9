package net.imagecraft.application.ai;

import jakarta.annotation.Nullable;

/**
 * Prompt sent to the backend, plus the enrichment output when enhancement succeeded.
 */
public record ComposedPrompt(String generationPrompt, @Nullable String enhancedPrompt) {
}
