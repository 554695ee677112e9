package net.imagecraft.application.ai;

import jakarta.annotation.Nullable;
import java.util.Optional;
import net.imagecraft.model.image.StylePreset;
import net.imagecraft.model.image.TextOverlay;
import net.imagecraft.util.LoggingUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Builds backend prompts from user input, style presets and optional enrichment.
 *
 * <p>Enrichment is fail-open at every call site: any failure is logged and the unenriched value
 * is used instead.</p>
 */
@Component
public class PromptComposer {

    private static final Logger log = LoggerFactory.getLogger(PromptComposer.class);

    static final String DEFAULT_STYLE_DESCRIPTION = "artistic, stylized";
    static final String REFERENCE_DESCRIPTION_REQUEST =
        "Describe this image in detail for an AI image generator. Focus on: the main subject's appearance, "
            + "clothing, setting, colors, lighting, and composition. Be specific and concise (3-4 sentences).";
    static final String STYLE_DESCRIPTION_REQUEST =
        "Describe the artistic style of this image in detail. Focus on: color palette, brushwork/texture, "
            + "lighting, mood, and artistic movement. Be concise (2-3 sentences).";

    private final PromptEnrichmentService enrichmentService;

    public PromptComposer(PromptEnrichmentService enrichmentService) {
        this.enrichmentService = enrichmentService;
    }

    /**
     * Generation prompt: optionally enhanced text, then the style suffix, then any text-overlay
     * instruction.
     */
    public ComposedPrompt compose(String prompt, String style, boolean enhance, @Nullable TextOverlay overlay) {
        String enhanced = enhance ? tryEnrich(EnrichmentKind.ENHANCE_PROMPT, prompt, null).orElse(null) : null;
        String base = enhanced != null ? enhanced : prompt;
        return new ComposedPrompt(withTextOverlay(withStyle(base, style), overlay), enhanced);
    }

    /**
     * Merges a refinement instruction into the parent prompt, falling back to plain concatenation.
     */
    public String mergeRefinement(String parentPrompt, String instruction) {
        String request = "Original prompt: " + parentPrompt + "\n\nRefinement instruction: " + instruction;
        return tryEnrich(EnrichmentKind.MERGE_REFINEMENT, request, null)
            .orElseGet(() -> parentPrompt + ", " + instruction);
    }

    /**
     * Vision description of a reference image, empty when enrichment failed.
     */
    public Optional<String> describeReference(byte[] image) {
        return tryEnrich(EnrichmentKind.DESCRIBE_REFERENCE, REFERENCE_DESCRIPTION_REQUEST, image);
    }

    public String describeStyle(byte[] styleImage) {
        return tryEnrich(EnrichmentKind.DESCRIBE_STYLE, STYLE_DESCRIPTION_REQUEST, styleImage)
            .orElse(DEFAULT_STYLE_DESCRIPTION);
    }

    public String withStyle(String prompt, String style) {
        return prompt + StylePreset.fromLabel(style).promptSuffix();
    }

    static String withTextOverlay(String prompt, @Nullable TextOverlay overlay) {
        if (overlay == null || !overlay.hasText()) {
            return prompt;
        }
        return prompt + ", with the text \"" + overlay.text() + "\" prominently displayed in "
            + overlay.fontHint() + " lettering positioned at the " + overlay.placement() + " of the image";
    }

    private Optional<String> tryEnrich(EnrichmentKind kind, String text, @Nullable byte[] image) {
        try {
            String reply = enrichmentService.enrich(kind, text, image);
            return reply == null || reply.isBlank() ? Optional.empty() : Optional.of(reply.trim());
        } catch (RuntimeException ex) {
            log.warn("{} enrichment failed, using unenriched input: {}", kind, LoggingUtils.summarize(ex));
            return Optional.empty();
        }
    }
}
