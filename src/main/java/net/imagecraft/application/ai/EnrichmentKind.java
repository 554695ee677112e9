package net.imagecraft.application.ai;

/**
 * The chat tasks the pipeline delegates to a text/vision model, with the instructions and
 * sampling settings each one uses.
 */
public enum EnrichmentKind {
    ENHANCE_PROMPT(
        "You are an expert at writing image generation prompts. Enhance this prompt for better, more detailed "
            + "image generation results while preserving the user's intent. Return only the enhanced prompt, nothing else.",
        500, 0.7),
    MERGE_REFINEMENT(
        "You are an image generation prompt expert. Given an original prompt and a refinement instruction, create a "
            + "new prompt that incorporates the changes while preserving the original intent and style. Return only "
            + "the new prompt, nothing else.",
        500, 0.7),
    DESCRIBE_REFERENCE(
        "You describe images for AI image generation. Return only the description.",
        300, 0.3),
    DESCRIBE_STYLE(
        "You are an art expert. Describe artistic styles concisely.",
        200, 0.5);

    private final String systemPrompt;
    private final long maxTokens;
    private final double temperature;

    EnrichmentKind(String systemPrompt, long maxTokens, double temperature) {
        this.systemPrompt = systemPrompt;
        this.maxTokens = maxTokens;
        this.temperature = temperature;
    }

    public String systemPrompt() {
        return systemPrompt;
    }

    public long maxTokens() {
        return maxTokens;
    }

    public double temperature() {
        return temperature;
    }
}
