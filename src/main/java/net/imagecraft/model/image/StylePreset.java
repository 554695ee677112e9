package net.imagecraft.model.image;

import java.util.Locale;

/**
 * Named style presets appended to generation prompts.
 */
public enum StylePreset {
    NONE("none", ""),
    PHOTOREALISTIC("photorealistic", ", photorealistic, ultra detailed, 8k, DSLR photo"),
    DIGITAL_ART("digital-art", ", digital art, vibrant colors, detailed illustration"),
    WATERCOLOR("watercolor", ", watercolor painting, soft edges, artistic, paper texture"),
    OIL_PAINTING("oil-painting", ", oil painting, rich textures, classical style, canvas"),
    ANIME("anime", ", anime style, manga, Japanese animation, cel shaded"),
    RENDER_3D("3d-render", ", 3D render, Cinema 4D, octane render, detailed lighting"),
    MINIMALIST("minimalist", ", minimalist, clean lines, simple shapes, modern design"),
    VINTAGE("vintage", ", vintage, retro, film grain, muted colors, nostalgic");

    private final String label;
    private final String promptSuffix;

    StylePreset(String label, String promptSuffix) {
        this.label = label;
        this.promptSuffix = promptSuffix;
    }

    public String label() {
        return label;
    }

    public String promptSuffix() {
        return promptSuffix;
    }

    /**
     * Unknown or blank style names resolve to {@link #NONE} so they contribute no suffix.
     */
    public static StylePreset fromLabel(String value) {
        if (value == null) {
            return NONE;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (StylePreset preset : values()) {
            if (preset.label.equals(normalized)) {
                return preset;
            }
        }
        return NONE;
    }
}
