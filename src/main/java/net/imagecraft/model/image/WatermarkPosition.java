package net.imagecraft.model.image;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;
import net.imagecraft.exception.ImageValidationException;

/**
 * Watermark anchor. {@link #TILED} repeats the text diagonally across the whole image.
 */
public enum WatermarkPosition {
    CENTER("center"),
    TOP_LEFT("top-left"),
    TOP_RIGHT("top-right"),
    BOTTOM_LEFT("bottom-left"),
    BOTTOM_RIGHT("bottom-right"),
    TILED("tiled");

    private final String label;

    WatermarkPosition(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Resolves a hyphenated label ({@code bottom-right}) or enum name ({@code BOTTOM_RIGHT}).
     */
    public static WatermarkPosition fromLabel(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
            for (WatermarkPosition position : values()) {
                if (position.label.equals(normalized)) {
                    return position;
                }
            }
        }
        String allowed = Arrays.stream(values()).map(WatermarkPosition::label).collect(Collectors.joining(", "));
        throw new ImageValidationException("Invalid watermark position: " + value + ". Use one of: " + allowed);
    }
}
