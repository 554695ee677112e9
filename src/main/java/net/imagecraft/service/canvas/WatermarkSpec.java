package net.imagecraft.service.canvas;

import java.awt.Color;
import net.imagecraft.exception.ImageValidationException;
import net.imagecraft.model.image.WatermarkPosition;

/**
 * Validated watermark parameters.
 *
 * @param text      watermark text, 1..500 characters
 * @param position  anchor or tiled mode
 * @param opacity   text opacity in [0.1, 1.0]
 * @param fontSize  font size at the 1024 px reference width, 12..200
 * @param color     {@code #rrggbb}; anything unparsable renders white
 */
public record WatermarkSpec(String text, WatermarkPosition position, double opacity, int fontSize, String color) {

    public static final int MAX_TEXT_LENGTH = 500;
    public static final double MIN_OPACITY = 0.1;
    public static final double MAX_OPACITY = 1.0;
    public static final int MIN_FONT_SIZE = 12;
    public static final int MAX_FONT_SIZE = 200;
    public static final int DEFAULT_FONT_SIZE = 48;
    public static final String DEFAULT_COLOR = "#FFFFFF";

    public WatermarkSpec {
        if (text == null || text.isEmpty() || text.length() > MAX_TEXT_LENGTH) {
            throw new ImageValidationException("Watermark text must be 1 to " + MAX_TEXT_LENGTH + " characters");
        }
        if (position == null) {
            position = WatermarkPosition.BOTTOM_RIGHT;
        }
        if (!(opacity >= MIN_OPACITY && opacity <= MAX_OPACITY)) {
            throw new ImageValidationException("Watermark opacity must be between 0.1 and 1.0, got " + opacity);
        }
        if (fontSize < MIN_FONT_SIZE || fontSize > MAX_FONT_SIZE) {
            throw new ImageValidationException("Watermark font size must be between 12 and 200, got " + fontSize);
        }
        color = color == null || color.isBlank() ? DEFAULT_COLOR : color.trim();
    }

    /**
     * Text alpha on the 0..255 scale, truncated: opacity 0.3 gives 76.
     */
    int textAlpha() {
        return (int) (255 * opacity);
    }

    Color rgb() {
        String hex = color.startsWith("#") ? color.substring(1) : color;
        if (hex.length() != 6) {
            return Color.WHITE;
        }
        try {
            return new Color(Integer.parseInt(hex, 16));
        } catch (NumberFormatException ex) {
            return Color.WHITE;
        }
    }
}
