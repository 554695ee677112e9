package net.imagecraft.model.image;

import java.util.Locale;
import net.imagecraft.exception.ImageValidationException;

/**
 * Parametric animation applied per frame when rendering a GIF from a still image.
 */
public enum GifEffect {
    ZOOM,
    PAN,
    ROTATE,
    PULSE,
    FADE;

    public static GifEffect fromLabel(String value) {
        if (value == null || value.isBlank()) {
            throw new ImageValidationException("Animation effect is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new ImageValidationException("Invalid animation effect: " + value + ". Use zoom, pan, rotate, pulse or fade", ex);
        }
    }
}
