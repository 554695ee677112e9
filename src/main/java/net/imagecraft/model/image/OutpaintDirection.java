package net.imagecraft.model.image;

import java.util.Locale;
import net.imagecraft.exception.ImageValidationException;

/**
 * Side of the canvas that an outpaint operation extends.
 */
public enum OutpaintDirection {
    UP,
    DOWN,
    LEFT,
    RIGHT;

    public boolean isVertical() {
        return this == UP || this == DOWN;
    }

    public static OutpaintDirection fromLabel(String value) {
        if (value == null || value.isBlank()) {
            throw new ImageValidationException("Outpaint direction is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new ImageValidationException("Invalid outpaint direction: " + value + ". Use up, down, left or right", ex);
        }
    }
}
