package net.imagecraft.model.image;

import com.fasterxml.jackson.annotation.JsonIgnore;
import net.imagecraft.exception.ImageValidationException;

/**
 * Tonal adjustment parameters applied in order: brightness, contrast, saturation, sharpness, blur.
 *
 * <p>Enhancement factors use 1.0 as identity and accept [0, 2]; blur is a Gaussian radius in [0, 10].</p>
 */
public record AdjustmentLevels(double brightness,
                               double contrast,
                               double saturation,
                               double sharpness,
                               double blur) implements OperationMetadata {

    public static final double MAX_FACTOR = 2.0;
    public static final double MAX_BLUR_RADIUS = 10.0;

    public AdjustmentLevels {
        requireFactor("brightness", brightness);
        requireFactor("contrast", contrast);
        requireFactor("saturation", saturation);
        requireFactor("sharpness", sharpness);
        if (!(blur >= 0.0 && blur <= MAX_BLUR_RADIUS)) {
            throw new ImageValidationException("blur must be between 0.0 and %.1f, got %s".formatted(MAX_BLUR_RADIUS, blur));
        }
    }

    public static AdjustmentLevels identity() {
        return new AdjustmentLevels(1.0, 1.0, 1.0, 1.0, 0.0);
    }

    @JsonIgnore
    public boolean isIdentity() {
        return brightness == 1.0 && contrast == 1.0 && saturation == 1.0 && sharpness == 1.0 && blur == 0.0;
    }

    private static void requireFactor(String name, double value) {
        if (!(value >= 0.0 && value <= MAX_FACTOR)) {
            throw new ImageValidationException("%s must be between 0.0 and %.1f, got %s".formatted(name, MAX_FACTOR, value));
        }
    }
}
