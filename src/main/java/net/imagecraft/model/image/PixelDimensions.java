package net.imagecraft.model.image;

import com.fasterxml.jackson.annotation.JsonIgnore;
import net.imagecraft.exception.ImageValidationException;

/**
 * Width and height of a raster in pixels.
 *
 * @param width  horizontal pixel count, always positive
 * @param height vertical pixel count, always positive
 */
public record PixelDimensions(int width, int height) {

    public PixelDimensions {
        if (width <= 0 || height <= 0) {
            throw new ImageValidationException("Pixel dimensions must be positive, got %dx%d".formatted(width, height));
        }
    }

    /**
     * Parses a {@code WIDTHxHEIGHT} label such as {@code 1024x1536}.
     */
    public static PixelDimensions parse(String label) {
        if (label == null || label.isBlank()) {
            throw new ImageValidationException("Size is required");
        }
        String[] parts = label.trim().toLowerCase().split("x");
        if (parts.length != 2) {
            throw new ImageValidationException("Invalid size '" + label + "', expected WIDTHxHEIGHT");
        }
        try {
            return new PixelDimensions(Integer.parseInt(parts[0].trim()), Integer.parseInt(parts[1].trim()));
        } catch (NumberFormatException ex) {
            throw new ImageValidationException("Invalid size '" + label + "', expected WIDTHxHEIGHT", ex);
        }
    }

    @JsonIgnore
    public double aspectRatio() {
        return (double) width / height;
    }

    @JsonIgnore
    public boolean isLandscape() {
        return width > height;
    }

    @JsonIgnore
    public boolean isPortrait() {
        return height > width;
    }

    /**
     * Formats back to the {@code WIDTHxHEIGHT} label used by generation backends.
     */
    @JsonIgnore
    public String label() {
        return width + "x" + height;
    }

    @Override
    public String toString() {
        return label();
    }
}
