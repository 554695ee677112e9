package net.imagecraft.application.image;

import java.util.Locale;
import net.imagecraft.exception.ImageValidationException;

/**
 * Download encodings for stored rasters.
 */
public enum ExportFormat {
    PNG("image/png"),
    JPEG("image/jpeg");

    private final String mediaType;

    ExportFormat(String mediaType) {
        this.mediaType = mediaType;
    }

    public String mediaType() {
        return mediaType;
    }

    public static ExportFormat fromLabel(String value) {
        if (value == null) {
            return PNG;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "png" -> PNG;
            case "jpg", "jpeg" -> JPEG;
            default -> throw new ImageValidationException("Unsupported export format: " + value + ". Use png or jpeg");
        };
    }
}
