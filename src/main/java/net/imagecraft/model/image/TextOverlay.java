package net.imagecraft.model.image;

import java.util.Locale;
import java.util.Set;

/**
 * Request to render text inside the generated image itself (as opposed to a watermark,
 * which is composited afterwards).
 *
 * @param text      the words to render; blank text disables the overlay
 * @param fontHint  lettering style hint, normalized to {@code bold} when unrecognized
 * @param placement vertical placement, normalized to {@code center} when unrecognized
 */
public record TextOverlay(String text, String fontHint, String placement) {

    private static final Set<String> FONT_HINTS = Set.of("bold", "handwritten", "3d", "graffiti", "serif", "sans-serif", "decorative");
    private static final Set<String> PLACEMENTS = Set.of("center", "top", "bottom");

    public TextOverlay {
        fontHint = normalize(fontHint, FONT_HINTS, "bold");
        placement = normalize(placement, PLACEMENTS, "center");
    }

    public boolean hasText() {
        return text != null && !text.isBlank();
    }

    private static String normalize(String value, Set<String> allowed, String fallback) {
        if (value == null) {
            return fallback;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return allowed.contains(normalized) ? normalized : fallback;
    }
}
