package net.imagecraft.support.adapter;

import java.util.List;
import lombok.extern.slf4j.Slf4j;
import net.imagecraft.exception.ImageValidationException;
import net.imagecraft.model.image.PixelDimensions;

/**
 * Output sizes the image backends accept.
 */
@Slf4j
public final class GenerationSizes {

    public static final PixelDimensions SQUARE = new PixelDimensions(1024, 1024);
    public static final PixelDimensions PORTRAIT = new PixelDimensions(1024, 1536);
    public static final PixelDimensions LANDSCAPE = new PixelDimensions(1536, 1024);
    public static final List<PixelDimensions> VALID = List.of(SQUARE, PORTRAIT, LANDSCAPE);

    private GenerationSizes() {
    }

    /**
     * Parses and validates a generation size label.
     *
     * @throws ImageValidationException for anything outside {@link #VALID}
     */
    public static PixelDimensions requireValid(String label) {
        PixelDimensions size = PixelDimensions.parse(label);
        if (!VALID.contains(size)) {
            throw new ImageValidationException("Invalid size: " + label + ". Use one of " + VALID);
        }
        return size;
    }

    /**
     * Valid size with the same orientation as {@code size}, used for edits of arbitrary rasters.
     */
    public static PixelDimensions closestTo(PixelDimensions size) {
        if (VALID.contains(size)) {
            return size;
        }
        PixelDimensions closest = size.isLandscape() ? LANDSCAPE : size.isPortrait() ? PORTRAIT : SQUARE;
        log.debug("Mapping {} to backend size {}", size, closest);
        return closest;
    }
}
