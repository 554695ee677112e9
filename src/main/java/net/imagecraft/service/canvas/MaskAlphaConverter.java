package net.imagecraft.service.canvas;

import java.awt.image.BufferedImage;
import net.imagecraft.model.image.PixelDimensions;
import org.springframework.stereotype.Component;

/**
 * Converts a painted grayscale mask into the alpha mask that image-edit backends expect.
 *
 * <p>Input polarity: white marks the region to edit, black the region to keep. Output polarity:
 * fully transparent pixels are regenerated, fully opaque black pixels are preserved.</p>
 */
@Component
public class MaskAlphaConverter {

    /** Intensities strictly above this value (50% of 255) mark the edit region. */
    static final int EDIT_THRESHOLD = 128;

    private static final int TRANSPARENT = 0x00000000;
    private static final int OPAQUE_BLACK = 0xFF000000;

    public byte[] toAlphaMask(byte[] maskBytes, PixelDimensions targetSize) {
        return RasterCodec.encodePng(toAlphaMask(RasterCodec.decode(maskBytes), targetSize));
    }

    /**
     * Resamples the mask to {@code targetSize} and thresholds each pixel's intensity.
     */
    public BufferedImage toAlphaMask(BufferedImage mask, PixelDimensions targetSize) {
        BufferedImage gray = toGray(mask);
        BufferedImage resized = Resampler.resize(gray, targetSize.width(), targetSize.height());
        BufferedImage alphaMask = new BufferedImage(targetSize.width(), targetSize.height(), BufferedImage.TYPE_INT_ARGB);
        for (int y = 0; y < targetSize.height(); y++) {
            for (int x = 0; x < targetSize.width(); x++) {
                int intensity = resized.getRGB(x, y) & 0xFF;
                alphaMask.setRGB(x, y, intensity > EDIT_THRESHOLD ? TRANSPARENT : OPAQUE_BLACK);
            }
        }
        return alphaMask;
    }

    /**
     * Flattens any input to opaque gray, so RGB-painted masks use luminance as intensity.
     */
    private static BufferedImage toGray(BufferedImage mask) {
        BufferedImage rgb = RasterCodec.toRgb(mask);
        int width = rgb.getWidth();
        int height = rgb.getHeight();
        BufferedImage gray = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int luminance = Luminance.of(rgb.getRGB(x, y));
                gray.setRGB(x, y, (luminance << 16) | (luminance << 8) | luminance);
            }
        }
        return gray;
    }
}
