package net.imagecraft.service.canvas;

import java.awt.image.BufferedImage;
import net.imagecraft.model.image.PixelDimensions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Crop-to-aspect normalization of backend output.
 *
 * <p>Backends frequently return a raster whose size differs from the one requested. The normalizer
 * center-crops the longer axis to the target aspect ratio and then resizes to the exact target,
 * so the stored raster always matches the asset's declared dimensions.</p>
 */
@Component
public class CanvasNormalizer {

    private static final Logger log = LoggerFactory.getLogger(CanvasNormalizer.class);

    /** Relative difference between source and target ratios tolerated without cropping. */
    static final double ASPECT_TOLERANCE = 0.01;

    /**
     * Decodes, normalizes to {@code target} and re-encodes as PNG.
     */
    public byte[] normalize(byte[] rawBytes, PixelDimensions target) {
        return RasterCodec.encodePng(normalize(RasterCodec.decode(rawBytes), target.width(), target.height()));
    }

    /**
     * Center-crops to the target aspect ratio when outside tolerance, then resizes.
     *
     * @return an INT_RGB or INT_ARGB image of exactly {@code targetWidth x targetHeight}
     */
    public BufferedImage normalize(BufferedImage source, int targetWidth, int targetHeight) {
        BufferedImage image = RasterCodec.toStandardColorModel(source);
        CropWindow window = cropWindow(image.getWidth(), image.getHeight(), targetWidth, targetHeight);
        if (!window.coversWholeImage(image.getWidth(), image.getHeight())) {
            log.debug("Cropping {}x{} to {}x{} at ({}, {}) for target {}x{}",
                image.getWidth(), image.getHeight(), window.width(), window.height(), window.x(), window.y(),
                targetWidth, targetHeight);
            image = image.getSubimage(window.x(), window.y(), window.width(), window.height());
        }
        return Resampler.resize(image, targetWidth, targetHeight);
    }

    /**
     * Resizes to the exact target without cropping, as the last step after a backend has
     * synthesized content for a precomputed canvas.
     */
    public byte[] resizeExact(byte[] rawBytes, PixelDimensions target) {
        BufferedImage image = RasterCodec.decode(rawBytes);
        return RasterCodec.encodePng(Resampler.resize(image, target.width(), target.height()));
    }

    /**
     * Computes the centered crop that brings a source to the target aspect ratio.
     * Sources within {@link #ASPECT_TOLERANCE} keep their full extent.
     */
    static CropWindow cropWindow(int sourceWidth, int sourceHeight, int targetWidth, int targetHeight) {
        double targetRatio = (double) targetWidth / targetHeight;
        double sourceRatio = (double) sourceWidth / sourceHeight;
        if (Math.abs(sourceRatio - targetRatio) <= ASPECT_TOLERANCE) {
            return new CropWindow(0, 0, sourceWidth, sourceHeight);
        }
        if (sourceRatio > targetRatio) {
            int croppedWidth = Math.max(1, (int) (sourceHeight * targetRatio));
            int left = (sourceWidth - croppedWidth) / 2;
            return new CropWindow(left, 0, croppedWidth, sourceHeight);
        }
        int croppedHeight = Math.max(1, (int) (sourceWidth / targetRatio));
        int top = (sourceHeight - croppedHeight) / 2;
        return new CropWindow(0, top, sourceWidth, croppedHeight);
    }

    record CropWindow(int x, int y, int width, int height) {
        boolean coversWholeImage(int sourceWidth, int sourceHeight) {
            return x == 0 && y == 0 && width == sourceWidth && height == sourceHeight;
        }
    }
}
