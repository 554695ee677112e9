package net.imagecraft.service.canvas;

import java.awt.image.BufferedImage;
import org.springframework.stereotype.Component;

/**
 * Synthesizes a grayscale depth proxy from edge density and a vertical prior.
 *
 * <p>This is a deterministic visual approximation, not depth estimation: detailed regions read as
 * nearer, and lower rows read as nearer than upper rows.</p>
 */
@Component
public class DepthMapRenderer {

    static final double EDGE_BLUR_RADIUS = 10.0;
    static final double FINAL_BLUR_RADIUS = 2.0;
    static final int BLEND_SCALE = 2;

    public byte[] render(byte[] imageBytes) {
        return RasterCodec.encodePng(render(RasterCodec.decode(imageBytes)));
    }

    /**
     * @return a {@link BufferedImage#TYPE_BYTE_GRAY} image at the source resolution
     */
    public BufferedImage render(BufferedImage source) {
        int width = source.getWidth();
        int height = source.getHeight();
        int[] luminance = Luminance.grayPlane(source);

        int[] edgeTerm = GrayPlanes.gaussianBlur(
            GrayPlanes.invert(GrayPlanes.findEdges(luminance, width, height)), width, height, EDGE_BLUR_RADIUS);

        int[] blended = new int[luminance.length];
        for (int y = 0; y < height; y++) {
            int prior = verticalPrior(y, height);
            for (int x = 0; x < width; x++) {
                int i = y * width + x;
                blended[i] = GrayPlanes.clip((prior + edgeTerm[i]) / BLEND_SCALE);
            }
        }
        int[] smoothed = GrayPlanes.gaussianBlur(blended, width, height, FINAL_BLUR_RADIUS);
        return GrayPlanes.toGrayImage(smoothed, width, height);
    }

    /**
     * Linear ramp from 0 at the top row to 255 at the bottom row.
     */
    static int verticalPrior(int row, int height) {
        return height <= 1 ? 0 : row * 255 / (height - 1);
    }
}
