package net.imagecraft.service.canvas;

import java.awt.image.BufferedImage;
import java.util.Arrays;
import net.imagecraft.model.image.AdjustmentLevels;
import org.springframework.stereotype.Component;

/**
 * Tonal adjustments with enhancement-factor semantics: each factor linearly interpolates between
 * a degenerate image (factor 0) and the input (factor 1), extrapolating above 1.
 *
 * <ul>
 *   <li>brightness: degenerate is black</li>
 *   <li>contrast: degenerate is flat gray at the mean luminance</li>
 *   <li>saturation: degenerate is the grayscale image</li>
 *   <li>sharpness: degenerate is a 3x3 smoothed image</li>
 * </ul>
 * Blur is a Gaussian with the given radius, applied last.
 */
@Component
public class ImageAdjuster {

    private static final int[] SMOOTH_KERNEL = {
        1, 1, 1,
        1, 5, 1,
        1, 1, 1
    };
    private static final int SMOOTH_DIVISOR = 13;

    public byte[] apply(byte[] imageBytes, AdjustmentLevels levels) {
        return RasterCodec.encodePng(apply(RasterCodec.decode(imageBytes), levels));
    }

    public BufferedImage apply(BufferedImage source, AdjustmentLevels levels) {
        BufferedImage rgb = RasterCodec.toRgb(source);
        int width = rgb.getWidth();
        int height = rgb.getHeight();
        int[][] planes = GrayPlanes.channels(rgb);

        if (levels.brightness() != 1.0) {
            int[][] black = new int[3][width * height];
            planes = blend(black, planes, levels.brightness());
        }
        if (levels.contrast() != 1.0) {
            int mean = (int) (meanLuminance(planes) + 0.5);
            int[][] flat = new int[3][width * height];
            for (int[] plane : flat) {
                Arrays.fill(plane, mean);
            }
            planes = blend(flat, planes, levels.contrast());
        }
        if (levels.saturation() != 1.0) {
            int[] gray = luminance(planes);
            planes = blend(new int[][] {gray, gray, gray}, planes, levels.saturation());
        }
        if (levels.sharpness() != 1.0) {
            int[][] smooth = new int[3][];
            for (int c = 0; c < 3; c++) {
                smooth[c] = smooth(planes[c], width, height);
            }
            planes = blend(smooth, planes, levels.sharpness());
        }
        if (levels.blur() > 0.0) {
            for (int c = 0; c < 3; c++) {
                planes[c] = GrayPlanes.gaussianBlur(planes[c], width, height, levels.blur());
            }
        }
        return GrayPlanes.fromChannels(planes, width, height);
    }

    private static int[][] blend(int[][] degenerate, int[][] image, double factor) {
        int[][] out = new int[3][];
        for (int c = 0; c < 3; c++) {
            int[] d = degenerate[c];
            int[] s = image[c];
            int[] o = new int[s.length];
            for (int i = 0; i < s.length; i++) {
                o[i] = GrayPlanes.clip((int) Math.round(d[i] + factor * (s[i] - d[i])));
            }
            out[c] = o;
        }
        return out;
    }

    private static int[] luminance(int[][] planes) {
        int[] gray = new int[planes[0].length];
        for (int i = 0; i < gray.length; i++) {
            gray[i] = (planes[0][i] * 299 + planes[1][i] * 587 + planes[2][i] * 114) / 1000;
        }
        return gray;
    }

    private static double meanLuminance(int[][] planes) {
        int[] gray = luminance(planes);
        long sum = 0;
        for (int value : gray) {
            sum += value;
        }
        return gray.length == 0 ? 0.0 : (double) sum / gray.length;
    }

    /**
     * Border pixels keep their value.
     */
    private static int[] smooth(int[] plane, int width, int height) {
        int[] out = plane.clone();
        for (int y = 1; y < height - 1; y++) {
            for (int x = 1; x < width - 1; x++) {
                int sum = 0;
                int k = 0;
                for (int dy = -1; dy <= 1; dy++) {
                    for (int dx = -1; dx <= 1; dx++) {
                        sum += SMOOTH_KERNEL[k++] * plane[(y + dy) * width + (x + dx)];
                    }
                }
                out[y * width + x] = GrayPlanes.clip(Math.round((float) sum / SMOOTH_DIVISOR));
            }
        }
        return out;
    }
}
