package net.imagecraft.service.canvas;

import java.awt.image.BufferedImage;
import java.awt.image.WritableRaster;

/**
 * Filters over single-channel planes stored row-major as {@code int[]} with values in 0..255.
 * Borders are handled by clamping sample coordinates to the nearest edge pixel.
 */
final class GrayPlanes {

    private static final int[] FIND_EDGES_KERNEL = {
        -1, -1, -1,
        -1, 8, -1,
        -1, -1, -1
    };

    private GrayPlanes() {
    }

    /**
     * 3x3 Laplacian edge detector, clipped to 0..255.
     */
    static int[] findEdges(int[] plane, int width, int height) {
        int[] out = new int[plane.length];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int sum = 0;
                int k = 0;
                for (int dy = -1; dy <= 1; dy++) {
                    int sy = clamp(y + dy, height - 1);
                    for (int dx = -1; dx <= 1; dx++) {
                        int sx = clamp(x + dx, width - 1);
                        sum += FIND_EDGES_KERNEL[k++] * plane[sy * width + sx];
                    }
                }
                out[y * width + x] = clip(sum);
            }
        }
        return out;
    }

    static int[] invert(int[] plane) {
        int[] out = new int[plane.length];
        for (int i = 0; i < plane.length; i++) {
            out[i] = 255 - plane[i];
        }
        return out;
    }

    /**
     * Separable Gaussian blur with {@code sigma = radius}. A radius of zero returns a copy.
     */
    static int[] gaussianBlur(int[] plane, int width, int height, double radius) {
        if (radius <= 0.0) {
            return plane.clone();
        }
        double[] kernel = gaussianKernel(radius);
        int half = kernel.length / 2;
        double[] horizontal = new double[plane.length];
        for (int y = 0; y < height; y++) {
            int row = y * width;
            for (int x = 0; x < width; x++) {
                double acc = 0.0;
                for (int k = -half; k <= half; k++) {
                    acc += kernel[k + half] * plane[row + clamp(x + k, width - 1)];
                }
                horizontal[row + x] = acc;
            }
        }
        int[] out = new int[plane.length];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                double acc = 0.0;
                for (int k = -half; k <= half; k++) {
                    acc += kernel[k + half] * horizontal[clamp(y + k, height - 1) * width + x];
                }
                out[y * width + x] = clip((int) Math.round(acc));
            }
        }
        return out;
    }

    static BufferedImage toGrayImage(int[] plane, int width, int height) {
        BufferedImage gray = new BufferedImage(width, height, BufferedImage.TYPE_BYTE_GRAY);
        WritableRaster raster = gray.getRaster();
        raster.setSamples(0, 0, width, height, 0, plane);
        return gray;
    }

    /**
     * Splits an RGB image into its three channel planes.
     */
    static int[][] channels(BufferedImage rgb) {
        int width = rgb.getWidth();
        int height = rgb.getHeight();
        int[][] planes = new int[3][width * height];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int pixel = rgb.getRGB(x, y);
                int i = y * width + x;
                planes[0][i] = (pixel >> 16) & 0xFF;
                planes[1][i] = (pixel >> 8) & 0xFF;
                planes[2][i] = pixel & 0xFF;
            }
        }
        return planes;
    }

    static BufferedImage fromChannels(int[][] planes, int width, int height) {
        BufferedImage rgb = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int i = y * width + x;
                rgb.setRGB(x, y, (planes[0][i] << 16) | (planes[1][i] << 8) | planes[2][i]);
            }
        }
        return rgb;
    }

    static int clip(int value) {
        return value < 0 ? 0 : Math.min(value, 255);
    }

    private static int clamp(int index, int max) {
        return index < 0 ? 0 : Math.min(index, max);
    }

    private static double[] gaussianKernel(double sigma) {
        int half = (int) Math.ceil(3 * sigma);
        double[] kernel = new double[half * 2 + 1];
        double sum = 0.0;
        for (int i = -half; i <= half; i++) {
            double value = Math.exp(-(i * i) / (2 * sigma * sigma));
            kernel[i + half] = value;
            sum += value;
        }
        for (int i = 0; i < kernel.length; i++) {
            kernel[i] /= sum;
        }
        return kernel;
    }
}
