package net.imagecraft.service.canvas;

/**
 * ITU-R 601-2 luma transform, the same weights used for "L" mode conversions.
 */
final class Luminance {

    private Luminance() {
    }

    static int of(int rgb) {
        int r = (rgb >> 16) & 0xFF;
        int g = (rgb >> 8) & 0xFF;
        int b = rgb & 0xFF;
        return (r * 299 + g * 587 + b * 114) / 1000;
    }

    /**
     * Mean luma over every pixel, in [0, 255].
     */
    static double mean(java.awt.image.BufferedImage image) {
        long sum = 0;
        int width = image.getWidth();
        int height = image.getHeight();
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                sum += of(image.getRGB(x, y));
            }
        }
        long count = (long) width * height;
        return count == 0 ? 0.0 : (double) sum / count;
    }

    static int[] grayPlane(java.awt.image.BufferedImage image) {
        int width = image.getWidth();
        int height = image.getHeight();
        int[] plane = new int[width * height];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                plane[y * width + x] = of(image.getRGB(x, y));
            }
        }
        return plane;
    }
}
