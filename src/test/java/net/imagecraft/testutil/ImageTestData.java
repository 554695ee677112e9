package net.imagecraft.testutil;

import java.awt.Color;
import java.awt.image.BufferedImage;
import java.time.Instant;
import net.imagecraft.model.image.ImageAsset;
import net.imagecraft.model.image.OperationKind;
import net.imagecraft.model.image.PixelDimensions;
import net.imagecraft.service.canvas.RasterCodec;

/** Utility methods for constructing rasters and asset records in tests. */
public final class ImageTestData {
    private ImageTestData() {}

    public static BufferedImage solid(Color color, int width, int height) {
        BufferedImage img = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        int rgb = color.getRGB();
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                img.setRGB(x, y, rgb);
            }
        }
        return img;
    }

    public static BufferedImage gray(int level, int width, int height) {
        return solid(new Color(level, level, level), width, height);
    }

    public static byte[] solidPng(Color color, int width, int height) {
        return RasterCodec.encodePng(solid(color, width, height));
    }

    public static ImageAsset root(String id, Instant createdAt) {
        return asset(id, null, OperationKind.ORIGINAL, createdAt);
    }

    public static ImageAsset child(String id, String parentId, OperationKind kind, Instant createdAt) {
        return asset(id, parentId, kind, createdAt);
    }

    public static ImageAsset asset(String id, String parentId, OperationKind kind, Instant createdAt) {
        return ImageAsset.builder()
            .id(id)
            .parentId(parentId)
            .prompt("prompt for " + id)
            .style("none")
            .filename(id + ".png")
            .dimensions(new PixelDimensions(1024, 1024))
            .operationKind(kind)
            .createdAt(createdAt)
            .build();
    }
}
