package net.imagecraft.service.canvas;

import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Iterator;
import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import net.imagecraft.exception.ImageProcessingException;

/**
 * Decoding and encoding between raw raster bytes and {@link BufferedImage}s.
 *
 * <p>All pipeline outputs are normalized to one of two fully specified color models:
 * {@link BufferedImage#TYPE_INT_RGB} or {@link BufferedImage#TYPE_INT_ARGB}.</p>
 */
public final class RasterCodec {

    private RasterCodec() {
    }

    /**
     * Decodes PNG/JPEG/GIF/BMP bytes.
     *
     * @throws ImageProcessingException when the bytes are empty or not a readable image
     */
    public static BufferedImage decode(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            throw new ImageProcessingException("Raster bytes are null or empty");
        }
        try (ByteArrayInputStream in = new ByteArrayInputStream(bytes)) {
            BufferedImage image = ImageIO.read(in);
            if (image == null) {
                throw new ImageProcessingException("Could not decode raster bytes; format unsupported or data corrupt");
            }
            return image;
        } catch (IOException e) {
            throw new ImageProcessingException("IOException while decoding raster: " + e.getMessage(), e);
        }
    }

    public static byte[] encodePng(BufferedImage image) {
        try (ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            if (!ImageIO.write(image, "png", out)) {
                throw new ImageProcessingException("No PNG writer is available");
            }
            return out.toByteArray();
        } catch (IOException e) {
            throw new ImageProcessingException("Failed to encode PNG: " + e.getMessage(), e);
        }
    }

    /**
     * Encodes as JPEG with explicit compression quality. Alpha is flattened first since the
     * JPEG writer rejects ARGB input.
     */
    public static byte[] encodeJpeg(BufferedImage image, float quality) {
        BufferedImage rgb = toRgb(image);
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("jpeg");
        if (!writers.hasNext()) {
            throw new ImageProcessingException("No JPEG ImageWriters available");
        }
        ImageWriter writer = writers.next();
        try (ByteArrayOutputStream out = new ByteArrayOutputStream();
             ImageOutputStream ios = ImageIO.createImageOutputStream(out)) {
            ImageWriteParam params = writer.getDefaultWriteParam();
            params.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            params.setCompressionQuality(quality);
            writer.setOutput(ios);
            writer.write(null, new IIOImage(rgb, null, null), params);
            ios.flush();
            return out.toByteArray();
        } catch (IOException e) {
            throw new ImageProcessingException("Failed to encode JPEG: " + e.getMessage(), e);
        } finally {
            writer.dispose();
        }
    }

    /**
     * Returns the image unchanged when it is already INT_RGB or INT_ARGB, otherwise converts it,
     * keeping an alpha channel only when the source has one.
     */
    public static BufferedImage toStandardColorModel(BufferedImage image) {
        int type = image.getType();
        if (type == BufferedImage.TYPE_INT_RGB || type == BufferedImage.TYPE_INT_ARGB) {
            return image;
        }
        return image.getColorModel().hasAlpha() ? toArgb(image) : toRgb(image);
    }

    public static BufferedImage toRgb(BufferedImage image) {
        if (image.getType() == BufferedImage.TYPE_INT_RGB) {
            return image;
        }
        return convert(image, BufferedImage.TYPE_INT_RGB);
    }

    public static BufferedImage toArgb(BufferedImage image) {
        if (image.getType() == BufferedImage.TYPE_INT_ARGB) {
            return image;
        }
        return convert(image, BufferedImage.TYPE_INT_ARGB);
    }

    public static BufferedImage copy(BufferedImage image) {
        return convert(image, image.getColorModel().hasAlpha() ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB);
    }

    private static BufferedImage convert(BufferedImage image, int type) {
        BufferedImage converted = new BufferedImage(image.getWidth(), image.getHeight(), type);
        Graphics2D g = converted.createGraphics();
        try {
            g.drawImage(image, 0, 0, null);
        } finally {
            g.dispose();
        }
        return converted;
    }
}
