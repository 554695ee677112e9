package net.imagecraft.service.canvas;

import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Iterator;
import java.util.List;
import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageTypeSpecifier;
import javax.imageio.ImageWriter;
import javax.imageio.metadata.IIOInvalidTreeException;
import javax.imageio.metadata.IIOMetadata;
import javax.imageio.metadata.IIOMetadataNode;
import javax.imageio.stream.ImageOutputStream;
import net.imagecraft.exception.ImageProcessingException;

/**
 * Writes frames as an infinitely looping GIF through the JDK's ImageIO GIF writer.
 */
final class GifSequenceEncoder {

    private static final String METADATA_FORMAT = "javax_imageio_gif_image_1.0";

    private GifSequenceEncoder() {
    }

    static byte[] encode(List<BufferedImage> frames, int frameDelayMillis) {
        if (frames.isEmpty()) {
            throw new ImageProcessingException("Cannot encode an animation without frames");
        }
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("gif");
        if (!writers.hasNext()) {
            throw new ImageProcessingException("No GIF ImageWriters available");
        }
        ImageWriter writer = writers.next();
        int delayCentiseconds = delayCentiseconds(frameDelayMillis);
        try (ByteArrayOutputStream out = new ByteArrayOutputStream();
             ImageOutputStream ios = ImageIO.createImageOutputStream(out)) {
            writer.setOutput(ios);
            writer.prepareWriteSequence(null);
            for (BufferedImage frame : frames) {
                BufferedImage rgb = RasterCodec.toRgb(frame);
                IIOMetadata metadata = frameMetadata(writer, rgb, delayCentiseconds);
                writer.writeToSequence(new IIOImage(rgb, null, metadata), null);
            }
            writer.endWriteSequence();
            ios.flush();
            return out.toByteArray();
        } catch (IOException e) {
            throw new ImageProcessingException("Failed to encode GIF: " + e.getMessage(), e);
        } finally {
            writer.dispose();
        }
    }

    /**
     * GIF stores delays in hundredths of a second, so sub-centisecond precision is truncated away:
     * 66 ms is written as 6. Never below 1, since some viewers treat 0 as "as fast as possible".
     */
    static int delayCentiseconds(int frameDelayMillis) {
        return Math.max(1, frameDelayMillis / 10);
    }

    private static IIOMetadata frameMetadata(ImageWriter writer, BufferedImage frame, int delayCentiseconds)
            throws IIOInvalidTreeException {
        IIOMetadata metadata = writer.getDefaultImageMetadata(ImageTypeSpecifier.createFromRenderedImage(frame), null);
        IIOMetadataNode root = (IIOMetadataNode) metadata.getAsTree(METADATA_FORMAT);

        IIOMetadataNode control = child(root, "GraphicControlExtension");
        control.setAttribute("disposalMethod", "none");
        control.setAttribute("userInputFlag", "FALSE");
        control.setAttribute("transparentColorFlag", "FALSE");
        control.setAttribute("delayTime", Integer.toString(delayCentiseconds));
        control.setAttribute("transparentColorIndex", "0");

        IIOMetadataNode extensions = child(root, "ApplicationExtensions");
        IIOMetadataNode loop = new IIOMetadataNode("ApplicationExtension");
        loop.setAttribute("applicationID", "NETSCAPE");
        loop.setAttribute("authenticationCode", "2.0");
        // sub-block 1, loop count 0 (forever), little endian
        loop.setUserObject(new byte[] {0x1, 0x0, 0x0});
        extensions.appendChild(loop);

        metadata.setFromTree(METADATA_FORMAT, root);
        return metadata;
    }

    private static IIOMetadataNode child(IIOMetadataNode root, String name) {
        for (int i = 0; i < root.getLength(); i++) {
            if (root.item(i).getNodeName().equalsIgnoreCase(name)) {
                return (IIOMetadataNode) root.item(i);
            }
        }
        IIOMetadataNode node = new IIOMetadataNode(name);
        root.appendChild(node);
        return node;
    }
}
