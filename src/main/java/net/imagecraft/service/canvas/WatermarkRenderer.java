package net.imagecraft.service.canvas;

import java.awt.AlphaComposite;
import java.awt.Color;
import java.awt.Font;
import java.awt.FontMetrics;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import net.imagecraft.model.image.WatermarkPosition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Composites resolution-independent text watermarks onto a raster.
 *
 * <p>The text is first drawn onto a transparent overlay the size of the base image, with a
 * contrasting shadow underneath, and the overlay is then alpha-composited onto the base.
 * The result is always flattened to opaque RGB.</p>
 */
@Component
public class WatermarkRenderer {

    private static final Logger log = LoggerFactory.getLogger(WatermarkRenderer.class);

    static final int REFERENCE_WIDTH = 1024;
    static final int MIN_SCALED_FONT_SIZE = 16;
    static final int PADDING = 20;
    static final int TILE_GAP = 80;
    static final int MAX_SHADOW_ALPHA = 180;
    static final double TILE_ROTATION_DEGREES = -45.0;
    private static final String FONT_FAMILY = "SansSerif";

    public byte[] apply(byte[] imageBytes, WatermarkSpec spec) {
        return RasterCodec.encodePng(apply(RasterCodec.decode(imageBytes), spec));
    }

    public BufferedImage apply(BufferedImage base, WatermarkSpec spec) {
        BufferedImage argb = RasterCodec.copy(RasterCodec.toArgb(base));
        Color shadow = shadowColorFor(base);
        BufferedImage overlay = renderOverlay(argb.getWidth(), argb.getHeight(), spec, shadow);

        Graphics2D graphics = argb.createGraphics();
        try {
            graphics.setComposite(AlphaComposite.SrcOver);
            graphics.drawImage(overlay, 0, 0, null);
        } finally {
            graphics.dispose();
        }
        log.debug("Applied {} watermark at opacity {} to {}x{} image",
            spec.position().label(), spec.opacity(), argb.getWidth(), argb.getHeight());
        return RasterCodec.toRgb(argb);
    }

    /**
     * Draws shadow and text onto a transparent overlay. Each pass is rendered as a coverage mask
     * and blended into the overlay by that coverage, so a fully covered pixel takes the pass
     * colour exactly and no pixel ends up more opaque than the stronger of the two passes.
     */
    BufferedImage renderOverlay(int width, int height, WatermarkSpec spec, Color shadowBase) {
        int scaledSize = scaledFontSize(spec.fontSize(), width);
        Font font = new Font(FONT_FAMILY, Font.PLAIN, scaledSize);
        int shadowOffset = Math.max(2, scaledSize / 20);
        int alpha = spec.textAlpha();

        BufferedImage overlay = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        paintCoverage(overlay, coverageMask(width, height, spec, font, shadowOffset),
            withAlpha(shadowBase, Math.min(alpha, MAX_SHADOW_ALPHA)));
        paintCoverage(overlay, coverageMask(width, height, spec, font, 0), withAlpha(spec.rgb(), alpha));
        return overlay;
    }

    static int scaledFontSize(int fontSize, int imageWidth) {
        return Math.max((int) ((long) fontSize * imageWidth / (double) REFERENCE_WIDTH), MIN_SCALED_FONT_SIZE);
    }

    /**
     * Light shadow on dark images and dark shadow on light ones.
     */
    static Color shadowColorFor(BufferedImage base) {
        return Luminance.mean(base) > 127.5 ? Color.BLACK : Color.WHITE;
    }

    private static int[] anchor(WatermarkPosition position,
                                int width, int height, int textWidth, int textHeight) {
        return switch (position) {
            case TOP_LEFT -> new int[] {PADDING, PADDING};
            case TOP_RIGHT -> new int[] {width - textWidth - PADDING, PADDING};
            case BOTTOM_LEFT -> new int[] {PADDING, height - textHeight - PADDING};
            case BOTTOM_RIGHT -> new int[] {width - textWidth - PADDING, height - textHeight - PADDING};
            case CENTER, TILED -> new int[] {(width - textWidth) / 2, (height - textHeight) / 2};
        };
    }

    /**
     * Anti-aliased text drawn opaque onto a transparent canvas; the alpha channel is the glyph
     * coverage.
     */
    private static BufferedImage coverageMask(int width, int height, WatermarkSpec spec, Font font, int offset) {
        BufferedImage mask = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        Graphics2D graphics = mask.createGraphics();
        try {
            applyTextHints(graphics);
            graphics.setFont(font);
            graphics.setColor(Color.WHITE);
            FontMetrics metrics = graphics.getFontMetrics();
            int textWidth = metrics.stringWidth(spec.text());
            int textHeight = metrics.getAscent() + metrics.getDescent();

            if (spec.position() == WatermarkPosition.TILED) {
                graphics.rotate(Math.toRadians(TILE_ROTATION_DEGREES), width / 2.0, height / 2.0);
                int stepX = textWidth + TILE_GAP;
                int stepY = textHeight + TILE_GAP;
                for (int y = -height; y < height * 2; y += stepY) {
                    for (int x = -width; x < width * 2; x += stepX) {
                        graphics.drawString(spec.text(), x + offset, y + metrics.getAscent() + offset);
                    }
                }
            } else {
                int[] anchor = anchor(spec.position(), width, height, textWidth, textHeight);
                graphics.drawString(spec.text(), anchor[0] + offset, anchor[1] + metrics.getAscent() + offset);
            }
        } finally {
            graphics.dispose();
        }
        return mask;
    }

    private static void paintCoverage(BufferedImage overlay, BufferedImage mask, Color ink) {
        int inkArgb = ink.getRGB();
        for (int y = 0; y < overlay.getHeight(); y++) {
            for (int x = 0; x < overlay.getWidth(); x++) {
                int coverage = mask.getRGB(x, y) >>> 24;
                if (coverage == 0) {
                    continue;
                }
                int current = overlay.getRGB(x, y);
                int blended = 0;
                for (int shift = 0; shift <= 24; shift += 8) {
                    int channel = blend((current >>> shift) & 0xFF, (inkArgb >>> shift) & 0xFF, coverage);
                    blended |= channel << shift;
                }
                overlay.setRGB(x, y, blended);
            }
        }
    }

    static int blend(int from, int to, int coverage) {
        return (from * (255 - coverage) + to * coverage + 127) / 255;
    }

    private static Color withAlpha(Color color, int alpha) {
        return new Color(color.getRed(), color.getGreen(), color.getBlue(), alpha);
    }

    private static void applyTextHints(Graphics2D graphics) {
        graphics.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
        graphics.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
        graphics.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
    }
}
