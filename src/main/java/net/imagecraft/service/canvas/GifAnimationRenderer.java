package net.imagecraft.service.canvas;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;
import net.imagecraft.exception.ImageValidationException;
import net.imagecraft.model.image.GifEffect;
import net.imagecraft.model.image.PixelDimensions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Generates parametric animations from a still image.
 *
 * <p>Every frame is derived from the original full-resolution image at normalized progress
 * {@code t in [0, 1]}; effects never accumulate across frames.</p>
 */
@Component
public class GifAnimationRenderer {

    private static final Logger log = LoggerFactory.getLogger(GifAnimationRenderer.class);

    static final int MAX_FRAME_DIMENSION = 512;
    static final double MAX_DURATION_SECONDS = 10.0;
    static final int MIN_FPS = 1;
    static final int MAX_FPS = 30;

    static final double ZOOM_RANGE = 0.3;
    static final double PAN_WINDOW = 0.8;
    static final double PAN_TRAVEL = 0.2;
    static final double PULSE_RANGE = 0.1;
    static final double ROTATE_START_DEGREES = -5.0;
    static final double ROTATE_SWEEP_DEGREES = 10.0;

    public GifAnimation render(byte[] imageBytes, GifEffect effect, double durationSeconds, int fps) {
        BufferedImage source = RasterCodec.toRgb(RasterCodec.decode(imageBytes));
        List<BufferedImage> frames = renderFrames(source, effect, durationSeconds, fps);
        int delayMillis = frameDelayMillis(fps);
        byte[] encoded = GifSequenceEncoder.encode(frames, delayMillis);
        BufferedImage first = frames.get(0);
        log.info("Rendered {} animation: {} frames at {} fps, {}x{}",
            effect, frames.size(), fps, first.getWidth(), first.getHeight());
        return new GifAnimation(encoded, effect, frames.size(), delayMillis,
            new PixelDimensions(first.getWidth(), first.getHeight()));
    }

    /**
     * Renders the bounded frames without encoding them.
     *
     * @throws ImageValidationException when duration is outside (0, 10] or fps outside 1..30
     */
    public List<BufferedImage> renderFrames(BufferedImage source, GifEffect effect, double durationSeconds, int fps) {
        int total = frameCount(durationSeconds, fps);
        BufferedImage rgb = RasterCodec.toRgb(source);
        List<BufferedImage> frames = new ArrayList<>(total);
        for (int i = 0; i < total; i++) {
            double t = total > 1 ? (double) i / (total - 1) : 0.0;
            frames.add(Resampler.fitWithin(frame(rgb, effect, t), MAX_FRAME_DIMENSION));
        }
        return frames;
    }

    static int frameCount(double durationSeconds, int fps) {
        if (!(durationSeconds > 0.0 && durationSeconds <= MAX_DURATION_SECONDS)) {
            throw new ImageValidationException("Animation duration must be greater than 0 and at most 10 seconds, got " + durationSeconds);
        }
        if (fps < MIN_FPS || fps > MAX_FPS) {
            throw new ImageValidationException("Animation fps must be between 1 and 30, got " + fps);
        }
        // half-to-even, so 0.5s at 5 fps gives 2 frames
        return Math.max(1, (int) Math.rint(durationSeconds * fps));
    }

    /**
     * Per-frame delay, truncated: 15 fps gives 66 ms.
     */
    static int frameDelayMillis(int fps) {
        return 1000 / fps;
    }

    static BufferedImage frame(BufferedImage source, GifEffect effect, double t) {
        return switch (effect) {
            case ZOOM -> zoom(source, zoomScale(t));
            case PAN -> pan(source, t);
            case ROTATE -> rotate(source, rotationDegrees(t));
            case PULSE -> zoom(source, pulseScale(t));
            case FADE -> fade(source, t);
        };
    }

    static double zoomScale(double t) {
        return 1.0 + ZOOM_RANGE * t;
    }

    static double pulseScale(double t) {
        return 1.0 + PULSE_RANGE * Math.sin(2 * Math.PI * t);
    }

    static double rotationDegrees(double t) {
        return ROTATE_START_DEGREES + ROTATE_SWEEP_DEGREES * t;
    }

    static int panWindowWidth(int width) {
        return Math.max(1, (int) (width * PAN_WINDOW));
    }

    /**
     * Left edge of the pan window, sliding right by {@code 0.2 * width * t}.
     */
    static int panOffset(int width, double t) {
        return Math.min(width - panWindowWidth(width), (int) (width * PAN_TRAVEL * t));
    }

    private static BufferedImage zoom(BufferedImage source, double scale) {
        int width = source.getWidth();
        int height = source.getHeight();
        int cropWidth = Math.max(1, Math.min(width, (int) (width / scale)));
        int cropHeight = Math.max(1, Math.min(height, (int) (height / scale)));
        int left = (width - cropWidth) / 2;
        int top = (height - cropHeight) / 2;
        return Resampler.resize(source.getSubimage(left, top, cropWidth, cropHeight), width, height);
    }

    private static BufferedImage pan(BufferedImage source, double t) {
        int width = source.getWidth();
        int height = source.getHeight();
        return Resampler.resize(source.getSubimage(panOffset(width, t), 0, panWindowWidth(width), height), width, height);
    }

    private static BufferedImage rotate(BufferedImage source, double degrees) {
        int width = source.getWidth();
        int height = source.getHeight();
        BufferedImage rotated = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D graphics = rotated.createGraphics();
        try {
            Resampler.applyQualityHints(graphics);
            graphics.setColor(Color.BLACK);
            graphics.fillRect(0, 0, width, height);
            // negative: counter-clockwise on screen for positive angles
            graphics.rotate(Math.toRadians(-degrees), width / 2.0, height / 2.0);
            graphics.drawImage(source, 0, 0, null);
        } finally {
            graphics.dispose();
        }
        return rotated;
    }

    private static BufferedImage fade(BufferedImage source, double t) {
        int width = source.getWidth();
        int height = source.getHeight();
        BufferedImage faded = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int pixel = source.getRGB(x, y);
                int r = (int) (((pixel >> 16) & 0xFF) * t);
                int g = (int) (((pixel >> 8) & 0xFF) * t);
                int b = (int) ((pixel & 0xFF) * t);
                faded.setRGB(x, y, (r << 16) | (g << 8) | b);
            }
        }
        return faded;
    }
}
