package net.imagecraft.service.canvas;

import net.imagecraft.model.image.GifEffect;
import net.imagecraft.model.image.PixelDimensions;

/**
 * Encoded looping GIF.
 *
 * @param bytes            GIF89a data
 * @param effect           effect that produced the frames
 * @param frameCount       number of frames
 * @param frameDelayMillis nominal per-frame duration, {@code 1000 / fps}
 * @param frameSize        size of every frame after bounding
 */
public record GifAnimation(byte[] bytes, GifEffect effect, int frameCount, int frameDelayMillis, PixelDimensions frameSize) {
}
