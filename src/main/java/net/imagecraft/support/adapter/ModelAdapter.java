package net.imagecraft.support.adapter;

import jakarta.annotation.Nullable;
import net.imagecraft.model.image.PixelDimensions;

/**
 * A generative image backend.
 *
 * <p>Implementations signal every failure (transport, quota, content policy, empty payload) by
 * throwing; callers treat all of them alike and fall back to the next backend.</p>
 */
public interface ModelAdapter {

    /**
     * Stable identity used for preferred-model selection and failure reports.
     */
    String id();

    /**
     * Text-to-image generation.
     *
     * @return encoded raster bytes, in whatever size the backend chose to return
     */
    byte[] synthesize(String prompt, PixelDimensions size);

    /**
     * Image edit. Transparent mask pixels mark the region to regenerate; without a mask the
     * backend may change the whole image.
     */
    byte[] edit(byte[] source, @Nullable byte[] mask, String prompt, PixelDimensions size);
}
