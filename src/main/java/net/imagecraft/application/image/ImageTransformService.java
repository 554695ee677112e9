package net.imagecraft.application.image;

import java.awt.image.BufferedImage;
import java.util.Set;
import net.imagecraft.exception.ImageValidationException;
import net.imagecraft.model.image.AdjustmentLevels;
import net.imagecraft.model.image.GifEffect;
import net.imagecraft.model.image.ImageAsset;
import net.imagecraft.model.image.OperationKind;
import net.imagecraft.model.image.OperationMetadata;
import net.imagecraft.model.image.PixelDimensions;
import net.imagecraft.service.canvas.DepthMapRenderer;
import net.imagecraft.service.canvas.GifAnimation;
import net.imagecraft.service.canvas.GifAnimationRenderer;
import net.imagecraft.service.canvas.ImageAdjuster;
import net.imagecraft.service.canvas.RasterCodec;
import net.imagecraft.service.canvas.Resampler;
import net.imagecraft.service.canvas.WatermarkRenderer;
import net.imagecraft.service.canvas.WatermarkSpec;
import org.springframework.stereotype.Service;

/**
 * Deterministic local transforms of a stored asset. None of these call a model backend.
 */
@Service
public class ImageTransformService {

    static final Set<Integer> UPSCALE_FACTORS = Set.of(2, 4);

    private final AssetRecorder assetRecorder;
    private final ImageAdjuster imageAdjuster;
    private final WatermarkRenderer watermarkRenderer;
    private final DepthMapRenderer depthMapRenderer;
    private final GifAnimationRenderer gifAnimationRenderer;

    public ImageTransformService(AssetRecorder assetRecorder,
                                 ImageAdjuster imageAdjuster,
                                 WatermarkRenderer watermarkRenderer,
                                 DepthMapRenderer depthMapRenderer,
                                 GifAnimationRenderer gifAnimationRenderer) {
        this.assetRecorder = assetRecorder;
        this.imageAdjuster = imageAdjuster;
        this.watermarkRenderer = watermarkRenderer;
        this.depthMapRenderer = depthMapRenderer;
        this.gifAnimationRenderer = gifAnimationRenderer;
    }

    /**
     * @param factor 2 or 4
     */
    public ImageAsset upscale(String assetId, int factor) {
        if (!UPSCALE_FACTORS.contains(factor)) {
            throw new ImageValidationException("Scale must be 2 or 4, got " + factor);
        }
        ImageAsset parent = assetRecorder.requireAsset(assetId);
        BufferedImage source = RasterCodec.toStandardColorModel(RasterCodec.decode(assetRecorder.readRaster(parent)));
        PixelDimensions target = new PixelDimensions(source.getWidth() * factor, source.getHeight() * factor);
        BufferedImage upscaled = Resampler.resize(source, target.width(), target.height());
        return assetRecorder.record(childOf(parent, target)
            .operationKind(OperationKind.UPSCALE)
            .metadata(new OperationMetadata.Upscale(factor)), RasterCodec.encodePng(upscaled));
    }

    public ImageAsset adjust(String assetId, AdjustmentLevels levels) {
        ImageAsset parent = assetRecorder.requireAsset(assetId);
        byte[] png = imageAdjuster.apply(assetRecorder.readRaster(parent), levels);
        return assetRecorder.record(childOf(parent, parent.dimensions())
            .operationKind(OperationKind.ADJUST)
            .metadata(levels), png);
    }

    public ImageAsset watermark(String assetId, WatermarkSpec spec) {
        ImageAsset parent = assetRecorder.requireAsset(assetId);
        byte[] png = watermarkRenderer.apply(assetRecorder.readRaster(parent), spec);
        return assetRecorder.record(childOf(parent, parent.dimensions())
            .operationKind(OperationKind.WATERMARK)
            .metadata(new OperationMetadata.Watermark(spec.text(), spec.position(), spec.opacity())), png);
    }

    public ImageAsset depthMap(String assetId) {
        ImageAsset parent = assetRecorder.requireAsset(assetId);
        byte[] png = depthMapRenderer.render(assetRecorder.readRaster(parent));
        return assetRecorder.record(childOf(parent, parent.dimensions())
            .operationKind(OperationKind.DEPTH_MAP)
            .metadata(new OperationMetadata.None()), png);
    }

    /**
     * Renders a looping GIF. The animation is returned to the caller and not recorded as an asset.
     */
    public GifAnimation animate(String assetId, GifEffect effect, double durationSeconds, int fps) {
        ImageAsset asset = assetRecorder.requireAsset(assetId);
        return gifAnimationRenderer.render(assetRecorder.readRaster(asset), effect, durationSeconds, fps);
    }

    private static ImageAsset.ImageAssetBuilder childOf(ImageAsset parent, PixelDimensions dimensions) {
        return ImageAsset.builder()
            .parentId(parent.id())
            .prompt(parent.prompt())
            .style(parent.style())
            .dimensions(dimensions);
    }
}
