package net.imagecraft.application.image;

import java.awt.image.BufferedImage;
import java.util.Collection;
import java.util.List;
import net.imagecraft.application.ai.PromptComposer;
import net.imagecraft.application.fallback.FallbackExecutor;
import net.imagecraft.application.fallback.FallbackResult;
import net.imagecraft.application.fallback.FallbackStrategy;
import net.imagecraft.config.ImageCraftProperties;
import net.imagecraft.model.image.ImageAsset;
import net.imagecraft.model.image.OperationKind;
import net.imagecraft.model.image.OperationMetadata;
import net.imagecraft.model.image.OutpaintDirection;
import net.imagecraft.model.image.PixelDimensions;
import net.imagecraft.service.canvas.CanvasNormalizer;
import net.imagecraft.service.canvas.MaskAlphaConverter;
import net.imagecraft.service.canvas.OutpaintPlan;
import net.imagecraft.service.canvas.OutpaintPlanner;
import net.imagecraft.service.canvas.RasterCodec;
import net.imagecraft.service.canvas.Resampler;
import net.imagecraft.support.adapter.GenerationSizes;
import net.imagecraft.support.adapter.ModelAdapter;
import net.imagecraft.support.adapter.ModelAdapterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * AI-backed edits that derive a child asset from a stored parent.
 *
 * <p>Mask-aware edits run a staged chain: edit with mask, then edit without mask, then
 * regeneration from text context alone. Each stage is one strategy in a first-success chain.</p>
 */
@Service
public class ImageEditService {

    private static final Logger log = LoggerFactory.getLogger(ImageEditService.class);

    static final String BLEND_SUFFIX = ". Seamlessly blend with the surrounding image context.";
    static final String OUTPAINT_SUFFIX = ". Extend the scene naturally beyond the original borders.";
    static final String PRESERVE_STYLE_INSTRUCTION =
        " Maintain the exact same artistic style, lighting, color palette, and composition.";
    static final int MAX_OBJECT_LENGTH = 200;

    private final FallbackExecutor fallbackExecutor;
    private final ModelAdapterRegistry adapterRegistry;
    private final PromptComposer promptComposer;
    private final CanvasNormalizer canvasNormalizer;
    private final MaskAlphaConverter maskAlphaConverter;
    private final OutpaintPlanner outpaintPlanner;
    private final AssetRecorder assetRecorder;
    private final ImageCraftProperties properties;

    public ImageEditService(FallbackExecutor fallbackExecutor,
                            ModelAdapterRegistry adapterRegistry,
                            PromptComposer promptComposer,
                            CanvasNormalizer canvasNormalizer,
                            MaskAlphaConverter maskAlphaConverter,
                            OutpaintPlanner outpaintPlanner,
                            AssetRecorder assetRecorder,
                            ImageCraftProperties properties) {
        this.fallbackExecutor = fallbackExecutor;
        this.adapterRegistry = adapterRegistry;
        this.promptComposer = promptComposer;
        this.canvasNormalizer = canvasNormalizer;
        this.maskAlphaConverter = maskAlphaConverter;
        this.outpaintPlanner = outpaintPlanner;
        this.assetRecorder = assetRecorder;
        this.properties = properties;
    }

    /**
     * Regenerates the parent with a refinement instruction merged into its prompt.
     */
    public ImageAsset refine(String parentId, String instruction) {
        String refinement = RequestValidation.requireText("instruction", instruction, RequestValidation.MAX_PROMPT_LENGTH);
        ImageAsset parent = assetRecorder.requireAsset(parentId);

        String merged = promptComposer.mergeRefinement(parent.prompt(), refinement);
        String generationPrompt = promptComposer.withStyle(merged, parent.style());
        PixelDimensions apiSize = GenerationSizes.closestTo(parent.dimensions());
        FallbackResult.Success<byte[]> result = fallbackExecutor.executeTracked(
            FallbackStrategy.synthesizeAll(adapterRegistry.ordered(), generationPrompt, apiSize));
        byte[] png = canvasNormalizer.normalize(result.value(), parent.dimensions());

        return assetRecorder.record(childOf(parent)
            .prompt(merged)
            .model(result.strategyId())
            .operationKind(OperationKind.REFINE)
            .metadata(new OperationMetadata.Refinement(parent.prompt(), refinement)), png);
    }

    /**
     * Regenerates the white region of {@code mask} (black is kept).
     */
    public ImageAsset inpaint(String parentId, byte[] mask, String prompt) {
        RequestValidation.requireImage("mask", mask);
        String editPrompt = RequestValidation.requirePrompt(prompt);
        ImageAsset parent = assetRecorder.requireAsset(parentId);
        PixelDimensions apiSize = GenerationSizes.closestTo(parent.dimensions());

        BufferedImage parentRaster = RasterCodec.decode(assetRecorder.readRaster(parent));
        byte[] source = RasterCodec.encodePng(Resampler.resize(parentRaster, apiSize.width(), apiSize.height()));
        byte[] alphaMask = maskAlphaConverter.toAlphaMask(mask, apiSize);

        FallbackResult.Success<byte[]> result = fallbackExecutor.executeTracked(
            maskedEditChain(source, alphaMask, editPrompt, editPrompt + BLEND_SUFFIX, apiSize));
        byte[] png = canvasNormalizer.normalize(result.value(), parent.dimensions());

        return assetRecorder.record(childOf(parent)
            .prompt(editPrompt)
            .model(modelOf(result.strategyId()))
            .operationKind(OperationKind.INPAINT)
            .metadata(new OperationMetadata.Inpaint(result.strategyId())), png);
    }

    /**
     * Extends the parent's canvas and lets the edit backend fill the new regions.
     */
    public ImageAsset outpaint(String parentId, Collection<OutpaintDirection> directions, int amountPercent, String prompt) {
        ImageAsset parent = assetRecorder.requireAsset(parentId);
        OutpaintPlan plan = outpaintPlanner.plan(parent.dimensions(), directions, amountPercent);
        String fillPrompt = prompt == null || prompt.isBlank() ? parent.prompt() : RequestValidation.requirePrompt(prompt);

        BufferedImage parentRaster = RasterCodec.decode(assetRecorder.readRaster(parent));
        BufferedImage canvas = outpaintPlanner.extendCanvas(parentRaster, plan);
        BufferedImage mask = outpaintPlanner.buildMask(plan);
        PixelDimensions apiSize = GenerationSizes.closestTo(plan.target());
        byte[] source = RasterCodec.encodePng(Resampler.resize(canvas, apiSize.width(), apiSize.height()));
        byte[] apiMask = RasterCodec.encodePng(Resampler.resize(mask, apiSize.width(), apiSize.height()));

        List<FallbackStrategy<byte[]>> chain = List.of(
            editStage("edit-with-mask", editAdapter(), source, apiMask, fillPrompt, apiSize),
            regenerateStage(fillPrompt + OUTPAINT_SUFFIX, apiSize));
        FallbackResult.Success<byte[]> result = fallbackExecutor.executeTracked(chain);
        byte[] png = canvasNormalizer.resizeExact(result.value(), plan.target());

        log.info("Outpainted {} from {} to {} ({})", parentId, plan.original(), plan.target(), plan.directions());
        return assetRecorder.record(childOf(parent)
            .prompt(fillPrompt)
            .model(modelOf(result.strategyId()))
            .dimensions(plan.target())
            .operationKind(OperationKind.OUTPAINT)
            .metadata(new OperationMetadata.Outpaint(plan.directions(), amountPercent, plan.original())), png);
    }

    /**
     * Replaces one object in the parent while keeping everything else.
     */
    public ImageAsset replaceObject(String parentId, String targetObject, String replacement, boolean preserveStyle) {
        String target = RequestValidation.requireText("target_object", targetObject, MAX_OBJECT_LENGTH);
        String substitute = RequestValidation.requireText("replacement", replacement, MAX_OBJECT_LENGTH);
        ImageAsset parent = assetRecorder.requireAsset(parentId);
        byte[] source = assetRecorder.readRaster(parent);

        String editPrompt = replacementPrompt(target, substitute, preserveStyle);
        PixelDimensions apiSize = GenerationSizes.closestTo(parent.dimensions());
        FallbackResult.Success<byte[]> result = fallbackExecutor.executeTracked(
            List.of(editStage("edit", editAdapter(), source, null, editPrompt, apiSize)));
        byte[] png = canvasNormalizer.normalize(result.value(), parent.dimensions());

        return assetRecorder.record(childOf(parent)
            .prompt(editPrompt)
            .model(modelOf(result.strategyId()))
            .operationKind(OperationKind.OBJECT_REPLACEMENT)
            .metadata(new OperationMetadata.ObjectReplacement(target, substitute, preserveStyle)), png);
    }

    static String replacementPrompt(String target, String replacement, boolean preserveStyle) {
        return "Replace '" + target + "' with '" + replacement
            + "' in this image, keeping everything else exactly the same."
            + (preserveStyle ? PRESERVE_STYLE_INSTRUCTION : "");
    }

    private List<FallbackStrategy<byte[]>> maskedEditChain(byte[] source, byte[] mask, String prompt,
                                                           String regeneratePrompt, PixelDimensions size) {
        ModelAdapter editor = editAdapter();
        return List.of(
            editStage("edit-with-mask", editor, source, mask, prompt, size),
            editStage("edit-without-mask", editor, source, null, prompt, size),
            regenerateStage(regeneratePrompt, size));
    }

    private static FallbackStrategy<byte[]> editStage(String stage, ModelAdapter adapter, byte[] source, byte[] mask,
                                                      String prompt, PixelDimensions size) {
        return FallbackStrategy.of(stage + ":" + adapter.id(), () -> adapter.edit(source, mask, prompt, size));
    }

    private FallbackStrategy<byte[]> regenerateStage(String prompt, PixelDimensions size) {
        ModelAdapter generator = adapterRegistry.require(properties.getModels().getRegenerateModel());
        return FallbackStrategy.of("regenerate:" + generator.id(), () -> generator.synthesize(prompt, size));
    }

    private ModelAdapter editAdapter() {
        return adapterRegistry.require(properties.getModels().getEditModel());
    }

    private static ImageAsset.ImageAssetBuilder childOf(ImageAsset parent) {
        return ImageAsset.builder()
            .parentId(parent.id())
            .prompt(parent.prompt())
            .style(parent.style())
            .dimensions(parent.dimensions());
    }

    /**
     * Adapter id from a stage id such as {@code edit-with-mask:gpt-image}.
     */
    static String modelOf(String strategyId) {
        int separator = strategyId.lastIndexOf(':');
        return separator < 0 ? strategyId : strategyId.substring(separator + 1);
    }
}
