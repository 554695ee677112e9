package net.imagecraft.application.image;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import net.imagecraft.application.ai.ComposedPrompt;
import net.imagecraft.application.ai.PromptComposer;
import net.imagecraft.application.fallback.FallbackExecutor;
import net.imagecraft.application.fallback.FallbackResult;
import net.imagecraft.application.fallback.FallbackStrategy;
import net.imagecraft.config.ImageCraftProperties;
import net.imagecraft.exception.ImageValidationException;
import net.imagecraft.model.batch.GenerationUnit;
import net.imagecraft.model.image.ImageAsset;
import net.imagecraft.model.image.OperationKind;
import net.imagecraft.model.image.OperationMetadata;
import net.imagecraft.model.image.PixelDimensions;
import net.imagecraft.model.image.StylePreset;
import net.imagecraft.service.canvas.CanvasNormalizer;
import net.imagecraft.support.adapter.GenerationSizes;
import net.imagecraft.support.adapter.ModelAdapter;
import net.imagecraft.support.adapter.ModelAdapterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Operations that create new root assets from text or uploaded references.
 *
 * <p>Every operation runs the single-asset pipeline: compose the prompt, run the backend fallback
 * chain, normalize the raster to the requested size and record the asset.</p>
 */
@Service
public class ImageGenerationService {

    private static final Logger log = LoggerFactory.getLogger(ImageGenerationService.class);

    static final String PRODUCT_PROMPT_TEMPLATE =
        "Professional product photography of %s, %s background, studio lighting, soft shadows, "
            + "sharp focus, high detail, commercial catalog quality";
    static final String DEFAULT_PRODUCT_BACKGROUND = "clean white";

    private final FallbackExecutor fallbackExecutor;
    private final ModelAdapterRegistry adapterRegistry;
    private final PromptComposer promptComposer;
    private final CanvasNormalizer canvasNormalizer;
    private final AssetRecorder assetRecorder;
    private final ImageCraftProperties properties;

    public ImageGenerationService(FallbackExecutor fallbackExecutor,
                                  ModelAdapterRegistry adapterRegistry,
                                  PromptComposer promptComposer,
                                  CanvasNormalizer canvasNormalizer,
                                  AssetRecorder assetRecorder,
                                  ImageCraftProperties properties) {
        this.fallbackExecutor = fallbackExecutor;
        this.adapterRegistry = adapterRegistry;
        this.promptComposer = promptComposer;
        this.canvasNormalizer = canvasNormalizer;
        this.assetRecorder = assetRecorder;
        this.properties = properties;
    }

    /**
     * Single-asset text-to-image pipeline. Batch units run through here as well.
     *
     * @throws ImageValidationException before any backend call for a bad prompt, size or model
     * @throws net.imagecraft.exception.AllAdaptersFailedException when every backend failed
     */
    public ImageAsset generate(GenerationUnit unit) {
        String prompt = RequestValidation.requirePrompt(unit.prompt());
        PixelDimensions size = requireGenerationSize(unit.size());
        List<ModelAdapter> adapters = adapterRegistry.orderedWithPreferred(unit.preferredModel());

        ComposedPrompt composed = promptComposer.compose(prompt, unit.style(), unit.enhance(), unit.textOverlay());
        FallbackResult.Success<byte[]> result = fallbackExecutor.executeTracked(
            FallbackStrategy.synthesizeAll(adapters, composed.generationPrompt(), size));
        byte[] png = canvasNormalizer.normalize(result.value(), size);

        OperationKind kind = unit.kind() != null ? unit.kind() : defaultKind(unit.style());
        return assetRecorder.record(ImageAsset.builder()
            .prompt(prompt)
            .style(styleLabel(unit.style()))
            .model(result.strategyId())
            .groupId(unit.groupId())
            .dimensions(size)
            .operationKind(kind)
            .metadata(new OperationMetadata.Generation(composed.enhancedPrompt(), null)), png);
    }

    /**
     * Generates a studio product shot from a product description.
     */
    public ImageAsset productPhoto(String productDescription, String background, PixelDimensions size, String preferredModel) {
        String product = RequestValidation.requireText("product description", productDescription, 500);
        String backdrop = background == null || background.isBlank() ? DEFAULT_PRODUCT_BACKGROUND : background.trim();
        String prompt = PRODUCT_PROMPT_TEMPLATE.formatted(product, backdrop);
        GenerationUnit unit = new GenerationUnit(prompt, StylePreset.NONE.label(), size, preferredModel,
            false, null, null, OperationKind.PRODUCT_PHOTO);
        return generate(unit);
    }

    /**
     * Generates from an uploaded reference image: the reference is described through enrichment
     * and sent to the edit backend, with text-only regeneration across every backend as the
     * last resort.
     */
    public ImageAsset generateFromImage(byte[] reference, String prompt, String style, PixelDimensions size) {
        RequestValidation.requireImage("reference image", reference);
        String userPrompt = RequestValidation.requirePrompt(prompt);
        PixelDimensions target = requireGenerationSize(size);
        ModelAdapter editAdapter = adapterRegistry.require(properties.getModels().getEditModel());

        byte[] normalizedReference = canvasNormalizer.normalize(reference, target);
        Optional<String> description = promptComposer.describeReference(normalizedReference);
        String generationPrompt = description
            .map(text -> promptComposer.withStyle("Based on this reference image: " + text
                + ". Now apply this modification: " + userPrompt, style))
            .orElseGet(() -> promptComposer.withStyle(userPrompt, style));

        List<FallbackStrategy<byte[]>> chain = new ArrayList<>();
        chain.add(FallbackStrategy.of("edit-reference:" + editAdapter.id(),
            () -> editAdapter.edit(normalizedReference, null, generationPrompt, target)));
        chain.add(FallbackStrategy.nested("regenerate", fallbackExecutor,
            FallbackStrategy.synthesizeAll(adapterRegistry.ordered(), generationPrompt, target)));
        FallbackResult.Success<byte[]> result = fallbackExecutor.executeTracked(chain);
        byte[] png = canvasNormalizer.normalize(result.value(), target);

        log.debug("Reference generation finished via {}", result.strategyId());
        return assetRecorder.record(ImageAsset.builder()
            .prompt(userPrompt)
            .style(styleLabel(style))
            .model(ImageEditService.modelOf(result.strategyId()))
            .dimensions(target)
            .operationKind(OperationKind.ORIGINAL)
            .metadata(new OperationMetadata.Generation(null, description.orElse(null))), png);
    }

    /**
     * Generates in the style of an uploaded reference, with strength in [0, 1] controlling how
     * strongly the described style is applied.
     */
    public ImageAsset styleTransfer(byte[] styleImage, String prompt, double strength, String style, PixelDimensions size) {
        RequestValidation.requireImage("style image", styleImage);
        String userPrompt = RequestValidation.requirePrompt(prompt);
        PixelDimensions target = requireGenerationSize(size);
        if (!(strength >= 0.0 && strength <= 1.0)) {
            throw new ImageValidationException("Strength must be between 0.0 and 1.0, got " + strength);
        }

        String styleDescription = promptComposer.describeStyle(styleImage);
        String generationPrompt = promptComposer.withStyle(
            userPrompt + ", " + strengthWord(strength) + " in the style of: " + styleDescription, style);
        FallbackResult.Success<byte[]> result = fallbackExecutor.executeTracked(
            FallbackStrategy.synthesizeAll(adapterRegistry.ordered(), generationPrompt, target));
        byte[] png = canvasNormalizer.normalize(result.value(), target);

        return assetRecorder.record(ImageAsset.builder()
            .prompt(userPrompt)
            .style(styleLabel(style))
            .model(result.strategyId())
            .dimensions(target)
            .operationKind(OperationKind.STYLE_TRANSFER)
            .metadata(new OperationMetadata.StyleTransfer(strength, styleDescription)), png);
    }

    static String strengthWord(double strength) {
        if (strength < 0.4) {
            return "subtly";
        }
        return strength < 0.7 ? "moderately" : "strongly";
    }

    private static PixelDimensions requireGenerationSize(PixelDimensions size) {
        if (size == null) {
            return GenerationSizes.SQUARE;
        }
        if (!GenerationSizes.VALID.contains(size)) {
            throw new ImageValidationException("Invalid size: " + size + ". Use one of " + GenerationSizes.VALID);
        }
        return size;
    }

    private static OperationKind defaultKind(String style) {
        return StylePreset.fromLabel(style) == StylePreset.NONE ? OperationKind.ORIGINAL : OperationKind.STYLE_PRESET;
    }

    private static String styleLabel(String style) {
        return StylePreset.fromLabel(style).label();
    }
}
