package net.imagecraft.model.image;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import java.util.List;
import java.util.Set;

/**
 * Variant-specific payload attached to an {@link ImageAsset}.
 *
 * <p>One record per payload shape; the JSON form carries a {@code type} discriminator so the
 * record store round-trips the exact variant.</p>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = OperationMetadata.None.class, name = "none"),
    @JsonSubTypes.Type(value = OperationMetadata.Generation.class, name = "generation"),
    @JsonSubTypes.Type(value = OperationMetadata.Refinement.class, name = "refinement"),
    @JsonSubTypes.Type(value = OperationMetadata.Inpaint.class, name = "inpaint"),
    @JsonSubTypes.Type(value = OperationMetadata.Upscale.class, name = "upscale"),
    @JsonSubTypes.Type(value = AdjustmentLevels.class, name = "adjustment"),
    @JsonSubTypes.Type(value = OperationMetadata.Watermark.class, name = "watermark"),
    @JsonSubTypes.Type(value = OperationMetadata.Outpaint.class, name = "outpaint"),
    @JsonSubTypes.Type(value = OperationMetadata.StyleTransfer.class, name = "style-transfer"),
    @JsonSubTypes.Type(value = OperationMetadata.ObjectReplacement.class, name = "object-replacement")
})
public sealed interface OperationMetadata permits OperationMetadata.None,
                                                  OperationMetadata.Generation,
                                                  OperationMetadata.Refinement,
                                                  OperationMetadata.Inpaint,
                                                  OperationMetadata.Upscale,
                                                  AdjustmentLevels,
                                                  OperationMetadata.Watermark,
                                                  OperationMetadata.Outpaint,
                                                  OperationMetadata.StyleTransfer,
                                                  OperationMetadata.ObjectReplacement {

    /** Operations with no parameters beyond the source asset (depth maps, legacy imports). */
    record None() implements OperationMetadata {
    }

    /**
     * Text-to-image generation details.
     *
     * @param enhancedPrompt enrichment output when enhancement ran, otherwise {@code null}
     * @param referenceDescription description of an uploaded reference image, when one was used
     */
    record Generation(String enhancedPrompt, String referenceDescription) implements OperationMetadata {
    }

    record Refinement(String originalPrompt, String instruction) implements OperationMetadata {
    }

    /**
     * @param editStage name of the edit strategy that produced the raster
     */
    record Inpaint(String editStage) implements OperationMetadata {
    }

    record Upscale(int factor) implements OperationMetadata {
    }

    record Watermark(String text, WatermarkPosition position, double opacity) implements OperationMetadata {
    }

    record Outpaint(List<OutpaintDirection> directions, int amountPercent, PixelDimensions originalSize)
        implements OperationMetadata {
        public Outpaint {
            directions = directions == null ? List.of() : List.copyOf(directions);
        }

        public static Outpaint of(Set<OutpaintDirection> directions, int amountPercent, PixelDimensions originalSize) {
            return new Outpaint(directions.stream().sorted().toList(), amountPercent, originalSize);
        }
    }

    record StyleTransfer(double strength, String styleDescription) implements OperationMetadata {
    }

    record ObjectReplacement(String targetObject, String replacement, boolean preserveStyle)
        implements OperationMetadata {
    }
}
