package net.imagecraft.model.batch;

import jakarta.annotation.Nullable;
import net.imagecraft.model.image.OperationKind;
import net.imagecraft.model.image.PixelDimensions;
import net.imagecraft.model.image.TextOverlay;

/**
 * One independent text-to-image request: the unit of work of the single-asset pipeline and of
 * every batch mode.
 *
 * @param prompt          user prompt, 1..2000 characters
 * @param style           style preset label
 * @param size            requested output size
 * @param preferredModel  adapter id to try first, or {@code null} for registry order
 * @param enhance         whether to run prompt enrichment first
 * @param textOverlay     optional in-image text instruction
 * @param groupId         shared id for variants generated together
 * @param kind            asset kind to record; {@code null} lets the pipeline pick ORIGINAL or STYLE_PRESET
 */
public record GenerationUnit(
        String prompt,
        String style,
        PixelDimensions size,
        @Nullable String preferredModel,
        boolean enhance,
        @Nullable TextOverlay textOverlay,
        @Nullable String groupId,
        @Nullable OperationKind kind) {

    public static GenerationUnit of(String prompt, String style, PixelDimensions size) {
        return new GenerationUnit(prompt, style, size, null, false, null, null, null);
    }

    public GenerationUnit withPreferredModel(String model) {
        return new GenerationUnit(prompt, style, size, model, enhance, textOverlay, groupId, kind);
    }

    public GenerationUnit withGroupId(String newGroupId) {
        return new GenerationUnit(prompt, style, size, preferredModel, enhance, textOverlay, newGroupId, kind);
    }

    public GenerationUnit withKind(OperationKind newKind) {
        return new GenerationUnit(prompt, style, size, preferredModel, enhance, textOverlay, groupId, newKind);
    }
}
