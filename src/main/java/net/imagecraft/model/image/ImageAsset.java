package net.imagecraft.model.image;

import jakarta.annotation.Nullable;
import java.time.Instant;
import java.util.Set;
import lombok.Builder;

/**
 * A generated or derived raster plus the metadata needed to navigate its lineage.
 *
 * <p>Assets are immutable once stored except for {@link #favorited()}. {@code parentId} is a weak
 * back-reference: the parent may later disappear from the store, and lineage walks stop there.</p>
 *
 * @param id             opaque unique identifier
 * @param parentId       source asset for derived images; {@code null} for roots
 * @param prompt         prompt shown to users for this asset
 * @param style          style preset label the asset was generated with
 * @param model          adapter id that produced the raster, when an adapter was involved
 * @param groupId        shared id for variants generated together
 * @param filename       raster file name inside the raster store
 * @param dimensions     exact pixel size of the stored raster
 * @param operationKind  single tag naming the producing operation; {@code null} only on legacy imports
 * @param metadata       variant-specific payload
 * @param legacyMarkers  boolean flags carried over from the older record format (e.g. {@code adjusted})
 * @param createdAt      creation instant
 * @param sequence       store-assigned insertion order, used to break {@code createdAt} ties
 * @param favorited      user favorite flag, the only mutable attribute
 */
@Builder(toBuilder = true)
public record ImageAsset(
        String id,
        @Nullable String parentId,
        String prompt,
        String style,
        @Nullable String model,
        @Nullable String groupId,
        String filename,
        PixelDimensions dimensions,
        @Nullable OperationKind operationKind,
        OperationMetadata metadata,
        Set<String> legacyMarkers,
        Instant createdAt,
        long sequence,
        boolean favorited) {

    public ImageAsset {
        metadata = metadata == null ? new OperationMetadata.None() : metadata;
        legacyMarkers = legacyMarkers == null ? Set.of() : Set.copyOf(legacyMarkers);
        style = style == null ? StylePreset.NONE.label() : style;
        prompt = prompt == null ? "" : prompt;
    }

    public boolean hasParent() {
        return parentId != null && !parentId.isBlank();
    }

    public ImageAsset withSequence(long newSequence) {
        return toBuilder().sequence(newSequence).build();
    }

    public ImageAsset withFavorited(boolean newFavorited) {
        return toBuilder().favorited(newFavorited).build();
    }
}
