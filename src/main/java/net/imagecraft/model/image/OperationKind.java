package net.imagecraft.model.image;

import java.util.Locale;

/**
 * The single pipeline operation that produced an {@link ImageAsset}.
 *
 * <p>Each asset carries exactly one kind. Records imported from the older flag-based
 * format are resolved to a kind by {@link net.imagecraft.service.lineage.OperationKindResolver}.</p>
 */
public enum OperationKind {
    ORIGINAL,
    REFINE,
    INPAINT,
    UPSCALE,
    ADJUST,
    BACKGROUND_REMOVAL,
    STYLE_TRANSFER,
    WATERMARK,
    OUTPAINT,
    DEPTH_MAP,
    OBJECT_REPLACEMENT,
    PRODUCT_PHOTO,
    BATCH_ITEM,
    STYLE_PRESET;

    /**
     * Lower snake-case label shown in history views, e.g. {@code background_removal}.
     */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Kinds that start a new lineage tree rather than deriving from a parent. Style transfer
     * generates from an uploaded style reference, not from a stored asset.
     */
    public boolean isRootKind() {
        return switch (this) {
            case ORIGINAL, STYLE_PRESET, PRODUCT_PHOTO, BATCH_ITEM, STYLE_TRANSFER -> true;
            default -> false;
        };
    }
}
