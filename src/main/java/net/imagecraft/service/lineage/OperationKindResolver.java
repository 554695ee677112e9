package net.imagecraft.service.lineage;

import java.util.LinkedHashMap;
import java.util.Map;
import net.imagecraft.model.image.ImageAsset;
import net.imagecraft.model.image.OperationKind;

/**
 * Resolves the single kind label of an asset.
 *
 * <p>Current records carry their kind. Records imported from the flag-based format may carry
 * several markers at once; those resolve by a fixed priority (outpaint, adjust, upscale,
 * background removal, style transfer, watermark), then refine for any other child, then original.
 * The priority is a compatibility rule for imported data only.</p>
 */
public final class OperationKindResolver {

    private static final Map<String, OperationKind> MARKER_PRIORITY = new LinkedHashMap<>();

    static {
        MARKER_PRIORITY.put("outpainted", OperationKind.OUTPAINT);
        MARKER_PRIORITY.put("adjusted", OperationKind.ADJUST);
        MARKER_PRIORITY.put("upscaled", OperationKind.UPSCALE);
        MARKER_PRIORITY.put("background_removed", OperationKind.BACKGROUND_REMOVAL);
        MARKER_PRIORITY.put("style_transfer", OperationKind.STYLE_TRANSFER);
        MARKER_PRIORITY.put("watermarked", OperationKind.WATERMARK);
    }

    private OperationKindResolver() {
    }

    public static OperationKind resolve(ImageAsset asset) {
        if (asset.operationKind() != null) {
            return asset.operationKind();
        }
        for (Map.Entry<String, OperationKind> entry : MARKER_PRIORITY.entrySet()) {
            if (asset.legacyMarkers().contains(entry.getKey())) {
                return entry.getValue();
            }
        }
        return asset.hasParent() ? OperationKind.REFINE : OperationKind.ORIGINAL;
    }
}
