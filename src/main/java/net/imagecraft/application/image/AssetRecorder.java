package net.imagecraft.application.image;

import java.time.Clock;
import java.util.UUID;
import net.imagecraft.exception.AssetNotFoundException;
import net.imagecraft.exception.SourceFileMissingException;
import net.imagecraft.model.image.ImageAsset;
import net.imagecraft.model.image.OperationKind;
import net.imagecraft.repository.AssetRecordStore;
import net.imagecraft.repository.RasterStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Last step of every pipeline operation: stores the raster, then appends the lineage record.
 *
 * <p>The raster is written first so a stored record always has its file.</p>
 */
@Component
public class AssetRecorder {

    private static final Logger log = LoggerFactory.getLogger(AssetRecorder.class);

    private final AssetRecordStore recordStore;
    private final RasterStore rasterStore;
    private final Clock clock;

    public AssetRecorder(AssetRecordStore recordStore, RasterStore rasterStore, Clock clock) {
        this.recordStore = recordStore;
        this.rasterStore = rasterStore;
        this.clock = clock;
    }

    /**
     * Assigns id, file name and creation time to {@code draft} and stores it with {@code png}.
     *
     * @throws IllegalArgumentException when a derived kind has no parent
     */
    public ImageAsset record(ImageAsset.ImageAssetBuilder draft, byte[] png) {
        String id = UUID.randomUUID().toString();
        String filename = id + ".png";
        ImageAsset asset = draft.id(id).filename(filename).createdAt(clock.instant()).build();
        OperationKind kind = asset.operationKind();
        if (kind != null && !kind.isRootKind() && !asset.hasParent()) {
            throw new IllegalArgumentException(kind.label() + " assets must reference a parent");
        }
        rasterStore.write(filename, png);
        ImageAsset stored = recordStore.append(asset);
        log.info("Recorded {} asset {} ({}, parent={})", kind == null ? "unlabeled" : kind.label(), stored.id(),
            stored.dimensions(), stored.parentId());
        return stored;
    }

    public ImageAsset requireAsset(String assetId) {
        return recordStore.findById(assetId).orElseThrow(() -> new AssetNotFoundException(assetId));
    }

    /**
     * @throws SourceFileMissingException when the record exists but its raster does not
     */
    public byte[] readRaster(ImageAsset asset) {
        return rasterStore.read(asset.filename())
            .orElseThrow(() -> new SourceFileMissingException(asset.id(), asset.filename()));
    }
}
