package net.imagecraft.application.image;

import java.util.List;
import java.util.Locale;
import net.imagecraft.exception.ImageValidationException;
import net.imagecraft.model.image.ImageAsset;
import net.imagecraft.repository.AssetRecordStore;
import net.imagecraft.service.canvas.RasterCodec;
import net.imagecraft.service.lineage.AssetLineageService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Lookup, listing, favorites and export over stored assets.
 */
@Service
public class AssetCatalogService {

    private static final Logger log = LoggerFactory.getLogger(AssetCatalogService.class);

    static final int MAX_PAGE_SIZE = 100;
    static final float JPEG_QUALITY = 0.9f;

    private final AssetRecordStore recordStore;
    private final AssetRecorder assetRecorder;

    public AssetCatalogService(AssetRecordStore recordStore, AssetRecorder assetRecorder) {
        this.recordStore = recordStore;
        this.assetRecorder = assetRecorder;
    }

    public ImageAsset find(String assetId) {
        return assetRecorder.requireAsset(assetId);
    }

    /**
     * Newest-first page of assets, optionally filtered by a case-insensitive prompt substring
     * and by favorite status.
     */
    public AssetPage list(int page, int limit, String search, boolean favoritesOnly) {
        if (page < 1) {
            throw new ImageValidationException("page must be at least 1, got " + page);
        }
        if (limit < 1 || limit > MAX_PAGE_SIZE) {
            throw new ImageValidationException("limit must be between 1 and " + MAX_PAGE_SIZE + ", got " + limit);
        }
        String needle = search == null || search.isBlank() ? null : search.toLowerCase(Locale.ROOT);
        List<ImageAsset> matching = recordStore.all().stream()
            .filter(asset -> needle == null || asset.prompt().toLowerCase(Locale.ROOT).contains(needle))
            .filter(asset -> !favoritesOnly || asset.favorited())
            .sorted(AssetLineageService.NEWEST_FIRST)
            .toList();
        int from = (int) Math.min((long) (page - 1) * limit, matching.size());
        int to = Math.min(from + limit, matching.size());
        return new AssetPage(matching.subList(from, to), matching.size(), page, limit);
    }

    /**
     * Flips the favorite flag, the only mutable attribute of an asset.
     */
    public ImageAsset toggleFavorite(String assetId) {
        ImageAsset updated = recordStore.update(assetId, asset -> asset.withFavorited(!asset.favorited()));
        log.debug("Asset {} favorited={}", assetId, updated.favorited());
        return updated;
    }

    public byte[] readRaster(String assetId) {
        return assetRecorder.readRaster(find(assetId));
    }

    /**
     * Stored raster re-encoded in the requested format. JPEG output is flattened and encoded at
     * 90% quality.
     */
    public byte[] export(String assetId, ExportFormat format) {
        byte[] stored = readRaster(assetId);
        return switch (format) {
            case PNG -> RasterCodec.encodePng(RasterCodec.decode(stored));
            case JPEG -> RasterCodec.encodeJpeg(RasterCodec.decode(stored), JPEG_QUALITY);
        };
    }
}
