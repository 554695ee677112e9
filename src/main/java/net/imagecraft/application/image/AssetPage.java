package net.imagecraft.application.image;

import java.util.List;
import net.imagecraft.model.image.ImageAsset;

/**
 * One page of the asset catalog.
 *
 * @param items matching assets on this page, newest first
 * @param total number of matching assets across all pages
 * @param page  1-based page number
 * @param limit page size
 */
public record AssetPage(List<ImageAsset> items, int total, int page, int limit) {

    public AssetPage {
        items = List.copyOf(items);
    }

    public boolean hasMore() {
        return (long) page * limit < total;
    }
}
