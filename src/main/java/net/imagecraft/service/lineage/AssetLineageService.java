package net.imagecraft.service.lineage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import net.imagecraft.exception.AssetNotFoundException;
import net.imagecraft.exception.NothingToRedoException;
import net.imagecraft.exception.NothingToUndoException;
import net.imagecraft.model.image.ImageAsset;
import net.imagecraft.repository.AssetRecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Parent/child navigation over stored assets.
 *
 * <p>Parent references are weak: a parent may be missing from the store, in which case walks stop
 * at the last resolvable asset and undo reports nothing to undo. Each query works on one snapshot
 * of the record store.</p>
 */
@Service
public class AssetLineageService {

    private static final Logger log = LoggerFactory.getLogger(AssetLineageService.class);

    /** Newest first: latest creation time, then latest insertion. */
    public static final Comparator<ImageAsset> NEWEST_FIRST = Comparator
        .comparing(ImageAsset::createdAt, Comparator.nullsFirst(Comparator.naturalOrder()))
        .thenComparingLong(ImageAsset::sequence)
        .reversed();

    private final AssetRecordStore recordStore;

    public AssetLineageService(AssetRecordStore recordStore) {
        this.recordStore = recordStore;
    }

    /**
     * Ancestors of the asset followed by the asset itself, oldest first.
     */
    public List<ImageAsset> rootChain(String assetId) {
        return rootChain(assetId, index());
    }

    /**
     * Direct children in insertion order.
     */
    public List<ImageAsset> children(String assetId) {
        return children(assetId, recordStore.all());
    }

    /**
     * @throws NothingToUndoException when the asset has no parent or the parent no longer exists
     */
    public ImageAsset undo(String assetId) {
        Map<String, ImageAsset> index = index();
        ImageAsset asset = require(assetId, index);
        if (!asset.hasParent()) {
            throw new NothingToUndoException(assetId);
        }
        ImageAsset parent = index.get(asset.parentId());
        if (parent == null) {
            log.debug("Parent {} of asset {} is missing; nothing to undo", asset.parentId(), assetId);
            throw new NothingToUndoException(assetId);
        }
        return parent;
    }

    /**
     * The most recently created child.
     *
     * @throws NothingToRedoException when the asset has no children
     */
    public ImageAsset redo(String assetId) {
        List<ImageAsset> all = recordStore.all();
        require(assetId, toIndex(all));
        return children(assetId, all).stream()
            .min(NEWEST_FIRST)
            .orElseThrow(() -> new NothingToRedoException(assetId));
    }

    public AssetHistory history(String assetId) {
        List<ImageAsset> all = recordStore.all();
        Map<String, ImageAsset> index = toIndex(all);
        List<ImageAsset> chain = rootChain(assetId, index);
        List<HistoryEntry> entries = new ArrayList<>(chain.size());
        for (int i = 0; i < chain.size(); i++) {
            ImageAsset step = chain.get(i);
            entries.add(new HistoryEntry(step.id(), OperationKindResolver.resolve(step), step.prompt(), step.createdAt(), i));
        }
        ImageAsset current = chain.get(chain.size() - 1);
        boolean canUndo = current.hasParent() && index.containsKey(current.parentId());
        boolean canRedo = !children(assetId, all).isEmpty();
        return new AssetHistory(entries, entries.size() - 1, canUndo, canRedo);
    }

    private List<ImageAsset> rootChain(String assetId, Map<String, ImageAsset> index) {
        ImageAsset current = require(assetId, index);
        List<ImageAsset> chain = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        while (current != null && visited.add(current.id())) {
            chain.add(current);
            current = current.hasParent() ? index.get(current.parentId()) : null;
        }
        Collections.reverse(chain);
        return chain;
    }

    private static List<ImageAsset> children(String assetId, List<ImageAsset> all) {
        return all.stream()
            .filter(asset -> assetId.equals(asset.parentId()))
            .sorted(Comparator.comparingLong(ImageAsset::sequence))
            .toList();
    }

    private Map<String, ImageAsset> index() {
        return toIndex(recordStore.all());
    }

    private static Map<String, ImageAsset> toIndex(List<ImageAsset> all) {
        return all.stream().collect(Collectors.toMap(ImageAsset::id, Function.identity(), (first, second) -> first));
    }

    private static ImageAsset require(String assetId, Map<String, ImageAsset> index) {
        ImageAsset asset = assetId == null ? null : index.get(assetId);
        if (asset == null) {
            throw new AssetNotFoundException(assetId);
        }
        return asset;
    }
}
