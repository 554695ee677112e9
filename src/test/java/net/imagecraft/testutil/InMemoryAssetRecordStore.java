package net.imagecraft.testutil;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;
import net.imagecraft.exception.AssetNotFoundException;
import net.imagecraft.model.image.ImageAsset;
import net.imagecraft.repository.AssetRecordStore;

/** List-backed record store for service tests that do not need the file format. */
public class InMemoryAssetRecordStore implements AssetRecordStore {

    private final List<ImageAsset> records = new ArrayList<>();

    @Override
    public synchronized ImageAsset append(ImageAsset asset) {
        ImageAsset stored = asset.withSequence(records.size() + 1L);
        records.add(stored);
        return stored;
    }

    @Override
    public synchronized List<ImageAsset> all() {
        return List.copyOf(records);
    }

    @Override
    public synchronized Optional<ImageAsset> findById(String id) {
        return records.stream().filter(asset -> asset.id().equals(id)).findFirst();
    }

    @Override
    public synchronized ImageAsset update(String id, UnaryOperator<ImageAsset> mutation) {
        for (int i = 0; i < records.size(); i++) {
            if (records.get(i).id().equals(id)) {
                ImageAsset updated = mutation.apply(records.get(i));
                records.set(i, updated);
                return updated;
            }
        }
        throw new AssetNotFoundException(id);
    }
}
