package net.imagecraft.repository;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;
import net.imagecraft.model.image.ImageAsset;

/**
 * Append-mostly store of asset records.
 *
 * <p>Writes are durable by the time a call returns. Concurrent appends never interleave: each
 * append is atomic with respect to every other append and update.</p>
 */
public interface AssetRecordStore {

    /**
     * Stores a new record and assigns its insertion {@code sequence}.
     *
     * @return the stored record, carrying the assigned sequence
     */
    ImageAsset append(ImageAsset asset);

    /**
     * Every record in insertion order.
     */
    List<ImageAsset> all();

    Optional<ImageAsset> findById(String id);

    /**
     * Replaces a record with the result of {@code mutation}.
     *
     * @throws net.imagecraft.exception.AssetNotFoundException when no record has the id
     */
    ImageAsset update(String id, UnaryOperator<ImageAsset> mutation);
}
