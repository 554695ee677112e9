package net.imagecraft.repository;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;
import net.imagecraft.config.ImageCraftProperties;
import net.imagecraft.exception.AssetNotFoundException;
import net.imagecraft.exception.RecordStoreException;
import net.imagecraft.model.image.ImageAsset;
import net.imagecraft.util.LoggingUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

/**
 * {@link AssetRecordStore} backed by a single JSON array file.
 *
 * <p>Records are loaded once and kept in memory. Every mutation holds one lock, rewrites the whole
 * file to a temporary sibling and atomically moves it into place, so readers of the file never see
 * a partially written array.</p>
 */
@Repository
public class JsonFileAssetRecordStore implements AssetRecordStore {

    private static final Logger log = LoggerFactory.getLogger(JsonFileAssetRecordStore.class);

    private final Path recordFile;
    private final ObjectMapper objectMapper;
    private final ReentrantLock lock = new ReentrantLock();
    private List<ImageAsset> records;
    private long nextSequence;

    @Autowired
    public JsonFileAssetRecordStore(ImageCraftProperties properties, ObjectMapper objectMapper) {
        this(properties.getStorage().recordFile(), objectMapper);
    }

    public JsonFileAssetRecordStore(Path recordFile, ObjectMapper objectMapper) {
        this.recordFile = Objects.requireNonNull(recordFile, "recordFile");
        this.objectMapper = objectMapper.copy()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false)
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public ImageAsset append(ImageAsset asset) {
        Objects.requireNonNull(asset, "asset");
        lock.lock();
        try {
            ensureLoaded();
            ImageAsset stored = asset.withSequence(nextSequence++);
            records.add(stored);
            try {
                persist();
            } catch (RecordStoreException e) {
                records.remove(records.size() - 1);
                nextSequence--;
                throw e;
            }
            log.debug("Appended asset {} ({}) as sequence {}", stored.id(), stored.operationKind(), stored.sequence());
            return stored;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<ImageAsset> all() {
        lock.lock();
        try {
            ensureLoaded();
            return List.copyOf(records);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<ImageAsset> findById(String id) {
        if (id == null) {
            return Optional.empty();
        }
        lock.lock();
        try {
            ensureLoaded();
            return records.stream().filter(asset -> id.equals(asset.id())).findFirst();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public ImageAsset update(String id, UnaryOperator<ImageAsset> mutation) {
        lock.lock();
        try {
            ensureLoaded();
            for (int i = 0; i < records.size(); i++) {
                ImageAsset existing = records.get(i);
                if (existing.id().equals(id)) {
                    ImageAsset updated = mutation.apply(existing);
                    if (updated == null || !id.equals(updated.id())) {
                        throw new IllegalArgumentException("Record mutation must keep asset id " + id);
                    }
                    updated = updated.withSequence(existing.sequence());
                    records.set(i, updated);
                    try {
                        persist();
                    } catch (RecordStoreException e) {
                        records.set(i, existing);
                        throw e;
                    }
                    return updated;
                }
            }
            throw new AssetNotFoundException(id);
        } finally {
            lock.unlock();
        }
    }

    private void ensureLoaded() {
        if (records != null) {
            return;
        }
        records = new ArrayList<>();
        if (!Files.exists(recordFile)) {
            return;
        }
        try {
            JsonNode root = objectMapper.readTree(recordFile.toFile());
            if (root == null || !root.isArray()) {
                log.warn("Record file {} does not contain a JSON array; starting empty", recordFile);
                return;
            }
            for (JsonNode node : root) {
                records.add(readRecord(node));
            }
            nextSequence = records.stream().mapToLong(ImageAsset::sequence).max().orElse(-1L) + 1;
            log.info("Loaded {} asset records from {}", records.size(), recordFile);
        } catch (IOException e) {
            records = null;
            throw new RecordStoreException("Failed to read asset records from " + recordFile, e);
        }
    }

    private ImageAsset readRecord(JsonNode node) throws IOException {
        long sequence = nextSequence++;
        if (LegacyAssetRecordMapper.isLegacy(node)) {
            return LegacyAssetRecordMapper.toAsset(node, sequence);
        }
        ImageAsset asset = objectMapper.treeToValue(node, ImageAsset.class);
        return node.has("sequence") ? asset : asset.withSequence(sequence);
    }

    private void persist() {
        try {
            Path parent = recordFile.toAbsolutePath().getParent();
            Files.createDirectories(parent);
            Path temp = Files.createTempFile(parent, recordFile.getFileName().toString(), ".tmp");
            try {
                objectMapper.writeValue(temp.toFile(), records);
                move(temp);
            } finally {
                Files.deleteIfExists(temp);
            }
        } catch (IOException e) {
            LoggingUtils.error(log, e, "Failed to write {} asset records to {}", records.size(), recordFile);
            throw new RecordStoreException("Failed to write asset records to " + recordFile, e);
        }
    }

    private void move(Path temp) throws IOException {
        try {
            Files.move(temp, recordFile, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move unsupported for {}, falling back to replace", recordFile);
            Files.move(temp, recordFile, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
