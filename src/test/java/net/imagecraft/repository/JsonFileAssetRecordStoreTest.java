package net.imagecraft.repository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import net.imagecraft.exception.AssetNotFoundException;
import net.imagecraft.model.image.AdjustmentLevels;
import net.imagecraft.model.image.ImageAsset;
import net.imagecraft.model.image.OperationKind;
import net.imagecraft.model.image.OperationMetadata;
import net.imagecraft.model.image.OutpaintDirection;
import net.imagecraft.model.image.PixelDimensions;
import net.imagecraft.testutil.ImageTestData;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JsonFileAssetRecordStoreTest {

    private static final Instant NOW = Instant.parse("2025-02-02T09:30:00Z");

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

    @TempDir
    Path tempDir;

    @Test
    void should_ReloadSameRecords_When_StoreReopened() {
        Path file = tempDir.resolve("images.json");
        JsonFileAssetRecordStore store = new JsonFileAssetRecordStore(file, objectMapper);
        ImageAsset root = ImageTestData.root("a", NOW);
        ImageAsset outpainted = ImageTestData.child("b", "a", OperationKind.OUTPAINT, NOW.plusSeconds(1)).toBuilder()
            .dimensions(new PixelDimensions(2048, 1024))
            .metadata(OperationMetadata.Outpaint.of(Set.of(OutpaintDirection.RIGHT, OutpaintDirection.LEFT), 50,
                new PixelDimensions(1024, 1024)))
            .build();
        ImageAsset adjusted = ImageTestData.child("c", "b", OperationKind.ADJUST, NOW.plusSeconds(2)).toBuilder()
            .metadata(new AdjustmentLevels(1.2, 1.0, 0.8, 1.0, 0.0))
            .build();
        store.append(root);
        store.append(outpainted);
        store.append(adjusted);

        JsonFileAssetRecordStore reopened = new JsonFileAssetRecordStore(file, objectMapper);

        List<ImageAsset> all = reopened.all();
        assertThat(all).extracting(ImageAsset::id).containsExactly("a", "b", "c");
        assertThat(all).extracting(ImageAsset::sequence).containsExactly(0L, 1L, 2L);
        assertThat(all.get(1).metadata()).isEqualTo(outpainted.metadata());
        assertThat(all.get(1).dimensions()).isEqualTo(new PixelDimensions(2048, 1024));
        assertThat(all.get(2).metadata()).isInstanceOf(AdjustmentLevels.class);
        assertThat(all.get(2).createdAt()).isEqualTo(NOW.plusSeconds(2));
    }

    @Test
    void should_ImportFlagsAsMarkers_When_RecordIsLegacyFormat() throws Exception {
        Path file = tempDir.resolve("images.json");
        Files.writeString(file, """
            [
              {"id": "old-1", "prompt": "a cat", "style": "none", "size": "1024x1536",
               "filename": "old-1.png", "created_at": "2024-11-05T14:22:01.123456"},
              {"id": "old-2", "parent_id": "old-1", "prompt": "a cat", "filename": "old-2.png",
               "adjusted": true, "watermarked": true, "favorite": true,
               "created_at": "2024-11-05T14:25:00"}
            ]
            """, StandardCharsets.UTF_8);

        JsonFileAssetRecordStore store = new JsonFileAssetRecordStore(file, objectMapper);

        ImageAsset first = store.findById("old-1").orElseThrow();
        ImageAsset second = store.findById("old-2").orElseThrow();
        assertThat(first.dimensions()).isEqualTo(new PixelDimensions(1024, 1536));
        assertThat(first.operationKind()).isNull();
        assertThat(first.createdAt()).isEqualTo(Instant.parse("2024-11-05T14:22:01.123456Z"));
        assertThat(second.parentId()).isEqualTo("old-1");
        assertThat(second.legacyMarkers()).containsExactlyInAnyOrder("adjusted", "watermarked");
        assertThat(second.favorited()).isTrue();
        assertThat(second.sequence()).isGreaterThan(first.sequence());
    }

    @Test
    void should_PersistFavoriteFlag_When_Updated() {
        Path file = tempDir.resolve("images.json");
        JsonFileAssetRecordStore store = new JsonFileAssetRecordStore(file, objectMapper);
        store.append(ImageTestData.root("a", NOW));

        store.update("a", asset -> asset.withFavorited(true));

        assertThat(new JsonFileAssetRecordStore(file, objectMapper).findById("a"))
            .hasValueSatisfying(asset -> assertThat(asset.favorited()).isTrue());
        assertThatThrownBy(() -> store.update("missing", asset -> asset))
            .isInstanceOf(AssetNotFoundException.class);
    }

    @Test
    void should_KeepEveryRecord_When_AppendingConcurrently() throws Exception {
        Path file = tempDir.resolve("nested").resolve("images.json");
        JsonFileAssetRecordStore store = new JsonFileAssetRecordStore(file, objectMapper);
        ExecutorService pool = Executors.newFixedThreadPool(6);
        List<Future<ImageAsset>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < 40; i++) {
                String id = "asset-" + i;
                futures.add(pool.submit(() -> store.append(ImageTestData.root(id, NOW))));
            }
            for (Future<ImageAsset> future : futures) {
                future.get(20, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        List<ImageAsset> reloaded = new JsonFileAssetRecordStore(file, objectMapper).all();
        assertThat(reloaded).hasSize(40);
        assertThat(reloaded).extracting(ImageAsset::sequence).doesNotHaveDuplicates();
    }

    @Test
    void should_StartEmpty_When_FileMissing() {
        JsonFileAssetRecordStore store = new JsonFileAssetRecordStore(tempDir.resolve("absent.json"), objectMapper);

        assertThat(store.all()).isEmpty();
        assertThat(store.findById("x")).isEmpty();
    }
}
