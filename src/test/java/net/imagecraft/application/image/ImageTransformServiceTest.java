package net.imagecraft.application.image;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.awt.Color;
import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import net.imagecraft.exception.ImageValidationException;
import net.imagecraft.exception.SourceFileMissingException;
import net.imagecraft.model.image.AdjustmentLevels;
import net.imagecraft.model.image.GifEffect;
import net.imagecraft.model.image.ImageAsset;
import net.imagecraft.model.image.OperationKind;
import net.imagecraft.model.image.OperationMetadata;
import net.imagecraft.model.image.PixelDimensions;
import net.imagecraft.model.image.WatermarkPosition;
import net.imagecraft.repository.LocalDiskRasterStore;
import net.imagecraft.service.canvas.DepthMapRenderer;
import net.imagecraft.service.canvas.GifAnimation;
import net.imagecraft.service.canvas.GifAnimationRenderer;
import net.imagecraft.service.canvas.ImageAdjuster;
import net.imagecraft.service.canvas.RasterCodec;
import net.imagecraft.service.canvas.WatermarkRenderer;
import net.imagecraft.service.canvas.WatermarkSpec;
import net.imagecraft.testutil.ImageTestData;
import net.imagecraft.testutil.InMemoryAssetRecordStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ImageTransformServiceTest {

    private static final Instant NOW = Instant.parse("2025-07-07T07:07:07Z");

    @TempDir
    Path tempDir;

    private InMemoryAssetRecordStore store;
    private LocalDiskRasterStore rasters;
    private ImageTransformService service;
    private ImageAsset parent;

    @BeforeEach
    void setUp() {
        store = new InMemoryAssetRecordStore();
        rasters = new LocalDiskRasterStore(tempDir);
        AssetRecorder recorder = new AssetRecorder(store, rasters, Clock.fixed(NOW, ZoneOffset.UTC));
        service = new ImageTransformService(recorder, new ImageAdjuster(), new WatermarkRenderer(),
            new DepthMapRenderer(), new GifAnimationRenderer());
        ImageAsset draft = ImageTestData.root("parent", NOW).toBuilder().dimensions(new PixelDimensions(120, 80)).build();
        rasters.write(draft.filename(), ImageTestData.solidPng(Color.ORANGE, 120, 80));
        parent = store.append(draft);
    }

    @Test
    void should_MultiplyDimensions_When_Upscaling() {
        ImageAsset upscaled = service.upscale(parent.id(), 4);

        assertThat(upscaled.dimensions()).isEqualTo(new PixelDimensions(480, 320));
        assertThat(upscaled.parentId()).isEqualTo(parent.id());
        assertThat(upscaled.operationKind()).isEqualTo(OperationKind.UPSCALE);
        assertThat(upscaled.metadata()).isEqualTo(new OperationMetadata.Upscale(4));
        BufferedImage stored = RasterCodec.decode(rasters.read(upscaled.filename()).orElseThrow());
        assertThat(stored.getWidth()).isEqualTo(480);
        assertThatThrownBy(() -> service.upscale(parent.id(), 3)).isInstanceOf(ImageValidationException.class);
    }

    @Test
    void should_RecordLevelsAsMetadata_When_Adjusting() {
        AdjustmentLevels levels = new AdjustmentLevels(1.1, 0.9, 1.0, 1.0, 1.5);

        ImageAsset adjusted = service.adjust(parent.id(), levels);

        assertThat(adjusted.operationKind()).isEqualTo(OperationKind.ADJUST);
        assertThat(adjusted.metadata()).isEqualTo(levels);
        assertThat(adjusted.dimensions()).isEqualTo(parent.dimensions());
    }

    @Test
    void should_ChainDerivedAssets_When_WatermarkingThenMappingDepth() {
        ImageAsset watermarked = service.watermark(parent.id(),
            new WatermarkSpec("(c) studio", WatermarkPosition.BOTTOM_LEFT, 0.5, 24, null));
        ImageAsset depth = service.depthMap(watermarked.id());

        assertThat(watermarked.operationKind()).isEqualTo(OperationKind.WATERMARK);
        assertThat(depth.parentId()).isEqualTo(watermarked.id());
        assertThat(depth.operationKind()).isEqualTo(OperationKind.DEPTH_MAP);
        assertThat(store.all()).hasSize(3);
    }

    @Test
    void should_ReturnAnimationWithoutRecordingAsset_When_Animating() {
        GifAnimation animation = service.animate(parent.id(), GifEffect.PULSE, 1.0, 5);

        assertThat(animation.frameCount()).isEqualTo(5);
        assertThat(animation.frameSize()).isEqualTo(new PixelDimensions(120, 80));
        assertThat(store.all()).hasSize(1);
    }

    @Test
    void should_FailWithoutRecording_When_RasterFileMissing() {
        ImageAsset orphan = store.append(ImageTestData.root("orphan", NOW));

        assertThatThrownBy(() -> service.depthMap(orphan.id())).isInstanceOf(SourceFileMissingException.class);
        assertThat(store.all()).hasSize(2);
    }
}
