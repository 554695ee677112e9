package net.imagecraft.application.batch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import net.imagecraft.application.image.ImageGenerationService;
import net.imagecraft.config.CacheFactory;
import net.imagecraft.config.ImageCraftProperties;
import net.imagecraft.exception.AllAdaptersFailedException;
import net.imagecraft.exception.BatchGenerationException;
import net.imagecraft.exception.ImageValidationException;
import net.imagecraft.exception.ModelAdapterException;
import net.imagecraft.model.batch.BatchJobSnapshot;
import net.imagecraft.model.batch.BatchJobStatus;
import net.imagecraft.model.batch.GenerationUnit;
import net.imagecraft.model.image.ImageAsset;
import net.imagecraft.model.image.OperationKind;
import net.imagecraft.model.image.PixelDimensions;
import net.imagecraft.support.adapter.ModelAdapter;
import net.imagecraft.support.adapter.ModelAdapterRegistry;
import net.imagecraft.testutil.ImageTestData;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class BatchCoordinatorTest {

    private static final Instant NOW = Instant.parse("2025-06-01T08:00:00Z");
    private static final GenerationUnit UNIT = GenerationUnit.of("a misty forest", "none", new PixelDimensions(1024, 1024));

    private ImageGenerationService generationService;
    private ExecutorService pool;
    private BatchJobRegistry jobRegistry;
    private BatchCoordinator coordinator;

    @BeforeEach
    void setUp() {
        generationService = mock(ImageGenerationService.class);
        pool = Executors.newFixedThreadPool(3);
        ImageCraftProperties properties = new ImageCraftProperties();
        properties.getBatch().setMaxJobUnits(10);
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        jobRegistry = new BatchJobRegistry(new CacheFactory(), properties, clock);
        ModelAdapterRegistry adapters = new ModelAdapterRegistry(List.of(adapter("gpt-image"), adapter("gemini-image")));
        coordinator = new BatchCoordinator(generationService, adapters, jobRegistry, pool, properties, clock);
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    void should_CompleteWithThreeSuccessesAndTwoFailures_When_TwoUnitsFail() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        when(generationService.generate(any())).thenAnswer(invocation -> {
            int call = calls.incrementAndGet();
            if (call == 2 || call == 4) {
                throw new AllAdaptersFailedException(List.of("gpt-image"), new ModelAdapterException("gpt-image", "quota"));
            }
            GenerationUnit unit = invocation.getArgument(0);
            return ImageTestData.asset("asset-" + call, null, unit.kind(), NOW);
        });

        BatchJobHandle handle = coordinator.submitJob(List.of(UNIT, UNIT, UNIT, UNIT, UNIT));
        BatchJobSnapshot done = handle.await(Duration.ofSeconds(10));

        assertThat(done.total()).isEqualTo(5);
        assertThat(done.completed()).isEqualTo(3);
        assertThat(done.failed()).isEqualTo(2);
        assertThat(done.status()).isEqualTo(BatchJobStatus.COMPLETE);
        assertThat(done.errors()).hasSize(2).allSatisfy(error -> assertThat(error).contains("quota"));
        assertThat(coordinator.findJob(handle.jobId())).hasValueSatisfying(found ->
            assertThat(found.resolved()).isEqualTo(5));
    }

    @Test
    void should_CompleteJob_When_UnitThrowsError() throws Exception {
        when(generationService.generate(any()))
            .thenThrow(new OutOfMemoryError("decode buffer"))
            .thenReturn(ImageTestData.root("survivor", NOW));

        BatchJobSnapshot done = coordinator.submitJob(List.of(UNIT, UNIT)).await(Duration.ofSeconds(10));

        assertThat(done.status()).isEqualTo(BatchJobStatus.COMPLETE);
        assertThat(done.completed()).isEqualTo(1);
        assertThat(done.failed()).isEqualTo(1);
        assertThat(done.errors()).containsExactly("decode buffer");
    }

    @Test
    void should_TagUnitsAsBatchItems_When_KindNotSet() throws Exception {
        when(generationService.generate(any())).thenReturn(ImageTestData.root("x", NOW));

        coordinator.submitJob(List.of(UNIT)).await(Duration.ofSeconds(10));

        verify(generationService).generate(argThat(unit -> unit.kind() == OperationKind.BATCH_ITEM));
    }

    @Test
    void should_RejectJob_When_EmptyOrTooLarge() {
        assertThatThrownBy(() -> coordinator.submitJob(List.of())).isInstanceOf(ImageValidationException.class);
        assertThatThrownBy(() -> coordinator.submitJob(java.util.Collections.nCopies(11, UNIT)))
            .isInstanceOf(ImageValidationException.class);
    }

    @Test
    void should_ShareGroupId_When_GeneratingSeveralVariants() {
        when(generationService.generate(any())).thenAnswer(invocation -> {
            GenerationUnit unit = invocation.getArgument(0);
            return ImageTestData.root("v", NOW).toBuilder().groupId(unit.groupId()).build();
        });

        BatchOutcome outcome = coordinator.generateVariants(UNIT, 3);

        assertThat(outcome.results()).hasSize(3);
        assertThat(outcome.groupId()).isNotNull();
        assertThat(outcome.results()).allSatisfy(asset -> assertThat(asset.groupId()).isEqualTo(outcome.groupId()));
        verify(generationService, times(3)).generate(any());
    }

    @Test
    void should_OmitGroupId_When_SingleVariant() {
        when(generationService.generate(any())).thenReturn(ImageTestData.root("v", NOW));

        assertThat(coordinator.generateVariants(UNIT, 1).groupId()).isNull();
        assertThatThrownBy(() -> coordinator.generateVariants(UNIT, 5)).isInstanceOf(ImageValidationException.class);
    }

    @Test
    void should_ReportPartialFailure_When_OneModelFailsComparison() {
        when(generationService.generate(argThat(unit -> unit != null && "gpt-image".equals(unit.preferredModel()))))
            .thenReturn(ImageTestData.root("gpt", NOW));
        when(generationService.generate(argThat(unit -> unit != null && "gemini-image".equals(unit.preferredModel()))))
            .thenThrow(new ModelAdapterException("gemini-image", "safety filter"));

        BatchOutcome outcome = coordinator.compareModels(UNIT);

        assertThat(outcome.results()).extracting(ImageAsset::id).containsExactly("gpt");
        assertThat(outcome.isPartial()).isTrue();
        assertThat(outcome.errors()).singleElement().asString().startsWith("gemini-image: ");
    }

    @Test
    void should_ThrowWithAllErrors_When_EveryVariantFails() {
        when(generationService.generate(any())).thenThrow(new ModelAdapterException("gpt-image", "down"));

        assertThatThrownBy(() -> coordinator.generateVariants(UNIT, 2))
            .isInstanceOf(BatchGenerationException.class)
            .satisfies(ex -> assertThat(((BatchGenerationException) ex).getUnitErrors()).hasSize(2));
    }

    private static ModelAdapter adapter(String id) {
        ModelAdapter adapter = mock(ModelAdapter.class);
        when(adapter.id()).thenReturn(id);
        return adapter;
    }
}
