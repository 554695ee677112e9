package net.imagecraft.application.batch;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import net.imagecraft.application.image.ImageGenerationService;
import net.imagecraft.config.ImageCraftProperties;
import net.imagecraft.exception.BatchGenerationException;
import net.imagecraft.exception.ImageValidationException;
import net.imagecraft.model.batch.BatchJob;
import net.imagecraft.model.batch.BatchJobSnapshot;
import net.imagecraft.model.batch.GenerationUnit;
import net.imagecraft.model.image.ImageAsset;
import net.imagecraft.model.image.OperationKind;
import net.imagecraft.support.adapter.ModelAdapterRegistry;
import net.imagecraft.util.LoggingUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Runs many independent generation units on the bounded batch pool.
 *
 * <p>Each unit runs the complete single-asset pipeline in isolation. A failed unit is recorded
 * and never cancels or affects its siblings. Units are not cancellable once started.</p>
 */
@Service
public class BatchCoordinator {

    private static final Logger log = LoggerFactory.getLogger(BatchCoordinator.class);

    static final int MAX_VARIANTS = 4;

    private final ImageGenerationService generationService;
    private final ModelAdapterRegistry adapterRegistry;
    private final BatchJobRegistry jobRegistry;
    private final Executor batchExecutor;
    private final ImageCraftProperties properties;
    private final Clock clock;

    public BatchCoordinator(ImageGenerationService generationService,
                            ModelAdapterRegistry adapterRegistry,
                            BatchJobRegistry jobRegistry,
                            @Qualifier("batchExecutor") Executor batchExecutor,
                            ImageCraftProperties properties,
                            Clock clock) {
        this.generationService = generationService;
        this.adapterRegistry = adapterRegistry;
        this.jobRegistry = jobRegistry;
        this.batchExecutor = batchExecutor;
        this.properties = properties;
        this.clock = clock;
    }

    // ── Synchronous aggregate ───────────────────────────────────────────

    /**
     * Generates {@code count} variants of one unit in parallel. Variants of a multi-image batch
     * share a group id.
     *
     * @throws BatchGenerationException when no variant succeeded
     */
    public BatchOutcome generateVariants(GenerationUnit unit, int count) {
        if (count < 1 || count > MAX_VARIANTS) {
            throw new ImageValidationException("count must be between 1 and " + MAX_VARIANTS + ", got " + count);
        }
        String groupId = count > 1 ? UUID.randomUUID().toString() : null;
        List<GenerationUnit> units = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            units.add(unit.withGroupId(groupId));
        }
        return runAll(units, groupId, false);
    }

    /**
     * Generates the same unit once per registered model, each with that model tried first.
     *
     * @throws BatchGenerationException when every model failed
     */
    public BatchOutcome compareModels(GenerationUnit unit) {
        String comparisonId = UUID.randomUUID().toString();
        List<GenerationUnit> units = adapterRegistry.ids().stream()
            .map(model -> unit.withPreferredModel(model).withGroupId(comparisonId))
            .toList();
        return runAll(units, comparisonId, true);
    }

    private BatchOutcome runAll(List<GenerationUnit> units, String groupId, boolean labelByModel) {
        List<CompletableFuture<ImageAsset>> futures = new ArrayList<>(units.size());
        for (GenerationUnit unit : units) {
            futures.add(submit(unit));
        }
        List<ImageAsset> results = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            try {
                results.add(await(futures.get(i)));
            } catch (RuntimeException ex) {
                String message = LoggingUtils.summarize(ex);
                errors.add(labelByModel ? units.get(i).preferredModel() + ": " + message : message);
            }
        }
        if (results.isEmpty()) {
            log.warn("All {} batch units failed", units.size());
            throw new BatchGenerationException(errors);
        }
        if (!errors.isEmpty()) {
            log.info("Batch finished with {} success(es) and {} failure(s)", results.size(), errors.size());
        }
        return new BatchOutcome(results, errors, groupId);
    }

    private CompletableFuture<ImageAsset> submit(GenerationUnit unit) {
        try {
            return CompletableFuture.supplyAsync(() -> generationService.generate(unit), batchExecutor);
        } catch (RejectedExecutionException ex) {
            return CompletableFuture.failedFuture(ex);
        }
    }

    private static ImageAsset await(Future<ImageAsset> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for batch unit", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() instanceof CompletionException ce && ce.getCause() != null ? ce.getCause() : e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException(LoggingUtils.summarize(cause), cause);
        }
    }

    // ── Asynchronous jobs ───────────────────────────────────────────────

    /**
     * Creates a job in PROCESSING state and returns immediately. Units run on the batch pool
     * and report into the job as they resolve.
     */
    public BatchJobHandle submitJob(List<GenerationUnit> units) {
        if (units == null || units.isEmpty()) {
            throw new ImageValidationException("A batch job needs at least one unit");
        }
        int maxUnits = properties.getBatch().getMaxJobUnits();
        if (units.size() > maxUnits) {
            throw new ImageValidationException("A batch job accepts at most " + maxUnits + " units, got " + units.size());
        }
        BatchJob job = jobRegistry.create(units.size());
        CompletableFuture<BatchJobSnapshot> completion = new CompletableFuture<>();
        log.info("Submitted batch job {} with {} unit(s)", job.id(), units.size());

        for (GenerationUnit unit : units) {
            GenerationUnit batchUnit = unit.kind() == null ? unit.withKind(OperationKind.BATCH_ITEM) : unit;
            try {
                batchExecutor.execute(() -> runJobUnit(job, batchUnit, completion));
            } catch (RejectedExecutionException ex) {
                resolveUnit(job, completion, null, ex);
            }
        }
        return new BatchJobHandle(job.id(), job::snapshot, completion);
    }

    public Optional<BatchJobSnapshot> findJob(String jobId) {
        return jobRegistry.find(jobId).map(BatchJob::snapshot);
    }

    /**
     * Every unit resolves into the job, even when generation throws an {@link Error}; the error
     * is rethrown to the pool thread once the counters are updated.
     */
    private void runJobUnit(BatchJob job, GenerationUnit unit, CompletableFuture<BatchJobSnapshot> completion) {
        ImageAsset asset;
        try {
            asset = generationService.generate(unit);
        } catch (RuntimeException ex) {
            resolveUnit(job, completion, null, ex);
            return;
        } catch (Error err) {
            resolveUnit(job, completion, null, err);
            throw err;
        }
        resolveUnit(job, completion, asset, null);
    }

    private void resolveUnit(BatchJob job, CompletableFuture<BatchJobSnapshot> completion,
                             ImageAsset asset, Throwable failure) {
        boolean finished;
        if (failure == null) {
            finished = job.recordSuccess(asset, clock.instant());
        } else {
            log.warn("Batch job {} unit failed: {}", job.id(), LoggingUtils.summarize(failure));
            finished = job.recordFailure(LoggingUtils.summarize(failure), clock.instant());
        }
        jobRegistry.touch(job);
        if (finished) {
            BatchJobSnapshot last = job.snapshot();
            log.info("Batch job {} complete: {} succeeded, {} failed", job.id(), last.completed(), last.failed());
            completion.complete(last);
        }
    }
}
