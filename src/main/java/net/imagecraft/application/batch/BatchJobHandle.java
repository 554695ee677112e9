package net.imagecraft.application.batch;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import net.imagecraft.model.batch.BatchJobSnapshot;

/**
 * Handle to a submitted asynchronous batch job: poll it through {@link #current()} or wait for
 * the final state through {@link #completion()}.
 */
public final class BatchJobHandle {

    private final String jobId;
    private final Supplier<BatchJobSnapshot> snapshotSupplier;
    private final CompletableFuture<BatchJobSnapshot> completion;

    BatchJobHandle(String jobId, Supplier<BatchJobSnapshot> snapshotSupplier, CompletableFuture<BatchJobSnapshot> completion) {
        this.jobId = jobId;
        this.snapshotSupplier = snapshotSupplier;
        this.completion = completion;
    }

    public String jobId() {
        return jobId;
    }

    public BatchJobSnapshot current() {
        return snapshotSupplier.get();
    }

    /**
     * Completes with the final snapshot once every unit has resolved. Never completes
     * exceptionally: unit failures are counted on the job.
     */
    public CompletableFuture<BatchJobSnapshot> completion() {
        return completion.copy();
    }

    public BatchJobSnapshot await(Duration timeout) throws InterruptedException, TimeoutException {
        try {
            return completion.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Batch job " + jobId + " completion failed", e.getCause());
        }
    }
}
