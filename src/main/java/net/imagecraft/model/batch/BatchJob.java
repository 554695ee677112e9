package net.imagecraft.model.batch;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import net.imagecraft.model.image.ImageAsset;

/**
 * Mutable progress record for one asynchronous batch.
 *
 * <p>Worker threads report completions concurrently, so every mutator and the snapshot are
 * {@code synchronized} on the job. {@code completed + failed} only grows, never exceeds
 * {@code total}, and the status flips to {@link BatchJobStatus#COMPLETE} exactly once.</p>
 */
public class BatchJob {

    private final String id;
    private final int total;
    private final Instant createdAt;
    private final List<ImageAsset> results = new ArrayList<>();
    private final List<String> errors = new ArrayList<>();

    private int completed;
    private int failed;
    private BatchJobStatus status;
    private Instant completedAt;

    public BatchJob(String id, int total, Instant createdAt) {
        if (total <= 0) {
            throw new IllegalArgumentException("Batch job total must be positive, got " + total);
        }
        this.id = Objects.requireNonNull(id, "id");
        this.total = total;
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.status = BatchJobStatus.PROCESSING;
    }

    public String id() {
        return id;
    }

    public int total() {
        return total;
    }

    /**
     * Records a successful unit.
     *
     * @param asset the asset the unit produced
     * @param now   completion instant, stored when this was the last unit
     * @return {@code true} when this completion resolved the final unit
     */
    public synchronized boolean recordSuccess(ImageAsset asset, Instant now) {
        ensureOpen();
        completed++;
        results.add(asset);
        return finishIfResolved(now);
    }

    /**
     * Records a failed unit.
     *
     * @return {@code true} when this failure resolved the final unit
     */
    public synchronized boolean recordFailure(String error, Instant now) {
        ensureOpen();
        failed++;
        errors.add(error);
        return finishIfResolved(now);
    }

    public synchronized BatchJobSnapshot snapshot() {
        return new BatchJobSnapshot(id, total, completed, failed, List.copyOf(results), List.copyOf(errors),
            status, createdAt, completedAt);
    }

    private void ensureOpen() {
        if (completed + failed >= total) {
            throw new IllegalStateException("Batch job " + id + " already resolved all " + total + " units");
        }
    }

    private boolean finishIfResolved(Instant now) {
        if (completed + failed == total && status == BatchJobStatus.PROCESSING) {
            status = BatchJobStatus.COMPLETE;
            completedAt = now;
            return true;
        }
        return false;
    }
}
