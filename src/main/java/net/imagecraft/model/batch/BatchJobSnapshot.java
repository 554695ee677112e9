package net.imagecraft.model.batch;

import java.time.Instant;
import java.util.List;
import net.imagecraft.model.image.ImageAsset;

/**
 * Point-in-time copy of a {@link BatchJob}, safe to hand to callers while workers keep running.
 */
public record BatchJobSnapshot(
        String id,
        int total,
        int completed,
        int failed,
        List<ImageAsset> results,
        List<String> errors,
        BatchJobStatus status,
        Instant createdAt,
        Instant completedAt) {

    public BatchJobSnapshot {
        results = results == null ? List.of() : List.copyOf(results);
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public int resolved() {
        return completed + failed;
    }

    public boolean isComplete() {
        return status == BatchJobStatus.COMPLETE;
    }
}
