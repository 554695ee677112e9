package net.imagecraft.application.batch;

import com.github.benmanes.caffeine.cache.Cache;
import java.time.Clock;
import java.util.Optional;
import java.util.UUID;
import net.imagecraft.config.CacheFactory;
import net.imagecraft.config.ImageCraftProperties;
import net.imagecraft.model.batch.BatchJob;
import org.springframework.stereotype.Component;

/**
 * Owns every live asynchronous batch job, keyed by job id.
 *
 * <p>A job is created at submission and stays queryable until it has gone unread and
 * unupdated for the configured retention period.</p>
 */
@Component
public class BatchJobRegistry {

    private static final int MAX_TRACKED_JOBS = 10_000;

    private final Cache<String, BatchJob> jobs;
    private final Clock clock;

    public BatchJobRegistry(CacheFactory cacheFactory, ImageCraftProperties properties, Clock clock) {
        this.jobs = cacheFactory.createAccessExpiringCache("batch-jobs", MAX_TRACKED_JOBS,
            properties.getBatch().getJobRetention());
        this.clock = clock;
    }

    public BatchJob create(int total) {
        BatchJob job = new BatchJob(UUID.randomUUID().toString(), total, clock.instant());
        jobs.put(job.id(), job);
        return job;
    }

    public Optional<BatchJob> find(String jobId) {
        return jobId == null ? Optional.empty() : Optional.ofNullable(jobs.getIfPresent(jobId));
    }

    /**
     * Refreshes the retention window of a job that is still being updated.
     */
    void touch(BatchJob job) {
        jobs.put(job.id(), job);
    }

    long size() {
        jobs.cleanUp();
        return jobs.estimatedSize();
    }
}
