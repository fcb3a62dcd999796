package io.github.byzatic.tickscheduler.job_store;

import com.google.errorprone.annotations.ThreadSafe;
import io.github.byzatic.tickscheduler.job.Job;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Job store backed by a {@link ConcurrentHashMap}. Listing order is not defined.
 */
@ThreadSafe
public class InMemoryJobStore implements JobStoreInterface {
    private final static Logger logger = LoggerFactory.getLogger(InMemoryJobStore.class);
    private final Map<String, Job> jobs = new ConcurrentHashMap<>();

    @Override
    public void addJob(@NotNull Job job) {
        Objects.requireNonNull(job, "job");
        Objects.requireNonNull(job.getNextRunTime(), "Job " + job.getJobId() + " has no next run time");
        jobs.put(job.getJobId(), job);
    }

    @Override
    public void removeJob(@NotNull String jobId) {
        jobs.remove(jobId);
    }

    @Override
    public @NotNull Optional<Job> getJobById(@NotNull String jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    @Override
    public @NotNull List<Job> getAllJobs() {
        return new ArrayList<>(jobs.values());
    }

    @Override
    public @NotNull List<Job> getDueJobs(@NotNull ZonedDateTime currentTime, @Nullable Duration maxGraceTime) {
        List<Job> out = new ArrayList<>();
        for (Job job : jobs.values()) {
            ZonedDateTime nextRunTime = job.getNextRunTime();
            if (nextRunTime == null || nextRunTime.isAfter(currentTime)) continue;
            if (maxGraceTime != null && currentTime.isAfter(nextRunTime.plus(maxGraceTime))) {
                logger.debug("Skipping job {}: due at {}, grace time {} exceeded", job.getJobId(), nextRunTime, maxGraceTime);
                continue;
            }
            out.add(job);
        }
        return out;
    }

    @Override
    public void updateJobNextRunTime(@NotNull String jobId, @NotNull ZonedDateTime nextRunTime) {
        Objects.requireNonNull(nextRunTime, "nextRunTime");
        // computeIfPresent never brings back a job removed concurrently
        jobs.computeIfPresent(jobId, (id, job) -> job.withNextRunTime(nextRunTime));
    }
}
