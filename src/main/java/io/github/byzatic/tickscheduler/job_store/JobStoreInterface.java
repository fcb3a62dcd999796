package io.github.byzatic.tickscheduler.job_store;

import io.github.byzatic.tickscheduler.job.Job;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Keyed collection of jobs. Implementations must be safe for concurrent use
 * and make an update visible to the next {@link #getDueJobs} call from any thread.
 */
public interface JobStoreInterface {
    /**
     * Inserts the job or replaces the one with the same id.
     */
    void addJob(@NotNull Job job);

    /**
     * No-op if the job is absent.
     */
    void removeJob(@NotNull String jobId);

    @NotNull Optional<Job> getJobById(@NotNull String jobId);

    @NotNull List<Job> getAllJobs();

    /**
     * Jobs with {@code nextRunTime <= currentTime}. With a grace time, jobs later than
     * {@code nextRunTime + maxGraceTime} are left out.
     *
     * @param maxGraceTime {@code null} for no lateness limit
     */
    @NotNull List<Job> getDueJobs(@NotNull ZonedDateTime currentTime, @Nullable Duration maxGraceTime);

    /**
     * No-op if the job has been removed meanwhile.
     */
    void updateJobNextRunTime(@NotNull String jobId, @NotNull ZonedDateTime nextRunTime);
}
