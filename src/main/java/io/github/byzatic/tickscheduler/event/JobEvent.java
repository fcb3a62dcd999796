package io.github.byzatic.tickscheduler.event;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.ZonedDateTime;
import java.util.Objects;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Emitted once per finished job run.
 */
public final class JobEvent {
    private final String jobId;
    private final JobStatus status;
    private final ZonedDateTime timestamp;
    private final Throwable error;

    public JobEvent(@NotNull String jobId, @NotNull JobStatus status, @NotNull ZonedDateTime timestamp, @Nullable Throwable error) {
        this.jobId = Objects.requireNonNull(jobId, "jobId");
        this.status = Objects.requireNonNull(status, "status");
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        checkArgument((status == JobStatus.ERROR) == (error != null),
                "An error is required for ERROR events and forbidden otherwise");
        this.error = error;
    }

    public static JobEvent success(@NotNull String jobId, @NotNull ZonedDateTime timestamp) {
        return new JobEvent(jobId, JobStatus.SUCCESS, timestamp, null);
    }

    public static JobEvent error(@NotNull String jobId, @NotNull ZonedDateTime timestamp, @NotNull Throwable error) {
        return new JobEvent(jobId, JobStatus.ERROR, timestamp, Objects.requireNonNull(error, "error"));
    }

    public @NotNull String getJobId() {
        return jobId;
    }

    public @NotNull JobStatus getStatus() {
        return status;
    }

    public @NotNull ZonedDateTime getTimestamp() {
        return timestamp;
    }

    public @Nullable Throwable getError() {
        return error;
    }

    @Override
    public String toString() {
        return "JobEvent{jobId=" + jobId + ", status=" + status + ", timestamp=" + timestamp +
                (error != null ? ", error='" + error + '\'' : "") + '}';
    }
}
