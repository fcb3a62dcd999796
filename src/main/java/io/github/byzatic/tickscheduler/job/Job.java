package io.github.byzatic.tickscheduler.job;

import io.github.byzatic.tickscheduler.trigger.Trigger;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.ZonedDateTime;
import java.util.Objects;
import java.util.concurrent.Executor;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * A scheduled unit of work: a task paired with a trigger.
 * <p>
 * Jobs are immutable. The next run time is replaced in the job store
 * through {@link #withNextRunTime(ZonedDateTime)}. Two jobs are equal when their ids are.
 */
public final class Job {
    private final String jobId;
    private final Trigger trigger;
    private final ZonedDateTime nextRunTime;
    private final boolean runConcurrently;
    private final Executor dispatcher;
    private final JobTask task;

    private Job(Builder builder) {
        Objects.requireNonNull(builder.jobId, "jobId");
        checkArgument(!builder.jobId.isBlank(), "jobId should not be blank");
        jobId = builder.jobId;
        trigger = Objects.requireNonNull(builder.trigger, "trigger");
        task = Objects.requireNonNull(builder.task, "task");
        nextRunTime = builder.nextRunTime;
        runConcurrently = builder.runConcurrently;
        dispatcher = builder.dispatcher;
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static Builder newBuilder(Job copy) {
        Builder builder = new Builder();
        builder.jobId = copy.jobId;
        builder.trigger = copy.trigger;
        builder.nextRunTime = copy.nextRunTime;
        builder.runConcurrently = copy.runConcurrently;
        builder.dispatcher = copy.dispatcher;
        builder.task = copy.task;
        return builder;
    }

    public @NotNull String getJobId() {
        return jobId;
    }

    public @NotNull Trigger getTrigger() {
        return trigger;
    }

    /**
     * @return the next run time, or {@code null} if it has not been computed yet
     */
    public @Nullable ZonedDateTime getNextRunTime() {
        return nextRunTime;
    }

    public boolean isRunConcurrently() {
        return runConcurrently;
    }

    /**
     * @return the executor the task runs on, or {@code null} for the shared worker pool
     */
    public @Nullable Executor getDispatcher() {
        return dispatcher;
    }

    public @NotNull JobTask getTask() {
        return task;
    }

    public @NotNull Job withNextRunTime(@NotNull ZonedDateTime nextRunTime) {
        return newBuilder(this).setNextRunTime(Objects.requireNonNull(nextRunTime, "nextRunTime")).build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Job job = (Job) o;
        return Objects.equals(jobId, job.jobId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(jobId);
    }

    @Override
    public String toString() {
        return "Job{" +
                "jobId='" + jobId + '\'' +
                ", trigger=" + trigger +
                ", nextRunTime=" + nextRunTime +
                ", runConcurrently=" + runConcurrently +
                '}';
    }

    /**
     * {@code Job} builder static inner class.
     */
    public static final class Builder {
        private String jobId;
        private Trigger trigger;
        private ZonedDateTime nextRunTime;
        private boolean runConcurrently = true;
        private Executor dispatcher;
        private JobTask task;

        private Builder() {
        }

        public Builder setJobId(String jobId) {
            this.jobId = jobId;
            return this;
        }

        public Builder setTrigger(Trigger trigger) {
            this.trigger = trigger;
            return this;
        }

        /**
         * Leave unset to let the scheduler compute the first run time from the trigger.
         */
        public Builder setNextRunTime(ZonedDateTime nextRunTime) {
            this.nextRunTime = nextRunTime;
            return this;
        }

        /**
         * When {@code false}, a firing is dropped while the previous one is still running.
         */
        public Builder setRunConcurrently(boolean runConcurrently) {
            this.runConcurrently = runConcurrently;
            return this;
        }

        public Builder setDispatcher(Executor dispatcher) {
            this.dispatcher = dispatcher;
            return this;
        }

        public Builder setTask(JobTask task) {
            this.task = task;
            return this;
        }

        /**
         * Returns a {@code Job} built from the parameters previously set.
         *
         * @return a {@code Job} built with parameters of this {@code Job.Builder}
         * @throws NullPointerException     if id, trigger or task is missing
         * @throws IllegalArgumentException if the id is blank
         */
        public Job build() {
            return new Job(this);
        }
    }
}
