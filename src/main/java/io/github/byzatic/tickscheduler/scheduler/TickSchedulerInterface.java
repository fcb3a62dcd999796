package io.github.byzatic.tickscheduler.scheduler;

import io.github.byzatic.tickscheduler.event.JobEventListener;
import io.github.byzatic.tickscheduler.job.Job;
import io.github.byzatic.tickscheduler.job.JobTask;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executor;

public interface TickSchedulerInterface extends AutoCloseable {

    /**
     * Starts the tick loop and returns immediately.
     *
     * @throws IllegalStateException if the scheduler is already running or has been closed
     */
    void start();

    /**
     * Stops the tick loop. Job runs already dispatched are left to finish.
     *
     * @throws IllegalStateException if the scheduler is not running
     */
    void shutdown();

    /**
     * Blocks the calling thread until the scheduler is shut down.
     * Interrupting the waiting thread shuts the scheduler down.
     */
    void idle();

    boolean isRunning();

    @NotNull SchedulerState getState();

    void addJob(@NotNull Job job);

    void removeJob(@NotNull String jobId);

    @NotNull Optional<Job> getJob(@NotNull String jobId);

    @NotNull List<Job> getJobs();

    /**
     * While paused no job is run, rescheduled or removed by the tick loop.
     */
    void pause();

    void resume();

    boolean isPaused();

    void pauseJob(@NotNull String jobId);

    void resumeJob(@NotNull String jobId);

    boolean isJobPaused(@NotNull String jobId);

    void addEventListener(@NotNull JobEventListener listener);

    void removeEventListener(@NotNull JobEventListener listener);

    /**
     * Runs {@code task} once at {@code runAt}.
     *
     * @return the generated job id
     */
    @NotNull String runOnce(@NotNull ZonedDateTime runAt, @NotNull JobTask task);

    @NotNull String runOnce(@NotNull ZonedDateTime runAt, @Nullable Executor dispatcher, boolean runConcurrently, @NotNull JobTask task);

    /**
     * Runs {@code task} every {@code intervalSeconds}, the first time one interval from now.
     *
     * @return the generated job id
     */
    @NotNull String runRepeating(long intervalSeconds, @NotNull JobTask task);

    @NotNull String runRepeating(long intervalSeconds, @Nullable Executor dispatcher, boolean runConcurrently, @NotNull JobTask task);

    /**
     * Runs {@code task} every day at {@code time}.
     *
     * @return the generated job id
     */
    @NotNull String runDaily(@NotNull LocalTime time, @NotNull JobTask task);

    @NotNull String runDaily(@NotNull LocalTime time, @Nullable Executor dispatcher, boolean runConcurrently, @NotNull JobTask task);

    /**
     * Runs {@code task} at {@code time} on each of {@code daysOfWeek}.
     *
     * @return the generated job id
     */
    @NotNull String runCron(@NotNull Set<DayOfWeek> daysOfWeek, @NotNull LocalTime time, @NotNull JobTask task);

    @NotNull String runCron(@NotNull Set<DayOfWeek> daysOfWeek, @NotNull LocalTime time, @Nullable Executor dispatcher, boolean runConcurrently, @NotNull JobTask task);

    /**
     * Shuts the scheduler down if it is running and releases the worker pool it owns.
     */
    @Override
    void close();
}
