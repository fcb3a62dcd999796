package io.github.byzatic.tickscheduler.executor;

import io.github.byzatic.tickscheduler.job.Job;
import org.jetbrains.annotations.NotNull;

import java.util.function.Consumer;

public interface JobExecutorInterface extends AutoCloseable {
    /**
     * Schedules the job's task and returns immediately.
     * <p>
     * Exactly one of {@code onSuccess} or {@code onError} is called once the task finishes.
     * Neither is called when the attempt is dropped because a non-concurrent job is still running.
     */
    void execute(@NotNull Job job, @NotNull Runnable onSuccess, @NotNull Consumer<Throwable> onError);

    boolean isInFlight(@NotNull String jobId);

    /**
     * Number of task runs currently executing, across all jobs.
     */
    int inFlightCount();

    @Override
    void close();
}
