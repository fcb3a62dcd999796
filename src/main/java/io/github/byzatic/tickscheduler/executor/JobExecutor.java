package io.github.byzatic.tickscheduler.executor;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.errorprone.annotations.ThreadSafe;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import io.github.byzatic.tickscheduler.job.Job;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executor;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Runs job tasks on a worker pool and keeps track of the runs in flight,
 * so that a job with {@code runConcurrently == false} never overlaps itself.
 */
@ThreadSafe
public class JobExecutor implements JobExecutorInterface {
    private final static Logger logger = LoggerFactory.getLogger(JobExecutor.class);

    private final ExecutorService workerPool;
    private final boolean ownsWorkerPool;

    private final Object lock = new Object();

    @GuardedBy("lock")
    private final Map<String, Integer> inFlight = new HashMap<>();

    /**
     * Creates an executor with its own worker pool, shut down by {@link #close()}.
     */
    public JobExecutor() {
        this(createDefaultWorkerPool(), true);
    }

    /**
     * Uses a caller-provided pool. {@link #close()} leaves it running.
     */
    public JobExecutor(@NotNull ExecutorService workerPool) {
        this(workerPool, false);
    }

    private JobExecutor(ExecutorService workerPool, boolean ownsWorkerPool) {
        this.workerPool = Objects.requireNonNull(workerPool, "workerPool");
        this.ownsWorkerPool = ownsWorkerPool;
    }

    @Override
    public void execute(@NotNull Job job, @NotNull Runnable onSuccess, @NotNull Consumer<Throwable> onError) {
        Objects.requireNonNull(job, "job");
        Objects.requireNonNull(onSuccess, "onSuccess");
        Objects.requireNonNull(onError, "onError");
        String jobId = job.getJobId();

        synchronized (lock) {
            if (!job.isRunConcurrently() && inFlight.containsKey(jobId)) {
                logger.debug("Job {} is still running, skipping this run", jobId);
                return;
            }
            inFlight.merge(jobId, 1, Integer::sum);
        }

        AtomicBoolean started = new AtomicBoolean(false);
        Runnable wrapper = () -> {
            started.set(true);
            try {
                Throwable failure = null;
                try {
                    job.getTask().run();
                } catch (Throwable ex) {
                    failure = ex;
                }
                if (failure == null) {
                    onSuccess.run();
                } else {
                    onError.accept(failure);
                }
            } finally {
                release(jobId);
            }
        };

        Executor dispatcher = job.getDispatcher() != null ? job.getDispatcher() : workerPool;
        try {
            dispatcher.execute(wrapper);
        } catch (RuntimeException ex) {
            // an inline dispatcher has already released the job
            if (started.get()) throw ex;
            // RejectedExecutionException, or whatever a custom dispatcher throws
            release(jobId);
            logger.warn("Job {} rejected by its dispatcher: {}", jobId, ex.toString());
            onError.accept(ex);
        }
    }

    @Override
    public boolean isInFlight(@NotNull String jobId) {
        synchronized (lock) {
            return inFlight.containsKey(jobId);
        }
    }

    @Override
    public int inFlightCount() {
        synchronized (lock) {
            int total = 0;
            for (int count : inFlight.values()) total += count;
            return total;
        }
    }

    /**
     * Shuts down the worker pool if this executor created it. Running tasks are allowed to finish.
     */
    @Override
    public void close() {
        if (!ownsWorkerPool) return;
        workerPool.shutdown();
        try {
            if (!workerPool.awaitTermination(10, TimeUnit.SECONDS)) {
                workerPool.shutdownNow();
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            workerPool.shutdownNow();
        }
    }

    private void release(String jobId) {
        synchronized (lock) {
            inFlight.computeIfPresent(jobId, (id, count) -> count > 1 ? count - 1 : null);
        }
    }

    private static ExecutorService createDefaultWorkerPool() {
        ThreadPoolExecutor pool = new ThreadPoolExecutor(
                Math.max(2, Runtime.getRuntime().availableProcessors()),
                Math.max(4, Runtime.getRuntime().availableProcessors() * 2),
                60, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(),
                new ThreadFactoryBuilder()
                        .setNameFormat("tick-exec-%d")
                        .setDaemon(true)
                        .setUncaughtExceptionHandler((th, ex) -> logger.error("Uncaught in {}", th.getName(), ex))
                        .build()
        );
        pool.allowCoreThreadTimeOut(true);
        return pool;
    }
}
