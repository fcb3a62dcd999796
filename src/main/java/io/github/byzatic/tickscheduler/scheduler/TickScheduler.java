package io.github.byzatic.tickscheduler.scheduler;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.errorprone.annotations.ThreadSafe;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import io.github.byzatic.tickscheduler.UuidProvider;
import io.github.byzatic.tickscheduler.event.JobEvent;
import io.github.byzatic.tickscheduler.event.JobEventListener;
import io.github.byzatic.tickscheduler.event.JobEventPublisher;
import io.github.byzatic.tickscheduler.executor.JobExecutor;
import io.github.byzatic.tickscheduler.executor.JobExecutorInterface;
import io.github.byzatic.tickscheduler.job.Job;
import io.github.byzatic.tickscheduler.job.JobTask;
import io.github.byzatic.tickscheduler.job_store.InMemoryJobStore;
import io.github.byzatic.tickscheduler.job_store.JobStoreInterface;
import io.github.byzatic.tickscheduler.trigger.CronTrigger;
import io.github.byzatic.tickscheduler.trigger.DailyTrigger;
import io.github.byzatic.tickscheduler.trigger.IntervalTrigger;
import io.github.byzatic.tickscheduler.trigger.OneTimeTrigger;
import io.github.byzatic.tickscheduler.trigger.Trigger;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

/**
 * TickScheduler
 * - Wakes every tick interval (100 ms by default) and runs the jobs that are due
 * - Next run time is written back before a job is dispatched, one-time jobs are removed
 * - Optional grace time: jobs later than that are skipped, not replayed
 * - Global and per-job pause
 * - Completion and error events for every run
 * - Can be restarted after shutdown
 */
@ThreadSafe
public final class TickScheduler implements TickSchedulerInterface {
    private final static Logger logger = LoggerFactory.getLogger(TickScheduler.class);

    private final JobStoreInterface jobStore;
    private final ZoneId zone;
    private final Duration maxGraceTime;
    private final Duration tickInterval;
    private final JobExecutorInterface executor;
    private final boolean ownsExecutor;
    private final Clock clock;
    private final JobEventPublisher publisher = new JobEventPublisher();

    private final AtomicBoolean paused = new AtomicBoolean(false);
    private final Set<String> pausedJobs = ConcurrentHashMap.newKeySet();
    // a tick left over from a previous start must finish before the next one reads the store
    private final Object tickLock = new Object();

    @GuardedBy("this")
    private SchedulerState state = SchedulerState.NOT_STARTED;

    @GuardedBy("this")
    private ScheduledExecutorService tickScope;

    @GuardedBy("this")
    private boolean closed = false;

    private TickScheduler(Builder builder) {
        this.jobStore = builder.jobStore != null ? builder.jobStore : new InMemoryJobStore();
        this.zone = builder.zone;
        this.maxGraceTime = builder.maxGraceTime;
        this.tickInterval = builder.tickInterval;
        this.ownsExecutor = builder.executor == null;
        this.executor = builder.executor != null ? builder.executor : new JobExecutor();
        this.clock = builder.clock;
        for (JobEventListener l : builder.listeners) publisher.addListener(l);
    }

    public static final class Builder {
        private JobStoreInterface jobStore;
        private ZoneId zone = ZoneId.systemDefault();
        private Duration maxGraceTime;
        private Duration tickInterval = Duration.ofMillis(100);
        private JobExecutorInterface executor;
        private Clock clock = Clock.systemUTC();
        private final List<JobEventListener> listeners = new ArrayList<>();

        /**
         * Job storage. Defaults to {@link InMemoryJobStore}.
         */
        public Builder jobStore(JobStoreInterface jobStore) {
            this.jobStore = Objects.requireNonNull(jobStore);
            return this;
        }

        public Builder zone(ZoneId zone) {
            this.zone = Objects.requireNonNull(zone);
            return this;
        }

        /**
         * Maximum lateness of a due job. {@code null} (the default) means no limit.
         */
        public Builder maxGraceTime(Duration maxGraceTime) {
            checkArgument(maxGraceTime == null || !maxGraceTime.isNegative(), "Grace time must not be negative");
            this.maxGraceTime = maxGraceTime;
            return this;
        }

        public Builder tickInterval(Duration tickInterval) {
            Objects.requireNonNull(tickInterval);
            checkArgument(tickInterval.toMillis() > 0, "Tick interval must be at least 1 ms");
            this.tickInterval = tickInterval;
            return this;
        }

        /**
         * Provide your own job executor. It is not closed together with the scheduler.
         */
        public Builder executor(JobExecutorInterface executor) {
            this.executor = Objects.requireNonNull(executor);
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock);
            return this;
        }

        public Builder addListener(JobEventListener l) {
            listeners.add(Objects.requireNonNull(l));
            return this;
        }

        public TickScheduler build() {
            return new TickScheduler(this);
        }
    }

    // ======== Lifecycle ========

    @Override
    public synchronized void start() {
        logger.info("Starting scheduler...");
        checkState(!closed, "Scheduler is closed");
        checkState(state != SchedulerState.RUNNING, "Scheduler is already running");

        ScheduledExecutorService scope = Executors.newSingleThreadScheduledExecutor(
                new ThreadFactoryBuilder()
                        .setNameFormat("tick-scheduler-%d")
                        .setDaemon(true)
                        .build());
        scope.scheduleWithFixedDelay(this::tick, 0, tickInterval.toMillis(), TimeUnit.MILLISECONDS);
        tickScope = scope;
        state = SchedulerState.RUNNING;
        logger.info("Scheduler started, tick interval {} ms, zone {}", tickInterval.toMillis(), zone);
    }

    @Override
    public synchronized void shutdown() {
        logger.info("Shutting down scheduler...");
        checkState(state == SchedulerState.RUNNING, "Scheduler is not running");
        // a tick in progress finishes, no new tick starts
        tickScope.shutdown();
        tickScope = null;
        state = SchedulerState.SHUT_DOWN;
        logger.info("Scheduler shut down");
    }

    @Override
    public void idle() {
        ScheduledExecutorService scope;
        synchronized (this) {
            if (state != SchedulerState.RUNNING) return;
            scope = tickScope;
        }
        logger.info("Idling scheduler");
        try {
            while (!scope.awaitTermination(1, TimeUnit.SECONDS)) {
                logger.trace("Scheduler still running");
            }
        } catch (InterruptedException ie) {
            logger.error("Stopping scheduler due to interruption: {}", ie.getMessage());
            shutdownIfRunning(scope);
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public synchronized boolean isRunning() {
        return state == SchedulerState.RUNNING;
    }

    @Override
    public synchronized @NotNull SchedulerState getState() {
        return state;
    }

    @Override
    public void close() {
        synchronized (this) {
            if (closed) return;
            closed = true;
            if (state == SchedulerState.RUNNING) shutdown();
        }
        if (ownsExecutor) executor.close();
    }

    // ======== Jobs ========

    /**
     * Adds or replaces a job. A job without a next run time gets one from its trigger.
     *
     * @throws IllegalArgumentException if the trigger has no future run time
     */
    @Override
    public void addJob(@NotNull Job job) {
        Objects.requireNonNull(job, "job");
        if (job.getNextRunTime() == null) {
            Trigger trigger = job.getTrigger();
            ZonedDateTime first = trigger.getNextRunTime(now(), zone)
                    .orElseThrow(() -> new IllegalArgumentException("Trigger has no future run time: " + trigger));
            job = job.withNextRunTime(first);
        }
        logger.info("Adding job {}, next run at {}", job.getJobId(), job.getNextRunTime());
        jobStore.addJob(job);
    }

    @Override
    public void removeJob(@NotNull String jobId) {
        logger.info("Removing job {}", jobId);
        jobStore.removeJob(jobId);
        pausedJobs.remove(jobId);
    }

    @Override
    public @NotNull Optional<Job> getJob(@NotNull String jobId) {
        return jobStore.getJobById(jobId);
    }

    @Override
    public @NotNull List<Job> getJobs() {
        return jobStore.getAllJobs();
    }

    // ======== Pause ========

    @Override
    public void pause() {
        logger.info("Pausing scheduler");
        paused.set(true);
    }

    @Override
    public void resume() {
        logger.info("Resuming scheduler");
        paused.set(false);
    }

    @Override
    public boolean isPaused() {
        return paused.get();
    }

    @Override
    public void pauseJob(@NotNull String jobId) {
        logger.info("Pausing job {}", jobId);
        pausedJobs.add(Objects.requireNonNull(jobId, "jobId"));
    }

    @Override
    public void resumeJob(@NotNull String jobId) {
        logger.info("Resuming job {}", jobId);
        pausedJobs.remove(jobId);
    }

    @Override
    public boolean isJobPaused(@NotNull String jobId) {
        return pausedJobs.contains(jobId);
    }

    // ======== Events ========

    @Override
    public void addEventListener(@NotNull JobEventListener listener) {
        publisher.addListener(listener);
    }

    @Override
    public void removeEventListener(@NotNull JobEventListener listener) {
        publisher.removeListener(listener);
    }

    // ======== Convenience ========

    @Override
    public @NotNull String runOnce(@NotNull ZonedDateTime runAt, @NotNull JobTask task) {
        return runOnce(runAt, null, true, task);
    }

    @Override
    public @NotNull String runOnce(@NotNull ZonedDateTime runAt, @Nullable Executor dispatcher, boolean runConcurrently, @NotNull JobTask task) {
        return register("runOnce", new OneTimeTrigger(runAt), runAt, dispatcher, runConcurrently, task);
    }

    @Override
    public @NotNull String runRepeating(long intervalSeconds, @NotNull JobTask task) {
        return runRepeating(intervalSeconds, null, true, task);
    }

    @Override
    public @NotNull String runRepeating(long intervalSeconds, @Nullable Executor dispatcher, boolean runConcurrently, @NotNull JobTask task) {
        return register("runRepeating", new IntervalTrigger(intervalSeconds), null, dispatcher, runConcurrently, task);
    }

    @Override
    public @NotNull String runDaily(@NotNull LocalTime time, @NotNull JobTask task) {
        return runDaily(time, null, true, task);
    }

    @Override
    public @NotNull String runDaily(@NotNull LocalTime time, @Nullable Executor dispatcher, boolean runConcurrently, @NotNull JobTask task) {
        return register("runDaily", new DailyTrigger(time), null, dispatcher, runConcurrently, task);
    }

    @Override
    public @NotNull String runCron(@NotNull Set<DayOfWeek> daysOfWeek, @NotNull LocalTime time, @NotNull JobTask task) {
        return runCron(daysOfWeek, time, null, true, task);
    }

    @Override
    public @NotNull String runCron(@NotNull Set<DayOfWeek> daysOfWeek, @NotNull LocalTime time, @Nullable Executor dispatcher, boolean runConcurrently, @NotNull JobTask task) {
        return register("runCron", new CronTrigger(daysOfWeek, time), null, dispatcher, runConcurrently, task);
    }

    // ======== Internal ========

    private String register(String prefix, Trigger trigger, ZonedDateTime nextRunTime,
                            Executor dispatcher, boolean runConcurrently, JobTask task) {
        Job job = Job.newBuilder()
                .setJobId(UuidProvider.generatePrefixedId(prefix))
                .setTrigger(trigger)
                .setNextRunTime(nextRunTime)
                .setDispatcher(dispatcher)
                .setRunConcurrently(runConcurrently)
                .setTask(task)
                .build();
        addJob(job);
        return job.getJobId();
    }

    private void tick() {
        synchronized (tickLock) {
            if (paused.get()) return;
            try {
                processDueJobs();
            } catch (Throwable ex) {
                // anything escaping here would cancel the periodic tick
                logger.error("Tick failed", ex);
            }
        }
    }

    private void processDueJobs() {
        ZonedDateTime now = now();
        List<Job> dueJobs = jobStore.getDueJobs(now, maxGraceTime);
        for (Job job : dueJobs) {
            if (pausedJobs.contains(job.getJobId())) continue;
            logger.debug("Processing due job {}", job.getJobId());
            try {
                // before dispatch, so a slow run is not picked up again on the next tick
                setNextRunTimeOrRemoveJob(job, now);
                executor.execute(job,
                        () -> handleJobCompletion(job),
                        ex -> handleJobError(job, ex));
            } catch (RuntimeException ex) {
                logger.error("Could not process job {}", job.getJobId(), ex);
            }
        }
    }

    private void setNextRunTimeOrRemoveJob(Job job, ZonedDateTime now) {
        Optional<ZonedDateTime> nextRunTime = job.getTrigger().getNextRunTime(now, zone);
        if (nextRunTime.isPresent()) {
            logger.debug("Updating next run time for job {} to {}", job.getJobId(), nextRunTime.get());
            jobStore.updateJobNextRunTime(job.getJobId(), nextRunTime.get());
        } else {
            logger.info("Removing job {} as it has no next run time", job.getJobId());
            jobStore.removeJob(job.getJobId());
        }
    }

    private void handleJobCompletion(Job job) {
        logger.debug("Job {} completed successfully", job.getJobId());
        publisher.publish(JobEvent.success(job.getJobId(), now()));
    }

    private void handleJobError(Job job, Throwable ex) {
        logger.error("Error executing job {}", job.getJobId(), ex);
        publisher.publish(JobEvent.error(job.getJobId(), now(), ex));
    }

    private synchronized void shutdownIfRunning(ScheduledExecutorService scope) {
        if (state == SchedulerState.RUNNING && tickScope == scope) {
            shutdown();
        }
    }

    private ZonedDateTime now() {
        return ZonedDateTime.now(clock.withZone(zone));
    }
}
