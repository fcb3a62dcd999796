package io.github.byzatic.tickscheduler.job;

/**
 * Body of a job. Any exception thrown here is reported as an error event.
 */
@FunctionalInterface
public interface JobTask {
    void run() throws Exception;
}
