package io.github.byzatic.tickscheduler.event;

/**
 * Job event listener. Called synchronously on the thread that finished the job.
 */
public interface JobEventListener {
    default void onJobComplete(JobEvent event) {
    }

    default void onJobError(JobEvent event) {
    }
}
