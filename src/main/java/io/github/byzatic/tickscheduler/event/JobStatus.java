package io.github.byzatic.tickscheduler.event;

/**
 * Outcome of a single job run.
 */
public enum JobStatus {SUCCESS, ERROR}
