package io.github.byzatic.tickscheduler.scheduler;

/**
 * Lifecycle of a scheduler. {@code SHUT_DOWN} may go back to {@code RUNNING} on restart.
 */
public enum SchedulerState {NOT_STARTED, RUNNING, SHUT_DOWN}
