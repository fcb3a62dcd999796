package io.github.byzatic.tickscheduler.trigger;

import org.jetbrains.annotations.NotNull;

import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Fires every {@code intervalSeconds}, counted from the moment it is asked.
 */
public final class IntervalTrigger implements Trigger {
    private final long intervalSeconds;

    public IntervalTrigger(long intervalSeconds) {
        checkArgument(intervalSeconds > 0, "Interval must be positive, got %s seconds", intervalSeconds);
        this.intervalSeconds = intervalSeconds;
    }

    public long getIntervalSeconds() {
        return intervalSeconds;
    }

    @Override
    public @NotNull Optional<ZonedDateTime> getNextRunTime(@NotNull ZonedDateTime currentTime, @NotNull ZoneId timeZone) {
        return Optional.of(currentTime.plusSeconds(intervalSeconds));
    }

    @Override
    public String toString() {
        return "IntervalTrigger{intervalSeconds=" + intervalSeconds + '}';
    }
}
