package io.github.byzatic.tickscheduler.trigger;

import org.jetbrains.annotations.NotNull;

import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * Computes the next run time of a job.
 * <p>
 * Implementations must be stateless and safe to call from any thread:
 * the result depends only on the trigger configuration and the arguments.
 * Custom triggers are welcome.
 */
public interface Trigger {

    /**
     * @param currentTime the current time
     * @param timeZone    the zone the scheduler operates in
     * @return the next run time strictly after {@code currentTime},
     * or empty if the trigger will never fire again
     */
    @NotNull Optional<ZonedDateTime> getNextRunTime(@NotNull ZonedDateTime currentTime, @NotNull ZoneId timeZone);
}
