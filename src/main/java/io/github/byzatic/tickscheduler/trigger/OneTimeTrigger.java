package io.github.byzatic.tickscheduler.trigger;

import org.jetbrains.annotations.NotNull;

import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Objects;
import java.util.Optional;

/**
 * Fires once at the given moment. The only trigger that ends a job.
 */
public final class OneTimeTrigger implements Trigger {
    private final ZonedDateTime runAt;

    public OneTimeTrigger(@NotNull ZonedDateTime runAt) {
        this.runAt = Objects.requireNonNull(runAt, "runAt");
    }

    public @NotNull ZonedDateTime getRunAt() {
        return runAt;
    }

    @Override
    public @NotNull Optional<ZonedDateTime> getNextRunTime(@NotNull ZonedDateTime currentTime, @NotNull ZoneId timeZone) {
        ZonedDateTime adjusted = runAt.withZoneSameInstant(timeZone);
        return adjusted.isAfter(currentTime) ? Optional.of(adjusted) : Optional.empty();
    }

    @Override
    public String toString() {
        return "OneTimeTrigger{runAt=" + runAt + '}';
    }
}
