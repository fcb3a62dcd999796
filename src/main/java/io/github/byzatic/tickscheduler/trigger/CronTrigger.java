package io.github.byzatic.tickscheduler.trigger;

import org.jetbrains.annotations.NotNull;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Fires at a fixed local time on the given days of the week.
 */
public final class CronTrigger implements Trigger {
    private final Set<DayOfWeek> daysOfWeek;
    private final LocalTime time;

    public CronTrigger(@NotNull Set<DayOfWeek> daysOfWeek, @NotNull LocalTime time) {
        Objects.requireNonNull(daysOfWeek, "daysOfWeek");
        checkArgument(!daysOfWeek.isEmpty(), "At least one day of week is required");
        this.daysOfWeek = Collections.unmodifiableSet(EnumSet.copyOf(daysOfWeek));
        this.time = Objects.requireNonNull(time, "time");
    }

    public @NotNull Set<DayOfWeek> getDaysOfWeek() {
        return daysOfWeek;
    }

    public @NotNull LocalTime getTime() {
        return time;
    }

    @Override
    public @NotNull Optional<ZonedDateTime> getNextRunTime(@NotNull ZonedDateTime currentTime, @NotNull ZoneId timeZone) {
        LocalDate date = currentTime.withZoneSameInstant(timeZone).toLocalDate();
        if (!DailyTrigger.atTime(date, time, timeZone).isAfter(currentTime)) {
            date = date.plusDays(1);
        }
        // at most six steps, the set is never empty
        while (!daysOfWeek.contains(date.getDayOfWeek())) {
            date = date.plusDays(1);
        }
        return Optional.of(DailyTrigger.atTime(date, time, timeZone));
    }

    @Override
    public String toString() {
        return "CronTrigger{daysOfWeek=" + daysOfWeek + ", time=" + time + '}';
    }
}
