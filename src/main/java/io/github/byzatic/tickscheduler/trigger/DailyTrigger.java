package io.github.byzatic.tickscheduler.trigger;

import org.jetbrains.annotations.NotNull;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Objects;
import java.util.Optional;

/**
 * Fires every day at a fixed local time of the scheduler zone.
 */
public final class DailyTrigger implements Trigger {
    private final LocalTime time;

    public DailyTrigger(@NotNull LocalTime time) {
        this.time = Objects.requireNonNull(time, "time");
    }

    public @NotNull LocalTime getTime() {
        return time;
    }

    @Override
    public @NotNull Optional<ZonedDateTime> getNextRunTime(@NotNull ZonedDateTime currentTime, @NotNull ZoneId timeZone) {
        return Optional.of(nextOccurrence(currentTime, timeZone, time));
    }

    /**
     * Today's occurrence of {@code time} in {@code timeZone}, or tomorrow's if it is not
     * strictly after {@code currentTime}. Sub-second precision is dropped.
     */
    static ZonedDateTime nextOccurrence(ZonedDateTime currentTime, ZoneId timeZone, LocalTime time) {
        LocalDate today = currentTime.withZoneSameInstant(timeZone).toLocalDate();
        ZonedDateTime next = atTime(today, time, timeZone);
        if (!next.isAfter(currentTime)) {
            next = atTime(today.plusDays(1), time, timeZone);
        }
        return next;
    }

    /**
     * {@code time} on {@code date}. Each date is resolved on its own, so a time pushed forward
     * by a daylight saving gap on one day stays unshifted on the others.
     */
    static ZonedDateTime atTime(LocalDate date, LocalTime time, ZoneId timeZone) {
        return ZonedDateTime.of(date, time.withNano(0), timeZone);
    }

    @Override
    public String toString() {
        return "DailyTrigger{time=" + time + '}';
    }
}
