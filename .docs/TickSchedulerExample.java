import io.github.byzatic.tickscheduler.event.JobEvent;
import io.github.byzatic.tickscheduler.event.JobEventListener;
import io.github.byzatic.tickscheduler.scheduler.TickScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.EnumSet;

class TickSchedulerExample {
    private static final Logger logger = LoggerFactory.getLogger(TickSchedulerExample.class);

    public static void main(String[] args) {
        ZoneId zone = ZoneId.of("Asia/Kolkata");
        try (TickScheduler scheduler = new TickScheduler.Builder()
                .zone(zone)
                .maxGraceTime(Duration.ofSeconds(30))
                .addListener(new MyEventListener())
                .build()
        ) {
            // Once, five seconds from now
            scheduler.runOnce(ZonedDateTime.now(zone).plusSeconds(5),
                    () -> logger.debug("[JOB] one-time job"));

            // Every ten seconds, never overlapping itself
            scheduler.runRepeating(10, null, false, () -> {
                logger.debug("[JOB] slow repeating job started");
                Thread.sleep(15_000);
            });

            // Every weekday at 09:30
            scheduler.runCron(EnumSet.range(DayOfWeek.MONDAY, DayOfWeek.FRIDAY), LocalTime.of(9, 30),
                    () -> logger.debug("[JOB] weekday job"));

            // Fails every time, still rescheduled
            scheduler.runRepeating(20, () -> {
                throw new IllegalStateException("Meow");
            });

            scheduler.start();
            // Blocks until the thread is interrupted
            scheduler.idle();
        }
    }

    /**
     * Event listener
     */
    public static class MyEventListener implements JobEventListener {
        @Override
        public void onJobComplete(JobEvent event) {
            logger.debug("[EVENT] Job {} completed at {}", event.getJobId(), event.getTimestamp());
        }

        @Override
        public void onJobError(JobEvent event) {
            logger.warn("[EVENT] Job {} failed at {}: {}", event.getJobId(), event.getTimestamp(), event.getError());
        }
    }
}
