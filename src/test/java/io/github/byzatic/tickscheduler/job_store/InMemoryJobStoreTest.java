package io.github.byzatic.tickscheduler.job_store;

import io.github.byzatic.tickscheduler.job.Job;
import io.github.byzatic.tickscheduler.trigger.IntervalTrigger;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryJobStoreTest {
    private static final ZonedDateTime NOW = ZonedDateTime.of(2023, 6, 12, 10, 0, 0, 0, ZoneId.of("UTC"));
    private final InMemoryJobStore store = new InMemoryJobStore();

    private static Job job(String id, ZonedDateTime nextRunTime) {
        return Job.newBuilder()
                .setJobId(id)
                .setTrigger(new IntervalTrigger(10))
                .setNextRunTime(nextRunTime)
                .setTask(() -> {})
                .build();
    }

    @Test
    void addGetRemove() {
        Job job = job("job1", NOW);
        store.addJob(job);

        assertEquals(job, store.getJobById("job1").orElseThrow());
        assertEquals(1, store.getAllJobs().size());

        store.removeJob("job1");
        assertTrue(store.getJobById("job1").isEmpty());
        assertTrue(store.getAllJobs().isEmpty());

        // removing again is a no-op
        store.removeJob("job1");
    }

    @Test
    void addReplacesJobWithSameId() {
        store.addJob(job("job1", NOW));
        store.addJob(job("job1", NOW.plusHours(1)));

        assertEquals(1, store.getAllJobs().size());
        assertEquals(NOW.plusHours(1), store.getJobById("job1").orElseThrow().getNextRunTime());
    }

    @Test
    void rejectsJobWithoutNextRunTime() {
        Job job = Job.newBuilder().setJobId("job1").setTrigger(new IntervalTrigger(1)).setTask(() -> {}).build();

        assertThrows(NullPointerException.class, () -> store.addJob(job));
    }

    @Test
    void dueJobsWithoutGraceIncludeAnyOverdueJob() {
        store.addJob(job("overdue", NOW.minusDays(3)));
        store.addJob(job("exact", NOW));
        store.addJob(job("future", NOW.plusSeconds(1)));

        List<Job> due = store.getDueJobs(NOW, null);

        assertEquals(2, due.size());
        assertTrue(due.contains(job("overdue", NOW)));
        assertTrue(due.contains(job("exact", NOW)));
    }

    @Test
    void dueJobsRespectGraceWindow() {
        store.addJob(job("late", NOW.minusSeconds(30)));

        assertEquals(1, store.getDueJobs(NOW, Duration.ofSeconds(60)).size());
        assertEquals(1, store.getDueJobs(NOW, Duration.ofSeconds(30)).size());
        assertTrue(store.getDueJobs(NOW, Duration.ofSeconds(10)).isEmpty());
        assertEquals(1, store.getDueJobs(NOW, null).size());

        // skipped jobs stay in the store untouched
        assertEquals(NOW.minusSeconds(30), store.getJobById("late").orElseThrow().getNextRunTime());
    }

    @Test
    void updateNextRunTimeIsVisibleToDueQuery() {
        store.addJob(job("job1", NOW));
        store.updateJobNextRunTime("job1", NOW.plusSeconds(10));

        assertTrue(store.getDueJobs(NOW, null).isEmpty());
        assertEquals(NOW.plusSeconds(10), store.getJobById("job1").orElseThrow().getNextRunTime());
    }

    @Test
    void updateAfterRemoveDoesNotResurrectJob() {
        store.addJob(job("job1", NOW));
        store.removeJob("job1");

        store.updateJobNextRunTime("job1", NOW.plusSeconds(10));

        assertTrue(store.getJobById("job1").isEmpty());
    }
}
