package io.github.byzatic.tickscheduler.event;

import com.google.errorprone.annotations.ThreadSafe;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Ordered listener registry owned by one scheduler.
 * A listener that throws is logged and skipped; the others still get the event.
 */
@ThreadSafe
public class JobEventPublisher {
    private final static Logger logger = LoggerFactory.getLogger(JobEventPublisher.class);
    private final List<JobEventListener> listeners = new CopyOnWriteArrayList<>();

    public void addListener(@NotNull JobEventListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(@NotNull JobEventListener listener) {
        listeners.remove(listener);
    }

    public int listenerCount() {
        return listeners.size();
    }

    public void publish(@NotNull JobEvent event) {
        Objects.requireNonNull(event, "event");
        if (event.getStatus() == JobStatus.SUCCESS) {
            fire(event, l -> l.onJobComplete(event));
        } else {
            fire(event, l -> l.onJobError(event));
        }
    }

    private void fire(JobEvent event, Consumer<JobEventListener> c) {
        for (JobEventListener l : listeners) {
            try {
                c.accept(l);
            } catch (RuntimeException ex) {
                logger.warn("Listener {} failed on {}", l, event, ex);
            }
        }
    }
}
