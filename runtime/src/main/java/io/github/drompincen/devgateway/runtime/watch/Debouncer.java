package io.github.drompincen.devgateway.runtime.watch;

import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs the latest action submitted for a key once the key has been quiet for the window.
 * A repeated submit cancels the pending timer and schedules a new one.
 */
public class Debouncer<K> {

    private final TaskScheduler scheduler;
    private final Duration window;
    private final Map<K, ScheduledFuture<?>> pending = new ConcurrentHashMap<>();

    public Debouncer(TaskScheduler scheduler, Duration window) {
        this.scheduler = scheduler;
        this.window = window;
    }

    public void submit(K key, Runnable action) {
        pending.compute(key, (k, previous) -> {
            if (previous != null) previous.cancel(false);
            AtomicReference<ScheduledFuture<?>> self = new AtomicReference<>();
            ScheduledFuture<?> future = scheduler.schedule(() -> {
                // only clear our own entry; a newer submit may already have replaced it
                pending.computeIfPresent(k, (ignored, current) -> current == self.get() ? null : current);
                action.run();
            }, Instant.now().plus(window));
            self.set(future);
            return future;
        });
    }

    public int pendingCount() {
        return pending.size();
    }

    public void cancelAll() {
        pending.values().forEach(f -> f.cancel(false));
        pending.clear();
    }
}
