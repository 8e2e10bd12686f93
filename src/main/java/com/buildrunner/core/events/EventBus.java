package com.buildrunner.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-process delivery of run lifecycle events.
 * <p>
 * Listeners attach to one run, to one task within a run, or to every run. A run's listeners are
 * released once its {@code run.completed} event has been delivered, so the bus holds no state for
 * finished runs. Events for one run are published from that run's scheduling thread and arrive in
 * publish order.
 */
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Listener>> runListeners = new ConcurrentHashMap<>();
    private final CopyOnWriteArrayList<Consumer<RunEvent>> globalListeners = new CopyOnWriteArrayList<>();

    public void publish(RunEvent event) {
        log.debug("{} {}{}", event.runId(), event.eventType(),
                event.taskName() == null ? "" : " " + event.taskName());

        List<Listener> listeners = runListeners.get(event.runId());
        if (listeners != null) {
            for (Listener listener : listeners) {
                if (listener.accepts(event)) {
                    deliver(listener.consumer(), event);
                }
            }
        }
        for (Consumer<RunEvent> listener : globalListeners) {
            deliver(listener, event);
        }

        if (RunEvent.RUN_COMPLETED.equals(event.eventType())) {
            List<Listener> released = runListeners.remove(event.runId());
            if (released != null) {
                log.debug("Released {} listener(s) of finished run {}", released.size(), event.runId());
            }
        }
    }

    /**
     * Listen to every event of one run until it completes.
     */
    public Subscription subscribe(String runId, Consumer<RunEvent> consumer) {
        return attach(runId, new Listener(null, consumer));
    }

    /**
     * Listen to the events of one task in a run: started, completed or blocked.
     */
    public Subscription subscribeTask(String runId, String taskName, Consumer<RunEvent> consumer) {
        Objects.requireNonNull(taskName, "taskName is required");
        return attach(runId, new Listener(taskName, consumer));
    }

    /**
     * Listen to the events of every run. Global listeners stay attached until unsubscribed.
     */
    public Subscription subscribeAll(Consumer<RunEvent> consumer) {
        globalListeners.add(consumer);
        return () -> globalListeners.remove(consumer);
    }

    /** Number of runs that currently have listeners attached. */
    public int activeRuns() {
        return runListeners.size();
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private Subscription attach(String runId, Listener listener) {
        Objects.requireNonNull(runId, "runId is required");
        runListeners.computeIfAbsent(runId, k -> new CopyOnWriteArrayList<>()).add(listener);
        return () -> runListeners.computeIfPresent(runId, (k, listeners) -> {
            listeners.remove(listener);
            return listeners.isEmpty() ? null : listeners;
        });
    }

    private void deliver(Consumer<RunEvent> consumer, RunEvent event) {
        try {
            consumer.accept(event);
        } catch (RuntimeException e) {
            log.warn("Listener failed on {} of run {}: {}", event.eventType(), event.runId(), e.getMessage(), e);
        }
    }

    private record Listener(String taskName, Consumer<RunEvent> consumer) {

        boolean accepts(RunEvent event) {
            return taskName == null || taskName.equals(event.taskName());
        }
    }
}
