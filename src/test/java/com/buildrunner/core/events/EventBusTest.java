package com.buildrunner.core.events;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class EventBusTest {

    private EventBus eventBus;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
    }

    private static RunEvent event(String type, String runId, String taskName) {
        return RunEvent.of(type, runId, taskName, Map.of());
    }

    @Nested
    @DisplayName("per-run subscription")
    class RunSubscriptionTests {

        @Test
        @DisplayName("delivers events for the subscribed run in publish order")
        void deliversInOrder() {
            List<RunEvent> received = new ArrayList<>();
            eventBus.subscribe("RUN-1", received::add);

            eventBus.publish(event(RunEvent.RUN_STARTED, "RUN-1", null));
            eventBus.publish(event(RunEvent.TASK_STARTED, "RUN-1", "compile"));
            eventBus.publish(event(RunEvent.TASK_COMPLETED, "RUN-1", "compile"));

            assertEquals(List.of(RunEvent.RUN_STARTED, RunEvent.TASK_STARTED, RunEvent.TASK_COMPLETED),
                    received.stream().map(RunEvent::eventType).toList());
        }

        @Test
        @DisplayName("ignores events of other runs")
        void ignoresOtherRuns() {
            List<RunEvent> received = new ArrayList<>();
            eventBus.subscribe("RUN-2", received::add);

            eventBus.publish(event(RunEvent.TASK_STARTED, "RUN-1", "compile"));

            assertTrue(received.isEmpty());
        }

        @Test
        @DisplayName("unsubscribe stops delivery to that subscriber only")
        void unsubscribe() {
            List<RunEvent> first = new ArrayList<>();
            List<RunEvent> second = new ArrayList<>();
            EventBus.Subscription subscription = eventBus.subscribe("RUN-1", first::add);
            eventBus.subscribe("RUN-1", second::add);

            subscription.unsubscribe();
            eventBus.publish(event(RunEvent.TASK_BLOCKED, "RUN-1", "test"));

            assertTrue(first.isEmpty());
            assertEquals(1, second.size());
        }
    }

    @Nested
    @DisplayName("run lifecycle")
    class LifecycleTests {

        @Test
        @DisplayName("run listeners receive run.completed and are then released")
        void releasedAfterCompletion() {
            List<RunEvent> received = new ArrayList<>();
            eventBus.subscribe("RUN-1", received::add);
            assertEquals(1, eventBus.activeRuns());

            eventBus.publish(event(RunEvent.RUN_COMPLETED, "RUN-1", null));
            eventBus.publish(event(RunEvent.TASK_STARTED, "RUN-1", "late"));

            assertEquals(List.of(RunEvent.RUN_COMPLETED), received.stream().map(RunEvent::eventType).toList());
            assertEquals(0, eventBus.activeRuns());
        }

        @Test
        @DisplayName("completing one run leaves other runs' listeners attached")
        void otherRunsKept() {
            List<RunEvent> second = new ArrayList<>();
            eventBus.subscribe("RUN-1", e -> {});
            eventBus.subscribe("RUN-2", second::add);

            eventBus.publish(event(RunEvent.RUN_COMPLETED, "RUN-1", null));
            eventBus.publish(event(RunEvent.TASK_STARTED, "RUN-2", "compile"));

            assertEquals(1, eventBus.activeRuns());
            assertEquals(1, second.size());
        }

        @Test
        @DisplayName("global listeners outlive completed runs")
        void globalKept() {
            List<RunEvent> received = new ArrayList<>();
            eventBus.subscribeAll(received::add);

            eventBus.publish(event(RunEvent.RUN_COMPLETED, "RUN-1", null));
            eventBus.publish(event(RunEvent.RUN_STARTED, "RUN-2", null));

            assertEquals(2, received.size());
        }

        @Test
        @DisplayName("removing the last listener of a run forgets the run")
        void unsubscribeForgetsRun() {
            EventBus.Subscription subscription = eventBus.subscribe("RUN-1", e -> {});

            subscription.unsubscribe();

            assertEquals(0, eventBus.activeRuns());
        }
    }

    @Nested
    @DisplayName("task subscription")
    class TaskSubscriptionTests {

        @Test
        @DisplayName("receives only the named task's events")
        void filtersByTask() {
            List<RunEvent> received = new ArrayList<>();
            eventBus.subscribeTask("RUN-1", "test", received::add);

            eventBus.publish(event(RunEvent.RUN_STARTED, "RUN-1", null));
            eventBus.publish(event(RunEvent.TASK_STARTED, "RUN-1", "compile"));
            eventBus.publish(event(RunEvent.TASK_BLOCKED, "RUN-1", "test"));

            assertEquals(1, received.size());
            assertEquals(RunEvent.TASK_BLOCKED, received.get(0).eventType());
        }

        @Test
        @DisplayName("requires a task name")
        void requiresTaskName() {
            assertThrows(NullPointerException.class, () -> eventBus.subscribeTask("RUN-1", null, e -> {}));
        }
    }

    @Nested
    @DisplayName("global subscription")
    class GlobalSubscriptionTests {

        @Test
        @DisplayName("receives events from every run alongside run subscribers")
        void receivesAllRuns() {
            List<RunEvent> global = new ArrayList<>();
            List<RunEvent> scoped = new ArrayList<>();
            eventBus.subscribeAll(global::add);
            eventBus.subscribe("RUN-1", scoped::add);

            eventBus.publish(event(RunEvent.RUN_STARTED, "RUN-1", null));
            eventBus.publish(event(RunEvent.RUN_STARTED, "RUN-2", null));

            assertEquals(2, global.size());
            assertEquals(1, scoped.size());
        }

        @Test
        @DisplayName("unsubscribing a global subscriber stops delivery")
        void unsubscribeGlobal() {
            List<RunEvent> received = new ArrayList<>();
            EventBus.Subscription subscription = eventBus.subscribeAll(received::add);

            subscription.unsubscribe();
            eventBus.publish(event(RunEvent.RUN_COMPLETED, "RUN-1", null));

            assertTrue(received.isEmpty());
        }
    }

    @Nested
    @DisplayName("edge cases")
    class EdgeCaseTests {

        @Test
        @DisplayName("a throwing subscriber does not stop delivery to the others")
        void throwingSubscriberIsIsolated() {
            List<RunEvent> received = new ArrayList<>();
            eventBus.subscribe("RUN-1", e -> {
                throw new IllegalStateException("boom");
            });
            eventBus.subscribe("RUN-1", received::add);

            assertDoesNotThrow(() -> eventBus.publish(event(RunEvent.TASK_STARTED, "RUN-1", "lint")));
            assertEquals(1, received.size());
        }

        @Test
        @DisplayName("concurrent publishes are all delivered")
        void concurrentPublishes() throws InterruptedException {
            CopyOnWriteArrayList<RunEvent> received = new CopyOnWriteArrayList<>();
            eventBus.subscribe("RUN-1", received::add);

            int threads = 8;
            int perThread = 50;
            CountDownLatch done = new CountDownLatch(threads);
            for (int t = 0; t < threads; t++) {
                new Thread(() -> {
                    for (int i = 0; i < perThread; i++) {
                        eventBus.publish(event(RunEvent.TASK_COMPLETED, "RUN-1", "task-" + i));
                    }
                    done.countDown();
                }).start();
            }

            assertTrue(done.await(10, TimeUnit.SECONDS));
            assertEquals(threads * perThread, received.size());
        }
    }
}
