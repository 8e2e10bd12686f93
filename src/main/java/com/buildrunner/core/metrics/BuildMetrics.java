package com.buildrunner.core.metrics;

import com.buildrunner.core.model.TaskStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for task runs.
 */
public class BuildMetrics {

    private final MeterRegistry registry;

    public BuildMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records a task reaching a terminal status. Blocked tasks are counted but not timed.
     */
    public void recordTaskResult(TaskStatus status, Duration elapsed) {
        String tag = tagOf(status);
        Counter.builder("buildrunner.tasks.total")
                .description("Tasks by terminal status")
                .tag("status", tag)
                .register(registry)
                .increment();

        if (status != TaskStatus.BLOCKED) {
            Timer.builder("buildrunner.task.duration")
                    .tag("status", tag)
                    .register(registry)
                    .record(elapsed);
        }
    }

    public void recordRunResult(boolean successful, Duration elapsed) {
        String result = successful ? "success" : "failure";
        Counter.builder("buildrunner.runs.total")
                .tag("result", result)
                .register(registry)
                .increment();
        Timer.builder("buildrunner.run.duration")
                .tag("result", result)
                .register(registry)
                .record(elapsed);
    }

    /**
     * Records how many tasks were waiting for a free slot when one was dispatched.
     */
    public void recordReadyQueueDepth(int depth) {
        DistributionSummary.builder("buildrunner.ready.queue")
                .description("Ready tasks waiting at each dispatch")
                .register(registry)
                .record(depth);
    }

    private static String tagOf(TaskStatus status) {
        return status.name().toLowerCase();
    }
}
