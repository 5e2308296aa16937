package io.cadence4j;

import io.cadence4j.core.TaskOptions;

/**
 * Declarative task definition, picked up by containers (e.g. the Spring Boot starter)
 * and passed to {@link TaskScheduler#schedule(String, String, TaskWork, TaskOptions)}.
 */
public interface TaskRegistration {

    String name();

    /**
     * Cron expression, 5 or 6 fields.
     */
    String schedule();

    TaskWork work();

    default TaskOptions options() {
        return TaskOptions.defaults();
    }
}
