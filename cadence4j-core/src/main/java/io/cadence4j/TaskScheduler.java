package io.cadence4j;

import io.cadence4j.core.ScheduledTask;
import io.cadence4j.core.TaskOptions;
import io.cadence4j.core.TaskResult;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Main scheduler API.
 *
 * <p>A scheduler starts stopped. Tasks can be registered and removed in either state but only
 * fire while running. It can be restarted after {@link #stop()}.
 *
 * <p>Typical usage:
 * <pre>{@code
 * String id = scheduler.schedule("sync-balances", "@hourly", token -> exchange.syncBalances());
 * scheduler.start();
 * ...
 * scheduler.stop();
 * }</pre>
 */
public interface TaskScheduler {

    /**
     * Register a task that fires on {@code schedule}.
     *
     * @return generated task id
     * @throws io.cadence4j.cron.ScheduleParseException if {@code schedule} is not a valid cron expression
     */
    String schedule(String name, String schedule, TaskWork work);

    /**
     * Register a task whose runs go through retry and/or rate limit admission.
     */
    String schedule(String name, String schedule, TaskWork work, TaskOptions options);

    /**
     * Remove a task. A run already in progress finishes; no further run starts.
     *
     * @return true if the task existed
     */
    boolean unschedule(String taskId);

    /**
     * Resume firing a disabled task; its next run is computed from now.
     *
     * @return true if the task exists
     */
    boolean enable(String taskId);

    /**
     * Stop firing a task while keeping it registered.
     *
     * @return true if the task exists
     */
    boolean disable(String taskId);

    void start();

    /**
     * Stop dispatching, cancel pending retry waits and wait (bounded) for running tasks.
     */
    void stop();

    boolean isRunning();

    /**
     * Snapshots of every task in registration order.
     */
    List<ScheduledTask> getTasks();

    Optional<ScheduledTask> getTask(String taskId);

    /**
     * Most recent run results of a task, oldest first; empty for unknown ids.
     */
    List<TaskResult> getResults(String taskId);

    /**
     * Wait until no task is running.
     *
     * @return true if idle, false if the timeout elapsed first
     */
    boolean awaitIdle(Duration timeout) throws InterruptedException;
}
