package io.cadence4j.config;

import io.cadence4j.TaskRegistration;
import io.cadence4j.TaskScheduler;
import io.cadence4j.core.TaskOptions;
import io.cadence4j.retry.RetryOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

import java.util.List;

/**
 * Bridges scheduler start/stop with the Spring container lifecycle.
 * {@link TaskRegistration} beans are scheduled once, on first start; registrations without
 * retry options get {@code defaultRetry} when it allows more than one attempt.
 */
public class CadenceLifecycle implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(CadenceLifecycle.class);

    private final TaskScheduler scheduler;
    private final List<TaskRegistration> registrations;
    private final RetryOptions defaultRetry;
    private volatile boolean registered = false;
    private volatile boolean running = false;

    public CadenceLifecycle(TaskScheduler scheduler, List<TaskRegistration> registrations, RetryOptions defaultRetry) {
        this.scheduler = scheduler;
        this.registrations = registrations == null ? List.of() : List.copyOf(registrations);
        this.defaultRetry = defaultRetry;
    }

    @Override
    public void start() {
        if (!registered) {
            for (TaskRegistration registration : registrations) {
                scheduler.schedule(registration.name(), registration.schedule(), registration.work(),
                        optionsFor(registration));
            }
            registered = true;
            log.info("Registered {} task bean(s)", registrations.size());
        }
        scheduler.start();
        running = true;
    }

    private TaskOptions optionsFor(TaskRegistration registration) {
        TaskOptions options = registration.options() == null ? TaskOptions.defaults() : registration.options();
        if (options.retry() != null || defaultRetry == null || defaultRetry.maxAttempts() <= 1) {
            return options;
        }
        return new TaskOptions(defaultRetry, options.rateLimitClass(), options.rateLimitKey());
    }

    @Override
    public void stop() {
        scheduler.stop();
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }
}
