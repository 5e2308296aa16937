package io.cadence4j.internal;

import io.cadence4j.TaskScheduler;
import io.cadence4j.TaskWork;
import io.cadence4j.config.SchedulerProperties;
import io.cadence4j.core.CancellationSource;
import io.cadence4j.core.CancellationToken;
import io.cadence4j.core.ScheduledTask;
import io.cadence4j.core.TaskExecutionException;
import io.cadence4j.core.TaskOptions;
import io.cadence4j.core.TaskResult;
import io.cadence4j.cron.CronEngine;
import io.cadence4j.cron.CronSchedule;
import io.cadence4j.ratelimit.RateLimitResult;
import io.cadence4j.ratelimit.RateLimiterRegistry;
import io.cadence4j.retry.DefaultRetryExecutor;
import io.cadence4j.retry.RetryExecutor;
import io.cadence4j.retry.RetryOptions;
import io.cadence4j.time.TimeSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-memory cron scheduler &amp; runner.
 *
 * <p>Core behavior:
 * <ul>
 *   <li>One dispatcher thread polls every {@code pollInterval} and hands due tasks to a worker pool,
 *       so a slow task never delays another</li>
 *   <li>A task never overlaps itself: {@code nextRun} advances when a run starts, and a firing that
 *       comes due while that run is still going is skipped, not queued</li>
 *   <li>After every run the next fire time is computed from the current time, so a scheduler that
 *       fell behind fires once and moves on instead of replaying missed firings</li>
 *   <li>Runs can go through the retry executor and be gated by a rate limiter (see {@link TaskOptions})</li>
 * </ul>
 *
 * <p>Task records are owned by the scheduler; callers only ever see {@link ScheduledTask} copies.
 * Instances are independent, several can run side by side.
 */
public class DefaultTaskScheduler implements TaskScheduler {
    private static final Logger log = LoggerFactory.getLogger(DefaultTaskScheduler.class);

    private final SchedulerProperties props;
    private final TimeSource timeSource;
    private final CronEngine cronEngine;
    private final RetryExecutor retryExecutor;
    private final RateLimiterRegistry rateLimiters;

    private final ConcurrentHashMap<String, TaskEntry> tasks = new ConcurrentHashMap<>();
    private final AtomicLong registrationSeq = new AtomicLong();

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final Object lifecycleLock = new Object();
    private final AtomicReference<Throwable> fatalError = new AtomicReference<>();

    private final AtomicInteger inFlight = new AtomicInteger();
    private final Object idleMonitor = new Object();

    private volatile CancellationSource cancellation = new CancellationSource();
    private volatile ExecutorService workerPool;
    private Thread dispatcherThread;

    public DefaultTaskScheduler(SchedulerProperties props, TimeSource timeSource) {
        this(props, timeSource, new CronEngine(timeSource), new DefaultRetryExecutor(timeSource),
                RateLimiterRegistry.empty(timeSource));
    }

    public DefaultTaskScheduler(SchedulerProperties props,
                                TimeSource timeSource,
                                CronEngine cronEngine,
                                RetryExecutor retryExecutor,
                                RateLimiterRegistry rateLimiters) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.timeSource = Objects.requireNonNull(timeSource, "timeSource must not be null");
        this.cronEngine = Objects.requireNonNull(cronEngine, "cronEngine must not be null");
        this.retryExecutor = Objects.requireNonNull(retryExecutor, "retryExecutor must not be null");
        this.rateLimiters = Objects.requireNonNull(rateLimiters, "rateLimiters must not be null");
    }

    @Override
    public String schedule(String name, String schedule, TaskWork work) {
        return schedule(name, schedule, work, TaskOptions.defaults());
    }

    @Override
    public String schedule(String name, String schedule, TaskWork work, TaskOptions options) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(work, "work must not be null");
        TaskOptions opts = options == null ? TaskOptions.defaults() : options;

        CronSchedule cron = cronEngine.parse(schedule);
        if (opts.isRateLimited()) {
            rateLimiters.getRequired(opts.rateLimitClass());
        }

        String id = UUID.randomUUID().toString();
        Instant nextRun = cronEngine.next(cron, currentInstant());
        TaskEntry entry = new TaskEntry(id, name, cron, work, opts, registrationSeq.incrementAndGet(), nextRun);
        tasks.put(id, entry);

        log.info("Task scheduled name={} id={} schedule={} nextRun={}", name, id, cron.expression(), nextRun);
        return id;
    }

    @Override
    public boolean unschedule(String taskId) {
        if (taskId == null) {
            return false;
        }
        TaskEntry entry = tasks.remove(taskId);
        if (entry == null) {
            return false;
        }
        synchronized (entry) {
            entry.removed = true;
        }
        log.info("Task unscheduled name={} id={}", entry.name, taskId);
        return true;
    }

    @Override
    public boolean enable(String taskId) {
        TaskEntry entry = taskId == null ? null : tasks.get(taskId);
        if (entry == null) {
            return false;
        }
        synchronized (entry) {
            if (!entry.enabled) {
                entry.enabled = true;
                entry.nextRun = cronEngine.next(entry.schedule, currentInstant());
                log.info("Task enabled name={} id={} nextRun={}", entry.name, taskId, entry.nextRun);
            }
        }
        return true;
    }

    @Override
    public boolean disable(String taskId) {
        TaskEntry entry = taskId == null ? null : tasks.get(taskId);
        if (entry == null) {
            return false;
        }
        synchronized (entry) {
            if (entry.enabled) {
                entry.enabled = false;
                log.info("Task disabled name={} id={}", entry.name, taskId);
            }
        }
        return true;
    }

    /**
     * Start dispatching due tasks. Idempotent.
     */
    @Override
    public void start() {
        synchronized (lifecycleLock) {
            if (started.get()) {
                return;
            }

            Duration interval = Objects.requireNonNull(props.getPollInterval(), "scheduler.pollInterval must not be null");
            if (interval.isZero() || interval.isNegative()) {
                throw new IllegalArgumentException("scheduler.pollInterval must be a positive duration");
            }
            Duration grace = Objects.requireNonNull(props.getShutdownGracePeriod(), "scheduler.shutdownGracePeriod must not be null");
            if (grace.isNegative()) {
                throw new IllegalArgumentException("scheduler.shutdownGracePeriod must not be negative");
            }
            if (props.getMaxConcurrency() <= 0) {
                throw new IllegalArgumentException("scheduler.maxConcurrency must be positive");
            }

            log.info("Scheduler starting with pollInterval={}, shutdownGracePeriod={}, maxConcurrency={}, timezone={}, tasks={}",
                    interval, grace, props.getMaxConcurrency(), timeSource.getTimezone(), tasks.size());

            fatalError.set(null);
            cancellation = new CancellationSource();

            String prefix = props.getWorkerNamePrefix() == null ? "cadence.worker-" : props.getWorkerNamePrefix();
            AtomicInteger workerSeq = new AtomicInteger(1);
            workerPool = Executors.newFixedThreadPool(props.getMaxConcurrency(), r -> {
                Thread t = new Thread(r);
                t.setName(prefix + workerSeq.getAndIncrement());
                t.setDaemon(true);
                return t;
            });

            started.set(true);

            dispatcherThread = new Thread(this::dispatchLoop);
            dispatcherThread.setName("cadence.dispatcher");
            dispatcherThread.setDaemon(true);
            dispatcherThread.start();

            log.info("Scheduler started successfully.");
        }
    }

    /**
     * Stop dispatching. Idempotent.
     *
     * <p>Pending retry waits are cancelled at once; running work gets {@code shutdownGracePeriod}
     * to finish before worker threads are interrupted.
     */
    @Override
    public void stop() {
        synchronized (lifecycleLock) {
            if (!started.compareAndSet(true, false)) {
                return;
            }

            log.info("Scheduler stopping...");
            Duration grace = props.getShutdownGracePeriod();

            cancellation.cancel();

            Thread dispatcher = dispatcherThread;
            dispatcherThread = null;
            // A fatal dispatch failure stops the scheduler from the dispatcher itself; interrupting
            // it there would cut the worker grace period short.
            if (dispatcher != null && dispatcher != Thread.currentThread()) {
                dispatcher.interrupt();
                try {
                    dispatcher.join(Math.max(1L, grace.toMillis()));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }

            ExecutorService pool = workerPool;
            workerPool = null;
            if (pool != null) {
                pool.shutdown();
                try {
                    if (!pool.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                        log.warn("Running tasks did not finish within {}; interrupting workers", grace);
                        pool.shutdownNow();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    pool.shutdownNow();
                }
            }
            log.info("Scheduler stopped successfully.");
        }
    }

    @Override
    public boolean isRunning() {
        return started.get();
    }

    @Override
    public List<ScheduledTask> getTasks() {
        return tasks.values().stream()
                .sorted(Comparator.comparingLong(e -> e.seq))
                .map(TaskEntry::snapshot)
                .toList();
    }

    @Override
    public Optional<ScheduledTask> getTask(String taskId) {
        TaskEntry entry = taskId == null ? null : tasks.get(taskId);
        return Optional.ofNullable(entry).map(TaskEntry::snapshot);
    }

    @Override
    public List<TaskResult> getResults(String taskId) {
        TaskEntry entry = taskId == null ? null : tasks.get(taskId);
        if (entry == null) {
            return List.of();
        }
        synchronized (entry) {
            return List.copyOf(entry.results);
        }
    }

    @Override
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (idleMonitor) {
            while (inFlight.get() > 0) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    return false;
                }
                TimeUnit.NANOSECONDS.timedWait(idleMonitor, remaining);
            }
            return true;
        }
    }

    /**
     * One dispatch pass: launch every enabled task whose next run is due. The dispatcher thread
     * calls this every {@code pollInterval}; callers driving a {@code ManualTimeSource} may call it
     * directly. Does nothing while stopped.
     *
     * @return number of runs launched
     */
    public int dispatchDue() {
        ExecutorService pool = workerPool;
        if (!started.get() || pool == null) {
            return 0;
        }
        Instant now = currentInstant();
        CancellationToken token = cancellation.token();

        int launched = 0;
        List<TaskEntry> entries = tasks.values().stream()
                .sorted(Comparator.comparingLong(e -> e.seq))
                .toList();
        for (TaskEntry entry : entries) {
            if (launch(entry, now, pool, token)) {
                launched++;
            }
        }
        if (launched > 0) {
            log.debug("Scheduler dispatched tasks count={} at={}", launched, now);
        }
        return launched;
    }

    private void dispatchLoop() {
        while (started.get()) {
            try {
                Thread.sleep(props.getPollInterval().toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (!started.get()) {
                break;
            }

            try {
                dispatchDue();
            } catch (RuntimeException e) {
                fatalError.compareAndSet(null, e);
            }

            Throwable fatal = fatalError.get();
            if (fatal != null) {
                log.error("Scheduler stopped due to dispatch failure msg={}", fatal.getMessage(), fatal);
                if (started.get()) {
                    stop();
                }
                break;
            }
        }
    }

    private boolean launch(TaskEntry entry, Instant now, ExecutorService pool, CancellationToken token) {
        synchronized (entry) {
            if (entry.removed || !entry.enabled || entry.nextRun.isAfter(now)) {
                return false;
            }
            if (entry.running) {
                log.warn("Task still running; skipping firing name={} id={} due={}", entry.name, entry.id, entry.nextRun);
                entry.nextRun = cronEngine.next(entry.schedule, now);
                return false;
            }
            if (!admit(entry)) {
                entry.nextRun = cronEngine.next(entry.schedule, now);
                return false;
            }
            entry.running = true;
            entry.lastRun = now;
            entry.nextRun = cronEngine.next(entry.schedule, now);
            inFlight.incrementAndGet();
        }

        try {
            pool.execute(() -> runTask(entry, now, token));
            return true;
        } catch (RejectedExecutionException e) {
            log.warn("Scheduler is shutting down; task not started name={} id={}", entry.name, entry.id);
            synchronized (entry) {
                entry.running = false;
            }
            taskFinished();
            return false;
        }
    }

    private boolean admit(TaskEntry entry) {
        TaskOptions options = entry.options;
        if (!options.isRateLimited()) {
            return true;
        }
        String key = options.rateLimitKey() != null ? options.rateLimitKey() : entry.name;
        RateLimitResult result = rateLimiters.getRequired(options.rateLimitClass()).isAllowed(key);
        if (!result.allowed()) {
            log.warn("Rate limit reached; skipping firing name={} id={} keyClass={} key={} retryAfterMs={}",
                    entry.name, entry.id, options.rateLimitClass(), key, result.retryAfter().toMillis());
        }
        return result.allowed();
    }

    private void runTask(TaskEntry entry, Instant startedAt, CancellationToken token) {
        long startMs = startedAt.toEpochMilli();
        boolean success = false;
        Throwable failure = null;
        try {
            startMs = timeSource.now();
            log.debug("Task started name={} id={} at={}", entry.name, entry.id, startedAt);
            invoke(entry, token);
            success = true;
            log.debug("Task succeeded name={} id={}", entry.name, entry.id);
        } catch (Exception e) {
            failure = e;
            log.error("Task failed name={} id={} msg={}", entry.name, entry.id, e.getMessage(), e);
        } finally {
            try {
                complete(entry, startedAt, startMs, success, failure);
            } catch (RuntimeException e) {
                log.error("Task bookkeeping failed name={} id={} msg={}", entry.name, entry.id, e.getMessage(), e);
                fatalError.compareAndSet(null, e);
            } finally {
                taskFinished();
            }
        }
    }

    private void invoke(TaskEntry entry, CancellationToken token) throws Exception {
        RetryOptions retry = entry.options.retry();
        if (retry == null) {
            entry.work.run(token);
            return;
        }
        retryExecutor.execute(() -> {
            entry.work.run(token);
            return null;
        }, retry, token);
    }

    private void complete(TaskEntry entry, Instant startedAt, long startMs, boolean success, Throwable failure) {
        RuntimeException bookkeepingFailure = null;
        long finishedMs = startMs;
        try {
            finishedMs = timeSource.now();
        } catch (RuntimeException e) {
            bookkeepingFailure = e;
        }
        Duration duration = Duration.ofMillis(Math.max(0L, finishedMs - startMs));
        TaskResult result = success
                ? TaskResult.succeeded(startedAt, duration)
                : TaskResult.failed(startedAt, duration, new TaskExecutionException(entry.id, entry.name, failure));

        synchronized (entry) {
            entry.running = false;
            entry.runCount++;
            if (!success) {
                entry.errorCount++;
            }
            entry.record(result, props.getResultHistorySize());
            if (!entry.removed) {
                try {
                    entry.nextRun = cronEngine.next(entry.schedule, Instant.ofEpochMilli(finishedMs));
                } catch (RuntimeException e) {
                    if (bookkeepingFailure == null) {
                        bookkeepingFailure = e;
                    }
                }
            }
        }
        if (bookkeepingFailure != null) {
            throw bookkeepingFailure;
        }
    }

    private void taskFinished() {
        if (inFlight.decrementAndGet() == 0) {
            synchronized (idleMonitor) {
                idleMonitor.notifyAll();
            }
        }
    }

    private Instant currentInstant() {
        return Instant.ofEpochMilli(timeSource.now());
    }

    /**
     * Scheduler-owned task state. Mutable fields are guarded by the entry's monitor.
     */
    private static final class TaskEntry {
        private final String id;
        private final String name;
        private final CronSchedule schedule;
        private final TaskWork work;
        private final TaskOptions options;
        private final long seq;

        private boolean enabled = true;
        private boolean removed;
        private boolean running;
        private Instant lastRun;
        private Instant nextRun;
        private long runCount;
        private long errorCount;
        private final ArrayDeque<TaskResult> results = new ArrayDeque<>();

        private TaskEntry(String id, String name, CronSchedule schedule, TaskWork work, TaskOptions options,
                          long seq, Instant nextRun) {
            this.id = id;
            this.name = name;
            this.schedule = schedule;
            this.work = work;
            this.options = options;
            this.seq = seq;
            this.nextRun = nextRun;
        }

        private void record(TaskResult result, int limit) {
            if (limit <= 0) {
                return;
            }
            results.addLast(result);
            while (results.size() > limit) {
                results.removeFirst();
            }
        }

        private synchronized ScheduledTask snapshot() {
            return new ScheduledTask(id, name, schedule.expression(), enabled, lastRun, nextRun, runCount, errorCount);
        }
    }
}
