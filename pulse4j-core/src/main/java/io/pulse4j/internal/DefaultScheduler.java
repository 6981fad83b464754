package io.pulse4j.internal;

import io.pulse4j.JobHandler;
import io.pulse4j.JobRunListener;
import io.pulse4j.Scheduler;
import io.pulse4j.core.AlreadyRunningException;
import io.pulse4j.core.DuplicateJobException;
import io.pulse4j.core.JobContext;
import io.pulse4j.core.JobDescriptor;
import io.pulse4j.core.JobOutcome;
import io.pulse4j.core.JobResult;
import io.pulse4j.core.JobRun;
import io.pulse4j.core.JobRunStore;
import io.pulse4j.core.RunTrigger;
import io.pulse4j.core.SchedulerOptions;
import io.pulse4j.core.SchedulerState;
import io.pulse4j.core.UnknownJobException;
import io.pulse4j.utils.CronSchedule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-process cron scheduler.
 *
 * <p>Core capabilities:
 * <ul>
 *   <li>One timer thread arms the next tick of every started job</li>
 *   <li>Job bodies run on a fixed worker pool so a slow job never delays another job's tick</li>
 *   <li>Per-job exclusive flag: a tick arriving while a run is in flight is dropped, never buffered</li>
 *   <li>Failures of a job body are sealed into a {@link JobOutcome#FAILURE} run and never reach the timer</li>
 * </ul>
 *
 * <p>State of a job is guarded by its own slot, so unrelated jobs never contend.
 */
public class DefaultScheduler implements Scheduler {
    private static final Logger log = LoggerFactory.getLogger(DefaultScheduler.class);

    private final SchedulerOptions options;
    private final JobRunStore runStore;
    private final Clock clock;

    private final ConcurrentHashMap<String, JobSlot> slots = new ConcurrentHashMap<>();
    private final List<JobRunListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    private final ScheduledExecutorService timer;
    private final ExecutorService workerPool;

    private static final class JobSlot {
        private final JobDescriptor descriptor;
        private final JobHandler handler;
        private final CronSchedule schedule;
        private final AtomicBoolean inFlight = new AtomicBoolean(false);

        // guarded by this
        private boolean active;
        private long generation;
        private ScheduledFuture<?> pendingTick;

        private volatile Instant nextFireAt;
        private volatile JobRun lastRun;

        private JobSlot(JobDescriptor descriptor, JobHandler handler, CronSchedule schedule) {
            this.descriptor = descriptor;
            this.handler = handler;
            this.schedule = schedule;
        }

        private String name() {
            return descriptor.name();
        }
    }

    public DefaultScheduler(SchedulerOptions options, JobRunStore runStore, Clock clock) {
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.runStore = Objects.requireNonNull(runStore, "runStore must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.timer = Executors.newSingleThreadScheduledExecutor(daemonThreads("pulse4j.timer"));
        this.workerPool = Executors.newFixedThreadPool(options.workerThreads(), daemonThreads("pulse4j.worker"));
    }

    public DefaultScheduler(SchedulerOptions options) {
        this(options, new InMemoryJobRunStore(50), Clock.systemUTC());
    }

    @Override
    public void register(JobDescriptor descriptor, JobHandler handler) {
        Objects.requireNonNull(descriptor, "descriptor must not be null");
        Objects.requireNonNull(handler, "handler must not be null");
        ensureOpen();

        CronSchedule schedule = descriptor.timezone() != null
                ? CronSchedule.parse(descriptor.cron(), descriptor.timezone())
                : CronSchedule.parse(descriptor.cron(), options.defaultZone());
        ZoneId zone = schedule.zone();

        JobSlot slot = new JobSlot(descriptor, handler, schedule);
        if (slots.putIfAbsent(descriptor.name(), slot) != null) {
            throw new DuplicateJobException(descriptor.name());
        }
        log.info("Scheduler job registered name={} cron={} timezone={} enabled={}",
                descriptor.name(), descriptor.cron(), zone, descriptor.enabled());
    }

    @Override
    public boolean start(String name) {
        JobSlot slot = requireSlot(name);
        ensureOpen();

        if (!slot.descriptor.enabled()) {
            log.warn("Scheduler job is disabled; not starting name={}", name);
            return false;
        }

        Instant next;
        synchronized (slot) {
            if (slot.active) {
                log.warn("Scheduler job already running; start ignored name={}", name);
                return false;
            }
            slot.active = true;
            slot.generation++;
            next = armNextTick(slot, null);
        }

        log.info("Scheduler job started name={} schedule={} nextExecution={}", name, slot.schedule, next);
        dispatch(slot, RunTrigger.STARTUP, clock.instant());
        return true;
    }

    @Override
    public void startAll() {
        for (JobSlot slot : slots.values()) {
            if (slot.descriptor.enabled()) {
                boolean alreadyActive;
                synchronized (slot) {
                    alreadyActive = slot.active;
                }
                if (!alreadyActive) {
                    start(slot.name());
                }
            }
        }
    }

    @Override
    public boolean stop(String name) {
        JobSlot slot = requireSlot(name);
        synchronized (slot) {
            if (!slot.active) {
                log.debug("Scheduler job not running; stop ignored name={}", name);
                return false;
            }
            slot.active = false;
            slot.generation++;
            if (slot.pendingTick != null) {
                slot.pendingTick.cancel(false);
                slot.pendingTick = null;
            }
            slot.nextFireAt = null;
        }
        log.info("Scheduler job stopped name={} inFlight={}", name, slot.inFlight.get());
        return true;
    }

    @Override
    public JobRun runNow(String name) {
        JobSlot slot = requireSlot(name);
        if (!slot.inFlight.compareAndSet(false, true)) {
            throw new AlreadyRunningException(name);
        }
        log.info("Scheduler manual run requested name={}", name);
        return runExclusive(slot, RunTrigger.MANUAL, clock.instant());
    }

    @Override
    public SchedulerState status(String name) {
        JobSlot slot = requireSlot(name);
        boolean active;
        Instant next;
        synchronized (slot) {
            active = slot.active;
            next = slot.nextFireAt;
        }
        return new SchedulerState(name, active, slot.inFlight.get(), active ? next : null, slot.lastRun);
    }

    @Override
    public Set<String> jobNames() {
        return Collections.unmodifiableSet(new TreeSet<>(slots.keySet()));
    }

    @Override
    public List<JobRun> history(String name, int limit) {
        requireSlot(name);
        return runStore.recent(name, limit);
    }

    @Override
    public void addListener(JobRunListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    @Override
    public void shutdown() {
        if (!shutdown.compareAndSet(false, true)) {
            return;
        }

        log.info("Scheduler stopping...");
        for (JobSlot slot : slots.values()) {
            stop(slot.name());
        }
        timer.shutdownNow();

        workerPool.shutdown();
        try {
            if (!workerPool.awaitTermination(options.shutdownGracePeriod().toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Scheduler worker pool did not drain within {}; interrupting", options.shutdownGracePeriod());
                workerPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workerPool.shutdownNow();
        }
        log.info("Scheduler stopped successfully.");
    }

    /**
     * Utility: current scheduler time source (useful for tests).
     */
    protected Instant nowInstant() {
        return clock.instant();
    }

    // Must hold the slot lock.
    private Instant armNextTick(JobSlot slot, Instant previousFireAt) {
        Instant now = nowInstant();
        Instant base = laterOf(previousFireAt, now);
        Instant fireAt = slot.schedule.nextFireAfter(base);
        long generation = slot.generation;
        long delayMs = Math.max(0L, Duration.between(now, fireAt).toMillis());

        slot.nextFireAt = fireAt;
        slot.pendingTick = timer.schedule(() -> onTick(slot, generation, fireAt), delayMs, TimeUnit.MILLISECONDS);
        return fireAt;
    }

    private void onTick(JobSlot slot, long generation, Instant fireAt) {
        try {
            synchronized (slot) {
                if (!slot.active || slot.generation != generation) {
                    return;
                }
                armNextTick(slot, fireAt);
            }
            dispatch(slot, RunTrigger.SCHEDULED, fireAt);
        } catch (RuntimeException e) {
            log.error("Scheduler tick handling failed name={} fireAt={} msg={}", slot.name(), fireAt, e.getMessage(), e);
        }
    }

    private void dispatch(JobSlot slot, RunTrigger trigger, Instant fireAt) {
        if (!slot.inFlight.compareAndSet(false, true)) {
            log.info("Scheduler tick dropped; previous run still in flight name={} trigger={} fireAt={}",
                    slot.name(), trigger, fireAt);
            return;
        }
        try {
            workerPool.execute(() -> runExclusive(slot, trigger, fireAt));
        } catch (RejectedExecutionException e) {
            slot.inFlight.set(false);
            log.warn("Scheduler worker pool rejected run name={} trigger={} msg={}", slot.name(), trigger, e.getMessage());
        }
    }

    // Caller must have acquired slot.inFlight.
    private JobRun runExclusive(JobSlot slot, RunTrigger trigger, Instant fireAt) {
        JobRun run;
        try {
            run = invokeHandler(slot, trigger, fireAt);
            slot.lastRun = run;
        } finally {
            slot.inFlight.set(false);
        }
        record(run);
        return run;
    }

    private JobRun invokeHandler(JobSlot slot, RunTrigger trigger, Instant fireAt) {
        String name = slot.name();
        Instant startedAt = nowInstant();
        JobContext context = new JobContext(name, trigger, fireAt, startedAt);
        log.debug("Scheduler job started name={} trigger={} at={}", name, trigger, startedAt);

        JobOutcome outcome;
        String detail;
        try {
            if (!slot.handler.shouldRun(context)) {
                outcome = JobOutcome.SKIPPED;
                detail = "nothing to do";
            } else {
                JobResult result = slot.handler.execute(context);
                if (result == null) {
                    result = JobResult.success();
                }
                outcome = result.outcome();
                detail = result.detail();
            }
        } catch (Throwable e) {
            // Errors from a job body are sealed like any other failure
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            outcome = JobOutcome.FAILURE;
            detail = describe(e);
            log.error("Scheduler job failed name={} trigger={} msg={}", name, trigger, e.getMessage(), e);
        }

        Instant finishedAt = nowInstant();
        JobRun run = new JobRun(name, trigger, startedAt, finishedAt, outcome, detail);
        if (outcome.isFailure()) {
            log.warn("Scheduler job finished name={} trigger={} outcome={} durationMs={} cause={}",
                    name, trigger, outcome, run.duration().toMillis(), detail);
        } else {
            log.info("Scheduler job finished name={} trigger={} outcome={} durationMs={}",
                    name, trigger, outcome, run.duration().toMillis());
        }
        return run;
    }

    private void record(JobRun run) {
        try {
            runStore.append(run);
        } catch (RuntimeException e) {
            log.error("Scheduler run history append failed name={} msg={}", run.jobName(), e.getMessage(), e);
        }
        for (JobRunListener listener : listeners) {
            try {
                listener.onRunCompleted(run);
            } catch (RuntimeException e) {
                log.warn("Scheduler run listener failed name={} listener={} msg={}",
                        run.jobName(), listener.getClass().getName(), e.getMessage(), e);
            }
        }
    }

    private JobSlot requireSlot(String name) {
        Objects.requireNonNull(name, "name must not be null");
        JobSlot slot = slots.get(name);
        if (slot == null) {
            throw new UnknownJobException(name);
        }
        return slot;
    }

    private void ensureOpen() {
        if (shutdown.get()) {
            throw new IllegalStateException("Scheduler has been shut down");
        }
    }

    private static String describe(Throwable e) {
        String message = e.getMessage();
        return message == null || message.isBlank()
                ? e.getClass().getSimpleName()
                : e.getClass().getSimpleName() + ": " + message;
    }

    private static Instant laterOf(Instant a, Instant b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.isAfter(b) ? a : b;
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r);
            t.setName(prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
