package io.fleetcron.internal;

import io.fleetcron.Schedule;
import io.fleetcron.config.SchedulerProperties;
import io.fleetcron.core.ConfigException;
import io.fleetcron.core.JobContext;
import io.fleetcron.core.JobResult;
import io.fleetcron.core.JobSpec;
import io.fleetcron.core.JobState;
import io.fleetcron.core.RunningJobRecord;
import io.fleetcron.core.ScheduleResult;
import io.fleetcron.core.ScheduledJob;
import io.fleetcron.core.SemaphoreSpec;
import io.fleetcron.core.SkipReason;
import io.fleetcron.internal.coordination.ConcurrencyCoordinator;
import io.fleetcron.internal.registry.ScheduleRegistry;
import io.fleetcron.internal.tracking.RunningJobTracker;
import io.fleetcron.spi.ActionInvoker;
import io.fleetcron.spi.EventSink;
import io.fleetcron.spi.ScheduleSource;
import io.fleetcron.utils.Evaluation;
import io.fleetcron.utils.Jids;
import io.fleetcron.utils.TriggerEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The scheduler: one control loop that evaluates every job each tock, admits due jobs
 * and hands them to a worker pool.
 *
 * <p>Typical usage:
 * <pre>{@code
 * schedule.start();
 * schedule.add(JobSpec.builder("highstate").function("state.apply").minutes(60).splay(30).build());
 * schedule.stop();
 * }</pre>
 *
 * <p>Only the loop thread evaluates scheduled occurrences; workers report completions through a
 * queue the loop drains at the start of every tick. Admission is serialized, so an explicit
 * {@link #runJob(String, boolean)} and a due occurrence never both pass the maxrunning check.
 * A run stays tracked, and keeps its semaphore slot, until its worker thread has left the job
 * function, even after the job has been reported as timed out.
 */
public class DefaultSchedule implements Schedule {
    private static final Logger log = LoggerFactory.getLogger(DefaultSchedule.class);

    private final SchedulerProperties props;
    private final ScheduleRegistry registry;
    private final RunningJobTracker tracker;
    private final ConcurrencyCoordinator coordinator;
    private final ActionInvoker invoker;
    private final EventSink eventSink;
    private final Clock clock;
    private final ScheduleSource startupSource;
    private final TriggerEvaluator evaluator;
    private final Jids jids;
    private final String nodeId;
    private final long pid = ProcessHandle.current().pid();

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final ConcurrentLinkedQueue<Completion> completions = new ConcurrentLinkedQueue<>();
    private final ReentrantLock admission = new ReentrantLock();

    private ExecutorService workerPool;
    private Thread loopThread;
    private int systemErrorCount = 0;

    /**
     * @param publish the result still has to be reported
     * @param ended   the worker thread has left the job function
     */
    private record Completion(Launch launch, boolean publish, boolean ended,
                              Object value, Throwable error, Instant finishedAt) {
    }

    public DefaultSchedule(SchedulerProperties props,
                           ScheduleRegistry registry,
                           RunningJobTracker tracker,
                           ConcurrencyCoordinator coordinator,
                           ActionInvoker invoker,
                           EventSink eventSink,
                           Clock clock,
                           Random random,
                           ScheduleSource startupSource) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.tracker = Objects.requireNonNull(tracker, "tracker must not be null");
        this.coordinator = Objects.requireNonNull(coordinator, "coordinator must not be null");
        this.invoker = Objects.requireNonNull(invoker, "invoker must not be null");
        this.eventSink = Objects.requireNonNull(eventSink, "eventSink must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.startupSource = startupSource;

        Duration tock = Objects.requireNonNull(props.getTock(), "fleetcron.tock must not be null");
        if (tock.isZero() || tock.isNegative()) {
            throw new IllegalArgumentException("fleetcron.tock must be a positive duration");
        }
        this.evaluator = new TriggerEvaluator(tock, random == null ? new Random() : random);
        this.jids = new Jids(clock);
        this.nodeId = tracker.nodeId();
    }

    public DefaultSchedule(SchedulerProperties props,
                           ScheduleRegistry registry,
                           RunningJobTracker tracker,
                           ConcurrencyCoordinator coordinator,
                           ActionInvoker invoker,
                           EventSink eventSink,
                           Clock clock) {
        this(props, registry, tracker, coordinator, invoker, eventSink, clock, new Random(), null);
    }

    /**
     * Load the registry and start the control loop. Idempotent.
     */
    @Override
    public void start() {
        if (!bootstrap()) {
            return;
        }
        if (loopThread == null) {
            loopThread = new Thread(this::loop);
            loopThread.setName("fleetcron.loop");
            loopThread.setDaemon(true);
            loopThread.start();
        }
        log.info("Schedule started successfully.");
    }

    /**
     * Everything {@link #start()} does except starting the loop thread.
     *
     * @return false when already started
     */
    boolean bootstrap() {
        if (!started.compareAndSet(false, true)) {
            return false;
        }
        Duration jobTimeout = Objects.requireNonNull(props.getJobTimeout(), "fleetcron.jobTimeout must not be null");
        if (jobTimeout.isZero() || jobTimeout.isNegative()) {
            throw new IllegalArgumentException("fleetcron.jobTimeout must be a positive duration");
        }
        if (props.getWorkerPoolSize() < 1) {
            throw new IllegalArgumentException("fleetcron.workerPoolSize must be >= 1");
        }

        log.info("Schedule starting with tock={}, nodeId={}, workerPoolSize={}, jobTimeout={}",
                props.getTock(), nodeId, props.getWorkerPoolSize(), props.getJobTimeout());

        registry.load();
        if (startupSource != null) {
            ScheduleResult reloaded = reload(startupSource, false);
            if (reloaded.isFailure()) {
                log.error("Startup schedule source rejected msg={}", reloaded.comment());
            }
        }

        if (workerPool == null) {
            workerPool = Executors.newFixedThreadPool(props.getWorkerPoolSize(), r -> {
                Thread t = new Thread(r);
                t.setName("fleetcron.workerPool");
                t.setDaemon(true);
                return t;
            });
        }
        return true;
    }

    /**
     * Stop evaluating, wait for running jobs up to the shutdown timeout, release all leases and
     * persist the registry. Idempotent.
     */
    @Override
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }

        log.info("Schedule stopping...");

        if (loopThread != null) {
            loopThread.interrupt();
            loopThread = null;
        }

        if (workerPool != null) {
            workerPool.shutdown();
            try {
                if (!workerPool.awaitTermination(props.getShutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                    int abandoned = abandon(workerPool.shutdownNow());
                    log.warn("Jobs still running after shutdownTimeout={}, abandoning them queued={}",
                            props.getShutdownTimeout(), abandoned);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                abandon(workerPool.shutdownNow());
            } finally {
                workerPool = null;
            }
        }

        reapCompletions();
        coordinator.releaseAll();
        registry.save();
        log.info("Schedule stopped successfully.");
    }

    @Override
    public boolean isRunning() {
        return started.get();
    }

    @Override
    public ScheduleResult add(JobSpec spec, boolean test) {
        return registry.add(spec, test);
    }

    @Override
    public ScheduleResult modify(JobSpec spec, boolean test) {
        return registry.modify(spec, test);
    }

    @Override
    public ScheduleResult delete(String name, boolean test) {
        return registry.delete(name, test);
    }

    @Override
    public ScheduleResult enable(String name, boolean test) {
        return registry.enable(name, test);
    }

    @Override
    public ScheduleResult disable(String name, boolean test) {
        return registry.disable(name, test);
    }

    @Override
    public ScheduleResult purge(boolean test) {
        return registry.deleteByPrefix("", test);
    }

    @Override
    public ScheduleResult reload(ScheduleSource source, boolean test) {
        Objects.requireNonNull(source, "source must not be null");
        Map<String, JobSpec> specs;
        try {
            specs = source.load();
        } catch (ConfigException ex) {
            log.warn("Schedule reload rejected msg={}", ex.getMessage());
            return ScheduleResult.failed(ex.getMessage());
        }
        return registry.reload(specs, test);
    }

    @Override
    public Map<String, ScheduledJob> list(boolean showDisabled) {
        return registry.list(showDisabled);
    }

    @Override
    public Optional<ScheduledJob> get(String name) {
        return registry.get(name);
    }

    @Override
    public ScheduleResult runJob(String name, boolean force) {
        Optional<ScheduledJob> job = registry.get(name);
        if (job.isEmpty()) {
            return ScheduleResult.failed("Job " + name + " does not exist.");
        }
        JobSpec spec = job.get().spec();
        if (!spec.enabled() && !force) {
            return ScheduleResult.failed("Job " + name + " is disabled.");
        }
        if (!started.get()) {
            return ScheduleResult.failed("Schedule is not running.");
        }
        Instant now = clock.instant();
        SkipReason denied = admitAndLaunch(spec, now, null, null, peerDeadline());
        if (denied != null) {
            return ScheduleResult.failed("Job " + name + " was not run: " + denied.value());
        }
        return ScheduleResult.applied("Scheduling Job " + name + " for immediate execution.", Map.of(name, "run"));
    }

    @Override
    public ScheduleResult postponeJob(String name, Instant currentTime, Instant newTime, boolean test) {
        return registry.postpone(name, currentTime, newTime, test);
    }

    @Override
    public ScheduleResult skipJob(String name, Instant time, boolean test) {
        return registry.skip(name, time, test);
    }

    @Override
    public Optional<Instant> nextFireTime(String name) {
        return registry.get(name)
                .filter(job -> job.spec().enabled())
                .map(job -> evaluator.evaluate(job.spec(), job.state(), clock.instant()).nextEligible());
    }

    @Override
    public ScheduleResult enableSchedule(boolean test) {
        return registry.enableSchedule(test);
    }

    @Override
    public ScheduleResult disableSchedule(boolean test) {
        return registry.disableSchedule(test);
    }

    @Override
    public boolean isEnabled(String name) {
        return registry.get(name).map(job -> job.spec().enabled()).orElse(false);
    }

    @Override
    public ScheduleResult save() {
        return registry.save();
    }

    /**
     * Answers a peer's question about what this node runs.
     */
    public RunningJobTracker tracker() {
        return tracker;
    }

    private void loop() {
        while (started.get()) {
            try {
                Thread.sleep(props.getTock().toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }

            if (!started.get()) {
                break;
            }

            try {
                tick();
                systemErrorCount = 0;
            } catch (Exception e) {
                systemErrorCount++;
                log.error("schedule tick failed msg={}", e.getMessage(), e);
                if (systemErrorCount >= 30) {
                    log.error("Schedule stopped due to repeated system failures...");
                    stop();
                    break;
                }

                try {
                    Duration sleep = (systemErrorCount >= 10)
                            ? Duration.ofSeconds(60)
                            : backoff(systemErrorCount);

                    Thread.sleep(sleep.toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }
    }

    // Exponential backoff for repeated tick failures.
    private Duration backoff(int failCount) {
        int exp = Math.max(0, Math.min(failCount, 15));
        long ms = Math.min(1000L * (1L << exp), 60_000L);
        return Duration.ofMillis(ms);
    }

    /**
     * One pass of the control loop at the clock's current time.
     */
    void tick() {
        Instant now = clock.instant();
        long peerDeadline = peerDeadline();
        reapCompletions();
        tracker.reapStale();

        if (!registry.isScheduleEnabled()) {
            log.debug("Schedule disabled, skipping tick at={}", now);
            return;
        }

        for (ScheduledJob job : registry.list(false).values()) {
            if (!started.get()) {
                break;
            }
            try {
                evaluate(job, now, peerDeadline);
            } catch (RuntimeException e) {
                log.error("schedule evaluation failed job={} msg={}", job.name(), e.getMessage(), e);
            }
        }
    }

    private void evaluate(ScheduledJob job, Instant now, long peerDeadline) {
        JobSpec spec = job.spec();
        JobState base = job.state();
        Evaluation evaluation = evaluator.evaluate(spec, base, now);
        if (!evaluation.due()) {
            registry.updateState(spec.name(), base, evaluation.state());
            return;
        }
        if (evaluation.missedBy().compareTo(props.getTock()) > 0) {
            log.debug("Job job={} fired late missedBy={}", spec.name(), evaluation.missedBy());
        }

        SkipReason denied = admitAndLaunch(spec, now, base, evaluation, peerDeadline);
        if (denied == null) {
            return;
        }
        if (evaluation.terminal()) {
            // a one-shot job keeps its single occurrence until it is admitted
            registry.updateState(spec.name(), base, evaluation.state().withSkipReason(denied));
        } else {
            registry.updateState(spec.name(), base, evaluation.state().consumed(now, denied));
        }
    }

    // peer fan-out shares half a tock per tick so a slow peer cannot stall the loop
    private long peerDeadline() {
        return System.nanoTime() + props.getTock().toNanos() / 2;
    }

    /**
     * Applies admission control and launches the job.
     *
     * @param base         the state {@code evaluation} started from, or null for an explicit run
     * @param evaluation   the scheduled occurrence being fired, or null for an explicit run
     * @param peerDeadline {@link System#nanoTime()} after which peers are no longer waited for
     * @return null when launched, otherwise why the job was not run
     */
    private SkipReason admitAndLaunch(JobSpec spec, Instant now, JobState base, Evaluation evaluation, long peerDeadline) {
        admission.lock();
        try {
            return admitAndLaunchLocked(spec, now, base, evaluation, peerDeadline);
        } finally {
            admission.unlock();
        }
    }

    private SkipReason admitAndLaunchLocked(JobSpec spec, Instant now, JobState base, Evaluation evaluation, long peerDeadline) {
        String name = spec.name();
        if (spec.jidInclude()) {
            Duration peerWait = Duration.ofNanos(Math.max(0, peerDeadline - System.nanoTime()));
            int running = tracker.countRunning(name, spec.maxRunningScope(), peerWait);
            if (running >= spec.maxRunning()) {
                log.info("Job job={} is already running count={} maxrunning={}, skipping", name, running, spec.maxRunning());
                return SkipReason.MAXRUNNING;
            }
        }

        String jid = jids.next();
        String leaseIdentifier = null;
        SemaphoreSpec semaphore = spec.semaphore();
        if (semaphore != null) {
            leaseIdentifier = nodeId + ":" + jid;
            if (!coordinator.lock(semaphore.resource(), leaseIdentifier, semaphore.maxConcurrent(), false, Duration.ZERO)) {
                log.info("Job job={} could not take semaphore resource={} max={}, skipping",
                        name, semaphore.resource(), semaphore.maxConcurrent());
                return SkipReason.SEMAPHORE;
            }
        }

        RunningJobRecord run = new RunningJobRecord(jid, name, nodeId, pid, now, spec.function(), spec.args());
        if (!launch(spec, run, leaseIdentifier)) {
            if (leaseIdentifier != null) {
                coordinator.unlock(semaphore.resource(), leaseIdentifier);
            }
            return SkipReason.SHUTTING_DOWN;
        }
        if (evaluation != null) {
            registry.recordFire(name, base, evaluation.state(), now, evaluation.terminal());
        }
        return null;
    }

    private boolean launch(JobSpec spec, RunningJobRecord run, String leaseIdentifier) {
        ExecutorService pool = workerPool;
        if (pool == null) {
            return false;
        }
        Launch launch = new Launch(spec, run, leaseIdentifier);
        if (spec.jidInclude()) {
            tracker.recordStart(run, launch.exited);
        }
        try {
            pool.execute(launch);
        } catch (RejectedExecutionException ex) {
            tracker.recordEnd(run.jid());
            log.warn("Worker pool rejected job={} jid={}, schedule is shutting down", spec.name(), run.jid());
            return false;
        }

        launch.exited.copy()
                .orTimeout(props.getJobTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((ignored, error) -> {
                    if (unwrap(error) instanceof TimeoutException) {
                        launch.timeOut();
                    }
                });
        log.info("Launched job={} jid={} function={}", spec.name(), run.jid(), spec.function());
        return true;
    }

    // queued launches dropped by shutdownNow never run; end them so their records and leases go
    private int abandon(List<Runnable> queued) {
        int count = 0;
        for (Runnable r : queued) {
            if (r instanceof Launch) {
                ((Launch) r).exit(null, new CancellationException("Schedule stopped before the job started"));
                count++;
            }
        }
        return count;
    }

    private void reapCompletions() {
        Completion c;
        while ((c = completions.poll()) != null) {
            try {
                finish(c);
            } catch (RuntimeException e) {
                log.error("schedule failed to finish job={} jid={} msg={}", c.launch().run.jobName(), c.launch().run.jid(), e.getMessage(), e);
            }
        }
    }

    private void finish(Completion c) {
        RunningJobRecord run = c.launch().run;
        JobSpec spec = c.launch().spec;
        if (c.ended()) {
            tracker.recordEnd(run.jid());
        }

        if (c.publish()) {
            publish(c, run, spec);
        } else if (c.ended()) {
            log.info("Job left its worker after timing out job={} jid={}", spec.name(), run.jid());
        }

        String leaseIdentifier = c.launch().leaseIdentifier;
        if (c.ended() && leaseIdentifier != null && spec.semaphore() != null) {
            coordinator.unlock(spec.semaphore().resource(), leaseIdentifier);
        }
    }

    private void publish(Completion c, RunningJobRecord run, JobSpec spec) {
        JobResult result;
        if (c.error() == null) {
            result = JobResult.success(run, c.value(), c.finishedAt(), spec.metadata());
            log.debug("Job succeeded job={} jid={} duration={}", spec.name(), run.jid(), result.duration());
        } else {
            Throwable cause = unwrap(c.error());
            String error = describe(cause);
            result = JobResult.failure(run, error, c.finishedAt(), spec.metadata());
            log.error("Job failed job={} jid={} msg={}", spec.name(), run.jid(), error, cause);
        }

        if (spec.returnJob()) {
            try {
                eventSink.publish(result);
            } catch (RuntimeException e) {
                log.error("Event sink failed job={} jid={} msg={}", spec.name(), run.jid(), e.getMessage(), e);
            }
        }
    }

    private String describe(Throwable cause) {
        if (cause instanceof TimeoutException) {
            return "Job timed out after " + props.getJobTimeout();
        }
        String msg = cause.getMessage();
        return cause.getClass().getSimpleName() + (msg == null ? "" : ": " + msg);
    }

    private static Throwable unwrap(Throwable t) {
        Throwable cur = t;
        while ((cur instanceof CompletionException || cur instanceof ExecutionException) && cur.getCause() != null) {
            cur = cur.getCause();
        }
        return cur;
    }

    /**
     * One execution of a job function on the worker pool.
     */
    private final class Launch implements Runnable {
        private final JobSpec spec;
        private final RunningJobRecord run;
        private final String leaseIdentifier;
        private final JobContext context;
        // completes once the worker thread has left the job function
        private final CompletableFuture<Void> exited = new CompletableFuture<>();
        private final AtomicBoolean reported = new AtomicBoolean(false);
        private Thread worker;

        private Launch(JobSpec spec, RunningJobRecord run, String leaseIdentifier) {
            this.spec = spec;
            this.run = run;
            this.leaseIdentifier = leaseIdentifier;
            this.context = new JobContext(spec.name(), run.jid(), nodeId, run.startedAt(), spec.metadata());
        }

        @Override
        public void run() {
            synchronized (this) {
                worker = Thread.currentThread();
            }
            Object value = null;
            Throwable error = null;
            try {
                if (!reported.get()) {
                    log.debug("Job started job={} jid={} function={}", spec.name(), run.jid(), spec.function());
                    value = invoker.invoke(spec.function(), spec.args(), spec.kwargs(), context);
                }
            } catch (Throwable t) {
                error = t;
            } finally {
                synchronized (this) {
                    worker = null;
                }
                exit(value, error);
            }
        }

        /**
         * Reports the timeout and interrupts the worker. The run keeps its tracking record and
         * semaphore slot until the worker actually returns.
         */
        private void timeOut() {
            if (!reported.compareAndSet(false, true)) {
                return;
            }
            completions.add(new Completion(this, true, false, null, new TimeoutException(), clock.instant()));
            synchronized (this) {
                if (worker != null) {
                    worker.interrupt();
                }
            }
        }

        private void exit(Object value, Throwable error) {
            boolean publish = reported.compareAndSet(false, true);
            completions.add(new Completion(this, publish, true, value, error, clock.instant()));
            exited.complete(null);
        }
    }
}
