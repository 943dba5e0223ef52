package io.fleetprov.scheduler;

import io.fleetprov.config.RunSettings;
import io.fleetprov.exec.CommandTemplate;
import io.fleetprov.exec.ExecutionException;
import io.fleetprov.exec.RemoteExecutor;
import io.fleetprov.model.ExecutionErrorKind;
import io.fleetprov.model.ExecutionResult;
import io.fleetprov.model.Job;
import io.fleetprov.model.ProgressEvent;
import io.fleetprov.model.RunSummary;
import io.fleetprov.model.Target;
import io.fleetprov.report.RunReporter;
import io.fleetprov.report.TargetLog;
import io.fleetprov.retry.RetryDecision;
import io.fleetprov.retry.RetryPolicy;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

/**
 * Drives every target through {@code PENDING -> RUNNING -> SUCCEEDED | AWAITING_RETRY | FAILED}.
 *
 * <p>Attempts run on a fixed pool of {@code concurrency} worker threads. A job
 * waiting for its retry delay is parked on a separate timer and does not hold a
 * worker; when the delay elapses it is queued for the pool again. Failures of
 * one target never affect another, and nothing thrown by an attempt escapes
 * {@link #run}: every outcome ends up in the {@link RunSummary}.
 *
 * <p>A scheduler runs once.
 */
public final class JobScheduler {
    private static final Duration ABORT_DRAIN = Duration.ofSeconds(30);
    private static final String ABORT_REASON = "run aborted before the target could complete";

    private final RunSettings settings;
    private final CommandTemplate template;
    private final RemoteExecutor executor;
    private final RetryPolicy retryPolicy;
    private final RunReporter reporter;
    private final AtomicBoolean started;
    private final AtomicBoolean aborted;
    private final AtomicInteger running;
    private final AtomicInteger peakRunning;
    private final Map<String, TargetLog> logs;
    private volatile List<Job> jobs;
    private volatile CountDownLatch remaining;
    private volatile ThreadPoolExecutor workers;
    private volatile ScheduledExecutorService timer;

    public JobScheduler(
            RunSettings settings,
            CommandTemplate template,
            RemoteExecutor executor,
            RetryPolicy retryPolicy,
            RunReporter reporter
    ) {
        this.settings = settings;
        this.template = template;
        this.executor = executor;
        this.retryPolicy = retryPolicy;
        this.reporter = reporter;
        this.started = new AtomicBoolean(false);
        this.aborted = new AtomicBoolean(false);
        this.running = new AtomicInteger(0);
        this.peakRunning = new AtomicInteger(0);
        this.logs = new ConcurrentHashMap<>();
        this.jobs = List.of();
    }

    /**
     * Runs every target to a terminal status and returns the summary.
     *
     * <p>If the calling thread is interrupted the run is aborted as if
     * {@link #abort()} had been called; the summary is still produced.
     */
    public RunSummary run(List<Target> targets) {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("scheduler already ran");
        }
        List<Job> created = new ArrayList<>(targets.size());
        int index = 0;
        for (Target target : targets) {
            index++;
            TargetLog log = reporter.register(target, index);
            logs.put(target.name(), log);
            created.add(new Job(target, index, log.file()));
        }
        remaining = new CountDownLatch(created.size());
        workers = new ThreadPoolExecutor(
                settings.concurrency(),
                settings.concurrency(),
                0L,
                TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(),
                namedThreads("fleetprov-worker-", false)
        );
        timer = Executors.newSingleThreadScheduledExecutor(namedThreads("fleetprov-retry-timer-", true));
        reporter.runStarted(settings.concurrency(), retryPolicy.maxAttempts());
        // Visible to abort() only once the latch and the reporter can take events.
        jobs = Collections.unmodifiableList(created);

        long staggerMs = settings.stagger().toMillis();
        for (int i = 0; i < created.size(); i++) {
            Job job = created.get(i);
            if (staggerMs <= 0L || i == 0) {
                dispatch(job);
            } else {
                schedule(job, Duration.ofMillis(staggerMs * i));
            }
        }

        if (aborted.get()) {
            sweepIdle(Instant.now());
        }

        boolean callerInterrupted = false;
        try {
            remaining.await();
        } catch (InterruptedException e) {
            callerInterrupted = true;
            abort();
            awaitDrain();
        } finally {
            workers.shutdownNow();
            timer.shutdownNow();
        }
        RunSummary summary = reporter.finalizeRun(peakRunning.get(), aborted.get());
        if (callerInterrupted) {
            Thread.currentThread().interrupt();
        }
        return summary;
    }

    /**
     * Operator abort. Parked retries are cancelled, pending jobs never start,
     * running attempts are interrupted and end as {@code FAILED/INTERRUPTED}.
     * Safe to call from any thread, any number of times.
     */
    public void abort() {
        if (!aborted.compareAndSet(false, true)) {
            return;
        }
        ScheduledExecutorService t = timer;
        ThreadPoolExecutor w = workers;
        if (t != null) {
            t.shutdownNow();
        }
        if (w != null) {
            w.shutdownNow();
        }
        sweepIdle(Instant.now());
    }

    public boolean aborted() {
        return aborted.get();
    }

    public int runningCount() {
        return running.get();
    }

    public int peakRunning() {
        return peakRunning.get();
    }

    public List<Job> jobs() {
        return jobs;
    }

    private void dispatch(Job job) {
        if (aborted.get()) {
            return;
        }
        try {
            workers.execute(() -> attempt(job));
        } catch (RejectedExecutionException e) {
            // Pool already closed by abort().
            interruptIfIdle(job);
        }
    }

    private void schedule(Job job, Duration delay) {
        try {
            timer.schedule(() -> dispatch(job), delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            interruptIfIdle(job);
        }
    }

    private void attempt(Job job) {
        if (aborted.get()) {
            return;
        }
        if (!transition(job, () -> job.beginAttempt(Instant.now()))) {
            return;
        }
        peakRunning.accumulateAndGet(running.incrementAndGet(), Math::max);
        try {
            if (aborted.get()) {
                throw new ExecutionException(ExecutionErrorKind.INTERRUPTED, "run aborted before the attempt started", null);
            }
            TargetLog log = logs.get(job.name());
            log.appendSeparator();
            log.appendNote("attempt " + job.attempts() + "/" + retryPolicy.maxAttempts() + " on " + job.target().host()
                    + " via " + job.target().relay());
            ExecutionResult result = executor.run(job.target(), template, settings.attemptTimeout(), log);
            if (transition(job, () -> job.markSucceeded(result, Instant.now()))) {
                complete();
            }
        } catch (ExecutionException e) {
            onFailure(job, e.kind(), e.getMessage(), e.partialResult());
        } catch (RuntimeException e) {
            onFailure(job, ExecutionErrorKind.LAUNCH_FAILED, "executor failed: " + e, null);
        } finally {
            running.decrementAndGet();
        }
    }

    private void onFailure(Job job, ExecutionErrorKind kind, String message, ExecutionResult partial) {
        Instant now = Instant.now();
        RetryDecision decision;
        boolean parked = false;
        boolean failed = false;
        synchronized (job) {
            ExecutionErrorKind effective = aborted.get() ? ExecutionErrorKind.INTERRUPTED : kind;
            job.recordFailure(effective, message, partial, now);
            decision = retryPolicy.nextAction(job);
            if (decision.retry()) {
                parked = transition(job, job::markAwaitingRetry);
            } else {
                failed = transition(job, job::markFailed);
            }
        }
        if (parked) {
            schedule(job, decision.delay());
        } else if (failed) {
            complete();
        }
    }

    private void sweepIdle(Instant now) {
        for (Job job : jobs) {
            if (transition(job, () -> job.markInterrupted(ABORT_REASON, now))) {
                complete();
            }
        }
    }

    private void interruptIfIdle(Job job) {
        Instant now = Instant.now();
        if (transition(job, () -> job.markInterrupted(ABORT_REASON, now))) {
            complete();
        }
    }

    /**
     * Applies {@code change} and reports the resulting state under the job's
     * monitor, so each transition yields exactly one event and events of one
     * job reach the reporter in transition order.
     */
    private boolean transition(Job job, BooleanSupplier change) {
        synchronized (job) {
            if (!change.getAsBoolean()) {
                return false;
            }
            reporter.onEvent(ProgressEvent.of(job, retryPolicy.maxAttempts(), Instant.now()));
            return true;
        }
    }

    private void complete() {
        CountDownLatch latch = remaining;
        if (latch != null) {
            latch.countDown();
        }
    }

    private void awaitDrain() {
        try {
            if (!remaining.await(ABORT_DRAIN.toMillis(), TimeUnit.MILLISECONDS)) {
                List<String> stuck = new ArrayList<>();
                for (Job job : jobs) {
                    if (!job.status().isTerminal()) {
                        stuck.add(job.name());
                    }
                }
                throw new IllegalStateException("attempts did not stop within " + ABORT_DRAIN.toSeconds()
                        + "s of abort: " + String.join(", ", stuck));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted again while waiting for aborted attempts", e);
        }
    }

    private static ThreadFactory namedThreads(String prefix, boolean daemon) {
        AtomicInteger counter = new AtomicInteger(0);
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(daemon);
            return thread;
        };
    }
}
