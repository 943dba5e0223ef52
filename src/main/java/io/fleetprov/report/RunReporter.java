package io.fleetprov.report;

import io.fleetprov.config.FleetProvConfig;
import io.fleetprov.model.ExecutionErrorKind;
import io.fleetprov.model.JobStatus;
import io.fleetprov.model.ProgressEvent;
import io.fleetprov.model.RunSummary;
import io.fleetprov.model.Target;
import io.fleetprov.model.TargetOutcome;
import io.fleetprov.util.Jsons;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Per-target logs, the combined run log, console progress and the run summary.
 *
 * <p>Workers only enqueue events. A single aggregation thread assigns each event
 * a run-wide sequence number, writes it to the target log and the combined log,
 * prints the progress line and folds it into the summary accumulator, so no
 * summary state is shared between workers.
 */
public final class RunReporter {
    private static final ProgressEvent STOP = new ProgressEvent(
            "", 0, JobStatus.PENDING, 0, 0, 0L, null, null, null, Instant.EPOCH);
    private static final int PREVIEW_CHARS = 200;

    private final FleetProvConfig layout;
    private final PrintStream console;
    private final PrintStream errors;
    private final BlockingQueue<ProgressEvent> queue;
    private final Map<String, TargetLog> logs;
    private final Map<String, Outcome> outcomes;
    private final AtomicInteger aggregationErrors;
    private volatile Path combinedLog;
    private volatile Path summaryFile;
    private Thread aggregator;
    private long sequence;

    public RunReporter(FleetProvConfig layout, PrintStream console, PrintStream errors) {
        this.layout = layout;
        this.console = console;
        this.errors = errors;
        this.queue = new LinkedBlockingQueue<>();
        this.logs = new LinkedHashMap<>();
        this.outcomes = new LinkedHashMap<>();
        this.aggregationErrors = new AtomicInteger(0);
    }

    /**
     * Creates the target's log file. Must be called for every target before {@link #runStarted}.
     */
    public synchronized TargetLog register(Target target, int index) {
        if (aggregator != null) {
            throw new IllegalStateException("targets must be registered before the run starts");
        }
        if (logs.containsKey(target.name())) {
            throw new IllegalArgumentException("target registered twice: " + target.name());
        }
        reserveCombinedLog();
        Path file;
        try {
            file = layout.reserveTargetLog(target.name());
        } catch (IOException e) {
            file = layout.targetLogFallback(target.name());
            aggregationError("create target log " + file, e);
        }
        TargetLog log = new TargetLog(target.name(), file, this::aggregationError);
        logs.put(target.name(), log);
        outcomes.put(target.name(), new Outcome(target.name(), index, file));
        return log;
    }

    public synchronized void runStarted(int concurrency, int maxAttempts) {
        if (aggregator != null) {
            throw new IllegalStateException("run already started");
        }
        reserveCombinedLog();
        String header = Instant.now() + " RUN START run_id=" + layout.runId()
                + " targets=" + logs.size()
                + " concurrency=" + concurrency
                + " max_attempts=" + maxAttempts;
        appendCombined(header);
        console.println("=".repeat(80));
        console.println("Starting run " + layout.runId() + ": " + logs.size() + " targets, "
                + concurrency + " parallel, up to " + maxAttempts + " attempts each");
        console.println("Logs directory: " + layout.logDir());
        console.println("=".repeat(80));
        aggregator = new Thread(this::drain, "fleetprov-reporter");
        aggregator.setDaemon(true);
        aggregator.start();
    }

    /**
     * Claims {@code run_<ts>.log} before any target log, so a target named
     * {@code run} can never take the combined log's name.
     */
    private void reserveCombinedLog() {
        if (combinedLog != null) {
            return;
        }
        try {
            combinedLog = layout.reserveCombinedLog();
        } catch (IOException e) {
            combinedLog = layout.logDir().resolve(layout.runId() + ".log");
            aggregationError("create combined log " + combinedLog, e);
        }
    }

    public void onEvent(ProgressEvent event) {
        if (aggregator == null) {
            throw new IllegalStateException("run not started");
        }
        queue.add(event);
    }

    /**
     * Drains pending events and builds the summary. Call once, after every job is terminal.
     *
     * @throws IllegalStateException if a registered target never reached a terminal status
     */
    public RunSummary finalizeRun(int peakRunning, boolean interrupted) {
        Thread thread;
        synchronized (this) {
            thread = aggregator;
        }
        if (thread == null) {
            throw new IllegalStateException("run not started");
        }
        queue.add(STOP);
        try {
            thread.join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted while draining progress events", e);
        }

        Instant finishedAt = Instant.now();
        List<TargetOutcome> finalOutcomes = new ArrayList<>(outcomes.size());
        List<String> failedTargets = new ArrayList<>();
        List<String> unfinished = new ArrayList<>();
        Map<ExecutionErrorKind, Integer> failuresByKind = new EnumMap<>(ExecutionErrorKind.class);
        int succeeded = 0;
        int failed = 0;
        int totalAttempts = 0;
        int retried = 0;
        for (Outcome outcome : outcomes.values()) {
            if (!outcome.status.isTerminal()) {
                unfinished.add(outcome.name);
            }
            if (outcome.status == JobStatus.SUCCEEDED) {
                succeeded++;
            } else if (outcome.status == JobStatus.FAILED) {
                failed++;
                failedTargets.add(outcome.name);
                if (outcome.lastErrorKind != null) {
                    failuresByKind.merge(outcome.lastErrorKind, 1, Integer::sum);
                }
            }
            totalAttempts += outcome.attempts;
            if (outcome.attempts > 1) {
                retried++;
            }
            finalOutcomes.add(outcome.toTargetOutcome());
        }
        if (!unfinished.isEmpty()) {
            throw new IllegalStateException("targets without a terminal status: " + String.join(", ", unfinished));
        }

        RunSummary summary = new RunSummary(
                layout.runId(),
                layout.startedAt(),
                finishedAt,
                Duration.between(layout.startedAt(), finishedAt).toMillis(),
                outcomes.size(),
                succeeded,
                failed,
                totalAttempts,
                retried,
                peakRunning,
                interrupted,
                aggregationErrors.get(),
                failuresByKind,
                finalOutcomes,
                failedTargets
        );
        if (summary.succeeded() + summary.failed() != summary.total()) {
            throw new IllegalStateException("summary counts do not add up: " + summary.succeeded()
                    + " + " + summary.failed() + " != " + summary.total());
        }

        appendCombined(finishedAt + " RUN END run_id=" + summary.runId()
                + " total=" + summary.total()
                + " succeeded=" + summary.succeeded()
                + " failed=" + summary.failed()
                + " duration_ms=" + summary.durationMs()
                + (interrupted ? " interrupted=true" : ""));
        appendCombined(SummaryPrinter.render(summary));
        writeSummaryFile(summary);
        return summary;
    }

    public Path combinedLogFile() {
        return combinedLog;
    }

    /**
     * Where the JSON summary was written, or {@code null} if writing it failed.
     */
    public Path summaryFile() {
        return summaryFile;
    }

    public int aggregationErrors() {
        return aggregationErrors.get();
    }

    private void drain() {
        while (true) {
            ProgressEvent event;
            try {
                event = queue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                errors.println("fleetprov: reporter interrupted, " + queue.size() + " progress events dropped");
                return;
            }
            if (event == STOP) {
                return;
            }
            apply(event);
        }
    }

    private void apply(ProgressEvent event) {
        sequence++;
        String line = eventLine(sequence, event);
        TargetLog log = logs.get(event.target());
        if (log != null) {
            log.append(event.error() == null ? line : line + " message=\"" + oneLine(event.error()) + "\"");
        }
        appendCombined(line);
        console.println(progressLine(event));
        Outcome outcome = outcomes.get(event.target());
        if (outcome != null) {
            outcome.apply(event);
        }
    }

    static String eventLine(long seq, ProgressEvent event) {
        StringBuilder sb = new StringBuilder();
        sb.append(event.at()).append(" EVENT seq=").append(seq)
                .append(" target=").append(event.target())
                .append(" status=").append(event.status())
                .append(" attempt=").append(event.attempt()).append('/').append(event.maxAttempts())
                .append(" elapsed_ms=").append(event.elapsedMs());
        if (event.errorKind() != null) {
            sb.append(" error=").append(event.errorKind());
        }
        return sb.toString();
    }

    static String progressLine(ProgressEvent event) {
        String prefix = String.format("[%3d] %s", event.index(), event.target());
        long seconds = event.elapsedMs() / 1000L;
        switch (event.status()) {
            case RUNNING:
                return prefix + " started attempt " + event.attempt() + "/" + event.maxAttempts();
            case SUCCEEDED:
                return prefix + " SUCCEEDED after " + event.attempt() + " attempt(s), " + seconds + "s";
            case AWAITING_RETRY:
                return prefix + " attempt " + event.attempt() + "/" + event.maxAttempts() + " failed ("
                        + event.errorKind() + "), retry scheduled: " + oneLine(event.error());
            case FAILED:
                return prefix + " FAILED after " + event.attempt() + " attempt(s), " + seconds + "s ("
                        + event.errorKind() + "): " + oneLine(event.error());
            default:
                return prefix + " " + event.status();
        }
    }

    private void appendCombined(String line) {
        Path file = combinedLog;
        if (file == null) {
            return;
        }
        try {
            Files.writeString(file, line + System.lineSeparator(), StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            aggregationError("combined log " + file, e);
        }
    }

    private void writeSummaryFile(RunSummary summary) {
        try {
            Path file = layout.reserveSummaryFile();
            Jsons.write(file, summary);
            summaryFile = file;
        } catch (IOException e) {
            aggregationError("summary file", e);
        }
    }

    private void aggregationError(String what, IOException e) {
        aggregationErrors.incrementAndGet();
        errors.println("fleetprov: failed to write " + what + ": " + e.getMessage());
    }

    private static String oneLine(String raw) {
        if (raw == null) {
            return "";
        }
        String normalized = raw.replace("\r", " ").replace("\n", " ").replace("\"", "'").trim();
        return normalized.length() <= PREVIEW_CHARS ? normalized : normalized.substring(0, PREVIEW_CHARS) + "...";
    }

    /**
     * Accumulated state of one target, touched only by the aggregation thread.
     */
    private static final class Outcome {
        private final String name;
        private final int index;
        private final Path logFile;
        private JobStatus status = JobStatus.PENDING;
        private int attempts;
        private long durationMs;
        private ExecutionErrorKind lastErrorKind;
        private String lastError;
        private String errorPreview;

        private Outcome(String name, int index, Path logFile) {
            this.name = name;
            this.index = index;
            this.logFile = logFile;
        }

        private void apply(ProgressEvent event) {
            if (status.isTerminal() && !event.terminal()) {
                return;
            }
            status = event.status();
            attempts = Math.max(attempts, event.attempt());
            durationMs = event.elapsedMs();
            if (event.errorKind() != null) {
                lastErrorKind = event.errorKind();
                lastError = event.error();
                errorPreview = event.errorPreview() == null ? null : oneLine(event.errorPreview());
            }
        }

        private TargetOutcome toTargetOutcome() {
            return new TargetOutcome(
                    name,
                    status,
                    attempts,
                    durationMs,
                    status == JobStatus.SUCCEEDED ? null : lastErrorKind,
                    status == JobStatus.SUCCEEDED ? null : lastError,
                    status == JobStatus.SUCCEEDED ? null : errorPreview,
                    logFile.toString()
            );
        }

        @Override
        public String toString() {
            return "[" + index + "] " + name + " " + status;
        }
    }
}
