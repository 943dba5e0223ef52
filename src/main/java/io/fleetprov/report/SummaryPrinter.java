package io.fleetprov.report;

import io.fleetprov.model.ExecutionErrorKind;
import io.fleetprov.model.RunSummary;
import io.fleetprov.model.TargetOutcome;

import java.util.Map;

/**
 * Human-readable breakdown of a {@link RunSummary}.
 */
public final class SummaryPrinter {
    private static final String RULE = "=".repeat(80);

    private SummaryPrinter() {
    }

    public static String render(RunSummary summary) {
        StringBuilder sb = new StringBuilder();
        String nl = System.lineSeparator();
        long seconds = summary.durationMs() / 1000L;
        sb.append(RULE).append(nl);
        sb.append("Run summary ").append(summary.runId())
                .append(summary.interrupted() ? " (interrupted)" : "").append(nl);
        sb.append(RULE).append(nl);
        sb.append(String.format("Total targets:       %d%n", summary.total()));
        sb.append(String.format("Succeeded:           %d%n", summary.succeeded()));
        sb.append(String.format("Failed:              %d%n", summary.failed()));
        for (Map.Entry<ExecutionErrorKind, Integer> entry : summary.failuresByKind().entrySet()) {
            sb.append(String.format("  %-18s %d%n", entry.getKey() + ":", entry.getValue()));
        }
        sb.append(String.format("Total attempts:      %d%n", summary.totalAttempts()));
        sb.append(String.format("Retried targets:     %d%n", summary.retriedTargets()));
        sb.append(String.format("Peak parallel:       %d%n", summary.peakRunning()));
        sb.append(String.format("Duration:            %ds (%.1f minutes)%n", seconds, seconds / 60.0));
        if (summary.aggregationErrors() > 0) {
            sb.append(String.format("Log write errors:    %d%n", summary.aggregationErrors()));
        }
        sb.append(RULE).append(nl);
        if (summary.succeeded() > 0) {
            sb.append("Succeeded targets:").append(nl);
            for (TargetOutcome outcome : summary.outcomes()) {
                if (!outcome.failed()) {
                    sb.append(String.format("  %s - %ds - %d attempt(s)%n",
                            outcome.name(), outcome.durationMs() / 1000L, outcome.attempts()));
                }
            }
        }
        if (summary.failed() > 0) {
            sb.append("Failed targets:").append(nl);
            for (TargetOutcome outcome : summary.outcomes()) {
                if (!outcome.failed()) {
                    continue;
                }
                sb.append(String.format("  %s - %s - %ds - %d attempt(s)%n",
                        outcome.name(), outcome.lastErrorKind(), outcome.durationMs() / 1000L, outcome.attempts()));
                if (outcome.lastError() != null && !outcome.lastError().isBlank()) {
                    sb.append("      Last error: ").append(outcome.lastError()).append(nl);
                }
                if (outcome.errorPreview() != null && !outcome.errorPreview().isBlank()) {
                    sb.append("      Error preview: ").append(outcome.errorPreview()).append(nl);
                }
                sb.append("      Log file: ").append(outcome.logFile()).append(nl);
            }
            sb.append("Re-run only these with: --only-failed-from <summary file>").append(nl);
        }
        return sb.toString();
    }
}
