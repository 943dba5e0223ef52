package io.fleetprov.model;

import java.time.Duration;
import java.util.List;

public record ExecutionResult(
        int exitStatus,
        List<String> stdoutTail,
        List<String> stderrTail,
        Duration duration
) {
    public ExecutionResult {
        stdoutTail = stdoutTail == null ? List.of() : List.copyOf(stdoutTail);
        stderrTail = stderrTail == null ? List.of() : List.copyOf(stderrTail);
        duration = duration == null ? Duration.ZERO : duration;
    }

    public boolean succeeded() {
        return exitStatus == 0;
    }

    /**
     * First non-blank stderr line, or the last stdout line when stderr is empty.
     */
    public String errorPreview() {
        for (String line : stderrTail) {
            if (line != null && !line.isBlank()) {
                return line.strip();
            }
        }
        for (int i = stdoutTail.size() - 1; i >= 0; i--) {
            String line = stdoutTail.get(i);
            if (line != null && !line.isBlank()) {
                return line.strip();
            }
        }
        return "";
    }
}
