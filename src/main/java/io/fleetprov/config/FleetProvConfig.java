package io.fleetprov.config;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Defaults and the on-disk layout of one run's log directory.
 */
public final class FleetProvConfig {
    public static final String DEFAULT_LOG_DIR = "logs";
    public static final int DEFAULT_CONCURRENCY = 10;
    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final Duration DEFAULT_RETRY_DELAY = Duration.ofSeconds(10);
    public static final Duration DEFAULT_RETRY_DELAY_MAX = Duration.ofMinutes(5);
    public static final Duration DEFAULT_ATTEMPT_TIMEOUT = Duration.ofHours(2);
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(15);
    public static final Duration DEFAULT_STAGGER = Duration.ofMillis(100);
    public static final int DEFAULT_TAIL_LINES = 20;

    private static final DateTimeFormatter RUN_TIMESTAMP = DateTimeFormatter
            .ofPattern("yyyyMMdd_HHmmss")
            .withZone(ZoneOffset.UTC);

    private final Path logDir;
    private final Instant startedAt;
    private final String runTimestamp;

    public FleetProvConfig(Path logDir, Instant startedAt) {
        this.logDir = logDir;
        this.startedAt = startedAt;
        this.runTimestamp = RUN_TIMESTAMP.format(startedAt);
    }

    public static FleetProvConfig forRun(String logDir) {
        return forRun(logDir, Instant.now());
    }

    public static FleetProvConfig forRun(String logDir, Instant startedAt) {
        Path resolved = logDir == null || logDir.isBlank()
                ? Paths.get(DEFAULT_LOG_DIR)
                : Paths.get(logDir);
        return new FleetProvConfig(resolved.toAbsolutePath().normalize(), startedAt);
    }

    public Path logDir() {
        return logDir;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public String runTimestamp() {
        return runTimestamp;
    }

    public String runId() {
        return "run_" + runTimestamp;
    }

    public Path reserveTargetLog(String targetName) throws IOException {
        return reserve(sanitizeFileStem(targetName) + "_" + runTimestamp, ".log");
    }

    /**
     * Target log path used when the reserved file could not be created.
     */
    public Path targetLogFallback(String targetName) {
        return logDir.resolve(sanitizeFileStem(targetName) + "_" + runTimestamp + ".log");
    }

    public Path reserveCombinedLog() throws IOException {
        return reserve(runId(), ".log");
    }

    public Path reserveSummaryFile() throws IOException {
        return reserve("summary_" + runTimestamp, ".json");
    }

    /**
     * Creates {@code stem + suffix} in the log directory, or {@code stem_2 + suffix},
     * {@code stem_3 + suffix}... when an earlier run in the same second already owns the name.
     */
    Path reserve(String stem, String suffix) throws IOException {
        Files.createDirectories(logDir);
        for (int n = 1; ; n++) {
            Path candidate = logDir.resolve(n == 1 ? stem + suffix : stem + "_" + n + suffix);
            try {
                return Files.createFile(candidate);
            } catch (FileAlreadyExistsException ignored) {
                // Taken by an earlier run; try the next suffix.
            }
        }
    }

    static String sanitizeFileStem(String raw) {
        if (raw == null || raw.isBlank()) {
            return "target";
        }
        String trimmed = raw.trim();
        StringBuilder sb = new StringBuilder(trimmed.length());
        for (int i = 0; i < trimmed.length(); i++) {
            char ch = trimmed.charAt(i);
            boolean ok = (ch >= 'a' && ch <= 'z')
                    || (ch >= 'A' && ch <= 'Z')
                    || (ch >= '0' && ch <= '9')
                    || ch == '_' || ch == '-' || ch == '.';
            sb.append(ok ? ch : '-');
        }
        String value = sb.toString();
        while (value.contains("--")) {
            value = value.replace("--", "-");
        }
        if (value.startsWith(".")) {
            value = "t" + value;
        }
        return value;
    }
}
