package io.fleetprov.report;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.function.BiConsumer;

/**
 * Append-only log of one target for one run.
 *
 * <p>Written from two sides: the reporter's aggregation thread appends event
 * lines and the executor's stream pumps append raw output. Appends are
 * serialized on this object and each one goes straight to disk.
 */
public final class TargetLog {
    public static final String OUTPUT_STDOUT = "out";
    public static final String OUTPUT_STDERR = "err";

    private final String targetName;
    private final Path file;
    private final BiConsumer<String, IOException> errorSink;

    TargetLog(String targetName, Path file, BiConsumer<String, IOException> errorSink) {
        this.targetName = targetName;
        this.file = file;
        this.errorSink = errorSink;
    }

    /**
     * Log that reports write failures to {@code errorSink} instead of a reporter.
     */
    public static TargetLog standalone(String targetName, Path file, BiConsumer<String, IOException> errorSink) {
        return new TargetLog(targetName, file, errorSink);
    }

    public String targetName() {
        return targetName;
    }

    public Path file() {
        return file;
    }

    public void appendOutput(String stream, String line) {
        append(stream + "| " + line);
    }

    public void appendNote(String text) {
        append(Instant.now() + " " + text);
    }

    public void appendSeparator() {
        append("=".repeat(80));
    }

    synchronized void append(String line) {
        try {
            Files.writeString(file, line + System.lineSeparator(), StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            errorSink.accept("target log " + file, e);
        }
    }
}
