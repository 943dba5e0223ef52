package io.fleetprov.report;

import io.fleetprov.model.RunSummary;
import io.fleetprov.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * Reads summaries written by earlier runs, for re-run selection.
 */
public final class RunSummaries {
    private RunSummaries() {
    }

    public static RunSummary read(Path file) throws IOException {
        if (file == null || !Files.isRegularFile(file)) {
            throw new NoSuchFileException(String.valueOf(file));
        }
        RunSummary summary = Jsons.mapper().readValue(file.toFile(), RunSummary.class);
        if (summary == null || summary.runId() == null) {
            throw new IOException("not a run summary: " + file);
        }
        return summary;
    }
}
