package io.fleetprov.cli;

import io.fleetprov.model.ExecutionErrorKind;
import io.fleetprov.model.RunSummary;
import io.fleetprov.report.RunSummaries;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Assumptions;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

final class FleetProvCommandTest {
    private static final String INVENTORY = """
            {
              "defaults": {"relay": "jump@bastion.example.edu", "user": "labadmin", "password": "s3cret"},
              "targets": [
                {"name": "lab-1", "host": "10.10.1.5", "metadata": {"network_id": "1"}},
                {"name": "lab-2", "host": "10.10.2.5", "metadata": {"network_id": "2"}}
              ]
            }
            """;

    @Test
    void targetsListingMasksPasswordsAndRendersCommands() throws Exception {
        Path root = Files.createTempDirectory("fleetprov-cli-targets-");
        try {
            Path inventory = Files.writeString(root.resolve("targets.json"), INVENTORY, StandardCharsets.UTF_8);
            Harness harness = new Harness();

            int code = harness.execute("targets", "-i", inventory.toString(), "-c", "./provision.sh -n {meta.network_id}");

            Assertions.assertEquals(FleetProvCommand.EXIT_OK, code, harness.err());
            String out = harness.out();
            Assertions.assertFalse(out.contains("s3cret"), out);
            Assertions.assertTrue(out.contains("\"password\" : \"***\""), out);
            Assertions.assertTrue(out.contains("./provision.sh -n 2"), out);
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void invalidInventoryExitsWithConfigurationError() throws Exception {
        Path root = Files.createTempDirectory("fleetprov-cli-dup-");
        try {
            Path inventory = Files.writeString(root.resolve("targets.json"), """
                    [
                      {"name": "lab-1", "host": "10.10.1.5", "relay": "bastion", "user": "lab", "password": "pw"},
                      {"name": "lab-1", "host": "10.10.1.6", "relay": "bastion", "user": "lab", "password": "pw"}
                    ]
                    """, StandardCharsets.UTF_8);
            Harness harness = new Harness();

            int code = harness.execute("--log-dir", root.resolve("logs").toString(),
                    "run", "-i", inventory.toString(), "-c", "provision {name}");

            Assertions.assertEquals(FleetProvCommand.EXIT_CONFIG_ERROR, code);
            Assertions.assertTrue(harness.err().contains("duplicate target name"), harness.err());
            Assertions.assertFalse(Files.exists(root.resolve("logs")), "no run may start on an invalid inventory");

            Harness noCommand = new Harness();
            Path valid = Files.writeString(root.resolve("valid.json"), INVENTORY, StandardCharsets.UTF_8);
            Assertions.assertEquals(FleetProvCommand.EXIT_CONFIG_ERROR,
                    noCommand.execute("--log-dir", root.resolve("logs").toString(), "run", "-i", valid.toString()));
            Assertions.assertTrue(noCommand.err().contains("command template is required"), noCommand.err());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void runReportsFailuresAndRerunCoversOnlyFailedTargets() throws Exception {
        Assumptions.assumeTrue(FileSystems.getDefault().supportedFileAttributeViews().contains("posix"));
        Assumptions.assumeTrue(Files.isExecutable(Paths.get("/bin/sh")));
        Path root = Files.createTempDirectory("fleetprov-cli-run-");
        try {
            Path inventory = Files.writeString(root.resolve("targets.json"), INVENTORY, StandardCharsets.UTF_8);
            Path logs = root.resolve("logs");
            Path flaky = script(root, "sshpass-flaky", """
                    for arg in "$@"; do last="$arg"; done
                    case "$last" in *lab-2*) echo "provision.sh: network 2 busy" >&2; exit 3;; esac
                    echo "provisioned: $last"
                    """);
            Path healthy = script(root, "sshpass-ok", "echo ok\n");

            Harness first = new Harness();
            int code = first.execute("--log-dir", logs.toString(), "run",
                    "-i", inventory.toString(),
                    "-c", "./provision.sh -n {meta.network_id} {name}",
                    "--sshpass-binary", flaky.toString(),
                    "--retries", "1",
                    "--retry-delay-ms", "0",
                    "--stagger-ms", "0");

            Assertions.assertEquals(FleetProvCommand.EXIT_TARGETS_FAILED, code, first.err());
            Assertions.assertTrue(first.out().contains("Failed targets:"), first.out());
            Assertions.assertFalse(first.out().contains("s3cret"), first.out());
            Path summaryFile = onlySummary(logs);
            RunSummary summary = RunSummaries.read(summaryFile);
            Assertions.assertEquals(List.of("lab-2"), summary.failedTargets());
            Assertions.assertEquals(Map.of(ExecutionErrorKind.NON_ZERO_EXIT, 1), summary.failuresByKind());
            Assertions.assertEquals(2, summary.outcomes().get(1).attempts());

            Harness failed = new Harness();
            Assertions.assertEquals(FleetProvCommand.EXIT_OK, failed.execute("failed", "-s", summaryFile.toString()));
            Assertions.assertEquals("lab-2", failed.out().strip());

            Harness rerun = new Harness();
            int rerunCode = rerun.execute("--log-dir", root.resolve("rerun").toString(), "run",
                    "-i", inventory.toString(),
                    "-c", "./provision.sh -n {meta.network_id} {name}",
                    "--sshpass-binary", healthy.toString(),
                    "--only-failed-from", summaryFile.toString(),
                    "--stagger-ms", "0",
                    "--json");

            Assertions.assertEquals(FleetProvCommand.EXIT_OK, rerunCode, rerun.err());
            RunSummary second = RunSummaries.read(onlySummary(root.resolve("rerun")));
            Assertions.assertEquals(1, second.total());
            Assertions.assertEquals("lab-2", second.outcomes().get(0).name());
            Assertions.assertTrue(rerun.out().contains("\"succeeded\" : 1"), rerun.out());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void exitCodeReflectsOutcome() {
        Assertions.assertEquals(FleetProvCommand.EXIT_OK, FleetProvCommand.exitCode(summary(2, 2, 0, false)));
        Assertions.assertEquals(FleetProvCommand.EXIT_TARGETS_FAILED, FleetProvCommand.exitCode(summary(2, 1, 1, false)));
        Assertions.assertEquals(FleetProvCommand.EXIT_INTERRUPTED, FleetProvCommand.exitCode(summary(2, 1, 1, true)));
    }

    private static RunSummary summary(int total, int succeeded, int failed, boolean interrupted) {
        Instant now = Instant.now();
        return new RunSummary("run_test", now, now, 0L, total, succeeded, failed, total, 0, 1, interrupted, 0,
                Map.of(), List.of(), List.of());
    }

    private static Path onlySummary(Path logs) throws IOException {
        try (Stream<Path> files = Files.list(logs)) {
            List<Path> summaries = files
                    .filter(p -> p.getFileName().toString().startsWith("summary_"))
                    .toList();
            Assertions.assertEquals(1, summaries.size(), summaries.toString());
            return summaries.get(0);
        }
    }

    private static Path script(Path dir, String name, String body) throws IOException {
        Path file = dir.resolve(name);
        Files.writeString(file, "#!/bin/sh\n" + body, StandardCharsets.UTF_8);
        Files.setPosixFilePermissions(file, PosixFilePermissions.fromString("rwx------"));
        return file;
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }

    private static final class Harness {
        private final ByteArrayOutputStream out = new ByteArrayOutputStream();
        private final ByteArrayOutputStream err = new ByteArrayOutputStream();

        int execute(String... args) {
            FleetProvCommand command = new FleetProvCommand();
            command.out = new PrintStream(out, true, StandardCharsets.UTF_8);
            command.err = new PrintStream(err, true, StandardCharsets.UTF_8);
            return new CommandLine(command).execute(args);
        }

        String out() {
            return out.toString(StandardCharsets.UTF_8);
        }

        String err() {
            return err.toString(StandardCharsets.UTF_8);
        }
    }
}
