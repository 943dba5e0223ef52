package io.fleetprov.exec;

import io.fleetprov.model.Credential;
import io.fleetprov.model.ExecutionErrorKind;
import io.fleetprov.model.ExecutionResult;
import io.fleetprov.model.Target;
import io.fleetprov.report.TargetLog;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Assumptions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

final class SshRemoteExecutorTest {

    @Test
    void passwordLoginGoesThroughSshpassWithoutPasswordOnCommandLine() {
        SshRemoteExecutor executor = new SshRemoteExecutor(new SshOptions("ssh", "sshpass", Duration.ofSeconds(15), 20));
        Target target = new Target("lab-1", "10.10.1.5", "bastion.example.edu", 0,
                Credential.password("labadmin", "s3cret"), Map.of());

        List<String> argv = executor.buildCommand(target, "./provision.sh -n 1");

        Assertions.assertEquals("sshpass", argv.get(0));
        Assertions.assertEquals("-e", argv.get(1));
        Assertions.assertEquals("ssh", argv.get(2));
        Assertions.assertTrue(argv.contains("ConnectTimeout=15"));
        Assertions.assertTrue(argv.contains("PubkeyAuthentication=no"));
        Assertions.assertFalse(argv.contains("BatchMode=yes"));
        int jump = argv.indexOf("-J");
        Assertions.assertEquals("labadmin@bastion.example.edu", argv.get(jump + 1));
        Assertions.assertEquals("labadmin@10.10.1.5", argv.get(argv.size() - 2));
        Assertions.assertEquals("./provision.sh -n 1", argv.get(argv.size() - 1));
        for (String token : argv) {
            Assertions.assertFalse(token.contains("s3cret"), token);
        }
    }

    @Test
    void identityFileLoginUsesBatchModeAndKeepsRelayUser() {
        SshRemoteExecutor executor = new SshRemoteExecutor(null);
        Target target = new Target("lab-2", "10.10.2.5", "jump@bastion.example.edu:2200", 2222,
                Credential.identityFile("labadmin", Paths.get("/keys/lab")), Map.of());

        List<String> argv = executor.buildCommand(target, "true");

        Assertions.assertEquals("ssh", argv.get(0));
        Assertions.assertTrue(argv.contains("BatchMode=yes"));
        Assertions.assertEquals("/keys/lab", argv.get(argv.indexOf("-i") + 1));
        Assertions.assertEquals("2222", argv.get(argv.indexOf("-p") + 1));
        Assertions.assertEquals("jump@bastion.example.edu:2200", argv.get(argv.indexOf("-J") + 1));
    }

    @Test
    void successfulCommandStreamsOutputToTargetLog() throws Exception {
        assumePosixShell();
        Path root = Files.createTempDirectory("fleetprov-ssh-ok-");
        try {
            Path ssh = script(root, "ssh", "echo \"provisioning network 7\"\necho \"warming up\" >&2\necho done\nexit 0\n");
            Path logFile = root.resolve("lab-7.log");
            AtomicInteger writeErrors = new AtomicInteger();
            TargetLog log = TargetLog.standalone("lab-7", logFile, (what, e) -> writeErrors.incrementAndGet());

            ExecutionResult result = executor(ssh, root.resolve("sshpass-unused"))
                    .run(agentTarget("lab-7"), CommandTemplate.parse("provision {name}", Map.of()), Duration.ofSeconds(10), log);

            Assertions.assertTrue(result.succeeded());
            Assertions.assertEquals(List.of("provisioning network 7", "done"), result.stdoutTail());
            Assertions.assertEquals(List.of("warming up"), result.stderrTail());
            String written = Files.readString(logFile, StandardCharsets.UTF_8);
            Assertions.assertTrue(written.contains("out| provisioning network 7"), written);
            Assertions.assertTrue(written.contains("err| warming up"), written);
            Assertions.assertTrue(written.contains("exit status 0"), written);
            Assertions.assertEquals(0, writeErrors.get());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void passwordReachesSshpassOnlyThroughEnvironment() throws Exception {
        assumePosixShell();
        Path root = Files.createTempDirectory("fleetprov-ssh-env-");
        try {
            Path sshpass = script(root, "sshpass", """
                    for arg in "$@"; do
                      case "$arg" in *s3cret*) echo "password on command line"; exit 9;; esac
                    done
                    if [ "$SSHPASS" = "s3cret" ]; then echo "env ok"; else echo "env missing"; exit 8; fi
                    """);
            Path logFile = root.resolve("lab-1.log");
            TargetLog log = TargetLog.standalone("lab-1", logFile, (what, e) -> { });
            Target target = new Target("lab-1", "10.10.1.5", "bastion", 0, Credential.password("labadmin", "s3cret"), Map.of());

            ExecutionResult result = executor(root.resolve("ssh-unused"), sshpass)
                    .run(target, CommandTemplate.parse("provision {name}", Map.of()), Duration.ofSeconds(10), log);

            Assertions.assertEquals(List.of("env ok"), result.stdoutTail());
            String written = Files.readString(logFile, StandardCharsets.UTF_8);
            Assertions.assertFalse(written.contains("s3cret"), written);
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void failuresAreClassifiedAndKeepCapturedOutput() throws Exception {
        assumePosixShell();
        Path root = Files.createTempDirectory("fleetprov-ssh-fail-");
        try {
            TargetLog log = TargetLog.standalone("lab-1", root.resolve("lab-1.log"), (what, e) -> { });
            CommandTemplate template = CommandTemplate.parse("provision {name}", Map.of());

            Path remoteFailure = script(root, "ssh-exit3", "echo \"step 1 ok\"\necho \"provision.sh: disk full\" >&2\nexit 3\n");
            ExecutionException nonZero = Assertions.assertThrows(ExecutionException.class,
                    () -> executor(remoteFailure, root.resolve("x")).run(agentTarget("lab-1"), template, Duration.ofSeconds(10), log));
            Assertions.assertEquals(ExecutionErrorKind.NON_ZERO_EXIT, nonZero.kind());
            Assertions.assertEquals(3, nonZero.partialResult().exitStatus());
            Assertions.assertEquals("provision.sh: disk full", nonZero.partialResult().errorPreview());
            Assertions.assertTrue(nonZero.getMessage().contains("disk full"), nonZero.getMessage());

            Path refused = script(root, "ssh-refused", "echo \"ssh: connect to host bastion port 22: Connection refused\" >&2\nexit 255\n");
            ExecutionException unreachable = Assertions.assertThrows(ExecutionException.class,
                    () -> executor(refused, root.resolve("x")).run(agentTarget("lab-1"), template, Duration.ofSeconds(10), log));
            Assertions.assertEquals(ExecutionErrorKind.RELAY_UNREACHABLE, unreachable.kind());

            Path badPassword = script(root, "sshpass-denied", "exit 5\n");
            Target passwordTarget = new Target("lab-1", "10.10.1.5", "bastion", 0, Credential.password("labadmin", "wrong"), Map.of());
            ExecutionException auth = Assertions.assertThrows(ExecutionException.class,
                    () -> executor(root.resolve("x"), badPassword).run(passwordTarget, template, Duration.ofSeconds(10), log));
            Assertions.assertEquals(ExecutionErrorKind.AUTH_REJECTED, auth.kind());

            ExecutionException launch = Assertions.assertThrows(ExecutionException.class,
                    () -> executor(root.resolve("no-such-ssh"), root.resolve("x"))
                            .run(agentTarget("lab-1"), template, Duration.ofSeconds(10), log));
            Assertions.assertEquals(ExecutionErrorKind.LAUNCH_FAILED, launch.kind());
            Assertions.assertNull(launch.partialResult());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void timeoutTerminatesCommandAndKeepsPartialOutput() throws Exception {
        assumePosixShell();
        Path root = Files.createTempDirectory("fleetprov-ssh-timeout-");
        try {
            Path slow = script(root, "ssh", "echo \"started\"\nsleep 30\necho \"never\"\n");
            Path logFile = root.resolve("lab-1.log");
            TargetLog log = TargetLog.standalone("lab-1", logFile, (what, e) -> { });

            long began = System.nanoTime();
            ExecutionException timeout = Assertions.assertThrows(ExecutionException.class,
                    () -> executor(slow, root.resolve("x")).run(agentTarget("lab-1"),
                            CommandTemplate.parse("provision {name}", Map.of()), Duration.ofMillis(500), log));
            long tookMs = (System.nanoTime() - began) / 1_000_000L;

            Assertions.assertEquals(ExecutionErrorKind.TIMEOUT, timeout.kind());
            Assertions.assertEquals(List.of("started"), timeout.partialResult().stdoutTail());
            Assertions.assertTrue(tookMs < 20_000L, "took " + tookMs + "ms");
            String written = Files.readString(logFile, StandardCharsets.UTF_8);
            Assertions.assertTrue(written.contains("out| started"), written);
            Assertions.assertTrue(written.contains("timed out"), written);
            Assertions.assertFalse(written.contains("never"), written);
        } finally {
            deleteRecursively(root);
        }
    }

    private static SshRemoteExecutor executor(Path ssh, Path sshpass) {
        return new SshRemoteExecutor(new SshOptions(ssh.toString(), sshpass.toString(), Duration.ofSeconds(5), 20));
    }

    private static Target agentTarget(String name) {
        return new Target(name, "10.10.1.5", "jump@bastion", 0, Credential.agent("labadmin"), Map.of());
    }

    private static void assumePosixShell() {
        Assumptions.assumeTrue(FileSystems.getDefault().supportedFileAttributeViews().contains("posix"));
        Assumptions.assumeTrue(Files.isExecutable(Paths.get("/bin/sh")));
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
}
