package io.fleetprov.exec;

import io.fleetprov.model.Credential;
import io.fleetprov.model.ExecutionErrorKind;
import io.fleetprov.model.ExecutionResult;
import io.fleetprov.model.Target;
import io.fleetprov.report.TargetLog;
import io.fleetprov.security.SensitiveDataMasker;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs the remote command with the OpenSSH client, hopping through the
 * target's relay with {@code -J}.
 *
 * <p>Password logins go through {@code sshpass -e}; the password travels in the
 * child's {@code SSHPASS} environment variable and never appears on a command
 * line or in a log.
 */
public final class SshRemoteExecutor implements RemoteExecutor {
    private static final long KILL_GRACE_MS = 5_000L;
    private static final long PUMP_JOIN_MS = 5_000L;

    private final SshOptions options;

    public SshRemoteExecutor(SshOptions options) {
        this.options = options == null ? SshOptions.defaults() : options;
    }

    @Override
    public ExecutionResult run(Target target, CommandTemplate template, Duration timeout, TargetLog log)
            throws ExecutionException {
        String remoteCommand;
        try {
            remoteCommand = template.render(target);
        } catch (IllegalArgumentException e) {
            throw new ExecutionException(ExecutionErrorKind.LAUNCH_FAILED, e.getMessage(), null, e);
        }
        Credential credential = target.credential();
        List<String> argv = buildCommand(target, remoteCommand);
        log.appendNote("command: " + SensitiveDataMasker.maskCommandLine(argv, secretsOf(credential)));

        ProcessBuilder pb = new ProcessBuilder(argv);
        if (credential.usesPassword()) {
            pb.environment().put("SSHPASS", credential.password());
        }
        Instant started = Instant.now();
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new ExecutionException(ExecutionErrorKind.LAUNCH_FAILED,
                    "failed to start " + argv.get(0) + ": " + e.getMessage(), null, e);
        }

        OutputTail stdout = new OutputTail(options.tailLines());
        OutputTail stderr = new OutputTail(options.tailLines());
        Thread outPump = pump(process.getInputStream(), TargetLog.OUTPUT_STDOUT, stdout, log);
        Thread errPump = pump(process.getErrorStream(), TargetLog.OUTPUT_STDERR, stderr, log);
        try {
            process.getOutputStream().close();
        } catch (IOException e) {
            log.appendNote("could not close remote stdin: " + e.getMessage());
        }

        boolean finished;
        try {
            finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            destroy(process);
            joinPumps(outPump, errPump);
            Thread.currentThread().interrupt();
            ExecutionResult partial = result(-1, stdout, stderr, started);
            log.appendNote("attempt interrupted after " + partial.duration().toSeconds() + "s, remote command terminated");
            throw new ExecutionException(ExecutionErrorKind.INTERRUPTED,
                    "interrupted by operator abort", partial, e);
        }
        if (!finished) {
            destroy(process);
            joinPumps(outPump, errPump);
            ExecutionResult partial = result(-1, stdout, stderr, started);
            log.appendNote("attempt timed out after " + timeout.toSeconds() + "s, remote command terminated");
            throw new ExecutionException(ExecutionErrorKind.TIMEOUT,
                    "timed out after " + timeout.toSeconds() + "s", partial);
        }
        joinPumps(outPump, errPump);
        int exit = process.exitValue();
        ExecutionResult result = result(exit, stdout, stderr, started);
        log.appendNote("exit status " + exit + " after " + result.duration().toSeconds() + "s");
        if (exit == 0) {
            return result;
        }
        ExecutionErrorKind kind = SshFailureClassifier.classify(exit, result.stderrTail(), credential.usesPassword());
        String preview = result.errorPreview();
        throw new ExecutionException(kind,
                "exit status " + exit + (preview.isEmpty() ? "" : ": " + truncate(preview)), result);
    }

    List<String> buildCommand(Target target, String remoteCommand) {
        Credential credential = target.credential();
        List<String> argv = new ArrayList<>();
        if (credential.usesPassword()) {
            argv.add(options.sshpassBinary());
            argv.add("-e");
        }
        argv.add(options.sshBinary());
        addOption(argv, "StrictHostKeyChecking=no");
        addOption(argv, "UserKnownHostsFile=/dev/null");
        addOption(argv, "LogLevel=ERROR");
        addOption(argv, "ConnectTimeout=" + Math.max(1L, options.connectTimeout().toSeconds()));
        addOption(argv, "ServerAliveInterval=30");
        addOption(argv, "ServerAliveCountMax=4");
        if (credential.usesPassword()) {
            addOption(argv, "PreferredAuthentications=password,keyboard-interactive");
            addOption(argv, "PubkeyAuthentication=no");
        } else {
            addOption(argv, "BatchMode=yes");
        }
        if (credential.identityFile() != null) {
            argv.add("-i");
            argv.add(credential.identityFile().toString());
            addOption(argv, "IdentitiesOnly=yes");
        }
        if (target.port() > 0) {
            argv.add("-p");
            argv.add(Integer.toString(target.port()));
        }
        argv.add("-J");
        argv.add(target.relay().contains("@") ? target.relay() : credential.user() + "@" + target.relay());
        argv.add(credential.user() + "@" + target.host());
        argv.add(remoteCommand);
        return argv;
    }

    private static void addOption(List<String> argv, String option) {
        argv.add("-o");
        argv.add(option);
    }

    private static List<String> secretsOf(Credential credential) {
        return credential.usesPassword() ? List.of(credential.password()) : List.of();
    }

    private static Thread pump(InputStream in, String stream, OutputTail tail, TargetLog log) {
        Thread thread = new Thread(() -> {
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    tail.add(line);
                    log.appendOutput(stream, line);
                }
            } catch (IOException e) {
                // Stream closed under us when the process was destroyed.
                log.appendNote(stream + " stream closed: " + e.getMessage());
            }
        }, "fleetprov-pump-" + log.targetName() + "-" + stream);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    private static void joinPumps(Thread... pumps) {
        for (Thread pump : pumps) {
            try {
                pump.join(PUMP_JOIN_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    private static void destroy(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
        try {
            process.waitFor(KILL_GRACE_MS, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static ExecutionResult result(int exit, OutputTail stdout, OutputTail stderr, Instant started) {
        return new ExecutionResult(exit, stdout.lines(), stderr.lines(), Duration.between(started, Instant.now()));
    }

    private static String truncate(String raw) {
        return raw.length() <= 200 ? raw : raw.substring(0, 200) + "...";
    }
}
