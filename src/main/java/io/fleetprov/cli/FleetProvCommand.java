package io.fleetprov.cli;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.fleetprov.config.FleetProvConfig;
import io.fleetprov.config.RunSettings;
import io.fleetprov.exec.CommandTemplate;
import io.fleetprov.exec.SshOptions;
import io.fleetprov.exec.SshRemoteExecutor;
import io.fleetprov.inventory.InventoryException;
import io.fleetprov.inventory.TargetRegistry;
import io.fleetprov.model.RunSummary;
import io.fleetprov.model.Target;
import io.fleetprov.report.RunReporter;
import io.fleetprov.report.RunSummaries;
import io.fleetprov.report.SummaryPrinter;
import io.fleetprov.retry.RetryPolicy;
import io.fleetprov.scheduler.JobScheduler;
import io.fleetprov.security.SensitiveDataMasker;
import io.fleetprov.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

@Command(
        name = "fleetprov",
        mixinStandardHelpOptions = true,
        description = "Run one provisioning command per target host through a bastion, in parallel, with retries",
        subcommands = {
                FleetProvCommand.RunCommand.class,
                FleetProvCommand.TargetsCommand.class,
                FleetProvCommand.FailedCommand.class
        }
)
public final class FleetProvCommand implements Runnable {
    public static final int EXIT_OK = 0;
    public static final int EXIT_TARGETS_FAILED = 1;
    public static final int EXIT_CONFIG_ERROR = 2;
    public static final int EXIT_INTERRUPTED = 130;

    private static final long SHUTDOWN_WAIT_MS = 60_000L;

    @Option(names = {"--log-dir"}, description = "Directory for per-target logs, the run log and summaries", defaultValue = FleetProvConfig.DEFAULT_LOG_DIR)
    String logDir;

    PrintStream out = System.out;
    PrintStream err = System.err;

    @Override
    public void run() {
        out.println("Use subcommands: run | targets | failed");
    }

    @Command(name = "run", description = "Provision every target in the inventory")
    static final class RunCommand implements Callable<Integer> {
        @ParentCommand
        FleetProvCommand parent;

        @Option(names = {"--inventory", "-i"}, required = true, description = "Inventory file (JSON or Ansible INI)")
        Path inventory;

        @Option(names = {"--group"}, defaultValue = TargetRegistry.DEFAULT_GROUP, description = "Host group to read from an INI inventory")
        String group;

        @Option(names = {"--settings"}, description = "JSON settings file; explicit options override it")
        Path settingsFile;

        @Option(names = {"--command", "-c"}, description = "Remote command template, e.g. 'cd /opt/lab && ./provision.sh -n {meta.network_id}'")
        String command;

        @Option(names = {"--var"}, description = "Template variable for {var.KEY}, repeatable: --var provider=proxmox")
        Map<String, String> vars;

        @Option(names = {"--concurrency", "--threads", "-t"}, description = "Parallel remote commands (default: " + FleetProvConfig.DEFAULT_CONCURRENCY + ")")
        Integer concurrency;

        @Option(names = {"--retries"}, description = "Retries after the first failed attempt (default: " + FleetProvConfig.DEFAULT_MAX_RETRIES + ")")
        Integer retries;

        @Option(names = {"--retry-delay-ms"}, description = "Delay before a retry (default: 10000)")
        Long retryDelayMs;

        @Option(names = {"--retry-delay-mode"}, description = "fixed | linear (delay times attempt count)")
        String retryDelayMode;

        @Option(names = {"--retry-delay-max-ms"}, description = "Ceiling for the retry delay (default: 300000)")
        Long retryDelayMaxMs;

        @Option(names = {"--attempt-timeout-ms"}, description = "Per-attempt timeout (default: 7200000)")
        Long attemptTimeoutMs;

        @Option(names = {"--stagger-ms"}, description = "Delay between initial dispatches (default: 100)")
        Long staggerMs;

        @Option(names = {"--connect-timeout-s"}, description = "ssh ConnectTimeout in seconds (default: 15)")
        Long connectTimeoutSeconds;

        @Option(names = {"--no-retry-on"}, description = "Failure kind that is not retried, repeatable: AUTH_REJECTED, RELAY_UNREACHABLE, ...")
        List<String> noRetryOn;

        @Option(names = {"--only-failed-from"}, description = "Summary JSON of an earlier run; only its failed targets are provisioned")
        Path onlyFailedFrom;

        @Option(names = {"--ssh-binary"}, defaultValue = "ssh", description = "OpenSSH client to launch")
        String sshBinary;

        @Option(names = {"--sshpass-binary"}, defaultValue = "sshpass", description = "sshpass wrapper used for password logins")
        String sshpassBinary;

        @Option(names = {"--json"}, defaultValue = "false", description = "Print the final summary as JSON")
        boolean json;

        @Override
        public Integer call() {
            RunSettings settings;
            List<Target> targets;
            CommandTemplate template;
            try {
                settings = resolveSettings();
                targets = new TargetRegistry(group, System::getenv).load(inventory);
                if (onlyFailedFrom != null) {
                    RunSummary previous = RunSummaries.read(onlyFailedFrom);
                    if (previous.failedTargets().isEmpty()) {
                        parent.out.println("No failed targets in " + onlyFailedFrom + ", nothing to re-run.");
                        return EXIT_OK;
                    }
                    targets = TargetRegistry.select(targets, previous.failedTargets());
                }
                template = CommandTemplate.parse(settings.commandTemplate(), settings.templateVars());
                template.validateAll(targets);
            } catch (InventoryException e) {
                parent.err.println("Inventory error: " + e.getMessage());
                return EXIT_CONFIG_ERROR;
            } catch (IllegalArgumentException | IOException e) {
                parent.err.println("Configuration error: " + e.getMessage());
                return EXIT_CONFIG_ERROR;
            }

            FleetProvConfig layout = FleetProvConfig.forRun(parent.logDir);
            RunReporter reporter = new RunReporter(layout, parent.out, parent.err);
            SshOptions sshOptions = new SshOptions(sshBinary, sshpassBinary, settings.connectTimeout(), FleetProvConfig.DEFAULT_TAIL_LINES);
            JobScheduler scheduler = new JobScheduler(
                    settings,
                    template,
                    new SshRemoteExecutor(sshOptions),
                    RetryPolicy.from(settings),
                    reporter
            );

            CountDownLatch finished = new CountDownLatch(1);
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                if (finished.getCount() == 0L) {
                    return;
                }
                parent.err.println("fleetprov: abort requested, terminating running attempts...");
                scheduler.abort();
                try {
                    finished.await(SHUTDOWN_WAIT_MS, TimeUnit.MILLISECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }, "fleetprov-shutdown-hook"));

            try {
                RunSummary summary = scheduler.run(targets);
                if (json) {
                    parent.out.println(Jsons.toJson(summary));
                } else {
                    parent.out.print(SummaryPrinter.render(summary));
                    parent.out.println("Run log:  " + reporter.combinedLogFile());
                    if (reporter.summaryFile() != null) {
                        parent.out.println("Summary:  " + reporter.summaryFile());
                    }
                }
                return exitCode(summary);
            } finally {
                finished.countDown();
            }
        }

        private RunSettings resolveSettings() throws IOException {
            return RunSettings.builder()
                    .settingsFile(settingsFile)
                    .command(command)
                    .vars(vars)
                    .concurrency(concurrency)
                    .maxRetries(retries)
                    .retryDelay(millis(retryDelayMs))
                    .retryDelayMode(retryDelayMode)
                    .retryDelayMax(millis(retryDelayMaxMs))
                    .attemptTimeout(millis(attemptTimeoutMs))
                    .stagger(millis(staggerMs))
                    .connectTimeout(connectTimeoutSeconds == null ? null : Duration.ofSeconds(connectTimeoutSeconds))
                    .noRetryOn(noRetryOn)
                    .build();
        }

        private static Duration millis(Long value) {
            return value == null ? null : Duration.ofMillis(value);
        }
    }

    @Command(name = "targets", description = "Validate the inventory (and optionally the command template) without connecting anywhere")
    static final class TargetsCommand implements Callable<Integer> {
        @ParentCommand
        FleetProvCommand parent;

        @Option(names = {"--inventory", "-i"}, required = true, description = "Inventory file (JSON or Ansible INI)")
        Path inventory;

        @Option(names = {"--group"}, defaultValue = TargetRegistry.DEFAULT_GROUP, description = "Host group to read from an INI inventory")
        String group;

        @Option(names = {"--command", "-c"}, description = "Render this template for every target")
        String command;

        @Option(names = {"--var"}, description = "Template variable for {var.KEY}, repeatable")
        Map<String, String> vars;

        @Override
        public Integer call() {
            try {
                List<Target> targets = new TargetRegistry(group, System::getenv).load(inventory);
                CommandTemplate template = command == null ? null : CommandTemplate.parse(command, vars);
                if (template != null) {
                    template.validateAll(targets);
                }
                ArrayNode rows = Jsons.mapper().createArrayNode();
                for (Target target : targets) {
                    ObjectNode row = rows.addObject();
                    row.put("name", target.name());
                    row.put("host", target.host());
                    row.put("relay", target.relay());
                    if (target.port() > 0) {
                        row.put("port", target.port());
                    }
                    row.put("user", target.credential().user());
                    row.put("auth", target.credential().method());
                    if (target.credential().usesPassword()) {
                        row.put("password", target.credential().password());
                    }
                    if (target.credential().identityFile() != null) {
                        row.put("identityFile", target.credential().identityFile().toString());
                    }
                    row.set("metadata", Jsons.mapper().valueToTree(target.metadata()));
                    if (template != null) {
                        row.put("command", template.render(target));
                    }
                }
                parent.out.println(Jsons.toJson(SensitiveDataMasker.masked(rows)));
                return EXIT_OK;
            } catch (InventoryException e) {
                parent.err.println("Inventory error: " + e.getMessage());
                return EXIT_CONFIG_ERROR;
            } catch (IllegalArgumentException e) {
                parent.err.println("Configuration error: " + e.getMessage());
                return EXIT_CONFIG_ERROR;
            }
        }
    }

    @Command(name = "failed", description = "Print the failed target names recorded in a run summary, one per line")
    static final class FailedCommand implements Callable<Integer> {
        @ParentCommand
        FleetProvCommand parent;

        @Option(names = {"--summary", "-s"}, required = true, description = "summary_<timestamp>.json written by a run")
        Path summary;

        @Override
        public Integer call() {
            try {
                RunSummary previous = RunSummaries.read(summary);
                for (String name : previous.failedTargets()) {
                    parent.out.println(name);
                }
                return EXIT_OK;
            } catch (IOException e) {
                parent.err.println("Cannot read summary " + summary + ": " + e.getMessage());
                return EXIT_CONFIG_ERROR;
            }
        }
    }

    static int exitCode(RunSummary summary) {
        if (summary.interrupted()) {
            return EXIT_INTERRUPTED;
        }
        return summary.allSucceeded() ? EXIT_OK : EXIT_TARGETS_FAILED;
    }
}
