/**
 * fleetprov source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.fleetprov.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.fleetprov.cli.FleetProvCommand} maps commands to the orchestrator.</li>
 *   <li>{@code io.fleetprov.scheduler.JobScheduler} runs targets on the worker pool, with retries and abort.</li>
 *   <li>{@code io.fleetprov.exec.SshRemoteExecutor} runs one attempt through the bastion.</li>
 *   <li>{@code io.fleetprov.report.RunReporter} owns logs, progress output and the run summary.</li>
 * </ul>
 */
package io.fleetprov;
