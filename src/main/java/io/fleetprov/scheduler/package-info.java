/**
 * Run orchestration.
 *
 * <p>{@link io.fleetprov.scheduler.JobScheduler} is the only stateful
 * coordination point of a run: it owns the worker pool, parks jobs between
 * attempts, applies the retry policy and handles operator abort. Everything it
 * observes is forwarded to the run reporter as progress events.
 */
package io.fleetprov.scheduler;
