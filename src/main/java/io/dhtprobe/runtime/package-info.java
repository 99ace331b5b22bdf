/**
 * Probe lifecycle package.
 *
 * <p>{@link io.dhtprobe.runtime.DhtProbeRuntime} wires the pieces for the CLI;
 * {@link io.dhtprobe.runtime.PopulationScheduler} evaluates due probes through
 * {@link io.dhtprobe.runtime.EvaluationExecutor} and refills the population through
 * {@link io.dhtprobe.runtime.ProbeCreator}. Network and integrity failures never
 * leave these classes as exceptions; they become terminal probe state or a
 * dropped creation attempt.
 */
package io.dhtprobe.runtime;
