/**
 * DHT probe source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.dhtprobe.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.dhtprobe.cli.DhtProbeCommand} maps commands to runtime APIs.</li>
 *   <li>{@code io.dhtprobe.runtime.PopulationScheduler} runs one maintenance cycle.</li>
 *   <li>{@code io.dhtprobe.storage.ProbeRecordStore} holds the authoritative probe snapshot.</li>
 *   <li>{@code io.dhtprobe.network.veilid.VeilidJsonApiClient} talks to the local veilid-server.</li>
 * </ul>
 */
package io.dhtprobe;
