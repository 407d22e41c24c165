package com.questrail.devicehub.observability;

/**
 * Receives observability events from the hub, its device actors and the debug
 * TCP servers. Implementations can provide logging, metrics or tracing.
 *
 * <p>Callbacks arrive on whichever thread produced the event (device actor
 * threads, the hub thread, Netty event loops); implementations must be
 * thread-safe.</p>
 */
public interface HubObservabilitySink {
    /**
     * Called when a device actor changes phase or mode, or a hub-level
     * lifecycle change happens (device registered, server bound, ...).
     */
    void onLifecycle(DeviceLifecycleEvent event);

    /**
     * Called for output produced by a device that nobody consumed: info log
     * lines, decoded terms, unclaimed debug data and unrecognized packets.
     */
    void onDeviceOutput(DeviceOutputEvent event);

    /**
     * Called for non-fatal anomalies: dropped replies, unknown framing
     * families, registry inconsistencies.
     */
    void onWarning(HubWarningEvent event);

    /**
     * Called when an error occurs. Fatal actor conditions are reported here
     * before the actor terminates.
     */
    void onError(HubErrorEvent event);
}
