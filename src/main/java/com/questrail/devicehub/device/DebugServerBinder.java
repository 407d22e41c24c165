package com.questrail.devicehub.device;

/**
 * Starts (or reuses) the debug TCP listener for a device once its actor is
 * ready.
 *
 * <p>Bind failures are reported by the implementation; they do not affect
 * the device actor.</p>
 */
@FunctionalInterface
public interface DebugServerBinder
{
    DebugServerBinder NONE = (identity, port) -> {};

    void bind(DeviceIdentity identity, int port);
}
