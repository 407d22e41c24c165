package com.questrail.devicehub.transport.tcp;

import com.questrail.devicehub.device.DeviceIdentity;

import java.util.concurrent.CompletableFuture;

/**
 * Routes one RSP request from a debug connection to whichever actor currently
 * serves the device.
 *
 * <p>Connections address devices by identity, not by actor, so a connection
 * survives the device being restarted under a new actor.</p>
 */
@FunctionalInterface
public interface DebugRequestDispatcher
{
    /**
     * @return the device's reply; empty for requests that need no reply
     */
    CompletableFuture<byte[]> dispatch(DeviceIdentity identity, byte[] request);
}
