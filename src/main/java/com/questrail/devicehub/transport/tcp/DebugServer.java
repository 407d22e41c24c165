package com.questrail.devicehub.transport.tcp;

import com.questrail.devicehub.device.DeviceIdentity;

import java.util.concurrent.CompletableFuture;

/**
 * DebugServer
 * -----------------------------------------------------------------------------
 * TCP listener serving RSP for one device.
 *
 * <p>Each accepted connection is handled as a strict request/reply loop: one
 * complete request is read, dispatched, and its reply (if any) written back
 * before the next request is read.</p>
 */
public interface DebugServer
{
    DeviceIdentity identity();

    /**
     * Bind the listening socket.
     *
     * @return completes with the bound port, or exceptionally if binding failed
     */
    CompletableFuture<Integer> start();

    /**
     * Close the listener and every open connection.
     */
    void stop();
}
