package com.questrail.devicehub.bridge;

/**
 * Starts bridging subprocesses.
 */
@FunctionalInterface
public interface BridgeSpawner
{
    /**
     * @return a channel that has not been started yet
     * @throws BridgeSpawnException if the subprocess cannot be started
     */
    BridgeChannel spawn(BridgeSpawnRequest request);
}
