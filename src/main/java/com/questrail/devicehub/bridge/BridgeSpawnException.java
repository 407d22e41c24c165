package com.questrail.devicehub.bridge;

/**
 * The bridging subprocess could not be started.
 */
public final class BridgeSpawnException extends BridgeException
{
    public BridgeSpawnException(String message, Throwable cause) {
        super(message, cause);
    }
}
