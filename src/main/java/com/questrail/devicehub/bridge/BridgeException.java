package com.questrail.devicehub.bridge;

/**
 * Transport failure on a bridging channel.
 */
public class BridgeException extends RuntimeException
{
    public BridgeException(String message) {
        super(message);
    }

    public BridgeException(String message, Throwable cause) {
        super(message, cause);
    }
}
