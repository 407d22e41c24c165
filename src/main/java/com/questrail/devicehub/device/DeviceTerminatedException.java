package com.questrail.devicehub.device;

/**
 * The device actor terminated before, or while, handling a request.
 */
public final class DeviceTerminatedException extends RuntimeException
{
    public DeviceTerminatedException(String message) {
        super(message);
    }

    public DeviceTerminatedException(String message, Throwable cause) {
        super(message, cause);
    }
}
