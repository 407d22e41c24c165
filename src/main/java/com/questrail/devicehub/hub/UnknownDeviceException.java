package com.questrail.devicehub.hub;

import com.questrail.devicehub.device.DeviceIdentity;

/**
 * No device actor is registered under the identity.
 */
public final class UnknownDeviceException extends RuntimeException
{
    public UnknownDeviceException(DeviceIdentity identity) {
        super("no device registered as " + identity);
    }
}
