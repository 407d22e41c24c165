package com.questrail.devicehub.transport.tcp;

import com.questrail.devicehub.device.DeviceIdentity;

/**
 * Creates unstarted {@link DebugServer}s.
 */
@FunctionalInterface
public interface DebugServerFactory
{
    DebugServer create(DeviceIdentity identity, int port);
}
