package com.questrail.devicehub.device;

/**
 * An RSP call was issued while another one was still outstanding on the same
 * device. Devices handle one RSP exchange at a time and requests are not
 * queued, so this terminates the device actor.
 */
public final class ConcurrentCallException extends RuntimeException
{
    public ConcurrentCallException(DeviceIdentity identity) {
        super("already have an RSP call waiting on " + identity);
    }
}
