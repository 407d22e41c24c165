package com.questrail.devicehub.device;

/**
 * Queries a freshly connected device for its {@link DeviceMetadata}.
 *
 * <p>Runs on a helper thread, never on the actor thread, because it issues
 * calls that the actor itself has to serve. Failures are thrown unchecked;
 * the actor then continues without metadata.</p>
 */
@FunctionalInterface
public interface MetadataProbe
{
    DeviceMetadata probe(RspCaller device);
}
