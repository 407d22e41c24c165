package com.questrail.devicehub.hub;

import com.questrail.devicehub.device.DeviceActor;
import com.questrail.devicehub.device.DeviceDescriptor;
import com.questrail.devicehub.device.DeviceEnvironment;

import java.util.function.Consumer;

/**
 * Creates (unstarted) device actors for the registry.
 */
@FunctionalInterface
public interface DeviceActorFactory
{
    DeviceActor create(DeviceDescriptor descriptor, Consumer<DeviceActor> onReady);

    static DeviceActorFactory of(DeviceEnvironment env) {
        return (descriptor, onReady) -> new DeviceActor(descriptor, env, onReady);
    }
}
