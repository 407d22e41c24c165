package com.questrail.devicehub.device;

import java.util.Objects;

/**
 * Everything a {@link DeviceActor} needs to know about its device at start.
 *
 * @param identity   registry key
 * @param ttyDevice  device file the bridge opens, e.g. {@code /dev/ttyACM1}
 * @param devPath    sysfs device path, or {@code null} when unknown
 * @param tcpPort    port of the debug TCP listener
 * @param appRunning true if the application (not the boot loader) is
 *                   already resident
 */
public record DeviceDescriptor(
    DeviceIdentity identity,
    String ttyDevice,
    String devPath,
    int tcpPort,
    boolean appRunning
) {
    public DeviceDescriptor {
        Objects.requireNonNull(identity, "identity");
        Objects.requireNonNull(ttyDevice, "ttyDevice");
        if (tcpPort < 0 || tcpPort > 65535) {
            throw new IllegalArgumentException("tcpPort out of range: " + tcpPort);
        }
    }
}
