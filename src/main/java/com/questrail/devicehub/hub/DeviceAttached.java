package com.questrail.devicehub.hub;

import com.questrail.devicehub.device.DeviceIdentity;

import java.util.Objects;
import java.util.Optional;

/**
 * Notification that a device appeared on some host.
 *
 * @param host       host the device is attached to
 * @param ttyDevice  device file, e.g. {@code /dev/ttyACM1}
 * @param devPath    sysfs device path; {@code null} if the source does not
 *                   provide one
 * @param usbPort    USB port if the source knows it directly; {@code null}
 *                   to derive it from {@code devPath}
 * @param appRunning true if the device runs its application rather than the
 *                   boot loader
 */
public record DeviceAttached(
    String host,
    String ttyDevice,
    String devPath,
    String usbPort,
    boolean appRunning
) {
    public DeviceAttached {
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(ttyDevice, "ttyDevice");
    }

    public static DeviceAttached of(String host, String ttyDevice, String devPath) {
        return new DeviceAttached(host, ttyDevice, devPath, null, false);
    }

    public DeviceAttached withAppRunning(boolean running) {
        return new DeviceAttached(host, ttyDevice, devPath, usbPort, running);
    }

    /**
     * Prefers the USB port (given, or derived from the sysfs path) and falls
     * back to the tty device.
     */
    public DeviceIdentity identity() {
        Optional<String> port = usbPort != null
                ? Optional.of(usbPort)
                : UsbPortPaths.fromDevPath(devPath);
        return port.map(p -> DeviceIdentity.usbPort(host, p))
                .orElseGet(() -> DeviceIdentity.tty(host, ttyDevice));
    }

    /** What the debug port is hashed from, besides the host. */
    String portKey() {
        if (devPath != null) {
            return devPath;
        }
        return usbPort != null ? usbPort : ttyDevice;
    }
}
