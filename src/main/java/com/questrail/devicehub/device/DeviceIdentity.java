package com.questrail.devicehub.device;

import java.util.Objects;

/**
 * DeviceIdentity
 * -----------------------------------------------------------------------------
 * Stable key for a physical device: the host it is attached to plus where it
 * is attached.
 *
 * <p>The physical USB port ({@code 9-2.4}) is preferred because it survives
 * re-enumeration under a different tty name. When the port cannot be
 * derived, the tty device path is used instead.</p>
 *
 * @param host     host name the device is attached to
 * @param kind     what {@code location} denotes
 * @param location USB port path or tty device path
 */
public record DeviceIdentity(String host, Kind kind, String location)
{
    public enum Kind {
        USB_PORT,
        TTY
    }

    public DeviceIdentity {
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(location, "location");
    }

    public static DeviceIdentity usbPort(String host, String usbPort) {
        return new DeviceIdentity(host, Kind.USB_PORT, usbPort);
    }

    public static DeviceIdentity tty(String host, String ttyDevice) {
        return new DeviceIdentity(host, Kind.TTY, ttyDevice);
    }

    @Override
    public String toString() {
        return kind == Kind.USB_PORT
                ? host + ":" + location
                : host + ":tty:" + location;
    }
}
