package com.questrail.devicehub.hub;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives the physical USB port of a device from its sysfs path.
 *
 * <p>In {@code /devices/pci0000:00/0000:00:16.0/usb9/9-2/9-2.4/9-2.4:1.0/tty/ttyACM1}
 * the first interface component {@code 9-2.4:1.0} names bus 9, hub port 2,
 * port 4, configuration 1, interface 0. The port is {@code 9-2.4}. It stays
 * the same when the device re-enumerates under another tty name.</p>
 */
public final class UsbPortPaths
{
    // bus-port[.port]*:config.interface
    private static final Pattern INTERFACE = Pattern.compile("(\\d+-\\d+(?:\\.\\d+)*):\\d+\\.\\d+");

    private UsbPortPaths() {}

    /**
     * @return the USB port, or empty if {@code devPath} has no USB interface
     *         component (e.g. a platform UART)
     */
    public static Optional<String> fromDevPath(String devPath)
    {
        if (devPath == null) {
            return Optional.empty();
        }
        for (String component : devPath.split("/")) {
            Optional<String> port = fromInterface(component);
            if (port.isPresent()) {
                return port;
            }
        }
        return Optional.empty();
    }

    /**
     * Strips configuration and interface from a USB interface name such as
     * {@code 2-1:1.0}.
     */
    public static Optional<String> fromInterface(String usbInterface)
    {
        Matcher m = INTERFACE.matcher(usbInterface);
        return m.matches() ? Optional.of(m.group(1)) : Optional.empty();
    }
}
