package com.questrail.devicehub.hub;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fallback discovery for hosts without udev: watches kernel log lines like
 * <pre>
 *   Oct  6 15:28:44 buildroot kern.info kernel: cdc_acm 2-1:1.0: ttyACM0: USB ACM device
 * </pre>
 * e.g. from {@code ssh root@host tail -n0 -f /tmp/messages}.
 */
public final class SyslogTtyParser
{
    private static final Pattern CDC_ACM = Pattern.compile("cdc_acm (.*): (ttyACM\\d+): USB ACM device");

    /**
     * @param usbInterface USB interface name, e.g. {@code 2-1:1.0}
     * @param tty          tty name without {@code /dev/}
     */
    public record Match(String usbInterface, String tty) {
        public String ttyDevice() {
            return "/dev/" + tty;
        }

        /**
         * The notification for a device found on {@code host}. The identity
         * uses the USB port when the interface name yields one.
         */
        public DeviceAttached attachedOn(String host) {
            String port = UsbPortPaths.fromInterface(usbInterface).orElse(null);
            return new DeviceAttached(host, ttyDevice(), null, port, false);
        }
    }

    private SyslogTtyParser() {}

    public static Optional<Match> parse(String line)
    {
        Matcher m = CDC_ACM.matcher(line);
        if (!m.find()) {
            return Optional.empty();
        }
        return Optional.of(new Match(m.group(1), m.group(2)));
    }
}
