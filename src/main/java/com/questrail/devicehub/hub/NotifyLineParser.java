package com.questrail.devicehub.hub;

import java.util.Optional;

/**
 * Parses the lines the udev notify scripts send:
 * <pre>
 *   bluepill add zoe /dev/ttyACM1 /devices/pci0000:00/.../9-2.4:1.0/tty/ttyACM1
 *   &lt;type&gt;  add &lt;host&gt; &lt;tty&gt; &lt;devpath&gt; [app|boot]
 * </pre>
 * The board type is not used by the hub. The optional last field says whether
 * the application is already running ({@code app}) or the boot loader is
 * ({@code boot}, the default).
 */
public final class NotifyLineParser
{
    private NotifyLineParser() {}

    /**
     * @return the attach notification, or empty for any other line
     */
    public static Optional<DeviceAttached> parse(String line)
    {
        String[] fields = line.trim().split("\\s+");
        if (fields.length < 5 || fields.length > 6 || !"add".equals(fields[1])) {
            return Optional.empty();
        }
        DeviceAttached attached = DeviceAttached.of(fields[2], fields[3], fields[4]);
        if (fields.length == 5) {
            return Optional.of(attached);
        }
        switch (fields[5]) {
            case "app":
                return Optional.of(attached.withAppRunning(true));
            case "boot":
                return Optional.of(attached);
            default:
                return Optional.empty();
        }
    }
}
