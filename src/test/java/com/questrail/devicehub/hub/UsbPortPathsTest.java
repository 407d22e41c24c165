package com.questrail.devicehub.hub;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class UsbPortPathsTest
{
    @Test
    void portIsTakenFromInterfaceComponent() {
        assertEquals(Optional.of("1-2"),
                UsbPortPaths.fromDevPath("/devices/pci0000:00/0000:00:14.0/usb1/1-2/1-2:1.0/tty/ttyACM0"));
    }

    /**
     * Verifies that ports behind hubs keep their full dotted path.
     */
    @Test
    void hubPortsKeepDottedPath() {
        assertEquals(Optional.of("3-1.4.2"),
                UsbPortPaths.fromDevPath("/devices/platform/usb3/3-1/3-1.4/3-1.4.2/3-1.4.2:1.2/tty/ttyACM3"));
    }

    @Test
    void pathWithoutInterfaceHasNoPort() {
        assertTrue(UsbPortPaths.fromDevPath("/devices/virtual/tty/ttyS0").isEmpty());
        assertTrue(UsbPortPaths.fromDevPath(null).isEmpty());
    }

    @Test
    void interfaceName() {
        assertEquals(Optional.of("1-1.3"), UsbPortPaths.fromInterface("1-1.3:1.0"));
        assertTrue(UsbPortPaths.fromInterface("1-1.3").isEmpty());
        assertTrue(UsbPortPaths.fromInterface("usb1").isEmpty());
    }
}
