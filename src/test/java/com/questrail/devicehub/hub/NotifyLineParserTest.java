package com.questrail.devicehub.hub;

import com.questrail.devicehub.device.DeviceIdentity;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class NotifyLineParserTest
{
    @Test
    void addLineIsParsed() {
        DeviceAttached attached = NotifyLineParser.parse(
                "tty add lab /dev/ttyACM0 /devices/pci0000:00/usb1/1-2/1-2:1.0/tty/ttyACM0\n").orElseThrow();

        assertEquals("lab", attached.host());
        assertEquals("/dev/ttyACM0", attached.ttyDevice());
        assertEquals("/devices/pci0000:00/usb1/1-2/1-2:1.0/tty/ttyACM0", attached.devPath());
        assertFalse(attached.appRunning());
        assertEquals(DeviceIdentity.usbPort("lab", "1-2"), attached.identity());
    }

    @Test
    void trailingAppFlagMarksApplicationRunning() {
        DeviceAttached attached = NotifyLineParser.parse(
                "tty add lab /dev/ttyACM0 /devices/pci0000:00/usb1/1-2/1-2:1.0/tty/ttyACM0 app").orElseThrow();

        assertTrue(attached.appRunning());
        assertEquals("/devices/pci0000:00/usb1/1-2/1-2:1.0/tty/ttyACM0", attached.devPath());
        assertEquals(DeviceIdentity.usbPort("lab", "1-2"), attached.identity());
    }

    @Test
    void trailingBootFlagIsTheDefault() {
        assertFalse(NotifyLineParser.parse("tty add lab /dev/ttyACM0 /devices/x boot").orElseThrow().appRunning());
    }

    @Test
    void unknownTrailingFlagIsIgnored() {
        assertTrue(NotifyLineParser.parse("tty add lab /dev/ttyACM0 /devices/x maybe").isEmpty());
        assertTrue(NotifyLineParser.parse("tty add lab /dev/ttyACM0 /devices/x app extra").isEmpty());
    }

    @Test
    void removeLinesAreIgnored() {
        assertTrue(NotifyLineParser.parse("tty remove lab /dev/ttyACM0 /devices/x").isEmpty());
    }

    @Test
    void wrongFieldCountIsIgnored() {
        assertTrue(NotifyLineParser.parse("tty add lab /dev/ttyACM0").isEmpty());
        assertTrue(NotifyLineParser.parse("").isEmpty());
    }

    /**
     * Verifies that a device path without a USB interface falls back to the
     * tty for identity.
     */
    @Test
    void nonUsbDeviceIsIdentifiedByTty() {
        DeviceAttached attached = NotifyLineParser.parse("tty add lab /dev/ttyS0 /devices/virtual/tty/ttyS0")
                .orElseThrow();
        assertEquals(DeviceIdentity.tty("lab", "/dev/ttyS0"), attached.identity());
        assertEquals("/devices/virtual/tty/ttyS0", attached.portKey());
    }
}
