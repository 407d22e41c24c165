package com.questrail.devicehub.device;

/**
 * Which firmware is resident on a device, which decides how debug requests
 * reach it.
 */
public enum DeviceMode {
    /** The boot loader speaks RSP directly on the serial line. */
    BOOTLOADER,
    /**
     * The application owns the serial line. RSP travels on the debug
     * sub-channel of the tagged packet protocol.
     */
    APPLICATION
}
