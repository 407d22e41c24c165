package com.questrail.devicehub.device;

import java.util.Objects;

/**
 * What a device reports about itself when it connects.
 *
 * @param uid       unique identifier (usually the MCU serial number)
 * @param protocol  framing the device expects on input
 * @param protocol2 framing the device uses on output, or {@code unknown}
 *                  when it equals {@code protocol}
 */
public record DeviceMetadata(String uid, String protocol, String protocol2)
{
    public static final String UNKNOWN = "unknown";

    public DeviceMetadata {
        Objects.requireNonNull(uid, "uid");
        Objects.requireNonNull(protocol, "protocol");
        Objects.requireNonNull(protocol2, "protocol2");
    }

    /** Name of the framing used to decode the device's output. */
    public String decodeProtocol() {
        return UNKNOWN.equals(protocol2) ? protocol : protocol2;
    }

    /** Name of the framing used to encode data sent to the device. */
    public String encodeProtocol() {
        return protocol;
    }
}
