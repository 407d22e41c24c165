package com.questrail.devicehub.observability;

import java.time.Instant;

/**
 * Output received from a device that was not consumed by a call or handler.
 */
public record DeviceOutputEvent(
    Instant timestamp,
    String source,
    Kind kind,
    String text
) {
    public enum Kind {
        /** One newline-terminated line from the info sub-channel. */
        INFO_LINE,
        /** A decoded external-format term. */
        TERM,
        /** Debug sub-channel data with no call waiting for it. */
        UNCLAIMED_DEBUG,
        /** Anything else, rendered as bytes. */
        PACKET
    }
}
