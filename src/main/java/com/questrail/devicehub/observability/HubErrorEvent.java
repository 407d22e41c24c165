package com.questrail.devicehub.observability;

import java.time.Instant;

/**
 * Error in the hub, a device actor or a TCP connection.
 *
 * @param cause may be {@code null}
 */
public record HubErrorEvent(
    Instant timestamp,
    String source,
    String message,
    Throwable cause
) {
}
