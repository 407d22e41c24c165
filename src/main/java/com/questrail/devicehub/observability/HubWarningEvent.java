package com.questrail.devicehub.observability;

import java.time.Instant;

/**
 * Non-fatal anomaly.
 */
public record HubWarningEvent(
    Instant timestamp,
    String source,
    String message
) {
}
