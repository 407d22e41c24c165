package com.questrail.devicehub.observability;

import java.time.Instant;

/**
 * Lifecycle change of a hub component.
 *
 * @param source component label, normally a device identity
 * @param description human readable description of the change
 */
public record DeviceLifecycleEvent(
    Instant timestamp,
    String source,
    String description
) {
}
