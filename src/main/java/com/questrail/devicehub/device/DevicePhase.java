package com.questrail.devicehub.device;

/**
 * Lifecycle phase of a {@link DeviceActor}.
 */
public enum DevicePhase {
    DISCOVERED,
    CONNECTING,
    AWAITING_METADATA,
    READY,
    TERMINATED
}
