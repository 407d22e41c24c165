package com.questrail.devicehub.device;

import com.questrail.devicehub.framing.FramingFamily;

import java.util.Optional;

/**
 * Diagnostic snapshot of a {@link DeviceActor}'s state, taken on the actor
 * thread.
 *
 * @param restBytes          undecoded bytes held back waiting for more input
 * @param pendingCorrelations correlated calls still waiting for a reply
 */
public record DeviceRecord(
    DeviceDescriptor descriptor,
    Optional<String> name,
    DevicePhase phase,
    DeviceMode mode,
    Optional<DeviceMetadata> metadata,
    FramingFamily decodeFamily,
    FramingFamily encodeFamily,
    int restBytes,
    int pendingCorrelations,
    boolean rspCallPending,
    boolean hasPeer,
    boolean hasForward
) {
    public DeviceIdentity identity() {
        return descriptor.identity();
    }

    public Optional<String> uid() {
        return metadata.map(DeviceMetadata::uid);
    }
}
