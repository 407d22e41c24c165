package com.questrail.devicehub.device;

import java.util.Optional;

/**
 * View of a device actor handed to {@link PacketHandler}s.
 *
 * <p>All methods must be called from within the handler callback, i.e. on
 * the actor thread.</p>
 */
public interface DeviceContext
{
    DeviceIdentity identity();

    Optional<String> name();

    DeviceMode mode();

    /**
     * Writes raw bytes to the device and switches it to application mode.
     */
    void send(byte[] raw);

    /**
     * Encodes {@code packet} with the device's output framing and sends it.
     */
    void sendPacket(byte[] packet);

    /**
     * Runs the built-in tag dispatch on {@code frame}: debug data, info
     * lines, correlated replies, terms, and logging of anything else.
     */
    void dispatchDefault(byte[] frame);

    /**
     * Reports a message no handler understood.
     */
    void reportUnhandled(Object message);
}
