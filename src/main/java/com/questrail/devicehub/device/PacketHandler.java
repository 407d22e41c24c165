package com.questrail.devicehub.device;

/**
 * PacketHandler
 * -----------------------------------------------------------------------------
 * Device-specific interpretation of decoded frames.
 *
 * <p>Every device actor has a default handler, chosen per device when the
 * actor is created; {@link #DEFAULT} hands everything to the built-in tag
 * dispatch. A forward handler set with {@link DeviceActor#setForward}
 * pre-empts both the default handler and a linked peer.</p>
 *
 * <p>Handlers run on the actor thread. An exception thrown by a handler
 * terminates the actor.</p>
 */
@FunctionalInterface
public interface PacketHandler
{
    PacketHandler DEFAULT = DeviceContext::dispatchDefault;

    /**
     * Called for each non-empty frame decoded from the device.
     */
    void onPacket(DeviceContext device, byte[] frame);

    /**
     * Called for application messages posted with
     * {@link DeviceActor#deliver(Object)}.
     */
    default void onMessage(DeviceContext device, Object message) {
        device.reportUnhandled(message);
    }
}
