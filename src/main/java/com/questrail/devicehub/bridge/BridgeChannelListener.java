package com.questrail.devicehub.bridge;

/**
 * BridgeChannelListener
 * -----------------------------------------------------------------------------
 * Callback sink for {@link BridgeChannel}.
 *
 * <p>Callbacks arrive on a channel-owned thread, serialized per channel.
 * Listeners are expected to hand the data to their own thread rather than
 * process it in place.</p>
 */
public interface BridgeChannelListener
{
    /**
     * Called with each chunk read from the device. Chunk boundaries carry no
     * meaning.
     */
    void onData(byte[] chunk);

    /**
     * Called once when the bridging subprocess exits on its own.
     */
    void onExit(int status);

    /**
     * Called when reading from the channel fails.
     */
    void onError(Throwable cause);
}
