package com.questrail.devicehub.bridge;

/**
 * BridgeChannel
 * -----------------------------------------------------------------------------
 * Duplex byte channel to a device's serial line, provided by the bridging
 * subprocess.
 *
 * <p>The channel carries opaque bytes. It does not frame, escape or interpret
 * anything; the owning device actor does all of that.</p>
 *
 * <p>A channel is exclusively owned by one device actor. Implementations may
 * be backed by a local process, a remote shell, or a test harness.</p>
 */
public interface BridgeChannel
{
    /**
     * Register the listener that receives inbound bytes and the exit signal.
     *
     * <p>This must be called before {@link #start()}.</p>
     */
    void setListener(BridgeChannelListener listener);

    /**
     * Begin delivering inbound data to the listener.
     */
    void start();

    /**
     * Write bytes to the device.
     *
     * @throws BridgeException if the channel is closed or the write fails
     */
    void write(byte[] bytes);

    /**
     * Close the channel and release the subprocess. Idempotent.
     *
     * <p>Closing does not notify the listener.</p>
     */
    void close();
}
