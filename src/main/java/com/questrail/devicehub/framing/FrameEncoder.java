package com.questrail.devicehub.framing;

/**
 * Frame to byte-stream encoder.
 */
@FunctionalInterface
public interface FrameEncoder
{
    /**
     * @return the bytes to write to the serial line for {@code frame}
     * @throws FramingException if the frame cannot be represented
     */
    byte[] encode(byte[] frame);
}
