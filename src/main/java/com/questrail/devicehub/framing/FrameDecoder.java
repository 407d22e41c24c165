package com.questrail.devicehub.framing;

/**
 * Byte-stream to frame decoder.
 *
 * <p>Decoders are stateless: the caller keeps the undecoded remainder and
 * passes it back prepended to the next chunk.</p>
 */
@FunctionalInterface
public interface FrameDecoder
{
    /**
     * Attempts to cut one frame off the front of {@code buffer}.
     *
     * @throws FramingException if the buffer can never become a valid frame
     */
    DecodeResult decode(byte[] buffer);
}
