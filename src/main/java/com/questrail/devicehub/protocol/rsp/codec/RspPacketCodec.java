package com.questrail.devicehub.protocol.rsp.codec;

/**
 * RspPacketCodec
 * -----------------------------------------------------------------------------
 * Packet-level codec for the debug sub-channel (GDB remote serial protocol
 * framing as spoken by the device stubs).
 *
 * <p>The codec is responsible only for:</p>
 * <ul>
 *   <li>Escaping the reserved characters {@code # $ } *}</li>
 *   <li>Delimiting a payload as {@code $...#xx} with a modulo-256 checksum</li>
 *   <li>Stripping ack/nack markers and the delimiters on the way back</li>
 * </ul>
 *
 * <p>The codec is <strong>not</strong> responsible for interpreting the
 * commands carried in the payload.</p>
 */
public interface RspPacketCodec
{
    /**
     * Wraps a payload as {@code "+$" + escape(payload) + "#" + checksum}.
     *
     * <p>The leading {@code +} acknowledges the previously received packet in
     * the same write.</p>
     */
    byte[] wrap(byte[] payload);

    /**
     * Recovers the payload of a packet. Leading {@code +}/{@code -} markers are
     * skipped and the checksum is <em>not</em> verified; the serial transport
     * below is already integrity protected.
     *
     * @throws com.questrail.devicehub.protocol.rsp.codec.impl.RspFramingException
     *         if the packet has no {@code $} start or no {@code #xx} trailer
     */
    byte[] unwrap(byte[] packet);
}
