package com.questrail.devicehub.protocol.rsp.codec.impl;

import com.questrail.devicehub.protocol.rsp.codec.RspPacketCodec;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * DefaultRspPacketCodec
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link RspPacketCodec}.
 *
 * <p>{@link #unwrap(byte[])} performs, in order:</p>
 * <ol>
 *   <li>Skipping of leading {@code +} (ack) and {@code -} (nack) markers</li>
 *   <li>Removal of the {@code $} start marker</li>
 *   <li>Removal of the {@code #} trailer and the checksum digits after it
 *       (escaped {@code }#} pairs inside the body do not end the packet)</li>
 *   <li>Unescaping</li>
 * </ol>
 */
public final class DefaultRspPacketCodec implements RspPacketCodec
{
    public static final DefaultRspPacketCodec INSTANCE = new DefaultRspPacketCodec();

    @Override
    public byte[] wrap(byte[] payload)
    {
        Objects.requireNonNull(payload, "payload");

        byte[] escaped = RspEscaping.escape(payload);
        byte[] checksum = RspChecksum.hex(escaped).getBytes(StandardCharsets.US_ASCII);

        byte[] out = new byte[2 + escaped.length + 1 + checksum.length];
        out[0] = '+';
        out[1] = '$';
        System.arraycopy(escaped, 0, out, 2, escaped.length);
        out[2 + escaped.length] = '#';
        System.arraycopy(checksum, 0, out, 3 + escaped.length, checksum.length);
        return out;
    }

    @Override
    public byte[] unwrap(byte[] packet)
    {
        Objects.requireNonNull(packet, "packet");

        int start = 0;
        while (start < packet.length && (packet[start] == '+' || packet[start] == '-')) {
            start++;
        }
        if (start >= packet.length || packet[start] != '$') {
            throw new RspFramingException("RSP packet does not start with '$'");
        }
        start++;

        int end = findTrailer(packet, start);
        return RspEscaping.unescape(Arrays.copyOfRange(packet, start, end));
    }

    /**
     * Index of the '#' that closes the body. At least one checksum character
     * must follow it.
     */
    private static int findTrailer(byte[] packet, int from)
    {
        for (int i = from; i < packet.length; i++) {
            if (packet[i] == RspEscaping.ESCAPE) {
                i++;
                continue;
            }
            if (packet[i] == '#' && i + 1 < packet.length) {
                return i;
            }
        }
        throw new RspFramingException("RSP packet has no '#' trailer");
    }
}
