package com.questrail.devicehub.framing.impl;

import com.questrail.devicehub.framing.DecodeResult;
import com.questrail.devicehub.framing.FrameDecoder;
import com.questrail.devicehub.framing.FrameEncoder;
import com.questrail.devicehub.framing.FramingException;

import java.util.Arrays;

/**
 * Frames carrying an N-byte big-endian length header (N = 1, 2 or 4).
 */
public final class LengthPrefixedFraming implements FrameDecoder, FrameEncoder
{
    private final int headerBytes;

    public LengthPrefixedFraming(int headerBytes)
    {
        if (headerBytes != 1 && headerBytes != 2 && headerBytes != 4) {
            throw new IllegalArgumentException("length header must be 1, 2 or 4 bytes: " + headerBytes);
        }
        this.headerBytes = headerBytes;
    }

    @Override
    public DecodeResult decode(byte[] buffer)
    {
        if (buffer.length < headerBytes) {
            return DecodeResult.NEED_MORE;
        }

        long length = 0;
        for (int i = 0; i < headerBytes; i++) {
            length = (length << 8) | (buffer[i] & 0xFF);
        }
        if (length > Integer.MAX_VALUE - headerBytes) {
            throw new FramingException("frame length " + length + " exceeds supported size");
        }

        int end = headerBytes + (int) length;
        if (buffer.length < end) {
            return DecodeResult.NEED_MORE;
        }
        return new DecodeResult.Complete(
                Arrays.copyOfRange(buffer, headerBytes, end),
                Arrays.copyOfRange(buffer, end, buffer.length));
    }

    @Override
    public byte[] encode(byte[] frame)
    {
        long max = (headerBytes == 4) ? 0xFFFFFFFFL : (1L << (8 * headerBytes)) - 1;
        if (frame.length > max) {
            throw new FramingException("frame of " + frame.length + " bytes does not fit a "
                    + headerBytes + "-byte length header");
        }

        byte[] out = new byte[headerBytes + frame.length];
        long length = frame.length;
        for (int i = headerBytes - 1; i >= 0; i--) {
            out[i] = (byte) (length & 0xFF);
            length >>>= 8;
        }
        System.arraycopy(frame, 0, out, headerBytes, frame.length);
        return out;
    }
}
