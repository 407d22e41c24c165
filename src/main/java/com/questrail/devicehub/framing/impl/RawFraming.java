package com.questrail.devicehub.framing.impl;

import com.questrail.devicehub.framing.DecodeResult;
import com.questrail.devicehub.framing.FrameDecoder;
import com.questrail.devicehub.framing.FrameEncoder;

/**
 * No framing. Whatever is buffered is one frame; frames are written as is.
 */
public final class RawFraming implements FrameDecoder, FrameEncoder
{
    public static final RawFraming INSTANCE = new RawFraming();

    private static final byte[] EMPTY = new byte[0];

    private RawFraming() {}

    @Override
    public DecodeResult decode(byte[] buffer)
    {
        if (buffer.length == 0) {
            return DecodeResult.NEED_MORE;
        }
        return new DecodeResult.Complete(buffer.clone(), EMPTY);
    }

    @Override
    public byte[] encode(byte[] frame)
    {
        return frame.clone();
    }
}
