package com.questrail.devicehub.framing.impl;

import com.questrail.devicehub.framing.DecodeResult;
import com.questrail.devicehub.framing.FrameDecoder;
import com.questrail.devicehub.framing.FrameEncoder;
import com.questrail.devicehub.framing.FramingException;

import java.io.ByteArrayOutputStream;
import java.util.Arrays;

/**
 * SlipFraming
 * -----------------------------------------------------------------------------
 * SLIP framing as used by the device applications.
 *
 * <ul>
 *   <li>{@code END} (192) terminates a frame. Encoded frames are also preceded
 *       by {@code END} to flush line noise; leading {@code END} bytes are
 *       skipped on decode since empty frames carry no meaning.</li>
 *   <li>{@code ESC} (219) followed by {@code ESC_END} (220) is a literal 192.</li>
 *   <li>{@code ESC} followed by {@code ESC_ESC} (221) is a literal 219.</li>
 *   <li>{@code ESC} at the very end of the buffer needs more data;
 *       {@code ESC} followed by anything else is a framing error.</li>
 * </ul>
 */
public final class SlipFraming implements FrameDecoder, FrameEncoder
{
    public static final SlipFraming INSTANCE = new SlipFraming();

    static final int END = 192;
    static final int ESC = 219;
    static final int ESC_END = 220;
    static final int ESC_ESC = 221;

    private SlipFraming() {}

    @Override
    public DecodeResult decode(byte[] buffer)
    {
        ByteArrayOutputStream frame = new ByteArrayOutputStream(buffer.length);

        int start = 0;
        while (start < buffer.length && (buffer[start] & 0xFF) == END) {
            start++;
        }

        for (int i = start; i < buffer.length; i++) {
            int b = buffer[i] & 0xFF;

            if (b == END) {
                return new DecodeResult.Complete(
                        frame.toByteArray(),
                        Arrays.copyOfRange(buffer, i + 1, buffer.length));
            }

            if (b != ESC) {
                frame.write(b);
                continue;
            }

            if (i + 1 >= buffer.length) {
                return DecodeResult.NEED_MORE;
            }

            int next = buffer[++i] & 0xFF;
            if (next == ESC_END) {
                frame.write(END);
            } else if (next == ESC_ESC) {
                frame.write(ESC);
            } else {
                throw new FramingException(String.format(
                        "invalid SLIP escape 0x%02X at offset %d", next, i));
            }
        }

        return DecodeResult.NEED_MORE;
    }

    @Override
    public byte[] encode(byte[] frame)
    {
        ByteArrayOutputStream out = new ByteArrayOutputStream(frame.length + 2);
        out.write(END);
        for (byte value : frame) {
            int b = value & 0xFF;
            if (b == END) {
                out.write(ESC);
                out.write(ESC_END);
            } else if (b == ESC) {
                out.write(ESC);
                out.write(ESC_ESC);
            } else {
                out.write(b);
            }
        }
        out.write(END);
        return out.toByteArray();
    }
}
