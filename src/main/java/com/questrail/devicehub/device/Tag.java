package com.questrail.devicehub.device;

import java.util.OptionalInt;

/**
 * Tag
 * -----------------------------------------------------------------------------
 * Two-byte big-endian sub-channel tags prefixing application-mode frames.
 *
 * <p>Tags from {@code 0xFFF0} up are reserved for the hub. Values below are
 * application defined.</p>
 */
public final class Tag
{
    /** Correlated call reply: {@code u8 ackLength, ack, payload}. */
    public static final int REPLY = 0xFFFC;
    /** Liveness probe; answered with an empty reply. */
    public static final int PING = 0xFFFB;
    /** RSP traffic relayed to and from the resident debug stub. */
    public static final int DEBUG = 0xFFFD;
    /** Log text from the device, newline separated. */
    public static final int INFO = 0xFFFE;

    private Tag() {}

    /**
     * @return the tag of {@code frame}, or empty if it is shorter than a tag
     */
    public static OptionalInt of(byte[] frame)
    {
        if (frame.length < 2) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(((frame[0] & 0xFF) << 8) | (frame[1] & 0xFF));
    }

    public static byte[] prefix(int tag, byte[] body)
    {
        if (tag < 0 || tag > 0xFFFF) {
            throw new IllegalArgumentException("tag out of range: " + tag);
        }
        byte[] out = new byte[2 + body.length];
        out[0] = (byte) (tag >>> 8);
        out[1] = (byte) tag;
        System.arraycopy(body, 0, out, 2, body.length);
        return out;
    }
}
