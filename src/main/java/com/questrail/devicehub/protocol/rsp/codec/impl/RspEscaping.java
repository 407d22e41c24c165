package com.questrail.devicehub.protocol.rsp.codec.impl;

import java.util.Arrays;

/**
 * RspEscaping
 * -----------------------------------------------------------------------------
 * Escapes and unescapes the reserved RSP characters.
 *
 * <p>Each of {@code # $ } *} is transmitted as the escape marker {@code }}
 * followed by the unmodified character. Unescaping drops each marker and
 * passes the byte after it through. A marker at the very end of the input is
 * kept as is.</p>
 */
final class RspEscaping
{
    static final byte ESCAPE = '}';

    private RspEscaping() {}

    static boolean isReserved(byte b)
    {
        return b == '#' || b == '$' || b == '}' || b == '*';
    }

    static byte[] escape(byte[] raw)
    {
        int reserved = 0;
        for (byte b : raw) {
            if (isReserved(b)) {
                reserved++;
            }
        }
        if (reserved == 0) {
            return raw.clone();
        }

        byte[] out = new byte[raw.length + reserved];
        int w = 0;
        for (byte b : raw) {
            if (isReserved(b)) {
                out[w++] = ESCAPE;
            }
            out[w++] = b;
        }
        return out;
    }

    static byte[] unescape(byte[] escaped)
    {
        byte[] out = new byte[escaped.length];
        int w = 0;

        for (int r = 0; r < escaped.length; r++) {
            if (escaped[r] == ESCAPE && r + 1 < escaped.length) {
                r++;
            }
            out[w++] = escaped[r];
        }

        return (w == out.length) ? out : Arrays.copyOf(out, w);
    }
}
