package com.questrail.devicehub.protocol.rsp;

import java.util.Optional;

/**
 * Lowercase hex text helpers used by the RSP layer (checksums, monitor
 * command payloads, numeric arguments).
 */
public final class Hex
{
    private static final char[] DIGITS = "0123456789abcdef".toCharArray();

    private Hex() {}

    public static String encode(byte[] bytes)
    {
        StringBuilder sb = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) {
            sb.append(DIGITS[(b >> 4) & 0xF]).append(DIGITS[b & 0xF]);
        }
        return sb.toString();
    }

    /**
     * Decodes hex text of either case.
     *
     * @return the decoded bytes, or empty if the text has odd length or a
     *         non-hex character
     */
    public static Optional<byte[]> decode(CharSequence text)
    {
        if (text.length() % 2 != 0) {
            return Optional.empty();
        }
        byte[] out = new byte[text.length() / 2];
        for (int i = 0; i < out.length; i++) {
            int hi = Character.digit(text.charAt(2 * i), 16);
            int lo = Character.digit(text.charAt(2 * i + 1), 16);
            if (hi < 0 || lo < 0) {
                return Optional.empty();
            }
            out[i] = (byte) ((hi << 4) | lo);
        }
        return Optional.of(out);
    }
}
