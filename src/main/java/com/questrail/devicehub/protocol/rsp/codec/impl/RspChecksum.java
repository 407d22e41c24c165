package com.questrail.devicehub.protocol.rsp.codec.impl;

/**
 * RspChecksum
 * -----------------------------------------------------------------------------
 * Modulo-256 sum over the escaped payload, rendered as two lowercase hex
 * digits.
 */
final class RspChecksum
{
    private RspChecksum() {}

    static int compute(byte[] escaped)
    {
        int sum = 0;
        for (byte b : escaped) {
            sum += b & 0xFF;
        }
        return sum & 0xFF;
    }

    static String hex(byte[] escaped)
    {
        return String.format("%02x", compute(escaped));
    }
}
