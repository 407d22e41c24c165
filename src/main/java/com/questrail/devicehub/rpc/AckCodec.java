package com.questrail.devicehub.rpc;

import com.questrail.devicehub.protocol.etf.ExternalTerms;
import com.questrail.devicehub.protocol.etf.TermDecodeException;

/**
 * AckCodec
 * -----------------------------------------------------------------------------
 * Serializes correlation tokens into the opaque ack blob appended to a call
 * frame, and recovers them from the copy the device echoes in its reply.
 *
 * <p>Tokens are encoded as external-format integers. Firmware treats the blob
 * as opaque bytes and echoes it back unchanged.</p>
 */
public final class AckCodec
{
    private AckCodec() {}

    public static byte[] encode(int token)
    {
        if (token < 0) {
            throw new IllegalArgumentException("token must be >= 0: " + token);
        }
        return ExternalTerms.encodeInteger(token);
    }

    /**
     * @throws AckDecodeException if the blob is not a non-negative integer term
     */
    public static int decode(byte[] ack)
    {
        final Object term;
        try {
            term = ExternalTerms.decode(ack);
        } catch (TermDecodeException e) {
            throw new AckDecodeException("ack is not a term", e);
        }
        if (!(term instanceof Long value) || value < 0 || value > Integer.MAX_VALUE) {
            throw new AckDecodeException("ack is not a token: " + ExternalTerms.render(term));
        }
        return value.intValue();
    }
}
