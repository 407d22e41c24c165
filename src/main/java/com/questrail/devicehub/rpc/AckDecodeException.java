package com.questrail.devicehub.rpc;

/**
 * The ack blob echoed in a reply frame does not decode to a token.
 */
public final class AckDecodeException extends RuntimeException
{
    public AckDecodeException(String message, Throwable cause) {
        super(message, cause);
    }

    public AckDecodeException(String message) {
        super(message);
    }
}
