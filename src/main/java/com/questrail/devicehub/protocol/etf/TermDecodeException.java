package com.questrail.devicehub.protocol.etf;

/**
 * Thrown when bytes are not a supported external-format term.
 */
public final class TermDecodeException extends RuntimeException
{
    public TermDecodeException(String message) {
        super(message);
    }
}
