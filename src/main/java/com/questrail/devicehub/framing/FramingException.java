package com.questrail.devicehub.framing;

/**
 * Indicates a malformed byte stream (e.g. an invalid SLIP escape) or a frame
 * that the selected framing cannot carry.
 */
public final class FramingException extends RuntimeException
{
    public FramingException(String message) {
        super(message);
    }
}
