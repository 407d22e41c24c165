package com.questrail.devicehub.protocol.rsp.codec.impl;

/**
 * Thrown when a byte sequence does not have the {@code $...#xx} shape of an
 * RSP packet.
 */
public final class RspFramingException extends RuntimeException
{
    public RspFramingException(String message) {
        super(message);
    }
}
