package com.questrail.devicehub.device;

/**
 * Entry point for raw bytes bound for a device or another endpoint.
 * Used as the relay target of a linked peer.
 */
@FunctionalInterface
public interface PacketSink
{
    void send(byte[] raw);
}
