package com.questrail.devicehub.device;

import java.util.concurrent.CompletableFuture;

/**
 * Issues one RSP request against a device and completes with its reply.
 */
@FunctionalInterface
public interface RspCaller
{
    CompletableFuture<byte[]> rspCall(byte[] request);
}
