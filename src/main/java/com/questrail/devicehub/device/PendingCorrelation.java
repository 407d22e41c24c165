package com.questrail.devicehub.device;

import com.questrail.devicehub.internal.time.Cancellable;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * A correlated call waiting in the correlation table.
 */
final class PendingCorrelation
{
    private final CompletableFuture<byte[]> reply;
    private Cancellable timeout;

    PendingCorrelation(CompletableFuture<byte[]> reply)
    {
        this.reply = Objects.requireNonNull(reply, "reply");
    }

    CompletableFuture<byte[]> reply()
    {
        return reply;
    }

    void armTimeout(Cancellable timeout)
    {
        this.timeout = timeout;
    }

    void complete(byte[] payload)
    {
        if (timeout != null) {
            timeout.cancel();
        }
        reply.complete(payload);
    }

    void fail(Throwable cause)
    {
        if (timeout != null) {
            timeout.cancel();
        }
        reply.completeExceptionally(cause);
    }
}
