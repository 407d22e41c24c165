package com.questrail.devicehub.device;

import com.questrail.devicehub.internal.time.Cancellable;
import com.questrail.devicehub.protocol.rsp.RspPacketAssembler;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * The single outstanding RSP call of a device actor. Reply chunks are
 * assembled here until a complete packet is available.
 *
 * <p>Instances are compared by identity: a timeout message names the call it
 * was armed for, so a stale timeout cannot hit a newer call.</p>
 */
final class PendingRspCall
{
    private final DeviceMode mode;
    private final CompletableFuture<byte[]> reply;
    private final RspPacketAssembler assembler = new RspPacketAssembler();
    private Cancellable timeout;

    PendingRspCall(DeviceMode mode, CompletableFuture<byte[]> reply)
    {
        this.mode = Objects.requireNonNull(mode, "mode");
        this.reply = Objects.requireNonNull(reply, "reply");
    }

    DeviceMode mode()
    {
        return mode;
    }

    CompletableFuture<byte[]> reply()
    {
        return reply;
    }

    void armTimeout(Cancellable timeout)
    {
        this.timeout = timeout;
    }

    /**
     * Feeds a chunk of reply data.
     *
     * @return the complete reply, once assembled
     */
    Optional<byte[]> feed(byte[] chunk)
    {
        return assembler.append(chunk);
    }

    void cancelTimeout()
    {
        if (timeout != null) {
            timeout.cancel();
        }
    }
}
