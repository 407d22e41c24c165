package com.questrail.devicehub.device;

import java.util.concurrent.CompletableFuture;

/**
 * Mailbox messages of a {@link DeviceActor}.
 *
 * <p>Messages posted after the actor terminated, or still queued when it
 * terminates, are rejected: messages carrying a reply future fail it.</p>
 */
sealed interface DeviceMessage
{
    /** Called instead of handling when the actor is gone. */
    default void reject(Throwable cause) {}

    record Connect() implements DeviceMessage {}

    record BridgeData(byte[] chunk) implements DeviceMessage {}

    record BridgeExited(int status) implements DeviceMessage {}

    record BridgeFailed(Throwable cause) implements DeviceMessage {}

    record MetadataReady(DeviceMetadata metadata) implements DeviceMessage {}

    record MetadataUnavailable(Throwable cause) implements DeviceMessage {}

    record RspCall(byte[] request, CompletableFuture<byte[]> reply) implements DeviceMessage {
        @Override
        public void reject(Throwable cause) {
            reply.completeExceptionally(cause);
        }
    }

    record RspCallTimeout(PendingRspCall call) implements DeviceMessage {}

    record CorrelatedCall(byte[] packet, CompletableFuture<byte[]> reply) implements DeviceMessage {
        @Override
        public void reject(Throwable cause) {
            reply.completeExceptionally(cause);
        }
    }

    record CorrelationTimeout(int token, PendingCorrelation call) implements DeviceMessage {}

    record Send(byte[] raw) implements DeviceMessage {}

    record SendPacket(byte[] packet) implements DeviceMessage {}

    record SetName(String name) implements DeviceMessage {}

    record SetForward(PacketHandler forward) implements DeviceMessage {}

    record SetPeer(PacketSink peer) implements DeviceMessage {}

    record Deliver(Object message) implements DeviceMessage {}

    record Dump(CompletableFuture<DeviceRecord> reply) implements DeviceMessage {
        @Override
        public void reject(Throwable cause) {
            reply.completeExceptionally(cause);
        }
    }

    /**
     * @param cause {@code null} for an orderly stop
     */
    record Stop(Throwable cause) implements DeviceMessage {}
}
