package com.questrail.devicehub.hub;

import com.questrail.devicehub.device.DeviceActor;
import com.questrail.devicehub.device.DeviceIdentity;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Mailbox messages of the {@link HubRegistry}.
 */
sealed interface HubMessage
{
    default void reject(Throwable cause) {}

    record Attached(DeviceAttached event, CompletableFuture<DeviceActor> reply) implements HubMessage {
        @Override
        public void reject(Throwable cause) {
            reply.completeExceptionally(cause);
        }
    }

    record Up(DeviceActor actor) implements HubMessage {}

    /**
     * @param cause {@code null} if the actor was stopped
     */
    record Down(DeviceActor actor, Throwable cause) implements HubMessage {}

    record Query<T>(Function<Map<DeviceIdentity, DeviceActor>, T> query,
                    CompletableFuture<T> reply) implements HubMessage {
        @Override
        public void reject(Throwable cause) {
            reply.completeExceptionally(cause);
        }

        void run(Map<DeviceIdentity, DeviceActor> devices) {
            reply.complete(query.apply(devices));
        }
    }
}
