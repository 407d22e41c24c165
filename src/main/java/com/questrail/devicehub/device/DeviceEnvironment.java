package com.questrail.devicehub.device;

import com.questrail.devicehub.bridge.BridgeSpawner;
import com.questrail.devicehub.config.HubConfig;
import com.questrail.devicehub.config.HubTimingPolicy;
import com.questrail.devicehub.internal.time.MonotonicClock;
import com.questrail.devicehub.internal.time.MonotonicScheduler;
import com.questrail.devicehub.internal.time.SystemMonotonicClock;
import com.questrail.devicehub.internal.time.SystemWallClock;
import com.questrail.devicehub.internal.time.WallClock;
import com.questrail.devicehub.observability.HubObservabilitySink;
import com.questrail.devicehub.observability.NullObservabilitySink;

import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.function.Function;

/**
 * Collaborators shared by all device actors of one hub.
 *
 * @param spawner        starts bridging subprocesses
 * @param bridgeCommand  command run to reach a device's serial line
 * @param timingPolicy   call timeouts
 * @param clock          time base for timeouts
 * @param scheduler      arms timeouts
 * @param wallClock      timestamps for observability events
 * @param helperExecutor runs the metadata probe off the actor thread
 * @param serverBinder   starts the debug TCP listener of a ready device
 * @param metadataProbe  queries uid and framing of a connected device
 * @param handlerFactory picks the default packet handler per device
 * @param sink           observability
 */
public record DeviceEnvironment(
    BridgeSpawner spawner,
    String bridgeCommand,
    HubTimingPolicy timingPolicy,
    MonotonicClock clock,
    MonotonicScheduler scheduler,
    WallClock wallClock,
    Executor helperExecutor,
    DebugServerBinder serverBinder,
    MetadataProbe metadataProbe,
    Function<DeviceDescriptor, PacketHandler> handlerFactory,
    HubObservabilitySink sink
) {
    public DeviceEnvironment {
        Objects.requireNonNull(spawner, "spawner");
        Objects.requireNonNull(bridgeCommand, "bridgeCommand");
        Objects.requireNonNull(timingPolicy, "timingPolicy");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(scheduler, "scheduler");
        Objects.requireNonNull(wallClock, "wallClock");
        Objects.requireNonNull(helperExecutor, "helperExecutor");
        Objects.requireNonNull(serverBinder, "serverBinder");
        Objects.requireNonNull(metadataProbe, "metadataProbe");
        Objects.requireNonNull(handlerFactory, "handlerFactory");
        Objects.requireNonNull(sink, "sink");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private BridgeSpawner spawner;
        private String bridgeCommand = HubConfig.DEFAULT_BRIDGE_COMMAND;
        private HubTimingPolicy timingPolicy = HubTimingPolicy.defaults();
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        private MonotonicScheduler scheduler;
        private WallClock wallClock = SystemWallClock.INSTANCE;
        private Executor helperExecutor;
        private DebugServerBinder serverBinder = DebugServerBinder.NONE;
        private MetadataProbe metadataProbe;
        private Function<DeviceDescriptor, PacketHandler> handlerFactory = d -> PacketHandler.DEFAULT;
        private HubObservabilitySink sink = NullObservabilitySink.INSTANCE;

        public Builder withSpawner(BridgeSpawner spawner) {
            this.spawner = spawner;
            return this;
        }

        public Builder withBridgeCommand(String bridgeCommand) {
            this.bridgeCommand = bridgeCommand;
            return this;
        }

        public Builder withTimingPolicy(HubTimingPolicy timingPolicy) {
            this.timingPolicy = timingPolicy;
            return this;
        }

        public Builder withClock(MonotonicClock clock) {
            this.clock = clock;
            return this;
        }

        public Builder withScheduler(MonotonicScheduler scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        public Builder withWallClock(WallClock wallClock) {
            this.wallClock = wallClock;
            return this;
        }

        public Builder withHelperExecutor(Executor helperExecutor) {
            this.helperExecutor = helperExecutor;
            return this;
        }

        public Builder withServerBinder(DebugServerBinder serverBinder) {
            this.serverBinder = serverBinder;
            return this;
        }

        /**
         * Defaults to {@link RspMetadataProbe} bounded by the policy's
         * metadata timeout.
         */
        public Builder withMetadataProbe(MetadataProbe metadataProbe) {
            this.metadataProbe = metadataProbe;
            return this;
        }

        public Builder withHandlerFactory(Function<DeviceDescriptor, PacketHandler> handlerFactory) {
            this.handlerFactory = handlerFactory;
            return this;
        }

        public Builder withObservabilitySink(HubObservabilitySink sink) {
            this.sink = sink;
            return this;
        }

        public DeviceEnvironment build() {
            MetadataProbe probe = metadataProbe != null
                    ? metadataProbe
                    : new RspMetadataProbe(timingPolicy.metadataTimeout());
            return new DeviceEnvironment(spawner, bridgeCommand, timingPolicy, clock, scheduler,
                    wallClock, helperExecutor, serverBinder, probe, handlerFactory, sink);
        }
    }
}
