package com.questrail.devicehub.runtime;

import com.questrail.devicehub.bridge.BridgeSpawner;
import com.questrail.devicehub.bridge.process.ProcessBridgeSpawner;
import com.questrail.devicehub.config.HubConfig;
import com.questrail.devicehub.device.DeviceActor;
import com.questrail.devicehub.device.DeviceDescriptor;
import com.questrail.devicehub.device.DeviceEnvironment;
import com.questrail.devicehub.device.PacketHandler;
import com.questrail.devicehub.hub.DeviceActorFactory;
import com.questrail.devicehub.hub.DeviceAttached;
import com.questrail.devicehub.hub.HubRegistry;
import com.questrail.devicehub.hub.NotifyLineParser;
import com.questrail.devicehub.hub.SyslogTtyParser;
import com.questrail.devicehub.hub.TcpPortAllocator;
import com.questrail.devicehub.internal.time.MonotonicClock;
import com.questrail.devicehub.internal.time.ScheduledExecutorScheduler;
import com.questrail.devicehub.internal.time.SystemMonotonicClock;
import com.questrail.devicehub.internal.time.SystemWallClock;
import com.questrail.devicehub.internal.time.WallClock;
import com.questrail.devicehub.observability.HubObservabilitySink;
import com.questrail.devicehub.observability.NullObservabilitySink;
import com.questrail.devicehub.transport.tcp.DebugRequestDispatcher;
import com.questrail.devicehub.transport.tcp.DebugServerRegistry;
import com.questrail.devicehub.transport.tcp.netty.NettyDebugServerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * DeviceHubRuntime
 * =============================================================================
 * Composition root and lifecycle owner for a production device hub: the
 * registry, the device actor environment, the debug TCP servers and the
 * executors behind them.
 */
public final class DeviceHubRuntime
{
    private final HubRegistry registry;
    private final DebugServerRegistry servers;
    private final NettyDebugServerFactory serverFactory;
    private final ScheduledExecutorService schedulerExecutor;
    private final ExecutorService helperExecutor;
    private final String syslogHost;

    private DeviceHubRuntime(HubRegistry registry,
                             DebugServerRegistry servers,
                             NettyDebugServerFactory serverFactory,
                             ScheduledExecutorService schedulerExecutor,
                             ExecutorService helperExecutor,
                             String syslogHost)
    {
        this.registry = registry;
        this.servers = servers;
        this.serverFactory = serverFactory;
        this.schedulerExecutor = schedulerExecutor;
        this.helperExecutor = helperExecutor;
        this.syslogHost = syslogHost;
    }

    public void start()
    {
        registry.start();
    }

    public void stop()
    {
        registry.stop();
        servers.stopAll();
        serverFactory.shutdown();
        shutdown(helperExecutor);
        shutdown(schedulerExecutor);
    }

    public HubRegistry registry()
    {
        return registry;
    }

    public CompletableFuture<DeviceActor> deviceAttached(DeviceAttached event)
    {
        return registry.deviceAttached(event);
    }

    /**
     * Feeds one line from a discovery source: a udev notify line, or a kernel
     * log line announcing a CDC ACM device on the configured syslog host.
     *
     * @return the attach in progress, or empty if the line announces nothing
     */
    public Optional<CompletableFuture<DeviceActor>> onDiscoveryLine(String line)
    {
        Optional<DeviceAttached> event = NotifyLineParser.parse(line)
                .or(() -> SyslogTtyParser.parse(line).map(m -> m.attachedOn(syslogHost)));
        return event.map(registry::deviceAttached);
    }

    private static void shutdown(ExecutorService executor)
    {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public static Builder builder()
    {
        return new Builder();
    }

    public static final class Builder
    {
        private HubConfig config = HubConfig.defaults();
        private BridgeSpawner spawner;
        private HubObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private Function<DeviceDescriptor, PacketHandler> handlerFactory = d -> PacketHandler.DEFAULT;
        private String syslogHost = "localhost";

        public Builder withConfig(HubConfig config) {
            this.config = config;
            return this;
        }

        /**
         * Defaults to running the bridge command as a local process, or
         * through ssh for remote hosts.
         */
        public Builder withSpawner(BridgeSpawner spawner) {
            this.spawner = spawner;
            return this;
        }

        public Builder withObservabilitySink(HubObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withHandlerFactory(Function<DeviceDescriptor, PacketHandler> handlerFactory) {
            this.handlerFactory = handlerFactory;
            return this;
        }

        /** Host that kernel log lines fed to the runtime come from. */
        public Builder withSyslogHost(String syslogHost) {
            this.syslogHost = syslogHost;
            return this;
        }

        public DeviceHubRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(observabilitySink, "observabilitySink");
            Objects.requireNonNull(syslogHost, "syslogHost");
            BridgeSpawner bridgeSpawner = spawner != null ? spawner : ProcessBridgeSpawner.forLocalMachine();

            // 1. Time
            MonotonicClock clock = SystemMonotonicClock.INSTANCE;
            WallClock wallClock = SystemWallClock.INSTANCE;
            ScheduledExecutorService schedulerExec = Executors.newScheduledThreadPool(1, daemon("hub-timer"));
            ExecutorService helperExec = Executors.newCachedThreadPool(daemon("device-helper"));

            // 2. Debug servers. They dispatch into the registry, which does not
            //    exist yet; the reference is filled in below.
            AtomicReference<HubRegistry> registryRef = new AtomicReference<>();
            DebugRequestDispatcher dispatcher = (identity, request) -> registryRef.get().dispatch(identity, request);
            NettyDebugServerFactory serverFactory = new NettyDebugServerFactory(
                    config.bindHost(), dispatcher, config.timingPolicy().tcpDispatchTimeout(),
                    observabilitySink, wallClock);
            DebugServerRegistry servers = new DebugServerRegistry(serverFactory, observabilitySink, wallClock);

            // 3. Device actors
            DeviceEnvironment env = DeviceEnvironment.builder()
                    .withSpawner(bridgeSpawner)
                    .withBridgeCommand(config.bridgeCommand())
                    .withTimingPolicy(config.timingPolicy())
                    .withClock(clock)
                    .withScheduler(new ScheduledExecutorScheduler(schedulerExec, clock))
                    .withWallClock(wallClock)
                    .withHelperExecutor(helperExec)
                    .withServerBinder(servers)
                    .withHandlerFactory(handlerFactory)
                    .withObservabilitySink(observabilitySink)
                    .build();

            // 4. Registry
            HubRegistry registry = new HubRegistry(
                    DeviceActorFactory.of(env),
                    new TcpPortAllocator(config.basePort()),
                    config.timingPolicy(),
                    observabilitySink,
                    wallClock);
            registryRef.set(registry);

            return new DeviceHubRuntime(registry, servers, serverFactory, schedulerExec, helperExec, syslogHost);
        }

        private static ThreadFactory daemon(String name) {
            return runnable -> {
                Thread t = new Thread(runnable, name);
                t.setDaemon(true);
                return t;
            };
        }
    }
}
