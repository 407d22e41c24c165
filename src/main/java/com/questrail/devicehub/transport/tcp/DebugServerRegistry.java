package com.questrail.devicehub.transport.tcp;

import com.questrail.devicehub.device.DebugServerBinder;
import com.questrail.devicehub.device.DeviceIdentity;
import com.questrail.devicehub.internal.time.WallClock;
import com.questrail.devicehub.observability.DeviceLifecycleEvent;
import com.questrail.devicehub.observability.HubErrorEvent;
import com.questrail.devicehub.observability.HubObservabilitySink;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * DebugServerRegistry
 * =============================================================================
 * Keeps one {@link DebugServer} per device identity.
 *
 * <p>Servers outlive device actors: when a device comes back under a new
 * actor, {@link #bind} finds the existing listener and leaves it (and its
 * open connections) alone. A server whose bind failed is dropped so the next
 * {@link #bind} tries again. Port collisions are not resolved; they surface
 * as bind errors.</p>
 */
public final class DebugServerRegistry implements DebugServerBinder
{
    private final DebugServerFactory factory;
    private final HubObservabilitySink sink;
    private final WallClock wallClock;
    private final Map<DeviceIdentity, DebugServer> servers = new ConcurrentHashMap<>();

    public DebugServerRegistry(DebugServerFactory factory, HubObservabilitySink sink, WallClock wallClock)
    {
        this.factory = Objects.requireNonNull(factory, "factory");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    @Override
    public void bind(DeviceIdentity identity, int port)
    {
        Objects.requireNonNull(identity, "identity");
        DebugServer[] created = new DebugServer[1];
        servers.computeIfAbsent(identity, id -> created[0] = factory.create(id, port));
        DebugServer server = created[0];
        if (server == null) {
            return;
        }

        server.start().whenComplete((boundPort, err) -> {
            if (err == null) {
                sink.onLifecycle(new DeviceLifecycleEvent(wallClock.now(), identity.toString(),
                        "GDB remote access on TCP port " + boundPort));
            } else {
                servers.remove(identity, server);
                sink.onError(new HubErrorEvent(wallClock.now(), identity.toString(),
                        "cannot listen on TCP port " + port, err));
            }
        });
    }

    public Optional<DebugServer> server(DeviceIdentity identity)
    {
        return Optional.ofNullable(servers.get(identity));
    }

    /**
     * Stops every server.
     */
    public void stopAll()
    {
        servers.values().forEach(DebugServer::stop);
        servers.clear();
    }
}
