package com.questrail.devicehub.transport.tcp;

import com.questrail.devicehub.device.DeviceIdentity;
import com.questrail.devicehub.observability.RecordingHubObservabilitySink;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.BindException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

public class DebugServerRegistryTest
{
    private static final DeviceIdentity DEVICE = DeviceIdentity.usbPort("lab", "1-2");

    /** Server whose start outcome is scripted by the test. */
    private static final class ScriptedServer implements DebugServer {
        final DeviceIdentity identity;
        final int port;
        final CompletableFuture<Integer> started = new CompletableFuture<>();
        boolean stopped;

        ScriptedServer(DeviceIdentity identity, int port) {
            this.identity = identity;
            this.port = port;
        }

        @Override
        public DeviceIdentity identity() {
            return identity;
        }

        @Override
        public CompletableFuture<Integer> start() {
            return started;
        }

        @Override
        public void stop() {
            stopped = true;
        }
    }

    private final List<ScriptedServer> created = new ArrayList<>();
    private RecordingHubObservabilitySink sink;
    private DebugServerRegistry registry;

    @BeforeEach
    void setUp() {
        sink = new RecordingHubObservabilitySink();
        registry = new DebugServerRegistry((identity, port) -> {
            ScriptedServer server = new ScriptedServer(identity, port);
            created.add(server);
            return server;
        }, sink, () -> Instant.EPOCH);
    }

    @Test
    void bindCreatesServerOnPort() {
        registry.bind(DEVICE, 19412);
        created.get(0).started.complete(19412);

        assertEquals(1, created.size());
        assertEquals(19412, created.get(0).port);
        assertSame(created.get(0), registry.server(DEVICE).orElseThrow());
        assertEquals("GDB remote access on TCP port 19412", sink.lifecycle().get(0).description());
    }

    /**
     * Verifies that a device re-attached under the same identity keeps its
     * listener instead of opening a second one.
     */
    @Test
    void secondBindReusesServer() {
        registry.bind(DEVICE, 19412);
        registry.bind(DEVICE, 19412);

        assertEquals(1, created.size());
    }

    @Test
    void bindFailureIsReportedAndForgotten() {
        registry.bind(DEVICE, 19412);
        created.get(0).started.completeExceptionally(new BindException("Address already in use"));

        assertTrue(registry.server(DEVICE).isEmpty());
        assertEquals(1, sink.errors().size());
        assertEquals("cannot listen on TCP port 19412", sink.errors().get(0).message());

        registry.bind(DEVICE, 19412);
        assertEquals(2, created.size());
    }

    @Test
    void stopAllStopsEveryServer() {
        registry.bind(DEVICE, 1);
        registry.bind(DeviceIdentity.usbPort("lab", "1-3"), 2);

        registry.stopAll();

        assertTrue(created.stream().allMatch(s -> s.stopped));
        assertTrue(registry.server(DEVICE).isEmpty());
    }
}
