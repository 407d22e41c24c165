package com.questrail.devicehub.hub;

import com.questrail.devicehub.bridge.FakeBridgeChannel;
import com.questrail.devicehub.bridge.FakeBridgeSpawner;
import com.questrail.devicehub.config.HubTimingPolicy;
import com.questrail.devicehub.device.DeviceActor;
import com.questrail.devicehub.device.DeviceEnvironment;
import com.questrail.devicehub.device.DeviceIdentity;
import com.questrail.devicehub.device.DeviceMetadata;
import com.questrail.devicehub.device.DevicePhase;
import com.questrail.devicehub.device.DeviceRecord;
import com.questrail.devicehub.observability.RecordingHubObservabilitySink;
import com.questrail.devicehub.time.DeterministicScheduler;
import com.questrail.devicehub.time.ManualMonotonicClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

public class HubRegistryTest
{
    private static final long WAIT_MS = 2000;
    private static final String DEV_PATH_A = "/devices/pci0000:00/usb1/1-2/1-2:1.0/tty/ttyACM0";
    private static final String DEV_PATH_B = "/devices/pci0000:00/usb1/1-3/1-3:1.0/tty/ttyACM1";

    private FakeBridgeSpawner spawner;
    private RecordingHubObservabilitySink sink;
    private TcpPortAllocator ports;
    private HubRegistry registry;

    @BeforeEach
    void setUp() {
        ManualMonotonicClock clock = new ManualMonotonicClock();
        spawner = new FakeBridgeSpawner();
        sink = new RecordingHubObservabilitySink();
        ports = new TcpPortAllocator(10000);

        DeviceEnvironment env = DeviceEnvironment.builder()
                .withSpawner(spawner)
                .withTimingPolicy(HubTimingPolicy.uniform(Duration.ofSeconds(2)))
                .withClock(clock)
                .withScheduler(new DeterministicScheduler(clock))
                .withWallClock(() -> Instant.EPOCH)
                .withHelperExecutor(Runnable::run)
                // uid derived from the USB port so tests can tell devices apart
                .withMetadataProbe(device -> new DeviceMetadata(
                        "uid-" + ((DeviceActor) device).identity().location(), "raw", DeviceMetadata.UNKNOWN))
                .withObservabilitySink(sink)
                .build();

        registry = new HubRegistry(DeviceActorFactory.of(env), ports,
                HubTimingPolicy.uniform(Duration.ofSeconds(2)), sink, () -> Instant.EPOCH);
        registry.start();
    }

    @AfterEach
    void tearDown() {
        registry.stop();
    }

    // ---------------------------------------------------------------------
    // Attach
    // ---------------------------------------------------------------------

    @Test
    void attachRegistersAndStartsActor() throws Exception {
        DeviceActor actor = attach(DeviceAttached.of("lab", "/dev/ttyACM0", DEV_PATH_A));

        DeviceIdentity id = DeviceIdentity.usbPort("lab", "1-2");
        assertEquals(id, actor.identity());
        assertEquals(Set.of(id), registry.identities());
        assertSame(actor, registry.device(id).orElseThrow());
        assertEquals(ports.port("lab", DEV_PATH_A), actor.tcpPort());
        assertNotNull(spawner.awaitChannel(WAIT_MS));
    }

    /**
     * Verifies that a repeated attach for the same identity returns the
     * registered actor and spawns nothing new.
     */
    @Test
    void attachIsIdempotent() throws Exception {
        DeviceActor first = attach(DeviceAttached.of("lab", "/dev/ttyACM0", DEV_PATH_A));
        DeviceActor second = attach(DeviceAttached.of("lab", "/dev/ttyACM0", DEV_PATH_A));

        assertSame(first, second);
        assertEquals(1, registry.devices().size());
        spawner.awaitChannel(WAIT_MS);
        assertEquals(1, spawner.requests().size());
    }

    @Test
    void appRunningIsPassedToActor() throws Exception {
        DeviceActor actor = attach(DeviceAttached.of("lab", "/dev/ttyACM0", DEV_PATH_A).withAppRunning(true));
        assertTrue(actor.descriptor().appRunning());
    }

    // ---------------------------------------------------------------------
    // Termination
    // ---------------------------------------------------------------------

    /**
     * Verifies that a terminated actor is removed and a later attach gets a
     * fresh actor.
     */
    @Test
    void terminatedActorIsDeregistered() throws Exception {
        DeviceActor first = attach(DeviceAttached.of("lab", "/dev/ttyACM0", DEV_PATH_A));
        FakeBridgeChannel bridge = spawner.awaitChannel(WAIT_MS);

        bridge.exit(1);

        assertTrue(eventually(() -> registry.identities().isEmpty()));
        assertEquals(DevicePhase.TERMINATED, first.phase());

        DeviceActor second = attach(DeviceAttached.of("lab", "/dev/ttyACM0", DEV_PATH_A));
        assertNotSame(first, second);
    }

    // ---------------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------------

    @Test
    void uidsAreSortedAndResolvable() throws Exception {
        DeviceActor b = attach(DeviceAttached.of("lab", "/dev/ttyACM1", DEV_PATH_B));
        DeviceActor a = attach(DeviceAttached.of("lab", "/dev/ttyACM0", DEV_PATH_A));

        assertTrue(eventually(() -> registry.uids().size() == 2));

        Map<String, DeviceActor> uids = registry.uids();
        assertEquals("uid-1-2", uids.keySet().iterator().next());
        assertSame(a, uids.get("uid-1-2"));
        assertSame(b, registry.findUid("uid-1-3").orElseThrow());
        assertTrue(registry.findUid("uid-9-9").isEmpty());
    }

    @Test
    void dumpOfUnknownDeviceIsEmpty() {
        assertTrue(registry.dump(DeviceIdentity.usbPort("lab", "4-4")).isEmpty());
    }

    @Test
    void dumpOfRegisteredDevice() throws Exception {
        DeviceActor actor = attach(DeviceAttached.of("lab", "/dev/ttyACM0", DEV_PATH_A));

        DeviceRecord record = registry.dump(actor.identity()).orElseThrow();

        assertEquals(actor.identity(), record.identity());
        assertEquals("/dev/ttyACM0", record.descriptor().ttyDevice());
    }

    // ---------------------------------------------------------------------
    // Debug request dispatch
    // ---------------------------------------------------------------------

    @Test
    void dispatchReachesDevice() throws Exception {
        DeviceActor actor = attach(DeviceAttached.of("lab", "/dev/ttyACM0", DEV_PATH_A));
        FakeBridgeChannel bridge = spawner.awaitChannel(WAIT_MS);
        assertTrue(eventually(() -> actor.phase() == DevicePhase.READY));

        CompletableFuture<byte[]> reply = registry.dispatch(actor.identity(), ascii("$g#67"));
        assertEquals("$g#67", new String(bridge.awaitWrites(1, WAIT_MS).get(0), StandardCharsets.ISO_8859_1));
        bridge.inject(ascii("+$00#60"));

        assertArrayEquals(ascii("+$00#60"), reply.get(WAIT_MS, TimeUnit.MILLISECONDS));
    }

    @Test
    void dispatchToUnknownDeviceFails() {
        CompletableFuture<byte[]> reply = registry.dispatch(DeviceIdentity.usbPort("lab", "7-7"), ascii("$g#67"));

        ExecutionException e = assertThrows(ExecutionException.class, () -> reply.get(WAIT_MS, TimeUnit.MILLISECONDS));
        assertInstanceOf(UnknownDeviceException.class, e.getCause());
    }

    // ---------------------------------------------------------------------
    // Stop
    // ---------------------------------------------------------------------

    @Test
    void stopStopsEveryActor() throws Exception {
        DeviceActor actor = attach(DeviceAttached.of("lab", "/dev/ttyACM0", DEV_PATH_A));

        registry.stop();

        actor.termination().toCompletableFuture().get(WAIT_MS, TimeUnit.MILLISECONDS);
        ExecutionException e = assertThrows(ExecutionException.class,
                () -> registry.deviceAttached(DeviceAttached.of("lab", "/dev/ttyACM1", DEV_PATH_B))
                        .get(WAIT_MS, TimeUnit.MILLISECONDS));
        assertInstanceOf(IllegalStateException.class, e.getCause());
    }

    // ---------------------------------------------------------------------
    // Event loop
    // ---------------------------------------------------------------------

    /**
     * Verifies that a stray interrupt of the registry thread is reported and
     * the thread goes back to waiting for messages.
     */
    @Test
    void strayInterruptKeepsRegistryServing() throws Exception {
        Thread loop = Thread.getAllStackTraces().keySet().stream()
                .filter(t -> t.getName().equals("device-hub") && t.isAlive())
                .findFirst()
                .orElseThrow();

        loop.interrupt();

        assertTrue(sink.awaitWarning(w -> w.message().startsWith("registry thread interrupted"), WAIT_MS));
        assertTrue(eventually(() -> loop.getState() == Thread.State.WAITING));

        DeviceActor actor = attach(DeviceAttached.of("lab", "/dev/ttyACM0", DEV_PATH_A));
        assertEquals(Set.of(actor.identity()), registry.identities());
    }

    private DeviceActor attach(DeviceAttached event) throws Exception {
        return registry.deviceAttached(event).get(WAIT_MS, TimeUnit.MILLISECONDS);
    }

    private static boolean eventually(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(WAIT_MS);
        while (System.nanoTime() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            Thread.sleep(10);
        }
        return condition.getAsBoolean();
    }

    private static byte[] ascii(String s) {
        return s.getBytes(StandardCharsets.ISO_8859_1);
    }
}
