package com.questrail.devicehub.device;

import com.questrail.devicehub.bridge.BridgeException;
import com.questrail.devicehub.bridge.BridgeSpawnRequest;
import com.questrail.devicehub.bridge.BridgeSpawnException;
import com.questrail.devicehub.framing.FramingFamily;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static com.questrail.devicehub.device.DeviceActorFixture.WAIT_MS;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Device actor with the boot loader resident: RSP is exchanged as bare bytes.
 */
public class DeviceActorBootloaderTest
{
    private DeviceActorFixture fixture;
    private DeviceActorFixture.Started device;

    @BeforeEach
    void setUp() throws Exception {
        fixture = new DeviceActorFixture();
        device = fixture.start(DeviceActorFixture.descriptor("1-2", false)).awaitReady();
    }

    @AfterEach
    void tearDown() {
        device.actor.stop();
    }

    // ---------------------------------------------------------------------
    // Connection
    // ---------------------------------------------------------------------

    /**
     * Verifies that the bridge is spawned on the device's host with the tty
     * as the only argument.
     */
    @Test
    void bridgeIsSpawnedForTty() {
        List<BridgeSpawnRequest> requests = fixture.spawner.requests();
        assertEquals(1, requests.size());
        assertEquals("lab", requests.get(0).host());
        assertEquals("gdbstub_connect", requests.get(0).command());
        assertEquals(List.of("/dev/ttyACM0"), requests.get(0).args());
        assertTrue(device.bridge.started());
    }

    @Test
    void readyActorHasBoundDebugServerOnItsPort() throws Exception {
        assertSame(device.actor, device.ready.get());
        assertEquals(List.of(new DeviceActorFixture.Binding(DeviceIdentity.usbPort("lab", "1-2"), 12345)),
                fixture.bindings);
        assertEquals(DevicePhase.READY, device.actor.phase());
    }

    @Test
    void dumpShowsBootloaderStateAndMetadata() throws Exception {
        DeviceRecord record = device.actor.dump().get(WAIT_MS, TimeUnit.MILLISECONDS);

        assertEquals(DeviceMode.BOOTLOADER, record.mode());
        assertEquals(DevicePhase.READY, record.phase());
        assertEquals("uid-1", record.uid().orElseThrow());
        assertEquals(FramingFamily.RAW, record.decodeFamily());
        assertFalse(record.rspCallPending());
    }

    // ---------------------------------------------------------------------
    // RSP pass-through
    // ---------------------------------------------------------------------

    /**
     * Verifies that a bare ack is answered locally and never reaches the
     * device.
     */
    @Test
    void ackIsAnsweredWithoutTraffic() throws Exception {
        byte[] reply = device.actor.rspCall(ascii("+")).get(WAIT_MS, TimeUnit.MILLISECONDS);

        assertEquals(0, reply.length);
        assertTrue(device.bridge.writes().isEmpty());
    }

    /**
     * Verifies that the request is written verbatim and the reply, assembled
     * from several reads, is returned without modification.
     */
    @Test
    void requestIsWrittenVerbatimAndReplyAssembled() throws Exception {
        CompletableFuture<byte[]> reply = device.actor.rspCall(ascii("$g#67"));

        List<byte[]> writes = device.bridge.awaitWrites(1, WAIT_MS);
        assertEquals("$g#67", text(writes.get(0)));

        device.bridge.inject(ascii("+$00ff"));
        device.bridge.inject(ascii("#f"));
        device.bridge.inject(ascii("5"));

        assertEquals("+$00ff#f5", text(reply.get(WAIT_MS, TimeUnit.MILLISECONDS)));
        assertEquals(DeviceMode.BOOTLOADER, device.actor.mode());
    }

    @Test
    void consecutiveCallsAreServedInTurn() throws Exception {
        CompletableFuture<byte[]> first = device.actor.rspCall(ascii("$?#3f"));
        device.bridge.awaitWrites(1, WAIT_MS);
        device.bridge.inject(ascii("+$S05#b8"));
        assertEquals("+$S05#b8", text(first.get(WAIT_MS, TimeUnit.MILLISECONDS)));

        CompletableFuture<byte[]> second = device.actor.rspCall(ascii("$g#67"));
        device.bridge.awaitWrites(2, WAIT_MS);
        device.bridge.inject(ascii("+$OK#9a"));
        assertEquals("+$OK#9a", text(second.get(WAIT_MS, TimeUnit.MILLISECONDS)));
    }

    /**
     * Verifies that a second call while one is outstanding fails and takes
     * the actor down, failing the first call too.
     */
    @Test
    void concurrentCallTerminatesActor() throws Exception {
        CompletableFuture<byte[]> first = device.actor.rspCall(ascii("$g#67"));
        device.bridge.awaitWrites(1, WAIT_MS);

        CompletableFuture<byte[]> second = device.actor.rspCall(ascii("$?#3f"));

        ExecutionException e2 = assertThrows(ExecutionException.class,
                () -> second.get(WAIT_MS, TimeUnit.MILLISECONDS));
        assertInstanceOf(ConcurrentCallException.class, e2.getCause());

        ExecutionException e1 = assertThrows(ExecutionException.class,
                () -> first.get(WAIT_MS, TimeUnit.MILLISECONDS));
        assertInstanceOf(DeviceTerminatedException.class, e1.getCause());

        ExecutionException end = assertThrows(ExecutionException.class,
                () -> device.actor.termination().toCompletableFuture().get(WAIT_MS, TimeUnit.MILLISECONDS));
        assertInstanceOf(ConcurrentCallException.class, end.getCause());
        assertTrue(device.bridge.closed());
        assertEquals(DevicePhase.TERMINATED, device.actor.phase());
    }

    @Test
    void unansweredCallTimesOut() throws Exception {
        CompletableFuture<byte[]> reply = device.actor.rspCall(ascii("$g#67"));
        device.bridge.awaitWrites(1, WAIT_MS);

        fixture.expire(1, fixture.timing.bootloaderCallTimeout());

        ExecutionException e = assertThrows(ExecutionException.class,
                () -> reply.get(WAIT_MS, TimeUnit.MILLISECONDS));
        assertInstanceOf(CallTimeoutException.class, e.getCause());

        // The actor survives and accepts the next call.
        CompletableFuture<byte[]> next = device.actor.rspCall(ascii("$?#3f"));
        device.bridge.awaitWrites(2, WAIT_MS);
        device.bridge.inject(ascii("$S05#b8"));
        assertEquals("$S05#b8", text(next.get(WAIT_MS, TimeUnit.MILLISECONDS)));
    }

    // ---------------------------------------------------------------------
    // Mode switch
    // ---------------------------------------------------------------------

    /**
     * Verifies that a raw send switches to application mode, after which RSP
     * requests travel on the debug sub-channel.
     */
    @Test
    void rawSendSwitchesToApplicationMode() throws Exception {
        device.actor.send(ascii("boot app\n"));
        device.bridge.awaitWrites(1, WAIT_MS);

        DeviceRecord record = device.actor.dump().get(WAIT_MS, TimeUnit.MILLISECONDS);
        assertEquals(DeviceMode.APPLICATION, record.mode());

        CompletableFuture<byte[]> reply = device.actor.rspCall(ascii("$g#67"));
        List<byte[]> writes = device.bridge.awaitWrites(2, WAIT_MS);
        assertArrayEquals(Tag.prefix(Tag.DEBUG, ascii("$g#67")), writes.get(1));

        device.bridge.inject(Tag.prefix(Tag.DEBUG, ascii("+$OK#9a")));
        assertEquals("+$OK#9a", text(reply.get(WAIT_MS, TimeUnit.MILLISECONDS)));
    }

    // ---------------------------------------------------------------------
    // Termination
    // ---------------------------------------------------------------------

    @Test
    void bridgeExitTerminatesActor() throws Exception {
        CompletableFuture<byte[]> reply = device.actor.rspCall(ascii("$g#67"));
        device.bridge.awaitWrites(1, WAIT_MS);

        device.bridge.exit(1);

        ExecutionException end = assertThrows(ExecutionException.class,
                () -> device.actor.termination().toCompletableFuture().get(WAIT_MS, TimeUnit.MILLISECONDS));
        assertInstanceOf(BridgeException.class, end.getCause());
        ExecutionException e = assertThrows(ExecutionException.class, () -> reply.get(WAIT_MS, TimeUnit.MILLISECONDS));
        assertInstanceOf(DeviceTerminatedException.class, e.getCause());
    }

    @Test
    void stoppedActorRejectsCalls() throws Exception {
        device.actor.stop();
        device.actor.termination().toCompletableFuture().get(WAIT_MS, TimeUnit.MILLISECONDS);

        ExecutionException e = assertThrows(ExecutionException.class,
                () -> device.actor.rspCall(ascii("$g#67")).get(WAIT_MS, TimeUnit.MILLISECONDS));
        assertInstanceOf(DeviceTerminatedException.class, e.getCause());
        assertTrue(device.bridge.closed());
    }

    @Test
    void spawnFailureTerminatesActor() throws Exception {
        DeviceActorFixture failing = new DeviceActorFixture();
        failing.spawner.failNextSpawns();
        CompletableFuture<DeviceActor> ready = new CompletableFuture<>();
        DeviceActor actor = new DeviceActor(DeviceActorFixture.descriptor("1-3", false),
                failing.environment(), ready::complete);
        actor.start();

        ExecutionException end = assertThrows(ExecutionException.class,
                () -> actor.termination().toCompletableFuture().get(WAIT_MS, TimeUnit.MILLISECONDS));
        assertInstanceOf(BridgeSpawnException.class, end.getCause());
        assertFalse(ready.isDone());
        assertEquals(1, failing.sink.errors().size());
    }

    private static byte[] ascii(String s) {
        return s.getBytes(StandardCharsets.ISO_8859_1);
    }

    private static String text(byte[] b) {
        return new String(b, StandardCharsets.ISO_8859_1);
    }
}
