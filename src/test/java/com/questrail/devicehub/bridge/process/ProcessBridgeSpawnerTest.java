package com.questrail.devicehub.bridge.process;

import com.questrail.devicehub.bridge.BridgeChannel;
import com.questrail.devicehub.bridge.BridgeChannelListener;
import com.questrail.devicehub.bridge.BridgeSpawnException;
import com.questrail.devicehub.bridge.BridgeSpawnRequest;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class ProcessBridgeSpawnerTest
{
    private final ProcessBridgeSpawner spawner = new ProcessBridgeSpawner(Set.of("localhost", "bench"));

    // ---------------------------------------------------------------------
    // Command line
    // ---------------------------------------------------------------------

    @Test
    void localHostRunsCommandDirectly() {
        assertEquals(List.of("gdbstub_connect", "/dev/ttyACM0"),
                spawner.commandLine(new BridgeSpawnRequest("bench", "gdbstub_connect", List.of("/dev/ttyACM0"))));
    }

    /**
     * Verifies that a device on another host is reached through ssh.
     */
    @Test
    void remoteHostGoesThroughSsh() {
        assertEquals(List.of("ssh", "lab7", "gdbstub_connect", "/dev/ttyACM1"),
                spawner.commandLine(new BridgeSpawnRequest("lab7", "gdbstub_connect", List.of("/dev/ttyACM1"))));
    }

    @Test
    void localMachineIncludesLocalhost() {
        assertEquals(List.of("cat"),
                ProcessBridgeSpawner.forLocalMachine().commandLine(new BridgeSpawnRequest("localhost", "cat", List.of())));
    }

    // ---------------------------------------------------------------------
    // Process channel
    // ---------------------------------------------------------------------

    /**
     * Listener collecting output until the process exits.
     */
    private static final class Collector implements BridgeChannelListener {
        final ByteArrayOutputStream data = new ByteArrayOutputStream();
        final CompletableFuture<Integer> exit = new CompletableFuture<>();

        @Override
        public synchronized void onData(byte[] chunk) {
            data.writeBytes(chunk);
        }

        @Override
        public void onExit(int status) {
            exit.complete(status);
        }

        @Override
        public void onError(Throwable cause) {
            exit.completeExceptionally(cause);
        }

        synchronized String text() {
            return data.toString(StandardCharsets.ISO_8859_1);
        }
    }

    @Test
    void outputAndExitStatusAreReported() throws Exception {
        BridgeChannel channel = spawner.spawn(
                new BridgeSpawnRequest("localhost", "sh", List.of("-c", "printf 'hello'; exit 3")));
        Collector collector = new Collector();
        channel.setListener(collector);
        channel.start();

        assertEquals(3, collector.exit.get(5, TimeUnit.SECONDS));
        assertEquals("hello", collector.text());
    }

    @Test
    void writesReachTheProcess() throws Exception {
        BridgeChannel channel = spawner.spawn(
                new BridgeSpawnRequest("localhost", "head", List.of("-c", "4")));
        Collector collector = new Collector();
        channel.setListener(collector);
        channel.start();

        channel.write("ping".getBytes(StandardCharsets.ISO_8859_1));

        assertEquals(0, collector.exit.get(5, TimeUnit.SECONDS));
        assertEquals("ping", collector.text());
    }

    @Test
    void closedChannelReportsNothing() throws Exception {
        BridgeChannel channel = spawner.spawn(new BridgeSpawnRequest("localhost", "cat", List.of()));
        Collector collector = new Collector();
        channel.setListener(collector);
        channel.start();

        channel.close();

        Thread.sleep(200);
        assertFalse(collector.exit.isDone());
    }

    @Test
    void missingCommandFailsToSpawn() {
        assertThrows(BridgeSpawnException.class, () -> spawner.spawn(
                new BridgeSpawnRequest("localhost", "/nonexistent/bridge-command", List.of())));
    }
}
