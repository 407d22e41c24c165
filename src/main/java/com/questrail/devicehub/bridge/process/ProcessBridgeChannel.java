package com.questrail.devicehub.bridge.process;

import com.questrail.devicehub.bridge.BridgeChannel;
import com.questrail.devicehub.bridge.BridgeChannelListener;
import com.questrail.devicehub.bridge.BridgeException;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Arrays;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * ProcessBridgeChannel
 * -----------------------------------------------------------------------------
 * {@link BridgeChannel} over the stdin/stdout of a child process.
 *
 * <p>A daemon reader thread pumps stdout into the listener. When stdout hits
 * end of stream the thread waits for the process and reports its exit status.
 * After {@link #close()} nothing more is reported.</p>
 */
final class ProcessBridgeChannel implements BridgeChannel
{
    private static final int READ_BUFFER_SIZE = 4096;

    private final Process process;
    private final String description;
    private final OutputStream stdin;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private volatile BridgeChannelListener listener;

    ProcessBridgeChannel(Process process, String description)
    {
        this.process = Objects.requireNonNull(process, "process");
        this.description = Objects.requireNonNull(description, "description");
        this.stdin = process.getOutputStream();
    }

    @Override
    public void setListener(BridgeChannelListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void start()
    {
        BridgeChannelListener l = listener;
        if (l == null) {
            throw new IllegalStateException("BridgeChannelListener must be set before start()");
        }
        if (started.compareAndSet(false, true)) {
            Thread reader = new Thread(() -> pump(l), "bridge-reader " + description);
            reader.setDaemon(true);
            reader.start();
        }
    }

    @Override
    public void write(byte[] bytes)
    {
        Objects.requireNonNull(bytes, "bytes");
        if (closed.get()) {
            throw new BridgeException("bridge closed: " + description);
        }
        try {
            synchronized (stdin) {
                stdin.write(bytes);
                stdin.flush();
            }
        } catch (IOException e) {
            throw new BridgeException("write to " + description + " failed", e);
        }
    }

    @Override
    public void close()
    {
        if (closed.compareAndSet(false, true)) {
            process.destroy();
        }
    }

    private void pump(BridgeChannelListener l)
    {
        byte[] buf = new byte[READ_BUFFER_SIZE];
        try (InputStream stdout = process.getInputStream()) {
            int n;
            while ((n = stdout.read(buf)) != -1) {
                if (n > 0 && !closed.get()) {
                    l.onData(Arrays.copyOf(buf, n));
                }
            }
            int status = process.waitFor();
            if (!closed.get()) {
                l.onExit(status);
            }
        } catch (IOException e) {
            if (!closed.get()) {
                l.onError(e);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
