package com.questrail.devicehub.device;

import com.questrail.devicehub.bridge.BridgeChannel;
import com.questrail.devicehub.bridge.BridgeChannelListener;
import com.questrail.devicehub.bridge.BridgeException;
import com.questrail.devicehub.bridge.BridgeSpawnException;
import com.questrail.devicehub.bridge.BridgeSpawnRequest;
import com.questrail.devicehub.framing.DecodeResult;
import com.questrail.devicehub.framing.FrameDecoder;
import com.questrail.devicehub.framing.FrameEncoder;
import com.questrail.devicehub.framing.FramingException;
import com.questrail.devicehub.framing.FramingFamily;
import com.questrail.devicehub.framing.Framings;
import com.questrail.devicehub.observability.DeviceLifecycleEvent;
import com.questrail.devicehub.observability.HubErrorEvent;
import com.questrail.devicehub.observability.HubWarningEvent;
import com.questrail.devicehub.protocol.rsp.RspPacketAssembler;
import com.questrail.devicehub.rpc.AckCodec;
import com.questrail.devicehub.rpc.CorrelationTable;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * DeviceActor
 * =============================================================================
 * Companion of one physical device. Owns the bridging channel to the device's
 * serial line, the framing state, the tag dispatcher and the correlation
 * table.
 *
 * <h2>Threading Model</h2>
 * The actor runs a single thread draining a mailbox. Every public method only
 * posts a message and, where there is an answer, returns a future. Nothing
 * inside the actor is touched from any other thread, so no locking is needed
 * beyond the mailbox itself.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   DISCOVERED → CONNECTING → AWAITING_METADATA → READY → TERMINATED
 * </pre>
 * <ul>
 *   <li>CONNECTING: the bridge is spawned. A spawn failure terminates the
 *       actor; there is no respawn here.</li>
 *   <li>AWAITING_METADATA: a helper thread asks the device for its uid and
 *       framing. Failure is logged and the actor continues without
 *       metadata.</li>
 *   <li>READY: the debug TCP listener is bound and the ready callback runs.</li>
 * </ul>
 * The actor terminates when the bridge exits or fails, when a handler throws,
 * when a second RSP call is issued while one is outstanding, or on
 * {@link #stop()}. Termination closes the bridge and fails every outstanding
 * future with {@link DeviceTerminatedException}; {@link #termination()}
 * completes exceptionally unless the actor was stopped.
 *
 * <h2>Modes</h2>
 * In {@link DeviceMode#BOOTLOADER} mode RSP requests are written to the bridge
 * verbatim and the reply is assembled from the raw byte stream. The first raw
 * send switches the device to {@link DeviceMode#APPLICATION} mode for good:
 * from then on RSP travels on the {@link Tag#DEBUG} sub-channel inside frames
 * of the negotiated framing.
 *
 * <h2>Frame routing</h2>
 * A decoded frame goes to the forward handler if one is set, else to the
 * linked peer if there is one, else to the device's default handler.
 */
public final class DeviceActor implements RspCaller, PacketSink
{
    private static final byte[] EMPTY = new byte[0];

    private final DeviceDescriptor descriptor;
    private final DeviceEnvironment env;
    private final Consumer<DeviceActor> onReady;
    private final PacketHandler defaultHandler;

    private final BlockingQueue<DeviceMessage> mailbox = new LinkedBlockingQueue<>();
    private final Object mailboxLock = new Object();
    private boolean accepting = true;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final CompletableFuture<Void> termination = new CompletableFuture<>();

    // Actor thread state.
    private final CorrelationTable<PendingCorrelation> correlations = new CorrelationTable<>();
    private final TagDispatcher dispatcher;
    private final Context context = new Context();

    private volatile DevicePhase phase = DevicePhase.DISCOVERED;
    private volatile DeviceMode mode;
    private volatile String name;
    private BridgeChannel bridge;
    private DeviceMetadata metadata;
    private FramingFamily decodeFamily;
    private FramingFamily encodeFamily;
    private FrameDecoder decoder;
    private FrameEncoder encoder;
    private byte[] rest = EMPTY;
    private PendingRspCall pendingCall;
    private PacketHandler forward;
    private PacketSink peer;

    /**
     * @param onReady called on the actor thread once the actor is ready
     */
    public DeviceActor(DeviceDescriptor descriptor, DeviceEnvironment env, Consumer<DeviceActor> onReady)
    {
        this.descriptor = Objects.requireNonNull(descriptor, "descriptor");
        this.env = Objects.requireNonNull(env, "env");
        this.onReady = Objects.requireNonNull(onReady, "onReady");
        this.defaultHandler = Objects.requireNonNull(env.handlerFactory().apply(descriptor), "default handler");

        // A running application is assumed to speak SLIP until it says otherwise.
        this.mode = descriptor.appRunning() ? DeviceMode.APPLICATION : DeviceMode.BOOTLOADER;
        bindFraming(descriptor.appRunning() ? FramingFamily.SLIP : FramingFamily.RAW,
                descriptor.appRunning() ? FramingFamily.SLIP : FramingFamily.RAW);

        this.dispatcher = new TagDispatcher(this::displayName, env.sink(), env.wallClock(),
                correlations, this::offerDebug);

        mailbox.offer(new DeviceMessage.Connect());
    }

    /**
     * Starts the actor thread. Idempotent.
     */
    public void start()
    {
        if (started.compareAndSet(false, true)) {
            Thread thread = new Thread(this::runEventLoop, "device " + identity());
            thread.setDaemon(true);
            thread.start();
        }
    }

    // ---------------------------------------------------------------------
    // Public surface: every method posts to the mailbox.
    // ---------------------------------------------------------------------

    /**
     * Issues one RSP request, in boot-loader or application style depending on
     * the current mode. A bare ack ({@code +}) completes with an empty reply
     * without touching the device.
     *
     * <p>Only one call may be outstanding. A second call terminates the
     * actor with {@link ConcurrentCallException}.</p>
     */
    @Override
    public CompletableFuture<byte[]> rspCall(byte[] request)
    {
        CompletableFuture<byte[]> reply = new CompletableFuture<>();
        post(new DeviceMessage.RspCall(request.clone(), reply));
        return reply;
    }

    /**
     * Correlated call: sends {@code packet || u8(ackLength) || ack} and
     * completes with the payload of the matching {@link Tag#REPLY} frame.
     */
    public CompletableFuture<byte[]> call(byte[] packet)
    {
        CompletableFuture<byte[]> reply = new CompletableFuture<>();
        post(new DeviceMessage.CorrelatedCall(packet.clone(), reply));
        return reply;
    }

    /**
     * Correlated call of a tagged request.
     */
    public CompletableFuture<byte[]> call(int tag, byte[] body)
    {
        return call(Tag.prefix(tag, body));
    }

    /**
     * Completes once the device answers a {@link Tag#PING} with an empty reply.
     */
    public CompletableFuture<Void> ping()
    {
        return call(Tag.PING, EMPTY).thenApply(reply -> {
            if (reply.length != 0) {
                throw new IllegalStateException("unexpected ping reply: " + TagDispatcher.render(reply));
            }
            return null;
        });
    }

    /**
     * Writes raw bytes to the device. Switches the device to application mode.
     */
    @Override
    public void send(byte[] raw)
    {
        post(new DeviceMessage.Send(raw.clone()));
    }

    /**
     * Encodes {@code packet} with the device's output framing and sends it.
     */
    public void sendPacket(byte[] packet)
    {
        post(new DeviceMessage.SendPacket(packet.clone()));
    }

    public void setName(String name)
    {
        post(new DeviceMessage.SetName(Objects.requireNonNull(name, "name")));
    }

    /**
     * Routes every decoded frame and delivered message to {@code forward}.
     * {@code null} removes the forward handler.
     */
    public void setForward(PacketHandler forward)
    {
        post(new DeviceMessage.SetForward(forward));
    }

    /**
     * Relays frames not taken by a forward handler to {@code peer}.
     * {@code null} removes the peer.
     */
    public void setPeer(PacketSink peer)
    {
        post(new DeviceMessage.SetPeer(peer));
    }

    /**
     * Makes this actor and {@code other} relay peers of each other. If one of
     * them terminates abnormally, the other terminates too.
     */
    public void link(DeviceActor other)
    {
        Objects.requireNonNull(other, "other");
        setPeer(other);
        other.setPeer(this);
        watchLinked(other, this);
        watchLinked(this, other);
    }

    /**
     * Hands an application message to the forward handler, or to the default
     * handler if there is none.
     */
    public void deliver(Object message)
    {
        post(new DeviceMessage.Deliver(Objects.requireNonNull(message, "message")));
    }

    public CompletableFuture<DeviceRecord> dump()
    {
        CompletableFuture<DeviceRecord> reply = new CompletableFuture<>();
        post(new DeviceMessage.Dump(reply));
        return reply;
    }

    /**
     * Orderly stop. Outstanding calls fail with {@link DeviceTerminatedException}.
     */
    public void stop()
    {
        post(new DeviceMessage.Stop(null));
    }

    /**
     * Completes when the actor has terminated: normally after {@link #stop()},
     * exceptionally with the cause otherwise.
     */
    public CompletionStage<Void> termination()
    {
        return termination.minimalCompletionStage();
    }

    public DeviceDescriptor descriptor()
    {
        return descriptor;
    }

    public DeviceIdentity identity()
    {
        return descriptor.identity();
    }

    public int tcpPort()
    {
        return descriptor.tcpPort();
    }

    public DevicePhase phase()
    {
        return phase;
    }

    public DeviceMode mode()
    {
        return mode;
    }

    @Override
    public String toString()
    {
        return "DeviceActor[" + displayName() + "]";
    }

    // ---------------------------------------------------------------------
    // Mailbox
    // ---------------------------------------------------------------------

    private void post(DeviceMessage message)
    {
        synchronized (mailboxLock) {
            if (accepting) {
                mailbox.offer(message);
                return;
            }
        }
        message.reject(new DeviceTerminatedException(identity() + " is terminated"));
    }

    private void runEventLoop()
    {
        while (phase != DevicePhase.TERMINATED) {
            final DeviceMessage message;
            try {
                message = mailbox.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                terminate(new DeviceTerminatedException("actor thread interrupted", e));
                return;
            }

            try {
                handle(message);
            } catch (RuntimeException e) {
                error("terminating: " + e.getMessage(), e);
                terminate(e);
            } catch (Error e) {
                error("terminating on fatal error: " + e, e);
                terminate(e);
                if (e instanceof VirtualMachineError && !(e instanceof StackOverflowError)) {
                    throw e;
                }
            }
        }
    }

    private void handle(DeviceMessage message)
    {
        if (message instanceof DeviceMessage.BridgeData m) {
            onBridgeData(m.chunk());
        } else if (message instanceof DeviceMessage.RspCall m) {
            onRspCall(m.request(), m.reply());
        } else if (message instanceof DeviceMessage.RspCallTimeout m) {
            onRspCallTimeout(m.call());
        } else if (message instanceof DeviceMessage.CorrelatedCall m) {
            onCorrelatedCall(m.packet(), m.reply());
        } else if (message instanceof DeviceMessage.CorrelationTimeout m) {
            onCorrelationTimeout(m.token(), m.call());
        } else if (message instanceof DeviceMessage.Send m) {
            sendRaw(m.raw());
        } else if (message instanceof DeviceMessage.SendPacket m) {
            sendEncoded(m.packet());
        } else if (message instanceof DeviceMessage.Connect) {
            onConnect();
        } else if (message instanceof DeviceMessage.MetadataReady m) {
            onMetadata(m.metadata());
        } else if (message instanceof DeviceMessage.MetadataUnavailable m) {
            warn("error getting meta info: " + m.cause());
            becomeReady();
        } else if (message instanceof DeviceMessage.BridgeExited m) {
            throw new BridgeException("bridge exited with status " + m.status());
        } else if (message instanceof DeviceMessage.BridgeFailed m) {
            throw new BridgeException("bridge failed", m.cause());
        } else if (message instanceof DeviceMessage.SetName m) {
            name = m.name();
        } else if (message instanceof DeviceMessage.SetForward m) {
            forward = m.forward();
        } else if (message instanceof DeviceMessage.SetPeer m) {
            peer = m.peer();
        } else if (message instanceof DeviceMessage.Deliver m) {
            (forward != null ? forward : defaultHandler).onMessage(context, m.message());
        } else if (message instanceof DeviceMessage.Dump m) {
            m.reply().complete(snapshot());
        } else if (message instanceof DeviceMessage.Stop m) {
            terminate(m.cause());
        }
    }

    // ---------------------------------------------------------------------
    // Connection and metadata
    // ---------------------------------------------------------------------

    private void onConnect()
    {
        transition(DevicePhase.CONNECTING, "connecting");
        final BridgeChannel channel;
        try {
            channel = env.spawner().spawn(new BridgeSpawnRequest(
                    identity().host(), env.bridgeCommand(), List.of(descriptor.ttyDevice())));
        } catch (BridgeSpawnException e) {
            error("cannot connect", e);
            terminate(e);
            return;
        }
        channel.setListener(new BridgeListener());
        bridge = channel;
        channel.start();

        transition(DevicePhase.AWAITING_METADATA, "connected, getting meta info");
        CompletableFuture
                .supplyAsync(() -> env.metadataProbe().probe(this), env.helperExecutor())
                .whenComplete((meta, err) -> post(err == null
                        ? new DeviceMessage.MetadataReady(meta)
                        : new DeviceMessage.MetadataUnavailable(unwrap(err))));
    }

    private void onMetadata(DeviceMetadata meta)
    {
        metadata = meta;
        bindFraming(resolveFamily(meta.decodeProtocol(), "decoder"),
                resolveFamily(meta.encodeProtocol(), "encoder"));
        lifecycle("uid " + meta.uid() + ", decode " + decodeFamily + ", encode " + encodeFamily);
        becomeReady();
    }

    private void becomeReady()
    {
        if (phase != DevicePhase.AWAITING_METADATA) {
            return;
        }
        transition(DevicePhase.READY, "ready, debug port " + tcpPort());
        env.serverBinder().bind(identity(), tcpPort());
        onReady.accept(this);
    }

    private FramingFamily resolveFamily(String protocol, String direction)
    {
        return FramingFamily.parse(protocol).orElseGet(() -> {
            warn("unknown " + direction + " " + protocol + ", using raw");
            return FramingFamily.RAW;
        });
    }

    private void bindFraming(FramingFamily decodeWith, FramingFamily encodeWith)
    {
        decodeFamily = decodeWith;
        encodeFamily = encodeWith;
        decoder = Framings.decoderFor(decodeWith);
        encoder = Framings.encoderFor(encodeWith);
    }

    // ---------------------------------------------------------------------
    // RSP calls
    // ---------------------------------------------------------------------

    private void onRspCall(byte[] request, CompletableFuture<byte[]> reply)
    {
        if (pendingCall != null) {
            ConcurrentCallException e = new ConcurrentCallException(identity());
            reply.completeExceptionally(e);
            throw e;
        }
        // The stubs do not expect acks.
        if (RspPacketAssembler.isAck(request)) {
            reply.complete(EMPTY);
            return;
        }

        PendingRspCall call = new PendingRspCall(mode, reply);
        pendingCall = call;
        if (call.mode() == DeviceMode.BOOTLOADER) {
            write(request);
        } else {
            writeEncoded(Tag.prefix(Tag.DEBUG, request));
        }
        call.armTimeout(env.scheduler().scheduleAfter(rspTimeout(call), env.clock(),
                () -> post(new DeviceMessage.RspCallTimeout(call))));
    }

    private void onRspCallTimeout(PendingRspCall call)
    {
        if (pendingCall != call) {
            return;
        }
        pendingCall = null;
        call.reply().completeExceptionally(new CallTimeoutException("RSP call", rspTimeout(call)));
    }

    private Duration rspTimeout(PendingRspCall call)
    {
        return call.mode() == DeviceMode.BOOTLOADER
                ? env.timingPolicy().bootloaderCallTimeout()
                : env.timingPolicy().applicationCallTimeout();
    }

    private boolean offerDebug(byte[] payload)
    {
        if (pendingCall == null) {
            return false;
        }
        feedPendingCall(payload);
        return true;
    }

    private void feedPendingCall(byte[] chunk)
    {
        PendingRspCall call = pendingCall;
        call.feed(chunk).ifPresent(reply -> {
            pendingCall = null;
            call.cancelTimeout();
            call.reply().complete(reply);
        });
    }

    // ---------------------------------------------------------------------
    // Correlated calls
    // ---------------------------------------------------------------------

    private void onCorrelatedCall(byte[] packet, CompletableFuture<byte[]> reply)
    {
        PendingCorrelation call = new PendingCorrelation(reply);
        int token = correlations.allocate(call);
        byte[] ack = AckCodec.encode(token);

        byte[] frame = Arrays.copyOf(packet, packet.length + 1 + ack.length);
        frame[packet.length] = (byte) ack.length;
        System.arraycopy(ack, 0, frame, packet.length + 1, ack.length);

        call.armTimeout(env.scheduler().scheduleAfter(env.timingPolicy().correlatedCallTimeout(), env.clock(),
                () -> post(new DeviceMessage.CorrelationTimeout(token, call))));
        sendEncoded(frame);
    }

    private void onCorrelationTimeout(int token, PendingCorrelation call)
    {
        if (correlations.release(token, call)) {
            call.fail(new CallTimeoutException("call with token " + token,
                    env.timingPolicy().correlatedCallTimeout()));
        }
    }

    // ---------------------------------------------------------------------
    // Outbound
    // ---------------------------------------------------------------------

    private void write(byte[] bytes)
    {
        bridge.write(bytes);
    }

    private void writeEncoded(byte[] packet)
    {
        write(encoder.encode(packet));
    }

    private void sendRaw(byte[] raw)
    {
        write(raw);
        if (mode != DeviceMode.APPLICATION) {
            mode = DeviceMode.APPLICATION;
            lifecycle("application mode");
        }
    }

    private void sendEncoded(byte[] packet)
    {
        sendRaw(encoder.encode(packet));
    }

    // ---------------------------------------------------------------------
    // Inbound
    // ---------------------------------------------------------------------

    private void onBridgeData(byte[] chunk)
    {
        // The boot loader speaks bare RSP: no framing, no tags.
        if (pendingCall != null && pendingCall.mode() == DeviceMode.BOOTLOADER) {
            feedPendingCall(chunk);
            return;
        }

        byte[] buffer = concat(rest, chunk);
        while (true) {
            final DecodeResult result;
            try {
                result = decoder.decode(buffer);
            } catch (FramingException e) {
                error("framing error, dropping " + buffer.length + " bytes", e);
                rest = EMPTY;
                return;
            }
            if (!(result instanceof DecodeResult.Complete complete)) {
                rest = buffer;
                return;
            }
            handleFrame(complete.frame());
            buffer = complete.rest();
        }
    }

    private void handleFrame(byte[] frame)
    {
        // Empty frames are artifacts of the framing.
        if (frame.length == 0) {
            return;
        }
        if (forward != null) {
            forward.onPacket(context, frame);
        } else if (peer != null) {
            peer.send(frame);
        } else {
            defaultHandler.onPacket(context, frame);
        }
    }

    // ---------------------------------------------------------------------
    // Termination
    // ---------------------------------------------------------------------

    private void terminate(Throwable cause)
    {
        if (phase == DevicePhase.TERMINATED) {
            return;
        }
        phase = DevicePhase.TERMINATED;

        List<DeviceMessage> leftovers = new ArrayList<>();
        synchronized (mailboxLock) {
            accepting = false;
            mailbox.drainTo(leftovers);
        }

        if (bridge != null) {
            bridge.close();
        }

        DeviceTerminatedException dead = cause == null
                ? new DeviceTerminatedException(identity() + " stopped")
                : new DeviceTerminatedException(identity() + " terminated", cause);
        if (pendingCall != null) {
            pendingCall.cancelTimeout();
            pendingCall.reply().completeExceptionally(dead);
            pendingCall = null;
        }
        correlations.drain().values().forEach(call -> call.fail(dead));
        leftovers.forEach(m -> m.reject(dead));

        lifecycle(cause == null ? "stopped" : "terminated: " + cause.getMessage());
        if (cause == null) {
            termination.complete(null);
        } else {
            termination.completeExceptionally(cause);
        }
    }

    private static void watchLinked(DeviceActor watched, DeviceActor watcher)
    {
        watched.termination().whenComplete((ignored, err) -> {
            if (err != null) {
                watcher.post(new DeviceMessage.Stop(new DeviceTerminatedException(
                        "linked peer " + watched.identity() + " terminated", err)));
            }
        });
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    private DeviceRecord snapshot()
    {
        return new DeviceRecord(
                descriptor,
                Optional.ofNullable(name),
                phase,
                mode,
                Optional.ofNullable(metadata),
                decodeFamily,
                encodeFamily,
                rest.length,
                correlations.size(),
                pendingCall != null,
                peer != null,
                forward != null);
    }

    private String displayName()
    {
        String n = name;
        return n == null ? identity().toString() : n + " " + identity();
    }

    private void transition(DevicePhase next, String description)
    {
        phase = next;
        lifecycle(description);
    }

    private void lifecycle(String description)
    {
        env.sink().onLifecycle(new DeviceLifecycleEvent(env.wallClock().now(), displayName(), description));
    }

    private void warn(String message)
    {
        env.sink().onWarning(new HubWarningEvent(env.wallClock().now(), displayName(), message));
    }

    private void error(String message, Throwable cause)
    {
        env.sink().onError(new HubErrorEvent(env.wallClock().now(), displayName(), message, cause));
    }

    private static Throwable unwrap(Throwable t)
    {
        return t instanceof CompletionException && t.getCause() != null ? t.getCause() : t;
    }

    private static byte[] concat(byte[] a, byte[] b)
    {
        if (a.length == 0) {
            return b;
        }
        byte[] out = Arrays.copyOf(a, a.length + b.length);
        System.arraycopy(b, 0, out, a.length, b.length);
        return out;
    }

    /**
     * Bridge callbacks arrive on the bridge's reader thread and are turned
     * into mailbox messages.
     */
    private final class BridgeListener implements BridgeChannelListener
    {
        @Override
        public void onData(byte[] chunk)
        {
            post(new DeviceMessage.BridgeData(chunk));
        }

        @Override
        public void onExit(int status)
        {
            post(new DeviceMessage.BridgeExited(status));
        }

        @Override
        public void onError(Throwable cause)
        {
            post(new DeviceMessage.BridgeFailed(cause));
        }
    }

    private final class Context implements DeviceContext
    {
        @Override
        public DeviceIdentity identity()
        {
            return DeviceActor.this.identity();
        }

        @Override
        public Optional<String> name()
        {
            return Optional.ofNullable(name);
        }

        @Override
        public DeviceMode mode()
        {
            return mode;
        }

        @Override
        public void send(byte[] raw)
        {
            sendRaw(raw);
        }

        @Override
        public void sendPacket(byte[] packet)
        {
            sendEncoded(packet);
        }

        @Override
        public void dispatchDefault(byte[] frame)
        {
            dispatcher.dispatch(frame);
        }

        @Override
        public void reportUnhandled(Object message)
        {
            warn("unhandled message: " + message);
        }
    }
}
