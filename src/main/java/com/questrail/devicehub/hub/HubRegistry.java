package com.questrail.devicehub.hub;

import com.questrail.devicehub.config.HubTimingPolicy;
import com.questrail.devicehub.device.CallTimeoutException;
import com.questrail.devicehub.device.DeviceActor;
import com.questrail.devicehub.device.DeviceDescriptor;
import com.questrail.devicehub.device.DeviceIdentity;
import com.questrail.devicehub.device.DeviceRecord;
import com.questrail.devicehub.device.DeviceTerminatedException;
import com.questrail.devicehub.internal.time.WallClock;
import com.questrail.devicehub.observability.DeviceLifecycleEvent;
import com.questrail.devicehub.observability.HubErrorEvent;
import com.questrail.devicehub.observability.HubObservabilitySink;
import com.questrail.devicehub.observability.HubWarningEvent;
import com.questrail.devicehub.transport.tcp.DebugRequestDispatcher;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * HubRegistry
 * =============================================================================
 * Directory of device actors, keyed by {@link DeviceIdentity}.
 *
 * <h2>Threading Model</h2>
 * The identity to actor map is owned by a single registry thread. Attach
 * notifications, actor terminations and queries are all messages to that
 * thread; other components never see the map itself.
 *
 * <h2>Behavior</h2>
 * <ul>
 *   <li>Attach is idempotent: a second notification for a registered
 *       identity returns the existing actor.</li>
 *   <li>Every actor is watched through its termination future. When it
 *       terminates, for whatever reason, its entry is removed. There is no
 *       respawn; the device has to be attached again.</li>
 *   <li>Blocking queries are bounded by the hub query timeout.</li>
 * </ul>
 */
public final class HubRegistry implements DebugRequestDispatcher
{
    private static final String SOURCE = "hub";

    private final DeviceActorFactory actorFactory;
    private final TcpPortAllocator ports;
    private final HubTimingPolicy timingPolicy;
    private final HubObservabilitySink sink;
    private final WallClock wallClock;

    private final BlockingQueue<HubMessage> mailbox = new LinkedBlockingQueue<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Map<DeviceIdentity, DeviceActor> devices = new HashMap<>();

    private volatile Thread thread;

    public HubRegistry(DeviceActorFactory actorFactory,
                       TcpPortAllocator ports,
                       HubTimingPolicy timingPolicy,
                       HubObservabilitySink sink,
                       WallClock wallClock)
    {
        this.actorFactory = Objects.requireNonNull(actorFactory, "actorFactory");
        this.ports = Objects.requireNonNull(ports, "ports");
        this.timingPolicy = Objects.requireNonNull(timingPolicy, "timingPolicy");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    /**
     * Starts the registry thread. Idempotent.
     */
    public void start()
    {
        if (running.compareAndSet(false, true)) {
            thread = new Thread(this::runEventLoop, "device-hub");
            thread.setDaemon(true);
            thread.start();
        }
    }

    /**
     * Stops the registry thread and every registered actor.
     */
    public void stop()
    {
        if (running.compareAndSet(true, false)) {
            Thread t = thread;
            if (t != null) {
                t.interrupt();
                try {
                    t.join(5000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            // The registry thread is gone; the map is ours now.
            devices.values().forEach(DeviceActor::stop);
            devices.clear();

            List<HubMessage> leftovers = new ArrayList<>();
            mailbox.drainTo(leftovers);
            leftovers.forEach(m -> m.reject(new IllegalStateException("hub registry stopped")));
        }
    }

    // ---------------------------------------------------------------------
    // Device events
    // ---------------------------------------------------------------------

    /**
     * Registers and starts an actor for the device unless one is registered
     * under the same identity already.
     *
     * @return the registered actor, new or existing
     */
    public CompletableFuture<DeviceActor> deviceAttached(DeviceAttached event)
    {
        CompletableFuture<DeviceActor> reply = new CompletableFuture<>();
        post(new HubMessage.Attached(Objects.requireNonNull(event, "event"), reply));
        return reply;
    }

    // ---------------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------------

    public CompletableFuture<Optional<DeviceActor>> find(DeviceIdentity identity)
    {
        return query(map -> Optional.ofNullable(map.get(identity)));
    }

    /**
     * Resolves an identity to its current actor, waiting at most the hub query
     * timeout.
     */
    public Optional<DeviceActor> device(DeviceIdentity identity)
    {
        return await(find(identity), "device query");
    }

    public List<DeviceActor> devices()
    {
        return await(query(map -> List.copyOf(map.values())), "devices query");
    }

    public Set<DeviceIdentity> identities()
    {
        return await(query(map -> Set.copyOf(map.keySet())), "identities query");
    }

    /**
     * Snapshot of one device's state.
     */
    public Optional<DeviceRecord> dump(DeviceIdentity identity)
    {
        Optional<DeviceActor> actor = device(identity);
        if (actor.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(await(actor.get().dump(), "dump of " + identity));
    }

    /**
     * Devices that reported a uid, by uid. Devices that terminate while being
     * asked are left out.
     */
    public Map<String, DeviceActor> uids()
    {
        Map<DeviceActor, CompletableFuture<DeviceRecord>> dumps = new LinkedHashMap<>();
        for (DeviceActor actor : devices()) {
            dumps.put(actor, actor.dump());
        }

        Map<String, DeviceActor> byUid = new TreeMap<>();
        dumps.forEach((actor, dump) -> {
            try {
                dump.get(timingPolicy.hubQueryTimeout().toMillis(), TimeUnit.MILLISECONDS)
                        .uid()
                        .ifPresent(uid -> byUid.put(uid, actor));
            } catch (ExecutionException e) {
                if (!(e.getCause() instanceof DeviceTerminatedException)) {
                    warn("dump of " + actor.identity() + " failed: " + e.getCause());
                }
            } catch (TimeoutException e) {
                warn("dump of " + actor.identity() + " timed out");
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CompletionException(e);
            }
        });
        return Collections.unmodifiableMap(byUid);
    }

    public Optional<DeviceActor> findUid(String uid)
    {
        return Optional.ofNullable(uids().get(uid));
    }

    /**
     * Routes a debug request to the device's current actor.
     */
    @Override
    public CompletableFuture<byte[]> dispatch(DeviceIdentity identity, byte[] request)
    {
        return find(identity).thenCompose(actor -> actor
                .map(a -> a.rspCall(request))
                .orElseGet(() -> CompletableFuture.failedFuture(new UnknownDeviceException(identity))));
    }

    // ---------------------------------------------------------------------
    // Event loop
    // ---------------------------------------------------------------------

    private <T> CompletableFuture<T> query(Function<Map<DeviceIdentity, DeviceActor>, T> query)
    {
        CompletableFuture<T> reply = new CompletableFuture<>();
        post(new HubMessage.Query<>(query, reply));
        return reply;
    }

    private void post(HubMessage message)
    {
        if (running.get()) {
            mailbox.offer(message);
        } else {
            message.reject(new IllegalStateException("hub registry not running"));
        }
    }

    private void runEventLoop()
    {
        while (running.get()) {
            try {
                HubMessage message = mailbox.take();
                if (running.get()) {
                    handle(message);
                } else {
                    message.reject(new IllegalStateException("hub registry stopped"));
                }
            } catch (InterruptedException e) {
                // Expected during shutdown. take() has cleared the flag.
                if (running.get()) {
                    warn("registry thread interrupted while running, ignoring");
                }
            } catch (RuntimeException e) {
                sink.onError(new HubErrorEvent(wallClock.now(), SOURCE, "message processing error", e));
            } catch (Error e) {
                sink.onError(new HubErrorEvent(wallClock.now(), SOURCE, "fatal error processing message", e));
                if (e instanceof VirtualMachineError && !(e instanceof StackOverflowError)) {
                    throw e;
                }
            }
        }
    }

    private void handle(HubMessage message)
    {
        if (message instanceof HubMessage.Attached m) {
            onAttached(m.event(), m.reply());
        } else if (message instanceof HubMessage.Up m) {
            lifecycle("up: " + m.actor().identity());
        } else if (message instanceof HubMessage.Down m) {
            onDown(m.actor(), m.cause());
        } else if (message instanceof HubMessage.Query<?> m) {
            m.run(Collections.unmodifiableMap(devices));
        }
    }

    private void onAttached(DeviceAttached event, CompletableFuture<DeviceActor> reply)
    {
        DeviceIdentity identity = event.identity();
        DeviceActor existing = devices.get(identity);
        if (existing != null) {
            lifecycle("already have " + identity);
            reply.complete(existing);
            return;
        }

        int port = ports.port(event.host(), event.portKey());
        DeviceDescriptor descriptor = new DeviceDescriptor(
                identity, event.ttyDevice(), event.devPath(), port, event.appRunning());

        final DeviceActor actor;
        try {
            actor = actorFactory.create(descriptor, a -> post(new HubMessage.Up(a)));
        } catch (RuntimeException e) {
            reply.completeExceptionally(e);
            throw e;
        }
        devices.put(identity, actor);
        actor.termination().whenComplete((ignored, err) -> post(new HubMessage.Down(actor, err)));
        actor.start();

        lifecycle("adding " + identity + ", tty " + event.ttyDevice() + ", debug port " + port);
        reply.complete(actor);
    }

    private void onDown(DeviceActor actor, Throwable cause)
    {
        if (devices.remove(actor.identity(), actor)) {
            lifecycle("removed " + actor.identity()
                    + (cause == null ? "" : " (" + cause.getMessage() + ")"));
        } else {
            warn(actor + " not registered");
        }
    }

    private <T> T await(CompletableFuture<T> future, String what)
    {
        try {
            return future.get(timingPolicy.hubQueryTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new CallTimeoutException(what, timingPolicy.hubQueryTimeout());
        } catch (ExecutionException e) {
            throw new CompletionException(e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CompletionException(e);
        }
    }

    private void lifecycle(String description)
    {
        sink.onLifecycle(new DeviceLifecycleEvent(wallClock.now(), SOURCE, description));
    }

    private void warn(String message)
    {
        sink.onWarning(new HubWarningEvent(wallClock.now(), SOURCE, message));
    }
}
