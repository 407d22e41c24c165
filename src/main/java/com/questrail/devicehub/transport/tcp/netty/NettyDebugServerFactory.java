package com.questrail.devicehub.transport.tcp.netty;

import com.questrail.devicehub.device.DeviceIdentity;
import com.questrail.devicehub.internal.time.WallClock;
import com.questrail.devicehub.observability.HubObservabilitySink;
import com.questrail.devicehub.transport.tcp.DebugRequestDispatcher;
import com.questrail.devicehub.transport.tcp.DebugServer;
import com.questrail.devicehub.transport.tcp.DebugServerFactory;

import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;

import java.time.Duration;
import java.util.Objects;

/**
 * Creates {@link NettyDebugTcpServer}s sharing one pair of event loop groups.
 *
 * <p>The factory owns the groups; {@link #shutdown()} releases them after the
 * servers have been stopped.</p>
 */
public final class NettyDebugServerFactory implements DebugServerFactory, AutoCloseable
{
    private final String bindHost;
    private final DebugRequestDispatcher dispatcher;
    private final Duration dispatchTimeout;
    private final HubObservabilitySink sink;
    private final WallClock wallClock;

    private final EventLoopGroup bossGroup = new NioEventLoopGroup(1);
    private final EventLoopGroup workerGroup = new NioEventLoopGroup();

    public NettyDebugServerFactory(String bindHost,
                                   DebugRequestDispatcher dispatcher,
                                   Duration dispatchTimeout,
                                   HubObservabilitySink sink,
                                   WallClock wallClock)
    {
        this.bindHost = Objects.requireNonNull(bindHost, "bindHost");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.dispatchTimeout = Objects.requireNonNull(dispatchTimeout, "dispatchTimeout");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    @Override
    public DebugServer create(DeviceIdentity identity, int port)
    {
        return new NettyDebugTcpServer(identity, bindHost, port, bossGroup, workerGroup,
                dispatcher, dispatchTimeout, sink, wallClock);
    }

    public void shutdown()
    {
        bossGroup.shutdownGracefully();
        workerGroup.shutdownGracefully();
    }

    @Override
    public void close()
    {
        shutdown();
    }
}
