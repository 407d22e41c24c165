package com.questrail.devicehub.transport.tcp.netty;

import com.questrail.devicehub.device.DeviceIdentity;
import com.questrail.devicehub.internal.time.WallClock;
import com.questrail.devicehub.observability.HubObservabilitySink;
import com.questrail.devicehub.transport.tcp.DebugRequestDispatcher;
import com.questrail.devicehub.transport.tcp.DebugServer;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.group.ChannelGroup;
import io.netty.channel.group.DefaultChannelGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.util.concurrent.GlobalEventExecutor;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * NettyDebugTcpServer
 * =============================================================================
 * Netty-backed implementation of the {@link DebugServer} port.
 *
 * <h2>Architectural Role</h2>
 * This class is a transport adapter. It reassembles RSP requests from the
 * socket and writes replies back; it does not interpret them. Requests are
 * handed to the {@link DebugRequestDispatcher} by device identity.
 *
 * <h2>Netty containment rule</h2>
 * Netty types do not escape this package. Requests and replies cross the
 * boundary as {@code byte[]}.
 *
 * <h2>Lifecycle</h2>
 * <ul>
 *   <li>{@link #start()} binds the listening socket.</li>
 *   <li>{@link #stop()} closes the listener and all accepted connections.
 *       The event loop groups belong to {@link NettyDebugServerFactory}.</li>
 * </ul>
 */
final class NettyDebugTcpServer implements DebugServer
{
    private final DeviceIdentity identity;
    private final InetSocketAddress bindAddress;
    private final ServerBootstrap bootstrap;
    private final ChannelGroup connections = new DefaultChannelGroup(GlobalEventExecutor.INSTANCE);

    private volatile Channel serverChannel;

    NettyDebugTcpServer(DeviceIdentity identity,
                        String bindHost,
                        int port,
                        EventLoopGroup bossGroup,
                        EventLoopGroup workerGroup,
                        DebugRequestDispatcher dispatcher,
                        Duration dispatchTimeout,
                        HubObservabilitySink sink,
                        WallClock wallClock)
    {
        this.identity = Objects.requireNonNull(identity, "identity");
        this.bindAddress = new InetSocketAddress(bindHost, port);

        this.bootstrap = new ServerBootstrap()
                .group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .option(ChannelOption.SO_REUSEADDR, true)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        connections.add(ch);
                        ch.pipeline().addLast(new RspConnectionHandler(
                                identity, dispatcher, dispatchTimeout, sink, wallClock));
                    }
                });
    }

    @Override
    public DeviceIdentity identity()
    {
        return identity;
    }

    @Override
    public CompletableFuture<Integer> start()
    {
        CompletableFuture<Integer> bound = new CompletableFuture<>();
        ChannelFuture f = bootstrap.bind(bindAddress);
        f.addListener((ChannelFutureListener) future -> {
            if (future.isSuccess()) {
                serverChannel = future.channel();
                bound.complete(((InetSocketAddress) future.channel().localAddress()).getPort());
            } else {
                bound.completeExceptionally(future.cause());
            }
        });
        return bound;
    }

    @Override
    public void stop()
    {
        Channel ch = serverChannel;
        if (ch != null) {
            ch.close();
        }
        connections.close();
    }
}
