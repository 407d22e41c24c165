package com.questrail.devicehub.transport.tcp.netty;

import com.questrail.devicehub.device.DeviceIdentity;
import com.questrail.devicehub.internal.time.WallClock;
import com.questrail.devicehub.observability.DeviceLifecycleEvent;
import com.questrail.devicehub.observability.HubErrorEvent;
import com.questrail.devicehub.observability.HubObservabilitySink;
import com.questrail.devicehub.protocol.rsp.RspPacketAssembler;
import com.questrail.devicehub.transport.tcp.DebugRequestDispatcher;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.TimeUnit;

/**
 * RspConnectionHandler
 * -----------------------------------------------------------------------------
 * One debug client connection.
 *
 * <p>Requests are served strictly one at a time: while a request is with the
 * device, reading from the socket is paused and anything already read waits
 * in a queue. Replies are written back verbatim since the device sends
 * complete RSP packets. An empty reply (e.g. to a bare ack) writes nothing.</p>
 *
 * <p>A failed or timed-out dispatch closes the connection.</p>
 *
 * <p>All state is touched on the channel's event loop only.</p>
 */
final class RspConnectionHandler extends SimpleChannelInboundHandler<ByteBuf>
{
    private final DeviceIdentity identity;
    private final DebugRequestDispatcher dispatcher;
    private final Duration dispatchTimeout;
    private final HubObservabilitySink sink;
    private final WallClock wallClock;

    private final RspPacketAssembler assembler = new RspPacketAssembler();
    private final Deque<byte[]> requests = new ArrayDeque<>();
    private boolean busy;

    RspConnectionHandler(DeviceIdentity identity,
                         DebugRequestDispatcher dispatcher,
                         Duration dispatchTimeout,
                         HubObservabilitySink sink,
                         WallClock wallClock)
    {
        this.identity = identity;
        this.dispatcher = dispatcher;
        this.dispatchTimeout = dispatchTimeout;
        this.sink = sink;
        this.wallClock = wallClock;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx)
    {
        sink.onLifecycle(new DeviceLifecycleEvent(wallClock.now(), source(),
                "connection from " + ctx.channel().remoteAddress()));
        ctx.fireChannelActive();
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, ByteBuf msg)
    {
        // Copy out of the ByteBuf (containment rule).
        byte[] chunk = new byte[msg.readableBytes()];
        msg.getBytes(msg.readerIndex(), chunk);

        assembler.append(chunk).ifPresent(requests::addLast);
        serveNext(ctx);
    }

    private void serveNext(ChannelHandlerContext ctx)
    {
        if (busy || requests.isEmpty()) {
            return;
        }
        byte[] request = requests.removeFirst();
        busy = true;
        ctx.channel().config().setAutoRead(false);

        dispatcher.dispatch(identity, request)
                .orTimeout(dispatchTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((reply, err) -> ctx.executor().execute(() -> onReply(ctx, reply, err)));
    }

    private void onReply(ChannelHandlerContext ctx, byte[] reply, Throwable err)
    {
        busy = false;
        if (err != null) {
            sink.onError(new HubErrorEvent(wallClock.now(), source(), "dispatch failed, closing connection", err));
            requests.clear();
            ctx.close();
            return;
        }
        if (reply.length > 0) {
            ctx.writeAndFlush(Unpooled.wrappedBuffer(reply));
        }
        ctx.channel().config().setAutoRead(true);
        serveNext(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
    {
        sink.onError(new HubErrorEvent(wallClock.now(), source(), "connection error", cause));
        ctx.close();
    }

    private String source()
    {
        return "gdb " + identity;
    }
}
