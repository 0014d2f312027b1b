package com.questrail.testhost.protocol.tcp.transport.netty;

import com.questrail.testhost.protocol.tcp.codec.EngineMessages;
import com.questrail.testhost.protocol.tcp.transport.FrameConnection;
import com.questrail.testhost.protocol.tcp.transport.FrameConnectionListener;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.DelimiterBasedFrameDecoder;

import java.net.SocketAddress;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * NettyFrameConnection
 * =============================================================================
 * Netty-backed implementation of the {@link FrameConnection} port.
 *
 * <h2>Pipeline</h2>
 * <pre>
 *   DelimiterBasedFrameDecoder (EOM, stripped)
 *        → InboundHandler (ByteBuf → byte[] → listener)
 * </pre>
 *
 * <h2>Netty containment rule</h2>
 * Netty types MUST NOT escape this package. Inbound frames are copied into
 * {@code byte[]}; write completion is exposed as {@link CompletableFuture}.
 *
 * <h2>Read gating</h2>
 * The channel is created with auto-read disabled; {@link #start} installs the
 * listener and only then turns reading on, so no frame can arrive before the
 * engine is ready for it.
 */
final class NettyFrameConnection implements FrameConnection
{
    private final Channel channel;
    private final AtomicBoolean started = new AtomicBoolean();
    private final AtomicBoolean terminated = new AtomicBoolean();

    private volatile FrameConnectionListener listener;

    /**
     * Wrap {@code channel} and install the framing handlers on its pipeline.
     * Must be called before the channel starts reading.
     */
    NettyFrameConnection(Channel channel, int maxFrameLength)
    {
        this.channel = Objects.requireNonNull(channel, "channel");

        ChannelPipeline p = channel.pipeline();
        p.addLast("frameDecoder", new DelimiterBasedFrameDecoder(
                maxFrameLength,
                true,
                Unpooled.wrappedBuffer(new byte[] { EngineMessages.END_OF_MESSAGE })));
        p.addLast("frameHandler", new InboundHandler());
    }

    @Override
    public void start(FrameConnectionListener listener)
    {
        Objects.requireNonNull(listener, "listener");
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("FrameConnection already started");
        }
        this.listener = listener;

        // Turning auto-read on issues the first read.
        channel.config().setAutoRead(true);
    }

    @Override
    public CompletableFuture<Void> send(byte[] frame)
    {
        Objects.requireNonNull(frame, "frame");

        // One buffer per frame: Netty serializes writeAndFlush calls per channel.
        return toCompletable(channel.writeAndFlush(Unpooled.copiedBuffer(frame)));
    }

    @Override
    public CompletableFuture<Void> flush()
    {
        // Writes complete in order, so an empty write completes after everything before it.
        return toCompletable(channel.writeAndFlush(Unpooled.EMPTY_BUFFER));
    }

    @Override
    public void close()
    {
        terminated.set(true);
        channel.close();
    }

    @Override
    public SocketAddress remoteAddress()
    {
        return channel.remoteAddress();
    }

    private static CompletableFuture<Void> toCompletable(ChannelFuture channelFuture)
    {
        CompletableFuture<Void> result = new CompletableFuture<>();
        channelFuture.addListener((ChannelFutureListener) future -> {
            if (future.isSuccess()) {
                result.complete(null);
            }
            else {
                result.completeExceptionally(future.cause());
            }
        });
        return result;
    }

    /**
     * InboundHandler
     * -------------------------------------------------------------------------
     * Receives delimited frames and forwards raw bytes to the port listener.
     */
    private final class InboundHandler extends SimpleChannelInboundHandler<ByteBuf>
    {
        @Override
        protected void channelRead0(ChannelHandlerContext ctx, ByteBuf frame)
        {
            FrameConnectionListener l = listener;
            if (l == null) {
                return;
            }

            // Copy the frame into a plain byte[] (Netty containment rule).
            byte[] bytes = new byte[frame.readableBytes()];
            frame.getBytes(frame.readerIndex(), bytes);

            l.onFrame(bytes);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            FrameConnectionListener l = listener;
            if (l != null && terminated.compareAndSet(false, true)) {
                l.onAbnormalTermination(cause);
            }
            ctx.close();
        }
    }
}
