package com.questrail.testhost.protocol.tcp.transport.netty;

import com.questrail.testhost.protocol.tcp.transport.FrameServer;
import com.questrail.testhost.protocol.tcp.transport.FrameServerListener;
import com.questrail.testhost.protocol.tcp.transport.FrameTransportException;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * NettyFrameServer
 * =============================================================================
 * Netty-backed implementation of the {@link FrameServer} port.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>. It binds, accepts
 * one connection and hands it over as a {@link NettyFrameConnection}. It MUST NOT
 * interpret frames or send anything on its own.
 *
 * <h2>Single accept</h2>
 * The first accepted child channel wins; any later one is closed immediately,
 * and the listening channel is closed as soon as the first becomes active.
 *
 * <h2>Lifecycle</h2>
 * - {@link #bind} binds synchronously and returns the OS-chosen address.
 * - {@link #close()} closes the listening channel (unblocking a pending accept)
 *   and shuts down both event loop groups without waiting for them.
 */
public final class NettyFrameServer implements FrameServer
{
    private final InetAddress bindAddress;
    private final int backlog;
    private final int maxFrameLength;

    private final EventLoopGroup bossGroup;
    private final EventLoopGroup workerGroup;
    private final AtomicBoolean accepted = new AtomicBoolean();

    private volatile Channel serverChannel;

    /**
     * Dedicated single-threaded groups: one accept, one connection. The accept
     * callback may block on the engine's state lock while {@link #bind} is
     * still waiting on the boss loop, so the two must not share a thread.
     */
    public NettyFrameServer(InetAddress bindAddress, int backlog, int maxFrameLength)
    {
        this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress");
        this.backlog = backlog;
        this.maxFrameLength = maxFrameLength;

        this.bossGroup = new NioEventLoopGroup(1);
        this.workerGroup = new NioEventLoopGroup(1);
    }

    @Override
    public InetSocketAddress bind(FrameServerListener listener)
    {
        Objects.requireNonNull(listener, "listener");

        ServerBootstrap bootstrap = new ServerBootstrap()
                .group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .option(ChannelOption.SO_BACKLOG, backlog)
                .childOption(ChannelOption.AUTO_READ, false)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        if (!accepted.compareAndSet(false, true)) {
                            ch.close();
                            return;
                        }
                        NettyFrameConnection connection = new NettyFrameConnection(ch, maxFrameLength);
                        ch.pipeline().addLast("accept", new AcceptHandler(connection, listener));
                    }
                });

        ChannelFuture f = bootstrap.bind(new InetSocketAddress(bindAddress, 0));
        serverChannel = f.channel();

        if (!f.awaitUninterruptibly().isSuccess()) {
            throw new FrameTransportException("Cannot listen on " + bindAddress.getHostAddress(), f.cause());
        }
        return (InetSocketAddress) f.channel().localAddress();
    }

    @Override
    public void close()
    {
        Channel ch = serverChannel;
        if (ch != null) {
            ch.close();
        }

        bossGroup.shutdownGracefully(0, 1, TimeUnit.SECONDS);
        workerGroup.shutdownGracefully(0, 1, TimeUnit.SECONDS);
    }

    /**
     * AcceptHandler
     * -------------------------------------------------------------------------
     * One-shot handler: stops listening and reports the connection once the
     * child channel is active, then removes itself.
     */
    private final class AcceptHandler extends ChannelInboundHandlerAdapter
    {
        private final NettyFrameConnection connection;
        private final FrameServerListener listener;

        private AcceptHandler(NettyFrameConnection connection, FrameServerListener listener)
        {
            this.connection = connection;
            this.listener = listener;
        }

        @Override
        public void channelActive(ChannelHandlerContext ctx)
        {
            ctx.fireChannelActive();
            ctx.pipeline().remove(this);

            Channel ch = serverChannel;
            if (ch != null) {
                ch.close();
            }

            listener.onAccepted(connection);
        }
    }
}
