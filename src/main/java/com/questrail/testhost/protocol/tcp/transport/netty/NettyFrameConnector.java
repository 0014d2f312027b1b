package com.questrail.testhost.protocol.tcp.transport.netty;

import com.questrail.testhost.protocol.tcp.transport.FrameConnection;
import com.questrail.testhost.protocol.tcp.transport.FrameConnector;
import com.questrail.testhost.protocol.tcp.transport.FrameTransportException;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;

import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Netty-backed implementation of the {@link FrameConnector} port.
 *
 * <p>Owns a single-threaded event loop group shared by the connections it opens.
 * {@link #connect} blocks and must not be called from a Netty event loop.</p>
 */
public final class NettyFrameConnector implements FrameConnector
{
    private final int maxFrameLength;
    private final EventLoopGroup group;

    public NettyFrameConnector(int maxFrameLength)
    {
        this.maxFrameLength = maxFrameLength;
        this.group = new NioEventLoopGroup(1);
    }

    @Override
    public FrameConnection connect(InetSocketAddress remote)
    {
        Objects.requireNonNull(remote, "remote");

        AtomicReference<NettyFrameConnection> created = new AtomicReference<>();
        Bootstrap bootstrap = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.AUTO_READ, false)
                .option(ChannelOption.TCP_NODELAY, true)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        created.set(new NettyFrameConnection(ch, maxFrameLength));
                    }
                });

        ChannelFuture f = bootstrap.connect(remote).awaitUninterruptibly();
        if (!f.isSuccess()) {
            throw new FrameTransportException("Cannot connect to " + remote, f.cause());
        }
        return created.get();
    }

    @Override
    public void close()
    {
        group.shutdownGracefully(0, 1, TimeUnit.SECONDS);
    }
}
