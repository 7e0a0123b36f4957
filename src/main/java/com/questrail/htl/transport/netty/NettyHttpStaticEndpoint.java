package com.questrail.htl.transport.netty;

import com.questrail.htl.transport.StaticEndpoint;
import com.questrail.htl.transport.StaticRequestListener;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;

import java.net.InetSocketAddress;
import java.util.Objects;

/**
 * NettyHttpStaticEndpoint
 * =============================================================================
 * Netty-backed implementation of the {@link StaticEndpoint} port.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>. It MUST NOT look up
 * routes, read files or parse HTL; all of that happens behind the
 * {@link StaticRequestListener}.
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code Channel}, {@code EventLoopGroup}, {@code ByteBuf})
 * MUST NOT escape this package.
 *
 * <h2>Pipeline</h2>
 * <pre>
 *   HttpServerCodec → HttpObjectAggregator → StaticHttpHandler
 * </pre>
 *
 * <h2>Lifecycle</h2>
 * - {@link #start()} binds the server socket and waits for the bind to finish.
 *   A failed bind shuts down both event loop groups before it throws.
 * - {@link #stop()} closes the channel and shuts down both event loop groups.
 */
public final class NettyHttpStaticEndpoint implements StaticEndpoint
{
    /** Request bodies are ignored; this only bounds what the aggregator buffers. */
    private static final int MAX_REQUEST_BYTES = 64 * 1024;

    private final InetSocketAddress bindAddress;

    private final EventLoopGroup bossGroup;
    private final EventLoopGroup workerGroup;
    private final ServerBootstrap bootstrap;

    private volatile StaticRequestListener listener;
    private volatile Channel channel;

    public NettyHttpStaticEndpoint(InetSocketAddress bindAddress)
    {
        this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress");

        this.bossGroup = new NioEventLoopGroup(1);
        this.workerGroup = new NioEventLoopGroup();
        this.bootstrap = new ServerBootstrap();

        bootstrap.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        ChannelPipeline p = ch.pipeline();
                        p.addLast(new HttpServerCodec());
                        p.addLast(new HttpObjectAggregator(MAX_REQUEST_BYTES));
                        p.addLast(new StaticHttpHandler(requireListener()));
                    }
                });
    }

    @Override
    public void setListener(StaticRequestListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void start()
    {
        requireListener();

        ChannelFuture f = bootstrap.bind(bindAddress).awaitUninterruptibly();
        if (!f.isSuccess()) {
            bossGroup.shutdownGracefully();
            workerGroup.shutdownGracefully();
            throw new IllegalStateException("Cannot bind " + bindAddress, f.cause());
        }
        channel = f.channel();
    }

    @Override
    public void stop()
    {
        Channel ch = channel;
        if (ch != null) {
            ch.close().awaitUninterruptibly();
        }

        bossGroup.shutdownGracefully();
        workerGroup.shutdownGracefully();
    }

    @Override
    public void awaitTermination() throws InterruptedException
    {
        Channel ch = channel;
        if (ch != null) {
            ch.closeFuture().await();
        }
    }

    @Override
    public InetSocketAddress localAddress()
    {
        Channel ch = channel;
        if (ch == null) {
            throw new IllegalStateException("Endpoint not started");
        }
        return (InetSocketAddress) ch.localAddress();
    }

    boolean isShuttingDown()
    {
        return bossGroup.isShuttingDown() && workerGroup.isShuttingDown();
    }

    private StaticRequestListener requireListener()
    {
        StaticRequestListener l = listener;
        if (l == null) {
            throw new IllegalStateException("StaticRequestListener must be set before start()");
        }
        return l;
    }
}
