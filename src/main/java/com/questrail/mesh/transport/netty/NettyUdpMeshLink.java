package com.questrail.mesh.transport.netty;

import com.questrail.mesh.transport.MeshLink;
import com.questrail.mesh.transport.MeshLinkListener;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.DatagramPacket;
import io.netty.channel.socket.nio.NioDatagramChannel;

import java.net.InetSocketAddress;
import java.util.List;
import java.util.Objects;

/**
 * NettyUdpMeshLink
 * =============================================================================
 * Netty-backed {@link MeshLink} that emulates a radio neighbourhood over UDP.
 *
 * <p>Each node binds one socket; {@link #broadcast(byte[])} writes the frame
 * to every configured neighbour address. Used for desktop simulation of a
 * mesh and for loopback tests.</p>
 *
 * <h2>Netty containment rule</h2>
 * Netty types ({@code Channel}, {@code EventLoopGroup}, {@code ByteBuf}) do not
 * leave this package. Inbound payloads are copied into {@code byte[]}; all
 * reference-counted buffers are released here.
 *
 * <h2>Lifecycle</h2>
 * - {@link #start()} binds the socket asynchronously and reports up/down.
 * - {@link #stop()} closes the channel and shuts down the event loop group.
 */
public final class NettyUdpMeshLink implements MeshLink
{
    private final InetSocketAddress bindAddress;
    private final List<InetSocketAddress> neighbours;

    private final EventLoopGroup group;
    private final Bootstrap bootstrap;

    private volatile MeshLinkListener listener;
    private volatile Channel channel;

    public NettyUdpMeshLink(InetSocketAddress bindAddress, List<InetSocketAddress> neighbours)
    {
        this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress");
        this.neighbours = List.copyOf(Objects.requireNonNull(neighbours, "neighbours"));

        this.group = new NioEventLoopGroup(1);
        this.bootstrap = new Bootstrap();

        bootstrap.group(group)
                .channel(NioDatagramChannel.class)
                .option(ChannelOption.SO_BROADCAST, false)
                .handler(new ChannelInitializer<NioDatagramChannel>() {
                    @Override
                    protected void initChannel(NioDatagramChannel ch)
                    {
                        ch.pipeline().addLast(new InboundHandler());
                    }
                });
    }

    @Override
    public void setListener(MeshLinkListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void start()
    {
        MeshLinkListener l = requireListener();

        ChannelFuture f = bootstrap.bind(bindAddress);
        f.addListener((ChannelFutureListener) future -> {
            if (future.isSuccess()) {
                channel = future.channel();
                l.onLinkUp();
            }
            else {
                l.onLinkDown(future.cause());
            }
        });
    }

    @Override
    public void stop()
    {
        Channel ch = channel;
        channel = null;
        if (ch != null) {
            ch.close().syncUninterruptibly();
        }
        group.shutdownGracefully();
    }

    @Override
    public void broadcast(byte[] frame)
    {
        Objects.requireNonNull(frame, "frame");

        Channel ch = channel;
        if (ch == null) {
            return;
        }

        for (InetSocketAddress neighbour : neighbours) {
            ByteBuf buf = Unpooled.wrappedBuffer(frame);
            ch.writeAndFlush(new DatagramPacket(buf, neighbour));
        }
    }

    /**
     * Address the socket is bound to, or {@code null} before the link is up.
     * With port 0 in the bind address this reports the ephemeral port.
     */
    public InetSocketAddress localAddress()
    {
        Channel ch = channel;
        return (ch == null) ? null : (InetSocketAddress) ch.localAddress();
    }

    private MeshLinkListener requireListener()
    {
        MeshLinkListener l = listener;
        if (l == null) {
            throw new IllegalStateException("MeshLinkListener must be set before start()");
        }
        return l;
    }

    /**
     * InboundHandler
     * -------------------------------------------------------------------------
     * Copies each datagram into a {@code byte[]} and forwards it with the
     * sender's socket address as the link address.
     */
    private final class InboundHandler extends SimpleChannelInboundHandler<DatagramPacket>
    {
        @Override
        protected void channelRead0(ChannelHandlerContext ctx, DatagramPacket packet)
        {
            MeshLinkListener l = listener;
            if (l == null) {
                return;
            }

            ByteBuf content = packet.content();
            byte[] bytes = new byte[content.readableBytes()];
            content.getBytes(content.readerIndex(), bytes);

            InetSocketAddress sender = packet.sender();
            l.onFrame(sender.getHostString() + ":" + sender.getPort(), bytes);
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            MeshLinkListener l = listener;
            if (l != null) {
                l.onLinkDown(null);
            }
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            MeshLinkListener l = listener;
            if (l != null) {
                l.onLinkDown(cause);
            }
            ctx.close();
        }
    }
}
