package com.questrail.dtchat.transport.netty;

import com.questrail.dtchat.api.Endpoint;
import com.questrail.dtchat.api.TransportKind;
import com.questrail.dtchat.transport.TransportEngine;
import com.questrail.dtchat.transport.TransportEvent;
import com.questrail.dtchat.transport.TransportEventListener;

import io.netty.bootstrap.Bootstrap;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.DatagramPacket;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioDatagramChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.LengthFieldBasedFrameDecoder;
import io.netty.handler.codec.LengthFieldPrepender;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * NettyTransportEngine
 * =============================================================================
 * Netty-backed implementation of the {@link TransportEngine} port for TCP and
 * UDP endpoints.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>. It MUST NOT decode
 * chat envelopes, interpret acknowledgements or retry.
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code Channel}, {@code EventLoopGroup}, {@code ByteBuf})
 * MUST NOT escape this package. Inbound payloads are copied into
 * {@code byte[]}; all reference-counted buffers are released internally.
 *
 * <h2>Framing</h2>
 * <ul>
 *   <li>TCP: every payload is one frame with a 4-byte big-endian length
 *       prefix. A send opens a connection, writes one frame and closes.</li>
 *   <li>UDP: every payload is one datagram, sent from the channel bound to the
 *       local endpoint (or an ephemeral one if none is bound).</li>
 *   <li>Bundle Protocol endpoints are not supported by this adapter.</li>
 * </ul>
 *
 * <h2>Threading</h2>
 * Events are delivered on the event loop threads of a dedicated group.
 */
public final class NettyTransportEngine implements TransportEngine
{
    private static final Logger log = LoggerFactory.getLogger(NettyTransportEngine.class);

    /** Default upper bound for one TCP frame. */
    public static final int DEFAULT_MAX_FRAME_LENGTH = 16 * 1024 * 1024;

    private static final int MAX_DATAGRAM = 65_535;
    private static final String UNSUPPORTED = "unsupported transport";

    private final int maxFrameLength;
    private final EventLoopGroup group;
    private final Map<Endpoint, Channel> listeners = new ConcurrentHashMap<>();

    private volatile TransportEventListener listener;

    public NettyTransportEngine()
    {
        this(DEFAULT_MAX_FRAME_LENGTH);
    }

    public NettyTransportEngine(int maxFrameLength)
    {
        if (maxFrameLength <= 0) {
            throw new IllegalArgumentException("maxFrameLength must be positive: " + maxFrameLength);
        }
        this.maxFrameLength = maxFrameLength;
        this.group = new NioEventLoopGroup(2);
    }

    @Override
    public void setListener(TransportEventListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void startListener(Endpoint endpoint)
    {
        Objects.requireNonNull(endpoint, "endpoint");
        requireListener();

        final InetSocketAddress bindAddress;
        if (endpoint.kind() == TransportKind.BUNDLE_PROTOCOL) {
            emit(new TransportEvent.SocketError(endpoint, UNSUPPORTED));
            return;
        }
        try {
            bindAddress = SocketAddresses.resolve(endpoint.address());
        }
        catch (IllegalArgumentException e) {
            emit(new TransportEvent.SocketError(endpoint, e.getMessage()));
            return;
        }

        ChannelFuture f = endpoint.kind() == TransportKind.TCP
                ? tcpServer(endpoint).bind(bindAddress)
                : udp(endpoint).bind(bindAddress);

        f.addListener((ChannelFutureListener) future -> {
            if (future.isSuccess()) {
                listeners.put(endpoint, future.channel());
                emit(new TransportEvent.ListenerStarted(endpoint));
            }
            else {
                emit(new TransportEvent.SocketError(endpoint, describe(future.cause())));
            }
        });
    }

    @Override
    public void send(Endpoint local, Endpoint remote, byte[] data, String token)
    {
        Objects.requireNonNull(local, "local");
        Objects.requireNonNull(remote, "remote");
        Objects.requireNonNull(data, "data");
        Objects.requireNonNull(token, "token");
        requireListener();

        if (remote.kind() == TransportKind.BUNDLE_PROTOCOL) {
            emit(new TransportEvent.SendFailed(remote, UNSUPPORTED, Optional.of(token)));
            return;
        }

        final InetSocketAddress target;
        try {
            target = SocketAddresses.resolve(remote.address());
        }
        catch (IllegalArgumentException e) {
            emit(new TransportEvent.ConnectionFailed(remote, e.getMessage(), Optional.of(token)));
            return;
        }

        byte[] payload = data.clone();
        emit(new TransportEvent.Sending(token, remote, payload.length));

        if (remote.kind() == TransportKind.TCP) {
            sendTcp(remote, target, payload, token);
        } else {
            sendUdp(local, remote, target, payload, token);
        }
    }

    @Override
    public void stop()
    {
        for (Channel ch : listeners.values()) {
            ch.close();
        }
        listeners.clear();

        group.shutdownGracefully();
    }

    private void sendTcp(Endpoint remote, InetSocketAddress target, byte[] payload, String token)
    {
        Bootstrap client = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        ch.pipeline().addLast(new LengthFieldPrepender(4));
                    }
                });

        client.connect(target).addListener((ChannelFutureListener) connected -> {
            if (!connected.isSuccess()) {
                emit(new TransportEvent.ConnectionFailed(remote, describe(connected.cause()), Optional.of(token)));
                return;
            }

            Channel ch = connected.channel();
            emit(new TransportEvent.Established(remote));

            ch.writeAndFlush(Unpooled.wrappedBuffer(payload)).addListener((ChannelFutureListener) written -> {
                if (written.isSuccess()) {
                    emit(new TransportEvent.Sent(token, remote, payload.length));
                }
                else {
                    emit(new TransportEvent.SendFailed(remote, describe(written.cause()), Optional.of(token)));
                }
                ch.close().addListener((ChannelFutureListener) closed -> emit(new TransportEvent.Closed(remote)));
            });
        });
    }

    private void sendUdp(Endpoint local, Endpoint remote, InetSocketAddress target, byte[] payload, String token)
    {
        if (payload.length > MAX_DATAGRAM) {
            emit(new TransportEvent.SendFailed(remote,
                    "payload of " + payload.length + " bytes exceeds datagram size", Optional.of(token)));
            return;
        }

        Channel bound = listeners.get(local);
        if (bound != null) {
            writeDatagram(bound, remote, target, payload, token, false);
            return;
        }

        udp(local).bind(0).addListener((ChannelFutureListener) f -> {
            if (f.isSuccess()) {
                writeDatagram(f.channel(), remote, target, payload, token, true);
            }
            else {
                emit(new TransportEvent.SendFailed(remote, describe(f.cause()), Optional.of(token)));
            }
        });
    }

    private void writeDatagram(Channel ch, Endpoint remote, InetSocketAddress target,
                               byte[] payload, String token, boolean closeAfter)
    {
        DatagramPacket pkt = new DatagramPacket(Unpooled.wrappedBuffer(payload), target);
        ch.writeAndFlush(pkt).addListener((ChannelFutureListener) written -> {
            if (written.isSuccess()) {
                emit(new TransportEvent.Sent(token, remote, payload.length));
            }
            else {
                emit(new TransportEvent.SendFailed(remote, describe(written.cause()), Optional.of(token)));
            }
            if (closeAfter) {
                ch.close();
            }
        });
    }

    private ServerBootstrap tcpServer(Endpoint local)
    {
        return new ServerBootstrap()
                .group(group)
                .channel(NioServerSocketChannel.class)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        ChannelPipeline p = ch.pipeline();
                        p.addLast(new LengthFieldBasedFrameDecoder(maxFrameLength, 0, 4, 0, 4));
                        p.addLast(new TcpInboundHandler(local));
                    }
                });
    }

    private Bootstrap udp(Endpoint local)
    {
        return new Bootstrap()
                .group(group)
                .channel(NioDatagramChannel.class)
                .option(ChannelOption.SO_BROADCAST, false)
                .option(ChannelOption.RCVBUF_ALLOCATOR, new FixedRecvByteBufAllocator(MAX_DATAGRAM))
                .handler(new ChannelInitializer<NioDatagramChannel>() {
                    @Override
                    protected void initChannel(NioDatagramChannel ch)
                    {
                        ch.pipeline().addLast(new UdpInboundHandler(local));
                    }
                });
    }

    private void emit(TransportEvent event)
    {
        TransportEventListener l = listener;
        if (l == null) {
            log.warn("Dropping transport event without listener: {}", event);
            return;
        }
        l.onTransportEvent(event);
    }

    private void requireListener()
    {
        if (listener == null) {
            throw new IllegalStateException("TransportEventListener must be set before use");
        }
    }

    private static String describe(Throwable cause)
    {
        if (cause == null) {
            return "unknown";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    private static byte[] copy(ByteBuf content)
    {
        byte[] bytes = new byte[content.readableBytes()];
        content.getBytes(content.readerIndex(), bytes);
        return bytes;
    }

    /**
     * Receives length-delimited frames on accepted TCP connections.
     */
    private final class TcpInboundHandler extends SimpleChannelInboundHandler<ByteBuf>
    {
        private final Endpoint local;

        TcpInboundHandler(Endpoint local)
        {
            this.local = local;
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, ByteBuf frame)
        {
            Endpoint from = SocketAddresses.toEndpoint(TransportKind.TCP, ctx.channel().remoteAddress());
            emit(new TransportEvent.Received(copy(frame), from));
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            emit(new TransportEvent.ReceiveFailed(local, describe(cause)));
            ctx.close();
        }
    }

    /**
     * Receives datagrams on a bound UDP channel.
     */
    private final class UdpInboundHandler extends SimpleChannelInboundHandler<DatagramPacket>
    {
        private final Endpoint local;

        UdpInboundHandler(Endpoint local)
        {
            this.local = local;
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, DatagramPacket packet)
        {
            Endpoint from = SocketAddresses.toEndpoint(TransportKind.UDP, packet.sender());
            emit(new TransportEvent.Received(copy(packet.content()), from));
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            emit(new TransportEvent.ReceiveFailed(local, describe(cause)));
        }
    }
}
