package com.questrail.harness.bus.netty;

import com.questrail.harness.bus.BusAddress;
import com.questrail.harness.bus.BusMessage;
import com.questrail.harness.bus.BusNames;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * BusDaemon
 * =============================================================================
 * The private message bus a controller starts for its workers.
 *
 * <h2>Routing</h2>
 * <ul>
 *   <li>{@code HELLO} assigns the connection a unique name ({@code :1.N})</li>
 *   <li>{@code REQUEST_NAME} gives the connection a well-known name; the
 *       previous owner, if any, loses it</li>
 *   <li>Method calls go to the owner of the destination name; without owner
 *       the caller gets a {@code ServiceUnknown} error</li>
 *   <li>Replies go to the unique name they are addressed to</li>
 *   <li>Signals are broadcast to every other connection</li>
 *   <li>Every ownership change, including a connection going away, is
 *       broadcast as {@code NAME_OWNER_CHANGED(name, oldOwner, newOwner)}</li>
 * </ul>
 *
 * <h2>Threading</h2>
 * All child channels share one Netty event loop, so the routing tables are
 * only ever touched by that thread.
 *
 * <h2>Netty containment rule</h2>
 * Netty types do not escape this package.
 */
public final class BusDaemon implements AutoCloseable
{
    private static final Logger log = LoggerFactory.getLogger(BusDaemon.class);

    private final InetSocketAddress bindAddress;
    private final EventLoopGroup bossGroup;
    private final EventLoopGroup workerGroup;

    private final Map<String, Channel> peers = new HashMap<>();
    private final Map<String, String> owners = new HashMap<>();
    private long nextPeerId;

    private volatile Channel serverChannel;
    private volatile BusAddress address;

    public BusDaemon(InetSocketAddress bindAddress)
    {
        this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress");
        this.bossGroup = new NioEventLoopGroup(1);
        this.workerGroup = new NioEventLoopGroup(1);
    }

    /**
     * Binds the listening socket.
     *
     * @return the address workers should connect to
     */
    public BusAddress start() throws IOException
    {
        ServerBootstrap bootstrap = new ServerBootstrap()
                .group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        BusFrames.configure(ch.pipeline());
                        ch.pipeline().addLast("router", new Router());
                    }
                });

        ChannelFuture f = bootstrap.bind(bindAddress).awaitUninterruptibly();
        if (!f.isSuccess()) {
            close();
            throw new IOException("Could not bind bus daemon to " + bindAddress, f.cause());
        }

        serverChannel = f.channel();
        InetSocketAddress local = (InetSocketAddress) serverChannel.localAddress();
        address = new BusAddress(local.getAddress().getHostAddress(), local.getPort());
        log.info("Bus daemon listening on {}", address);
        return address;
    }

    public BusAddress address()
    {
        BusAddress a = address;
        if (a == null) {
            throw new IllegalStateException("Bus daemon is not started");
        }
        return a;
    }

    @Override
    public void close()
    {
        Channel ch = serverChannel;
        if (ch != null) {
            ch.close().awaitUninterruptibly();
        }
        workerGroup.shutdownGracefully().awaitUninterruptibly();
        bossGroup.shutdownGracefully().awaitUninterruptibly();
    }

    private void broadcast(BusMessage message, Channel except)
    {
        for (Channel peer : peers.values()) {
            if (peer != except) {
                peer.writeAndFlush(message);
            }
        }
    }

    /**
     * Router
     * -------------------------------------------------------------------------
     * One instance per connection; holds that connection's unique name.
     */
    private final class Router extends SimpleChannelInboundHandler<BusMessage>
    {
        private String uniqueName;

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, BusMessage msg)
        {
            if (uniqueName == null) {
                if (msg.type() != BusMessage.Type.HELLO) {
                    log.warn("Dropping connection {}: {} before HELLO", ctx.channel().remoteAddress(), msg.type());
                    ctx.close();
                    return;
                }
                hello(ctx, msg);
                return;
            }

            switch (msg.type()) {
                case REQUEST_NAME -> requestName(ctx, msg);
                case METHOD_CALL -> routeCall(ctx, msg);
                case METHOD_RETURN, ERROR -> routeReply(msg);
                case SIGNAL -> broadcast(msg.withSender(uniqueName), ctx.channel());
                default -> log.debug("Ignoring {} from {}", msg.type(), uniqueName);
            }
        }

        private void hello(ChannelHandlerContext ctx, BusMessage msg)
        {
            uniqueName = ":1." + (++nextPeerId);
            peers.put(uniqueName, ctx.channel());
            ctx.writeAndFlush(BusMessage.methodReturn(0, msg.serial(), uniqueName, List.of(uniqueName)));
            broadcast(BusMessage.nameOwnerChanged(uniqueName, "", uniqueName), null);
            log.debug("Bus peer {} connected from {}", uniqueName, ctx.channel().remoteAddress());
        }

        private void requestName(ChannelHandlerContext ctx, BusMessage msg)
        {
            Object requested = msg.firstArg();
            if (!(requested instanceof String) || ((String) requested).isEmpty()) {
                ctx.writeAndFlush(BusMessage.error(0, msg.serial(), uniqueName, BusNames.ERROR_FAILED, "invalid name"));
                return;
            }
            String name = (String) requested;
            String previous = owners.put(name, uniqueName);
            ctx.writeAndFlush(BusMessage.methodReturn(0, msg.serial(), uniqueName, List.of()));
            if (!uniqueName.equals(previous)) {
                broadcast(BusMessage.nameOwnerChanged(name, previous == null ? "" : previous, uniqueName), null);
            }
        }

        private void routeCall(ChannelHandlerContext ctx, BusMessage msg)
        {
            String destination = msg.destination();
            String owner = destination == null ? null
                    : destination.startsWith(":") ? destination : owners.get(destination);
            Channel target = owner == null ? null : peers.get(owner);
            if (target == null) {
                ctx.writeAndFlush(BusMessage.error(0, msg.serial(), uniqueName,
                        BusNames.ERROR_SERVICE_UNKNOWN, "No owner for " + destination));
                return;
            }
            target.writeAndFlush(msg.withSender(uniqueName));
        }

        private void routeReply(BusMessage msg)
        {
            Channel target = msg.destination() == null ? null : peers.get(msg.destination());
            if (target != null) {
                target.writeAndFlush(msg.withSender(uniqueName));
            }
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            if (uniqueName == null) {
                return;
            }
            peers.remove(uniqueName);

            List<String> released = new ArrayList<>();
            owners.entrySet().removeIf(e -> {
                if (e.getValue().equals(uniqueName)) {
                    released.add(e.getKey());
                    return true;
                }
                return false;
            });
            for (String name : released) {
                broadcast(BusMessage.nameOwnerChanged(name, uniqueName, ""), null);
            }
            broadcast(BusMessage.nameOwnerChanged(uniqueName, uniqueName, ""), null);
            log.debug("Bus peer {} disconnected, released {}", uniqueName, released);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            log.warn("Bus peer {} failed; closing", uniqueName, cause);
            ctx.close();
        }
    }
}
