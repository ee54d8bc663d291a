package com.questrail.harness.bus.netty;

import com.questrail.harness.bus.AbstractBusConnection;
import com.questrail.harness.bus.BusAddress;
import com.questrail.harness.bus.BusMessage;
import com.questrail.harness.bus.BusNames;
import com.questrail.harness.bus.BusValues;
import com.questrail.harness.bus.RemoteCallException;
import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * NettyBusConnection
 * =============================================================================
 * TCP client side of the harness bus.
 *
 * <h2>Threading</h2>
 * Frames arrive on a private Netty event loop. Reply futures are completed on
 * that thread; inbound calls, signals and membership changes are handed to the
 * dispatch executor given at {@link #connect(BusAddress, Executor)}.
 *
 * <h2>Lifecycle</h2>
 * {@link #connect} blocks until the daemon has assigned a unique name.
 * {@link #close()} fails every pending call and runs the close listeners; the
 * same happens when the daemon goes away.
 */
public final class NettyBusConnection extends AbstractBusConnection
{
    private static final Logger log = LoggerFactory.getLogger(NettyBusConnection.class);

    private static final Duration HANDSHAKE_TIMEOUT = Duration.ofSeconds(5);

    private final EventLoopGroup group;
    private final AtomicLong serials = new AtomicLong();
    private final Map<Long, CompletableFuture<List<Object>>> pending = new ConcurrentHashMap<>();
    private final List<Runnable> closeListeners = new CopyOnWriteArrayList<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private volatile Channel channel;
    private volatile String uniqueName;

    private NettyBusConnection(EventLoopGroup group, Executor dispatcher)
    {
        super(dispatcher);
        this.group = group;
    }

    /**
     * Connects to the daemon at {@code address} and performs the handshake.
     *
     * @param dispatcher executor inbound calls, signals and membership changes run on
     */
    public static NettyBusConnection connect(BusAddress address, Executor dispatcher) throws IOException
    {
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(dispatcher, "dispatcher");

        EventLoopGroup group = new NioEventLoopGroup(1);
        NettyBusConnection connection = new NettyBusConnection(group, dispatcher);

        Bootstrap bootstrap = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) HANDSHAKE_TIMEOUT.toMillis())
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        BusFrames.configure(ch.pipeline());
                        ch.pipeline().addLast("client", connection.new InboundHandler());
                    }
                });

        ChannelFuture f = bootstrap.connect(address.toSocketAddress()).awaitUninterruptibly();
        if (!f.isSuccess()) {
            group.shutdownGracefully();
            throw new IOException("Could not connect to bus at " + address, f.cause());
        }
        connection.channel = f.channel();

        try {
            List<Object> reply = connection.request(BusMessage.hello(connection.nextSerial()))
                    .get(HANDSHAKE_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
            connection.uniqueName = (String) reply.get(0);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            connection.close();
            throw new IOException("Interrupted during bus handshake", e);
        } catch (ExecutionException | TimeoutException | RuntimeException e) {
            connection.close();
            throw new IOException("Bus handshake with " + address + " failed", e);
        }

        log.debug("Connected to bus {} as {}", address, connection.uniqueName);
        return connection;
    }

    @Override
    public String uniqueName()
    {
        return uniqueName;
    }

    @Override
    public CompletableFuture<Void> requestName(String name)
    {
        Objects.requireNonNull(name, "name");
        return request(BusMessage.requestName(nextSerial(), name)).thenApply(reply -> null);
    }

    @Override
    public CompletableFuture<Object> call(String destination, String path, String iface, String member, List<Object> args)
    {
        Objects.requireNonNull(destination, "destination");
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(member, "member");
        BusMessage call = BusMessage.methodCall(nextSerial(), destination, path, iface, member, wire(args));
        return request(call).thenApply(reply -> reply.isEmpty() ? null : reply.get(0));
    }

    @Override
    public void emitSignal(String path, String iface, String member, List<Object> args)
    {
        send(BusMessage.signal(nextSerial(), path, iface, member, wire(args)));
    }

    /**
     * Registers a callback for when the connection is closed, locally or by the daemon.
     */
    public void whenClosed(Runnable listener)
    {
        Objects.requireNonNull(listener, "listener");
        closeListeners.add(listener);
        if (closed.get()) {
            listener.run();
        }
    }

    public boolean isOpen()
    {
        return !closed.get();
    }

    @Override
    public void close()
    {
        Channel ch = channel;
        if (ch != null) {
            ch.close().awaitUninterruptibly();
        }
        markClosed();
        group.shutdownGracefully();
    }

    private long nextSerial()
    {
        return serials.incrementAndGet();
    }

    private CompletableFuture<List<Object>> request(BusMessage message)
    {
        CompletableFuture<List<Object>> reply = new CompletableFuture<>();
        if (closed.get()) {
            reply.completeExceptionally(new RemoteCallException(BusNames.ERROR_DISCONNECTED, "connection closed"));
            return reply;
        }

        pending.put(message.serial(), reply);
        channel.writeAndFlush(message).addListener((ChannelFutureListener) f -> {
            if (!f.isSuccess()) {
                CompletableFuture<List<Object>> p = pending.remove(message.serial());
                if (p != null) {
                    p.completeExceptionally(new RemoteCallException(BusNames.ERROR_DISCONNECTED,
                            "write failed", f.cause()));
                }
            }
        });
        return reply;
    }

    private void send(BusMessage message)
    {
        Channel ch = channel;
        if (ch == null || closed.get()) {
            log.debug("Dropping {} {}: connection closed", message.type(), message.member());
            return;
        }
        ch.writeAndFlush(message);
    }

    private static List<Object> wire(List<Object> args)
    {
        if (args == null || args.isEmpty()) {
            return List.of();
        }
        List<Object> out = new ArrayList<>(args.size());
        for (Object a : args) {
            out.add(BusValues.toWire(a));
        }
        return out;
    }

    private void markClosed()
    {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        for (Long serial : List.copyOf(pending.keySet())) {
            CompletableFuture<List<Object>> p = pending.remove(serial);
            if (p != null) {
                p.completeExceptionally(new RemoteCallException(BusNames.ERROR_DISCONNECTED, "connection closed"));
            }
        }
        for (Runnable l : closeListeners) {
            l.run();
        }
    }

    /**
     * InboundHandler
     * -------------------------------------------------------------------------
     * Completes replies and forwards everything else to the dispatcher.
     */
    private final class InboundHandler extends SimpleChannelInboundHandler<BusMessage>
    {
        @Override
        protected void channelRead0(ChannelHandlerContext ctx, BusMessage msg)
        {
            switch (msg.type()) {
                case METHOD_RETURN -> {
                    CompletableFuture<List<Object>> p = pending.remove(msg.replySerial());
                    if (p != null) {
                        p.complete(msg.args());
                    }
                }
                case ERROR -> {
                    CompletableFuture<List<Object>> p = pending.remove(msg.replySerial());
                    if (p != null) {
                        p.completeExceptionally(new RemoteCallException(msg.errorName(), String.valueOf(msg.firstArg())));
                    }
                }
                case METHOD_CALL -> dispatchMethodCall(msg.path(), msg.iface(), msg.member(), msg.args(),
                        (result, error) -> {
                            if (error == null) {
                                send(BusMessage.methodReturn(nextSerial(), msg.serial(), msg.sender(),
                                        result == null ? List.of() : Collections.singletonList(BusValues.toWire(result))));
                            }
                            else {
                                send(BusMessage.error(nextSerial(), msg.serial(), msg.sender(),
                                        error.errorName(), error.detail()));
                            }
                        });
                case SIGNAL -> dispatchSignal(msg.path(), msg.iface(), msg.member(), msg.args());
                case NAME_OWNER_CHANGED -> {
                    List<Object> a = msg.args();
                    if (a.size() == 3) {
                        dispatchNameOwnerChanged((String) a.get(0), (String) a.get(1), (String) a.get(2));
                    }
                }
                default -> log.debug("Ignoring unexpected {} from daemon", msg.type());
            }
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            markClosed();
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            log.warn("Bus connection {} failed; closing", uniqueName, cause);
            ctx.close();
        }
    }
}
