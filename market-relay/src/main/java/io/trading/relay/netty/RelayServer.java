package io.trading.relay.netty;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.websocketx.WebSocketFrameAggregator;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolConfig;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import io.netty.handler.codec.http.websocketx.extensions.compression.WebSocketServerCompressionHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import io.trading.relay.broker.SubscriptionBroker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.concurrent.TimeUnit;

/**
 * WebSocket server accepting subscriber connections.
 * Any request path is accepted.
 */
public class RelayServer implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(RelayServer.class);

    /**
     * Largest accepted subscriber message. Commands are short.
     */
    static final int MAX_COMMAND_BYTES = 65536;

    private final String host;
    private final int port;
    private final int writeTimeoutMs;
    private final SubscriberConnectionHandler connectionHandler;

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel serverChannel;

    /**
     * @param host           Interface to bind
     * @param port           Port to bind, 0 for an ephemeral port
     * @param writeTimeoutMs Connections whose writes stall longer than this are closed
     * @param broker         Receiver of connections and commands
     */
    public RelayServer(String host, int port, int writeTimeoutMs, SubscriptionBroker broker) {
        this.host = host;
        this.port = port;
        this.writeTimeoutMs = writeTimeoutMs;
        this.connectionHandler = new SubscriberConnectionHandler(broker);
    }

    /**
     * Binds the listening socket.
     *
     * @throws IOException if the address cannot be bound
     */
    public synchronized void start() throws IOException {
        if (serverChannel != null) {
            return;
        }
        bossGroup = NettyEventLoopFactory.createEventLoopGroup(1);
        workerGroup = NettyEventLoopFactory.createEventLoopGroup(0);

        WebSocketServerProtocolConfig protocolConfig = WebSocketServerProtocolConfig.newBuilder()
            .websocketPath("/")
            .checkStartsWith(true)
            .allowExtensions(true)
            .maxFramePayloadLength(MAX_COMMAND_BYTES)
            .build();

        ServerBootstrap bootstrap = new ServerBootstrap();
        bootstrap.group(bossGroup, workerGroup)
            .channel(NettyEventLoopFactory.getServerChannelClass())
            .childHandler(new ChannelInitializer<SocketChannel>() {
                @Override
                protected void initChannel(SocketChannel ch) {
                    ChannelPipeline pipeline = ch.pipeline();
                    pipeline.addLast(new HttpServerCodec());
                    pipeline.addLast(new HttpObjectAggregator(MAX_COMMAND_BYTES));
                    pipeline.addLast(new WebSocketServerCompressionHandler());
                    pipeline.addLast(new WebSocketServerProtocolHandler(protocolConfig));
                    pipeline.addLast(new WebSocketFrameAggregator(MAX_COMMAND_BYTES));
                    pipeline.addLast(new WriteTimeoutHandler(writeTimeoutMs, TimeUnit.MILLISECONDS));
                    pipeline.addLast(connectionHandler);
                }
            });

        try {
            serverChannel = bootstrap.bind(host, port).sync().channel();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            release();
            throw new IOException("Interrupted while binding " + host + ":" + port, e);
        } catch (Exception e) {
            release();
            throw new IOException("Failed to bind " + host + ":" + port, e);
        }
        LOGGER.info("[Server] Listening on {}:{}", host, getPort());
    }

    /**
     * Bound port, or -1 if not started.
     */
    public int getPort() {
        Channel current = serverChannel;
        if (current == null) {
            return -1;
        }
        return ((InetSocketAddress) current.localAddress()).getPort();
    }

    @Override
    public synchronized void close() {
        release();
        LOGGER.info("[Server] Stopped");
    }

    private void release() {
        if (serverChannel != null) {
            serverChannel.close().syncUninterruptibly();
            serverChannel = null;
        }
        if (workerGroup != null) {
            workerGroup.shutdownGracefully();
            workerGroup = null;
        }
        if (bossGroup != null) {
            bossGroup.shutdownGracefully();
            bossGroup = null;
        }
    }
}
