package io.trading.relay.netty;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketFrameAggregator;
import io.netty.handler.codec.http.websocketx.extensions.compression.WebSocketClientCompressionHandler;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.util.function.Consumer;

/**
 * Netty-based WebSocket client holding one long-lived connection to a push feed.
 */
public class WebSocketClient implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(WebSocketClient.class);

    /**
     * Largest accepted message; a full-universe frame can be several megabytes.
     */
    static final int MAX_MESSAGE_BYTES = 16 * 1024 * 1024;

    private final URI uri;
    private final String name;
    private final Consumer<String> messageHandler;
    private final Consumer<Throwable> errorHandler;
    private final Runnable connectHandler;
    private final Runnable disconnectHandler;

    private EventLoopGroup eventLoopGroup;
    private volatile Channel channel;
    private volatile boolean connected = false;

    /**
     * Creates a new WebSocket client.
     *
     * @param uri               The WebSocket URI to connect to (ws:// or wss://)
     * @param name              Friendly name for this client, used in logs
     * @param messageHandler    Callback for received text messages
     * @param errorHandler      Callback for errors
     * @param connectHandler    Callback when the handshake completed
     * @param disconnectHandler Callback when the connection is lost
     */
    public WebSocketClient(
        URI uri,
        String name,
        Consumer<String> messageHandler,
        Consumer<Throwable> errorHandler,
        Runnable connectHandler,
        Runnable disconnectHandler
    ) {
        this.uri = uri;
        this.name = name;
        this.messageHandler = messageHandler;
        this.errorHandler = errorHandler;
        this.connectHandler = connectHandler;
        this.disconnectHandler = disconnectHandler;
    }

    /**
     * Opens the TCP connection and starts the WebSocket handshake.
     * The connect handler runs once the handshake completes.
     *
     * @throws IOException if the connection cannot be established
     */
    public synchronized void connect() throws IOException {
        if (isConnected()) {
            LOGGER.warn("{}: Already connected", name);
            return;
        }
        release();

        boolean secure = "wss".equals(uri.getScheme());
        String host = uri.getHost();
        int port = uri.getPort() > 0 ? uri.getPort() : (secure ? 443 : 80);

        try {
            SslContext sslContext = secure ? SslContextBuilder.forClient().build() : null;
            eventLoopGroup = NettyEventLoopFactory.createEventLoopGroup(1);

            Bootstrap bootstrap = new Bootstrap();
            bootstrap.group(eventLoopGroup)
                .channel(NettyEventLoopFactory.getClientChannelClass())
                .handler(new ChannelInitializer<>() {
                    @Override
                    protected void initChannel(Channel ch) {
                        // current before the handshake can complete or fail
                        WebSocketClient.this.channel = ch;
                        ChannelPipeline pipeline = ch.pipeline();

                        if (sslContext != null) {
                            pipeline.addLast(sslContext.newHandler(ch.alloc(), host, port));
                        }

                        pipeline.addLast(new HttpClientCodec());
                        pipeline.addLast(new HttpObjectAggregator(8192));
                        pipeline.addLast(WebSocketClientCompressionHandler.INSTANCE);
                        pipeline.addLast(new WebSocketFrameAggregator(MAX_MESSAGE_BYTES));

                        pipeline.addLast(new WebSocketClientHandler(
                            name,
                            uri,
                            MAX_MESSAGE_BYTES,
                            messageHandler,
                            errorHandler,
                            () -> {
                                connected = true;
                                LOGGER.info("{}: Connected", name);
                                if (connectHandler != null) {
                                    connectHandler.run();
                                }
                            },
                            () -> {
                                // channels released by connect() or close() are no longer current
                                if (ch != WebSocketClient.this.channel) {
                                    return;
                                }
                                connected = false;
                                LOGGER.warn("{}: Disconnected", name);
                                if (disconnectHandler != null) {
                                    disconnectHandler.run();
                                }
                            }
                        ));
                    }
                });

            LOGGER.info("{}: Connecting to {}:{}...", name, host, port);
            channel = bootstrap.connect(host, port).sync().channel();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            release();
            throw new IOException(name + ": interrupted while connecting", e);
        } catch (Exception e) {
            release();
            throw new IOException(name + ": failed to connect to " + uri, e);
        }
    }

    /**
     * Sends a text message through the WebSocket.
     *
     * @return true if the message was handed to the channel
     */
    public boolean send(String message) {
        Channel current = channel;
        if (!connected || current == null) {
            LOGGER.warn("{}: Cannot send message, not connected", name);
            return false;
        }

        current.writeAndFlush(new TextWebSocketFrame(message)).addListener(future -> {
            if (!future.isSuccess()) {
                LOGGER.error("{}: Failed to send message", name, future.cause());
                if (errorHandler != null) {
                    errorHandler.accept(future.cause());
                }
            }
        });
        return true;
    }

    /**
     * Returns whether the handshake completed and the channel is still open.
     */
    public boolean isConnected() {
        Channel current = channel;
        return connected && current != null && current.isActive();
    }

    @Override
    public synchronized void close() {
        connected = false;
        release();
        LOGGER.info("{}: Closed", name);
    }

    private void release() {
        Channel current = channel;
        channel = null;
        if (current != null) {
            try {
                current.close().sync();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOGGER.error("{}: Interrupted while closing channel", name, e);
            }
        }
        if (eventLoopGroup != null) {
            eventLoopGroup.shutdownGracefully();
            eventLoopGroup = null;
        }
    }
}
