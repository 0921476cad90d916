package io.trading.relay.netty;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PongWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshaker;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshakerFactory;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketHandshakeException;
import io.netty.handler.codec.http.websocketx.WebSocketVersion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.function.Consumer;

/**
 * Client side of one feed connection: completes the handshake, then hands text
 * frames to the message callback. The disconnect callback fires whenever the channel
 * goes inactive, including after a failed handshake.
 */
public class WebSocketClientHandler extends SimpleChannelInboundHandler<Object> {

    private static final Logger LOGGER = LoggerFactory.getLogger(WebSocketClientHandler.class);

    private final String name;
    private final WebSocketClientHandshaker handshaker;
    private final Consumer<String> messageHandler;
    private final Consumer<Throwable> errorHandler;
    private final Runnable connectHandler;
    private final Runnable disconnectHandler;

    /**
     * @param name                  Connection name used in logs
     * @param uri                   Feed endpoint
     * @param maxFramePayloadLength Largest accepted frame payload
     * @param messageHandler        Receives every text message
     * @param errorHandler          Receives handshake, protocol and callback failures
     * @param connectHandler        Runs once the handshake completed
     * @param disconnectHandler     Runs when the channel goes inactive
     */
    public WebSocketClientHandler(
        String name,
        URI uri,
        int maxFramePayloadLength,
        Consumer<String> messageHandler,
        Consumer<Throwable> errorHandler,
        Runnable connectHandler,
        Runnable disconnectHandler
    ) {
        this.name = name;
        this.handshaker = WebSocketClientHandshakerFactory.newHandshaker(
            uri, WebSocketVersion.V13, null, true, new DefaultHttpHeaders(), maxFramePayloadLength);
        this.messageHandler = messageHandler;
        this.errorHandler = errorHandler;
        this.connectHandler = connectHandler;
        this.disconnectHandler = disconnectHandler;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) {
        LOGGER.debug("{}: TCP connected, sending handshake", name);
        handshaker.handshake(ctx.channel());
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) {
        LOGGER.debug("{}: Channel inactive", name);
        disconnectHandler.run();
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, Object msg) {
        if (!handshaker.isHandshakeComplete()) {
            completeHandshake(ctx, (FullHttpResponse) msg);
        } else if (msg instanceof WebSocketFrame frame) {
            onFrame(ctx, frame);
        } else {
            throw new IllegalStateException(name + ": unexpected message after handshake: " + msg);
        }
    }

    private void completeHandshake(ChannelHandlerContext ctx, FullHttpResponse response) {
        try {
            handshaker.finishHandshake(ctx.channel(), response);
        } catch (WebSocketHandshakeException e) {
            LOGGER.error("{}: Handshake rejected ({}): {}", name, response.status(), e.getMessage());
            errorHandler.accept(e);
            ctx.close();
            return;
        }
        LOGGER.debug("{}: Handshake complete", name);
        connectHandler.run();
    }

    private void onFrame(ChannelHandlerContext ctx, WebSocketFrame frame) {
        if (frame instanceof TextWebSocketFrame text) {
            deliver(text.text());
        } else if (frame instanceof PingWebSocketFrame) {
            ctx.writeAndFlush(new PongWebSocketFrame(frame.content().retain()));
        } else if (frame instanceof CloseWebSocketFrame close) {
            LOGGER.info("{}: Feed closed the connection ({} {})", name, close.statusCode(), close.reasonText());
            ctx.close();
        } else if (!(frame instanceof PongWebSocketFrame)) {
            LOGGER.warn("{}: Ignoring {}", name, frame.getClass().getSimpleName());
        }
    }

    private void deliver(String message) {
        try {
            messageHandler.accept(message);
        } catch (RuntimeException e) {
            LOGGER.error("{}: Message handler failed", name, e);
            errorHandler.accept(e);
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        LOGGER.error("{}: Connection error: {}", name, cause.toString());
        errorHandler.accept(cause);
        ctx.close();
    }
}
