package io.trading.relay.netty;

import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import io.netty.handler.timeout.WriteTimeoutException;
import io.trading.relay.broker.SubscriptionBroker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bridges a subscriber WebSocket connection to the {@link SubscriptionBroker}.
 * Control frames are answered by the protocol handler in front of this one.
 */
@ChannelHandler.Sharable
public class SubscriberConnectionHandler extends SimpleChannelInboundHandler<WebSocketFrame> {

    private static final Logger LOGGER = LoggerFactory.getLogger(SubscriberConnectionHandler.class);

    private final SubscriptionBroker broker;

    public SubscriberConnectionHandler(SubscriptionBroker broker) {
        this.broker = broker;
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof WebSocketServerProtocolHandler.HandshakeComplete handshake) {
            LOGGER.debug("[Server] Handshake complete on {} for {}", ctx.channel().id().asShortText(),
                handshake.requestUri());
            broker.register(ctx.channel());
        } else {
            super.userEventTriggered(ctx, evt);
        }
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, WebSocketFrame frame) {
        if (frame instanceof TextWebSocketFrame textFrame) {
            broker.handleCommand(ctx.channel(), textFrame.text())
                .ifPresent(response -> ctx.channel().writeAndFlush(new TextWebSocketFrame(response)));
        } else {
            LOGGER.debug("[Server] Ignoring {} from {}", frame.getClass().getSimpleName(),
                ctx.channel().id().asShortText());
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        if (cause instanceof WriteTimeoutException) {
            LOGGER.warn("[Server] Subscriber {} stalled, closing", ctx.channel().id().asShortText());
        } else {
            LOGGER.warn("[Server] Subscriber {} error: {}", ctx.channel().id().asShortText(), cause.toString());
        }
        ctx.close();
    }
}
