package io.trading.relay.netty;

import io.netty.channel.EventLoopGroup;
import io.netty.channel.epoll.Epoll;
import io.netty.channel.epoll.EpollEventLoopGroup;
import io.netty.channel.epoll.EpollServerSocketChannel;
import io.netty.channel.epoll.EpollSocketChannel;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.ServerSocketChannel;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory for creating Netty event loop groups and channel classes.
 * Uses epoll on Linux, NIO on other platforms.
 */
public final class NettyEventLoopFactory {

    private static final Logger LOGGER = LoggerFactory.getLogger(NettyEventLoopFactory.class);

    private static final boolean EPOLL_AVAILABLE = Epoll.isAvailable();

    static {
        LOGGER.info("Netty: using {} transport", EPOLL_AVAILABLE ? "native epoll" : "NIO");
    }

    private NettyEventLoopFactory() {
    }

    /**
     * Creates an EventLoopGroup with the specified number of threads.
     *
     * @param threads Number of threads, 0 for Netty's default
     */
    public static EventLoopGroup createEventLoopGroup(int threads) {
        if (EPOLL_AVAILABLE) {
            return new EpollEventLoopGroup(threads);
        }
        return new NioEventLoopGroup(threads);
    }

    /**
     * Gets the client SocketChannel class for the current platform.
     */
    public static Class<? extends SocketChannel> getClientChannelClass() {
        return EPOLL_AVAILABLE ? EpollSocketChannel.class : NioSocketChannel.class;
    }

    /**
     * Gets the ServerSocketChannel class for the current platform.
     */
    public static Class<? extends ServerSocketChannel> getServerChannelClass() {
        return EPOLL_AVAILABLE ? EpollServerSocketChannel.class : NioServerSocketChannel.class;
    }
}
