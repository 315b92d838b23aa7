package com.hallsync.server;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import io.netty.handler.codec.http.websocketx.extensions.compression.WebSocketServerCompressionHandler;
import io.netty.handler.timeout.IdleStateHandler;

import com.hallsync.config.RelayConfig;
import com.hallsync.handler.HealthCheckHandler;
import com.hallsync.handler.WebSocketFrameHandler;
import com.hallsync.relay.RelayServer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * WebSocket front end of the relay, using Netty's NIO transport.
 *
 * Threading Model:
 * - Boss Group: 1 thread that accepts incoming connections
 * - Worker Group: N threads (CPU cores) that handle socket I/O
 * - Relay loop: 1 thread inside {@link RelayServer} that owns all shared state
 *
 * Workers never touch actor state; they decode frames and hand events to the relay loop.
 */
public class SyncServer {

    private static final Logger logger = LoggerFactory.getLogger(SyncServer.class);

    private final RelayConfig config;
    private final RelayServer relay;

    // Netty event loop groups
    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel serverChannel;

    public SyncServer(RelayConfig config) {
        this.config = config;
        this.relay = new RelayServer(config);
    }

    /**
     * Binds the port and starts the relay. Returns once the server is accepting connections.
     */
    public void bind() throws InterruptedException {
        // Boss group: accepts incoming connections (1 thread is enough)
        bossGroup = new NioEventLoopGroup(1);

        // Worker group: handles I/O for accepted connections
        // Default: 2 * number of CPU cores
        workerGroup = new NioEventLoopGroup();

        relay.start();

        ServerBootstrap bootstrap = new ServerBootstrap();
        bootstrap.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                // TCP options
                .option(ChannelOption.SO_BACKLOG, 128)
                .childOption(ChannelOption.SO_KEEPALIVE, true)
                .childOption(ChannelOption.TCP_NODELAY, true) // Disable Nagle for low latency
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ChannelPipeline pipeline = ch.pipeline();

                        // Reader idle: ping once, close on the second silent period
                        if (config.getReaderIdleSeconds() > 0) {
                            pipeline.addLast(new IdleStateHandler(config.getReaderIdleSeconds(), 0, 0, TimeUnit.SECONDS));
                        }

                        // HTTP codec for the WebSocket handshake and the health check
                        pipeline.addLast(new HttpServerCodec());
                        pipeline.addLast(new HttpObjectAggregator(65536));

                        // WebSocket compression (optional, saves bandwidth)
                        pipeline.addLast(new WebSocketServerCompressionHandler());

                        // WebSocket protocol handler (handles handshake, ping/pong, close)
                        pipeline.addLast(new WebSocketServerProtocolHandler(
                                config.getWebsocketPath(),
                                null,      // subprotocols
                                true,      // allow extensions
                                config.getMaxFrameSize(),
                                false,     // allow mask mismatch
                                true,      // allow sub-paths of the websocket path
                                10000L     // handshake timeout ms
                        ));

                        // Plain HTTP requests on other paths
                        pipeline.addLast(new HealthCheckHandler());

                        // Relay events for this connection
                        pipeline.addLast(new WebSocketFrameHandler(relay, config.getOutboundQueueLimit()));
                    }
                });

        serverChannel = bootstrap.bind(config.getPort()).sync().channel();

        logger.info("Server started successfully!");
        logger.info("WebSocket endpoint: ws://localhost:{}{}", config.getPort(), config.getWebsocketPath());
    }

    /**
     * Starts the server and blocks until it is shut down.
     */
    public void start() throws InterruptedException {
        try {
            bind();
            // Block until the server channel is closed
            serverChannel.closeFuture().sync();
        } finally {
            shutdown();
        }
    }

    /**
     * Gracefully shuts down the server.
     * - Stops accepting new connections
     * - Stops the relay loop
     * - Releases all Netty resources
     */
    public void shutdown() {
        logger.info("Shutting down server...");

        if (serverChannel != null) {
            serverChannel.close();
        }

        relay.stop();

        // Graceful shutdown of event loops
        if (bossGroup != null) {
            bossGroup.shutdownGracefully();
        }
        if (workerGroup != null) {
            workerGroup.shutdownGracefully();
        }

        logger.info("Server shutdown complete.");
    }

    public RelayServer getRelay() {
        return relay;
    }
}
