package com.hallsync.handler;

import com.hallsync.relay.RelayServer;
import com.hallsync.session.ClientSession;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import io.netty.handler.timeout.IdleState;
import io.netty.handler.timeout.IdleStateEvent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bridges one Netty channel to the relay.
 *
 * Lifecycle:
 * - Handshake complete: wrap the channel in a {@link ClientSession} and report the connect
 * - Text frame: forward the raw payload; decoding happens on the relay loop
 * - Channel inactive: report the disconnect. Clean closes, resets and idle timeouts all end here
 *
 * Threading Model:
 * - One handler instance per channel, always called on that channel's event loop
 * - Nothing here mutates shared state; the relay serializes all events
 *
 * Important: Never block in this handler! Use async operations for I/O.
 */
public class WebSocketFrameHandler extends SimpleChannelInboundHandler<WebSocketFrame> {

    private static final Logger logger = LoggerFactory.getLogger(WebSocketFrameHandler.class);

    private final RelayServer relay;
    private final int outboundQueueLimit;
    private ClientSession session;

    public WebSocketFrameHandler(RelayServer relay, int outboundQueueLimit) {
        this.relay = relay;
        this.outboundQueueLimit = outboundQueueLimit;
    }

    /**
     * Called when a WebSocket frame is received.
     */
    @Override
    protected void channelRead0(ChannelHandlerContext ctx, WebSocketFrame frame) {
        // We only handle text frames (JSON messages)
        if (!(frame instanceof TextWebSocketFrame)) {
            logger.debug("Ignoring {} on {}", frame.getClass().getSimpleName(), ctx.channel().id());
            return;
        }
        if (session == null) {
            return;
        }
        relay.onMessage(session, ((TextWebSocketFrame) frame).text());
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof WebSocketServerProtocolHandler.HandshakeComplete) {
            session = new ClientSession(ctx.channel(), outboundQueueLimit);
            logger.debug("Handshake complete: {}", session.label());
            relay.onConnect(session);
            return;
        }
        if (evt instanceof IdleStateEvent) {
            IdleStateEvent e = (IdleStateEvent) evt;
            if (e.state() == IdleState.READER_IDLE) {
                if (e.isFirst() && session != null) {
                    // Any pong resets the reader idle timer
                    ctx.writeAndFlush(new PingWebSocketFrame());
                } else {
                    logger.warn("Connection idle timeout, closing: {}", ctx.channel().id());
                    ctx.close();
                }
            }
            return;
        }
        super.userEventTriggered(ctx, evt);
    }

    @Override
    public void channelWritabilityChanged(ChannelHandlerContext ctx) throws Exception {
        if (session != null && ctx.channel().isWritable()) {
            session.drain();
        }
        super.channelWritabilityChanged(ctx);
    }

    /**
     * Called when the connection is gone, whatever the reason.
     */
    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        if (session != null) {
            relay.onDisconnect(session);
            session = null;
        }
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        logger.warn("WebSocket error on {}: {}", ctx.channel().id(), cause.toString());
        ctx.close();
    }
}
