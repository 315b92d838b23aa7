package com.hallsync.session;

import io.netty.channel.Channel;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A WebSocket connection backed by a Netty channel.
 *
 * Outbound frames pass through a bounded {@link OutboundQueue} owned by the
 * channel's event loop: frames are written only while the channel is writable,
 * and the queue drops its oldest frame when a slow client falls too far behind.
 * The first frame sent (the welcome) is never dropped.
 *
 * Thread Safety:
 * - {@link #send} may be called from any thread; it hops onto the channel's event loop
 * - The queue itself is only touched from that event loop
 */
public class ClientSession implements Connection {

    private static final Logger logger = LoggerFactory.getLogger(ClientSession.class);

    private final Channel channel;
    private final String label;
    private final OutboundQueue outbound;

    public ClientSession(Channel channel, int outboundQueueLimit) {
        this.channel = channel;
        this.label = channel.id().asShortText();
        this.outbound = new OutboundQueue(outboundQueueLimit);
    }

    @Override
    public String label() {
        return label;
    }

    @Override
    public void send(String text) {
        if (!channel.isActive()) {
            return;
        }
        if (channel.eventLoop().inEventLoop()) {
            enqueue(text);
        } else {
            channel.eventLoop().execute(() -> enqueue(text));
        }
    }

    private void enqueue(String text) {
        if (outbound.offer(text)) {
            logger.debug("Outbound queue full for {}, dropped oldest frame ({} dropped so far)",
                    label, outbound.getDroppedCount());
        }
        drain();
    }

    /**
     * Writes pending frames while the channel accepts them.
     * Called again by the handler when the channel becomes writable.
     */
    public void drain() {
        if (!channel.isActive()) {
            outbound.clear();
            return;
        }
        boolean wrote = false;
        while (channel.isWritable() && !outbound.isEmpty()) {
            channel.write(new TextWebSocketFrame(outbound.poll()));
            wrote = true;
        }
        if (wrote) {
            channel.flush();
        }
    }

    @Override
    public boolean isOpen() {
        return channel.isActive();
    }

    @Override
    public String toString() {
        return "ClientSession{" +
                "channel='" + label + '\'' +
                ", active=" + isOpen() +
                ", pending=" + outbound.size() +
                '}';
    }
}
