package com.hallsync.session;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Bounded FIFO of frames waiting for a slow socket.
 *
 * When full, offering a new frame evicts the oldest one. Every frame the relay
 * broadcasts is a full snapshot, so a newer frame always supersedes an older one
 * of the same kind.
 *
 * The first frame a queue ever receives is the connection's one-off welcome and
 * has no successor. It is pinned: eviction skips it until it has been polled.
 *
 * Not thread-safe: confine to the owning channel's event loop.
 */
public class OutboundQueue {

    private final int limit;
    private final Deque<String> frames;
    private long droppedCount;
    private boolean received;
    private boolean headPinned;

    public OutboundQueue(int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive: " + limit);
        }
        this.limit = limit;
        this.frames = new ArrayDeque<>(Math.min(limit, 64));
    }

    /**
     * Appends a frame, evicting the oldest unpinned one if the queue is full.
     * If the only queued frame is pinned, the new frame is dropped instead.
     *
     * @return true if a frame was dropped to make room
     */
    public boolean offer(String frame) {
        if (!received) {
            received = true;
            headPinned = true;
        }
        if (frames.size() < limit) {
            frames.addLast(frame);
            return false;
        }
        droppedCount++;
        if (!headPinned) {
            frames.pollFirst();
        } else if (frames.size() > 1) {
            String pinned = frames.pollFirst();
            frames.pollFirst();
            frames.addFirst(pinned);
        } else {
            return true;
        }
        frames.addLast(frame);
        return true;
    }

    /**
     * @return the oldest pending frame, or null if empty
     */
    public String poll() {
        String frame = frames.pollFirst();
        if (frame != null) {
            headPinned = false;
        }
        return frame;
    }

    public boolean isEmpty() {
        return frames.isEmpty();
    }

    public int size() {
        return frames.size();
    }

    public void clear() {
        frames.clear();
        headPinned = false;
    }

    /**
     * Total frames evicted over the queue's lifetime.
     */
    public long getDroppedCount() {
        return droppedCount;
    }
}
