package com.hallsync.session;

import java.util.ArrayList;
import java.util.List;

/**
 * In-memory {@link Connection} that records every frame sent to it.
 */
public class RecordingConnection implements Connection {

    private final String label;
    private final List<String> sent = new ArrayList<>();
    private volatile boolean open = true;

    public RecordingConnection(String label) {
        this.label = label;
    }

    @Override
    public String label() {
        return label;
    }

    @Override
    public synchronized void send(String text) {
        if (open) {
            sent.add(text);
        }
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    public void close() {
        open = false;
    }

    public synchronized List<String> sent() {
        return new ArrayList<>(sent);
    }

    public synchronized void clear() {
        sent.clear();
    }

    @Override
    public String toString() {
        return label;
    }
}
