package com.chessws.server.network;

import java.io.IOException;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.chessws.server.registry.ConnectionHandle;

/**
 * Per-connection outbound queue. Any thread may {@link #enqueue} a frame; frames are written
 * in enqueue order by whichever thread currently holds the drain flag, so the underlying
 * sink never sees two concurrent writers.
 */
public class Outbox {
    private static final Logger LOGGER = LoggerFactory.getLogger(Outbox.class);

    static final int CLOSE_WRITE_FAILED = 1011;

    private final ConnectionHandle handle;
    private final OutboundSink sink;
    private final Queue<String> pending = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean draining = new AtomicBoolean(false);
    private volatile boolean closed;

    public Outbox(ConnectionHandle handle, OutboundSink sink) {
        this.handle = handle;
        this.sink = sink;
    }

    public void enqueue(String frame) {
        if (closed) {
            LOGGER.debug("Skip send to {} (outbox closed)", handle);
            return;
        }
        pending.add(frame);
        drain();
    }

    private void drain() {
        // re-check after releasing the flag: a frame added between the last poll and the
        // release would otherwise sit in the queue until the next enqueue
        while (!pending.isEmpty() && draining.compareAndSet(false, true)) {
            try {
                String frame;
                while (!closed && (frame = pending.poll()) != null) {
                    write(frame);
                }
            } finally {
                draining.set(false);
            }
            if (closed) {
                pending.clear();
                return;
            }
        }
    }

    private void write(String frame) {
        try {
            if (!sink.isOpen()) {
                throw new IOException("socket closed");
            }
            sink.send(frame);
            LOGGER.trace("-> {} {}", handle, frame);
        } catch (IOException e) {
            LOGGER.warn("Send to {} failed, closing connection: {}", handle, e.getMessage());
            closed = true;
            sink.close(CLOSE_WRITE_FAILED, "write failed");
        }
    }

    public void close() {
        closed = true;
        pending.clear();
    }

    public boolean isClosed() {
        return closed;
    }

    int pendingCount() {
        return pending.size();
    }
}
