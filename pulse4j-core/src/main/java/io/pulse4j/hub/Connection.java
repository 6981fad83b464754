package io.pulse4j.hub;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;

/**
 * One live connection owned by the {@link ConnectionRegistry}.
 *
 * <p>Frames go through a per-connection outbound queue drained by at most one writer at a
 * time, so they never interleave or reorder, and a transport that blocks only holds up its
 * own queue. Once removed, a connection accepts no further frames. The transport is closed
 * after the in-flight write, if any, has returned.
 */
public final class Connection {
    private static final Logger log = LoggerFactory.getLogger(Connection.class);

    private final String id;
    private final String subscriberId;
    private final ConnectionHandle handle;
    private final Instant acceptedAt;
    private final Executor writer;

    private volatile Instant lastHeartbeatAt;
    private volatile long writeStartedNanos;

    // guarded by this
    private final ArrayDeque<Outbound> outbound = new ArrayDeque<>();
    private boolean draining;
    private boolean removed;
    private boolean broken;
    private boolean closed;
    private ScheduledFuture<?> heartbeat;

    Connection(String id, String subscriberId, ConnectionHandle handle, Instant acceptedAt, Executor writer) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.subscriberId = Objects.requireNonNull(subscriberId, "subscriberId must not be null");
        this.handle = Objects.requireNonNull(handle, "handle must not be null");
        this.writer = Objects.requireNonNull(writer, "writer must not be null");
        this.acceptedAt = acceptedAt;
        this.lastHeartbeatAt = acceptedAt;
    }

    public String id() {
        return id;
    }

    public String subscriberId() {
        return subscriberId;
    }

    public Instant acceptedAt() {
        return acceptedAt;
    }

    public Instant lastHeartbeatAt() {
        return lastHeartbeatAt;
    }

    public synchronized boolean isRemoved() {
        return removed;
    }

    /**
     * Queue a frame behind every frame queued before it.
     *
     * @return completes with {@code true} once written, {@code false} if the connection was
     * removed before the frame went out, or exceptionally with a {@link DeliveryFailureException}
     */
    CompletableFuture<Boolean> enqueue(String frame) {
        Outbound next = new Outbound(frame);
        boolean startDrain;
        synchronized (this) {
            if (removed) {
                return CompletableFuture.completedFuture(false);
            }
            if (broken) {
                return CompletableFuture.failedFuture(
                        new DeliveryFailureException(subscriberId, id, "an earlier write failed"));
            }
            outbound.add(next);
            startDrain = !draining;
            draining = true;
        }
        if (startDrain) {
            try {
                writer.execute(this::drain);
            } catch (RejectedExecutionException e) {
                abandon(e);
            }
        }
        return next.result;
    }

    /**
     * Queue a keepalive frame; the last-heartbeat time moves once it is written.
     */
    CompletableFuture<Boolean> heartbeat(String frame, Instant at) {
        return enqueue(frame).thenApply(written -> {
            if (written) {
                lastHeartbeatAt = at;
            }
            return written;
        });
    }

    /**
     * How long the write currently on the transport has been running; zero when idle.
     */
    Duration stalledFor() {
        long started = writeStartedNanos;
        return started == 0 ? Duration.ZERO : Duration.ofNanos(System.nanoTime() - started);
    }

    synchronized void armHeartbeat(ScheduledFuture<?> task) {
        if (removed) {
            task.cancel(false);
            return;
        }
        this.heartbeat = task;
    }

    /**
     * Stops the heartbeat, drops queued frames and closes the transport. Only the first call
     * has an effect.
     */
    void markRemoved() {
        List<Outbound> dropped;
        boolean closeNow;
        synchronized (this) {
            if (removed) {
                return;
            }
            removed = true;
            if (heartbeat != null) {
                heartbeat.cancel(false);
                heartbeat = null;
            }
            dropped = takeQueued();
            closeNow = !draining;
            if (closeNow) {
                closed = true;
            }
        }
        dropped.forEach(o -> o.result.complete(false));
        if (closeNow) {
            closeTransport();
        }
    }

    private void drain() {
        while (true) {
            Outbound next;
            boolean closeNow = false;
            synchronized (this) {
                next = removed ? null : outbound.poll();
                if (next == null) {
                    draining = false;
                    if (removed && !closed) {
                        closed = true;
                        closeNow = true;
                    }
                }
            }
            if (next == null) {
                if (closeNow) {
                    closeTransport();
                }
                return;
            }

            writeStartedNanos = System.nanoTime();
            try {
                handle.send(next.frame);
            } catch (IOException | RuntimeException e) {
                writeStartedNanos = 0;
                abandon(e);
                next.result.completeExceptionally(new DeliveryFailureException(subscriberId, id, e));
                return;
            }
            writeStartedNanos = 0;
            next.result.complete(true);
        }
    }

    // The writer gives up on this connection: later frames fail fast until it is removed.
    private void abandon(Exception cause) {
        List<Outbound> dropped;
        boolean closeNow = false;
        synchronized (this) {
            broken = true;
            draining = false;
            dropped = takeQueued();
            if (removed && !closed) {
                closed = true;
                closeNow = true;
            }
        }
        dropped.forEach(o -> o.result.completeExceptionally(new DeliveryFailureException(subscriberId, id, cause)));
        if (closeNow) {
            closeTransport();
        }
    }

    private List<Outbound> takeQueued() {
        List<Outbound> queued = new ArrayList<>(outbound);
        outbound.clear();
        return queued;
    }

    private void closeTransport() {
        try {
            handle.close();
        } catch (RuntimeException e) {
            log.debug("Connection close failed subscriberId={} connectionId={} msg={}", subscriberId, id, e.getMessage());
        }
    }

    @Override
    public String toString() {
        return "Connection{id=" + id + ", subscriberId=" + subscriberId + "}";
    }

    private static final class Outbound {
        final String frame;
        final CompletableFuture<Boolean> result = new CompletableFuture<>();

        Outbound(String frame) {
            this.frame = frame;
        }
    }
}
