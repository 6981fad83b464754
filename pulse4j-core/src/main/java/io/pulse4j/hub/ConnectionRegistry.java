package io.pulse4j.hub;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Live connections grouped by subscriber.
 *
 * <p>Every mutation is an atomic update scoped to one subscriber key. A subscriber without
 * connections has no entry at all. Each connection carries a fixed-rate keepalive that
 * removes it on the first failed write.
 *
 * <p>Heartbeat ticks and publishers never write to a transport themselves: they queue frames
 * on the connection, and a shared writer pool drains each queue serially. A connection whose
 * write has been stuck for longer than the write timeout is removed.
 *
 * <p>State lives in this process only; fan-out does not reach clients connected to other
 * instances.
 */
public class ConnectionRegistry implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ConnectionRegistry.class);

    public static final Duration DEFAULT_WRITE_TIMEOUT = Duration.ofSeconds(10);

    private final ConcurrentHashMap<String, Map<String, Connection>> bySubscriber = new ConcurrentHashMap<>();
    private final ScheduledExecutorService heartbeatPool;
    private final ExecutorService writerPool;
    private final Duration heartbeatInterval;
    private final Duration writeTimeout;
    private final Clock clock;

    public ConnectionRegistry(Duration heartbeatInterval, int heartbeatThreads) {
        this(heartbeatInterval, heartbeatThreads, DEFAULT_WRITE_TIMEOUT);
    }

    /**
     * Creates a registry that owns its heartbeat and writer threads and releases them on
     * {@link #close()}.
     *
     * @param writeTimeout how long a single frame may stay on a transport before the
     *                     connection counts as stuck
     */
    public ConnectionRegistry(Duration heartbeatInterval, int heartbeatThreads, Duration writeTimeout) {
        this.heartbeatInterval = requirePositive(heartbeatInterval, "heartbeatInterval");
        this.writeTimeout = requirePositive(writeTimeout, "writeTimeout");
        this.heartbeatPool = newHeartbeatPool(heartbeatThreads);
        this.writerPool = Executors.newCachedThreadPool(daemonThreads("pulse4j.writer-"));
        this.clock = Clock.systemUTC();
    }

    /**
     * Register a connection and arm its keepalive.
     *
     * @return the generated connection id, needed for {@link #remove(String, String)}
     */
    public String add(String subscriberId, ConnectionHandle handle) {
        Objects.requireNonNull(subscriberId, "subscriberId must not be null");
        if (subscriberId.isBlank()) {
            throw new IllegalArgumentException("subscriberId must not be blank");
        }
        Objects.requireNonNull(handle, "handle must not be null");

        String connectionId = UUID.randomUUID().toString();
        Connection connection = new Connection(connectionId, subscriberId, handle, clock.instant(), writerPool);

        bySubscriber.compute(subscriberId, (key, connections) -> {
            Map<String, Connection> target = connections != null ? connections : new ConcurrentHashMap<>();
            target.put(connectionId, connection);
            return target;
        });

        long periodMs = heartbeatInterval.toMillis();
        ScheduledFuture<?> task = heartbeatPool.scheduleAtFixedRate(
                () -> heartbeat(connection), periodMs, periodMs, TimeUnit.MILLISECONDS);
        connection.armHeartbeat(task);

        log.debug("Connection added subscriberId={} connectionId={}", subscriberId, connectionId);
        return connectionId;
    }

    /**
     * Remove a connection. Removing an unknown or already removed connection is a no-op.
     *
     * @return whether a connection was removed by this call
     */
    public boolean remove(String subscriberId, String connectionId) {
        if (subscriberId == null || connectionId == null) {
            return false;
        }
        Connection[] removed = new Connection[1];
        bySubscriber.computeIfPresent(subscriberId, (key, connections) -> {
            removed[0] = connections.remove(connectionId);
            return connections.isEmpty() ? null : connections;
        });
        if (removed[0] == null) {
            return false;
        }
        removed[0].markRemoved();
        log.debug("Connection removed subscriberId={} connectionId={}", subscriberId, connectionId);
        return true;
    }

    /**
     * Snapshot of the live connections of a subscriber.
     */
    public List<Connection> connections(String subscriberId) {
        Map<String, Connection> connections = bySubscriber.get(subscriberId);
        return connections == null ? List.of() : new ArrayList<>(connections.values());
    }

    /**
     * Snapshot of the subscribers with at least one live connection.
     */
    public Set<String> subscribers() {
        return Set.copyOf(bySubscriber.keySet());
    }

    public int connectionCount() {
        int count = 0;
        for (Map<String, Connection> connections : bySubscriber.values()) {
            count += connections.size();
        }
        return count;
    }

    public boolean contains(String subscriberId, String connectionId) {
        Map<String, Connection> connections = bySubscriber.get(subscriberId);
        return connections != null && connections.containsKey(connectionId);
    }

    public Duration heartbeatInterval() {
        return heartbeatInterval;
    }

    public Duration writeTimeout() {
        return writeTimeout;
    }

    /**
     * Remove every connection, closing the transports.
     */
    @Override
    public void close() {
        for (String subscriberId : subscribers()) {
            for (Connection connection : connections(subscriberId)) {
                remove(subscriberId, connection.id());
            }
        }
        heartbeatPool.shutdownNow();
        writerPool.shutdown();
    }

    private void heartbeat(Connection connection) {
        if (!contains(connection.subscriberId(), connection.id())) {
            connection.markRemoved();
            return;
        }
        if (connection.stalledFor().compareTo(writeTimeout) > 0) {
            log.warn("Connection write stalled; removing connection subscriberId={} connectionId={} stalledMs={}",
                    connection.subscriberId(), connection.id(), connection.stalledFor().toMillis());
            remove(connection.subscriberId(), connection.id());
            return;
        }
        connection.heartbeat(SseFrames.keepalive(clock.millis()), clock.instant())
                .whenComplete((written, error) -> {
                    if (error != null) {
                        log.debug("Keepalive failed; removing connection subscriberId={} connectionId={} msg={}",
                                connection.subscriberId(), connection.id(), error.getMessage());
                        remove(connection.subscriberId(), connection.id());
                    }
                });
    }

    private static Duration requirePositive(Duration value, String name) {
        Objects.requireNonNull(value, name + " must not be null");
        if (value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be a positive duration");
        }
        return value;
    }

    private static ScheduledExecutorService newHeartbeatPool(int threads) {
        if (threads <= 0) {
            throw new IllegalArgumentException("heartbeatThreads must be positive");
        }
        return Executors.newScheduledThreadPool(threads, daemonThreads("pulse4j.heartbeat-"));
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r);
            t.setName(prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
