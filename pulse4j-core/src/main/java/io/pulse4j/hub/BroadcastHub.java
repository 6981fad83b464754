package io.pulse4j.hub;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.pulse4j.utils.ObjectMappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Best-effort fan-out of events to live connections.
 *
 * <p>An event is serialized once per publish call and queued on every target connection, so
 * each connection sees events in publish-call order. A failed write is logged and the broken
 * connection is removed; so is a connection whose write outlasts the registry's write
 * timeout, which also bounds how long a publish call waits. Nothing escalates to the
 * publisher: the returned count only says how many local writes succeeded.
 */
public class BroadcastHub {
    private static final Logger log = LoggerFactory.getLogger(BroadcastHub.class);

    private final ConnectionRegistry registry;
    private final ObjectMapper objectMapper;

    public BroadcastHub(ConnectionRegistry registry, ObjectMapper objectMapper) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    public BroadcastHub(ConnectionRegistry registry) {
        this(registry, ObjectMappers.create());
    }

    /**
     * Deliver an event to every live connection of one subscriber.
     *
     * @return number of connections written to; 0 when nobody is listening
     */
    public int publish(String subscriberId, Object event) {
        Objects.requireNonNull(subscriberId, "subscriberId must not be null");
        List<Connection> connections = registry.connections(subscriberId);
        if (connections.isEmpty()) {
            log.debug("Hub publish skipped; no live connections subscriberId={}", subscriberId);
            return 0;
        }
        return deliver(connections, frame(event));
    }

    /**
     * Deliver an event to every live connection of every subscriber.
     */
    public int publishAll(Object event) {
        String frame = frame(event);
        int delivered = 0;
        for (String subscriberId : registry.subscribers()) {
            delivered += deliver(registry.connections(subscriberId), frame);
        }
        log.debug("Hub broadcast delivered={}", delivered);
        return delivered;
    }

    public ConnectionRegistry registry() {
        return registry;
    }

    // Queues the frame on every connection first, then waits for all of them against one deadline.
    private int deliver(List<Connection> connections, String frame) {
        List<CompletableFuture<Boolean>> pending = new ArrayList<>(connections.size());
        for (Connection connection : connections) {
            pending.add(connection.enqueue(frame));
        }

        long deadline = System.nanoTime() + registry.writeTimeout().toNanos();
        int delivered = 0;
        for (int i = 0; i < connections.size(); i++) {
            Connection connection = connections.get(i);
            try {
                long remaining = Math.max(0L, deadline - System.nanoTime());
                if (pending.get(i).get(remaining, TimeUnit.NANOSECONDS)) {
                    delivered++;
                }
            } catch (ExecutionException e) {
                log.warn("Hub delivery failed; removing connection subscriberId={} connectionId={} msg={}",
                        connection.subscriberId(), connection.id(), e.getCause().getMessage());
                registry.remove(connection.subscriberId(), connection.id());
            } catch (TimeoutException e) {
                log.warn("Hub delivery timed out; removing connection subscriberId={} connectionId={} timeoutMs={}",
                        connection.subscriberId(), connection.id(), registry.writeTimeout().toMillis());
                registry.remove(connection.subscriberId(), connection.id());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.debug("Hub publish interrupted while waiting for writes delivered={}", delivered);
                return delivered;
            }
        }
        return delivered;
    }

    private String frame(Object event) {
        Objects.requireNonNull(event, "event must not be null");
        try {
            return SseFrames.data(objectMapper.writeValueAsString(event));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Event is not serializable: " + event.getClass().getName(), e);
        }
    }
}
