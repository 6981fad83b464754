package io.pulse4j.hub;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.pulse4j.core.JobOutcome;
import io.pulse4j.core.JobRun;
import io.pulse4j.core.RunTrigger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BroadcastHubTest {

    private ConnectionRegistry registry;
    private BroadcastHub hub;

    @BeforeEach
    void setUp() {
        registry = new ConnectionRegistry(Duration.ofMinutes(5), 1);
        hub = new BroadcastHub(registry);
    }

    @AfterEach
    void tearDown() {
        registry.close();
    }

    @Test
    void publishShouldSkipBrokenConnectionAndRemoveIt() {
        RecordingHandle first = new RecordingHandle();
        RecordingHandle broken = RecordingHandle.broken();
        RecordingHandle third = new RecordingHandle();
        registry.add("user-1", first);
        String brokenId = registry.add("user-1", broken);
        registry.add("user-1", third);

        int delivered = hub.publish("user-1", Map.of("type", "pick-graded"));

        assertEquals(2, delivered);
        assertEquals(1, first.frames.size());
        assertEquals(1, third.frames.size());
        assertFalse(registry.contains("user-1", brokenId));
        assertEquals(2, registry.connections("user-1").size());
        assertEquals(1, broken.closeCalls.get());
    }

    @Test
    void publishToUnknownSubscriberShouldDeliverNothing() {
        assertEquals(0, hub.publish("nobody", Map.of("type", "noop")));
        assertTrue(registry.subscribers().isEmpty());
    }

    @Test
    void frameShouldBeSingleDataLineFollowedByBlankLine() {
        RecordingHandle handle = new RecordingHandle();
        registry.add("user-1", handle);

        hub.publish("user-1", Map.of("score", 3));

        assertEquals("data: {\"score\":3}\n\n", handle.frames.get(0));
    }

    @Test
    void publishShouldOnlyReachTheAddressedSubscriber() {
        RecordingHandle mine = new RecordingHandle();
        RecordingHandle other = new RecordingHandle();
        registry.add("user-1", mine);
        registry.add("user-2", other);

        hub.publish("user-1", Map.of("type", "private"));

        assertEquals(1, mine.frames.size());
        assertTrue(other.frames.isEmpty());
    }

    @Test
    void publishAllShouldReachEverySubscriber() {
        RecordingHandle a1 = new RecordingHandle();
        RecordingHandle a2 = new RecordingHandle();
        RecordingHandle b = new RecordingHandle();
        registry.add("user-a", a1);
        registry.add("user-a", a2);
        registry.add("user-b", b);

        assertEquals(3, hub.publishAll(Map.of("type", "maintenance")));
        assertEquals(a1.frames, b.frames);
    }

    @Test
    void unserializableEventShouldBeRejected() {
        registry.add("user-1", new RecordingHandle());
        assertThrows(IllegalArgumentException.class, () -> hub.publish("user-1", new Object()));
    }

    @Test
    void jobRunBroadcasterShouldPublishRunsAsEvents() throws Exception {
        RecordingHandle handle = new RecordingHandle();
        registry.add("ops-dashboard", handle);
        Instant started = Instant.parse("2026-03-01T06:00:00Z");
        JobRun run = new JobRun("expiry-sweep", RunTrigger.SCHEDULED, started, started.plusSeconds(2),
                JobOutcome.SUCCESS, null);

        new JobRunBroadcaster(hub).onRunCompleted(run);

        String frame = handle.frames.get(0);
        assertTrue(frame.startsWith("data: "));
        JsonNode event = new ObjectMapper().readTree(frame.substring("data: ".length()).trim());
        assertEquals(JobRunBroadcaster.EVENT_TYPE, event.get("type").asText());
        assertEquals("expiry-sweep", event.get("payload").get("jobName").asText());
        assertEquals("2026-03-01T06:00:00Z", event.get("payload").get("startedAt").asText());
    }

    @Test
    void stuckConnectionShouldNotHoldBackDeliveryToOthers() throws Exception {
        ConnectionRegistry fastTimeout = new ConnectionRegistry(Duration.ofMinutes(5), 1, Duration.ofMillis(200));
        BroadcastHub boundedHub = new BroadcastHub(fastTimeout);
        BlockingHandle stuck = new BlockingHandle();
        RecordingHandle healthy = new RecordingHandle();
        try {
            String stuckId = fastTimeout.add("user-1", stuck);
            fastTimeout.add("user-1", healthy);

            long started = System.nanoTime();
            int delivered = boundedHub.publish("user-1", Map.of("type", "odds-moved"));
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

            assertEquals(1, delivered);
            assertEquals(List.of("data: {\"type\":\"odds-moved\"}\n\n"), healthy.frames);
            assertFalse(fastTimeout.contains("user-1", stuckId));
            assertTrue(elapsedMs < 2_000, "publish waited " + elapsedMs + "ms");

            assertEquals(1, boundedHub.publish("user-1", Map.of("type", "odds-moved")));
        } finally {
            stuck.release();
            fastTimeout.close();
        }
    }

    @Test
    void eachConnectionShouldSeeEventsInPublishOrder() throws Exception {
        List<RecordingHandle> handles = List.of(new RecordingHandle(), new RecordingHandle(), new RecordingHandle());
        handles.forEach(h -> registry.add("user-1", h));
        int publishers = 4;
        int eventsPerPublisher = 100;

        ExecutorService pool = Executors.newFixedThreadPool(publishers);
        CountDownLatch go = new CountDownLatch(1);
        try {
            List<Future<?>> done = new ArrayList<>();
            for (int p = 0; p < publishers; p++) {
                int publisher = p;
                done.add(pool.submit(() -> {
                    go.await();
                    for (int seq = 0; seq < eventsPerPublisher; seq++) {
                        hub.publish("user-1", Map.of("publisher", publisher, "seq", seq));
                    }
                    return null;
                }));
            }
            go.countDown();
            for (Future<?> f : done) {
                f.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        ObjectMapper mapper = new ObjectMapper();
        for (RecordingHandle handle : handles) {
            assertEquals(publishers * eventsPerPublisher, handle.frames.size());
            int[] lastSeq = new int[publishers];
            Arrays.fill(lastSeq, -1);
            for (String frame : handle.frames) {
                JsonNode event = mapper.readTree(frame.substring("data: ".length()).trim());
                int publisher = event.get("publisher").asInt();
                int seq = event.get("seq").asInt();
                assertEquals(lastSeq[publisher] + 1, seq, "out of order for publisher " + publisher);
                lastSeq[publisher] = seq;
            }
        }
    }

    @Test
    void eventsShouldStayOrderedWhileKeepalivesInterleave() throws Exception {
        ConnectionRegistry busy = new ConnectionRegistry(Duration.ofMillis(1), 2);
        BroadcastHub busyHub = new BroadcastHub(busy);
        RecordingHandle handle = new RecordingHandle();
        try {
            busy.add("user-1", handle);
            for (int seq = 0; seq < 200; seq++) {
                assertEquals(1, busyHub.publish("user-1", Map.of("seq", seq)));
            }
        } finally {
            busy.close();
        }

        ObjectMapper mapper = new ObjectMapper();
        int expected = 0;
        for (String frame : handle.frames) {
            if (frame.startsWith(":keepalive")) {
                continue;
            }
            JsonNode event = mapper.readTree(frame.substring("data: ".length()).trim());
            assertEquals(expected++, event.get("seq").asInt());
        }
        assertEquals(200, expected);
    }

    @Test
    void dataFrameShouldSplitMultiLineJson() {
        assertEquals("data: {\ndata:   \"a\": 1\ndata: }\n\n", SseFrames.data("{\n  \"a\": 1\n}"));
    }
}
