package io.pulse4j.internal;

import io.pulse4j.core.JobOutcome;
import io.pulse4j.core.JobRun;
import io.pulse4j.core.RunTrigger;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryJobRunStoreTest {

    @Test
    void recentShouldReturnNewestFirstAndHonorRetention() {
        InMemoryJobRunStore store = new InMemoryJobRunStore(3);
        Instant base = Instant.parse("2026-01-01T00:00:00Z");
        for (int i = 0; i < 5; i++) {
            store.append(run("webhook-replay", base.plusSeconds(i)));
        }

        List<JobRun> recent = store.recent("webhook-replay", 10);

        assertEquals(3, recent.size());
        assertEquals(base.plusSeconds(4), recent.get(0).startedAt());
        assertEquals(base.plusSeconds(2), recent.get(2).startedAt());
        assertEquals(base.plusSeconds(4), store.last("webhook-replay").orElseThrow().startedAt());
    }

    @Test
    void unknownJobShouldHaveNoHistory() {
        InMemoryJobRunStore store = new InMemoryJobRunStore(3);
        assertTrue(store.recent("nothing", 5).isEmpty());
        assertTrue(store.last("nothing").isEmpty());
    }

    private static JobRun run(String name, Instant startedAt) {
        return new JobRun(name, RunTrigger.SCHEDULED, startedAt, startedAt.plusMillis(5), JobOutcome.SUCCESS, null);
    }
}
