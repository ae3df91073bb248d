/*
 * Copyright 2025 Firefly Software Solutions Inc
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package com.firefly.orchestration.worker;

import com.firefly.orchestration.exception.DuplicateIdentityException;
import com.firefly.orchestration.exception.IllegalStateTransitionException;
import com.firefly.orchestration.observability.OrchestrationEvents;
import com.firefly.orchestration.store.InMemoryStateStore;
import com.firefly.orchestration.store.StateStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class WorkerRegistryTest {

    private StateStore store;
    private OrchestrationEvents events;
    private MutableClock clock;
    private WorkerRegistry registry;

    @BeforeEach
    void setUp() {
        store = new InMemoryStateStore();
        events = mock(OrchestrationEvents.class);
        clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
        registry = new WorkerRegistry(store, events, 0.05, clock);
    }

    @Test
    void registerStoresWorkerAndEmitsEvent() {
        registry.register(WorkerAgent.of("w1", 2, "payment"));

        WorkerAgent stored = registry.get("w1").orElseThrow();
        assertEquals(Set.of("payment"), stored.capabilities());
        assertEquals(clock.instant(), stored.lastHeartbeat());
        assertTrue(store.get("worker/w1", WorkerAgent.class).isPresent());
        verify(events).onWorkerRegistered("w1", Set.of("payment"));
    }

    @Test
    void reRegistrationOverwritesUnlessCapabilitiesAreLocked() {
        registry.register(WorkerAgent.of("w1", 2, "a"));
        registry.register(WorkerAgent.of("w1", 4, "b"));
        assertEquals(Set.of("b"), registry.get("w1").orElseThrow().capabilities());

        registry.register(WorkerAgent.of("w2", 2, "a").withCapabilitiesLocked(true));
        assertThrows(DuplicateIdentityException.class,
                () -> registry.register(WorkerAgent.of("w2", 2, "b")));
        // same capabilities are accepted even when locked
        registry.register(WorkerAgent.of("w2", 8, "a").withCapabilitiesLocked(true));
        assertEquals(8d, registry.get("w2").orElseThrow().maxLoad());
    }

    @Test
    void findMatchPrefersLowestLoadRatioThenBestSuccessRate() {
        registry.register(WorkerAgent.of("busy", 2, "solve"));
        registry.register(WorkerAgent.of("fresh", 2, "solve"));
        registry.register(WorkerAgent.of("flaky", 2, "solve").withSuccessRate(0.5));
        registry.register(WorkerAgent.of("other", 2, "render"));
        assertTrue(registry.reserve("busy", 1));

        assertEquals("fresh", registry.findMatch(Set.of("solve")).orElseThrow().id());
        assertEquals("other", registry.findMatch(Set.of("render")).orElseThrow().id());
        assertTrue(registry.findMatch(Set.of("solve", "render")).isEmpty());
    }

    @Test
    void saturatedAndOfflineWorkersAreNotMatched() {
        registry.register(WorkerAgent.of("w1", 1, "solve"));
        assertTrue(registry.reserve("w1", 1));
        assertEquals(WorkerStatus.BUSY, registry.get("w1").orElseThrow().status());
        assertTrue(registry.findMatch(Set.of("solve")).isEmpty());
        assertTrue(registry.hasCapableWorker(Set.of("solve")));
        assertFalse(registry.reserve("w1", 1), "a saturated worker refuses further work");

        registry.release("w1", 1);
        assertEquals(WorkerStatus.IDLE, registry.get("w1").orElseThrow().status());
        registry.markStatus("w1", WorkerStatus.OFFLINE);
        assertTrue(registry.findMatch(Set.of("solve")).isEmpty());
        assertFalse(registry.hasCapableWorker(Set.of("solve")));
    }

    @Test
    void recordOutcomeAppliesMovingAverageAndReleasesLoad() {
        registry.register(WorkerAgent.of("w1", 4, "solve"));
        registry.reserve("w1", 2);

        WorkerAgent afterFailure = registry.recordOutcome("w1", false, 1).orElseThrow();
        assertEquals(0.95, afterFailure.successRate(), 1e-9);
        assertEquals(1d, afterFailure.currentLoad(), 1e-9);

        WorkerAgent afterSuccess = registry.recordOutcome("w1", true, 5).orElseThrow();
        assertEquals(0.95 * 0.95 + 0.05, afterSuccess.successRate(), 1e-9);
        assertEquals(0d, afterSuccess.currentLoad(), 1e-9, "load never drops below zero");
        assertTrue(registry.recordOutcome("missing", true, 1).isEmpty());
    }

    @Test
    void goingOfflineNotifiesLossListenersOnce() {
        List<String> lost = new ArrayList<>();
        registry.addLossListener(lost::add);
        registry.addLossListener(id -> { throw new IllegalStateException("listener boom"); });
        registry.register(WorkerAgent.of("w1", 1, "solve"));

        registry.markStatus("w1", WorkerStatus.OFFLINE);
        assertEquals(List.of("w1"), lost);
        verify(events).onWorkerLost("w1");

        assertThrows(IllegalStateTransitionException.class, () -> registry.markStatus("w1", WorkerStatus.OFFLINE));
        assertEquals(1, lost.size());
    }

    @Test
    void deregisteringAnOnlineWorkerCountsAsLoss() {
        List<String> lost = new ArrayList<>();
        registry.addLossListener(lost::add);
        registry.register(WorkerAgent.of("w1", 1, "solve"));

        assertTrue(registry.deregister("w1"));
        assertFalse(registry.deregister("w1"));
        assertEquals(List.of("w1"), lost);
        assertTrue(registry.get("w1").isEmpty());
    }

    @Test
    void staleHeartbeatsExpireAndHeartbeatRevives() {
        registry.register(WorkerAgent.of("old", 1, "solve"));
        clock.advance(Duration.ofSeconds(20));
        registry.register(WorkerAgent.of("young", 1, "solve"));
        clock.advance(Duration.ofSeconds(15));

        assertEquals(List.of("old"), registry.expireStaleWorkers(Duration.ofSeconds(30)));
        assertEquals(WorkerStatus.OFFLINE, registry.get("old").orElseThrow().status());
        assertEquals(WorkerStatus.IDLE, registry.get("young").orElseThrow().status());

        assertTrue(registry.heartbeat("old"));
        assertEquals(WorkerStatus.IDLE, registry.get("old").orElseThrow().status());
        assertFalse(registry.heartbeat("unknown"));
    }

    @Test
    void concurrentReservationsNeverExceedCapacity() throws Exception {
        registry.register(WorkerAgent.of("w1", 10, "solve"));
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            results.add(pool.submit(() -> {
                start.await();
                return registry.reserve("w1", 1);
            }));
        }
        start.countDown();
        int granted = 0;
        for (var f : results) {
            if (f.get(5, TimeUnit.SECONDS)) granted++;
        }
        pool.shutdownNow();

        assertEquals(10, granted);
        Optional<WorkerAgent> w = registry.get("w1");
        assertEquals(10d, w.orElseThrow().currentLoad(), 1e-9);
    }
}
