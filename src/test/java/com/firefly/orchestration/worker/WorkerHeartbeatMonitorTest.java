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

import com.firefly.orchestration.observability.NoOpOrchestrationEvents;
import com.firefly.orchestration.store.InMemoryStateStore;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WorkerHeartbeatMonitorTest {

    @Test
    void sweepMarksSilentWorkersOffline() {
        MutableClock clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
        WorkerRegistry registry = new WorkerRegistry(new InMemoryStateStore(), NoOpOrchestrationEvents.INSTANCE,
                WorkerRegistry.DEFAULT_SMOOTHING_FACTOR, clock);
        registry.register(WorkerAgent.of("w1", 1, "solve"));
        WorkerHeartbeatMonitor monitor = new WorkerHeartbeatMonitor(registry, Duration.ofSeconds(1),
                Duration.ofSeconds(30));

        assertEquals(List.of(), monitor.sweepOnce());
        clock.advance(Duration.ofMinutes(1));
        assertEquals(List.of("w1"), monitor.sweepOnce());
        assertEquals(WorkerStatus.OFFLINE, registry.get("w1").orElseThrow().status());
    }

    @Test
    void startAndStopAreIdempotent() {
        WorkerRegistry registry = new WorkerRegistry(new InMemoryStateStore(), NoOpOrchestrationEvents.INSTANCE);
        WorkerHeartbeatMonitor monitor = new WorkerHeartbeatMonitor(registry, Duration.ofMillis(50),
                Duration.ofSeconds(30));
        monitor.start();
        monitor.start();
        assertTrue(monitor.isRunning());
        monitor.stop();
        monitor.stop();
        assertFalse(monitor.isRunning());
    }
}
