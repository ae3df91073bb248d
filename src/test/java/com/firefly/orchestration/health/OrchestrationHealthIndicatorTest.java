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


package com.firefly.orchestration.health;

import com.firefly.orchestration.engine.OrchestrationEngine;
import com.firefly.orchestration.worker.WorkerAgent;
import com.firefly.orchestration.worker.WorkerRegistry;
import com.firefly.orchestration.worker.WorkerStatus;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class OrchestrationHealthIndicatorTest {

    private static final Duration WINDOW = Duration.ofMinutes(5);

    private OrchestrationEngine engine(List<String> stalled) {
        OrchestrationEngine engine = mock(OrchestrationEngine.class);
        WorkerRegistry registry = mock(WorkerRegistry.class);
        when(registry.all()).thenReturn(List.of(
                WorkerAgent.of("w1", 2, "compute"),
                WorkerAgent.of("w2", 2, "compute").withStatus(WorkerStatus.BUSY),
                WorkerAgent.of("w3", 2, "compute").withStatus(WorkerStatus.OFFLINE)));
        when(engine.workers()).thenReturn(registry);
        when(engine.stalledExecutions(WINDOW)).thenReturn(stalled);
        when(engine.runningSagas()).thenReturn(List.of("run-1"));
        when(engine.activeProblems()).thenReturn(List.of("p-1", "p-2"));
        return engine;
    }

    @Test
    void upWithWorkerDetailsWhenNothingIsStalled() {
        Health health = new OrchestrationHealthIndicator(engine(List.of()), WINDOW).health();

        assertEquals(Status.UP, health.getStatus());
        assertEquals(1, health.getDetails().get("runningSagas"));
        assertEquals(2, health.getDetails().get("activeProblems"));
        assertEquals(3, health.getDetails().get("workersTotal"));
        assertEquals(2L, health.getDetails().get("workersOnline"));
        assertEquals(1L, health.getDetails().get("workersBusy"));
        assertFalse(health.getDetails().containsKey("stalledExecutions"));
    }

    @Test
    void downListingStalledExecutions() {
        Health health = new OrchestrationHealthIndicator(engine(List.of("p-2")), WINDOW).health();

        assertEquals(Status.DOWN, health.getStatus());
        assertEquals(List.of("p-2"), health.getDetails().get("stalledExecutions"));
        assertEquals(WINDOW.toMillis(), health.getDetails().get("stallWindowMs"));
    }

    @Test
    void downWhenCollectionFails() {
        OrchestrationEngine engine = mock(OrchestrationEngine.class);
        when(engine.stalledExecutions(any())).thenThrow(new IllegalStateException("store offline"));

        Health health = new OrchestrationHealthIndicator(engine, WINDOW).health();

        assertEquals(Status.DOWN, health.getStatus());
        assertTrue(String.valueOf(health.getDetails().get("error")).contains("store offline"));
    }
}
