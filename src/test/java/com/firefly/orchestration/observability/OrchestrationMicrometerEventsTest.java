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


package com.firefly.orchestration.observability;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class OrchestrationMicrometerEventsTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final OrchestrationMicrometerEvents events = new OrchestrationMicrometerEvents(registry);

    @Test
    void recordsSagaStepAndRunMeters() {
        events.onStepStarted("Checkout", "run-1", "reserve", "w1", 1);
        events.onStepSuccess("Checkout", "run-1", "reserve", 2, 150L, 0.5);
        events.onStepRetry("Checkout", "run-1", "reserve", 1, 10L, new RuntimeException("x"));
        events.onSagaCompleted("Checkout", "run-1", true);

        assertEquals(1.0, registry.get("orchestration.saga.step.started").tags("saga", "Checkout", "step", "reserve").counter().count());
        assertEquals(1.0, registry.get("orchestration.saga.step.retries").tags("step", "reserve").counter().count());
        assertEquals(1.0, registry.get("orchestration.saga.step.completed").tags("outcome", "success").counter().count());
        assertEquals(150.0, registry.get("orchestration.saga.step.latency").tags("step", "reserve").timer().totalTime(TimeUnit.MILLISECONDS), 0.001);
        assertEquals(2.0, registry.get("orchestration.saga.step.attempts").summary().totalAmount(), 0.001);
        assertEquals(1.0, registry.get("orchestration.saga.run.completed").tags("saga", "Checkout", "success", "true").counter().count());
    }

    @Test
    void recordsProblemAndWorkerMeters() {
        events.onProblemSubmitted("optimization", "p-1", 4);
        events.onTaskCompleted("optimization", "p-1", "t1", "w1", 20L);
        events.onTaskFailed("optimization", "p-1", "t2", "w2", new RuntimeException("x"), 1, true);
        events.onProblemFailed("optimization", "p-1", "no consensus");
        events.onWorkerLost("w2");

        assertEquals(1.0, registry.get("orchestration.problem.submitted").tags("type", "optimization").counter().count());
        assertEquals(4.0, registry.get("orchestration.problem.tasks").summary().totalAmount(), 0.001);
        assertEquals(1.0, registry.get("orchestration.task.completed").tags("type", "optimization").counter().count());
        assertEquals(1.0, registry.get("orchestration.task.failed").tags("retry", "true").counter().count());
        assertEquals(1.0, registry.get("orchestration.problem.failed").counter().count());
        assertEquals(1.0, registry.get("orchestration.worker.lost").counter().count());
    }
}
