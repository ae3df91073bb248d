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

import com.firefly.orchestration.consensus.ConsensusRecord;
import com.firefly.orchestration.consensus.PerformanceMetrics;
import com.firefly.orchestration.consensus.Solution;
import com.firefly.orchestration.events.EventStream;
import com.firefly.orchestration.events.OrchestrationEvent;
import com.firefly.orchestration.events.OrchestrationEventType;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class EventStreamPublisherTest {

    private final EventStream stream = new EventStream();
    private final EventStreamPublisher publisher = new EventStreamPublisher(stream);

    private List<OrchestrationEventType> types(String aggregateId) {
        return stream.history(aggregateId).stream().map(OrchestrationEvent::type).collect(Collectors.toList());
    }

    @Test
    void sagaHooksMapToWireEvents() {
        publisher.onSagaStarted("Checkout", "run-1");
        publisher.onStepStarted("Checkout", "run-1", "reserve", "w1", 1);
        publisher.onStepSuccess("Checkout", "run-1", "reserve", 1, 12L, 0.5);
        publisher.onStepRetry("Checkout", "run-1", "charge", 1, 100L, new RuntimeException("timeout"));
        publisher.onStepFailed("Checkout", "run-1", "charge", new RuntimeException("declined"), 3, 40L);
        publisher.onCompensationStarted("Checkout", "run-1", "reserve");
        publisher.onCompensated("Checkout", "run-1", "reserve", null);
        publisher.onSagaCompleted("Checkout", "run-1", false);

        assertEquals(List.of(
                OrchestrationEventType.SAGA_STARTED,
                OrchestrationEventType.SAGA_STEP_COMPLETED,
                OrchestrationEventType.SAGA_STEP_FAILED,
                OrchestrationEventType.SAGA_STEP_FAILED,
                OrchestrationEventType.SAGA_STEP_COMPENSATED,
                OrchestrationEventType.SAGA_COMPENSATED,
                OrchestrationEventType.SAGA_FAILED), types("run-1"));

        List<OrchestrationEvent> history = stream.history("run-1");
        OrchestrationEvent retry = history.get(2);
        assertEquals("charge", retry.subjectId());
        assertEquals(Boolean.TRUE, retry.payload().get("willRetry"));
        assertEquals("timeout", retry.payload().get("error"));
        OrchestrationEvent exhausted = history.get(3);
        assertEquals(Boolean.FALSE, exhausted.payload().get("willRetry"));
        assertEquals(3, exhausted.payload().get("attempts"));
    }

    @Test
    void successfulSagaPublishesCompleted() {
        publisher.onSagaStarted("Checkout", "run-2");
        publisher.onSagaCompleted("Checkout", "run-2", true);
        publisher.onCompensated("Checkout", "run-3", "reserve", new IllegalStateException("gone"));

        assertEquals(List.of(OrchestrationEventType.SAGA_STARTED, OrchestrationEventType.SAGA_COMPLETED), types("run-2"));
        assertEquals(List.of(OrchestrationEventType.SAGA_COMPENSATION_FAILED), types("run-3"));
    }

    @Test
    void problemAndWorkerHooksMapToWireEvents() {
        Solution solution = new Solution("p-1", 42, 0.9,
                new ConsensusRecord(true, 1.0, 0.8, 1, "majority", List.of()),
                new PerformanceMetrics(Duration.ofMillis(30), Duration.ofMillis(60), 2), Map.of());

        publisher.onProblemSubmitted("optimization", "p-1", 4);
        publisher.onTaskScheduled("optimization", "p-1", "t1", "w1", 1);
        publisher.onTaskFailed("optimization", "p-1", "t1", "w1", new RuntimeException("lost"), 1, true);
        publisher.onTaskCompleted("optimization", "p-1", "t1", "w2", 5L);
        publisher.onValidationRound("optimization", "p-1", 1, 1.0, false);
        publisher.onProblemSolved("optimization", "p-1", solution);
        publisher.onWorkerRegistered("w9", Set.of("b", "a"));
        publisher.onWorkerLost("w9");

        assertEquals(List.of(
                OrchestrationEventType.PROBLEM_SUBMITTED,
                OrchestrationEventType.PROBLEM_TASK_SCHEDULED,
                OrchestrationEventType.PROBLEM_TASK_FAILED,
                OrchestrationEventType.PROBLEM_TASK_COMPLETED,
                OrchestrationEventType.PROBLEM_SOLVED), types("p-1"));
        OrchestrationEvent solved = stream.history("p-1").get(4);
        assertEquals(Boolean.TRUE, solved.payload().get("consensus"));
        assertEquals(2, solved.payload().get("parallelism"));

        List<OrchestrationEvent> worker = stream.history("w9");
        assertEquals(OrchestrationEventType.WORKER_REGISTERED, worker.get(0).type());
        assertEquals(List.of("a", "b"), worker.get(0).payload().get("capabilities"));
        assertEquals(OrchestrationEventType.WORKER_LOST, worker.get(1).type());
    }

    @Test
    void nullPayloadValuesAreDropped() {
        publisher.onSagaCancelled("Checkout", "run-4", null);

        OrchestrationEvent cancelled = stream.history("run-4").get(0);
        assertEquals(OrchestrationEventType.SAGA_CANCELLED, cancelled.type());
        assertFalse(cancelled.payload().containsKey("reason"));
    }
}
