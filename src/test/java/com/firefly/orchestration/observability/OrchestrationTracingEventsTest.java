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

import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.mockito.Mockito.*;

class OrchestrationTracingEventsTest {

    private Tracer tracer;
    private Span root;
    private Span child;
    private OrchestrationTracingEvents events;

    @BeforeEach
    void setUp() {
        tracer = mock(Tracer.class);
        root = mock(Span.class);
        child = mock(Span.class);
        when(tracer.nextSpan()).thenReturn(root);
        when(root.name(anyString())).thenReturn(root);
        when(root.start()).thenReturn(root);
        when(tracer.nextSpan(root)).thenReturn(child);
        when(child.name(anyString())).thenReturn(child);
        when(child.start()).thenReturn(child);
        events = new OrchestrationTracingEvents(tracer);
    }

    @Test
    void stepSpansAreChildrenOfTheRunSpan() {
        events.onSagaStarted("Checkout", "run-1");
        events.onStepStarted("Checkout", "run-1", "reserve", "w1", 1);
        events.onStepSuccess("Checkout", "run-1", "reserve", 1, 5L, 1.0);
        events.onSagaCompleted("Checkout", "run-1", true);

        verify(root).name("saga:Checkout");
        verify(child).name("step:reserve");
        verify(child).tag("worker", "w1");
        verify(child).tag("outcome", "success");
        verify(child).end();
        verify(root).tag("outcome", "success");
        verify(root).end();
    }

    @Test
    void failedTaskRecordsErrorAndOrphansAreEndedWithTheProblem() {
        RuntimeException boom = new RuntimeException("boom");
        events.onProblemSubmitted("analysis", "p-1", 3);
        events.onTaskScheduled("analysis", "p-1", "t1", "w1", 1);
        events.onTaskFailed("analysis", "p-1", "t1", "w1", boom, 1, true);
        events.onTaskScheduled("analysis", "p-1", "t2", "w2", 1);
        events.onProblemFailed("analysis", "p-1", "gave up");

        verify(root).tag("tasks", "3");
        verify(child).error(boom);
        verify(root).tag("outcome", "failed");
        verify(child, times(2)).end();
        verify(root).end();
    }
}
