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

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CompositeOrchestrationEventsTest {

    static class CapturingEvents implements OrchestrationEvents {
        final List<String> calls = new ArrayList<>();
        @Override public void onSagaStarted(String sagaName, String runId) { calls.add("start:" + sagaName + ":" + runId); }
        @Override public void onStepStarted(String sagaName, String runId, String stepName, String workerId, int attempt) { calls.add("step:" + stepName + "@" + workerId); }
        @Override public void onSagaCompleted(String sagaName, String runId, boolean success) { calls.add("completed:" + success); }
        @Override public void onWorkerLost(String workerId) { calls.add("lost:" + workerId); }
    }

    static class ThrowingEvents implements OrchestrationEvents {
        @Override public void onSagaStarted(String sagaName, String runId) { throw new IllegalStateException("sink down"); }
        @Override public void onWorkerLost(String workerId) { throw new IllegalStateException("sink down"); }
    }

    @Test
    void compositeFansOutCalls() {
        CapturingEvents a = new CapturingEvents();
        CapturingEvents b = new CapturingEvents();
        CompositeOrchestrationEvents composite = new CompositeOrchestrationEvents(List.of(a, b));

        composite.onSagaStarted("S", "id1");
        composite.onStepStarted("S", "id1", "x", "w1", 1);
        composite.onSagaCompleted("S", "id1", true);

        assertEquals(List.of("start:S:id1", "step:x@w1", "completed:true"), a.calls);
        assertEquals(a.calls, b.calls);
    }

    @Test
    void failingSinkDoesNotStopOthers() {
        CapturingEvents after = new CapturingEvents();
        CompositeOrchestrationEvents composite = new CompositeOrchestrationEvents(List.of(new ThrowingEvents(), after));

        assertDoesNotThrow(() -> composite.onSagaStarted("S", "id2"));
        assertDoesNotThrow(() -> composite.onWorkerLost("w1"));

        assertEquals(List.of("start:S:id2", "lost:w1"), after.calls);
        assertEquals(2, composite.delegates().size());
    }
}
