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

import com.firefly.orchestration.consensus.Solution;
import com.firefly.orchestration.events.EventStream;
import com.firefly.orchestration.events.OrchestrationEvent;
import com.firefly.orchestration.events.OrchestrationEventType;
import com.firefly.orchestration.util.JsonUtils;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Translates engine hooks into {@link OrchestrationEvent}s on an {@link EventStream}.
 * Hooks with no wire counterpart (step started, compensation started, validation rounds) are ignored.
 */
public class EventStreamPublisher implements OrchestrationEvents {

    private final EventStream stream;

    public EventStreamPublisher(EventStream stream) {
        this.stream = stream;
    }

    public EventStream stream() {
        return stream;
    }

    @Override
    public void onSagaStarted(String sagaName, String runId) {
        publish(OrchestrationEventType.SAGA_STARTED, runId, null, "saga", sagaName);
    }

    @Override
    public void onStepSuccess(String sagaName, String runId, String stepName, int attempts, long latencyMs, double progress) {
        publish(OrchestrationEventType.SAGA_STEP_COMPLETED, runId, stepName,
                "saga", sagaName, "attempts", attempts, "latencyMs", latencyMs, "progress", progress);
    }

    @Override
    public void onStepRetry(String sagaName, String runId, String stepName, int attempt, long delayMs, Throwable error) {
        publish(OrchestrationEventType.SAGA_STEP_FAILED, runId, stepName,
                "saga", sagaName, "attempts", attempt, "willRetry", true, "delayMs", delayMs,
                "error", JsonUtils.errorMessage(error));
    }

    @Override
    public void onStepFailed(String sagaName, String runId, String stepName, Throwable error, int attempts, long latencyMs) {
        publish(OrchestrationEventType.SAGA_STEP_FAILED, runId, stepName,
                "saga", sagaName, "attempts", attempts, "willRetry", false, "error", JsonUtils.errorMessage(error));
    }

    @Override
    public void onCompensated(String sagaName, String runId, String stepName, Throwable error) {
        if (error == null) {
            publish(OrchestrationEventType.SAGA_STEP_COMPENSATED, runId, stepName, "saga", sagaName);
        } else {
            publish(OrchestrationEventType.SAGA_COMPENSATION_FAILED, runId, stepName,
                    "saga", sagaName, "error", JsonUtils.errorMessage(error));
        }
    }

    @Override
    public void onSagaCancelled(String sagaName, String runId, String reason) {
        publish(OrchestrationEventType.SAGA_CANCELLED, runId, null, "saga", sagaName, "reason", reason);
    }

    @Override
    public void onSagaCompleted(String sagaName, String runId, boolean success) {
        if (success) {
            publish(OrchestrationEventType.SAGA_COMPLETED, runId, null, "saga", sagaName);
        } else {
            publish(OrchestrationEventType.SAGA_COMPENSATED, runId, null, "saga", sagaName);
            publish(OrchestrationEventType.SAGA_FAILED, runId, null, "saga", sagaName);
        }
    }

    @Override
    public void onProblemSubmitted(String problemType, String problemId, int taskCount) {
        publish(OrchestrationEventType.PROBLEM_SUBMITTED, problemId, null, "type", problemType, "tasks", taskCount);
    }

    @Override
    public void onTaskScheduled(String problemType, String problemId, String taskId, String workerId, int attempt) {
        publish(OrchestrationEventType.PROBLEM_TASK_SCHEDULED, problemId, taskId,
                "type", problemType, "workerId", workerId, "attempt", attempt);
    }

    @Override
    public void onTaskCompleted(String problemType, String problemId, String taskId, String workerId, long latencyMs) {
        publish(OrchestrationEventType.PROBLEM_TASK_COMPLETED, problemId, taskId,
                "type", problemType, "workerId", workerId, "latencyMs", latencyMs);
    }

    @Override
    public void onTaskFailed(String problemType, String problemId, String taskId, String workerId, Throwable error,
                             int attempts, boolean willRetry) {
        publish(OrchestrationEventType.PROBLEM_TASK_FAILED, problemId, taskId,
                "type", problemType, "workerId", workerId, "attempts", attempts, "willRetry", willRetry,
                "error", JsonUtils.errorMessage(error));
    }

    @Override
    public void onProblemSolved(String problemType, String problemId, Solution solution) {
        publish(OrchestrationEventType.PROBLEM_SOLVED, problemId, null,
                "type", problemType,
                "confidence", solution.confidence(),
                "consensus", solution.consensus().achieved(),
                "agreement", solution.consensus().agreementRatio(),
                "consensusFailure", solution.consensus().failureReason(),
                "parallelism", solution.performance().parallelism());
    }

    @Override
    public void onProblemFailed(String problemType, String problemId, String reason) {
        publish(OrchestrationEventType.PROBLEM_FAILED, problemId, null, "type", problemType, "reason", reason);
    }

    @Override
    public void onWorkerRegistered(String workerId, Set<String> capabilities) {
        publish(OrchestrationEventType.WORKER_REGISTERED, workerId, null,
                "capabilities", List.copyOf(new TreeSet<>(capabilities)));
    }

    @Override
    public void onWorkerLost(String workerId) {
        publish(OrchestrationEventType.WORKER_LOST, workerId, null);
    }

    private void publish(OrchestrationEventType type, String aggregateId, String subjectId, Object... keyValues) {
        Map<String, Object> payload = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            Object value = keyValues[i + 1];
            if (value != null) {
                payload.put(String.valueOf(keyValues[i]), value);
            }
        }
        stream.publish(OrchestrationEvent.of(type, aggregateId, subjectId, payload));
    }
}
