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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Fans every callback out to a list of sinks. A sink that throws is logged and skipped so that
 * monitoring problems never affect orchestration.
 */
public class CompositeOrchestrationEvents implements OrchestrationEvents {

    private static final Logger log = LoggerFactory.getLogger(CompositeOrchestrationEvents.class);

    private final List<OrchestrationEvents> delegates;

    public CompositeOrchestrationEvents(List<OrchestrationEvents> delegates) {
        this.delegates = List.copyOf(delegates);
    }

    public List<OrchestrationEvents> delegates() {
        return delegates;
    }

    private void each(Consumer<OrchestrationEvents> call) {
        for (OrchestrationEvents d : delegates) {
            try {
                call.accept(d);
            } catch (RuntimeException e) {
                log.warn("Events sink {} failed: {}", d.getClass().getSimpleName(), e.getMessage(), e);
            }
        }
    }

    @Override public void onSagaStarted(String sagaName, String runId) { each(d -> d.onSagaStarted(sagaName, runId)); }
    @Override public void onStepStarted(String sagaName, String runId, String stepName, String workerId, int attempt) { each(d -> d.onStepStarted(sagaName, runId, stepName, workerId, attempt)); }
    @Override public void onStepSuccess(String sagaName, String runId, String stepName, int attempts, long latencyMs, double progress) { each(d -> d.onStepSuccess(sagaName, runId, stepName, attempts, latencyMs, progress)); }
    @Override public void onStepRetry(String sagaName, String runId, String stepName, int attempt, long delayMs, Throwable error) { each(d -> d.onStepRetry(sagaName, runId, stepName, attempt, delayMs, error)); }
    @Override public void onStepFailed(String sagaName, String runId, String stepName, Throwable error, int attempts, long latencyMs) { each(d -> d.onStepFailed(sagaName, runId, stepName, error, attempts, latencyMs)); }
    @Override public void onCompensationStarted(String sagaName, String runId, String stepName) { each(d -> d.onCompensationStarted(sagaName, runId, stepName)); }
    @Override public void onCompensated(String sagaName, String runId, String stepName, Throwable error) { each(d -> d.onCompensated(sagaName, runId, stepName, error)); }
    @Override public void onSagaCancelled(String sagaName, String runId, String reason) { each(d -> d.onSagaCancelled(sagaName, runId, reason)); }
    @Override public void onSagaCompleted(String sagaName, String runId, boolean success) { each(d -> d.onSagaCompleted(sagaName, runId, success)); }

    @Override public void onProblemSubmitted(String problemType, String problemId, int taskCount) { each(d -> d.onProblemSubmitted(problemType, problemId, taskCount)); }
    @Override public void onTaskScheduled(String problemType, String problemId, String taskId, String workerId, int attempt) { each(d -> d.onTaskScheduled(problemType, problemId, taskId, workerId, attempt)); }
    @Override public void onTaskCompleted(String problemType, String problemId, String taskId, String workerId, long latencyMs) { each(d -> d.onTaskCompleted(problemType, problemId, taskId, workerId, latencyMs)); }
    @Override public void onTaskFailed(String problemType, String problemId, String taskId, String workerId, Throwable error, int attempts, boolean willRetry) { each(d -> d.onTaskFailed(problemType, problemId, taskId, workerId, error, attempts, willRetry)); }
    @Override public void onValidationRound(String problemType, String problemId, int round, double agreementRatio, boolean recompute) { each(d -> d.onValidationRound(problemType, problemId, round, agreementRatio, recompute)); }
    @Override public void onProblemSolved(String problemType, String problemId, Solution solution) { each(d -> d.onProblemSolved(problemType, problemId, solution)); }
    @Override public void onProblemFailed(String problemType, String problemId, String reason) { each(d -> d.onProblemFailed(problemType, problemId, reason)); }

    @Override public void onWorkerRegistered(String workerId, Set<String> capabilities) { each(d -> d.onWorkerRegistered(workerId, capabilities)); }
    @Override public void onWorkerLost(String workerId) { each(d -> d.onWorkerLost(workerId)); }
}
