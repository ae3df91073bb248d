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

import java.util.Set;

/**
 * Observability hook for saga, problem and worker lifecycle events.
 * Provide your own Spring bean of this type to export metrics/traces/logs; the default wiring fans out
 * to {@link OrchestrationLoggerEvents}, {@link EventStreamPublisher} and, when available, the
 * Micrometer sinks.
 *
 * Notes:
 * - onCompensated is invoked for both success and error cases; a null error indicates a successful compensation.
 * - onSagaCompleted with success=false is invoked after every compensation has been attempted.
 */
public interface OrchestrationEvents {

    // saga runs

    default void onSagaStarted(String sagaName, String runId) {}
    default void onStepStarted(String sagaName, String runId, String stepName, String workerId, int attempt) {}
    default void onStepSuccess(String sagaName, String runId, String stepName, int attempts, long latencyMs, double progress) {}
    /** A failed attempt that will be retried after {@code delayMs}. */
    default void onStepRetry(String sagaName, String runId, String stepName, int attempt, long delayMs, Throwable error) {}
    /** The step exhausted its attempts; compensation follows. */
    default void onStepFailed(String sagaName, String runId, String stepName, Throwable error, int attempts, long latencyMs) {}
    default void onCompensationStarted(String sagaName, String runId, String stepName) {}
    default void onCompensated(String sagaName, String runId, String stepName, Throwable error) {}
    default void onSagaCancelled(String sagaName, String runId, String reason) {}
    default void onSagaCompleted(String sagaName, String runId, boolean success) {}

    // problems

    default void onProblemSubmitted(String problemType, String problemId, int taskCount) {}
    default void onTaskScheduled(String problemType, String problemId, String taskId, String workerId, int attempt) {}
    default void onTaskCompleted(String problemType, String problemId, String taskId, String workerId, long latencyMs) {}
    default void onTaskFailed(String problemType, String problemId, String taskId, String workerId, Throwable error,
                              int attempts, boolean willRetry) {}
    default void onValidationRound(String problemType, String problemId, int round, double agreementRatio, boolean recompute) {}
    default void onProblemSolved(String problemType, String problemId, Solution solution) {}
    default void onProblemFailed(String problemType, String problemId, String reason) {}

    // workers

    default void onWorkerRegistered(String workerId, Set<String> capabilities) {}
    default void onWorkerLost(String workerId) {}
}
