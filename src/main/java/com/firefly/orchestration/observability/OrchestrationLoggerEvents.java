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
import com.firefly.orchestration.util.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * Default {@link OrchestrationEvents} implementation that emits JSON-friendly key=value logs via SLF4J.
 */
public class OrchestrationLoggerEvents implements OrchestrationEvents {
    private static final Logger log = LoggerFactory.getLogger(OrchestrationLoggerEvents.class);

    @Override
    public void onSagaStarted(String sagaName, String runId) {
        log.info(JsonUtils.json(
                "saga_event", "start",
                "saga", sagaName,
                "runId", runId
        ));
    }

    @Override
    public void onStepStarted(String sagaName, String runId, String stepName, String workerId, int attempt) {
        log.info(JsonUtils.json(
                "saga_event", "step_started",
                "saga", sagaName,
                "runId", runId,
                "step", stepName,
                "workerId", workerId,
                "attempt", Integer.toString(attempt)
        ));
    }

    @Override
    public void onStepSuccess(String sagaName, String runId, String stepName, int attempts, long latencyMs, double progress) {
        log.info(JsonUtils.json(
                "saga_event", "step_success",
                "saga", sagaName,
                "runId", runId,
                "step", stepName,
                "attempts", Integer.toString(attempts),
                "latencyMs", Long.toString(latencyMs),
                "progress", String.format(Locale.ROOT, "%.2f", progress)
        ));
    }

    @Override
    public void onStepRetry(String sagaName, String runId, String stepName, int attempt, long delayMs, Throwable error) {
        log.warn(JsonUtils.json(
                "saga_event", "step_retry",
                "saga", sagaName,
                "runId", runId,
                "step", stepName,
                "attempt", Integer.toString(attempt),
                "delayMs", Long.toString(delayMs),
                "error_class", error != null ? error.getClass().getName() : "",
                "error_msg", JsonUtils.errorMessage(error)
        ));
    }

    @Override
    public void onStepFailed(String sagaName, String runId, String stepName, Throwable error, int attempts, long latencyMs) {
        log.warn(JsonUtils.json(
                "saga_event", "step_failed",
                "saga", sagaName,
                "runId", runId,
                "step", stepName,
                "attempts", Integer.toString(attempts),
                "latencyMs", Long.toString(latencyMs),
                "error_class", error != null ? error.getClass().getName() : "",
                "error_msg", JsonUtils.errorMessage(error)
        ));
    }

    @Override
    public void onCompensationStarted(String sagaName, String runId, String stepName) {
        log.info(JsonUtils.json(
                "saga_event", "compensation_started",
                "saga", sagaName,
                "runId", runId,
                "step", stepName
        ));
    }

    @Override
    public void onCompensated(String sagaName, String runId, String stepName, Throwable error) {
        if (error == null) {
            log.info(JsonUtils.json(
                    "saga_event", "compensated",
                    "saga", sagaName,
                    "runId", runId,
                    "step", stepName
            ));
        } else {
            log.error(JsonUtils.json(
                    "saga_event", "compensation_failed",
                    "saga", sagaName,
                    "runId", runId,
                    "step", stepName,
                    "error_class", error.getClass().getName(),
                    "error_msg", JsonUtils.errorMessage(error)
            ));
        }
    }

    @Override
    public void onSagaCancelled(String sagaName, String runId, String reason) {
        log.warn(JsonUtils.json(
                "saga_event", "cancelled",
                "saga", sagaName,
                "runId", runId,
                "reason", JsonUtils.truncate(reason, 300)
        ));
    }

    @Override
    public void onSagaCompleted(String sagaName, String runId, boolean success) {
        log.info(JsonUtils.json(
                "saga_event", "completed",
                "saga", sagaName,
                "runId", runId,
                "success", Boolean.toString(success)
        ));
    }

    @Override
    public void onProblemSubmitted(String problemType, String problemId, int taskCount) {
        log.info(JsonUtils.json(
                "problem_event", "submitted",
                "type", problemType,
                "problemId", problemId,
                "tasks", Integer.toString(taskCount)
        ));
    }

    @Override
    public void onTaskScheduled(String problemType, String problemId, String taskId, String workerId, int attempt) {
        log.info(JsonUtils.json(
                "problem_event", "task_scheduled",
                "type", problemType,
                "problemId", problemId,
                "taskId", taskId,
                "workerId", workerId,
                "attempt", Integer.toString(attempt)
        ));
    }

    @Override
    public void onTaskCompleted(String problemType, String problemId, String taskId, String workerId, long latencyMs) {
        log.info(JsonUtils.json(
                "problem_event", "task_completed",
                "type", problemType,
                "problemId", problemId,
                "taskId", taskId,
                "workerId", workerId,
                "latencyMs", Long.toString(latencyMs)
        ));
    }

    @Override
    public void onTaskFailed(String problemType, String problemId, String taskId, String workerId, Throwable error,
                             int attempts, boolean willRetry) {
        log.warn(JsonUtils.json(
                "problem_event", "task_failed",
                "type", problemType,
                "problemId", problemId,
                "taskId", taskId,
                "workerId", workerId,
                "attempts", Integer.toString(attempts),
                "willRetry", Boolean.toString(willRetry),
                "error_class", error != null ? error.getClass().getName() : "",
                "error_msg", JsonUtils.errorMessage(error)
        ));
    }

    @Override
    public void onValidationRound(String problemType, String problemId, int round, double agreementRatio, boolean recompute) {
        log.info(JsonUtils.json(
                "problem_event", "validation_round",
                "type", problemType,
                "problemId", problemId,
                "round", Integer.toString(round),
                "agreement", String.format(Locale.ROOT, "%.3f", agreementRatio),
                "recompute", Boolean.toString(recompute)
        ));
    }

    @Override
    public void onProblemSolved(String problemType, String problemId, Solution solution) {
        log.info(JsonUtils.json(
                "problem_event", "solved",
                "type", problemType,
                "problemId", problemId,
                "confidence", String.format(Locale.ROOT, "%.3f", solution.confidence()),
                "consensus", Boolean.toString(solution.consensus().achieved()),
                "parallelism", Integer.toString(solution.performance().parallelism()),
                "wallTimeMs", Long.toString(solution.performance().wallTime().toMillis())
        ));
    }

    @Override
    public void onProblemFailed(String problemType, String problemId, String reason) {
        log.warn(JsonUtils.json(
                "problem_event", "failed",
                "type", problemType,
                "problemId", problemId,
                "reason", JsonUtils.truncate(reason, 500)
        ));
    }

    @Override
    public void onWorkerRegistered(String workerId, Set<String> capabilities) {
        log.info(JsonUtils.json(
                "worker_event", "registered",
                "workerId", workerId,
                "capabilities", String.join(",", new TreeSet<>(capabilities))
        ));
    }

    @Override
    public void onWorkerLost(String workerId) {
        log.warn(JsonUtils.json(
                "worker_event", "lost",
                "workerId", workerId
        ));
    }
}
