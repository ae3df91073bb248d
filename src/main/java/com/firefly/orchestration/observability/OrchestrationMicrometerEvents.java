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
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Set;

/**
 * Micrometer-based implementation of OrchestrationEvents that publishes counters, timers,
 * and distribution summaries for saga steps, problem tasks and validation rounds.
 */
public class OrchestrationMicrometerEvents implements OrchestrationEvents {
    private final MeterRegistry registry;

    public OrchestrationMicrometerEvents(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void onStepStarted(String sagaName, String runId, String stepName, String workerId, int attempt) {
        registry.counter("orchestration.saga.step.started", Tags.of(Tag.of("saga", sagaName), Tag.of("step", stepName))).increment();
    }

    @Override
    public void onStepSuccess(String sagaName, String runId, String stepName, int attempts, long latencyMs, double progress) {
        recordStep(Tags.of(Tag.of("saga", sagaName), Tag.of("step", stepName), Tag.of("outcome", "success")), attempts, latencyMs);
    }

    @Override
    public void onStepRetry(String sagaName, String runId, String stepName, int attempt, long delayMs, Throwable error) {
        registry.counter("orchestration.saga.step.retries", Tags.of(Tag.of("saga", sagaName), Tag.of("step", stepName))).increment();
    }

    @Override
    public void onStepFailed(String sagaName, String runId, String stepName, Throwable error, int attempts, long latencyMs) {
        recordStep(Tags.of(Tag.of("saga", sagaName), Tag.of("step", stepName), Tag.of("outcome", "failed")), attempts, latencyMs);
    }

    @Override
    public void onCompensated(String sagaName, String runId, String stepName, Throwable error) {
        String outcome = error == null ? "success" : "error";
        registry.counter("orchestration.saga.step.compensated",
                Tags.of(Tag.of("saga", sagaName), Tag.of("step", stepName), Tag.of("outcome", outcome))).increment();
    }

    @Override
    public void onSagaCancelled(String sagaName, String runId, String reason) {
        registry.counter("orchestration.saga.run.cancelled", Tags.of(Tag.of("saga", sagaName))).increment();
    }

    @Override
    public void onSagaCompleted(String sagaName, String runId, boolean success) {
        registry.counter("orchestration.saga.run.completed",
                Tags.of(Tag.of("saga", sagaName), Tag.of("success", String.valueOf(success)))).increment();
    }

    @Override
    public void onProblemSubmitted(String problemType, String problemId, int taskCount) {
        Tags tags = Tags.of(Tag.of("type", problemType));
        registry.counter("orchestration.problem.submitted", tags).increment();
        DistributionSummary.builder("orchestration.problem.tasks")
                .baseUnit("tasks")
                .tags(tags)
                .register(registry)
                .record(Math.max(0, taskCount));
    }

    @Override
    public void onTaskCompleted(String problemType, String problemId, String taskId, String workerId, long latencyMs) {
        Tags tags = Tags.of(Tag.of("type", problemType), Tag.of("outcome", "success"));
        registry.counter("orchestration.task.completed", tags).increment();
        Timer.builder("orchestration.task.latency")
                .tags(tags)
                .register(registry)
                .record(Duration.ofMillis(Math.max(0L, latencyMs)));
    }

    @Override
    public void onTaskFailed(String problemType, String problemId, String taskId, String workerId, Throwable error,
                             int attempts, boolean willRetry) {
        registry.counter("orchestration.task.failed",
                Tags.of(Tag.of("type", problemType), Tag.of("retry", String.valueOf(willRetry)))).increment();
    }

    @Override
    public void onValidationRound(String problemType, String problemId, int round, double agreementRatio, boolean recompute) {
        DistributionSummary.builder("orchestration.consensus.agreement")
                .tags(Tags.of(Tag.of("type", problemType)))
                .register(registry)
                .record(agreementRatio);
    }

    @Override
    public void onProblemSolved(String problemType, String problemId, Solution solution) {
        Tags tags = Tags.of(Tag.of("type", problemType),
                Tag.of("consensus", String.valueOf(solution.consensus().achieved())));
        registry.counter("orchestration.problem.solved", tags).increment();
        Timer.builder("orchestration.problem.wall_time")
                .tags(tags)
                .register(registry)
                .record(solution.performance().wallTime());
    }

    @Override
    public void onProblemFailed(String problemType, String problemId, String reason) {
        registry.counter("orchestration.problem.failed", Tags.of(Tag.of("type", problemType))).increment();
    }

    @Override
    public void onWorkerRegistered(String workerId, Set<String> capabilities) {
        registry.counter("orchestration.worker.registered").increment();
    }

    @Override
    public void onWorkerLost(String workerId) {
        registry.counter("orchestration.worker.lost").increment();
    }

    private void recordStep(Tags tags, int attempts, long latencyMs) {
        registry.counter("orchestration.saga.step.completed", tags).increment();
        Timer.builder("orchestration.saga.step.latency")
                .tags(tags)
                .register(registry)
                .record(Duration.ofMillis(Math.max(0L, latencyMs)));
        DistributionSummary.builder("orchestration.saga.step.attempts")
                .baseUnit("attempts")
                .tags(tags)
                .register(registry)
                .record(Math.max(0, attempts));
    }
}
