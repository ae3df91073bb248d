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
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer Tracing implementation for OrchestrationEvents.
 * Creates a span for each saga run and problem, and a child span per step attempt or task attempt.
 */
public class OrchestrationTracingEvents implements OrchestrationEvents {
    private final Tracer tracer;
    private final Map<String, Span> rootSpans = new ConcurrentHashMap<>();
    private final Map<String, Span> childSpans = new ConcurrentHashMap<>(); // key: rootId:childId

    public OrchestrationTracingEvents(Tracer tracer) {
        this.tracer = tracer;
    }

    @Override
    public void onSagaStarted(String sagaName, String runId) {
        rootSpans.put(runId, tracer.nextSpan().name("saga:" + sagaName).start());
    }

    @Override
    public void onStepStarted(String sagaName, String runId, String stepName, String workerId, int attempt) {
        startChild(runId, stepName, "step:" + stepName, workerId, attempt);
    }

    @Override
    public void onStepSuccess(String sagaName, String runId, String stepName, int attempts, long latencyMs, double progress) {
        endChild(runId, stepName, null);
    }

    @Override
    public void onStepRetry(String sagaName, String runId, String stepName, int attempt, long delayMs, Throwable error) {
        endChild(runId, stepName, error);
    }

    @Override
    public void onStepFailed(String sagaName, String runId, String stepName, Throwable error, int attempts, long latencyMs) {
        endChild(runId, stepName, error);
    }

    @Override
    public void onSagaCompleted(String sagaName, String runId, boolean success) {
        endRoot(runId, success ? "success" : "failed");
    }

    @Override
    public void onSagaCancelled(String sagaName, String runId, String reason) {
        Span span = rootSpans.get(runId);
        if (span != null) {
            span.event("cancelled");
        }
    }

    @Override
    public void onProblemSubmitted(String problemType, String problemId, int taskCount) {
        Span span = tracer.nextSpan().name("problem:" + problemType).start();
        span.tag("tasks", String.valueOf(taskCount));
        rootSpans.put(problemId, span);
    }

    @Override
    public void onTaskScheduled(String problemType, String problemId, String taskId, String workerId, int attempt) {
        startChild(problemId, taskId, "task:" + taskId, workerId, attempt);
    }

    @Override
    public void onTaskCompleted(String problemType, String problemId, String taskId, String workerId, long latencyMs) {
        endChild(problemId, taskId, null);
    }

    @Override
    public void onTaskFailed(String problemType, String problemId, String taskId, String workerId, Throwable error,
                             int attempts, boolean willRetry) {
        endChild(problemId, taskId, error);
    }

    @Override
    public void onProblemSolved(String problemType, String problemId, Solution solution) {
        endRoot(problemId, solution.consensus().achieved() ? "success" : "low_confidence");
    }

    @Override
    public void onProblemFailed(String problemType, String problemId, String reason) {
        endRoot(problemId, "failed");
    }

    private void startChild(String rootId, String childId, String name, String workerId, int attempt) {
        Span parent = rootSpans.get(rootId);
        Span span = (parent != null ? tracer.nextSpan(parent) : tracer.nextSpan())
                .name(name)
                .start();
        if (workerId != null) {
            span.tag("worker", workerId);
        }
        span.tag("attempt", String.valueOf(attempt));
        Span previous = childSpans.put(key(rootId, childId), span);
        if (previous != null) {
            previous.end();
        }
    }

    private void endChild(String rootId, String childId, Throwable error) {
        Span span = childSpans.remove(key(rootId, childId));
        if (span != null) {
            if (error != null) {
                span.error(error);
                span.tag("outcome", "failed");
            } else {
                span.tag("outcome", "success");
            }
            span.end();
        }
    }

    private void endRoot(String rootId, String outcome) {
        Span span = rootSpans.remove(rootId);
        if (span != null) {
            span.tag("outcome", outcome);
            span.end();
        }
        String prefix = rootId + ":";
        childSpans.keySet().removeIf(k -> {
            if (!k.startsWith(prefix)) return false;
            Span orphan = childSpans.get(k);
            if (orphan != null) orphan.end();
            return true;
        });
    }

    private static String key(String rootId, String childId) {
        return rootId + ":" + childId;
    }
}
