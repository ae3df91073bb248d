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


package com.firefly.orchestration.saga;

import com.firefly.orchestration.exception.IllegalStateTransitionException;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Mutable state of one saga execution. Every mutator is synchronized so that the driving reactive
 * chain, cancellation and worker-loss notifications never interleave on the same run.
 */
public class SagaRun {

    private final String id;
    private final SagaDefinition definition;
    private final Instant startedAt;
    private final Map<String, Object> data;
    private final List<String> completedSteps = new ArrayList<>();
    private final Map<String, SagaStepStatus> statuses = new LinkedHashMap<>();
    private final Map<String, Integer> attempts = new LinkedHashMap<>();
    private final Map<String, String> workers = new LinkedHashMap<>();
    private final Map<String, Throwable> stepErrors = new LinkedHashMap<>();
    private final Map<String, Throwable> compensationErrors = new LinkedHashMap<>();
    private final AtomicBoolean callbacksFired = new AtomicBoolean();
    private final Sinks.One<Throwable> cancellation = Sinks.one();
    private final Sinks.One<SagaResult> result = Sinks.one();

    private SagaRunState state = SagaRunState.RUNNING;
    private String failedStep;
    private Throwable error;
    private Throwable cancelCause;
    private boolean forwardSettled;
    private Instant lastProgressAt;
    private Instant completedAt;
    // in-flight attempt
    private String currentStep;
    private String currentWorker;
    private Sinks.One<Throwable> currentAbort;

    public SagaRun(String id, SagaDefinition definition, Map<String, Object> initialData, Instant startedAt) {
        this.id = id;
        this.definition = definition;
        this.startedAt = startedAt;
        this.lastProgressAt = startedAt;
        this.data = new LinkedHashMap<>(initialData != null ? initialData : Map.of());
        for (SagaStep s : definition.steps()) {
            statuses.put(s.name(), SagaStepStatus.PENDING);
            attempts.put(s.name(), 0);
        }
    }

    public String id() { return id; }
    public SagaDefinition definition() { return definition; }
    public Instant startedAt() { return startedAt; }

    public synchronized SagaRunState state() { return state; }
    public synchronized Instant lastProgressAt() { return lastProgressAt; }
    public synchronized Map<String, Object> dataSnapshot() { return new LinkedHashMap<>(data); }
    public synchronized List<String> completedSteps() { return List.copyOf(completedSteps); }
    public synchronized SagaStepStatus status(String step) { return statuses.get(step); }
    public synchronized int attempts(String step) { return attempts.getOrDefault(step, 0); }
    public synchronized String currentWorker() { return currentWorker; }
    public synchronized boolean isCancelled() { return cancelCause != null; }
    public synchronized Throwable cancelCause() { return cancelCause; }

    public synchronized double progress() {
        return (double) completedSteps.size() / definition.steps().size();
    }

    synchronized void transition(SagaRunState next) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateTransitionException("saga run " + id, state, next);
        }
        state = next;
        touch(Instant.now());
        if (next.isTerminal()) {
            completedAt = lastProgressAt;
        }
    }

    synchronized void stepStatus(String step, SagaStepStatus next) {
        SagaStepStatus current = statuses.get(step);
        if (current != next && !current.canTransitionTo(next)) {
            throw new IllegalStateTransitionException("step " + step + " of saga run " + id, current, next);
        }
        statuses.put(step, next);
        touch(Instant.now());
    }

    /**
     * Starts an attempt on a worker.
     *
     * @return the attempt number (1-based)
     */
    synchronized int beginAttempt(String step, String workerId, Sinks.One<Throwable> abort) {
        stepStatus(step, SagaStepStatus.RUNNING);
        int n = attempts.merge(step, 1, Integer::sum);
        workers.put(step, workerId);
        currentStep = step;
        currentWorker = workerId;
        currentAbort = abort;
        return n;
    }

    synchronized void endAttempt() {
        currentStep = null;
        currentWorker = null;
        currentAbort = null;
    }

    synchronized void completeStep(String step, Map<String, Object> output) {
        endAttempt();
        stepStatus(step, SagaStepStatus.DONE);
        if (output != null) {
            data.putAll(output);
        }
        completedSteps.add(step);
    }

    synchronized void failStep(String step, Throwable err) {
        endAttempt();
        stepStatus(step, SagaStepStatus.FAILED);
        stepErrors.put(step, err);
        if (failedStep == null) {
            failedStep = step;
            error = err;
        }
    }

    synchronized void compensated(String step, Throwable compensationError) {
        if (compensationError == null) {
            stepStatus(step, SagaStepStatus.COMPENSATED);
        } else {
            stepStatus(step, SagaStepStatus.COMPENSATION_FAILED);
            compensationErrors.put(step, compensationError);
        }
    }

    /** Fails the step whose attempt was interrupted by cancellation, if any. */
    synchronized void abandonInFlight(Throwable cause) {
        if (currentStep != null && statuses.get(currentStep) == SagaStepStatus.RUNNING) {
            failStep(currentStep, cause);
        }
        endAttempt();
    }

    /**
     * Aborts the in-flight attempt if it runs on {@code workerId}.
     *
     * @return true when an attempt was aborted
     */
    synchronized boolean abortIfOn(String workerId, Throwable cause) {
        if (currentAbort == null || !workerId.equals(currentWorker)) {
            return false;
        }
        currentAbort.tryEmitValue(cause);
        return true;
    }

    /** Action of the step in flight, null between attempts. */
    synchronized String currentAction() {
        if (currentStep == null) {
            return null;
        }
        for (SagaStep s : definition.steps()) {
            if (s.name().equals(currentStep)) {
                return s.action();
            }
        }
        return null;
    }

    /**
     * Closes the forward phase once every step is done. A run cancelled first stays cancelled.
     *
     * @return false when a cancellation got in before
     */
    synchronized boolean settleForward() {
        if (cancelCause != null) {
            return false;
        }
        forwardSettled = true;
        return true;
    }

    /**
     * Marks the run cancelled. Only the first cause is kept.
     *
     * @return false when the run was already cancelled, finished, or past its last forward step
     */
    synchronized boolean cancel(Throwable cause) {
        if (cancelCause != null || forwardSettled || state != SagaRunState.RUNNING) {
            return false;
        }
        cancelCause = cause;
        if (error == null) {
            error = cause;
            failedStep = currentStep;
        }
        cancellation.tryEmitValue(cause);
        return true;
    }

    /** Errors with the cancel cause once the run is cancelled. */
    Mono<Void> cancellationSignal() {
        return cancellation.asMono().flatMap(Mono::error);
    }

    boolean markCallbacksFired() {
        return callbacksFired.compareAndSet(false, true);
    }

    void publishResult(SagaResult r) {
        result.tryEmitValue(r);
    }

    public Mono<SagaResult> result() {
        return result.asMono();
    }

    public synchronized SagaResult snapshot() {
        Map<String, SagaResult.StepOutcome> steps = new LinkedHashMap<>();
        for (SagaStep s : definition.steps()) {
            steps.put(s.name(), new SagaResult.StepOutcome(
                    statuses.get(s.name()),
                    attempts.getOrDefault(s.name(), 0),
                    workers.get(s.name()),
                    stepErrors.get(s.name()),
                    compensationErrors.get(s.name())));
        }
        return new SagaResult(id, definition.name(), state, data, completedSteps, failedStep, error, steps,
                startedAt, completedAt);
    }

    public synchronized SagaRunRecord toRecord() {
        return new SagaRunRecord(id, definition.name(), state, completedSteps, statuses, failedStep,
                error != null ? String.valueOf(error.getMessage()) : null, progress(), cancelCause != null,
                startedAt, lastProgressAt);
    }

    private void touch(Instant now) {
        lastProgressAt = now;
    }
}
