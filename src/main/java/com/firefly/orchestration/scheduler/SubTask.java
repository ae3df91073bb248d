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


package com.firefly.orchestration.scheduler;

import com.firefly.orchestration.exception.IllegalStateTransitionException;

import java.time.Instant;

/**
 * Runtime state of one sub-task. Not thread-safe on its own: only touched while holding the owning
 * {@link ProblemExecution}'s lock.
 */
public class SubTask {

    private final String problemId;
    private final SubTaskDefinition definition;
    private SubTaskStatus status = SubTaskStatus.PENDING;
    private String assignedWorker;
    private Object result;
    private Throwable error;
    private int attempts;
    private long epoch;
    private double workerSuccessRate = 1d;
    private Instant startedAt;
    private Instant completedAt;

    SubTask(String problemId, SubTaskDefinition definition) {
        this.problemId = problemId;
        this.definition = definition;
    }

    public String id() { return definition.id(); }
    public String problemId() { return problemId; }
    public SubTaskDefinition definition() { return definition; }
    public SubTaskStatus status() { return status; }
    public String assignedWorker() { return assignedWorker; }
    public Object result() { return result; }
    public Throwable error() { return error; }
    public int attempts() { return attempts; }
    public long epoch() { return epoch; }
    public double workerSuccessRate() { return workerSuccessRate; }
    public Instant startedAt() { return startedAt; }
    public Instant completedAt() { return completedAt; }

    void transition(SubTaskStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateTransitionException("sub-task " + problemId + "/" + id(), status, next);
        }
        status = next;
    }

    /**
     * @return the epoch identifying this assignment
     */
    long assign(String workerId) {
        transition(SubTaskStatus.ASSIGNED);
        assignedWorker = workerId;
        return ++epoch;
    }

    void start(Instant at) {
        transition(SubTaskStatus.RUNNING);
        startedAt = at;
    }

    void complete(Object value, double successRate, Instant at) {
        transition(SubTaskStatus.COMPLETED);
        result = value;
        workerSuccessRate = successRate;
        completedAt = at;
    }

    /** Counts a failed attempt, invalidating the current assignment. */
    int recordFailure(Throwable cause) {
        error = cause;
        epoch++;
        return ++attempts;
    }

    void requeue() {
        transition(SubTaskStatus.PENDING);
        assignedWorker = null;
        startedAt = null;
    }

    void fail(Throwable cause, Instant at) {
        transition(SubTaskStatus.FAILED);
        error = cause;
        completedAt = at;
        epoch++;
    }

    void cancel(Throwable cause, Instant at) {
        transition(SubTaskStatus.CANCELLED);
        if (cause != null) {
            error = cause;
        }
        completedAt = at;
        epoch++;
    }
}
