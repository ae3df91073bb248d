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

import com.firefly.orchestration.consensus.Solution;
import com.firefly.orchestration.exception.IllegalStateTransitionException;
import com.firefly.orchestration.problem.Problem;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Task set and bookkeeping of one problem, guarded by its own lock. Registry updates made on behalf
 * of the problem happen while the lock is held, so the lock order is always problem before worker.
 */
public class ProblemExecution {

    private final Problem problem;
    private final DecompositionStrategy strategy;
    private final Map<String, SubTask> tasks = new LinkedHashMap<>();
    private final Map<String, Disposable> inFlight = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Sinks.One<ProblemRecord> done = Sinks.one();
    private final Instant startedAt;

    private ProblemState state = ProblemState.RUNNING;
    private int round;
    private int running;
    private int maxParallelism;
    private long computeMillis;
    private boolean repollPending;
    private String failureReason;
    private Solution solution;
    private Instant lastProgressAt;

    ProblemExecution(Problem problem, DecompositionStrategy strategy, List<SubTaskDefinition> definitions, Instant now) {
        this.problem = problem;
        this.strategy = strategy;
        this.startedAt = now;
        this.lastProgressAt = now;
        addTasks(definitions);
    }

    public Problem problem() { return problem; }
    DecompositionStrategy strategy() { return strategy; }
    public Instant startedAt() { return startedAt; }

    <T> T locked(Supplier<T> body) {
        lock.lock();
        try {
            return body.get();
        } finally {
            lock.unlock();
        }
    }

    void locked(Runnable body) {
        lock.lock();
        try {
            body.run();
        } finally {
            lock.unlock();
        }
    }

    // everything below expects the lock to be held by the caller

    Collection<SubTask> tasks() { return tasks.values(); }
    SubTask task(String id) { return tasks.get(id); }
    ProblemState state() { return state; }
    int round() { return round; }
    String failureReason() { return failureReason; }
    Solution solution() { return solution; }
    int maxParallelism() { return maxParallelism; }
    Duration computeTime() { return Duration.ofMillis(computeMillis); }
    Instant lastProgressAt() { return lastProgressAt; }

    void addTasks(List<SubTaskDefinition> definitions) {
        for (SubTaskDefinition d : definitions) {
            tasks.put(d.id(), new SubTask(problem.id(), d));
        }
    }

    List<SubTaskDefinition> definitions() {
        List<SubTaskDefinition> out = new ArrayList<>(tasks.size());
        for (SubTask t : tasks.values()) out.add(t.definition());
        return out;
    }

    boolean dependenciesCompleted(SubTask task) {
        for (String dep : task.definition().dependencies()) {
            SubTask d = tasks.get(dep);
            if (d == null || d.status() != SubTaskStatus.COMPLETED) return false;
        }
        return true;
    }

    Map<String, Object> dependencyResults(SubTask task) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (String dep : task.definition().dependencies()) {
            out.put(dep, tasks.get(dep).result());
        }
        return out;
    }

    boolean allTerminal() {
        return tasks.values().stream().allMatch(t -> t.status().isTerminal());
    }

    void transition(ProblemState next) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateTransitionException("problem " + problem.id(), state, next);
        }
        state = next;
        touch();
    }

    int nextRound() {
        return ++round;
    }

    void taskStarted() {
        running++;
        maxParallelism = Math.max(maxParallelism, running);
        touch();
    }

    void taskStopped(long elapsedMillis) {
        running = Math.max(0, running - 1);
        computeMillis += Math.max(0L, elapsedMillis);
        touch();
    }

    boolean claimRepoll() {
        if (repollPending) return false;
        repollPending = true;
        return true;
    }

    void repollDone() {
        repollPending = false;
    }

    void trackInFlight(String key, Disposable disposable) {
        if (!disposable.isDisposed()) {
            inFlight.put(key, disposable);
        }
    }

    void untrackInFlight(String key) {
        inFlight.remove(key);
    }

    void disposeInFlight(String key) {
        Disposable d = inFlight.remove(key);
        if (d != null) d.dispose();
    }

    void fail(String reason) {
        if (failureReason == null) failureReason = reason;
    }

    void solved(Solution value) {
        solution = value;
    }

    void touch() {
        lastProgressAt = Instant.now();
    }

    double progress() {
        if (tasks.isEmpty()) return 0d;
        long completed = tasks.values().stream().filter(t -> t.status() == SubTaskStatus.COMPLETED).count();
        return (double) completed / tasks.size();
    }

    ProblemRecord toRecord() {
        Map<String, SubTaskStatus> statuses = new LinkedHashMap<>();
        for (SubTask t : tasks.values()) statuses.put(t.id(), t.status());
        return new ProblemRecord(problem.id(), problem.type(), state, statuses, progress(), round, failureReason,
                solution, startedAt, lastProgressAt);
    }

    void publishDone(ProblemRecord record) {
        done.tryEmitValue(record);
    }

    Mono<ProblemRecord> whenDone() {
        return done.asMono();
    }
}
