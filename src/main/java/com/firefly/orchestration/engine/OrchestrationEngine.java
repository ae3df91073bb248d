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


package com.firefly.orchestration.engine;

import com.firefly.orchestration.events.EventStream;
import com.firefly.orchestration.events.OrchestrationEvent;
import com.firefly.orchestration.exception.UnknownExecutionException;
import com.firefly.orchestration.problem.Problem;
import com.firefly.orchestration.saga.SagaCoordinator;
import com.firefly.orchestration.saga.SagaDefinition;
import com.firefly.orchestration.saga.SagaResult;
import com.firefly.orchestration.saga.SagaRunRecord;
import com.firefly.orchestration.scheduler.ProblemRecord;
import com.firefly.orchestration.scheduler.TaskScheduler;
import com.firefly.orchestration.worker.WorkerRegistry;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Submission and status API over the saga coordinator and the task scheduler.
 * <p>
 * Saga runs and problems share one id space for status queries: an id is looked up as a saga run
 * first and as a problem second.
 */
public class OrchestrationEngine {

    private final SagaCoordinator coordinator;
    private final TaskScheduler scheduler;
    private final WorkerRegistry registry;
    private final EventStream eventStream;

    public OrchestrationEngine(SagaCoordinator coordinator, TaskScheduler scheduler, WorkerRegistry registry,
                               EventStream eventStream) {
        this.coordinator = Objects.requireNonNull(coordinator, "coordinator");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.eventStream = eventStream;
    }

    /** Starts the saga in the background and returns its run id. */
    public String submitSaga(SagaDefinition definition, Map<String, Object> initialData) {
        return coordinator.submit(definition, initialData);
    }

    public Mono<SagaResult> executeSaga(SagaDefinition definition, Map<String, Object> initialData) {
        return coordinator.execute(definition, initialData);
    }

    /** Decomposes and schedules the problem in the background and returns its id. */
    public String submitProblem(Problem problem) {
        return scheduler.submit(problem);
    }

    public Mono<ProblemRecord> awaitProblem(String problemId) {
        return scheduler.awaitCompletion(problemId);
    }

    public Mono<SagaResult> awaitSaga(String runId) {
        return coordinator.awaitResult(runId);
    }

    /**
     * @throws UnknownExecutionException when the id is neither a saga run nor a problem
     */
    public ExecutionStatus getStatus(String id) {
        Optional<SagaRunRecord> run = coordinator.status(id);
        if (run.isPresent()) {
            SagaRunRecord r = run.get();
            return new ExecutionStatus(r.runId(), ExecutionKind.SAGA, r.sagaName(), r.state().name(), r.progress(),
                    r.state().isTerminal(), null, r.failure(), history(id), r.updatedAt());
        }
        Optional<ProblemRecord> problem = scheduler.status(id);
        if (problem.isPresent()) {
            ProblemRecord p = problem.get();
            return new ExecutionStatus(p.problemId(), ExecutionKind.PROBLEM, p.problemType(), p.state().name(),
                    p.progress(), p.state().isTerminal(), p.solution(), p.failureReason(), history(id), p.updatedAt());
        }
        throw new UnknownExecutionException(id);
    }

    /**
     * Cancels a saga run or a problem.
     *
     * @return false when the id is unknown or the execution already finished
     */
    public boolean cancel(String id) {
        return coordinator.cancel(id) || scheduler.cancel(id);
    }

    /** Saga runs and problems without recorded progress within the window. */
    public List<String> stalledExecutions(Duration window) {
        Instant now = Instant.now();
        List<String> stalled = new ArrayList<>(coordinator.stalledRuns(window, now));
        stalled.addAll(scheduler.stalledProblems(window, now));
        return stalled;
    }

    public List<String> runningSagas() {
        return coordinator.runningSagas();
    }

    public List<String> activeProblems() {
        return scheduler.activeProblems();
    }

    public WorkerRegistry workers() {
        return registry;
    }

    private List<OrchestrationEvent> history(String id) {
        return eventStream == null ? List.of() : eventStream.history(id);
    }
}
