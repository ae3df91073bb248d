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

import com.firefly.orchestration.action.ActionExecutor;
import com.firefly.orchestration.consensus.Candidate;
import com.firefly.orchestration.consensus.ConsensusValidator;
import com.firefly.orchestration.consensus.ConsensusVerdict;
import com.firefly.orchestration.consensus.PerformanceMetrics;
import com.firefly.orchestration.consensus.Solution;
import com.firefly.orchestration.exception.ActionFailedException;
import com.firefly.orchestration.exception.DependencyUnsatisfiableException;
import com.firefly.orchestration.exception.ExecutionCancelledException;
import com.firefly.orchestration.exception.NoWorkerAvailableException;
import com.firefly.orchestration.exception.UnknownExecutionException;
import com.firefly.orchestration.observability.OrchestrationEvents;
import com.firefly.orchestration.problem.Problem;
import com.firefly.orchestration.store.StateStore;
import com.firefly.orchestration.store.Versioned;
import com.firefly.orchestration.util.Jitter;
import com.firefly.orchestration.util.JsonUtils;
import com.firefly.orchestration.worker.WorkerAgent;
import com.firefly.orchestration.worker.WorkerLossListener;
import com.firefly.orchestration.worker.WorkerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;

/**
 * Decomposes problems into sub-task graphs and runs them on the worker pool.
 * <p>
 * A scheduling pass assigns every pending task whose dependencies have all completed to the best
 * matching worker and dispatches it asynchronously; the pass itself never waits for a dispatch.
 * Results arrive through callbacks that update the task, release the worker and trigger another
 * pass. Every assignment carries an epoch; a result whose epoch is no longer current (the task was
 * reassigned or cancelled meanwhile) is discarded.
 * <p>
 * When every task completed the candidate results go to the {@link ConsensusValidator}, which either
 * produces the {@link Solution} or requests another round of solver tasks.
 */
public class TaskScheduler implements WorkerLossListener {

    private static final Logger log = LoggerFactory.getLogger(TaskScheduler.class);

    static final String KEY_PREFIX = "problem/";

    private final WorkerRegistry registry;
    private final ActionExecutor executor;
    private final StateStore store;
    private final OrchestrationEvents events;
    private final DecompositionRegistry decompositions;
    private final ConsensusValidator validator;
    private final CapabilityTable capabilities;
    private final SchedulerSettings settings;
    private final Map<String, ProblemExecution> active = new ConcurrentHashMap<>();
    private final Map<String, ProblemExecution> finished;

    public TaskScheduler(WorkerRegistry registry, ActionExecutor executor, StateStore store, OrchestrationEvents events,
                         DecompositionRegistry decompositions, ConsensusValidator validator) {
        this(registry, executor, store, events, decompositions, validator, new CapabilityTable(),
                SchedulerSettings.defaults());
    }

    public TaskScheduler(WorkerRegistry registry, ActionExecutor executor, StateStore store, OrchestrationEvents events,
                         DecompositionRegistry decompositions, ConsensusValidator validator,
                         CapabilityTable capabilities, SchedulerSettings settings) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.store = Objects.requireNonNull(store, "store");
        this.events = Objects.requireNonNull(events, "events");
        this.decompositions = Objects.requireNonNull(decompositions, "decompositions");
        this.validator = Objects.requireNonNull(validator, "validator");
        this.capabilities = capabilities != null ? capabilities : new CapabilityTable();
        this.settings = settings != null ? settings : SchedulerSettings.defaults();
        int retained = this.settings.retainedProblems();
        this.finished = Collections.synchronizedMap(new LinkedHashMap<>(16, 0.75f, false) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, ProblemExecution> eldest) {
                return size() > retained;
            }
        });
        registry.addLossListener(this);
    }

    /**
     * Decomposes the problem and starts scheduling it in the background.
     *
     * @return the problem id
     * @throws com.firefly.orchestration.exception.UnknownProblemTypeException   no strategy for the type
     * @throws com.firefly.orchestration.exception.InvalidDecompositionException the strategy produced an invalid graph
     */
    public String submit(Problem problem) {
        Objects.requireNonNull(problem, "problem");
        DecompositionStrategy strategy = decompositions.strategyFor(problem.type());
        List<SubTaskDefinition> definitions = decompositions.decompose(problem);
        ProblemExecution exec = new ProblemExecution(problem, strategy, definitions, Instant.now());
        if (active.putIfAbsent(problem.id(), exec) != null || finished.containsKey(problem.id())) {
            active.remove(problem.id(), exec);
            throw new IllegalArgumentException("Problem " + problem.id() + " was already submitted");
        }
        exec.locked(() -> persist(exec));
        events.onProblemSubmitted(problem.type(), problem.id(), definitions.size());
        schedulePass(exec);
        return problem.id();
    }

    /** Completes with the terminal record of the problem (solved, failed or cancelled). */
    public Mono<ProblemRecord> awaitCompletion(String problemId) {
        ProblemExecution exec = lookup(problemId);
        if (exec == null) {
            return Mono.error(new UnknownExecutionException(problemId));
        }
        return exec.whenDone();
    }

    public Optional<ProblemRecord> status(String problemId) {
        ProblemExecution exec = lookup(problemId);
        if (exec != null) {
            return Optional.of(exec.locked(exec::toRecord));
        }
        return store.get(KEY_PREFIX + problemId, ProblemRecord.class).map(Versioned::value);
    }

    /** Snapshot of one sub-task, for inspection. */
    public Optional<SubTaskView> task(String problemId, String taskId) {
        ProblemExecution exec = lookup(problemId);
        if (exec == null) return Optional.empty();
        return exec.locked(() -> {
            SubTask t = exec.task(taskId);
            return Optional.ofNullable(t == null ? null : SubTaskView.of(t));
        });
    }

    public List<String> activeProblems() {
        List<String> ids = new ArrayList<>(active.keySet());
        Collections.sort(ids);
        return ids;
    }

    /**
     * Cancels every non-terminal task of the problem, releasing the load charged to workers.
     *
     * @return false when the problem is unknown or already finished
     */
    public boolean cancel(String problemId) {
        ProblemExecution exec = active.get(problemId);
        if (exec == null) return false;
        boolean cancelled = exec.locked(() -> {
            if (exec.state().isTerminal()) return false;
            ExecutionCancelledException cause = new ExecutionCancelledException(problemId);
            for (SubTask t : exec.tasks()) {
                if (!t.status().isTerminal()) {
                    abandon(exec, t);
                    t.cancel(cause, Instant.now());
                }
            }
            exec.fail("cancelled by request");
            exec.transition(ProblemState.CANCELLED);
            return true;
        });
        if (cancelled) {
            events.onProblemFailed(exec.problem().type(), problemId, "cancelled by request");
            terminate(exec);
        }
        return cancelled;
    }

    /** Active problems without any progress since {@code now - window}. */
    public List<String> stalledProblems(Duration window, Instant now) {
        Instant cutoff = now.minus(window);
        List<String> stalled = new ArrayList<>();
        for (ProblemExecution exec : active.values()) {
            if (exec.locked(exec::lastProgressAt).isBefore(cutoff)) {
                stalled.add(exec.problem().id());
            }
        }
        return stalled;
    }

    /**
     * Every task assigned to or running on the lost worker goes back to pending with one more attempt
     * counted (failing permanently at the ceiling) and is rescheduled.
     */
    @Override
    public void onWorkerLost(String workerId) {
        for (ProblemExecution exec : active.values()) {
            boolean affected = exec.locked(() -> {
                boolean any = false;
                for (SubTask t : exec.tasks()) {
                    if (t.status().isInFlight() && workerId.equals(t.assignedWorker())) {
                        any = true;
                        ActionFailedException lost = new ActionFailedException(workerId, t.definition().action(),
                                "Worker '" + workerId + "' was lost");
                        boolean wasRunning = t.status() == SubTaskStatus.RUNNING;
                        exec.disposeInFlight(inFlightKey(t));
                        if (wasRunning) {
                            exec.taskStopped(elapsed(t));
                        }
                        registry.recordOutcome(workerId, false, t.definition().estimatedCost());
                        handleFailure(exec, t, workerId, lost);
                        if (exec.state().isTerminal()) break;
                    }
                }
                if (any) persist(exec);
                return any;
            });
            if (affected) {
                log.warn(JsonUtils.json(
                        "problem_event", "worker_lost",
                        "problemId", exec.problem().id(),
                        "workerId", workerId
                ));
                afterChange(exec);
            }
        }
    }

    private void schedulePass(ProblemExecution exec) {
        List<Dispatch> dispatches = new ArrayList<>();
        boolean starved = exec.locked(() -> {
            if (exec.state() != ProblemState.RUNNING) return false;
            boolean noWorker = false;
            for (SubTask t : exec.tasks()) {
                if (t.status() != SubTaskStatus.PENDING || !exec.dependenciesCompleted(t)) {
                    continue;
                }
                Set<String> required = capabilities.capabilitiesFor(t.definition().kind());
                Optional<WorkerAgent> match = registry.findMatch(required);
                if (match.isEmpty()) {
                    if (settings.failWithoutCapableWorker() && !registry.hasCapableWorker(required)) {
                        NoWorkerAvailableException none = new NoWorkerAvailableException(required);
                        t.recordFailure(none);
                        events.onTaskFailed(exec.problem().type(), exec.problem().id(), t.id(), null, none,
                                t.attempts(), false);
                        failTask(exec, t, none);
                        break;
                    }
                    noWorker = true;
                    continue;
                }
                WorkerAgent worker = match.get();
                if (!registry.reserve(worker.id(), t.definition().estimatedCost())) {
                    noWorker = true;
                    continue;
                }
                long epoch = t.assign(worker.id());
                events.onTaskScheduled(exec.problem().type(), exec.problem().id(), t.id(), worker.id(), t.attempts() + 1);
                dispatches.add(new Dispatch(t.id(), worker, epoch));
            }
            persist(exec);
            return noWorker && exec.claimRepoll();
        });

        if (exec.locked(() -> exec.state() == ProblemState.FAILED)) {
            terminate(exec);
            return;
        }
        for (Dispatch d : dispatches) {
            dispatch(exec, d);
        }
        if (starved) {
            Duration delay = Jitter.apply(settings.pollDelay(), settings.pollJitter());
            log.debug("No free worker for problem {}, re-polling in {}ms", exec.problem().id(), delay.toMillis());
            Mono.delay(delay).subscribe(t -> {
                exec.locked(exec::repollDone);
                schedulePass(exec);
            });
        }
    }

    private void dispatch(ProblemExecution exec, Dispatch d) {
        Problem problem = exec.problem();
        SubTaskDefinition def = exec.locked(() -> exec.task(d.taskId()).definition());
        Duration timeout = settings.timeoutFor(def);
        String key = d.key();

        Disposable disposable = Mono.defer(() -> {
                    TaskInput input = exec.locked(() -> {
                        SubTask t = exec.task(d.taskId());
                        if (t.epoch() != d.epoch() || t.status() != SubTaskStatus.ASSIGNED) {
                            return null;
                        }
                        t.start(Instant.now());
                        exec.taskStarted();
                        persist(exec);
                        return new TaskInput(problem.id(), t.id(), def.kind(), problem.payload(), def.input(),
                                exec.dependencyResults(t));
                    });
                    if (input == null) {
                        return Mono.<Optional<Object>>empty();
                    }
                    return executor.executeAction(d.worker(), def.action(), input, timeout, problem.id())
                            .map(Optional::of)
                            .defaultIfEmpty(Optional.empty())
                            .timeout(timeout)
                            .onErrorMap(err -> !(err instanceof ActionFailedException),
                                    err -> asActionFailure(d.worker(), def, timeout, err));
                })
                .subscribeOn(Schedulers.boundedElastic())
                .subscribe(
                        result -> onTaskSuccess(exec, d, result.orElse(null)),
                        err -> onTaskError(exec, d, err),
                        () -> exec.locked(() -> exec.untrackInFlight(key)));
        exec.locked(() -> {
            SubTask t = exec.task(d.taskId());
            if (t.epoch() == d.epoch() && t.status().isInFlight()) {
                exec.trackInFlight(key, disposable);
            }
        });
    }

    private void onTaskSuccess(ProblemExecution exec, Dispatch d, Object result) {
        boolean applied = exec.locked(() -> {
            SubTask t = exec.task(d.taskId());
            exec.untrackInFlight(d.key());
            if (t.epoch() != d.epoch() || t.status() != SubTaskStatus.RUNNING) {
                log.debug("Discarding stale result of task {} of problem {}", d.taskId(), exec.problem().id());
                return false;
            }
            long latency = elapsed(t);
            exec.taskStopped(latency);
            double rate = registry.recordOutcome(d.worker().id(), true, t.definition().estimatedCost())
                    .map(WorkerAgent::successRate)
                    .orElse(d.worker().successRate());
            t.complete(result, rate, Instant.now());
            events.onTaskCompleted(exec.problem().type(), exec.problem().id(), t.id(), d.worker().id(), latency);
            persist(exec);
            return true;
        });
        if (applied) {
            afterChange(exec);
        }
    }

    private void onTaskError(ProblemExecution exec, Dispatch d, Throwable err) {
        boolean applied = exec.locked(() -> {
            SubTask t = exec.task(d.taskId());
            exec.untrackInFlight(d.key());
            if (t.epoch() != d.epoch() || !t.status().isInFlight()) {
                return false;
            }
            if (t.status() == SubTaskStatus.RUNNING) {
                exec.taskStopped(elapsed(t));
            }
            registry.recordOutcome(d.worker().id(), false, t.definition().estimatedCost());
            handleFailure(exec, t, d.worker().id(), err);
            persist(exec);
            return true;
        });
        if (applied) {
            afterChange(exec);
        }
    }

    /** Counts a failed attempt; requeues below the ceiling, fails the problem at it. Lock held. */
    private void handleFailure(ProblemExecution exec, SubTask t, String workerId, Throwable err) {
        int attempts = t.recordFailure(err);
        boolean retry = attempts < settings.maxAttempts();
        events.onTaskFailed(exec.problem().type(), exec.problem().id(), t.id(), workerId, err, attempts, retry);
        if (retry) {
            t.requeue();
        } else {
            failTask(exec, t, err);
        }
    }

    /**
     * Fails the task permanently and with it the problem: dependents fail with
     * {@link DependencyUnsatisfiableException}, every other non-terminal task is cancelled. Lock held.
     */
    private void failTask(ProblemExecution exec, SubTask failed, Throwable cause) {
        Instant now = Instant.now();
        failed.fail(cause, now);
        Set<String> dependents = TaskGraph.dependentsOf(failed.id(), exec.definitions());
        for (SubTask t : exec.tasks()) {
            if (t.status().isTerminal()) continue;
            abandon(exec, t);
            if (dependents.contains(t.id())) {
                t.fail(new DependencyUnsatisfiableException(t.id(), failed.id()), now);
            } else {
                t.cancel(null, now);
            }
        }
        String reason = "Task '" + failed.id() + "' failed: " + JsonUtils.errorMessage(cause);
        exec.fail(reason);
        exec.transition(ProblemState.FAILED);
        events.onProblemFailed(exec.problem().type(), exec.problem().id(), reason);
    }

    /** Takes back the load charged for an in-flight task. Lock held. */
    private void abandon(ProblemExecution exec, SubTask t) {
        if (!t.status().isInFlight()) return;
        exec.disposeInFlight(inFlightKey(t));
        if (t.status() == SubTaskStatus.RUNNING) {
            exec.taskStopped(elapsed(t));
        }
        registry.release(t.assignedWorker(), t.definition().estimatedCost());
    }

    private void afterChange(ProblemExecution exec) {
        ProblemState state = exec.locked(exec::state);
        if (state.isTerminal()) {
            terminate(exec);
            return;
        }
        boolean ready = exec.locked(() -> exec.state() == ProblemState.RUNNING && exec.allTerminal());
        if (ready) {
            validate(exec);
        } else {
            schedulePass(exec);
        }
    }

    private void validate(ProblemExecution exec) {
        Problem problem = exec.problem();
        record Round(int number, List<Candidate> candidates, Object fallback, Map<String, Object> results) { }
        Round r = exec.locked(() -> {
            if (exec.state() != ProblemState.RUNNING) return null;
            exec.transition(ProblemState.VALIDATING);
            List<Candidate> candidates = new ArrayList<>();
            Map<String, Object> results = new LinkedHashMap<>();
            for (SubTask t : exec.tasks()) {
                results.put(t.id(), t.result());
                if (t.definition().candidate()) {
                    candidates.add(new Candidate(t.id(), t.assignedWorker(), t.result(), t.workerSuccessRate()));
                }
            }
            List<String> sinks = TaskGraph.sinks(exec.definitions());
            Object fallback;
            if (sinks.size() == 1) {
                fallback = results.get(sinks.get(0));
            } else {
                Map<String, Object> sinkResults = new LinkedHashMap<>();
                sinks.forEach(id -> sinkResults.put(id, results.get(id)));
                fallback = sinkResults;
            }
            persist(exec);
            return new Round(exec.nextRound(), candidates, fallback, results);
        });
        if (r == null) return;

        try {
            ConsensusVerdict verdict = validator.validate(problem, r.candidates(), r.fallback(), r.number());
            events.onValidationRound(problem.type(), problem.id(), r.number(), verdict.consensus().agreementRatio(),
                    verdict.recompute());
            if (verdict.recompute()) {
                List<SubTaskDefinition> extra = exec.locked(() ->
                        exec.strategy().expand(problem, r.number() + 1, exec.definitions()));
                if (!extra.isEmpty()) {
                    exec.locked(() -> {
                        List<SubTaskDefinition> all = new ArrayList<>(exec.definitions());
                        all.addAll(extra);
                        TaskGraph.validate(problem.type(), all);
                        exec.addTasks(extra);
                        exec.transition(ProblemState.RUNNING);
                        persist(exec);
                    });
                    schedulePass(exec);
                    return;
                }
                verdict = validator.validate(problem, r.candidates(), r.fallback(), r.number(), false);
            }
            solve(exec, verdict, r.results());
        } catch (RuntimeException e) {
            log.error("Validation of problem {} failed", problem.id(), e);
            exec.locked(() -> {
                if (exec.state().isTerminal()) return;
                exec.fail("Validation failed: " + JsonUtils.errorMessage(e));
                exec.transition(ProblemState.FAILED);
                persist(exec);
            });
            events.onProblemFailed(problem.type(), problem.id(), "Validation failed: " + JsonUtils.errorMessage(e));
            terminate(exec);
        }
    }

    private void solve(ProblemExecution exec, ConsensusVerdict verdict, Map<String, Object> results) {
        Problem problem = exec.problem();
        Solution solution = exec.locked(() -> {
            PerformanceMetrics perf = new PerformanceMetrics(
                    Duration.between(exec.startedAt(), Instant.now()), exec.computeTime(), exec.maxParallelism());
            Solution s = new Solution(problem.id(), verdict.result(), verdict.confidence(), verdict.consensus(), perf,
                    results);
            exec.solved(s);
            exec.transition(ProblemState.SOLVED);
            persist(exec);
            return s;
        });
        events.onProblemSolved(problem.type(), problem.id(), solution);
        terminate(exec);
    }

    private void terminate(ProblemExecution exec) {
        String id = exec.problem().id();
        if (active.remove(id, exec)) {
            finished.put(id, exec);
            exec.publishDone(exec.locked(exec::toRecord));
        }
    }

    private ProblemExecution lookup(String problemId) {
        ProblemExecution exec = active.get(problemId);
        return exec != null ? exec : finished.get(problemId);
    }

    private void persist(ProblemExecution exec) {
        store.set(KEY_PREFIX + exec.problem().id(), exec.toRecord());
    }

    private static String inFlightKey(SubTask t) {
        return t.id() + "#" + t.epoch();
    }

    private static long elapsed(SubTask t) {
        return t.startedAt() == null ? 0L : Duration.between(t.startedAt(), Instant.now()).toMillis();
    }

    private static ActionFailedException asActionFailure(WorkerAgent worker, SubTaskDefinition def, Duration timeout,
                                                         Throwable err) {
        if (err instanceof TimeoutException) {
            return new ActionFailedException(worker.id(), def.action(),
                    "Task '" + def.id() + "' timed out after " + timeout.toMillis() + "ms", err);
        }
        return new ActionFailedException(worker.id(), def.action(),
                "Task '" + def.id() + "' failed: " + JsonUtils.errorMessage(err), err);
    }

    private record Dispatch(String taskId, WorkerAgent worker, long epoch) {
        String key() {
            return taskId + "#" + epoch;
        }
    }
}
