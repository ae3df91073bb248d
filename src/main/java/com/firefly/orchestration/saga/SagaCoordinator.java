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

import com.firefly.orchestration.action.ActionExecutor;
import com.firefly.orchestration.exception.ActionFailedException;
import com.firefly.orchestration.exception.ExecutionCancelledException;
import com.firefly.orchestration.exception.NoWorkerAvailableException;
import com.firefly.orchestration.exception.SagaTimeoutException;
import com.firefly.orchestration.exception.UnknownExecutionException;
import com.firefly.orchestration.observability.OrchestrationEvents;
import com.firefly.orchestration.store.StateStore;
import com.firefly.orchestration.store.Versioned;
import com.firefly.orchestration.util.Jitter;
import com.firefly.orchestration.util.JsonUtils;
import com.firefly.orchestration.worker.WorkerAgent;
import com.firefly.orchestration.worker.WorkerLossListener;
import com.firefly.orchestration.worker.WorkerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Runs sagas: steps execute one after another on workers resolved through the {@link WorkerRegistry};
 * a step that exhausts its attempts moves the run to {@link SagaRunState#COMPENSATING} and the
 * completed steps are undone in reverse order by the {@link SagaCompensator}.
 * <p>
 * Each run is driven by a single reactive chain. Cancellation, the saga-level timeout and the forward
 * chain race each other, so cancelling aborts the in-flight attempt and any late result is dropped.
 * A worker going offline aborts only the attempt running on it; that attempt then follows the retry
 * policy like any other failure.
 */
public class SagaCoordinator implements WorkerLossListener {

    private static final Logger log = LoggerFactory.getLogger(SagaCoordinator.class);

    static final String KEY_PREFIX = "saga/";
    private static final double STEP_COST = 1d;

    private final WorkerRegistry registry;
    private final ActionExecutor executor;
    private final StateStore store;
    private final OrchestrationEvents events;
    private final SagaSettings settings;
    private final SagaCompensator compensator;
    private final Map<String, SagaRun> active = new ConcurrentHashMap<>();
    private final Map<String, SagaResult> finished;

    public SagaCoordinator(WorkerRegistry registry, ActionExecutor executor, StateStore store,
                           OrchestrationEvents events) {
        this(registry, executor, store, events, SagaSettings.defaults());
    }

    public SagaCoordinator(WorkerRegistry registry, ActionExecutor executor, StateStore store,
                           OrchestrationEvents events, SagaSettings settings) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.store = Objects.requireNonNull(store, "store");
        this.events = Objects.requireNonNull(events, "events");
        this.settings = settings != null ? settings : SagaSettings.defaults();
        this.compensator = new SagaCompensator(registry, executor, events);
        int retained = this.settings.retainedResults();
        this.finished = Collections.synchronizedMap(new LinkedHashMap<>(16, 0.75f, false) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, SagaResult> eldest) {
                return size() > retained;
            }
        });
        registry.addLossListener(this);
    }

    /**
     * Starts a run in the background.
     *
     * @return the run id; observe completion via events, {@link #status(String)} or {@link #awaitResult(String)}
     */
    public String submit(SagaDefinition definition, Map<String, Object> initialData) {
        SagaRun run = newRun(definition, initialData);
        drive(run).subscribe(
                r -> { },
                err -> log.error("Saga run {} terminated unexpectedly", run.id(), err));
        return run.id();
    }

    /**
     * Runs a saga when subscribed. The returned result is never an error signal for step failures:
     * a failed run completes with a {@link SagaResult} in state {@link SagaRunState#COMPENSATED}.
     */
    public Mono<SagaResult> execute(SagaDefinition definition, Map<String, Object> initialData) {
        return Mono.defer(() -> drive(newRun(definition, initialData)));
    }

    /**
     * Cancels a running saga: the in-flight attempt is aborted, late results are discarded and the
     * completed steps are compensated.
     *
     * @return false when the run is unknown or already finished
     */
    public boolean cancel(String runId) {
        return cancel(runId, new ExecutionCancelledException(runId), "cancelled by request");
    }

    public List<String> runningSagas() {
        List<String> ids = new ArrayList<>(active.keySet());
        Collections.sort(ids);
        return ids;
    }

    public Optional<SagaRunRecord> status(String runId) {
        SagaRun run = active.get(runId);
        if (run != null) {
            return Optional.of(run.toRecord());
        }
        return store.get(KEY_PREFIX + runId, SagaRunRecord.class).map(Versioned::value);
    }

    public Optional<SagaResult> result(String runId) {
        SagaRun run = active.get(runId);
        if (run != null) {
            return Optional.of(run.snapshot());
        }
        return Optional.ofNullable(finished.get(runId));
    }

    /** Completes with the final result of a run, waiting if it is still active. */
    public Mono<SagaResult> awaitResult(String runId) {
        SagaRun run = active.get(runId);
        if (run != null) {
            return run.result();
        }
        SagaResult done = finished.get(runId);
        return done != null ? Mono.just(done) : Mono.error(new UnknownExecutionException(runId));
    }

    /** Active runs without any progress since {@code now - window}. */
    public List<String> stalledRuns(Duration window, Instant now) {
        Instant cutoff = now.minus(window);
        List<String> stalled = new ArrayList<>();
        for (SagaRun run : active.values()) {
            if (run.lastProgressAt().isBefore(cutoff)) {
                stalled.add(run.id());
            }
        }
        return stalled;
    }

    @Override
    public void onWorkerLost(String workerId) {
        for (SagaRun run : active.values()) {
            if (run.abortIfOn(workerId, workerLost(workerId, run.currentAction()))) {
                log.warn(JsonUtils.json(
                        "saga_event", "worker_lost",
                        "saga", run.definition().name(),
                        "runId", run.id(),
                        "workerId", workerId
                ));
            }
        }
    }

    private static ActionFailedException workerLost(String workerId, String action) {
        return new ActionFailedException(workerId, action, "Worker '" + workerId + "' was lost");
    }

    private SagaRun newRun(SagaDefinition definition, Map<String, Object> initialData) {
        Objects.requireNonNull(definition, "definition");
        SagaRun run = new SagaRun(UUID.randomUUID().toString(), definition, initialData, Instant.now());
        active.put(run.id(), run);
        persist(run);
        return run;
    }

    private boolean cancel(String runId, Throwable cause, String reason) {
        SagaRun run = active.get(runId);
        if (run == null || !run.cancel(cause)) {
            return false;
        }
        events.onSagaCancelled(run.definition().name(), runId, reason);
        persist(run);
        return true;
    }

    private Mono<SagaResult> drive(SagaRun run) {
        SagaDefinition def = run.definition();
        events.onSagaStarted(def.name(), run.id());

        Mono<Void> forward = Flux.fromIterable(def.steps())
                .concatMap(step -> runStep(run, step, 1, 0))
                .then(Mono.defer(() -> run.settleForward() ? Mono.<Void>empty() : Mono.error(run.cancelCause())));

        List<Mono<Void>> racers = new ArrayList<>();
        racers.add(forward);
        racers.add(run.cancellationSignal());
        if (def.timeout() != null) {
            racers.add(Mono.delay(def.timeout())
                    .flatMap(t -> {
                        SagaTimeoutException timeout = new SagaTimeoutException(run.id(), def.timeout());
                        if (!cancel(run.id(), timeout, timeout.getMessage())) {
                            // forward phase already settled or another cause won
                            return Mono.<Void>never();
                        }
                        return Mono.<Void>error(timeout);
                    }));
        }

        return Mono.firstWithSignal(racers)
                .then(Mono.fromCallable(() -> finish(run, SagaRunState.COMPLETED)))
                .onErrorResume(err -> {
                    run.abandonInFlight(err);
                    run.transition(SagaRunState.COMPENSATING);
                    persist(run);
                    log.error(JsonUtils.json(
                            "saga_event", "compensating",
                            "saga", def.name(),
                            "runId", run.id(),
                            "completed", String.join(",", run.completedSteps()),
                            "error_class", err.getClass().getName(),
                            "error_msg", JsonUtils.errorMessage(err)
                    ));
                    return compensator.compensate(run)
                            .then(Mono.fromCallable(() -> finish(run, SagaRunState.COMPENSATED)));
                });
    }

    private SagaResult finish(SagaRun run, SagaRunState terminal) {
        run.transition(terminal);
        boolean success = terminal == SagaRunState.COMPLETED;
        SagaResult result = run.snapshot();
        persist(run);
        active.remove(run.id());
        finished.put(run.id(), result);
        events.onSagaCompleted(run.definition().name(), run.id(), success);
        if (run.markCallbacksFired()) {
            fireCallback(run, success ? run.definition().onSuccess() : run.definition().onFailure(), result);
        }
        run.publishResult(result);
        return result;
    }

    private void fireCallback(SagaRun run, Consumer<SagaResult> callback, SagaResult result) {
        if (callback == null) return;
        try {
            callback.accept(result);
        } catch (RuntimeException e) {
            log.warn("Terminal callback of saga run {} failed: {}", run.id(), e.getMessage(), e);
        }
    }

    /**
     * One attempt of a step, recursing for retries and registry re-polls.
     *
     * @param attempt the attempt about to be made
     * @param polls   registry re-polls already spent on this attempt
     */
    private Mono<Void> runStep(SagaRun run, SagaStep step, int attempt, int polls) {
        return Mono.defer(() -> {
            if (run.isCancelled()) {
                return Mono.error(run.cancelCause());
            }
            Optional<WorkerAgent> match = registry.findMatch(step.requiredCapabilities());
            if (match.isEmpty() || !registry.reserve(match.get().id(), STEP_COST)) {
                if (polls >= settings.resolveAttempts()) {
                    NoWorkerAvailableException none = new NoWorkerAvailableException(step.requiredCapabilities());
                    run.failStep(step.name(), none);
                    persist(run);
                    events.onStepFailed(run.definition().name(), run.id(), step.name(), none, run.attempts(step.name()), 0L);
                    return Mono.error(none);
                }
                Duration delay = Jitter.apply(settings.pollDelay(), settings.pollJitter());
                log.debug("No worker for step {} of run {}, re-polling in {}ms", step.name(), run.id(), delay.toMillis());
                return Mono.delay(delay).then(runStep(run, step, attempt, polls + 1));
            }
            return dispatch(run, step, match.get(), attempt);
        });
    }

    private Mono<Void> dispatch(SagaRun run, SagaStep step, WorkerAgent worker, int attempt) {
        String sagaName = run.definition().name();
        Sinks.One<Throwable> abort = Sinks.one();
        run.beginAttempt(step.name(), worker.id(), abort);
        persist(run);
        events.onStepStarted(sagaName, run.id(), step.name(), worker.id(), attempt);
        long start = System.currentTimeMillis();
        AtomicBoolean settled = new AtomicBoolean();
        // a loss between reserve and beginAttempt found no abort to fire
        boolean online = registry.get(worker.id()).map(WorkerAgent::isOnline).orElse(false);

        Mono<Optional<Object>> call = Mono.defer(() -> {
                    if (!online) {
                        return Mono.error(workerLost(worker.id(), step.action()));
                    }
                    Object input = step.input().apply(run.dataSnapshot());
                    return executor.executeAction(worker, step.action(), input, step.timeout(), run.id());
                })
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty())
                .timeout(step.timeout())
                .onErrorMap(err -> !(err instanceof ActionFailedException), err -> asActionFailure(worker, step, err));

        Mono<Optional<Object>> lost = abort.asMono().flatMap(Mono::error);

        return Mono.firstWithSignal(call, lost)
                .doOnCancel(() -> {
                    if (settled.compareAndSet(false, true)) {
                        registry.release(worker.id(), STEP_COST);
                    }
                })
                .flatMap(result -> {
                    if (settled.compareAndSet(false, true)) {
                        registry.recordOutcome(worker.id(), true, STEP_COST);
                    }
                    if (run.isCancelled()) {
                        // late result of a cancelled run
                        return Mono.error(run.cancelCause());
                    }
                    if (log.isDebugEnabled()) {
                        log.debug("Step {} of run {} returned {}", step.name(), run.id(),
                                JsonUtils.summarize(result.orElse(null), 200));
                    }
                    Map<String, Object> output = step.output().apply(result.orElse(null), run.dataSnapshot());
                    run.completeStep(step.name(), output);
                    persist(run);
                    long latency = System.currentTimeMillis() - start;
                    events.onStepSuccess(sagaName, run.id(), step.name(), attempt, latency, run.progress());
                    return Mono.<Void>empty();
                })
                .onErrorResume(err -> {
                    if (settled.compareAndSet(false, true)) {
                        registry.recordOutcome(worker.id(), false, STEP_COST);
                    }
                    long latency = System.currentTimeMillis() - start;
                    if (run.isCancelled()) {
                        run.failStep(step.name(), run.cancelCause());
                        persist(run);
                        return Mono.error(run.cancelCause());
                    }
                    int max = settings.retryPolicy().maxAttempts(step);
                    if (attempt < max) {
                        Duration delay = settings.retryPolicy().backoff(attempt);
                        run.endAttempt();
                        run.stepStatus(step.name(), SagaStepStatus.PENDING);
                        persist(run);
                        events.onStepRetry(sagaName, run.id(), step.name(), attempt, delay.toMillis(), err);
                        return Mono.delay(delay).then(runStep(run, step, attempt + 1, 0));
                    }
                    run.failStep(step.name(), err);
                    persist(run);
                    events.onStepFailed(sagaName, run.id(), step.name(), err, attempt, latency);
                    return Mono.error(err);
                });
    }

    private static ActionFailedException asActionFailure(WorkerAgent worker, SagaStep step, Throwable err) {
        if (err instanceof TimeoutException) {
            return new ActionFailedException(worker.id(), step.action(),
                    "Action '" + step.action() + "' timed out after " + step.timeout().toMillis() + "ms", err);
        }
        return new ActionFailedException(worker.id(), step.action(),
                "Action '" + step.action() + "' failed: " + JsonUtils.errorMessage(err), err);
    }

    private void persist(SagaRun run) {
        store.set(KEY_PREFIX + run.id(), run.toRecord());
    }
}
