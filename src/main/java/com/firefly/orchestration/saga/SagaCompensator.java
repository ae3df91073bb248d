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
import com.firefly.orchestration.exception.CompensationFailedException;
import com.firefly.orchestration.exception.NoWorkerAvailableException;
import com.firefly.orchestration.observability.OrchestrationEvents;
import com.firefly.orchestration.util.JsonUtils;
import com.firefly.orchestration.worker.WorkerAgent;
import com.firefly.orchestration.worker.WorkerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * Unwinds a failed run: compensations run one at a time in strict reverse order of the completed
 * steps, each exactly once, with the run's current data as input. A failed compensation is recorded
 * and the unwind moves on; compensations are never retried.
 */
final class SagaCompensator {

    private static final Logger log = LoggerFactory.getLogger(SagaCompensator.class);

    private final WorkerRegistry registry;
    private final ActionExecutor executor;
    private final OrchestrationEvents events;

    SagaCompensator(WorkerRegistry registry, ActionExecutor executor, OrchestrationEvents events) {
        this.registry = registry;
        this.executor = executor;
        this.events = events;
    }

    Mono<Void> compensate(SagaRun run) {
        List<String> reversed = new ArrayList<>(run.completedSteps());
        Collections.reverse(reversed);
        return Flux.fromIterable(reversed)
                .concatMap(stepName -> compensateOne(run, run.definition().step(stepName)))
                .then();
    }

    private Mono<Void> compensateOne(SagaRun run, SagaStep step) {
        String sagaName = run.definition().name();
        if (!step.hasCompensation()) {
            run.compensated(step.name(), null);
            events.onCompensated(sagaName, run.id(), step.name(), null);
            return Mono.empty();
        }
        events.onCompensationStarted(sagaName, run.id(), step.name());
        Map<String, Object> input = run.dataSnapshot();
        return Mono.defer(() -> {
                    WorkerAgent worker = resolve(step);
                    return executor.executeAction(worker, step.compensationAction(), input, step.timeout(), run.id())
                            .timeout(step.timeout())
                            .onErrorMap(TimeoutException.class, e -> new ActionFailedException(worker.id(),
                                    step.compensationAction(), "Compensation timed out after " + step.timeout().toMillis() + "ms", e))
                            .doOnSuccess(v -> registry.recordOutcome(worker.id(), true, 0d))
                            .doOnError(e -> registry.recordOutcome(worker.id(), false, 0d));
                })
                .then(Mono.fromRunnable(() -> {
                    run.compensated(step.name(), null);
                    events.onCompensated(sagaName, run.id(), step.name(), null);
                }))
                .onErrorResume(err -> {
                    CompensationFailedException failure = new CompensationFailedException(step.name(), err);
                    log.error(JsonUtils.json(
                            "saga_event", "compensation_error",
                            "saga", sagaName,
                            "runId", run.id(),
                            "step", step.name(),
                            "action", step.compensationAction(),
                            "error_class", err.getClass().getName(),
                            "error_msg", JsonUtils.errorMessage(err)
                    ));
                    run.compensated(step.name(), failure);
                    events.onCompensated(sagaName, run.id(), step.name(), failure);
                    return Mono.empty();
                })
                .then();
    }

    /**
     * Compensations must not starve behind forward work, so a saturated but capable worker is
     * accepted when no worker has spare capacity.
     */
    private WorkerAgent resolve(SagaStep step) {
        Optional<WorkerAgent> match = registry.findMatch(step.requiredCapabilities());
        if (match.isPresent()) {
            return match.get();
        }
        return registry.all().stream()
                .filter(w -> w.isOnline() && w.hasCapabilities(step.requiredCapabilities()))
                .findFirst()
                .orElseThrow(() -> new NoWorkerAvailableException(step.requiredCapabilities()));
    }
}
