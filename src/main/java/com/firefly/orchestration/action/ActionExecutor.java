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


package com.firefly.orchestration.action;

import com.firefly.orchestration.worker.WorkerAgent;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * The only point where the engine calls out to a worker. Real agents, remote services and
 * simulators are plugged in behind this interface.
 * <p>
 * The returned {@link Mono} emits the action result, completes empty when the action produced no
 * result, or errors when the action failed. The engine applies {@code timeout} itself as well, so
 * implementations may treat it as a hint for the remote side.
 */
@FunctionalInterface
public interface ActionExecutor {

    Mono<Object> executeAction(WorkerAgent agent, String action, Object input, Duration timeout);

    /**
     * Variant carrying the id of the saga run or problem the call belongs to, for propagation to
     * remote workers. Defaults to ignoring it.
     */
    default Mono<Object> executeAction(WorkerAgent agent, String action, Object input, Duration timeout,
                                       String orchestrationId) {
        return executeAction(agent, action, input, timeout);
    }
}
