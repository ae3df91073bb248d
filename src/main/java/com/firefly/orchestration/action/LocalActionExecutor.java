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

import com.firefly.orchestration.exception.ActionFailedException;
import com.firefly.orchestration.worker.WorkerAgent;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs actions in-process by dispatching to registered {@link ActionHandler}s by action name.
 * Used for embedded workers and simulations.
 */
public class LocalActionExecutor implements ActionExecutor {

    private final Map<String, ActionHandler> handlers = new ConcurrentHashMap<>();

    public LocalActionExecutor register(String action, ActionHandler handler) {
        handlers.put(Objects.requireNonNull(action, "action"), Objects.requireNonNull(handler, "handler"));
        return this;
    }

    public Set<String> actions() {
        return Set.copyOf(handlers.keySet());
    }

    @Override
    public Mono<Object> executeAction(WorkerAgent agent, String action, Object input, Duration timeout) {
        ActionHandler handler = handlers.get(action);
        if (handler == null) {
            return Mono.error(new ActionFailedException(agent.id(), action, "No handler registered for action '" + action + "'"));
        }
        return Mono.defer(() -> handler.handle(agent, input));
    }
}
