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
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Duration;
import java.util.Map;

/**
 * Executes actions on remote workers by POSTing the JSON input to {@code {endpoint}/actions/{action}}.
 * The saga run or problem id is propagated in {@value #ORCHESTRATION_HEADER}.
 */
public class HttpActionExecutor implements ActionExecutor {
    public static final String ORCHESTRATION_HEADER = "X-Orchestration-Id";

    private final WebClient webClient;

    public HttpActionExecutor(WebClient webClient) {
        this.webClient = webClient;
    }

    @Override
    public Mono<Object> executeAction(WorkerAgent agent, String action, Object input, Duration timeout) {
        return executeAction(agent, action, input, timeout, null);
    }

    @Override
    public Mono<Object> executeAction(WorkerAgent agent, String action, Object input, Duration timeout,
                                     String orchestrationId) {
        if (agent.endpoint() == null) {
            return Mono.error(new ActionFailedException(agent.id(), action, "Worker '" + agent.id() + "' has no endpoint"));
        }
        URI uri = UriComponentsBuilder.fromUri(agent.endpoint())
                .path("/actions/{action}")
                .buildAndExpand(action)
                .toUri();
        WebClient.RequestHeadersSpec<?> spec = webClient.post()
                .uri(uri)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(input != null ? input : Map.of());
        Mono<Object> call = propagate(spec, orchestrationId)
                .retrieve()
                .bodyToMono(Object.class);
        if (timeout != null && !timeout.isZero() && !timeout.isNegative()) {
            call = call.timeout(timeout);
        }
        return call.onErrorMap(err -> !(err instanceof ActionFailedException),
                err -> new ActionFailedException(agent.id(), action, describe(action, err), err));
    }

    static WebClient.RequestHeadersSpec<?> propagate(WebClient.RequestHeadersSpec<?> spec, String orchestrationId) {
        if (orchestrationId == null) return spec;
        return spec.header(ORCHESTRATION_HEADER, orchestrationId);
    }

    private static String describe(String action, Throwable err) {
        if (err instanceof WebClientResponseException wre) {
            return "Action '" + action + "' returned HTTP " + wre.getStatusCode().value();
        }
        return "Action '" + action + "' failed: " + (err.getMessage() != null ? err.getMessage() : err.getClass().getSimpleName());
    }
}
