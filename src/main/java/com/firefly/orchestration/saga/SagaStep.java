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

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * One step of a saga: a forward action run on a worker with {@code capability}, paired with the
 * action that semantically undoes it.
 *
 * @param name               unique name within the saga
 * @param capability         capability a worker needs to run the step and its compensation
 * @param action             forward action identifier
 * @param compensationAction compensating action identifier, null when the step needs no undo
 * @param retryable          whether a failed attempt may be retried
 * @param timeout            per attempt timeout
 * @param input              derives the action input from the run's data
 * @param output             turns the action result into entries merged into the run's data
 */
public record SagaStep(
        String name,
        String capability,
        String action,
        String compensationAction,
        boolean retryable,
        Duration timeout,
        Function<Map<String, Object>, Object> input,
        BiFunction<Object, Map<String, Object>, Map<String, Object>> output
) {
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    public SagaStep {
        requireText(name, "name");
        requireText(capability, "capability");
        requireText(action, "action");
        timeout = timeout == null || timeout.isZero() || timeout.isNegative() ? DEFAULT_TIMEOUT : timeout;
        input = input != null ? input : data -> new LinkedHashMap<>(data);
        if (output == null) {
            String key = name;
            output = (result, data) -> Collections.singletonMap(key, result);
        }
    }

    public Set<String> requiredCapabilities() {
        return Set.of(capability);
    }

    public boolean hasCompensation() {
        return compensationAction != null && !compensationAction.isBlank();
    }

    private static void requireText(String value, String field) {
        Objects.requireNonNull(value, field);
        if (value.isBlank()) {
            throw new IllegalArgumentException("Saga step " + field + " must not be blank");
        }
    }
}
