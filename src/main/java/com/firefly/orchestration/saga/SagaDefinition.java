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
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Immutable, ordered list of {@link SagaStep}s plus run level settings. Build one with {@link SagaBuilder}.
 *
 * @param name      saga name, used in logs and metrics
 * @param steps     steps in execution order
 * @param timeout   limit for the whole run, null for none
 * @param onSuccess invoked once when a run completes
 * @param onFailure invoked once after a failed run has been compensated
 */
public record SagaDefinition(
        String name,
        List<SagaStep> steps,
        Duration timeout,
        Consumer<SagaResult> onSuccess,
        Consumer<SagaResult> onFailure
) {
    public SagaDefinition {
        Objects.requireNonNull(name, "name");
        steps = List.copyOf(steps);
        if (steps.isEmpty()) {
            throw new IllegalArgumentException("Saga '" + name + "' has no steps");
        }
        Set<String> seen = new HashSet<>();
        for (SagaStep s : steps) {
            if (!seen.add(s.name())) {
                throw new IllegalArgumentException("Duplicate step '" + s.name() + "' in saga '" + name + "'");
            }
        }
        if (timeout != null && (timeout.isZero() || timeout.isNegative())) {
            timeout = null;
        }
    }

    public SagaStep step(String stepName) {
        for (SagaStep s : steps) {
            if (s.name().equals(stepName)) return s;
        }
        throw new IllegalArgumentException("Unknown step '" + stepName + "' in saga '" + name + "'");
    }

    public int indexOf(String stepName) {
        for (int i = 0; i < steps.size(); i++) {
            if (steps.get(i).name().equals(stepName)) return i;
        }
        return -1;
    }
}
