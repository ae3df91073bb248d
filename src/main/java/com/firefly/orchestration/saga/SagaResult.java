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
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable snapshot of a finished (or in progress) saga run.
 */
public record SagaResult(
        String runId,
        String sagaName,
        SagaRunState state,
        Map<String, Object> data,
        List<String> completedSteps,
        String failedStep,
        Throwable error,
        Map<String, StepOutcome> steps,
        Instant startedAt,
        Instant completedAt
) {
    public record StepOutcome(
            SagaStepStatus status,
            int attempts,
            String workerId,
            Throwable error,
            Throwable compensationError
    ) {
        public boolean compensated() {
            return status == SagaStepStatus.COMPENSATED;
        }
    }

    public SagaResult {
        data = Collections.unmodifiableMap(new LinkedHashMap<>(data));
        completedSteps = List.copyOf(completedSteps);
        steps = Collections.unmodifiableMap(new LinkedHashMap<>(steps));
    }

    public boolean isSuccess() {
        return state == SagaRunState.COMPLETED;
    }

    public Optional<Throwable> errorIfAny() {
        return Optional.ofNullable(error);
    }

    public Duration duration() {
        return completedAt == null ? Duration.ZERO : Duration.between(startedAt, completedAt);
    }

    public <T> Optional<T> valueOf(String key, Class<T> type) {
        Object v = data.get(key);
        return type.isInstance(v) ? Optional.of(type.cast(v)) : Optional.empty();
    }
}
