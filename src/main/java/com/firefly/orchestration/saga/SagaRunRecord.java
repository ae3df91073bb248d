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

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Persisted view of a saga run, written under {@code saga/{runId}} on every transition.
 *
 * @param progress fraction of steps completed, in [0, 1]
 * @param failure  message of the captured error, null while none
 */
public record SagaRunRecord(
        String runId,
        String sagaName,
        SagaRunState state,
        List<String> completedSteps,
        Map<String, SagaStepStatus> stepStatuses,
        String failedStep,
        String failure,
        double progress,
        boolean cancelled,
        Instant startedAt,
        Instant updatedAt
) {
    public SagaRunRecord {
        completedSteps = List.copyOf(completedSteps);
        stepStatuses = Collections.unmodifiableMap(new LinkedHashMap<>(stepStatuses));
    }
}
