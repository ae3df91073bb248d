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

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle states of a saga step within a single run.
 */
public enum SagaStepStatus {
    PENDING,
    RUNNING,
    DONE,
    FAILED,
    COMPENSATED,
    COMPENSATION_FAILED;

    public Set<SagaStepStatus> allowedTransitions() {
        return switch (this) {
            case PENDING -> EnumSet.of(RUNNING, FAILED);
            // PENDING again while waiting for a retry
            case RUNNING -> EnumSet.of(DONE, FAILED, PENDING);
            case DONE -> EnumSet.of(COMPENSATED, COMPENSATION_FAILED);
            case FAILED, COMPENSATED, COMPENSATION_FAILED -> EnumSet.noneOf(SagaStepStatus.class);
        };
    }

    public boolean canTransitionTo(SagaStepStatus next) {
        return allowedTransitions().contains(next);
    }
}
