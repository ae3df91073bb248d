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
 * Lifecycle of a saga run: {@code RUNNING -> COMPLETED} or {@code RUNNING -> COMPENSATING -> COMPENSATED}.
 */
public enum SagaRunState {
    RUNNING,
    COMPLETED,
    COMPENSATING,
    COMPENSATED;

    public Set<SagaRunState> allowedTransitions() {
        return switch (this) {
            case RUNNING -> EnumSet.of(COMPLETED, COMPENSATING);
            case COMPENSATING -> EnumSet.of(COMPENSATED);
            case COMPLETED, COMPENSATED -> EnumSet.noneOf(SagaRunState.class);
        };
    }

    public boolean canTransitionTo(SagaRunState next) {
        return allowedTransitions().contains(next);
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == COMPENSATED;
    }
}
