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


package com.firefly.orchestration.scheduler;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a submitted problem. {@code VALIDATING -> RUNNING} happens when the validator asks
 * for another round of solvers.
 */
public enum ProblemState {
    RUNNING,
    VALIDATING,
    SOLVED,
    FAILED,
    CANCELLED;

    public Set<ProblemState> allowedTransitions() {
        return switch (this) {
            case RUNNING -> EnumSet.of(VALIDATING, FAILED, CANCELLED);
            case VALIDATING -> EnumSet.of(RUNNING, SOLVED, FAILED, CANCELLED);
            case SOLVED, FAILED, CANCELLED -> EnumSet.noneOf(ProblemState.class);
        };
    }

    public boolean canTransitionTo(ProblemState next) {
        return allowedTransitions().contains(next);
    }

    public boolean isTerminal() {
        return this == SOLVED || this == FAILED || this == CANCELLED;
    }
}
