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
 * Lifecycle of a sub-task: {@code PENDING -> ASSIGNED -> RUNNING -> COMPLETED | FAILED}. A failed
 * attempt below the retry ceiling, or the loss of the worker, sends the task back to {@code PENDING}.
 */
public enum SubTaskStatus {
    PENDING,
    ASSIGNED,
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public Set<SubTaskStatus> allowedTransitions() {
        return switch (this) {
            case PENDING -> EnumSet.of(ASSIGNED, FAILED, CANCELLED);
            case ASSIGNED -> EnumSet.of(RUNNING, PENDING, FAILED, CANCELLED);
            case RUNNING -> EnumSet.of(COMPLETED, PENDING, FAILED, CANCELLED);
            case COMPLETED, FAILED, CANCELLED -> EnumSet.noneOf(SubTaskStatus.class);
        };
    }

    public boolean canTransitionTo(SubTaskStatus next) {
        return allowedTransitions().contains(next);
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /** Work currently charged to a worker. */
    public boolean isInFlight() {
        return this == ASSIGNED || this == RUNNING;
    }
}
