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


package com.firefly.orchestration.worker;

import java.util.EnumSet;
import java.util.Set;

/**
 * Availability of a worker agent.
 */
public enum WorkerStatus {
    /** Online with spare capacity. */
    IDLE,
    /** Online but at its maximum load. */
    BUSY,
    /** Unreachable: explicitly marked, deregistered or heartbeat expired. */
    OFFLINE;

    public boolean canAcceptWork() {
        return this != OFFLINE;
    }

    public Set<WorkerStatus> allowedTransitions() {
        return switch (this) {
            case IDLE -> EnumSet.of(BUSY, OFFLINE);
            case BUSY -> EnumSet.of(IDLE, OFFLINE);
            case OFFLINE -> EnumSet.of(IDLE, BUSY);
        };
    }

    public boolean canTransitionTo(WorkerStatus next) {
        return this == next || allowedTransitions().contains(next);
    }
}
