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


package com.firefly.orchestration.events;

/**
 * Lifecycle event types published on the {@link EventStream}. {@link #wireName()} is the name
 * external monitors subscribe to.
 */
public enum OrchestrationEventType {
    SAGA_STARTED("saga:started"),
    SAGA_STEP_COMPLETED("saga:step-completed"),
    SAGA_STEP_FAILED("saga:step-failed"),
    SAGA_STEP_COMPENSATED("saga:step-compensated"),
    SAGA_COMPENSATION_FAILED("saga:compensation-failed"),
    SAGA_COMPENSATED("saga:compensated"),
    SAGA_COMPLETED("saga:completed"),
    SAGA_FAILED("saga:failed"),
    SAGA_CANCELLED("saga:cancelled"),
    PROBLEM_SUBMITTED("problem:submitted"),
    PROBLEM_TASK_SCHEDULED("problem:task-scheduled"),
    PROBLEM_TASK_COMPLETED("problem:task-completed"),
    PROBLEM_TASK_FAILED("problem:task-failed"),
    PROBLEM_SOLVED("problem:solved"),
    PROBLEM_FAILED("problem:failed"),
    WORKER_REGISTERED("worker:registered"),
    WORKER_LOST("worker:lost");

    private final String wireName;

    OrchestrationEventType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static OrchestrationEventType fromWireName(String name) {
        for (OrchestrationEventType t : values()) {
            if (t.wireName.equals(name)) return t;
        }
        throw new IllegalArgumentException("Unknown event type: " + name);
    }

    @Override
    public String toString() {
        return wireName;
    }
}
