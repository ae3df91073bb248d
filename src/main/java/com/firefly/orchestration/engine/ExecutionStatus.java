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


package com.firefly.orchestration.engine;

import com.firefly.orchestration.consensus.Solution;
import com.firefly.orchestration.events.OrchestrationEvent;

import java.time.Instant;
import java.util.List;

/**
 * Status report of a saga run or a problem.
 *
 * @param id            run id or problem id
 * @param kind          saga or problem
 * @param name          saga name or problem type
 * @param state         name of the current state
 * @param progress      completed fraction in [0, 1]
 * @param terminal      true once the execution will not change anymore
 * @param solution      the solution of a solved problem, null otherwise
 * @param failureReason why the execution failed, null while healthy
 * @param events        recent lifecycle events, oldest first
 * @param updatedAt     time of the last recorded progress
 */
public record ExecutionStatus(
        String id,
        ExecutionKind kind,
        String name,
        String state,
        double progress,
        boolean terminal,
        Solution solution,
        String failureReason,
        List<OrchestrationEvent> events,
        Instant updatedAt
) {
    public ExecutionStatus {
        events = events == null ? List.of() : List.copyOf(events);
    }

    public int percentComplete() {
        return (int) Math.round(progress * 100);
    }
}
