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

import com.firefly.orchestration.util.JsonUtils;

import java.time.Instant;

/**
 * Immutable snapshot of a {@link SubTask}.
 */
public record SubTaskView(
        String id,
        String kind,
        SubTaskStatus status,
        String assignedWorker,
        int attempts,
        Object result,
        String error,
        Instant startedAt,
        Instant completedAt
) {
    static SubTaskView of(SubTask task) {
        return new SubTaskView(task.id(), task.definition().kind(), task.status(), task.assignedWorker(),
                task.attempts(), task.result(), task.error() == null ? null : JsonUtils.errorMessage(task.error()),
                task.startedAt(), task.completedAt());
    }
}
