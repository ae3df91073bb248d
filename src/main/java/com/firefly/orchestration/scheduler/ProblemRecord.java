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

import com.firefly.orchestration.consensus.Solution;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Persisted view of a problem execution, written under {@code problem/{id}} on every change.
 *
 * @param tasks         status of every sub-task by id
 * @param progress      fraction of sub-tasks completed, in [0, 1]
 * @param round         validation rounds started so far
 * @param failureReason first permanent failure, null unless failed or cancelled
 * @param solution      set once solved
 */
public record ProblemRecord(
        String problemId,
        String problemType,
        ProblemState state,
        Map<String, SubTaskStatus> tasks,
        double progress,
        int round,
        String failureReason,
        Solution solution,
        Instant startedAt,
        Instant updatedAt
) {
    public ProblemRecord {
        tasks = Collections.unmodifiableMap(new LinkedHashMap<>(tasks));
    }
}
