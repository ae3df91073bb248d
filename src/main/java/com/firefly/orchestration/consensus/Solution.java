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


package com.firefly.orchestration.consensus;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Final, immutable answer for a problem.
 *
 * @param problemId   the solved problem
 * @param result      aggregated result: the agreed value, or the sink task result when the
 *                    decomposition had no redundant candidates
 * @param confidence  confidence score in [0, 1]
 * @param consensus   how the candidates voted
 * @param performance timing and parallelism
 * @param taskResults result of every completed sub-task by id
 */
public record Solution(
        String problemId,
        Object result,
        double confidence,
        ConsensusRecord consensus,
        PerformanceMetrics performance,
        Map<String, Object> taskResults
) {
    public Solution {
        taskResults = taskResults == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(taskResults));
    }
}
