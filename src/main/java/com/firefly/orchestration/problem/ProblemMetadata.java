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


package com.firefly.orchestration.problem;

import java.time.Instant;

/**
 * Optional hints attached to a problem.
 *
 * @param priority       higher values are scheduled first when several problems compete for workers
 * @param deadline       informational deadline (nullable)
 * @param accuracyTarget required agreement ratio; overrides the validator threshold when higher (nullable)
 */
public record ProblemMetadata(int priority, Instant deadline, Double accuracyTarget) {

    public static final ProblemMetadata NONE = new ProblemMetadata(0, null, null);

    public ProblemMetadata {
        if (accuracyTarget != null && (accuracyTarget < 0d || accuracyTarget > 1d)) {
            throw new IllegalArgumentException("accuracyTarget must be within [0, 1]");
        }
    }
}
