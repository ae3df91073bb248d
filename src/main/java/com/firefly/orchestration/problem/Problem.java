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

import java.util.Objects;
import java.util.UUID;

/**
 * A unit of computational work submitted to the task scheduler. Immutable after submission.
 *
 * @param id         identity, generated by {@link #of} when not supplied
 * @param type       selects the decomposition strategy, agreement policy and constraints
 * @param payload    problem specific input handed to every sub-task
 * @param complexity size hint
 * @param metadata   priority, deadline and accuracy target
 */
public record Problem(String id, String type, Object payload, Complexity complexity, ProblemMetadata metadata) {

    public Problem {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(type, "type");
        complexity = complexity == null ? Complexity.MEDIUM : complexity;
        metadata = metadata == null ? ProblemMetadata.NONE : metadata;
    }

    public static Problem of(String type, Object payload, Complexity complexity) {
        return new Problem(UUID.randomUUID().toString(), type, payload, complexity, ProblemMetadata.NONE);
    }

    public static Problem of(String type, Object payload, Complexity complexity, ProblemMetadata metadata) {
        return new Problem(UUID.randomUUID().toString(), type, payload, complexity, metadata);
    }
}
