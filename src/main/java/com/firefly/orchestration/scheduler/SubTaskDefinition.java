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

import java.util.Objects;
import java.util.Set;

/**
 * What a {@link DecompositionStrategy} produces: one node of a problem's task graph.
 *
 * @param id            unique within the problem
 * @param kind          looked up in the {@link CapabilityTable} to find capable workers
 * @param action        action identifier sent to the worker
 * @param dependencies  ids that must be {@link SubTaskStatus#COMPLETED} before this task may be assigned
 * @param estimatedCost load charged to the worker while the task runs; also scales the timeout
 * @param candidate     whether the result is a redundant solver output that takes part in consensus
 * @param input         task specific input, merged with the problem payload
 */
public record SubTaskDefinition(
        String id,
        String kind,
        String action,
        Set<String> dependencies,
        double estimatedCost,
        boolean candidate,
        Object input
) {
    public SubTaskDefinition {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(kind, "kind");
        action = action != null ? action : kind;
        dependencies = dependencies == null ? Set.of() : Set.copyOf(dependencies);
        if (estimatedCost <= 0) {
            throw new IllegalArgumentException("estimatedCost must be positive for task " + id);
        }
    }

    public static SubTaskDefinition task(String id, String kind, Set<String> dependencies) {
        return new SubTaskDefinition(id, kind, kind, dependencies, 1d, false, null);
    }

    public static SubTaskDefinition candidate(String id, String kind, Set<String> dependencies) {
        return new SubTaskDefinition(id, kind, kind, dependencies, 1d, true, null);
    }

    public SubTaskDefinition withCost(double cost) {
        return new SubTaskDefinition(id, kind, action, dependencies, cost, candidate, input);
    }

    public SubTaskDefinition withInput(Object value) {
        return new SubTaskDefinition(id, kind, action, dependencies, estimatedCost, candidate, value);
    }

    public SubTaskDefinition withAction(String value) {
        return new SubTaskDefinition(id, kind, value, dependencies, estimatedCost, candidate, input);
    }
}
