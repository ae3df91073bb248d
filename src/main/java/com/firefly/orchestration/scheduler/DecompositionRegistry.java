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

import com.firefly.orchestration.exception.UnknownProblemTypeException;
import com.firefly.orchestration.problem.Problem;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Strategy map keyed by problem type. New problem types are supported by registering a strategy,
 * without touching the scheduler.
 */
public class DecompositionRegistry {

    private final Map<String, DecompositionStrategy> strategies = new ConcurrentHashMap<>();

    public DecompositionRegistry() {
    }

    public DecompositionRegistry(Collection<? extends DecompositionStrategy> initial) {
        initial.forEach(this::register);
    }

    /** Registry with the built-in optimization and analysis strategies. */
    public static DecompositionRegistry withDefaults() {
        return new DecompositionRegistry(List.of(new OptimizationDecomposition(), new AnalysisDecomposition()));
    }

    public DecompositionRegistry register(DecompositionStrategy strategy) {
        Objects.requireNonNull(strategy, "strategy");
        strategies.put(strategy.problemType(), strategy);
        return this;
    }

    public DecompositionStrategy strategyFor(String problemType) {
        DecompositionStrategy s = strategies.get(problemType);
        if (s == null) {
            throw new UnknownProblemTypeException(problemType);
        }
        return s;
    }

    public Set<String> problemTypes() {
        return Set.copyOf(strategies.keySet());
    }

    /** Decomposes and validates the resulting graph. */
    public List<SubTaskDefinition> decompose(Problem problem) {
        List<SubTaskDefinition> tasks = List.copyOf(strategyFor(problem.type()).decompose(problem));
        TaskGraph.validate(problem.type(), tasks);
        return tasks;
    }
}
