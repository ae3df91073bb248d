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

import com.firefly.orchestration.problem.Problem;

import java.util.List;

/**
 * Turns a problem of one type into a graph of sub-tasks. Implementations are pure functions of the
 * problem; the scheduler never interprets problem semantics itself.
 */
public interface DecompositionStrategy {

    /** Problem type this strategy handles. */
    String problemType();

    List<SubTaskDefinition> decompose(Problem problem);

    /**
     * Extra solver tasks for another validation round, appended to the existing graph. Dependencies
     * may point at existing tasks. An empty list means the strategy cannot add solvers and the
     * validator settles for the current candidates.
     *
     * @param round    1-based index of the round the new tasks belong to
     * @param existing every task already in the graph
     */
    default List<SubTaskDefinition> expand(Problem problem, int round, List<SubTaskDefinition> existing) {
        return List.of();
    }
}
