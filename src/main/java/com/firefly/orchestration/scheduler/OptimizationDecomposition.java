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

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * {@code seed -> N parallel optimize candidates -> aggregate}, with N taken from the problem's
 * complexity (2, 4 or 8). Extra rounds add N more optimize candidates seeded by the same seed task.
 */
public class OptimizationDecomposition implements DecompositionStrategy {

    public static final String TYPE = "optimization";
    public static final String SEED = "seed";
    public static final String OPTIMIZE = "optimize";
    public static final String AGGREGATE = "aggregate";

    @Override
    public String problemType() {
        return TYPE;
    }

    @Override
    public List<SubTaskDefinition> decompose(Problem problem) {
        int fanOut = problem.complexity().defaultFanOut();
        List<SubTaskDefinition> tasks = new ArrayList<>(fanOut + 2);
        tasks.add(SubTaskDefinition.task(SEED, SEED, Set.of()).withAction("generate-seed"));
        List<String> solvers = new ArrayList<>(fanOut);
        for (int i = 1; i <= fanOut; i++) {
            String id = OPTIMIZE + "-" + i;
            solvers.add(id);
            tasks.add(SubTaskDefinition.candidate(id, OPTIMIZE, Set.of(SEED)).withInput(i));
        }
        tasks.add(SubTaskDefinition.task(AGGREGATE, AGGREGATE, Set.copyOf(solvers)));
        return tasks;
    }

    @Override
    public List<SubTaskDefinition> expand(Problem problem, int round, List<SubTaskDefinition> existing) {
        int fanOut = problem.complexity().defaultFanOut();
        List<SubTaskDefinition> extra = new ArrayList<>(fanOut);
        for (int i = 1; i <= fanOut; i++) {
            extra.add(SubTaskDefinition.candidate(OPTIMIZE + "-r" + round + "-" + i, OPTIMIZE, Set.of(SEED))
                    .withInput(i));
        }
        return extra;
    }
}
