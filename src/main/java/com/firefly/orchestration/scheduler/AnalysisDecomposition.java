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
 * {@code partition -> N analyze shards -> merge}. The shards work on different parts of the input,
 * so none of them is a consensus candidate and the merged result is the answer.
 */
public class AnalysisDecomposition implements DecompositionStrategy {

    public static final String TYPE = "analysis";
    public static final String PARTITION = "partition";
    public static final String ANALYZE = "analyze";
    public static final String MERGE = "merge";

    @Override
    public String problemType() {
        return TYPE;
    }

    @Override
    public List<SubTaskDefinition> decompose(Problem problem) {
        int shards = problem.complexity().defaultFanOut();
        List<SubTaskDefinition> tasks = new ArrayList<>(shards + 2);
        tasks.add(SubTaskDefinition.task(PARTITION, PARTITION, Set.of()).withInput(shards));
        List<String> analyzers = new ArrayList<>(shards);
        for (int i = 0; i < shards; i++) {
            String id = ANALYZE + "-" + i;
            analyzers.add(id);
            tasks.add(SubTaskDefinition.task(id, ANALYZE, Set.of(PARTITION)).withInput(i));
        }
        tasks.add(SubTaskDefinition.task(MERGE, MERGE, Set.copyOf(analyzers)));
        return tasks;
    }
}
