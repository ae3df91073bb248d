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

import java.util.Map;

/**
 * Input sent to the worker running a sub-task.
 *
 * @param problemId         owning problem
 * @param taskId            the sub-task
 * @param kind              sub-task kind
 * @param payload           the problem payload
 * @param input             the task specific input from the decomposition, may be null
 * @param dependencyResults results of the task's dependencies by task id
 */
public record TaskInput(
        String problemId,
        String taskId,
        String kind,
        Object payload,
        Object input,
        Map<String, Object> dependencyResults
) {
}
