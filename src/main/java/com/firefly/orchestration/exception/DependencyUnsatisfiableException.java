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


package com.firefly.orchestration.exception;

/**
 * A sub-task can never run because one of its dependencies failed permanently.
 */
public class DependencyUnsatisfiableException extends OrchestrationException {
    private final String taskId;
    private final String failedDependency;

    public DependencyUnsatisfiableException(String taskId, String failedDependency) {
        super("Task '" + taskId + "' can never run: dependency '" + failedDependency + "' failed permanently");
        this.taskId = taskId;
        this.failedDependency = failedDependency;
    }

    public String taskId() {
        return taskId;
    }

    public String failedDependency() {
        return failedDependency;
    }
}
