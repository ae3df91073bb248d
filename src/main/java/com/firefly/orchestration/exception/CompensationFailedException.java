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
 * A compensating action failed. Logged and recorded on the run; never retried and never blocks
 * the remaining compensations.
 */
public class CompensationFailedException extends OrchestrationException {
    private final String stepName;

    public CompensationFailedException(String stepName, Throwable cause) {
        super("Compensation of step '" + stepName + "' failed: " + (cause != null ? cause.getMessage() : "unknown"), cause);
        this.stepName = stepName;
    }

    public String stepName() {
        return stepName;
    }
}
