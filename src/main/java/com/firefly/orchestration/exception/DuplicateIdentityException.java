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
 * A worker re-registered under an existing id with different capabilities while the existing
 * entry declared its capabilities immutable.
 */
public class DuplicateIdentityException extends OrchestrationException {

    public DuplicateIdentityException(String workerId) {
        super("Worker '" + workerId + "' is already registered with immutable, different capabilities");
    }
}
