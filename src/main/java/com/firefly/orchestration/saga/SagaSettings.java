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


package com.firefly.orchestration.saga;

import java.time.Duration;

/**
 * Tunables of the {@link SagaCoordinator}.
 *
 * @param retryPolicy     attempt budget and backoff of forward steps
 * @param resolveAttempts how many times a step re-polls the registry for a free worker before failing
 * @param pollDelay       nominal delay between re-polls
 * @param pollJitter      spread applied to {@code pollDelay}, in [0, 1]
 * @param retainedResults finished runs whose results stay queryable in memory
 */
public record SagaSettings(RetryPolicy retryPolicy, int resolveAttempts, Duration pollDelay, double pollJitter,
                           int retainedResults) {

    public static SagaSettings defaults() {
        return new SagaSettings(RetryPolicy.DEFAULT, 10, Duration.ofMillis(500), 0.25, 1000);
    }

    public SagaSettings {
        retryPolicy = retryPolicy != null ? retryPolicy : RetryPolicy.DEFAULT;
        resolveAttempts = Math.max(0, resolveAttempts);
        pollDelay = pollDelay != null ? pollDelay : Duration.ofMillis(500);
        retainedResults = Math.max(1, retainedResults);
    }

    public SagaSettings withRetryPolicy(RetryPolicy policy) {
        return new SagaSettings(policy, resolveAttempts, pollDelay, pollJitter, retainedResults);
    }

    public SagaSettings withResolve(int attempts, Duration delay) {
        return new SagaSettings(retryPolicy, attempts, delay, pollJitter, retainedResults);
    }
}
