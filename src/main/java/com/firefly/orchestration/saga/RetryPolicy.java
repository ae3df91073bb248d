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
 * Attempt budget and exponential backoff of saga steps: a retryable step gets
 * {@code retryableAttempts} attempts, any other step exactly one, and the n-th retry waits
 * {@code baseDelay * 2^(n-1)} capped at {@code maxDelay}.
 */
public record RetryPolicy(int retryableAttempts, Duration baseDelay, Duration maxDelay) {

    public static final RetryPolicy DEFAULT = new RetryPolicy(3, Duration.ofSeconds(1), Duration.ofSeconds(30));

    public RetryPolicy {
        if (retryableAttempts < 1) {
            throw new IllegalArgumentException("retryableAttempts must be >= 1");
        }
        baseDelay = baseDelay == null ? Duration.ZERO : baseDelay;
        maxDelay = maxDelay == null ? baseDelay : maxDelay;
    }

    public int maxAttempts(SagaStep step) {
        return step.retryable() ? retryableAttempts : 1;
    }

    /**
     * @param failedAttempts attempts made so far (1 after the first failure)
     */
    public Duration backoff(int failedAttempts) {
        int exp = Math.max(0, Math.min(30, failedAttempts - 1));
        long ms = baseDelay.toMillis() * (1L << exp);
        return Duration.ofMillis(Math.min(ms, maxDelay.toMillis()));
    }
}
