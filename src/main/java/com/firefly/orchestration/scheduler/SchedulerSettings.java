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

import java.time.Duration;

/**
 * Tunables of the {@link TaskScheduler}.
 *
 * @param maxAttempts                  failed attempts after which a sub-task fails permanently
 * @param baseTaskTimeout              timeout of a task with cost 1; larger costs scale it linearly
 * @param pollDelay                    nominal delay of the re-poll when no worker is free
 * @param pollJitter                   spread applied to {@code pollDelay}, in [0, 1]
 * @param failWithoutCapableWorker     fail a task at once when no online worker has its capabilities
 * @param retainedProblems             finished problems kept queryable in memory
 */
public record SchedulerSettings(int maxAttempts, Duration baseTaskTimeout, Duration pollDelay, double pollJitter,
                                boolean failWithoutCapableWorker, int retainedProblems) {

    public static SchedulerSettings defaults() {
        return new SchedulerSettings(3, Duration.ofSeconds(30), Duration.ofMillis(500), 0.25, true, 1000);
    }

    public SchedulerSettings {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        baseTaskTimeout = baseTaskTimeout != null ? baseTaskTimeout : Duration.ofSeconds(30);
        pollDelay = pollDelay != null ? pollDelay : Duration.ofMillis(500);
        retainedProblems = Math.max(1, retainedProblems);
    }

    /** SLA of a task derived from its estimated cost. */
    public Duration timeoutFor(SubTaskDefinition task) {
        double factor = Math.max(1d, task.estimatedCost());
        return Duration.ofMillis(Math.round(baseTaskTimeout.toMillis() * factor));
    }
}
