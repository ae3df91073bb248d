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


package com.firefly.orchestration.consensus;

import java.time.Duration;

/**
 * @param wallTime    submission to solution
 * @param computeTime sum of the execution time of every completed sub-task attempt
 * @param parallelism highest number of sub-tasks observed running at the same time
 */
public record PerformanceMetrics(Duration wallTime, Duration computeTime, int parallelism) {
}
