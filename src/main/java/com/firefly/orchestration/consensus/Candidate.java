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

/**
 * One redundant solver output considered for consensus.
 *
 * @param taskId   sub-task that produced the value
 * @param workerId worker that computed it
 * @param value    the candidate answer
 * @param weight   trust in the candidate, the worker's success rate when it reported the result
 */
public record Candidate(String taskId, String workerId, Object value, double weight) {
}
