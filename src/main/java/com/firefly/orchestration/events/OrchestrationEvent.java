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


package com.firefly.orchestration.events;

import java.time.Instant;
import java.util.Map;

/**
 * One lifecycle event.
 *
 * @param type        what happened
 * @param aggregateId the saga run id, problem id or worker id the event belongs to
 * @param subjectId   the step name or sub-task id (nullable for aggregate-level events)
 * @param payload     event specific details
 * @param timestamp   when the event was emitted
 */
public record OrchestrationEvent(
        OrchestrationEventType type,
        String aggregateId,
        String subjectId,
        Map<String, Object> payload,
        Instant timestamp
) {
    public OrchestrationEvent {
        payload = payload == null ? Map.of() : Map.copyOf(payload);
    }

    public static OrchestrationEvent of(OrchestrationEventType type, String aggregateId, String subjectId,
                                        Map<String, Object> payload) {
        return new OrchestrationEvent(type, aggregateId, subjectId, payload, Instant.now());
    }
}
