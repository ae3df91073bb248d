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


package com.firefly.orchestration.health;

import com.firefly.orchestration.engine.OrchestrationEngine;
import com.firefly.orchestration.worker.WorkerAgent;
import com.firefly.orchestration.worker.WorkerStatus;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Spring Boot Actuator health indicator for the orchestration engine.
 * <p>
 * Reports {@code DOWN} while any saga run or problem made no progress inside the stall window,
 * listing the stalled ids. Worker availability is reported as details.
 */
public class OrchestrationHealthIndicator implements HealthIndicator {

    private final OrchestrationEngine engine;
    private final Duration stallWindow;

    public OrchestrationHealthIndicator(OrchestrationEngine engine, Duration stallWindow) {
        this.engine = engine;
        this.stallWindow = stallWindow;
    }

    @Override
    public Health health() {
        try {
            List<String> stalled = engine.stalledExecutions(stallWindow);
            List<WorkerAgent> workers = engine.workers().all();
            long online = workers.stream().filter(w -> w.status() != WorkerStatus.OFFLINE).count();
            long saturated = workers.stream().filter(w -> w.status() == WorkerStatus.BUSY).count();

            Map<String, Object> details = new LinkedHashMap<>();
            details.put("runningSagas", engine.runningSagas().size());
            details.put("activeProblems", engine.activeProblems().size());
            details.put("workersTotal", workers.size());
            details.put("workersOnline", online);
            details.put("workersBusy", saturated);
            details.put("stallWindowMs", stallWindow.toMillis());

            Health.Builder builder = stalled.isEmpty() ? Health.up() : Health.down();
            if (!stalled.isEmpty()) {
                details.put("stalledExecutions", stalled);
            }
            return builder.withDetails(details).build();
        } catch (Exception e) {
            return Health.down()
                    .withDetail("error", "Failed to collect orchestration health: " + e.getMessage())
                    .build();
        }
    }
}
