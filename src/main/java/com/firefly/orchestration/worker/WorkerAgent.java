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


package com.firefly.orchestration.worker;

import java.net.URI;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collection;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable snapshot of a worker agent as known by the {@link WorkerRegistry}.
 * The registry replaces snapshots atomically; nobody else mutates worker state.
 *
 * @param id                 stable identity of the worker
 * @param capabilities       capability tags the worker declared
 * @param status             availability
 * @param currentLoad        sum of the estimated cost of work currently dispatched to it
 * @param maxLoad            capacity; the worker is matched only while {@code currentLoad < maxLoad}
 * @param successRate        exponential moving average of attempt outcomes, in [0, 1]
 * @param lastHeartbeat      last time the worker proved it is alive
 * @param endpoint           base URI for remote executors (nullable)
 * @param capabilitiesLocked whether re-registration must keep the same capabilities
 */
public record WorkerAgent(
        String id,
        Set<String> capabilities,
        WorkerStatus status,
        double currentLoad,
        double maxLoad,
        double successRate,
        Instant lastHeartbeat,
        URI endpoint,
        boolean capabilitiesLocked
) {
    public WorkerAgent {
        Objects.requireNonNull(id, "id");
        capabilities = capabilities == null ? Set.of() : Set.copyOf(capabilities);
        status = status == null ? WorkerStatus.IDLE : status;
        if (maxLoad <= 0) {
            throw new IllegalArgumentException("maxLoad must be positive for worker " + id);
        }
        currentLoad = Math.max(0d, currentLoad);
        successRate = Math.min(1d, Math.max(0d, successRate));
    }

    /** Convenience factory for an idle worker with a perfect track record. */
    public static WorkerAgent of(String id, double maxLoad, String... capabilities) {
        return new WorkerAgent(id, Set.copyOf(Arrays.asList(capabilities)), WorkerStatus.IDLE, 0d, maxLoad, 1d,
                Instant.now(), null, false);
    }

    public static WorkerAgent of(String id, double maxLoad, Collection<String> capabilities) {
        return new WorkerAgent(id, Set.copyOf(capabilities), WorkerStatus.IDLE, 0d, maxLoad, 1d,
                Instant.now(), null, false);
    }

    public double loadRatio() {
        return currentLoad / maxLoad;
    }

    public boolean hasCapabilities(Set<String> required) {
        return capabilities.containsAll(required);
    }

    public boolean hasSpareCapacity() {
        return currentLoad < maxLoad;
    }

    public boolean isOnline() {
        return status != WorkerStatus.OFFLINE;
    }

    public WorkerAgent withStatus(WorkerStatus next) {
        return new WorkerAgent(id, capabilities, next, currentLoad, maxLoad, successRate, lastHeartbeat, endpoint,
                capabilitiesLocked);
    }

    /** Applies a new load and derives IDLE/BUSY from it, leaving OFFLINE untouched. */
    public WorkerAgent withLoad(double load) {
        double l = Math.max(0d, load);
        WorkerStatus next = status == WorkerStatus.OFFLINE ? WorkerStatus.OFFLINE
                : (l >= maxLoad ? WorkerStatus.BUSY : WorkerStatus.IDLE);
        return new WorkerAgent(id, capabilities, next, l, maxLoad, successRate, lastHeartbeat, endpoint,
                capabilitiesLocked);
    }

    public WorkerAgent withSuccessRate(double rate) {
        return new WorkerAgent(id, capabilities, status, currentLoad, maxLoad, rate, lastHeartbeat, endpoint,
                capabilitiesLocked);
    }

    public WorkerAgent withHeartbeat(Instant at) {
        return new WorkerAgent(id, capabilities, status, currentLoad, maxLoad, successRate, at, endpoint,
                capabilitiesLocked);
    }

    public WorkerAgent withEndpoint(URI uri) {
        return new WorkerAgent(id, capabilities, status, currentLoad, maxLoad, successRate, lastHeartbeat, uri,
                capabilitiesLocked);
    }

    public WorkerAgent withCapabilitiesLocked(boolean locked) {
        return new WorkerAgent(id, capabilities, status, currentLoad, maxLoad, successRate, lastHeartbeat, endpoint,
                locked);
    }
}
