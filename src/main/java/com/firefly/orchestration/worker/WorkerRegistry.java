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

import com.firefly.orchestration.exception.DuplicateIdentityException;
import com.firefly.orchestration.exception.IllegalStateTransitionException;
import com.firefly.orchestration.observability.OrchestrationEvents;
import com.firefly.orchestration.store.StateStore;
import com.firefly.orchestration.store.Versioned;
import com.firefly.orchestration.util.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.UnaryOperator;

/**
 * Owns every {@link WorkerAgent}. Workers live under {@code worker/{id}} in the {@link StateStore}
 * and are only ever replaced through compare-and-set, so concurrent schedulers and coordinators can
 * update the same worker without a process lock.
 * <p>
 * Matching: a worker qualifies when its capabilities are a superset of the requirement, it is not
 * offline and its load is below its maximum. Candidates are ordered by ascending load ratio, then
 * descending success rate, then id (for determinism).
 */
public class WorkerRegistry {

    private static final Logger log = LoggerFactory.getLogger(WorkerRegistry.class);

    static final String KEY_PREFIX = "worker/";
    public static final double DEFAULT_SMOOTHING_FACTOR = 0.05;

    private static final Comparator<WorkerAgent> MATCH_ORDER = Comparator
            .comparingDouble(WorkerAgent::loadRatio)
            .thenComparing(Comparator.comparingDouble(WorkerAgent::successRate).reversed())
            .thenComparing(WorkerAgent::id);

    private final StateStore store;
    private final OrchestrationEvents events;
    private final double smoothingFactor;
    private final Clock clock;
    private final List<WorkerLossListener> lossListeners = new CopyOnWriteArrayList<>();

    public WorkerRegistry(StateStore store, OrchestrationEvents events) {
        this(store, events, DEFAULT_SMOOTHING_FACTOR, Clock.systemUTC());
    }

    public WorkerRegistry(StateStore store, OrchestrationEvents events, double smoothingFactor, Clock clock) {
        if (smoothingFactor <= 0 || smoothingFactor > 1) {
            throw new IllegalArgumentException("smoothingFactor must be in (0, 1]: " + smoothingFactor);
        }
        this.store = Objects.requireNonNull(store, "store");
        this.events = Objects.requireNonNull(events, "events");
        this.smoothingFactor = smoothingFactor;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Adds or overwrites a worker. Overwriting is how a restarted worker re-registers; it is only
     * refused when the existing entry locked its capabilities and the new ones differ.
     */
    public WorkerAgent register(WorkerAgent agent) {
        Objects.requireNonNull(agent, "agent");
        String key = key(agent.id());
        WorkerAgent stored = agent.withHeartbeat(clock.instant());
        while (true) {
            Optional<Versioned<WorkerAgent>> current = store.get(key, WorkerAgent.class);
            long version = StateStore.ABSENT;
            if (current.isPresent()) {
                WorkerAgent existing = current.get().value();
                if (existing.capabilitiesLocked() && !existing.capabilities().equals(agent.capabilities())) {
                    throw new DuplicateIdentityException(agent.id());
                }
                version = current.get().version();
            }
            if (store.compareAndSet(key, stored, version)) {
                break;
            }
        }
        events.onWorkerRegistered(stored.id(), stored.capabilities());
        return stored;
    }

    /**
     * Removes a worker. Work assigned to it is reassigned as for a lost worker.
     *
     * @return true when the worker was known
     */
    public boolean deregister(String workerId) {
        Optional<WorkerAgent> previous = get(workerId);
        if (previous.isEmpty() || !store.delete(key(workerId))) {
            return false;
        }
        if (previous.get().isOnline()) {
            notifyLost(workerId);
        }
        return true;
    }

    public Optional<WorkerAgent> get(String workerId) {
        return store.get(key(workerId), WorkerAgent.class).map(Versioned::value);
    }

    /** All known workers ordered by id. */
    public List<WorkerAgent> all() {
        List<WorkerAgent> out = new ArrayList<>();
        for (String k : store.keys(KEY_PREFIX)) {
            store.get(k, WorkerAgent.class).ifPresent(v -> out.add(v.value()));
        }
        out.sort(Comparator.comparing(WorkerAgent::id));
        return out;
    }

    /**
     * Best available worker for the capabilities, or empty when none qualifies right now. Empty is
     * the backpressure signal: callers re-poll later.
     */
    public Optional<WorkerAgent> findMatch(Set<String> requiredCapabilities) {
        return all().stream()
                .filter(WorkerAgent::isOnline)
                .filter(WorkerAgent::hasSpareCapacity)
                .filter(w -> w.hasCapabilities(requiredCapabilities))
                .min(MATCH_ORDER);
    }

    /** Whether any online worker could ever run work with these capabilities, regardless of load. */
    public boolean hasCapableWorker(Set<String> requiredCapabilities) {
        return all().stream().anyMatch(w -> w.isOnline() && w.hasCapabilities(requiredCapabilities));
    }

    /**
     * Charges a dispatch of {@code cost} to the worker.
     *
     * @return false when the worker is unknown, offline or already saturated (another dispatcher won
     * the race), in which case nothing changed
     */
    public boolean reserve(String workerId, double cost) {
        return update(workerId, w -> w.isOnline() && w.hasSpareCapacity() ? w.withLoad(w.currentLoad() + cost) : null)
                .isPresent();
    }

    /** Returns load for work that was cancelled or never ran; the success rate is left alone. */
    public void release(String workerId, double cost) {
        update(workerId, w -> w.withLoad(w.currentLoad() - cost));
    }

    /**
     * Records the outcome of one attempt: the load drops by {@code costDelta} and the success rate
     * moves towards 1 or 0 by the smoothing factor.
     */
    public Optional<WorkerAgent> recordOutcome(String workerId, boolean success, double costDelta) {
        return update(workerId, w -> {
            double rate = w.successRate() * (1 - smoothingFactor) + (success ? smoothingFactor : 0d);
            return w.withLoad(w.currentLoad() - costDelta).withSuccessRate(rate);
        });
    }

    /**
     * Moves a worker to {@code status}. Going {@link WorkerStatus#OFFLINE} emits {@code worker:lost}
     * and notifies every {@link WorkerLossListener} so assigned work gets reassigned.
     *
     * @throws IllegalStateTransitionException when the transition table forbids the move
     */
    public Optional<WorkerAgent> markStatus(String workerId, WorkerStatus status) {
        Objects.requireNonNull(status, "status");
        WorkerStatus[] before = new WorkerStatus[1];
        Optional<WorkerAgent> updated = update(workerId, w -> {
            if (!w.status().canTransitionTo(status)) {
                throw new IllegalStateTransitionException("worker " + workerId, w.status(), status);
            }
            before[0] = w.status();
            return w.withStatus(status);
        });
        if (updated.isPresent() && status == WorkerStatus.OFFLINE && before[0] != WorkerStatus.OFFLINE) {
            notifyLost(workerId);
        }
        return updated;
    }

    /**
     * Refreshes the heartbeat. An offline worker that reports in again comes back online.
     */
    public boolean heartbeat(String workerId) {
        Instant now = clock.instant();
        return update(workerId, w -> {
            WorkerAgent refreshed = w.withHeartbeat(now);
            return w.isOnline() ? refreshed : refreshed.withStatus(WorkerStatus.IDLE).withLoad(w.currentLoad());
        }).isPresent();
    }

    /**
     * Marks offline every online worker whose last heartbeat is older than {@code timeout}.
     *
     * @return ids of the workers that were expired
     */
    public List<String> expireStaleWorkers(Duration timeout) {
        Instant cutoff = clock.instant().minus(timeout);
        List<String> expired = new ArrayList<>();
        for (WorkerAgent w : all()) {
            if (w.isOnline() && w.lastHeartbeat() != null && w.lastHeartbeat().isBefore(cutoff)) {
                log.warn(JsonUtils.json(
                        "worker_event", "heartbeat_expired",
                        "workerId", w.id(),
                        "lastHeartbeat", w.lastHeartbeat().toString()
                ));
                markStatus(w.id(), WorkerStatus.OFFLINE);
                expired.add(w.id());
            }
        }
        return expired;
    }

    public void addLossListener(WorkerLossListener listener) {
        lossListeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeLossListener(WorkerLossListener listener) {
        lossListeners.remove(listener);
    }

    /**
     * Compare-and-set loop. The mutation may return null to abort without writing.
     */
    private Optional<WorkerAgent> update(String workerId, UnaryOperator<WorkerAgent> mutation) {
        String key = key(workerId);
        while (true) {
            Optional<Versioned<WorkerAgent>> current = store.get(key, WorkerAgent.class);
            if (current.isEmpty()) {
                return Optional.empty();
            }
            WorkerAgent next = mutation.apply(current.get().value());
            if (next == null) {
                return Optional.empty();
            }
            if (store.compareAndSet(key, next, current.get().version())) {
                return Optional.of(next);
            }
        }
    }

    private void notifyLost(String workerId) {
        events.onWorkerLost(workerId);
        for (WorkerLossListener listener : lossListeners) {
            try {
                listener.onWorkerLost(workerId);
            } catch (RuntimeException e) {
                log.warn("Worker loss listener {} failed for worker {}: {}",
                        listener.getClass().getSimpleName(), workerId, e.getMessage(), e);
            }
        }
    }

    private static String key(String workerId) {
        return KEY_PREFIX + workerId;
    }
}
