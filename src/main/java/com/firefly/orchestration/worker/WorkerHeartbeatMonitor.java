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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.List;

/**
 * Periodically expires workers whose heartbeat is older than the configured timeout.
 */
public class WorkerHeartbeatMonitor {

    private static final Logger log = LoggerFactory.getLogger(WorkerHeartbeatMonitor.class);

    private final WorkerRegistry registry;
    private final Duration interval;
    private final Duration timeout;
    private final Scheduler scheduler;
    private volatile Disposable sweep;

    public WorkerHeartbeatMonitor(WorkerRegistry registry, Duration interval, Duration timeout) {
        this(registry, interval, timeout, Schedulers.parallel());
    }

    public WorkerHeartbeatMonitor(WorkerRegistry registry, Duration interval, Duration timeout, Scheduler scheduler) {
        this.registry = registry;
        this.interval = interval;
        this.timeout = timeout;
        this.scheduler = scheduler;
    }

    public synchronized void start() {
        if (isRunning()) return;
        sweep = Flux.interval(interval, interval, scheduler)
                .concatMap(tick -> Mono.fromCallable(this::sweepOnce)
                        .onErrorResume(err -> {
                            log.warn("Heartbeat sweep failed: {}", err.getMessage(), err);
                            return Mono.just(List.of());
                        }))
                .subscribe();
    }

    public synchronized void stop() {
        if (sweep != null) {
            sweep.dispose();
            sweep = null;
        }
    }

    public boolean isRunning() {
        Disposable d = sweep;
        return d != null && !d.isDisposed();
    }

    /** Runs one sweep immediately. */
    public List<String> sweepOnce() {
        List<String> expired = registry.expireStaleWorkers(timeout);
        if (!expired.isEmpty()) {
            log.info("Expired {} worker(s) with stale heartbeats: {}", expired.size(), expired);
        }
        return expired;
    }
}
