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


package com.firefly.orchestration.config;

import com.firefly.orchestration.saga.RetryPolicy;
import com.firefly.orchestration.saga.SagaSettings;
import com.firefly.orchestration.scheduler.SchedulerSettings;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Configuration properties of the orchestration engine.
 *
 * Example configuration:
 * <pre>
 * firefly.orchestration.saga.retryable-attempts=3
 * firefly.orchestration.saga.base-backoff=1s
 * firefly.orchestration.scheduler.max-attempts=3
 * firefly.orchestration.scheduler.capabilities.optimize=solver,gpu
 * firefly.orchestration.consensus.threshold=0.8
 * firefly.orchestration.registry.heartbeat-timeout=30s
 * firefly.orchestration.http.enabled=true
 * </pre>
 */
@ConfigurationProperties(prefix = "firefly.orchestration")
public class OrchestrationProperties {

    @NestedConfigurationProperty
    private SagaProperties saga = new SagaProperties();

    @NestedConfigurationProperty
    private SchedulerProperties scheduler = new SchedulerProperties();

    @NestedConfigurationProperty
    private ConsensusProperties consensus = new ConsensusProperties();

    @NestedConfigurationProperty
    private RegistryProperties registry = new RegistryProperties();

    @NestedConfigurationProperty
    private EventsProperties events = new EventsProperties();

    @NestedConfigurationProperty
    private HealthProperties health = new HealthProperties();

    @NestedConfigurationProperty
    private HttpProperties http = new HttpProperties();

    public SagaProperties getSaga() {
        return saga;
    }

    public void setSaga(SagaProperties saga) {
        this.saga = saga;
    }

    public SchedulerProperties getScheduler() {
        return scheduler;
    }

    public void setScheduler(SchedulerProperties scheduler) {
        this.scheduler = scheduler;
    }

    public ConsensusProperties getConsensus() {
        return consensus;
    }

    public void setConsensus(ConsensusProperties consensus) {
        this.consensus = consensus;
    }

    public RegistryProperties getRegistry() {
        return registry;
    }

    public void setRegistry(RegistryProperties registry) {
        this.registry = registry;
    }

    public EventsProperties getEvents() {
        return events;
    }

    public void setEvents(EventsProperties events) {
        this.events = events;
    }

    public HealthProperties getHealth() {
        return health;
    }

    public void setHealth(HealthProperties health) {
        this.health = health;
    }

    public HttpProperties getHttp() {
        return http;
    }

    public void setHttp(HttpProperties http) {
        this.http = http;
    }

    /**
     * Saga coordinator properties.
     */
    @Data
    public static class SagaProperties {
        /** Attempts of a retryable step; non-retryable steps run once. */
        private int retryableAttempts = 3;
        private Duration baseBackoff = Duration.ofSeconds(1);
        private Duration maxBackoff = Duration.ofSeconds(30);
        /** Registry polls for a free worker before a step fails with no worker available. */
        private int resolveAttempts = 10;
        private Duration pollDelay = Duration.ofMillis(500);
        private double pollJitter = 0.25;
        private int retainedResults = 1000;

        public SagaSettings toSettings() {
            return new SagaSettings(new RetryPolicy(retryableAttempts, baseBackoff, maxBackoff), resolveAttempts,
                    pollDelay, pollJitter, retainedResults);
        }
    }

    /**
     * Task scheduler properties.
     */
    @Data
    public static class SchedulerProperties {
        private int maxAttempts = 3;
        /** Timeout of a task with estimated cost 1; scaled by cost. */
        private Duration baseTaskTimeout = Duration.ofSeconds(30);
        private Duration pollDelay = Duration.ofMillis(500);
        private double pollJitter = 0.25;
        /** Fail a task at once when no online worker has its capabilities. */
        private boolean failWithoutCapableWorker = true;
        private int retainedProblems = 1000;
        /** Sub-task kind to required capabilities; unmapped kinds require a capability named after the kind. */
        private Map<String, Set<String>> capabilities = new LinkedHashMap<>();

        public SchedulerSettings toSettings() {
            return new SchedulerSettings(maxAttempts, baseTaskTimeout, pollDelay, pollJitter,
                    failWithoutCapableWorker, retainedProblems);
        }
    }

    /**
     * Consensus validator properties.
     */
    @Data
    public static class ConsensusProperties {
        private double threshold = 0.8;
        private int maxAdditionalRounds = 1;
        /** Relative tolerance under which two numeric candidates agree. */
        private double numericTolerance = 0.01;
    }

    /**
     * Worker registry properties.
     */
    @Data
    public static class RegistryProperties {
        private double smoothingFactor = 0.05;
        private boolean heartbeatMonitorEnabled = true;
        private Duration heartbeatInterval = Duration.ofSeconds(10);
        private Duration heartbeatTimeout = Duration.ofSeconds(30);
    }

    /**
     * Event stream properties.
     */
    @Data
    public static class EventsProperties {
        /** Events kept per saga run, problem or worker for status reports. */
        private int historyLimit = 200;
    }

    /**
     * Health indicator properties.
     */
    @Data
    public static class HealthProperties {
        private Duration stallWindow = Duration.ofMinutes(5);
    }

    /**
     * Worker protocol properties.
     */
    @Data
    public static class HttpProperties {
        /** Call workers over HTTP at their endpoint instead of in-process handlers. */
        private boolean enabled = false;
    }
}
