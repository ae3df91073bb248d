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

import com.firefly.orchestration.action.ActionExecutor;
import com.firefly.orchestration.action.HttpActionExecutor;
import com.firefly.orchestration.action.LocalActionExecutor;
import com.firefly.orchestration.consensus.ConsensusValidator;
import com.firefly.orchestration.consensus.DefaultAgreementPolicy;
import com.firefly.orchestration.engine.OrchestrationEngine;
import com.firefly.orchestration.events.EventStream;
import com.firefly.orchestration.health.OrchestrationHealthIndicator;
import com.firefly.orchestration.observability.CompositeOrchestrationEvents;
import com.firefly.orchestration.observability.EventStreamPublisher;
import com.firefly.orchestration.observability.OrchestrationEvents;
import com.firefly.orchestration.observability.OrchestrationLoggerEvents;
import com.firefly.orchestration.observability.OrchestrationMicrometerEvents;
import com.firefly.orchestration.observability.OrchestrationTracingEvents;
import com.firefly.orchestration.saga.SagaCoordinator;
import com.firefly.orchestration.scheduler.CapabilityTable;
import com.firefly.orchestration.scheduler.DecompositionRegistry;
import com.firefly.orchestration.scheduler.DecompositionStrategy;
import com.firefly.orchestration.scheduler.TaskScheduler;
import com.firefly.orchestration.store.InMemoryStateStore;
import com.firefly.orchestration.store.StateStore;
import com.firefly.orchestration.worker.WorkerHeartbeatMonitor;
import com.firefly.orchestration.worker.WorkerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Spring configuration that wires the orchestration engine components.
 * Users typically activate it via {@link com.firefly.orchestration.annotations.EnableOrchestrationEngine}.
 */
@Configuration
@EnableConfigurationProperties(OrchestrationProperties.class)
public class OrchestrationEngineConfiguration {

    private static final Logger log = LoggerFactory.getLogger(OrchestrationEngineConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public StateStore orchestrationStateStore() {
        return new InMemoryStateStore();
    }

    @Bean
    public EventStream orchestrationEventStream(OrchestrationProperties properties) {
        return new EventStream(properties.getEvents().getHistoryLimit());
    }

    @Bean
    public OrchestrationLoggerEvents orchestrationLoggerEvents() {
        return new OrchestrationLoggerEvents();
    }

    @Bean
    public EventStreamPublisher eventStreamPublisher(EventStream eventStream) {
        return new EventStreamPublisher(eventStream);
    }

    @Bean
    @Primary
    public OrchestrationEvents orchestrationEventsComposite(OrchestrationLoggerEvents logger,
                                                            EventStreamPublisher publisher,
                                                            ObjectProvider<OrchestrationMicrometerEvents> micrometer,
                                                            ObjectProvider<OrchestrationTracingEvents> tracing) {
        List<OrchestrationEvents> sinks = new ArrayList<>();
        sinks.add(logger);
        sinks.add(publisher);
        OrchestrationMicrometerEvents m = micrometer.getIfAvailable();
        if (m != null) sinks.add(m);
        OrchestrationTracingEvents t = tracing.getIfAvailable();
        if (t != null) sinks.add(t);
        return new CompositeOrchestrationEvents(sinks);
    }

    @Bean
    public WorkerRegistry workerRegistry(StateStore store, OrchestrationEvents events,
                                         OrchestrationProperties properties) {
        return new WorkerRegistry(store, events, properties.getRegistry().getSmoothingFactor(), Clock.systemUTC());
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    @ConditionalOnProperty(name = "firefly.orchestration.registry.heartbeat-monitor-enabled", havingValue = "true",
            matchIfMissing = true)
    public WorkerHeartbeatMonitor workerHeartbeatMonitor(WorkerRegistry registry, OrchestrationProperties properties) {
        OrchestrationProperties.RegistryProperties p = properties.getRegistry();
        return new WorkerHeartbeatMonitor(registry, p.getHeartbeatInterval(), p.getHeartbeatTimeout());
    }

    @Bean
    @ConditionalOnMissingBean(WebClient.Builder.class)
    public WebClient.Builder webClientBuilder() {
        return WebClient.builder();
    }

    @Bean
    @ConditionalOnMissingBean(ActionExecutor.class)
    public ActionExecutor actionExecutor(OrchestrationProperties properties, WebClient.Builder webClientBuilder) {
        if (properties.getHttp().isEnabled()) {
            log.info("Worker actions are invoked over HTTP");
            return new HttpActionExecutor(webClientBuilder.build());
        }
        log.info("No HTTP worker protocol enabled. Using LocalActionExecutor - register handlers for every action");
        return new LocalActionExecutor();
    }

    @Bean
    public SagaCoordinator sagaCoordinator(WorkerRegistry registry, ActionExecutor executor, StateStore store,
                                           OrchestrationEvents events, OrchestrationProperties properties) {
        return new SagaCoordinator(registry, executor, store, events, properties.getSaga().toSettings());
    }

    @Bean
    public DecompositionRegistry decompositionRegistry(ObjectProvider<DecompositionStrategy> strategies) {
        DecompositionRegistry registry = DecompositionRegistry.withDefaults();
        List<DecompositionStrategy> custom = strategies.orderedStream().collect(Collectors.toList());
        custom.forEach(registry::register);
        if (!custom.isEmpty()) {
            log.info("Registered decomposition strategies: {}", registry.problemTypes());
        }
        return registry;
    }

    @Bean
    @ConditionalOnMissingBean
    public ConsensusValidator consensusValidator(OrchestrationProperties properties) {
        OrchestrationProperties.ConsensusProperties p = properties.getConsensus();
        return new ConsensusValidator(p.getThreshold(), p.getMaxAdditionalRounds(),
                new DefaultAgreementPolicy(p.getNumericTolerance()));
    }

    @Bean
    public TaskScheduler taskScheduler(WorkerRegistry registry, ActionExecutor executor, StateStore store,
                                       OrchestrationEvents events, DecompositionRegistry decompositions,
                                       ConsensusValidator validator, OrchestrationProperties properties) {
        OrchestrationProperties.SchedulerProperties p = properties.getScheduler();
        return new TaskScheduler(registry, executor, store, events, decompositions, validator,
                new CapabilityTable(p.getCapabilities()), p.toSettings());
    }

    @Bean
    public OrchestrationEngine orchestrationEngine(SagaCoordinator coordinator, TaskScheduler scheduler,
                                                   WorkerRegistry registry, EventStream eventStream) {
        return new OrchestrationEngine(coordinator, scheduler, registry, eventStream);
    }

    @Configuration
    @ConditionalOnClass(name = "org.springframework.boot.actuate.health.HealthIndicator")
    static class HealthAutoConfig {
        @Bean
        public OrchestrationHealthIndicator orchestrationHealthIndicator(OrchestrationEngine engine,
                                                                         OrchestrationProperties properties) {
            return new OrchestrationHealthIndicator(engine, properties.getHealth().getStallWindow());
        }
    }

    @Configuration
    @ConditionalOnClass(name = "io.micrometer.core.instrument.MeterRegistry")
    @ConditionalOnBean(type = "io.micrometer.core.instrument.MeterRegistry")
    static class MicrometerAutoConfig {
        @Bean
        public OrchestrationMicrometerEvents orchestrationMicrometerEvents(io.micrometer.core.instrument.MeterRegistry registry) {
            return new OrchestrationMicrometerEvents(registry);
        }
    }

    @Configuration
    @ConditionalOnClass(name = "io.micrometer.tracing.Tracer")
    @ConditionalOnBean(type = "io.micrometer.tracing.Tracer")
    static class TracingAutoConfig {
        @Bean
        public OrchestrationTracingEvents orchestrationTracingEvents(io.micrometer.tracing.Tracer tracer) {
            return new OrchestrationTracingEvents(tracer);
        }
    }
}
