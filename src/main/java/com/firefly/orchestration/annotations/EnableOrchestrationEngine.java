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


package com.firefly.orchestration.annotations;

import com.firefly.orchestration.config.OrchestrationEngineConfiguration;
import org.springframework.context.annotation.Import;

import java.lang.annotation.*;

/**
 * Enables the orchestration engine components in a Spring application.
 * <p>
 * Imports {@link OrchestrationEngineConfiguration} that wires:
 * - {@code WorkerRegistry} and its {@code WorkerHeartbeatMonitor}
 * - {@code SagaCoordinator} and {@code TaskScheduler} sharing the registry
 * - {@code OrchestrationEngine}: the submission and status facade
 * - {@code OrchestrationEvents}: logger and event stream sinks, plus Micrometer metrics and tracing when present
 * - {@code OrchestrationHealthIndicator} when Actuator is on the classpath
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Inherited
@Import(OrchestrationEngineConfiguration.class)
public @interface EnableOrchestrationEngine {
}
