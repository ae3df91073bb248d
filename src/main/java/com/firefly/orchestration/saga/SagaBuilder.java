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


package com.firefly.orchestration.saga;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Fluent builder for {@link SagaDefinition}s.
 * <pre>
 * SagaBuilder.saga("order")
 *     .step("reserve").capability("inventory").action("reserve").compensate("release").retryable(true).add()
 *     .step("charge").capability("payment").action("charge").compensate("refund").add()
 *     .build();
 * </pre>
 */
public class SagaBuilder {
    private final String name;
    private final List<SagaStep> steps = new ArrayList<>();
    private Duration timeout;
    private Consumer<SagaResult> onSuccess;
    private Consumer<SagaResult> onFailure;

    private SagaBuilder(String name) {
        this.name = name;
    }

    public static SagaBuilder saga(String name) {
        return new SagaBuilder(name);
    }

    public Step step(String stepName) {
        return new Step(stepName);
    }

    public SagaBuilder timeout(Duration timeout) {
        this.timeout = timeout;
        return this;
    }

    public SagaBuilder onSuccess(Consumer<SagaResult> callback) {
        this.onSuccess = callback;
        return this;
    }

    public SagaBuilder onFailure(Consumer<SagaResult> callback) {
        this.onFailure = callback;
        return this;
    }

    public SagaDefinition build() {
        return new SagaDefinition(name, steps, timeout, onSuccess, onFailure);
    }

    public class Step {
        private final String stepName;
        private String capability;
        private String action;
        private String compensationAction;
        private boolean retryable;
        private Duration timeout;
        private Function<Map<String, Object>, Object> input;
        private BiFunction<Object, Map<String, Object>, Map<String, Object>> output;

        private Step(String stepName) {
            this.stepName = stepName;
        }

        public Step capability(String capability) { this.capability = capability; return this; }
        public Step action(String action) { this.action = action; return this; }
        public Step compensate(String compensationAction) { this.compensationAction = compensationAction; return this; }
        public Step retryable(boolean retryable) { this.retryable = retryable; return this; }
        public Step timeout(Duration timeout) { this.timeout = timeout; return this; }
        public Step input(Function<Map<String, Object>, Object> input) { this.input = input; return this; }
        public Step output(BiFunction<Object, Map<String, Object>, Map<String, Object>> output) { this.output = output; return this; }

        /** Stores the action result under {@code key} instead of the step name. */
        public Step outputAs(String key) {
            this.output = (result, data) -> Collections.singletonMap(key, result);
            return this;
        }

        public SagaBuilder add() {
            steps.add(new SagaStep(stepName, capability, action, compensationAction, retryable, timeout, input, output));
            return SagaBuilder.this;
        }
    }
}
