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

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SagaBuilderTest {

    @Test
    void buildsStepsInDeclarationOrderWithDefaults() {
        SagaDefinition def = SagaBuilder.saga("s")
                .step("a").capability("cap-a").action("do-a").compensate("undo-a").retryable(true).add()
                .step("b").capability("cap-b").action("do-b").add()
                .build();

        assertEquals(List.of("a", "b"), def.steps().stream().map(SagaStep::name).toList());
        SagaStep b = def.step("b");
        assertFalse(b.retryable());
        assertFalse(b.hasCompensation());
        assertEquals(SagaStep.DEFAULT_TIMEOUT, b.timeout());
        assertEquals(Map.of("b", "out"), b.output().apply("out", Map.of()));
        assertEquals(Map.of("k", 1), b.input().apply(Map.of("k", 1)));
        assertNull(def.timeout());
        assertEquals(1, def.indexOf("b"));
    }

    @Test
    void rejectsInvalidDefinitions() {
        assertThrows(IllegalArgumentException.class, () -> SagaBuilder.saga("empty").build());
        assertThrows(IllegalArgumentException.class, () -> SagaBuilder.saga("dup")
                .step("a").capability("c").action("x").add()
                .step("a").capability("c").action("y").add()
                .build());
        assertThrows(NullPointerException.class, () -> SagaBuilder.saga("nocap")
                .step("a").action("x").add());
        SagaDefinition def = SagaBuilder.saga("one").step("a").capability("c").action("x").add().build();
        assertThrows(IllegalArgumentException.class, () -> def.step("missing"));
    }

    @Test
    void orderProcessingTemplateMatchesTheCanonicalFlow() {
        SagaDefinition def = SagaTemplates.orderProcessing();

        assertEquals("order-processing", def.name());
        assertEquals(List.of("validate-order", "reserve-inventory", "process-payment", "create-shipment"),
                def.steps().stream().map(SagaStep::name).toList());
        SagaStep payment = def.step("process-payment");
        assertFalse(payment.retryable());
        assertEquals(Duration.ofSeconds(60), payment.timeout());
        assertEquals("refund-payment", payment.compensationAction());
        assertEquals(Map.of("orderId", "o-1", "totalAmount", 10),
                payment.input().apply(Map.of("orderId", "o-1", "totalAmount", 10, "items", List.of())));
        assertEquals(Duration.ofMinutes(5), def.timeout());
        assertEquals(Map.of("validation", true), def.step("validate-order").output().apply(true, Map.of()));
    }

    @Test
    void otherTemplatesAreWellFormed() {
        assertEquals(4, SagaTemplates.dataProcessing().steps().size());
        assertEquals(Duration.ofHours(1), SagaTemplates.mlModelTraining().step("train-model").timeout());
    }

    @Test
    void retryPolicyBoundsAttemptsAndBacksOffExponentially() {
        RetryPolicy policy = new RetryPolicy(3, Duration.ofSeconds(1), Duration.ofSeconds(3));
        SagaStep retryable = SagaBuilder.saga("p").step("a").capability("c").action("x").retryable(true).add()
                .build().step("a");
        SagaStep once = SagaBuilder.saga("p").step("a").capability("c").action("x").add().build().step("a");

        assertEquals(3, policy.maxAttempts(retryable));
        assertEquals(1, policy.maxAttempts(once));
        assertEquals(Duration.ofSeconds(1), policy.backoff(1));
        assertEquals(Duration.ofSeconds(2), policy.backoff(2));
        assertEquals(Duration.ofSeconds(3), policy.backoff(3), "capped at the maximum delay");
        assertEquals(3, RetryPolicy.DEFAULT.retryableAttempts());
    }
}
