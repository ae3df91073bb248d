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


package com.firefly.orchestration.action;

import com.firefly.orchestration.exception.ActionFailedException;
import com.firefly.orchestration.worker.WorkerAgent;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class LocalActionExecutorTest {

    private final WorkerAgent worker = WorkerAgent.of("w1", 2, "inventory");

    @Test
    void dispatchesToRegisteredHandler() {
        LocalActionExecutor executor = new LocalActionExecutor()
                .register("reserve", (agent, input) -> Mono.just(agent.id() + ":" + input));

        StepVerifier.create(executor.executeAction(worker, "reserve", "sku-1", Duration.ofSeconds(1)))
                .expectNext("w1:sku-1")
                .verifyComplete();
        assertEquals(Set.of("reserve"), executor.actions());
    }

    @Test
    void unknownActionFails() {
        LocalActionExecutor executor = new LocalActionExecutor();

        StepVerifier.create(executor.executeAction(worker, "missing", null, Duration.ofSeconds(1), "run-1"))
                .expectErrorSatisfies(err -> {
                    ActionFailedException afe = assertInstanceOf(ActionFailedException.class, err);
                    assertEquals("missing", afe.action());
                    assertTrue(afe.getMessage().contains("No handler registered"));
                })
                .verify();
    }

    @Test
    void handlerRunsOnSubscription() {
        AtomicInteger calls = new AtomicInteger();
        LocalActionExecutor executor = new LocalActionExecutor()
                .register("count", (agent, input) -> Mono.fromSupplier(calls::incrementAndGet));

        Mono<Object> call = executor.executeAction(worker, "count", null, Duration.ofSeconds(1));
        assertEquals(0, calls.get());
        StepVerifier.create(call).expectNext(1).verifyComplete();
        StepVerifier.create(call).expectNext(2).verifyComplete();
    }

    @Test
    void registrationRejectsNulls() {
        LocalActionExecutor executor = new LocalActionExecutor();
        assertThrows(NullPointerException.class, () -> executor.register(null, (a, i) -> Mono.empty()));
        assertThrows(NullPointerException.class, () -> executor.register("x", null));
    }
}
