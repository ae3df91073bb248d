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
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Ready-made saga definitions for common multi-worker workflows. Capabilities name the kind of
 * worker that runs each step.
 */
public final class SagaTemplates {

    private SagaTemplates() {
    }

    /**
     * validate -> reserve inventory -> charge payment (never retried) -> create shipment.
     */
    public static SagaDefinition orderProcessing() {
        return SagaBuilder.saga("order-processing")
                .step("validate-order").capability("validation").action("validate-order")
                    .compensate("mark-order-invalid").retryable(true)
                    .input(data -> pick(data, "orderId"))
                    .outputAs("validation").add()
                .step("reserve-inventory").capability("inventory").action("reserve-items")
                    .compensate("release-items").retryable(true)
                    .input(data -> pick(data, "items", "orderId")).add()
                .step("process-payment").capability("payment").action("charge-payment")
                    .compensate("refund-payment").retryable(false).timeout(Duration.ofSeconds(60))
                    .input(data -> pick(data, "totalAmount", "paymentMethod", "orderId")).add()
                .step("create-shipment").capability("shipping").action("create-shipment")
                    .compensate("cancel-shipment").retryable(true)
                    .input(data -> pick(data, "orderId", "shippingAddress", "items")).add()
                .timeout(Duration.ofMinutes(5))
                .build();
    }

    public static SagaDefinition dataProcessing() {
        return SagaBuilder.saga("data-processing-pipeline")
                .step("fetch-data").capability("data-fetcher").action("fetch-from-source")
                    .compensate("cleanup-temp-data").retryable(true).add()
                .step("validate-data").capability("validator").action("validate-schema")
                    .compensate("log-validation-failure").add()
                .step("transform-data").capability("transformer").action("apply-transformations")
                    .compensate("rollback-transformations").retryable(true).add()
                .step("store-data").capability("storage").action("persist-to-database")
                    .compensate("delete-stored-data").retryable(true).add()
                .build();
    }

    public static SagaDefinition mlModelTraining() {
        return SagaBuilder.saga("ml-model-training")
                .step("prepare-dataset").capability("data-prep").action("prepare-training-data")
                    .compensate("cleanup-prepared-data").retryable(true).timeout(Duration.ofMinutes(10)).add()
                .step("train-model").capability("training").action("train-ml-model")
                    .compensate("delete-model-artifacts").timeout(Duration.ofHours(1)).add()
                .step("evaluate-model").capability("evaluation").action("evaluate-performance")
                    .compensate("log-evaluation-failure").retryable(true).add()
                .step("deploy-model").capability("deployment").action("deploy-to-production")
                    .compensate("rollback-deployment").add()
                .build();
    }

    private static Map<String, Object> pick(Map<String, Object> data, String... keys) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (String k : keys) {
            if (data.containsKey(k)) {
                out.put(k, data.get(k));
            }
        }
        return out;
    }
}
