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


package com.firefly.orchestration.consensus;

import java.util.Set;

/**
 * Outcome of an {@link AgreementPolicy}.
 *
 * @param ratio     fraction of candidates that agree with {@code value}
 * @param value     the answer the largest agreeing group converged on
 * @param agreeing  task ids of the candidates in that group
 */
public record Agreement(double ratio, Object value, Set<String> agreeing) {

    public static Agreement none() {
        return new Agreement(0d, null, Set.of());
    }
}
