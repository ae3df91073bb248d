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

import java.util.List;

/**
 * Uses {@link NumericToleranceAgreement} when every candidate is a number and
 * {@link MajorityVoteAgreement} otherwise.
 */
public class DefaultAgreementPolicy implements AgreementPolicy {

    private final NumericToleranceAgreement numeric;
    private final MajorityVoteAgreement majority = new MajorityVoteAgreement();

    public DefaultAgreementPolicy(double numericTolerance) {
        this.numeric = new NumericToleranceAgreement(numericTolerance);
    }

    @Override
    public Agreement evaluate(List<Candidate> candidates) {
        boolean allNumeric = !candidates.isEmpty() && candidates.stream().allMatch(c -> c.value() instanceof Number);
        return allNumeric ? numeric.evaluate(candidates) : majority.evaluate(candidates);
    }

    @Override
    public String name() {
        return "default";
    }
}
