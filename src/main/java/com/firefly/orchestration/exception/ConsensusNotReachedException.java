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


package com.firefly.orchestration.exception;

import java.util.Locale;

/**
 * Candidate results did not agree closely enough. Recorded on the low-confidence solution rather
 * than failing the problem.
 */
public class ConsensusNotReachedException extends OrchestrationException {
    private final double agreementRatio;
    private final double threshold;

    public ConsensusNotReachedException(double agreementRatio, double threshold) {
        super(String.format(Locale.ROOT, "Agreement %.2f below threshold %.2f", agreementRatio, threshold));
        this.agreementRatio = agreementRatio;
        this.threshold = threshold;
    }

    public double agreementRatio() {
        return agreementRatio;
    }

    public double threshold() {
        return threshold;
    }
}
