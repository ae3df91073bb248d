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
 * @param achieved       agreement reached the threshold
 * @param agreementRatio fraction of candidates in the winning group
 * @param threshold      ratio that was required
 * @param rounds         validation rounds run, the first one included
 * @param policy         name of the agreement policy used
 * @param votes          every candidate and whether it agreed
 * @param failureReason  why agreement was not reached, null when it was
 */
public record ConsensusRecord(
        boolean achieved,
        double agreementRatio,
        double threshold,
        int rounds,
        String policy,
        List<Vote> votes,
        String failureReason
) {
    public ConsensusRecord {
        votes = votes == null ? List.of() : List.copyOf(votes);
    }

    public ConsensusRecord(boolean achieved, double agreementRatio, double threshold, int rounds, String policy,
                           List<Vote> votes) {
        this(achieved, agreementRatio, threshold, rounds, policy, votes, null);
    }
}
