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

import com.firefly.orchestration.problem.Complexity;
import com.firefly.orchestration.problem.Problem;
import com.firefly.orchestration.problem.ProblemMetadata;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConsensusValidatorTest {

    private static final Problem PROBLEM = Problem.of("optimization", null, Complexity.MEDIUM);

    private static List<Candidate> candidates(Object... values) {
        Candidate[] out = new Candidate[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = new Candidate("t" + i, "w" + i, values[i], 1d);
        }
        return List.of(out);
    }

    @Test
    void agreementAtThresholdIsAchieved() {
        ConsensusValidator validator = new ConsensusValidator();
        ConsensusVerdict verdict = validator.validate(PROBLEM, candidates(10.0, 10.05, 9.98, 10.02, 50.0), null, 1);

        assertTrue(verdict.consensus().achieved());
        assertEquals(0.8, verdict.consensus().agreementRatio(), 1e-9);
        assertFalse(verdict.recompute());
        assertEquals(10.0125, (Double) verdict.result(), 1e-9);
        assertEquals(0.8, verdict.confidence(), 1e-9);
        assertEquals("default", verdict.consensus().policy());
        assertEquals(5, verdict.consensus().votes().size());
        assertFalse(verdict.consensus().votes().get(4).agreed());
    }

    @Test
    void belowThresholdRequestsAnotherRoundWhileRoundsRemain() {
        ConsensusValidator validator = new ConsensusValidator(0.8, 1, new DefaultAgreementPolicy(0.01));
        List<Candidate> split = candidates("A", "A", "B", "C");

        ConsensusVerdict first = validator.validate(PROBLEM, split, null, 1);
        assertTrue(first.recompute());
        assertFalse(first.consensus().achieved());

        ConsensusVerdict last = validator.validate(PROBLEM, split, null, 2);
        assertFalse(last.recompute());
        assertFalse(last.consensus().achieved());
        assertEquals("A", last.result());
        assertEquals(0.5, last.consensus().agreementRatio(), 1e-9);
        assertEquals("Agreement 0.50 below threshold 0.80", last.consensus().failureReason());

        ConsensusVerdict forced = validator.validate(PROBLEM, split, null, 1, false);
        assertFalse(forced.recompute());
    }

    @Test
    void withoutAgreementTheMostTrustedCandidateWins() {
        ConsensusValidator validator = new ConsensusValidator(0.8, 0, new DefaultAgreementPolicy(0.01));
        ConsensusVerdict verdict = validator.validate(PROBLEM, List.of(
                new Candidate("t0", "w0", "x", 0.3),
                new Candidate("t1", "w1", "x", 0.3),
                new Candidate("t2", "w2", "y", 0.95),
                new Candidate("t3", "w3", "z", 0.2)), null, 1);

        assertFalse(verdict.consensus().achieved());
        assertEquals(0.5, verdict.consensus().agreementRatio(), 1e-9);
        assertEquals("y", verdict.result());
        assertEquals(0.95 * 0.25, verdict.confidence(), 1e-9);
        assertNotNull(verdict.consensus().failureReason());
    }

    @Test
    void achievedConsensusCarriesNoFailureReason() {
        ConsensusVerdict verdict = new ConsensusValidator().validate(PROBLEM, candidates("A", "A", "A", "A", "B"), null, 1);

        assertTrue(verdict.consensus().achieved());
        assertNull(verdict.consensus().failureReason());
    }

    @Test
    void noCandidatesFallsBackToSinkResultWithFullAgreement() {
        ConsensusVerdict verdict = new ConsensusValidator().validate(PROBLEM, List.of(), "merged", 1);

        assertTrue(verdict.consensus().achieved());
        assertEquals(1d, verdict.consensus().agreementRatio());
        assertEquals("merged", verdict.result());
        assertEquals(1d, verdict.confidence());
    }

    @Test
    void constraintViolationsCountAsDisagreement() {
        ConsensusValidator validator = new ConsensusValidator()
                .registerConstraint("optimization", (problem, value) -> ((Number) value).doubleValue() >= 0);
        ConsensusVerdict verdict = validator.validate(PROBLEM, candidates(-1.0, -1.0, -1.0, 3.0), null, 1);

        assertEquals(0.25, verdict.consensus().agreementRatio(), 1e-9);
        assertFalse(verdict.consensus().achieved());
        assertEquals(3.0, (Double) verdict.result(), 1e-9);
        assertFalse(verdict.consensus().votes().get(0).valid());
    }

    @Test
    void accuracyTargetRaisesTheThreshold() {
        Problem strict = Problem.of("optimization", null, Complexity.LOW, new ProblemMetadata(1, null, 0.95));
        ConsensusValidator validator = new ConsensusValidator();
        assertEquals(0.95, validator.requiredRatio(strict), 1e-9);
        assertEquals(0.8, validator.requiredRatio(PROBLEM), 1e-9);

        ConsensusVerdict verdict = validator.validate(strict, candidates(1, 1, 1, 1, 1, 1, 1, 1, 1, 2), null, 1);
        assertFalse(verdict.consensus().achieved());
        assertEquals(0.9, verdict.consensus().agreementRatio(), 1e-9);
    }

    @Test
    void perTypePolicyOverridesTheDefault() {
        ConsensusValidator validator = new ConsensusValidator()
                .registerPolicy("optimization", new MajorityVoteAgreement());
        ConsensusVerdict verdict = validator.validate(PROBLEM, candidates(1.0, 1.001, 1.002, 1.003), null, 1);

        assertEquals("majority-vote", verdict.consensus().policy());
        assertEquals(0.25, verdict.consensus().agreementRatio(), 1e-9);
    }

    @Test
    void numericToleranceIsRelativeAboveMagnitudeOne() {
        NumericToleranceAgreement numeric = new NumericToleranceAgreement(0.01);
        assertTrue(numeric.close(1000, 1009));
        assertFalse(numeric.close(1000, 1011));
        assertTrue(numeric.close(0.001, 0.009));
        assertThrows(IllegalArgumentException.class, () -> new NumericToleranceAgreement(-1));
    }

    @Test
    void majorityTieGoesToTheHeavierGroup() {
        Agreement agreement = new MajorityVoteAgreement().evaluate(List.of(
                new Candidate("t1", "w1", "x", 0.2),
                new Candidate("t2", "w2", "y", 0.9)));
        assertEquals("y", agreement.value());
        assertEquals(0.5, agreement.ratio(), 1e-9);
    }
}
