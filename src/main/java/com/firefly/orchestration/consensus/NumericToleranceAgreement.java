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

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Numeric answers: two candidates agree when they differ by at most {@code tolerance} relative to
 * the larger magnitude (absolute below magnitude 1). Every candidate is tried as the anchor of a
 * cluster; the largest cluster wins and its weighted mean is the agreed value.
 */
public class NumericToleranceAgreement implements AgreementPolicy {

    private final double tolerance;

    public NumericToleranceAgreement(double tolerance) {
        if (tolerance < 0d) throw new IllegalArgumentException("tolerance must not be negative");
        this.tolerance = tolerance;
    }

    public double tolerance() {
        return tolerance;
    }

    @Override
    public Agreement evaluate(List<Candidate> candidates) {
        List<Candidate> numeric = candidates.stream().filter(c -> c.value() instanceof Number).toList();
        if (numeric.isEmpty()) return Agreement.none();

        List<Candidate> best = List.of();
        for (Candidate anchor : numeric) {
            double a = ((Number) anchor.value()).doubleValue();
            List<Candidate> cluster = new ArrayList<>();
            for (Candidate other : numeric) {
                if (close(a, ((Number) other.value()).doubleValue())) {
                    cluster.add(other);
                }
            }
            if (cluster.size() > best.size()
                    || (cluster.size() == best.size() && weight(cluster) > weight(best))) {
                best = cluster;
            }
        }
        Set<String> agreeing = new LinkedHashSet<>();
        best.forEach(c -> agreeing.add(c.taskId()));
        return new Agreement((double) best.size() / candidates.size(), weightedMean(best), agreeing);
    }

    boolean close(double a, double b) {
        double scale = Math.max(1d, Math.max(Math.abs(a), Math.abs(b)));
        return Math.abs(a - b) <= tolerance * scale;
    }

    private static double weight(List<Candidate> group) {
        return group.stream().mapToDouble(Candidate::weight).sum();
    }

    private static double weightedMean(List<Candidate> group) {
        double totalWeight = weight(group);
        if (totalWeight <= 0d) {
            return group.stream().mapToDouble(c -> ((Number) c.value()).doubleValue()).average().orElse(0d);
        }
        double sum = 0d;
        for (Candidate c : group) {
            sum += ((Number) c.value()).doubleValue() * c.weight();
        }
        return sum / totalWeight;
    }

    @Override
    public String name() {
        return "numeric-tolerance";
    }
}
