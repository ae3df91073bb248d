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
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Discrete answers: candidates agree when their values are equal. Ties between equally large
 * groups go to the group with the higher summed weight.
 */
public class MajorityVoteAgreement implements AgreementPolicy {

    @Override
    public Agreement evaluate(List<Candidate> candidates) {
        if (candidates.isEmpty()) return Agreement.none();
        Map<Object, List<Candidate>> groups = new LinkedHashMap<>();
        for (Candidate c : candidates) {
            Object key = groups.keySet().stream()
                    .filter(k -> Objects.equals(k, c.value()))
                    .findFirst()
                    .orElse(c.value());
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(c);
        }
        List<Candidate> best = null;
        Object bestValue = null;
        for (Map.Entry<Object, List<Candidate>> e : groups.entrySet()) {
            if (best == null || e.getValue().size() > best.size()
                    || (e.getValue().size() == best.size() && weight(e.getValue()) > weight(best))) {
                best = e.getValue();
                bestValue = e.getKey();
            }
        }
        Set<String> agreeing = new LinkedHashSet<>();
        best.forEach(c -> agreeing.add(c.taskId()));
        return new Agreement((double) best.size() / candidates.size(), bestValue, agreeing);
    }

    private static double weight(List<Candidate> group) {
        return group.stream().mapToDouble(Candidate::weight).sum();
    }

    @Override
    public String name() {
        return "majority-vote";
    }
}
