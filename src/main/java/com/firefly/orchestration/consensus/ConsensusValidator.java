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

import com.firefly.orchestration.exception.ConsensusNotReachedException;
import com.firefly.orchestration.problem.Problem;
import com.firefly.orchestration.util.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Reconciles the results of a problem's sub-tasks into a single answer.
 * <p>
 * Candidates (outputs of redundant solvers) are checked against the constraints registered for the
 * problem type, then grouped by the type's {@link AgreementPolicy}. When the winning group covers at
 * least the threshold (default 0.8, raised by the problem's accuracy target) consensus is achieved.
 * Otherwise the validator asks for another solver round while rounds remain, and finally settles for
 * the best supported candidate with {@code achieved = false}.
 */
public class ConsensusValidator {

    private static final Logger log = LoggerFactory.getLogger(ConsensusValidator.class);

    public static final double DEFAULT_THRESHOLD = 0.8d;

    private final double threshold;
    private final int maxAdditionalRounds;
    private final AgreementPolicy defaultPolicy;
    private final Map<String, AgreementPolicy> policies = new ConcurrentHashMap<>();
    private final Map<String, List<ProblemConstraint>> constraints = new ConcurrentHashMap<>();

    public ConsensusValidator() {
        this(DEFAULT_THRESHOLD, 0, new DefaultAgreementPolicy(0.01d));
    }

    public ConsensusValidator(double threshold, int maxAdditionalRounds, AgreementPolicy defaultPolicy) {
        if (threshold < 0d || threshold > 1d) {
            throw new IllegalArgumentException("threshold must be within [0, 1]");
        }
        this.threshold = threshold;
        this.maxAdditionalRounds = Math.max(0, maxAdditionalRounds);
        this.defaultPolicy = Objects.requireNonNull(defaultPolicy, "defaultPolicy");
    }

    public ConsensusValidator registerPolicy(String problemType, AgreementPolicy policy) {
        policies.put(problemType, policy);
        return this;
    }

    public ConsensusValidator registerConstraint(String problemType, ProblemConstraint constraint) {
        constraints.computeIfAbsent(problemType, k -> new CopyOnWriteArrayList<>()).add(constraint);
        return this;
    }

    public double threshold() {
        return threshold;
    }

    public int maxAdditionalRounds() {
        return maxAdditionalRounds;
    }

    /**
     * Ratio a problem must reach: the configured threshold or the problem's accuracy target,
     * whichever is higher.
     */
    public double requiredRatio(Problem problem) {
        Double target = problem.metadata().accuracyTarget();
        return target != null ? Math.max(threshold, target) : threshold;
    }

    /**
     * @param problem        the problem being validated
     * @param candidates     redundant solver outputs, possibly empty
     * @param fallbackResult result used when the decomposition produced no candidates
     * @param round          1-based index of this validation round
     */
    public ConsensusVerdict validate(Problem problem, List<Candidate> candidates, Object fallbackResult, int round) {
        return validate(problem, candidates, fallbackResult, round, true);
    }

    /**
     * As {@link #validate(Problem, List, Object, int)}; with {@code allowRecompute = false} the verdict
     * is always final, used when the decomposition cannot spawn more solvers.
     */
    public ConsensusVerdict validate(Problem problem, List<Candidate> candidates, Object fallbackResult, int round,
                                     boolean allowRecompute) {
        AgreementPolicy policy = policies.getOrDefault(problem.type(), defaultPolicy);
        double required = requiredRatio(problem);

        if (candidates.isEmpty()) {
            ConsensusRecord record = new ConsensusRecord(true, 1d, required, round, policy.name(), List.of());
            return new ConsensusVerdict(record, fallbackResult, 1d, false);
        }

        List<ProblemConstraint> checks = constraints.getOrDefault(problem.type(), List.of());
        List<Candidate> valid = new ArrayList<>();
        for (Candidate c : candidates) {
            if (satisfiesAll(checks, problem, c.value())) {
                valid.add(c);
            }
        }

        Agreement agreement = valid.isEmpty() ? Agreement.none() : policy.evaluate(valid);
        double ratio = (double) agreement.agreeing().size() / candidates.size();

        List<Vote> votes = new ArrayList<>(candidates.size());
        for (Candidate c : candidates) {
            boolean isValid = valid.contains(c);
            votes.add(new Vote(c.taskId(), c.workerId(), c.value(), isValid, agreement.agreeing().contains(c.taskId())));
        }

        boolean achieved = ratio >= required;
        if (!achieved && allowRecompute && round <= maxAdditionalRounds) {
            log.info(JsonUtils.json(
                    "consensus_event", "recompute",
                    "problemId", problem.id(),
                    "round", Integer.toString(round),
                    "ratio", String.format(Locale.ROOT, "%.3f", ratio),
                    "required", String.format(Locale.ROOT, "%.3f", required)
            ));
            ConsensusRecord record = new ConsensusRecord(false, ratio, required, round, policy.name(), votes);
            return new ConsensusVerdict(record, agreement.value(), confidence(ratio, candidates, agreement), true);
        }

        if (achieved) {
            ConsensusRecord record = new ConsensusRecord(true, ratio, required, round, policy.name(), votes);
            return new ConsensusVerdict(record, agreement.value(), confidence(ratio, candidates, agreement), false);
        }

        Candidate strongest = strongest(valid.isEmpty() ? candidates : valid, agreement);
        double share = agreement.agreeing().contains(strongest.taskId()) ? ratio : 1d / candidates.size();
        ConsensusNotReachedException reason = new ConsensusNotReachedException(ratio, required);
        log.warn(JsonUtils.json(
                "consensus_event", "not_reached",
                "problemId", problem.id(),
                "rounds", Integer.toString(round),
                "selected", strongest.taskId(),
                "reason", reason.getMessage()
        ));
        ConsensusRecord record = new ConsensusRecord(false, ratio, required, round, policy.name(), votes,
                reason.getMessage());
        return new ConsensusVerdict(record, strongest.value(), strongest.weight() * share, false);
    }

    /**
     * Highest-weight candidate; among equal weights, members of the agreeing group come first,
     * then submission order.
     */
    private static Candidate strongest(List<Candidate> pool, Agreement agreement) {
        Candidate best = null;
        for (Candidate c : pool) {
            if (best == null || c.weight() > best.weight()
                    || (c.weight() == best.weight()
                        && agreement.agreeing().contains(c.taskId())
                        && !agreement.agreeing().contains(best.taskId()))) {
                best = c;
            }
        }
        return best;
    }

    private static boolean satisfiesAll(List<ProblemConstraint> checks, Problem problem, Object value) {
        for (ProblemConstraint check : checks) {
            if (!check.isSatisfiedBy(problem, value)) return false;
        }
        return true;
    }

    // ratio scaled by the mean trust of the agreeing candidates
    private static double confidence(double ratio, List<Candidate> candidates, Agreement agreement) {
        double meanWeight = candidates.stream()
                .filter(c -> agreement.agreeing().contains(c.taskId()))
                .mapToDouble(Candidate::weight)
                .average()
                .orElse(0d);
        return ratio * meanWeight;
    }
}
