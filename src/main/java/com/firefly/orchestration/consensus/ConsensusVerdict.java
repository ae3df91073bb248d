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

/**
 * Decision of the {@link ConsensusValidator} for one validation round.
 *
 * @param consensus  the vote record of this round
 * @param result     the selected answer
 * @param confidence confidence of the selected answer
 * @param recompute  true when the scheduler should run another round of solvers instead of
 *                   accepting this result
 */
public record ConsensusVerdict(ConsensusRecord consensus, Object result, double confidence, boolean recompute) {
}
