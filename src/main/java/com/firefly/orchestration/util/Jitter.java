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


package com.firefly.orchestration.util;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Randomized re-poll delays, so that callers waiting for a free worker do not wake up in lockstep.
 */
public final class Jitter {

    private Jitter() {
    }

    /**
     * @param base   nominal delay
     * @param factor spread in [0, 1]; the result lies in {@code base * (1 ± factor)}
     */
    public static Duration apply(Duration base, double factor) {
        long ms = Math.max(0L, base.toMillis());
        double f = Math.max(0d, Math.min(1d, factor));
        if (ms == 0L || f == 0d) return Duration.ofMillis(ms);
        double min = ms * (1 - f);
        double max = ms * (1 + f);
        return Duration.ofMillis(Math.round(ThreadLocalRandom.current().nextDouble(min, max)));
    }
}
