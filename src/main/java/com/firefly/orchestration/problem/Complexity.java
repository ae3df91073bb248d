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


package com.firefly.orchestration.problem;

/**
 * Size hint supplied with a problem; decomposition strategies use it to pick their fan-out.
 */
public enum Complexity {
    LOW(2),
    MEDIUM(4),
    HIGH(8);

    private final int defaultFanOut;

    Complexity(int defaultFanOut) {
        this.defaultFanOut = defaultFanOut;
    }

    public int defaultFanOut() {
        return defaultFanOut;
    }
}
