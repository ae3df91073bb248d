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

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class JitterTest {

    @Test
    void staysWithinSpread() {
        for (int i = 0; i < 200; i++) {
            long ms = Jitter.apply(Duration.ofMillis(400), 0.25).toMillis();
            assertTrue(ms >= 300 && ms <= 500, "delay " + ms);
        }
    }

    @Test
    void zeroFactorOrZeroBaseIsExact() {
        assertEquals(Duration.ofMillis(400), Jitter.apply(Duration.ofMillis(400), 0));
        assertEquals(Duration.ZERO, Jitter.apply(Duration.ZERO, 0.5));
        assertEquals(Duration.ZERO, Jitter.apply(Duration.ofMillis(-5), 0.5));
    }
}
