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

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JsonUtilsTest {

    @Test
    void jsonKeepsKeyOrderAndBlanksNulls() {
        assertEquals("{\"saga_event\":\"start\",\"saga\":\"S\",\"runId\":\"\"}",
                JsonUtils.json("saga_event", "start", "saga", "S", "runId", null));
    }

    @Test
    void jsonEscapesValues() {
        assertEquals("{\"msg\":\"say \\\"hi\\\"\"}", JsonUtils.json("msg", "say \"hi\""));
    }

    @Test
    void oddArgumentsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> JsonUtils.json("only-key"));
    }

    @Test
    void summarizeRendersStructuredValuesAndTruncates() {
        assertEquals("null", JsonUtils.summarize(null, 10));
        assertEquals("42", JsonUtils.summarize(42, 10));
        assertEquals("{\"a\":[1,2]}", JsonUtils.summarize(Map.of("a", List.of(1, 2)), 50));
        assertEquals("abc...", JsonUtils.summarize("abcdef", 3));
    }

    @Test
    void errorMessageFallsBackToClassName() {
        assertEquals("", JsonUtils.errorMessage(null));
        assertEquals("boom", JsonUtils.errorMessage(new RuntimeException("boom")));
        assertEquals("IllegalStateException", JsonUtils.errorMessage(new IllegalStateException()));
        assertEquals(503, JsonUtils.errorMessage(new RuntimeException("x".repeat(600))).length());
    }
}
