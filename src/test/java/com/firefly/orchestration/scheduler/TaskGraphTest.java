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


package com.firefly.orchestration.scheduler;

import com.firefly.orchestration.exception.InvalidDecompositionException;
import com.firefly.orchestration.exception.UnknownProblemTypeException;
import com.firefly.orchestration.problem.Complexity;
import com.firefly.orchestration.problem.Problem;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TaskGraphTest {

    private static final List<SubTaskDefinition> DIAMOND = List.of(
            SubTaskDefinition.task("a", "k", Set.of()),
            SubTaskDefinition.task("b", "k", Set.of("a")),
            SubTaskDefinition.task("c", "k", Set.of("a")),
            SubTaskDefinition.task("d", "k", Set.of("b", "c")),
            SubTaskDefinition.task("e", "k", Set.of()));

    @Test
    void layersFollowDependencies() {
        List<List<String>> layers = TaskGraph.layers(DIAMOND);

        assertEquals(3, layers.size());
        assertEquals(List.of("a", "e"), layers.get(0));
        assertEquals(Set.of("b", "c"), Set.copyOf(layers.get(1)));
        assertEquals(List.of("d"), layers.get(2));
    }

    @Test
    void dependentsAndSinks() {
        assertEquals(Set.of("b", "c", "d"), TaskGraph.dependentsOf("a", DIAMOND));
        assertEquals(Set.of(), TaskGraph.dependentsOf("e", DIAMOND));
        assertEquals(List.of("d", "e"), TaskGraph.sinks(DIAMOND));
    }

    @Test
    void validateRejectsMalformedGraphs() {
        assertDoesNotThrow(() -> TaskGraph.validate("t", DIAMOND));
        assertThrows(InvalidDecompositionException.class, () -> TaskGraph.validate("t", List.of()));
        assertThrows(InvalidDecompositionException.class, () -> TaskGraph.validate("t", List.of(
                SubTaskDefinition.task("a", "k", Set.of()),
                SubTaskDefinition.task("a", "k", Set.of()))));
        assertThrows(InvalidDecompositionException.class, () -> TaskGraph.validate("t", List.of(
                SubTaskDefinition.task("a", "k", Set.of("ghost")))));
        assertThrows(InvalidDecompositionException.class, () -> TaskGraph.validate("t", List.of(
                SubTaskDefinition.task("a", "k", Set.of("a")))));
        InvalidDecompositionException cycle = assertThrows(InvalidDecompositionException.class,
                () -> TaskGraph.validate("t", List.of(
                        SubTaskDefinition.task("a", "k", Set.of("c")),
                        SubTaskDefinition.task("b", "k", Set.of("a")),
                        SubTaskDefinition.task("c", "k", Set.of("b")))));
        assertTrue(cycle.getMessage().contains("cycle"));
    }

    @Test
    void builtInStrategiesScaleWithComplexity() {
        DecompositionRegistry registry = DecompositionRegistry.withDefaults();
        assertEquals(Set.of("optimization", "analysis"), registry.problemTypes());

        List<SubTaskDefinition> medium = registry.decompose(Problem.of("optimization", null, Complexity.MEDIUM));
        assertEquals(6, medium.size());
        assertEquals(4, medium.stream().filter(SubTaskDefinition::candidate).count());
        assertEquals("generate-seed", medium.get(0).action());
        assertEquals(List.of("aggregate"), TaskGraph.sinks(medium));

        List<SubTaskDefinition> high = registry.decompose(Problem.of("analysis", null, Complexity.HIGH));
        assertEquals(10, high.size());
        assertEquals(0, high.stream().filter(SubTaskDefinition::candidate).count());

        List<SubTaskDefinition> extra = new OptimizationDecomposition()
                .expand(Problem.of("optimization", null, Complexity.LOW), 2, medium);
        assertEquals(List.of("optimize-r2-1", "optimize-r2-2"), extra.stream().map(SubTaskDefinition::id).toList());

        assertThrows(UnknownProblemTypeException.class, () -> registry.strategyFor("unknown"));
    }

    @Test
    void capabilityTableFallsBackToTheKind() {
        CapabilityTable table = new CapabilityTable().map("optimize", Set.of("solver", "gpu"));
        assertEquals(Set.of("solver", "gpu"), table.capabilitiesFor("optimize"));
        assertEquals(Set.of("merge"), table.capabilitiesFor("merge"));
    }

    @Test
    void taskTimeoutScalesWithEstimatedCost() {
        SchedulerSettings settings = SchedulerSettings.defaults();
        assertEquals(Duration.ofSeconds(30), settings.timeoutFor(SubTaskDefinition.task("a", "k", Set.of()).withCost(0.5)));
        assertEquals(Duration.ofSeconds(90), settings.timeoutFor(SubTaskDefinition.task("a", "k", Set.of()).withCost(3)));
        assertThrows(IllegalArgumentException.class, () -> SubTaskDefinition.task("a", "k", Set.of()).withCost(0));
    }
}
