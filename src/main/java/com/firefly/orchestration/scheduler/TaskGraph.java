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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;

/**
 * Graph utilities for decompositions: validation and topological layers.
 */
public final class TaskGraph {

    private TaskGraph() {
    }

    /**
     * Checks ids are unique, every dependency exists and the graph is acyclic.
     *
     * @throws InvalidDecompositionException otherwise
     */
    public static void validate(String problemType, Collection<SubTaskDefinition> tasks) {
        if (tasks.isEmpty()) {
            throw new InvalidDecompositionException("Decomposition of '" + problemType + "' produced no tasks");
        }
        Map<String, SubTaskDefinition> byId = new LinkedHashMap<>();
        for (SubTaskDefinition t : tasks) {
            if (byId.putIfAbsent(t.id(), t) != null) {
                throw new InvalidDecompositionException("Duplicate task id '" + t.id() + "' in '" + problemType + "'");
            }
        }
        for (SubTaskDefinition t : tasks) {
            for (String dep : t.dependencies()) {
                if (!byId.containsKey(dep)) {
                    throw new InvalidDecompositionException("Task '" + t.id() + "' depends on unknown task '" + dep + "'");
                }
                if (dep.equals(t.id())) {
                    throw new InvalidDecompositionException("Task '" + t.id() + "' depends on itself");
                }
            }
        }
        int ordered = layers(tasks).stream().mapToInt(List::size).sum();
        if (ordered < tasks.size()) {
            throw new InvalidDecompositionException("Decomposition of '" + problemType + "' contains a dependency cycle");
        }
    }

    /**
     * Topological levels: tasks without dependencies first; removing a level unlocks the next.
     * Tasks on a cycle never appear.
     */
    public static List<List<String>> layers(Collection<SubTaskDefinition> tasks) {
        Map<String, Integer> indegree = new LinkedHashMap<>();
        Map<String, List<String>> adj = new LinkedHashMap<>();
        for (SubTaskDefinition t : tasks) {
            indegree.putIfAbsent(t.id(), 0);
            adj.putIfAbsent(t.id(), new ArrayList<>());
        }
        for (SubTaskDefinition t : tasks) {
            for (String dep : t.dependencies()) {
                if (!adj.containsKey(dep)) continue;
                indegree.merge(t.id(), 1, Integer::sum);
                adj.get(dep).add(t.id());
            }
        }
        List<List<String>> layers = new ArrayList<>();
        Queue<String> q = new ArrayDeque<>();
        for (Map.Entry<String, Integer> e : indegree.entrySet()) {
            if (e.getValue() == 0) q.add(e.getKey());
        }
        while (!q.isEmpty()) {
            int size = q.size();
            List<String> layer = new ArrayList<>(size);
            for (int i = 0; i < size; i++) {
                String u = q.poll();
                layer.add(u);
                for (String v : adj.getOrDefault(u, List.of())) {
                    if (indegree.merge(v, -1, Integer::sum) == 0) q.add(v);
                }
            }
            layers.add(layer);
        }
        return layers;
    }

    /** Every task that transitively depends on {@code root}. */
    public static Set<String> dependentsOf(String root, Collection<SubTaskDefinition> tasks) {
        Set<String> out = new LinkedHashSet<>();
        Queue<String> q = new ArrayDeque<>(List.of(root));
        while (!q.isEmpty()) {
            String u = q.poll();
            for (SubTaskDefinition t : tasks) {
                if (t.dependencies().contains(u) && out.add(t.id())) {
                    q.add(t.id());
                }
            }
        }
        return out;
    }

    /** Tasks nothing else depends on. */
    public static List<String> sinks(Collection<SubTaskDefinition> tasks) {
        Set<String> depended = new LinkedHashSet<>();
        for (SubTaskDefinition t : tasks) {
            depended.addAll(t.dependencies());
        }
        List<String> out = new ArrayList<>();
        for (SubTaskDefinition t : tasks) {
            if (!depended.contains(t.id())) out.add(t.id());
        }
        return out;
    }
}
