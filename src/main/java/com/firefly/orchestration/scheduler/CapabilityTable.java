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

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps a sub-task kind to the capabilities a worker needs to run it. Kinds without an entry require
 * a capability named like the kind.
 */
public class CapabilityTable {

    private final Map<String, Set<String>> table = new ConcurrentHashMap<>();

    public CapabilityTable() {
    }

    public CapabilityTable(Map<String, ? extends Set<String>> entries) {
        entries.forEach(this::map);
    }

    public CapabilityTable map(String kind, Set<String> capabilities) {
        table.put(kind, Set.copyOf(capabilities));
        return this;
    }

    public Set<String> capabilitiesFor(String kind) {
        return table.getOrDefault(kind, Set.of(kind));
    }
}
