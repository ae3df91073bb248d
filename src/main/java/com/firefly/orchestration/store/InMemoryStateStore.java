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


package com.firefly.orchestration.store;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * {@link StateStore} backed by a {@link ConcurrentHashMap}. Compare-and-set is implemented with
 * {@link ConcurrentHashMap#compute}, which runs atomically per key.
 */
public class InMemoryStateStore implements StateStore {

    private final ConcurrentHashMap<String, Versioned<Object>> entries = new ConcurrentHashMap<>();

    @Override
    public <T> Optional<Versioned<T>> get(String key, Class<T> type) {
        Versioned<Object> v = entries.get(key);
        if (v == null) return Optional.empty();
        if (!type.isInstance(v.value())) {
            throw new ClassCastException("Value under '" + key + "' is " + v.value().getClass().getName()
                    + ", not " + type.getName());
        }
        return Optional.of(new Versioned<>(type.cast(v.value()), v.version()));
    }

    @Override
    public long set(String key, Object value) {
        return entries.compute(key, (k, prev) -> new Versioned<>(value, prev == null ? 1L : prev.version() + 1))
                .version();
    }

    @Override
    public boolean compareAndSet(String key, Object value, long expectedVersion) {
        boolean[] written = {false};
        entries.compute(key, (k, prev) -> {
            long current = prev == null ? ABSENT : prev.version();
            if (current != expectedVersion) {
                return prev;
            }
            written[0] = true;
            return new Versioned<>(value, current + 1);
        });
        return written[0];
    }

    @Override
    public boolean delete(String key) {
        return entries.remove(key) != null;
    }

    @Override
    public Set<String> keys(String prefix) {
        return entries.keySet().stream()
                .filter(k -> k.startsWith(prefix))
                .collect(Collectors.toSet());
    }

    public int size() {
        return entries.size();
    }
}
