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

/**
 * Key/value boundary through which every mutable aggregate (workers, saga runs, problems) is read
 * and written. Implementations may be in-memory or backed by a replicated store; the engine relies
 * on {@link #compareAndSet(String, Object, long)} for aggregate-level atomicity when it does not
 * hold an in-process lock.
 */
public interface StateStore {

    /** Version passed to {@link #compareAndSet} to require that the key is absent. */
    long ABSENT = 0L;

    <T> Optional<Versioned<T>> get(String key, Class<T> type);

    /**
     * Unconditionally writes the value.
     *
     * @return the new version of the key
     */
    long set(String key, Object value);

    /**
     * Writes the value only if the key is currently at {@code expectedVersion}
     * ({@link #ABSENT} meaning "not present").
     *
     * @return true when the write happened
     */
    boolean compareAndSet(String key, Object value, long expectedVersion);

    boolean delete(String key);

    Set<String> keys(String prefix);
}
