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

import org.junit.jupiter.api.Test;

import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryStateStoreTest {

    private final InMemoryStateStore store = new InMemoryStateStore();

    @Test
    void versionsGrowByOnePerWrite() {
        assertTrue(store.get("k", String.class).isEmpty());
        assertEquals(1L, store.set("k", "a"));
        assertEquals(2L, store.set("k", "b"));

        Versioned<String> v = store.get("k", String.class).orElseThrow();
        assertEquals("b", v.value());
        assertEquals(2L, v.version());
    }

    @Test
    void compareAndSetHonoursExpectedVersion() {
        assertTrue(store.compareAndSet("k", "first", StateStore.ABSENT));
        assertFalse(store.compareAndSet("k", "again", StateStore.ABSENT));
        assertFalse(store.compareAndSet("k", "stale", 7L));
        assertTrue(store.compareAndSet("k", "second", 1L));

        assertEquals("second", store.get("k", String.class).orElseThrow().value());
    }

    @Test
    void wrongTypeIsRejected() {
        store.set("k", 42);
        assertThrows(ClassCastException.class, () -> store.get("k", String.class));
    }

    @Test
    void keysAreFilteredByPrefixAndDeletable() {
        store.set("worker/w1", 1);
        store.set("worker/w2", 2);
        store.set("saga/r1", 3);

        assertEquals(Set.of("worker/w1", "worker/w2"), store.keys("worker/"));
        assertTrue(store.delete("worker/w1"));
        assertFalse(store.delete("worker/w1"));
        assertEquals(2, store.size());
    }

    @Test
    void concurrentCompareAndSetLetsExactlyOneWriterWinPerVersion() throws Exception {
        int threads = 16;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger wins = new AtomicInteger();
        try {
            for (int i = 0; i < threads; i++) {
                int n = i;
                pool.submit(() -> {
                    start.await();
                    if (store.compareAndSet("counter", n, StateStore.ABSENT)) {
                        wins.incrementAndGet();
                    }
                    return null;
                });
            }
            start.countDown();
        } finally {
            pool.shutdown();
            assertTrue(pool.awaitTermination(5, TimeUnit.SECONDS));
        }
        assertEquals(1, wins.get());
        assertEquals(1L, store.get("counter", Integer.class).orElseThrow().version());
    }
}
