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


package com.firefly.orchestration.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Publish-only feed of lifecycle events for external monitors.
 * <p>
 * Supports per-aggregate and global subscriptions and retains a bounded history per aggregate so
 * that status reports can include the partial event trail of a running or failed execution.
 * The engine only writes to the stream; it never reads its own events back for decisions.
 */
public class EventStream {

    private static final Logger log = LoggerFactory.getLogger(EventStream.class);

    private final int historyLimit;
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<OrchestrationEvent>>> aggregateSubscribers =
            new ConcurrentHashMap<>();
    private final CopyOnWriteArrayList<Consumer<OrchestrationEvent>> globalSubscribers = new CopyOnWriteArrayList<>();
    private final ConcurrentHashMap<String, Deque<OrchestrationEvent>> history = new ConcurrentHashMap<>();

    public EventStream() {
        this(200);
    }

    public EventStream(int historyLimit) {
        this.historyLimit = Math.max(1, historyLimit);
    }

    public void publish(OrchestrationEvent event) {
        log.debug("Publishing event: {} for {}", event.type(), event.aggregateId());
        remember(event);

        List<Consumer<OrchestrationEvent>> subs = aggregateSubscribers.get(event.aggregateId());
        if (subs != null) {
            for (Consumer<OrchestrationEvent> subscriber : subs) {
                deliverSafely(subscriber, event);
            }
        }
        for (Consumer<OrchestrationEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    public Subscription subscribe(String aggregateId, Consumer<OrchestrationEvent> consumer) {
        aggregateSubscribers.computeIfAbsent(aggregateId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        return () -> {
            CopyOnWriteArrayList<Consumer<OrchestrationEvent>> subs = aggregateSubscribers.get(aggregateId);
            if (subs != null) {
                subs.remove(consumer);
            }
        };
    }

    public Subscription subscribeAll(Consumer<OrchestrationEvent> consumer) {
        globalSubscribers.add(consumer);
        return () -> globalSubscribers.remove(consumer);
    }

    /**
     * Returns the retained events of an aggregate, oldest first.
     */
    public List<OrchestrationEvent> history(String aggregateId) {
        Deque<OrchestrationEvent> events = history.get(aggregateId);
        if (events == null) return List.of();
        synchronized (events) {
            return List.copyOf(events);
        }
    }

    public void forget(String aggregateId) {
        history.remove(aggregateId);
        aggregateSubscribers.remove(aggregateId);
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void remember(OrchestrationEvent event) {
        if (event.aggregateId() == null) return;
        Deque<OrchestrationEvent> events = history.computeIfAbsent(event.aggregateId(), k -> new ArrayDeque<>());
        synchronized (events) {
            events.addLast(event);
            while (events.size() > historyLimit) {
                events.removeFirst();
            }
        }
    }

    private void deliverSafely(Consumer<OrchestrationEvent> subscriber, OrchestrationEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}", event.type(), e.getMessage(), e);
        }
    }
}
