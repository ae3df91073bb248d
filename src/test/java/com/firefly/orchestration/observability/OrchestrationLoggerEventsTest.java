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


package com.firefly.orchestration.observability;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class OrchestrationLoggerEventsTest {

    private Logger logger;
    private Level oldLevel;
    private ListAppender<ILoggingEvent> appender;
    private final OrchestrationLoggerEvents events = new OrchestrationLoggerEvents();

    @BeforeEach
    void attach() {
        logger = (Logger) LoggerFactory.getLogger(OrchestrationLoggerEvents.class);
        oldLevel = logger.getLevel();
        logger.setLevel(Level.INFO);
        appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void detach() {
        logger.detachAppender(appender);
        logger.setLevel(oldLevel);
    }

    private ILoggingEvent only() {
        assertEquals(1, appender.list.size());
        return appender.list.get(0);
    }

    @Test
    void stepFailureIsLoggedAsWarnJson() {
        events.onStepFailed("Checkout", "run-1", "charge", new IllegalStateException("card declined"), 3, 25L);

        ILoggingEvent e = only();
        assertEquals(Level.WARN, e.getLevel());
        String msg = e.getFormattedMessage();
        assertTrue(msg.contains("\"saga_event\":\"step_failed\""), msg);
        assertTrue(msg.contains("\"step\":\"charge\""), msg);
        assertTrue(msg.contains("\"attempts\":\"3\""), msg);
        assertTrue(msg.contains("\"error_class\":\"java.lang.IllegalStateException\""), msg);
        assertTrue(msg.contains("\"error_msg\":\"card declined\""), msg);
    }

    @Test
    void compensationFailureIsLoggedAsError() {
        events.onCompensated("Checkout", "run-1", "reserve", new RuntimeException("release failed"));

        ILoggingEvent e = only();
        assertEquals(Level.ERROR, e.getLevel());
        assertTrue(e.getFormattedMessage().contains("\"saga_event\":\"compensation_failed\""));
    }

    @Test
    void taskFailureCarriesRetryFlag() {
        events.onTaskFailed("analysis", "p-1", "t2", "w3", new RuntimeException("boom"), 1, true);

        String msg = only().getFormattedMessage();
        assertTrue(msg.contains("\"problem_event\":\"task_failed\""), msg);
        assertTrue(msg.contains("\"taskId\":\"t2\""), msg);
        assertTrue(msg.contains("\"willRetry\":\"true\""), msg);
    }

    @Test
    void workerRegistrationListsSortedCapabilities() {
        events.onWorkerRegistered("w1", Set.of("payment", "inventory"));

        ILoggingEvent e = only();
        assertEquals(Level.INFO, e.getLevel());
        assertTrue(e.getFormattedMessage().contains("\"capabilities\":\"inventory,payment\""), e.getFormattedMessage());
    }

    @Test
    void decimalsIgnoreTheDefaultLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.GERMANY);
        try {
            events.onStepSuccess("Checkout", "run-1", "charge", 1, 12L, 0.5);
        } finally {
            Locale.setDefault(previous);
        }

        String msg = only().getFormattedMessage();
        assertTrue(msg.contains("\"progress\":\"0.50\""), msg);
    }
}
