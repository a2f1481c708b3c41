/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logsink.logback;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import com.intuitivedesigns.logsink.core.FieldValue;
import com.intuitivedesigns.logsink.core.LogRecord;
import com.intuitivedesigns.logsink.core.CountersSnapshot;
import com.intuitivedesigns.logsink.core.LogSink;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

class LogSinkAppenderTest {

    private static final class CapturingSink implements LogSink {
        final List<LogRecord> records = new CopyOnWriteArrayList<>();

        @Override
        public void send(LogRecord record) {
            records.add(record);
        }
    }

    private final List<Logger> attached = new ArrayList<>();
    private LoggerContext context;
    private CapturingSink sink;
    private LogSinkAppender appender;

    @BeforeEach
    void setUp() {
        context = (LoggerContext) LoggerFactory.getILoggerFactory();
        sink = new CapturingSink();
        appender = new LogSinkAppender();
        appender.setContext(context);
        appender.setName("LOGSINK");
        appender.setSink(sink);
        appender.setServiceName("billing");
        appender.setFlushIntervalMs(20);
    }

    @AfterEach
    void tearDown() {
        attached.forEach(l -> l.detachAppender(appender));
        attached.clear();
        appender.stop();
        MDC.clear();
    }

    private Logger logger(String name) {
        Logger logger = context.getLogger(name);
        logger.addAppender(appender);
        attached.add(logger);
        return logger;
    }

    @Test
    void testErrorEventIsTranslatedAndDelivered() {
        appender.start();
        assertTrue(appender.isStarted());
        Logger log = logger("com.acme.checkout.Payments");

        MDC.put("request_id", "r-1");
        MDC.put("tenant", "acme");
        log.atError()
                .addKeyValue("order_id", 42)
                .addKeyValue("request_id", "r-2")
                .log("charge failed for {}", "alice");

        await().atMost(Duration.ofSeconds(5)).until(() -> sink.records.size() == 1);
        LogRecord r = sink.records.get(0);
        assertEquals("ERROR", r.level());
        assertEquals("com.acme.checkout.Payments", r.target());
        assertEquals("charge failed for alice", r.message());
        assertEquals("billing", r.serviceName());
        assertEquals(FieldValue.of(42L), r.fields().get("order_id"));
        assertEquals(FieldValue.of("r-2"), r.fields().get("request_id"), "key/value pairs win over MDC");
        assertEquals(FieldValue.of("acme"), r.fields().get("tenant"));
    }

    @Test
    void testEventsBelowMinimumLevelAreSkipped() {
        appender.start();
        Logger log = logger("com.acme.checkout.Payments");

        log.warn("slow response");
        log.info("started");
        log.error("boom", new IllegalStateException("bad state"));

        await().atMost(Duration.ofSeconds(5)).until(() -> sink.records.size() == 1);
        LogRecord r = sink.records.get(0);
        assertEquals("boom", r.message());
        assertEquals(FieldValue.of(IllegalStateException.class.getName()), r.fields().get("exception.class"));
        assertEquals(FieldValue.of("bad state"), r.fields().get("exception.message"));
        assertEquals(LogSinkAppenderTest.class.getName(), r.modulePath());
        assertEquals("LogSinkAppenderTest.java", r.file());
        assertNotNull(r.line());
        assertEquals(1, appender.getPipeline().counters().observed());
    }

    @Test
    void testMinimumLevelIsConfigurable() {
        appender.setMinimumLevel("warning");
        appender.start();
        Logger log = logger("com.acme.checkout.Payments");

        log.warn("slow response");
        log.info("started");

        await().atMost(Duration.ofSeconds(5)).until(() -> sink.records.size() == 1);
        assertEquals("WARN", sink.records.get(0).level());
    }

    @Test
    void testExcludedLoggersAreNeverForwarded() {
        appender.setExcludedPrefixes("com.acme.noisy, org.internal");
        appender.start();

        logger("com.acme.noisy.Poller").error("ignored");
        logger("com.acme.noisyneighbor").error("kept");

        await().atMost(Duration.ofSeconds(5)).until(() -> sink.records.size() == 1);
        assertEquals("kept", sink.records.get(0).message());
        assertEquals(List.of("a", "b"), LogSinkAppender.splitPrefixes(" a ,, b"));
    }

    @Test
    void testOwnPackageIsExcludedByDefault() {
        appender.start();

        logger("com.intuitivedesigns.logsink.core.DeliveryEngine").error("sink down");
        logger("com.acme.Api").error("real failure");

        await().atMost(Duration.ofSeconds(5)).until(() -> sink.records.size() == 1);
        assertEquals("com.acme.Api", sink.records.get(0).target());
    }

    @Test
    void testCallerDataCanBeDisabled() {
        appender.setIncludeCallerData(false);
        appender.start();

        logger("com.acme.Api").error("no location");

        await().atMost(Duration.ofSeconds(5)).until(() -> sink.records.size() == 1);
        assertNull(sink.records.get(0).file());
        assertNull(sink.records.get(0).line());
    }

    @Test
    void testInvalidConfigurationDoesNotStart() {
        LogSinkAppender broken = new LogSinkAppender();
        broken.setContext(context);
        broken.setDsn("smtp://mail.example.com");
        broken.start();

        assertFalse(broken.isStarted());
        assertNull(broken.getPipeline());

        LogSinkAppender badLevel = new LogSinkAppender();
        badLevel.setContext(context);
        badLevel.setMinimumLevel("loud");
        badLevel.start();
        assertFalse(badLevel.isStarted());
    }

    @Test
    void testDsnBuildsSinkThroughFactory() {
        LogSinkAppender fromDsn = new LogSinkAppender();
        fromDsn.setContext(context);
        fromDsn.setDsn("log://?level=INFO");
        fromDsn.start();
        try {
            assertTrue(fromDsn.isStarted());
            assertNotNull(fromDsn.getPipeline());
            assertTrue(fromDsn.getPipeline().task().isAlive());
        } finally {
            fromDsn.stop();
        }
    }

    @Test
    void testConcurrentProducersAreAllAccountedFor() throws Exception {
        appender.setQueueCapacity(4096);
        appender.start();
        Logger log = logger("com.acme.Workers");

        final int threads = 8;
        final int perThread = 50;
        CountDownLatch go = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            for (int t = 0; t < threads; t++) {
                final int id = t;
                pool.submit(() -> {
                    go.await();
                    for (int i = 0; i < perThread; i++) {
                        log.error("w{}-{}", id, i);
                    }
                    return null;
                });
            }
            go.countDown();
            pool.shutdown();
            assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));
        } finally {
            pool.shutdownNow();
        }

        await().atMost(Duration.ofSeconds(10)).until(() -> sink.records.size() == threads * perThread);
        Set<String> messages = new HashSet<>();
        sink.records.forEach(r -> messages.add(r.message()));
        assertEquals(threads * perThread, messages.size());

        CountersSnapshot c = appender.getPipeline().counters();
        assertEquals(threads * perThread, c.enqueued());
        assertEquals(0, c.dropped());
    }

    @Test
    void testAppendDoesNotTakeTheAppenderMonitor() throws InterruptedException {
        appender.start();
        Logger log = logger("com.acme.Api");

        Thread producer = new Thread(() -> log.error("while monitor held"));
        synchronized (appender) {
            producer.start();
            producer.join(5_000);
            assertFalse(producer.isAlive(), "logging thread blocked on the appender");
        }

        await().atMost(Duration.ofSeconds(5)).until(() -> sink.records.size() == 1);
    }

    @Test
    void testOversizedSettingsStillStart() {
        appender.setBatchSize(Integer.MAX_VALUE);
        appender.setFlushIntervalMs(Long.MAX_VALUE);
        appender.setMaxBackoffMs(Long.MAX_VALUE);
        appender.start();

        assertTrue(appender.isStarted());
        assertTrue(appender.getPipeline().task().isAlive());
    }
}
