/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logsink.core;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static com.intuitivedesigns.logsink.core.RecordingSink.record;
import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

class PipelineSupervisorTest {

    private static PipelineSettings settings(int capacity, int batchSize, long flushMs) {
        return PipelineSettings.builder()
                .queueCapacity(capacity)
                .batchSize(batchSize)
                .flushInterval(Duration.ofMillis(flushMs))
                .initialBackoff(Duration.ofMillis(1))
                .maxBackoff(Duration.ofMillis(5))
                .build();
    }

    @Test
    void testEveryAcceptedRecordIsDeliveredOnceInOrder() {
        RecordingSink sink = new RecordingSink();
        LogPipeline pipeline = PipelineSupervisor.start(sink, settings(1024, 16, 50));

        List<String> expected = new ArrayList<>();
        for (int i = 0; i < 200; i++) {
            assertEquals(OfferResult.ACCEPTED, pipeline.offer(record("m" + i)));
            expected.add("m" + i);
        }

        await().atMost(Duration.ofSeconds(10)).until(() -> sink.sent.size() >= 200);
        assertEquals(expected, sink.messages());

        CountersSnapshot s = pipeline.counters();
        assertEquals(200, s.enqueued());
        assertEquals(0, s.dropped());
        assertEquals(200, s.delivered());
        assertEquals(200, s.dequeued());
    }

    @Test
    void testSmallBurstIsSentPromptlyInOrder() {
        RecordingSink sink = new RecordingSink();
        LogPipeline pipeline = PipelineSupervisor.start(sink, settings(16, 4, 50));

        for (String m : List.of("r1", "r2", "r3", "r4")) pipeline.offer(record(m));

        await().atMost(Duration.ofSeconds(1)).until(() -> sink.sent.size() == 4);
        assertEquals(List.of("r1", "r2", "r3", "r4"), sink.messages());
        assertEquals(4, pipeline.counters().enqueued());
        assertEquals(0, pipeline.counters().dropped());
    }

    @Test
    void testOverflowWhileConsumerIsBlockedIsDroppedAndCounted() throws InterruptedException {
        RecordingSink sink = new RecordingSink().blockUntilReleased();
        LogPipeline pipeline = PipelineSupervisor.start(sink, settings(16, 1, 50));

        try {
            pipeline.offer(record("held"));
            assertTrue(sink.entered.await(5, TimeUnit.SECONDS), "consumer never reached the sink");

            int accepted = 0;
            int rejected = 0;
            for (int i = 0; i < 18; i++) {
                if (pipeline.offer(record("q" + i)).accepted()) accepted++;
                else rejected++;
            }

            assertEquals(16, accepted);
            assertEquals(2, rejected);
            assertEquals(2, pipeline.counters().dropped());
            assertEquals(19, pipeline.counters().observed());
        } finally {
            sink.release();
        }

        await().atMost(Duration.ofSeconds(10)).until(() -> sink.sent.size() == 17);
        assertEquals(17, pipeline.counters().delivered());
    }

    @Test
    void testFailingSinkIsRetriedWithGrowingBackoff() {
        RecordingSink sink = new RecordingSink().failFirst(2);
        List<Duration> sleeps = new CopyOnWriteArrayList<>();
        PipelineSettings s = PipelineSettings.builder()
                .queueCapacity(64)
                .batchSize(2)
                .flushInterval(Duration.ofMillis(20))
                .initialBackoff(Duration.ofMillis(100))
                .maxBackoff(Duration.ofSeconds(10))
                .build();

        LogPipeline pipeline = PipelineSupervisor.start(sink, s, null, sleeps::add);
        pipeline.offer(record("a"));
        pipeline.offer(record("b"));

        await().atMost(Duration.ofSeconds(5)).until(() -> sink.sent.size() == 2);
        assertEquals(List.of("a", "b"), sink.messages());
        assertEquals(List.of(Duration.ofMillis(100), Duration.ofMillis(200)), sleeps);
        assertEquals(2, pipeline.counters().retries());
    }

    @Test
    void testOfferFromPipelineThreadIsRejected() {
        AtomicReference<LogPipeline> ref = new AtomicReference<>();
        AtomicReference<OfferResult> nested = new AtomicReference<>();
        RecordingSink sink = new RecordingSink() {
            @Override
            public void send(LogRecord record) throws Exception {
                super.send(record);
                LogPipeline p = ref.get();
                if (p != null && nested.get() == null) {
                    nested.set(p.offer(record("from-sink")));
                }
            }
        };

        LogPipeline pipeline = PipelineSupervisor.start(sink, settings(16, 1, 20));
        ref.set(pipeline);
        pipeline.offer(record("outer"));

        await().atMost(Duration.ofSeconds(5)).until(() -> nested.get() != null);
        assertEquals(OfferResult.REJECTED, nested.get());
        assertEquals(1, pipeline.counters().dropped());
        assertEquals(List.of("outer"), sink.messages());
    }

    @Test
    void testRunsOnOneNamedThread() throws InterruptedException {
        RecordingSink sink = new RecordingSink();
        LogPipeline pipeline = PipelineSupervisor.start(sink, settings(16, 1, 20));

        assertTrue(pipeline.task().name().startsWith(PipelineSupervisor.THREAD_PREFIX));
        assertTrue(pipeline.task().isAlive());
        assertFalse(pipeline.task().isCurrentThread());
        assertFalse(pipeline.task().join(Duration.ofMillis(20)));

        pipeline.offer(record("a"));
        pipeline.offer(record("b"));
        await().atMost(Duration.ofSeconds(5)).until(() -> sink.sent.size() == 2);

        assertEquals(List.of(pipeline.task().name(), pipeline.task().name()), sink.sendThreads);
    }

    @Test
    void testInterruptEndsTheLoop() throws InterruptedException {
        LogPipeline pipeline = PipelineSupervisor.start(new RecordingSink(), settings(16, 4, 20));

        pipeline.task().interrupt();

        assertTrue(pipeline.task().join(Duration.ofSeconds(5)));
        assertFalse(pipeline.task().isAlive());
    }

    @Test
    void testExtremeSettingsStillStartAPipeline() {
        RecordingSink sink = new RecordingSink();
        PipelineSettings s = PipelineSettings.builder()
                .queueCapacity(64)
                .batchSize(Integer.MAX_VALUE)
                .flushInterval(Duration.ofMillis(Long.MAX_VALUE))
                .initialBackoff(Duration.ofMillis(1))
                .build();
        LogPipeline pipeline = PipelineSupervisor.start(sink, s);

        for (int i = 0; i < 64; i++) pipeline.offer(record("f" + i));

        // batchSize is capped at the queue capacity, so a full queue triggers a SIZE batch
        await().atMost(Duration.ofSeconds(5)).until(() -> sink.sent.size() == 64);
        assertEquals(64, pipeline.counters().delivered());
    }

    @Test
    void testEchoHappensOnThePipelineThread() {
        Logger echoLogger = (Logger) LoggerFactory.getLogger(PipelineSettings.ECHO_LOGGER);
        ListAppender<ILoggingEvent> captured = new ListAppender<>();
        captured.start();
        echoLogger.addAppender(captured);
        try {
            RecordingSink sink = new RecordingSink();
            PipelineSettings s = PipelineSettings.builder()
                    .queueCapacity(16)
                    .batchSize(2)
                    .flushInterval(Duration.ofMillis(20))
                    .echo(true)
                    .build();
            LogPipeline pipeline = PipelineSupervisor.start(sink, s);

            pipeline.offer(record("echo-1"));
            pipeline.offer(record("echo-2"));

            await().atMost(Duration.ofSeconds(5)).until(() -> captured.list.size() >= 2);
            for (ILoggingEvent e : captured.list) {
                assertEquals(pipeline.task().name(), e.getThreadName());
            }
            assertTrue(captured.list.get(0).getFormattedMessage().contains("echo-1"));
            assertTrue(captured.list.get(1).getFormattedMessage().contains("echo-2"));
            await().atMost(Duration.ofSeconds(5)).until(() -> sink.sent.size() == 2);
        } finally {
            echoLogger.detachAppender(captured);
        }
    }

    @Test
    void testNoEchoByDefault() {
        Logger echoLogger = (Logger) LoggerFactory.getLogger(PipelineSettings.ECHO_LOGGER);
        ListAppender<ILoggingEvent> captured = new ListAppender<>();
        captured.start();
        echoLogger.addAppender(captured);
        try {
            RecordingSink sink = new RecordingSink();
            LogPipeline pipeline = PipelineSupervisor.start(sink, settings(16, 1, 20));

            pipeline.offer(record("quiet"));

            await().atMost(Duration.ofSeconds(5)).until(() -> sink.sent.size() == 1);
            assertTrue(captured.list.isEmpty());
        } finally {
            echoLogger.detachAppender(captured);
        }
    }
}
