package com.edushield.audit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.edushield.audit.sink.AuditSink;
import com.edushield.audit.sink.InMemoryAuditSink;
import com.edushield.observability.MetricFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("AuditPipeline")
class AuditPipelineTest {

    private static final Duration STOP_TIMEOUT = Duration.ofSeconds(10);

    private SimpleMeterRegistry registry;
    private MetricFactory metrics;
    private InMemoryAuditSink memory;
    private AuditPipeline pipeline;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new MetricFactory(registry, "audit-test");
        memory = new InMemoryAuditSink();
    }

    @AfterEach
    void tearDown() {
        if (pipeline != null) {
            pipeline.stop(STOP_TIMEOUT);
        }
    }

    private AuditPipeline pipeline(List<AuditSink> sinks, int capacity) {
        return new AuditPipeline(sinks, new AuditSanitizer(), metrics,
                new AuditPipelineOptions(capacity, 3, Duration.ZERO, STOP_TIMEOUT));
    }

    private double count(String name) {
        return registry.get(name).counter().count();
    }

    @Nested
    @DisplayName("delivery")
    class Delivery {

        @Test
        @DisplayName("every accepted entry is delivered exactly once, in submission order")
        void deliversInOrder() {
            pipeline = pipeline(List.of(memory), 100);
            pipeline.start();

            for (int i = 0; i < 20; i++) {
                assertThat(pipeline.submit(AuditEntries.student("tr-%08d".formatted(i)))).isTrue();
            }
            assertThat(pipeline.stop(STOP_TIMEOUT)).isTrue();

            List<String> traceIds = memory.records().stream().map(AuditRecord::traceId).toList();
            List<String> expected = new ArrayList<>();
            for (int i = 0; i < 20; i++) {
                expected.add("tr-%08d".formatted(i));
            }
            assertThat(traceIds).isEqualTo(expected);
            assertThat(count("iccp.audit.submitted")).isEqualTo(20.0);
            assertThat(registry.get("iccp.audit.delivered").tag("sink", "memory").counter().count()).isEqualTo(20.0);
        }

        @Test
        @DisplayName("concurrent producers each get exactly one entry per submission")
        void concurrentProducers() throws InterruptedException {
            pipeline = pipeline(List.of(memory), 1_000);
            pipeline.start();

            int producers = 4;
            int perProducer = 50;
            ExecutorService executor = Executors.newFixedThreadPool(producers);
            CountDownLatch done = new CountDownLatch(producers);
            for (int p = 0; p < producers; p++) {
                int producer = p;
                executor.submit(() -> {
                    for (int i = 0; i < perProducer; i++) {
                        pipeline.submit(AuditEntries.teacher("tr-p%d-%03d".formatted(producer, i)));
                    }
                    done.countDown();
                });
            }
            assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();
            executor.shutdown();
            pipeline.stop(STOP_TIMEOUT);

            assertThat(memory.size()).isEqualTo(producers * perProducer);
            assertThat(memory.records().stream().map(AuditRecord::traceId).distinct().count())
                    .isEqualTo(producers * perProducer);
        }

        @Test
        @DisplayName("delivered records never contain a social security number")
        void noSsnDelivered() {
            pipeline = pipeline(List.of(memory), 10);
            pipeline.start();

            AuditLogEntry base = AuditEntries.student("tr-cccc0001");
            pipeline.submit(new AuditLogEntry(base.traceId(), base.userId(), base.role(), base.presentedRole(), base.clearance(),
                    base.sessionContext(), base.modelInvoked(), base.resourcesAccessed(), base.resourcesDenied(),
                    base.fieldsMasked(), base.policyDecision(), "Asked about 123-45-6789", base.ttlStatus(),
                    base.timestamp()));
            pipeline.stop(STOP_TIMEOUT);

            AuditRecord delivered = memory.find("tr-cccc0001").orElseThrow();
            assertThat(delivered.toJsonLine()).doesNotContainPattern("\\d{3}-\\d{2}-\\d{4}");
        }

        @Test
        @DisplayName("entries submitted before start are delivered on stop")
        void drainsWithoutStart() {
            pipeline = pipeline(List.of(memory), 10);
            pipeline.submit(AuditEntries.student("tr-dddd0001"));
            pipeline.submit(AuditEntries.student("tr-dddd0002"));

            assertThat(pipeline.queueDepth()).isEqualTo(2);
            assertThat(registry.get("iccp.audit.queue.depth").gauge().value()).isEqualTo(2.0);
            assertThat(pipeline.stop(STOP_TIMEOUT)).isTrue();
            assertThat(memory.size()).isEqualTo(2);
        }
    }

    @Nested
    @DisplayName("sink failures")
    class SinkFailures {

        @Test
        @DisplayName("a failing sink is retried, reported and does not affect other sinks")
        void failingSinkIsolated() throws IOException {
            AuditSink broken = mock(AuditSink.class);
            when(broken.name()).thenReturn("broken");
            doThrow(new IOException("disk full")).when(broken).write(any());

            pipeline = pipeline(List.of(broken, memory), 10);
            pipeline.start();
            pipeline.submit(AuditEntries.student("tr-eeee0001"));
            pipeline.submit(AuditEntries.student("tr-eeee0002"));
            pipeline.stop(STOP_TIMEOUT);

            verify(broken, times(6)).write(any());
            verify(broken).close();
            assertThat(memory.size()).isEqualTo(2);
            assertThat(registry.get("iccp.audit.sink.failures").tag("sink", "broken").counter().count())
                    .isEqualTo(2.0);
            assertThat(registry.get("iccp.audit.sink.failures").tag("sink", "memory").counter().count())
                    .isZero();
        }

        @Test
        @DisplayName("a sink that recovers within the attempt budget counts as delivered")
        void recoversOnRetry() throws IOException {
            AuditSink flaky = mock(AuditSink.class);
            when(flaky.name()).thenReturn("flaky");
            doThrow(new IOException("busy")).doNothing().when(flaky).write(any());

            pipeline = pipeline(List.of(flaky), 10);
            pipeline.start();
            pipeline.submit(AuditEntries.teacher("tr-ffff0001"));
            pipeline.stop(STOP_TIMEOUT);

            verify(flaky, times(2)).write(any());
            assertThat(registry.get("iccp.audit.delivered").tag("sink", "flaky").counter().count()).isEqualTo(1.0);
            assertThat(registry.get("iccp.audit.sink.failures").tag("sink", "flaky").counter().count()).isZero();
        }

        @Test
        @DisplayName("runtime exceptions from a sink do not kill the dispatcher")
        void runtimeFailure() throws IOException {
            AuditSink exploding = mock(AuditSink.class);
            when(exploding.name()).thenReturn("exploding");
            doThrow(new IllegalStateException("bug")).when(exploding).write(any());

            pipeline = pipeline(List.of(exploding, memory), 10);
            pipeline.start();
            pipeline.submit(AuditEntries.student("tr-gggg0001"));
            pipeline.submit(AuditEntries.student("tr-gggg0002"));

            assertThat(pipeline.stop(STOP_TIMEOUT)).isTrue();
            assertThat(memory.size()).isEqualTo(2);
        }
    }

    @Nested
    @DisplayName("lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("submissions after stop are rejected and counted")
        void rejectsAfterStop() {
            pipeline = pipeline(List.of(memory), 10);
            pipeline.start();
            pipeline.stop(STOP_TIMEOUT);

            assertThat(pipeline.submit(AuditEntries.student("tr-hhhh0001"))).isFalse();
            assertThat(count("iccp.audit.rejected")).isEqualTo(1.0);
            assertThat(pipeline.isRunning()).isFalse();
        }

        @Test
        @DisplayName("a full queue rejects without blocking")
        void rejectsWhenFull() {
            pipeline = pipeline(List.of(memory), 2);

            assertThat(pipeline.submit(AuditEntries.student("tr-iiii0001"))).isTrue();
            assertThat(pipeline.submit(AuditEntries.student("tr-iiii0002"))).isTrue();
            assertThat(pipeline.submit(AuditEntries.student("tr-iiii0003"))).isFalse();
            assertThat(count("iccp.audit.rejected")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("a drain that times out waits for the dispatcher, records leftovers and closes sinks last")
        void drainTimeout() throws InterruptedException {
            BlockingSink slow = new BlockingSink();
            ClosingAwareSink recording = new ClosingAwareSink();
            pipeline = pipeline(List.of(slow, recording), 10);
            pipeline.submit(AuditEntries.student("tr-jjjj0001"));
            pipeline.submit(AuditEntries.student("tr-jjjj0002"));
            pipeline.submit(AuditEntries.student("tr-jjjj0003"));
            pipeline.start();
            assertThat(slow.entered.await(5, TimeUnit.SECONDS)).isTrue();

            assertThat(pipeline.stop(Duration.ofMillis(100))).isFalse();

            assertThat(count("iccp.audit.undelivered")).isEqualTo(2.0);
            assertThat(registry.get("iccp.audit.sink.failures").tag("sink", "slow").counter().count())
                    .isEqualTo(1.0);
            assertThat(recording.written).containsExactly("tr-jjjj0001");
            assertThat(recording.closed).isTrue();
            assertThat(recording.writesAfterClose).isZero();
            assertThat(pipeline.queueDepth()).isZero();
        }

        @Test
        @DisplayName("cannot be started twice")
        void startTwice() {
            pipeline = pipeline(List.of(memory), 10);
            pipeline.start();

            assertThatThrownBy(pipeline::start).isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("sink names must be unique")
        void duplicateSinkNames() {
            assertThatThrownBy(() -> pipeline(List.of(memory, new InMemoryAuditSink()), 10))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("memory");
        }
    }

    /** Blocks every write until released or interrupted. */
    private static final class BlockingSink implements AuditSink {

        private final CountDownLatch entered = new CountDownLatch(1);
        private final CountDownLatch release = new CountDownLatch(1);

        @Override
        public String name() {
            return "slow";
        }

        @Override
        public void write(AuditRecord record) throws IOException {
            entered.countDown();
            try {
                release.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new InterruptedIOException("write interrupted");
            }
        }
    }

    /** Records delivered trace ids and whether any arrived after close. */
    private static final class ClosingAwareSink implements AuditSink {

        private final List<String> written = new CopyOnWriteArrayList<>();
        private volatile boolean closed;
        private volatile int writesAfterClose;

        @Override
        public String name() {
            return "recording";
        }

        @Override
        public void write(AuditRecord record) {
            if (closed) {
                writesAfterClose++;
            }
            written.add(record.traceId());
        }

        @Override
        public void close() {
            closed = true;
        }
    }
}
