package com.edushield.audit;

import com.edushield.audit.sink.AuditSink;
import com.edushield.observability.MetricFactory;
import io.micrometer.core.instrument.Counter;
import java.io.IOException;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Asynchronous, ordered delivery of audit entries to every configured sink.
 * <p>
 * {@link #submit} never blocks: entries go onto a bounded FIFO queue drained by a single
 * dispatcher thread, which sanitizes each entry and hands it to every sink in turn. A sink
 * that keeps failing is retried, then reported; it never holds up the producer, the other
 * sinks or the dispatcher. {@link #stop} drains every accepted entry before closing the sinks;
 * an entry still queued when the drain times out is logged by trace id and counted as
 * undelivered.
 */
public class AuditPipeline implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AuditPipeline.class);

    private static final long POLL_MILLIS = 100;

    private enum State { NEW, RUNNING, STOPPED }

    private final List<AuditSink> sinks;
    private final AuditSanitizer sanitizer;
    private final AuditPipelineOptions options;
    private final BlockingQueue<AuditLogEntry> queue;

    private final Counter submitted;
    private final Counter rejected;
    private final Counter undelivered;
    private final Map<String, Counter> delivered = new HashMap<>();
    private final Map<String, Counter> failures = new HashMap<>();

    private final Object lifecycleLock = new Object();
    private volatile State state = State.NEW;
    private Thread dispatcher;

    public AuditPipeline(List<AuditSink> sinks, AuditSanitizer sanitizer, MetricFactory metrics,
                         AuditPipelineOptions options) {
        if (sinks == null || sinks.isEmpty()) {
            throw new IllegalArgumentException("at least one sink is required");
        }
        if (sanitizer == null || metrics == null || options == null) {
            throw new IllegalArgumentException("sanitizer, metrics and options must not be null");
        }
        this.sinks = List.copyOf(sinks);
        this.sanitizer = sanitizer;
        this.options = options;
        this.queue = new LinkedBlockingQueue<>(options.queueCapacity());

        this.submitted = metrics.counter("iccp.audit.submitted", "Audit entries accepted for delivery");
        this.rejected = metrics.counter("iccp.audit.rejected", "Audit entries refused at submission");
        this.undelivered = metrics.counter("iccp.audit.undelivered",
                "Accepted audit entries abandoned when shutdown timed out");
        for (AuditSink sink : this.sinks) {
            if (delivered.containsKey(sink.name())) {
                throw new IllegalArgumentException("duplicate sink name: " + sink.name());
            }
            delivered.put(sink.name(), metrics.counter("iccp.audit.delivered",
                    "Audit records written by a sink", "sink", sink.name()));
            failures.put(sink.name(), metrics.counter("iccp.audit.sink.failures",
                    "Audit records a sink failed to write after all attempts", "sink", sink.name()));
        }
        metrics.gauge("iccp.audit.queue.depth", "Audit entries waiting for the dispatcher", queue::size);
    }

    /**
     * Starts the dispatcher thread. Entries submitted before start are kept and delivered
     * once it runs.
     *
     * @throws IllegalStateException if the pipeline was already started or stopped
     */
    public void start() {
        synchronized (lifecycleLock) {
            if (state != State.NEW) {
                throw new IllegalStateException("Audit pipeline already " + state.name().toLowerCase());
            }
            dispatcher = new Thread(this::dispatchLoop, "audit-dispatcher");
            dispatcher.setDaemon(true);
            state = State.RUNNING;
            dispatcher.start();
        }
        log.info("Audit pipeline started: sinks={}, queueCapacity={}, maxWriteAttempts={}",
                sinks.stream().map(AuditSink::name).toList(), options.queueCapacity(), options.maxWriteAttempts());
    }

    /**
     * Queues an entry for delivery without waiting for it to be written.
     *
     * @return {@code true} if accepted; {@code false} if the pipeline is stopped or the
     *         queue is full (the rejection is logged and counted)
     */
    public boolean submit(AuditLogEntry entry) {
        if (entry == null) {
            throw new IllegalArgumentException("entry must not be null");
        }
        synchronized (lifecycleLock) {
            if (state == State.STOPPED) {
                rejected.increment();
                log.warn("Audit pipeline stopped, rejecting entry {}", entry.traceId());
                return false;
            }
            if (!queue.offer(entry)) {
                rejected.increment();
                log.error("Audit queue full ({} entries), rejecting entry {}", options.queueCapacity(), entry.traceId());
                return false;
            }
        }
        submitted.increment();
        return true;
    }

    /**
     * Stops accepting entries, waits up to {@code timeout} for the queue to drain and
     * closes every sink.
     *
     * @return {@code true} if every accepted entry was dispatched
     */
    public boolean stop(Duration timeout) {
        Thread worker;
        State previous;
        synchronized (lifecycleLock) {
            previous = state;
            if (previous == State.STOPPED) {
                return queue.isEmpty();
            }
            state = State.STOPPED;
            worker = dispatcher;
        }

        if (previous == State.NEW) {
            drainOnCallerThread();
        } else {
            awaitDispatcher(worker, timeout);
        }

        int abandoned = recordUndelivered();
        closeSinks();
        log.info("Audit pipeline stopped");
        return abandoned == 0;
    }

    /**
     * Stops the pipeline, waiting up to the configured shutdown timeout.
     */
    @Override
    public void close() {
        stop(options.shutdownTimeout());
    }

    /** Entries waiting for the dispatcher. */
    public int queueDepth() {
        return queue.size();
    }

    public boolean isRunning() {
        return state == State.RUNNING;
    }

    private void dispatchLoop() {
        try {
            while (true) {
                AuditLogEntry entry = queue.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
                if (entry != null) {
                    dispatch(entry);
                } else if (state == State.STOPPED) {
                    return;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Audit dispatcher interrupted with {} entries queued", queue.size());
        }
    }

    private void drainOnCallerThread() {
        AuditLogEntry entry;
        while ((entry = queue.poll()) != null) {
            dispatch(entry);
        }
    }

    private void awaitDispatcher(Thread worker, Duration timeout) {
        long millis = Math.max(1, timeout.toMillis());
        try {
            worker.join(millis);
            if (worker.isAlive()) {
                log.error("Audit dispatcher did not drain within {}, interrupting", timeout);
                worker.interrupt();
                worker.join(millis);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            worker.interrupt();
        }
        if (worker.isAlive()) {
            log.error("Audit dispatcher still busy after interrupt; closing sinks under it");
        }
    }

    private int recordUndelivered() {
        int abandoned = 0;
        AuditLogEntry entry;
        while ((entry = queue.poll()) != null) {
            abandoned++;
            undelivered.increment();
            log.error("Audit entry {} was not delivered before shutdown", entry.traceId());
        }
        if (abandoned > 0) {
            log.error("Audit pipeline stopped with {} undelivered entries", abandoned);
        }
        return abandoned;
    }

    void dispatch(AuditLogEntry entry) {
        AuditRecord record = sanitizer.sanitize(entry);
        for (AuditSink sink : sinks) {
            deliver(sink, record);
        }
    }

    private void deliver(AuditSink sink, AuditRecord record) {
        int attempts = options.maxWriteAttempts();
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                sink.write(record);
                delivered.get(sink.name()).increment();
                return;
            } catch (IOException | RuntimeException e) {
                if (attempt == attempts) {
                    failures.get(sink.name()).increment();
                    log.error("Audit sink '{}' failed to write entry {} after {} attempts",
                            sink.name(), record.traceId(), attempts, e);
                    return;
                }
                log.warn("Audit sink '{}' failed to write entry {} (attempt {}/{}): {}",
                        sink.name(), record.traceId(), attempt, attempts, e.getMessage());
                if (!backoff()) {
                    failures.get(sink.name()).increment();
                    log.error("Audit sink '{}' retry interrupted for entry {}", sink.name(), record.traceId());
                    return;
                }
            }
        }
    }

    private boolean backoff() {
        if (Thread.currentThread().isInterrupted()) {
            return false;
        }
        long millis = options.retryBackoff().toMillis();
        if (millis == 0) {
            return true;
        }
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void closeSinks() {
        for (AuditSink sink : sinks) {
            try {
                sink.close();
            } catch (IOException | RuntimeException e) {
                log.error("Failed to close audit sink '{}'", sink.name(), e);
            }
        }
    }
}
