package com.edushield.audit;

import java.time.Duration;

/**
 * Tuning for {@link AuditPipeline}.
 *
 * @param queueCapacity    maximum entries waiting for the dispatcher
 * @param maxWriteAttempts attempts per sink before a delivery is reported as failed
 * @param retryBackoff     pause between attempts
 * @param shutdownTimeout  how long {@link AuditPipeline#close()} waits for the queue to drain
 */
public record AuditPipelineOptions(int queueCapacity, int maxWriteAttempts, Duration retryBackoff,
                                   Duration shutdownTimeout) {

    public static final int DEFAULT_QUEUE_CAPACITY = 10_000;
    public static final int DEFAULT_MAX_WRITE_ATTEMPTS = 3;
    public static final Duration DEFAULT_RETRY_BACKOFF = Duration.ofMillis(50);
    public static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(10);

    public AuditPipelineOptions {
        if (queueCapacity <= 0) {
            throw new IllegalArgumentException("queueCapacity must be positive");
        }
        if (maxWriteAttempts <= 0) {
            throw new IllegalArgumentException("maxWriteAttempts must be positive");
        }
        if (retryBackoff == null || retryBackoff.isNegative()) {
            retryBackoff = DEFAULT_RETRY_BACKOFF;
        }
        if (shutdownTimeout == null || shutdownTimeout.isNegative() || shutdownTimeout.isZero()) {
            shutdownTimeout = DEFAULT_SHUTDOWN_TIMEOUT;
        }
    }

    public static AuditPipelineOptions defaults() {
        return new AuditPipelineOptions(DEFAULT_QUEUE_CAPACITY, DEFAULT_MAX_WRITE_ATTEMPTS, DEFAULT_RETRY_BACKOFF,
                DEFAULT_SHUTDOWN_TIMEOUT);
    }
}
