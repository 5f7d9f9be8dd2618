package com.callinsight.processing.service;

import com.callinsight.config.AppProperties;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.AsyncTaskExecutor;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Process-wide bound on concurrent model calls (transcription and analysis).
 *
 * <p>The caller acquires a permit, the work runs on the inference executor, and the pooled task
 * releases the permit when it finishes. A caller that gives up after the call timeout therefore
 * never frees a permit that is still in use.
 */
public class InferenceGate {

    private static final Logger log = LoggerFactory.getLogger(InferenceGate.class);

    private final Semaphore permits;
    private final AsyncTaskExecutor executor;
    private final Duration acquireTimeout;
    private final Duration callTimeout;
    private final MeterRegistry meterRegistry;

    public InferenceGate(AsyncTaskExecutor executor, AppProperties.Inference settings, MeterRegistry meterRegistry) {
        this.permits = new Semaphore(settings.maxConcurrent(), true);
        this.executor = executor;
        this.acquireTimeout = settings.acquireTimeout();
        this.callTimeout = settings.callTimeout();
        this.meterRegistry = meterRegistry;
    }

    public <T> T call(String operation, Supplier<T> work) {
        acquire(operation);
        Future<T> future;
        try {
            future = executor.submit(() -> {
                Timer.Sample sample = Timer.start(meterRegistry);
                try {
                    return work.get();
                } finally {
                    sample.stop(meterRegistry.timer("inference.call.latency", "operation", operation));
                    permits.release();
                }
            });
        } catch (RejectedExecutionException ex) {
            permits.release();
            throw new RecordingProcessingException(operation + " rejected by inference executor", ex);
        }
        return await(operation, future);
    }

    public int availablePermits() {
        return permits.availablePermits();
    }

    private void acquire(String operation) {
        try {
            if (!permits.tryAcquire(acquireTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new RecordingProcessingException(
                        operation + " waited more than " + acquireTimeout.toMillis() + " ms for an inference slot");
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new RecordingProcessingException(operation + " interrupted while waiting for an inference slot", ex);
        }
    }

    private <T> T await(String operation, Future<T> future) {
        try {
            return future.get(callTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            log.warn("{} exceeded {} ms; the call keeps its slot until it returns", operation, callTimeout.toMillis());
            throw new RecordingProcessingException(operation + " timed out after " + callTimeout.toMillis() + " ms", ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new RecordingProcessingException(operation + " interrupted", ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            if (cause instanceof RecordingProcessingException processingException) {
                throw processingException;
            }
            throw new RecordingProcessingException(operation + " failed: " + cause.getMessage(), cause);
        }
    }
}
