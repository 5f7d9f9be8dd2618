package com.callinsight.processing.queue;

import com.callinsight.config.AppProperties;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class ProcessingQueueTest {

    private static final Duration BACKOFF_BASE = Duration.ofMillis(20);
    private static final Duration STOP_TIMEOUT = Duration.ofMillis(100);

    private final List<String> calls = new CopyOnWriteArrayList<>();
    private final List<String> events = new CopyOnWriteArrayList<>();
    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private ProcessingQueue queue;

    @AfterEach
    void tearDown() {
        if (queue != null) {
            queue.stop();
        }
    }

    @Test
    void addReportsPositionAndRejectsActiveDuplicates() {
        queue = newQueue((callId, file, force, stages) -> calls.add(callId));

        EnqueueResult first = queue.add("call-a", "a.wav", false);
        EnqueueResult second = queue.add("call-b", null, false);
        EnqueueResult duplicate = queue.add("call-a", "other.wav", true);

        assertThat(first.status()).isEqualTo(EnqueueStatus.QUEUED);
        assertThat(first.position()).isEqualTo(1);
        assertThat(first.item().status()).isEqualTo(QueueItemStatus.PENDING);
        assertThat(second.position()).isEqualTo(2);
        assertThat(duplicate.status()).isEqualTo(EnqueueStatus.ALREADY_QUEUED);
        assertThat(duplicate.position()).isEqualTo(1);
        assertThat(duplicate.item().recordingFile()).isEqualTo("a.wav");
        assertThat(queue.getStatus().pending()).isEqualTo(2);
        assertThat(events).contains(ProcessingQueue.STATUS_EVENT);
    }

    @Test
    void addBatchSkipsDuplicatesInsideTheBatchAndAlreadyQueuedCalls() {
        queue = newQueue((callId, file, force, stages) -> calls.add(callId));
        queue.add("call-0", null, false);

        BatchResult result = queue.addBatch(List.of(
                QueueRequest.of("call-1"),
                QueueRequest.of("call-1"),
                QueueRequest.of("call-2"),
                QueueRequest.of("call-0")
        ));

        assertThat(result.status()).isEqualTo("batch_queued");
        assertThat(result.added()).containsExactly("call-1", "call-2");
        assertThat(result.skipped()).containsExactly("call-1", "call-0");
        assertThat(result.addedCount()).isEqualTo(2);
        assertThat(result.skippedCount()).isEqualTo(2);
        assertThat(queue.getStatus().pendingItems())
                .extracting(QueueItemView::callId)
                .containsExactly("call-0", "call-1", "call-2");
    }

    @Test
    void workerProcessesInFifoOrder() {
        queue = newQueue((callId, file, force, stages) -> calls.add(callId));
        queue.add("call-1", null, false);
        queue.add("call-2", null, false);
        queue.add("call-3", null, false);

        queue.start();

        await().atMost(Duration.ofSeconds(5)).until(() -> queue.getStatus().completedCount() == 3);
        assertThat(calls).containsExactly("call-1", "call-2", "call-3");
        assertThat(queue.getStatus().pending()).isZero();
        assertThat(meterRegistry.counter("processing.queue.completed.total").count()).isEqualTo(3.0);
    }

    @Test
    void completedCallCanBeQueuedAgain() {
        queue = newQueue((callId, file, force, stages) -> calls.add(callId));
        queue.start();
        queue.add("call-1", null, false);
        await().atMost(Duration.ofSeconds(5)).until(() -> queue.getStatus().completedCount() == 1);

        EnqueueResult again = queue.add("call-1", null, true);

        assertThat(again.status()).isEqualTo(EnqueueStatus.QUEUED);
        await().atMost(Duration.ofSeconds(5)).until(() -> queue.getStatus().completedCount() == 2);
    }

    @Test
    void clearDropsWaitingItemsButLeavesTheProcessingItem() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        queue = newQueue((callId, file, force, stages) -> {
            calls.add(callId);
            if ("busy".equals(callId)) {
                release.await(5, TimeUnit.SECONDS);
            }
        });
        queue.start();
        queue.add("busy", null, false);
        await().atMost(Duration.ofSeconds(5)).until(() -> queue.getStatus().processingItem() != null);
        queue.add("waiting-1", null, false);
        queue.add("waiting-2", null, false);

        ClearResult cleared = queue.clear();

        assertThat(cleared.clearedCount()).isEqualTo(2);
        assertThat(cleared.callIds()).containsExactlyInAnyOrder("waiting-1", "waiting-2");
        QueueStatus status = queue.getStatus();
        assertThat(status.pending()).isZero();
        assertThat(status.processingItem().callId()).isEqualTo("busy");

        release.countDown();
        await().atMost(Duration.ofSeconds(5)).until(() -> queue.getStatus().completedCount() == 1);
        Thread.sleep(100);
        assertThat(calls).containsExactly("busy");
    }

    @Test
    void processingItemReportsPositionZeroForDuplicates() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        queue = newQueue((callId, file, force, stages) -> release.await(5, TimeUnit.SECONDS));
        queue.start();
        queue.add("call-1", null, false);
        await().atMost(Duration.ofSeconds(5)).until(() -> queue.getStatus().processingItem() != null);

        EnqueueResult duplicate = queue.add("call-1", null, false);

        assertThat(duplicate.status()).isEqualTo(EnqueueStatus.ALREADY_QUEUED);
        assertThat(duplicate.position()).isZero();
        assertThat(duplicate.item().status()).isEqualTo(QueueItemStatus.PROCESSING);
        release.countDown();
    }

    @Test
    void failedAttemptsAreRetriedWithExponentialBackoff() {
        List<Long> attemptTimes = new CopyOnWriteArrayList<>();
        AtomicInteger invocations = new AtomicInteger();
        queue = newQueue((callId, file, force, stages) -> {
            attemptTimes.add(System.nanoTime());
            if (invocations.incrementAndGet() < 3) {
                throw new IllegalStateException("transient " + invocations.get());
            }
        });
        queue.start();
        queue.add("call-1", null, false);

        await().atMost(Duration.ofSeconds(5)).until(() -> queue.getStatus().completedCount() == 1);

        QueueItemView completed = queue.getStatus().recentCompleted().get(0);
        assertThat(completed.attempt()).isEqualTo(3);
        assertThat(completed.status()).isEqualTo(QueueItemStatus.COMPLETED);
        assertThat(attemptTimes).hasSize(3);
        long firstGap = TimeUnit.NANOSECONDS.toMillis(attemptTimes.get(1) - attemptTimes.get(0));
        long secondGap = TimeUnit.NANOSECONDS.toMillis(attemptTimes.get(2) - attemptTimes.get(1));
        assertThat(firstGap).isGreaterThanOrEqualTo(BACKOFF_BASE.toMillis() * 2);
        assertThat(secondGap).isGreaterThanOrEqualTo(BACKOFF_BASE.toMillis() * 4);
        assertThat(meterRegistry.counter("processing.queue.retry.scheduled.total").count()).isEqualTo(2.0);
    }

    @Test
    void itemFailsAfterThreeAttempts() {
        queue = newQueue((callId, file, force, stages) -> {
            calls.add(callId);
            throw new IllegalStateException("model unavailable");
        });
        queue.start();
        queue.add("call-1", null, false);

        await().atMost(Duration.ofSeconds(5)).until(() -> queue.getStatus().failedCount() == 1);

        QueueStatus status = queue.getStatus();
        QueueItemView failed = status.recentFailed().get(0);
        assertThat(failed.status()).isEqualTo(QueueItemStatus.FAILED);
        assertThat(failed.attempt()).isEqualTo(QueueItem.MAX_RETRIES);
        assertThat(failed.errorMessage()).isEqualTo("model unavailable");
        assertThat(status.pending()).isZero();
        assertThat(status.processingItem()).isNull();
        assertThat(calls).hasSize(3);
        assertThat(meterRegistry.counter("processing.queue.failed.total").count()).isEqualTo(1.0);
    }

    @Test
    void clearedRetryIsNotAttemptedAgain() throws Exception {
        queue = newQueue(Duration.ofSeconds(2), Duration.ZERO, (callId, file, force, stages) -> {
            calls.add(callId);
            throw new IllegalStateException("boom");
        });
        queue.start();
        queue.add("call-1", null, false);
        await().atMost(Duration.ofSeconds(5)).until(() -> !queue.getStatus().pendingItems().isEmpty()
                && queue.getStatus().pendingItems().get(0).status() == QueueItemStatus.RETRYING);

        ClearResult cleared = queue.clear();

        assertThat(cleared.callIds()).containsExactly("call-1");
        Thread.sleep(200);
        assertThat(calls).hasSize(1);
        assertThat(queue.getStatus().pending()).isZero();
    }

    @Test
    void stageUpdatesOnlyApplyToTheProcessingItem() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        queue = newQueue((callId, file, force, stages) -> {
            stages.onStage(ProcessingStage.DOWNLOADING);
            release.await(5, TimeUnit.SECONDS);
        });
        queue.start();
        queue.add("call-1", null, false);
        await().atMost(Duration.ofSeconds(5)).until(() -> queue.getStatus().processingItem() != null
                && queue.getStatus().processingItem().stage() == ProcessingStage.DOWNLOADING);
        queue.add("call-2", null, false);

        queue.updateStage("call-2", ProcessingStage.SAVING);

        QueueStatus status = queue.getStatus();
        assertThat(status.processingItem().stage()).isEqualTo(ProcessingStage.DOWNLOADING);
        assertThat(status.pendingItems().get(0).stage()).isNull();
        release.countDown();
    }

    @Test
    void broadcastFailuresDoNotAffectProcessing() {
        queue = new ProcessingQueue(
                (callId, file, force, stages) -> calls.add(callId),
                (eventType, payload) -> {
                    throw new IllegalStateException("subscriber gone");
                },
                new AppProperties.Queue(BACKOFF_BASE, 50, Duration.ZERO, STOP_TIMEOUT),
                meterRegistry,
                Clock.systemUTC()
        );
        queue.start();

        EnqueueResult result = queue.add("call-1", null, false);

        assertThat(result.queued()).isTrue();
        await().atMost(Duration.ofSeconds(5)).until(() -> queue.getStatus().completedCount() == 1);
    }

    @Test
    void historyIsBounded() {
        queue = new ProcessingQueue(
                (callId, file, force, stages) -> calls.add(callId),
                (eventType, payload) -> {
                },
                new AppProperties.Queue(BACKOFF_BASE, 3, Duration.ZERO, STOP_TIMEOUT),
                meterRegistry,
                Clock.systemUTC()
        );
        queue.start();
        for (int i = 0; i < 5; i++) {
            queue.add("call-" + i, null, false);
        }

        await().atMost(Duration.ofSeconds(5))
                .until(() -> meterRegistry.counter("processing.queue.completed.total").count() == 5.0);

        assertThat(queue.getStatus().recentCompleted())
                .extracting(QueueItemView::callId)
                .containsExactly("call-2", "call-3", "call-4");
    }

    @Test
    void residencyCapFailsTheItemInsteadOfRetrying() {
        queue = newQueue(BACKOFF_BASE, Duration.ofMillis(5), (callId, file, force, stages) -> {
            Thread.sleep(30);
            throw new IllegalStateException("slow failure");
        });
        queue.start();
        queue.add("call-1", null, false);

        await().atMost(Duration.ofSeconds(5)).until(() -> queue.getStatus().failedCount() == 1);

        QueueItemView failed = queue.getStatus().recentFailed().get(0);
        assertThat(failed.attempt()).isEqualTo(1);
        assertThat(failed.errorMessage()).isEqualTo("slow failure (max queue residency exceeded)");
    }

    @Test
    void stopHaltsTheWorker() {
        queue = newQueue((callId, file, force, stages) -> calls.add(callId));
        queue.start();
        assertThat(queue.isRunning()).isTrue();

        queue.stop();
        queue.add("call-1", null, false);

        assertThat(queue.isRunning()).isFalse();
        assertThat(queue.getStatus().running()).isFalse();
        assertThat(queue.getStatus().pending()).isEqualTo(1);
        assertThat(calls).isEmpty();
    }

    @Test
    void retriedItemReentersBehindCallsQueuedDuringItsAttempt() {
        CountDownLatch secondQueued = new CountDownLatch(1);
        AtomicInteger firstCallAttempts = new AtomicInteger();
        queue = newQueue((callId, file, force, stages) -> {
            calls.add(callId);
            if ("call-a".equals(callId) && firstCallAttempts.incrementAndGet() == 1) {
                secondQueued.await(5, TimeUnit.SECONDS);
                throw new IllegalStateException("transient");
            }
        });
        queue.start();
        queue.add("call-a", null, false);
        await().atMost(Duration.ofSeconds(5)).until(() -> queue.getStatus().processingItem() != null);

        queue.add("call-b", null, false);
        secondQueued.countDown();

        await().atMost(Duration.ofSeconds(5)).until(() -> queue.getStatus().completedCount() == 2);
        assertThat(calls).containsExactly("call-a", "call-b", "call-a");
        assertThat(queue.getStatus().recentCompleted())
                .extracting(QueueItemView::callId)
                .containsExactly("call-b", "call-a");
    }

    @Test
    void clearRacingTheWorkerNeverReportsAnItemThatThenRuns() throws Exception {
        AtomicBoolean failedOnce = new AtomicBoolean();
        AtomicReference<Future<ClearResult>> clearing = new AtomicReference<>();
        ExecutorService clearer = Executors.newSingleThreadExecutor();
        WorkerHookClock clock = new WorkerHookClock();
        queue = new ProcessingQueue(
                (callId, file, force, stages) -> {
                    calls.add(callId);
                    if (failedOnce.compareAndSet(false, true)) {
                        throw new IllegalStateException("transient");
                    }
                },
                (eventType, payload) -> {
                    // the worker's next clock read is the retry-window check for call-1
                    if (failedOnce.get() && clearing.get() == null && isWorkerThread()) {
                        clock.onNextWorkerRead(() -> {
                            clearing.set(clearer.submit(() -> queue.clear()));
                            pause(200);
                        });
                    }
                },
                new AppProperties.Queue(Duration.ZERO, 50, Duration.ZERO, STOP_TIMEOUT),
                meterRegistry,
                clock
        );
        try {
            queue.start();
            queue.add("call-1", null, false);

            await().atMost(Duration.ofSeconds(5)).until(() -> queue.getStatus().completedCount() == 1);
            await().atMost(Duration.ofSeconds(5)).until(() -> clearing.get() != null && clearing.get().isDone());

            ClearResult cleared = clearing.get().get();
            assertThat(cleared.callIds()).isEmpty();
            assertThat(calls).containsExactly("call-1", "call-1");
            assertThat(queue.getStatus().recentCompleted().get(0).attempt()).isEqualTo(2);
        } finally {
            clearer.shutdownNow();
        }
    }

    @Test
    void historySizeIsCappedAtFifty() {
        queue = new ProcessingQueue(
                (callId, file, force, stages) -> calls.add(callId),
                (eventType, payload) -> {
                },
                new AppProperties.Queue(BACKOFF_BASE, 500, Duration.ZERO, STOP_TIMEOUT),
                meterRegistry,
                Clock.systemUTC()
        );
        queue.start();
        for (int i = 0; i < 60; i++) {
            queue.add("call-" + i, null, false);
        }

        await().atMost(Duration.ofSeconds(10))
                .until(() -> meterRegistry.counter("processing.queue.completed.total").count() == 60.0);

        List<QueueItemView> recent = queue.getStatus().recentCompleted();
        assertThat(recent).hasSize(ProcessingQueue.MAX_HISTORY_SIZE);
        assertThat(recent.get(0).callId()).isEqualTo("call-10");
    }

    @Test
    void restartWaitsForABusyWorkerToExit() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        queue = newQueue((callId, file, force, stages) -> {
            calls.add(callId);
            if ("slow".equals(callId)) {
                release.await(5, TimeUnit.SECONDS);
            }
        });
        queue.start();
        queue.add("slow", null, false);
        await().atMost(Duration.ofSeconds(5)).until(() -> queue.getStatus().processingItem() != null);

        queue.stop();

        assertThatThrownBy(queue::start)
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("Previous processing queue worker is still running");
        assertThat(queue.isRunning()).isFalse();

        release.countDown();
        await().atMost(Duration.ofSeconds(5)).ignoreExceptions().until(() -> {
            queue.start();
            return queue.isRunning();
        });
        queue.add("next", null, false);

        await().atMost(Duration.ofSeconds(5)).until(() -> queue.getStatus().completedCount() == 2);
        assertThat(calls).containsExactly("slow", "next");
    }

    private static boolean isWorkerThread() {
        return "processing-queue-worker".equals(Thread.currentThread().getName());
    }

    private static void pause(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
    }

    private ProcessingQueue newQueue(ProcessingFunction function) {
        return newQueue(BACKOFF_BASE, Duration.ZERO, function);
    }

    private ProcessingQueue newQueue(Duration backoffBase, Duration maxResidency, ProcessingFunction function) {
        return new ProcessingQueue(
                function,
                (eventType, payload) -> events.add(eventType),
                new AppProperties.Queue(backoffBase, 50, maxResidency, STOP_TIMEOUT),
                meterRegistry,
                Clock.systemUTC()
        );
    }

    private static final class WorkerHookClock extends Clock {

        private final Clock delegate = Clock.systemUTC();
        private final AtomicReference<Runnable> hook = new AtomicReference<>();

        void onNextWorkerRead(Runnable action) {
            hook.set(action);
        }

        @Override
        public Instant instant() {
            if (isWorkerThread()) {
                Runnable action = hook.getAndSet(null);
                if (action != null) {
                    action.run();
                }
            }
            return delegate.instant();
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }
    }
}
