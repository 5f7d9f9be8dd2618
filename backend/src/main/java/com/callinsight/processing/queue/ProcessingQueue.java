package com.callinsight.processing.queue;

import com.callinsight.config.AppProperties;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single-consumer FIFO of calls awaiting processing.
 *
 * <p>One dedicated worker thread drains the queue and hands each item to the injected
 * {@link ProcessingFunction}. Failed attempts are retried with exponential backoff up to
 * {@link QueueItem#MAX_RETRIES} attempts and re-enter at the tail. Terminal items are kept in bounded
 * completed/failed histories for status reporting.
 *
 * <p>At most one item per call id is active (pending, processing or retrying) at any time.
 */
public class ProcessingQueue {

    private static final Logger log = LoggerFactory.getLogger(ProcessingQueue.class);

    public static final String STATUS_EVENT = "queue_status";

    private static final long IDLE_POLL_MILLIS = 1000;
    private static final long WORKER_COOLDOWN_MILLIS = 1000;
    private static final Duration DEFAULT_STOP_TIMEOUT = Duration.ofSeconds(5);

    static final int MAX_HISTORY_SIZE = 50;

    private final ProcessingFunction processingFunction;
    private final StatusBroadcaster broadcaster;
    private final Duration backoffBase;
    private final int historySize;
    private final Duration maxResidency;
    private final Duration stopTimeout;
    private final Clock clock;

    private final Counter completedCounter;
    private final Counter failedCounter;
    private final Counter retryCounter;
    private final Timer latencyTimer;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition itemsAvailable = lock.newCondition();
    private final Condition retryWake = lock.newCondition();

    // guarded by lock
    private final Deque<QueueItem> queue = new ArrayDeque<>();
    private final Map<String, QueueItem> index = new LinkedHashMap<>();
    private final Deque<QueueItem> completed = new ArrayDeque<>();
    private final Deque<QueueItem> failed = new ArrayDeque<>();
    private QueueItem waiting;
    private QueueItem current;

    private volatile boolean running;
    private Thread worker;

    public ProcessingQueue(ProcessingFunction processingFunction,
                           StatusBroadcaster broadcaster,
                           AppProperties.Queue settings,
                           MeterRegistry meterRegistry,
                           Clock clock) {
        this.processingFunction = processingFunction;
        this.broadcaster = broadcaster;
        this.backoffBase = settings.backoffBase();
        this.historySize = Math.min(settings.historySize(), MAX_HISTORY_SIZE);
        this.maxResidency = settings.maxResidency();
        this.stopTimeout = settings.stopTimeout() == null ? DEFAULT_STOP_TIMEOUT : settings.stopTimeout();
        if (settings.historySize() > MAX_HISTORY_SIZE) {
            log.warn("Queue history size {} capped at {}", settings.historySize(), MAX_HISTORY_SIZE);
        }
        this.clock = clock;
        this.completedCounter = meterRegistry.counter("processing.queue.completed.total");
        this.failedCounter = meterRegistry.counter("processing.queue.failed.total");
        this.retryCounter = meterRegistry.counter("processing.queue.retry.scheduled.total");
        this.latencyTimer = meterRegistry.timer("processing.queue.item.latency");
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        if (worker != null && !awaitWorkerExit()) {
            throw new IllegalStateException("Previous processing queue worker is still running");
        }
        running = true;
        worker = new Thread(this::runWorker, "processing-queue-worker");
        worker.setDaemon(true);
        worker.start();
        log.info("Processing queue started");
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        lock.lock();
        try {
            itemsAvailable.signalAll();
            retryWake.signalAll();
        } finally {
            lock.unlock();
        }
        if (!awaitWorkerExit()) {
            log.warn("Processing queue worker still busy after {} ms, leaving it to finish", stopTimeout.toMillis());
        }
        log.info("Processing queue stopped");
    }

    // keeps the reference while the thread is alive so start() cannot spawn a second consumer
    private boolean awaitWorkerExit() {
        try {
            worker.join(stopTimeout.toMillis());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
        if (worker.isAlive()) {
            return false;
        }
        worker = null;
        return true;
    }

    public boolean isRunning() {
        return running;
    }

    public EnqueueResult add(String callId, String recordingFile, boolean force) {
        if (callId == null || callId.isBlank()) {
            throw new IllegalArgumentException("callId must not be blank");
        }
        EnqueueResult result;
        lock.lock();
        try {
            QueueItem existing = index.get(callId);
            if (existing != null && existing.getStatus().isActive()) {
                return new EnqueueResult(EnqueueStatus.ALREADY_QUEUED, positionOf(callId), existing.view());
            }
            QueueItem item = new QueueItem(callId, recordingFile, force, clock.instant());
            index.put(callId, item);
            queue.addLast(item);
            itemsAvailable.signal();
            result = new EnqueueResult(EnqueueStatus.QUEUED, positionOf(callId), item.view());
        } finally {
            lock.unlock();
        }
        log.info("Queued call {} at position {}", callId, result.position());
        broadcastStatus();
        return result;
    }

    public BatchResult addBatch(List<QueueRequest> requests) {
        List<String> added = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (QueueRequest request : requests) {
            if (!seen.add(request.callId())) {
                skipped.add(request.callId());
                continue;
            }
            EnqueueResult result = add(request.callId(), request.recordingFile(), request.force());
            if (result.queued()) {
                added.add(request.callId());
            } else {
                skipped.add(request.callId());
            }
        }
        log.info("Batch enqueue finished: {} added, {} skipped", added.size(), skipped.size());
        return BatchResult.of(added, skipped);
    }

    public ClearResult clear() {
        List<String> cleared = new ArrayList<>();
        lock.lock();
        try {
            Iterator<QueueItem> it = index.values().iterator();
            while (it.hasNext()) {
                QueueItem item = it.next();
                if (item.getStatus().isWaiting()) {
                    cleared.add(item.getCallId());
                    it.remove();
                }
            }
            queue.clear();
            retryWake.signalAll();
        } finally {
            lock.unlock();
        }
        log.info("Cleared {} queued calls", cleared.size());
        broadcastStatus();
        return new ClearResult(cleared.size(), List.copyOf(cleared));
    }

    public void updateStage(String callId, ProcessingStage stage) {
        lock.lock();
        try {
            if (current == null || !current.getCallId().equals(callId)) {
                return;
            }
            current.updateStage(stage);
        } finally {
            lock.unlock();
        }
        log.debug("Call {} entered stage {}", callId, stage.label());
        broadcastStatus();
    }

    public QueueStatus getStatus() {
        lock.lock();
        try {
            List<QueueItemView> pendingItems = new ArrayList<>();
            for (QueueItem item : executionOrder()) {
                pendingItems.add(item.view());
            }
            return new QueueStatus(
                    pendingItems.size(),
                    List.copyOf(pendingItems),
                    current == null ? null : current.view(),
                    completed.size(),
                    failed.size(),
                    views(completed),
                    views(failed),
                    running
            );
        } finally {
            lock.unlock();
        }
    }

    private void runWorker() {
        log.info("Processing queue worker running");
        while (running) {
            try {
                QueueItem item = nextItem();
                if (item == null || !claim(item)) {
                    continue;
                }
                execute(item);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                break;
            } catch (Exception ex) {
                log.error("Processing queue worker fault", ex);
                if (!cooldown()) {
                    break;
                }
            }
        }
        log.info("Processing queue worker exited");
    }

    private QueueItem nextItem() throws InterruptedException {
        lock.lock();
        try {
            if (queue.isEmpty()) {
                itemsAvailable.await(IDLE_POLL_MILLIS, TimeUnit.MILLISECONDS);
            }
            QueueItem item = queue.pollFirst();
            if (item == null) {
                return null;
            }
            if (index.get(item.getCallId()) != item) {
                log.debug("Skipping stale queue entry for call {}", item.getCallId());
                return null;
            }
            waiting = item;
            return item;
        } finally {
            lock.unlock();
        }
    }

    // the eligibility check and markProcessing happen under one lock hold
    private boolean claim(QueueItem item) throws InterruptedException {
        lock.lock();
        try {
            while (running && item.getNextRetryAt() != null && index.get(item.getCallId()) == item) {
                long remaining = Duration.between(clock.instant(), item.getNextRetryAt()).toNanos();
                if (remaining <= 0) {
                    break;
                }
                retryWake.awaitNanos(remaining);
            }
            waiting = null;
            if (running && index.get(item.getCallId()) == item) {
                item.markProcessing(clock.instant());
                current = item;
                return true;
            }
            if (running) {
                log.debug("Call {} was cleared while waiting for retry", item.getCallId());
            } else {
                // put it back so a restarted worker still sees it
                queue.addFirst(item);
            }
            return false;
        } finally {
            lock.unlock();
        }
    }

    private void execute(QueueItem item) {
        log.info("Processing call {} (attempt {}/{})", item.getCallId(), item.getAttempt(), QueueItem.MAX_RETRIES);
        broadcastStatus();

        Exception failure = null;
        long startNanos = System.nanoTime();
        try {
            processingFunction.process(
                    item.getCallId(),
                    item.getRecordingFile(),
                    item.isForce(),
                    stage -> updateStage(item.getCallId(), stage)
            );
        } catch (Exception ex) {
            failure = ex;
        } finally {
            latencyTimer.record(System.nanoTime() - startNanos, TimeUnit.NANOSECONDS);
            lock.lock();
            try {
                current = null;
            } finally {
                lock.unlock();
            }
        }

        if (failure == null) {
            onSuccess(item);
        } else {
            onFailure(item, failure);
        }
        broadcastStatus();
    }

    private void onSuccess(QueueItem item) {
        lock.lock();
        try {
            item.markCompleted(clock.instant());
            remember(completed, item);
            index.remove(item.getCallId(), item);
        } finally {
            lock.unlock();
        }
        completedCounter.increment();
        log.info("Completed call {}", item.getCallId());
    }

    private void onFailure(QueueItem item, Exception failure) {
        String message = failure.getMessage() == null ? failure.getClass().getSimpleName() : failure.getMessage();
        log.error("Processing failed for call {} (attempt {}/{})",
                item.getCallId(), item.getAttempt(), QueueItem.MAX_RETRIES, failure);

        Instant now = clock.instant();
        boolean residencyExceeded = residencyExceeded(item, now);
        lock.lock();
        try {
            if (item.getAttempt() < QueueItem.MAX_RETRIES && !residencyExceeded) {
                Duration backoff = backoffBase.multipliedBy(1L << item.getAttempt());
                item.markRetrying(message, now.plus(backoff));
                if (index.get(item.getCallId()) == item) {
                    queue.addLast(item);
                    itemsAvailable.signal();
                }
                retryCounter.increment();
                log.info("Retrying call {} in {} ms", item.getCallId(), backoff.toMillis());
                return;
            }
            String finalMessage = residencyExceeded ? message + " (max queue residency exceeded)" : message;
            item.markFailed(finalMessage, now);
            remember(failed, item);
            index.remove(item.getCallId(), item);
        } finally {
            lock.unlock();
        }
        failedCounter.increment();
        log.warn("Giving up on call {} after {} attempts", item.getCallId(), item.getAttempt());
    }

    private boolean residencyExceeded(QueueItem item, Instant now) {
        if (maxResidency == null || maxResidency.isZero() || maxResidency.isNegative()) {
            return false;
        }
        return Duration.between(item.getAddedAt(), now).compareTo(maxResidency) > 0;
    }

    private void broadcastStatus() {
        try {
            broadcaster.broadcast(STATUS_EVENT, getStatus());
        } catch (Exception ex) {
            log.warn("Queue status broadcast failed: {}", ex.getMessage());
        }
    }

    private boolean cooldown() {
        try {
            Thread.sleep(WORKER_COOLDOWN_MILLIS);
            return true;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    // caller holds lock
    private List<QueueItem> executionOrder() {
        List<QueueItem> order = new ArrayList<>();
        if (waiting != null && index.get(waiting.getCallId()) == waiting) {
            order.add(waiting);
        }
        for (QueueItem item : queue) {
            if (index.get(item.getCallId()) == item) {
                order.add(item);
            }
        }
        return order;
    }

    // caller holds lock
    private int positionOf(String callId) {
        if (current != null && current.getCallId().equals(callId)) {
            return 0;
        }
        List<QueueItem> order = executionOrder();
        for (int i = 0; i < order.size(); i++) {
            if (order.get(i).getCallId().equals(callId)) {
                return i + 1;
            }
        }
        return 0;
    }

    private void remember(Deque<QueueItem> history, QueueItem item) {
        history.addLast(item);
        while (history.size() > historySize) {
            history.removeFirst();
        }
    }

    private static List<QueueItemView> views(Deque<QueueItem> items) {
        List<QueueItemView> views = new ArrayList<>(items.size());
        for (QueueItem item : items) {
            views.add(item.view());
        }
        return List.copyOf(views);
    }
}
