package com.company.clientpulse.service;

import com.company.clientpulse.domain.EnqueueResult;
import com.company.clientpulse.domain.EvaluationOutcome;
import com.company.clientpulse.domain.EvaluationRequest;
import com.company.clientpulse.domain.QueueStats;
import com.company.clientpulse.domain.enums.EnqueueStatus;
import com.company.clientpulse.domain.enums.TargetState;
import com.company.clientpulse.event.EvaluationCompletedEvent;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs evaluations on a fixed pool behind a bounded FIFO queue.
 *
 * <p>At most one evaluation per target key is queued or running at any time. A full queue,
 * a duplicate key or a stopped queue rejects the request immediately. Every accepted request
 * completes its outcome future exactly once and releases its key on every exit path.
 */
@Slf4j
public class EvaluationQueue {

    private final Evaluator evaluator;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;
    private final int workers;
    private final int capacity;
    private final Duration shutdownGrace;

    private final ConcurrentMap<String, TargetState> targets = new ConcurrentHashMap<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final ThreadPoolExecutor executor;

    private final AtomicLong enqueued = new AtomicLong();
    private final AtomicLong rejected = new AtomicLong();
    private final AtomicLong started = new AtomicLong();
    private final AtomicLong succeeded = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong notificationsSent = new AtomicLong();
    private final AtomicLong inFlight = new AtomicLong();

    public EvaluationQueue(Evaluator evaluator, ApplicationEventPublisher eventPublisher, Clock clock,
                           int workers, int capacity, Duration shutdownGrace) {
        if (workers < 1 || capacity < 1) {
            throw new IllegalArgumentException("Queue needs at least one worker and a capacity of one");
        }
        this.evaluator = evaluator;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
        this.workers = workers;
        this.capacity = capacity;
        this.shutdownGrace = shutdownGrace;
        this.executor = new ThreadPoolExecutor(
                workers, workers,
                0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(capacity),
                new CustomizableThreadFactory("evaluation-worker-"),
                new ThreadPoolExecutor.AbortPolicy());
    }

    public void start() {
        if (executor.isShutdown()) {
            throw new IllegalStateException("Evaluation queue cannot be restarted after stop");
        }
        if (running.compareAndSet(false, true)) {
            executor.prestartAllCoreThreads();
            log.info("Evaluation queue started with {} workers and capacity {}", workers, capacity);
        }
    }

    public EnqueueResult enqueue(EvaluationRequest request) {
        String key = request.targetKey();

        if (!running.get()) {
            return reject(key, EnqueueStatus.STOPPED);
        }

        TargetState existing = targets.putIfAbsent(key, TargetState.QUEUED);
        if (existing != null) {
            log.info("Evaluation for {} already {}, rejecting duplicate", key, existing.name().toLowerCase());
            return reject(key, EnqueueStatus.ALREADY_RUNNING);
        }

        CompletableFuture<EvaluationOutcome> outcome = new CompletableFuture<>();
        try {
            executor.execute(new EvaluationTask(request, key, outcome));
        } catch (RejectedExecutionException e) {
            targets.remove(key);
            EnqueueStatus status = running.get() && !executor.isShutdown()
                    ? EnqueueStatus.QUEUE_FULL
                    : EnqueueStatus.STOPPED;
            log.warn("Evaluation for {} rejected: {}", key, status.getDescription());
            return reject(key, status);
        }

        enqueued.incrementAndGet();
        log.debug("Evaluation for {} queued (depth {})", key, executor.getQueue().size());
        return EnqueueResult.accepted(key, outcome);
    }

    /**
     * Stops intake, cancels queued work, gives running evaluations the grace period to finish,
     * then interrupts them. Returns once all workers have exited.
     */
    public void stop() {
        if (!running.getAndSet(false) && executor.isTerminated()) {
            return;
        }
        log.info("Stopping evaluation queue ({} in flight, {} queued)", inFlight.get(), executor.getQueue().size());

        List<Runnable> pending = new ArrayList<>();
        executor.getQueue().drainTo(pending);
        executor.shutdown();
        cancelAll(pending);

        try {
            if (!executor.awaitTermination(shutdownGrace.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Evaluations still running after {}ms, interrupting workers", shutdownGrace.toMillis());
                cancelAll(executor.shutdownNow());
                while (!executor.awaitTermination(shutdownGrace.toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("Waiting for {} evaluation worker(s) to exit", executor.getActiveCount());
                }
            }
        } catch (InterruptedException e) {
            cancelAll(executor.shutdownNow());
            Thread.currentThread().interrupt();
        }
        log.info("Evaluation queue stopped");
    }

    public boolean isRunning() {
        return running.get();
    }

    public TargetState stateOf(String targetKey) {
        return targets.getOrDefault(targetKey, TargetState.IDLE);
    }

    public QueueStats stats() {
        return QueueStats.builder()
                .running(running.get())
                .enqueued(enqueued.get())
                .rejected(rejected.get())
                .started(started.get())
                .succeeded(succeeded.get())
                .failed(failed.get())
                .notificationsSent(notificationsSent.get())
                .inFlight(inFlight.get())
                .queueDepth(executor.getQueue().size())
                .workers(workers)
                .capacity(capacity)
                .build();
    }

    private EnqueueResult reject(String key, EnqueueStatus status) {
        rejected.incrementAndGet();
        return EnqueueResult.rejected(key, status);
    }

    private void cancelAll(List<Runnable> tasks) {
        for (Runnable task : tasks) {
            if (task instanceof EvaluationTask) {
                ((EvaluationTask) task).cancel();
            }
        }
    }

    private void complete(EvaluationTask task, EvaluationOutcome outcome) {
        if (!task.outcome.complete(outcome)) {
            return;
        }
        try {
            eventPublisher.publishEvent(new EvaluationCompletedEvent(outcome));
        } catch (Exception e) {
            log.error("Failed to publish outcome for {}", task.key, e);
        }
    }

    private final class EvaluationTask implements Runnable {

        private final EvaluationRequest request;
        private final String key;
        private final CompletableFuture<EvaluationOutcome> outcome;
        private final AtomicBoolean claimed = new AtomicBoolean(false);

        private EvaluationTask(EvaluationRequest request, String key, CompletableFuture<EvaluationOutcome> outcome) {
            this.request = request;
            this.key = key;
            this.outcome = outcome;
        }

        @Override
        public void run() {
            if (!claimed.compareAndSet(false, true)) {
                return;
            }
            targets.put(key, TargetState.RUNNING);
            started.incrementAndGet();
            inFlight.incrementAndGet();
            MDC.put("target", key);

            Instant startedAt = clock.instant();
            boolean sent = false;
            Throwable error = null;
            try {
                sent = evaluator.evaluate(request);
            } catch (Exception | Error e) {
                error = e;
                log.error("Evaluation for {} failed", key, e);
            } finally {
                inFlight.decrementAndGet();
                targets.remove(key);
                MDC.remove("target");
            }

            if (error == null) {
                succeeded.incrementAndGet();
                if (sent) {
                    notificationsSent.incrementAndGet();
                }
            } else {
                failed.incrementAndGet();
            }

            complete(this, EvaluationOutcome.builder()
                    .request(request)
                    .notificationSent(sent)
                    .error(error)
                    .startedAt(startedAt)
                    .finishedAt(clock.instant())
                    .build());
        }

        /**
         * Completes a task that never started.
         */
        private void cancel() {
            if (!claimed.compareAndSet(false, true)) {
                return;
            }
            targets.remove(key);
            failed.incrementAndGet();
            Instant now = clock.instant();
            log.info("Evaluation for {} cancelled before it started", key);
            complete(this, EvaluationOutcome.builder()
                    .request(request)
                    .notificationSent(false)
                    .error(new CancellationException("Evaluation queue stopped before " + key + " started"))
                    .startedAt(now)
                    .finishedAt(now)
                    .build());
        }
    }
}
