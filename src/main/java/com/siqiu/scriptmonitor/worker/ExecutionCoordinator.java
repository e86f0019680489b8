package com.siqiu.scriptmonitor.worker;

import com.siqiu.scriptmonitor.alert.AlertEvaluator;
import com.siqiu.scriptmonitor.execution.ExecutionRecord;
import com.siqiu.scriptmonitor.execution.ExecutionRecordRepository;
import com.siqiu.scriptmonitor.metrics.MonitorMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Set;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounded worker pool in front of the sandbox.
 * <p>
 * A schedule id is "claimed" from the moment its request is accepted until its record has been
 * written and handed to the alert evaluator, so a schedule is never queued twice nor run twice
 * concurrently. The single consumer thread takes a pool slot before taking a request; when all
 * slots are busy, requests simply wait in the queue.
 */
@Component
public class ExecutionCoordinator implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(ExecutionCoordinator.class);

    private final ExecutionRunner runner;
    private final ExecutionRecordRepository records;
    private final AlertEvaluator alerts;
    private final MonitorMetrics metrics;
    private final Clock clock;
    private final int poolSize;
    private final boolean autoStart;

    private final BlockingQueue<RunRequest> queue = new LinkedBlockingQueue<>();
    private final Set<Long> claimed = ConcurrentHashMap.newKeySet();
    private final Semaphore slots;
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicBoolean running = new AtomicBoolean(false);

    private final ExecutorService consumer = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "execution-coordinator");
        t.setDaemon(false);
        return t;
    });
    private final ExecutorService workers;

    public ExecutionCoordinator(
            ExecutionRunner runner,
            ExecutionRecordRepository records,
            AlertEvaluator alerts,
            MonitorMetrics metrics,
            Clock clock,
            @Value("${monitor.worker.pool-size:5}") int poolSize,
            @Value("${monitor.sandbox.stack-size-bytes:4194304}") long stackSizeBytes,
            @Value("${monitor.worker.autostart:true}") boolean autoStart
    ) {
        if (poolSize < 1) {
            throw new IllegalArgumentException("monitor.worker.pool-size must be >= 1");
        }
        this.runner = runner;
        this.records = records;
        this.alerts = alerts;
        this.metrics = metrics;
        this.clock = clock;
        this.poolSize = poolSize;
        this.autoStart = autoStart;
        this.slots = new Semaphore(poolSize);

        AtomicInteger seq = new AtomicInteger();
        // interpreter recursion depth is bounded by this stack size
        this.workers = Executors.newFixedThreadPool(poolSize,
                r -> new Thread(null, r, "script-worker-" + seq.incrementAndGet(), stackSizeBytes));

        metrics.gauge("monitor_pool_in_use", "Execution slots currently in use", inFlight::get);
        metrics.gauge("monitor_queue_depth", "Run requests waiting for a slot", queue::size);
    }

    /**
     * Accept a request unless its schedule is already queued or running.
     *
     * @return false if the request was dropped
     */
    public boolean submit(RunRequest request) {
        if (!claimed.add(request.scheduleId())) {
            metrics.incRunRequestsDropped();
            log.info("run_request_dropped scheduleId={} reason=already_queued_or_running", request.scheduleId());
            return false;
        }
        queue.add(request);
        return true;
    }

    public boolean isActive(long scheduleId) {
        return claimed.contains(scheduleId);
    }

    public int inFlight() {
        return inFlight.get();
    }

    public int queued() {
        return queue.size();
    }

    public int poolSize() {
        return poolSize;
    }

    @Override
    public void start() {
        if (running.compareAndSet(false, true)) {
            log.info("execution_coordinator_started poolSize={}", poolSize);
            consumer.submit(this::loop);
        }
    }

    @Override
    public void stop() {
        running.set(false);
        consumer.shutdownNow();
        workers.shutdown();
        try {
            if (!workers.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("execution_coordinator_forced_shutdown inFlight={}", inFlight.get());
                workers.shutdownNow();
            }
        } catch (InterruptedException ex) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("execution_coordinator_stopped queued={}", queue.size());
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public boolean isAutoStartup() {
        return autoStart;
    }

    private void loop() {
        while (running.get()) {
            try {
                slots.acquire();
                RunRequest next;
                try {
                    next = queue.poll(500, TimeUnit.MILLISECONDS);
                } catch (InterruptedException e) {
                    slots.release();
                    throw e;
                }
                if (next == null) {
                    slots.release();
                    continue;
                }
                dispatch(next);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (Exception e) {
                log.error("execution_coordinator_loop_error", e);
            }
        }
    }

    private void dispatch(RunRequest request) {
        try {
            workers.execute(() -> execute(request));
        } catch (RejectedExecutionException e) {
            claimed.remove(request.scheduleId());
            slots.release();
            log.warn("run_request_rejected scheduleId={} reason=pool_shutdown", request.scheduleId());
        }
    }

    /**
     * Run one request on the current thread. The slot and the schedule claim are released only after the
     * record has been written and handed to the alert evaluator.
     */
    void execute(RunRequest request) {
        inFlight.incrementAndGet();
        Instant startedAt = clock.instant();
        try {
            Duration lag = Duration.between(request.triggerTime(), startedAt);
            if (!lag.isNegative()) {
                metrics.observeTriggerLag(lag);
            }

            ExecutionRecord record;
            try {
                record = runner.run(request);
            } catch (RuntimeException e) {
                log.error("execution_engine_failure scheduleId={}", request.scheduleId(), e);
                record = runner.engineFailure(request, startedAt, e);
            }

            metrics.observeExecution(record.status(), Duration.ofMillis(record.durationMs()));
            log.info("execution_completed scheduleId={} executionId={} status={} durationMs={}",
                    record.scheduleId(), record.id(), record.status().wireName(), record.durationMs());

            store(record);
            try {
                alerts.submit(record);
            } catch (RuntimeException e) {
                log.error("alert_handoff_failed scheduleId={} executionId={}", record.scheduleId(), record.id(), e);
            }
        } finally {
            release(request);
        }
    }

    private void store(ExecutionRecord record) {
        try {
            records.recordExecution(record);
            return;
        } catch (RuntimeException e) {
            log.error("execution_record_write_failed scheduleId={} executionId={}", record.scheduleId(), record.id(), e);
        }
        try {
            records.recordMinimal(record, "storage rejected the full record");
            log.warn("execution_record_degraded scheduleId={} executionId={} status={}",
                    record.scheduleId(), record.id(), record.status().wireName());
        } catch (RuntimeException e) {
            log.error("execution_record_lost scheduleId={} executionId={}", record.scheduleId(), record.id(), e);
        }
    }

    private void release(RunRequest request) {
        claimed.remove(request.scheduleId());
        inFlight.decrementAndGet();
        slots.release();
    }
}
