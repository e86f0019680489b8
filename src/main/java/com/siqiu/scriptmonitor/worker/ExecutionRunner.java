package com.siqiu.scriptmonitor.worker;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.siqiu.scriptmonitor.execution.ExecutionRecord;
import com.siqiu.scriptmonitor.execution.ExecutionStatus;
import com.siqiu.scriptmonitor.network.FetchSession;
import com.siqiu.scriptmonitor.network.NetworkGatekeeper;
import com.siqiu.scriptmonitor.sandbox.SandboxExecution;
import com.siqiu.scriptmonitor.sandbox.ScriptInvocation;
import com.siqiu.scriptmonitor.sandbox.ScriptOutcome;
import com.siqiu.scriptmonitor.sandbox.ScriptSandbox;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Drives one RunRequest through a fresh sandbox under the outer deadline and turns the outcome into a record.
 * Runs on the calling (worker) thread.
 */
@Component
public class ExecutionRunner implements DisposableBean {

    private final ScriptSandbox sandbox;
    private final NetworkGatekeeper gatekeeper;
    private final Clock clock;
    private final Duration defaultTimeout;
    private final Duration outerDeadline;

    private final ScheduledExecutorService watchdog = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "execution-watchdog");
        t.setDaemon(true);
        return t;
    });

    public ExecutionRunner(
            ScriptSandbox sandbox,
            NetworkGatekeeper gatekeeper,
            Clock clock,
            @Value("${monitor.worker.default-timeout-ms:30000}") long defaultTimeoutMs,
            @Value("${monitor.worker.max-timeout-ms:35000}") long maxTimeoutMs
    ) {
        if (maxTimeoutMs <= defaultTimeoutMs) {
            throw new IllegalArgumentException("monitor.worker.max-timeout-ms (" + maxTimeoutMs
                    + ") must be greater than monitor.worker.default-timeout-ms (" + defaultTimeoutMs + ")");
        }
        this.sandbox = sandbox;
        this.gatekeeper = gatekeeper;
        this.clock = clock;
        this.defaultTimeout = Duration.ofMillis(defaultTimeoutMs);
        this.outerDeadline = Duration.ofMillis(maxTimeoutMs);
    }

    public ExecutionRecord run(RunRequest request) {
        Instant startedAt = clock.instant();
        long t0 = System.nanoTime();

        FetchSession fetch = gatekeeper.openSession(startedAt.plus(outerDeadline));
        SandboxExecution execution = sandbox.newExecution(new ScriptInvocation(
                request.scheduleId(),
                request.script(),
                request.params(),
                request.env(),
                defaultTimeout,
                fetch
        ));

        // the only mechanism guaranteed to stop a script that never yields
        ScheduledFuture<?> deadline = watchdog.schedule(
                () -> execution.cancel(SandboxExecution.CancelReason.DEADLINE),
                outerDeadline.toMillis(), TimeUnit.MILLISECONDS);

        ScriptOutcome outcome;
        try {
            outcome = execution.run();
        } finally {
            deadline.cancel(false);
        }

        long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0);
        return new ExecutionRecord(
                UUID.randomUUID(),
                request.scheduleId(),
                request.triggerTime(),
                startedAt,
                durationMs,
                outcome.status(),
                outcome.result(),
                outcome.error(),
                outcome.logs()
        );
    }

    /**
     * Terminal record for a run that blew up outside the interpreter, so no request ends without a record.
     */
    public ExecutionRecord engineFailure(RunRequest request, Instant startedAt, Exception cause) {
        ObjectNode error = JsonNodeFactory.instance.objectNode();
        error.put("type", "engine_error");
        error.put("message", String.valueOf(cause.getMessage()));
        long durationMs = Math.max(0, Duration.between(startedAt, clock.instant()).toMillis());
        return new ExecutionRecord(
                UUID.randomUUID(),
                request.scheduleId(),
                request.triggerTime(),
                startedAt,
                durationMs,
                ExecutionStatus.ENGINE_ERROR,
                null,
                error,
                List.of()
        );
    }

    @Override
    public void destroy() {
        watchdog.shutdownNow();
    }
}
