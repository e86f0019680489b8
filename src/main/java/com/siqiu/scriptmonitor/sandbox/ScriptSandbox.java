package com.siqiu.scriptmonitor.sandbox;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory for per-execution interpreter instances. Holds only what is safe to share:
 * the prelude text, the limits and the threads used for sampling and cancellation.
 */
@Component
public class ScriptSandbox implements DisposableBean {

    static final String PRELUDE_RESOURCE = "sandbox/prelude.js";

    private final SandboxLimits limits;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final String prelude;

    private final ScheduledExecutorService guardSampler = Executors.newSingleThreadScheduledExecutor(daemon("sandbox-guard"));
    private final ExecutorService canceller = Executors.newCachedThreadPool(daemon("sandbox-cancel"));

    public ScriptSandbox(SandboxLimits limits, ObjectMapper mapper, Clock clock) {
        this.limits = limits;
        this.mapper = mapper;
        this.clock = clock;
        this.prelude = loadPrelude();
    }

    public SandboxExecution newExecution(ScriptInvocation invocation) {
        return new SandboxExecution(
                invocation,
                limits,
                prelude,
                mapper,
                new ScriptLogBuffer(limits.maxLogEntries(), clock),
                guardSampler,
                canceller
        );
    }

    @Override
    public void destroy() {
        guardSampler.shutdownNow();
        canceller.shutdownNow();
    }

    private static String loadPrelude() {
        try (InputStream in = new ClassPathResource(PRELUDE_RESOURCE).getInputStream()) {
            return StreamUtils.copyToString(in, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SandboxException("cannot load " + PRELUDE_RESOURCE, e);
        }
    }

    private static ThreadFactory daemon(String prefix) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
