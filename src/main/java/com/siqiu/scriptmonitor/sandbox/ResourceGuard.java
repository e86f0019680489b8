package com.siqiu.scriptmonitor.sandbox;

import org.graalvm.polyglot.ResourceLimits;
import org.graalvm.polyglot.Source;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;
import java.lang.management.ThreadMXBean;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Predicate;

/**
 * Enforces the ceilings of one interpreter instance.
 * <p>
 * Statement counting is delegated to the engine's resource limits. Memory (bytes allocated by the
 * executing thread) and the script's wall-clock budget are checked by a periodic sampler. The first
 * violation wins; it is recorded and the owner's cancel callback is run once.
 */
public class ResourceGuard {

    private static final Logger log = LoggerFactory.getLogger(ResourceGuard.class);

    static final long SAMPLE_INTERVAL_MS = 20;

    private static final com.sun.management.ThreadMXBean ALLOCATION_COUNTER = allocationCounter();

    private final SandboxLimits limits;
    private final Duration timeBudget;
    private final ScheduledExecutorService sampler;
    private final Runnable onViolation;

    private final AtomicReference<ResourceViolation> violation = new AtomicReference<>();

    private volatile ScheduledFuture<?> sampling;
    private volatile long threadId = -1;
    private volatile long baselineBytes;
    private volatile long startNanos;

    public ResourceGuard(SandboxLimits limits, Duration timeBudget, ScheduledExecutorService sampler, Runnable onViolation) {
        this.limits = limits;
        this.timeBudget = timeBudget;
        this.sampler = sampler;
        this.onViolation = onViolation;
    }

    /**
     * Engine-side limits; only statements from sources accepted by {@code countedSources} are counted.
     */
    public ResourceLimits polyglotLimits(Predicate<Source> countedSources) {
        return ResourceLimits.newBuilder()
                .statementLimit(limits.maxStatements(), countedSources)
                .onLimit(event -> trip(new ResourceViolation(GuardLimit.STATEMENTS,
                        "statement limit of " + limits.maxStatements() + " exceeded")))
                .build();
    }

    /**
     * Begin sampling the given thread, which must be the one that runs the script.
     */
    public void start(Thread executing) {
        this.threadId = executing.getId();
        this.baselineBytes = allocatedBytes(threadId);
        this.startNanos = System.nanoTime();
        this.sampling = sampler.scheduleAtFixedRate(this::sample, SAMPLE_INTERVAL_MS, SAMPLE_INTERVAL_MS, TimeUnit.MILLISECONDS);
    }

    public void stop() {
        ScheduledFuture<?> f = sampling;
        if (f != null) {
            f.cancel(false);
        }
    }

    public Optional<ResourceViolation> violation() {
        return Optional.ofNullable(violation.get());
    }

    void sample() {
        if (violation.get() != null) {
            stop();
            return;
        }
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
        if (elapsedMs > timeBudget.toMillis()) {
            trip(new ResourceViolation(GuardLimit.WALL_CLOCK,
                    "script exceeded its time budget of " + timeBudget.toMillis() + "ms"));
            return;
        }
        long current = allocatedBytes(threadId);
        if (current >= 0 && baselineBytes >= 0 && current - baselineBytes > limits.maxAllocatedBytes()) {
            trip(new ResourceViolation(GuardLimit.MEMORY,
                    "memory limit of " + limits.maxAllocatedBytes() + " bytes exceeded"));
        }
    }

    boolean trip(ResourceViolation v) {
        if (!violation.compareAndSet(null, v)) {
            return false;
        }
        stop();
        log.info("resource_limit_exceeded limit={} message={}", v.limit().label(), v.message());
        onViolation.run();
        return true;
    }

    private static long allocatedBytes(long threadId) {
        if (ALLOCATION_COUNTER == null || threadId < 0) return -1;
        return ALLOCATION_COUNTER.getThreadAllocatedBytes(threadId);
    }

    private static com.sun.management.ThreadMXBean allocationCounter() {
        ThreadMXBean bean = ManagementFactory.getThreadMXBean();
        if (bean instanceof com.sun.management.ThreadMXBean) {
            com.sun.management.ThreadMXBean hotspot = (com.sun.management.ThreadMXBean) bean;
            if (hotspot.isThreadAllocatedMemorySupported()) {
                if (!hotspot.isThreadAllocatedMemoryEnabled()) {
                    hotspot.setThreadAllocatedMemoryEnabled(true);
                }
                return hotspot;
            }
        }
        log.warn("thread_allocation_accounting_unavailable memory_limit=not_enforced");
        return null;
    }
}
