package com.siqiu.scriptmonitor.sandbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.siqiu.scriptmonitor.execution.ExecutionStatus;
import com.siqiu.scriptmonitor.execution.LogLevel;
import com.siqiu.scriptmonitor.network.FetchRequest;
import com.siqiu.scriptmonitor.network.FetchResponse;
import com.siqiu.scriptmonitor.network.NetworkRejectedException;
import org.graalvm.polyglot.Context;
import org.graalvm.polyglot.EnvironmentAccess;
import org.graalvm.polyglot.HostAccess;
import org.graalvm.polyglot.PolyglotAccess;
import org.graalvm.polyglot.PolyglotException;
import org.graalvm.polyglot.Source;
import org.graalvm.polyglot.Value;
import org.graalvm.polyglot.proxy.ProxyExecutable;
import org.graalvm.polyglot.proxy.ProxyObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One disposable interpreter instance running one script. {@link #run()} is called once, on the
 * thread whose resources are accounted; {@link #cancel(CancelReason)} may be called from any thread.
 */
public class SandboxExecution {

    private static final Logger log = LoggerFactory.getLogger(SandboxExecution.class);

    public enum CancelReason {
        /** Outer deadline elapsed; always classified as timeout. */
        DEADLINE,
        /** The resource guard recorded a violation. */
        GUARD
    }

    private final ScriptInvocation invocation;
    private volatile ScriptSource source;
    private final SandboxLimits limits;
    private final String preludeCode;
    private final ObjectMapper mapper;
    private final ScriptLogBuffer logs;
    private final ResourceGuard guard;
    private final Executor canceller;

    private final ReentrantLock lifecycle = new ReentrantLock();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicBoolean started = new AtomicBoolean(false);
    private Context context;
    private Value helpers;
    private volatile CancelReason cancelReason;

    SandboxExecution(
            ScriptInvocation invocation,
            SandboxLimits limits,
            String preludeCode,
            ObjectMapper mapper,
            ScriptLogBuffer logs,
            ScheduledExecutorService guardSampler,
            Executor canceller
    ) {
        this.invocation = invocation;
        this.source = ScriptSource.of(invocation.script());
        this.limits = limits;
        this.preludeCode = preludeCode;
        this.mapper = mapper;
        this.logs = logs;
        this.canceller = canceller;
        this.guard = new ResourceGuard(limits, invocation.timeBudget(), guardSampler, () -> cancel(CancelReason.GUARD));
    }

    public ScriptOutcome run() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("SandboxExecution can only run once");
        }
        try {
            lifecycle.lock();
            try {
                if (cancelReason != null) {
                    return cancelledOutcome();
                }
                context = buildContext();
            } finally {
                lifecycle.unlock();
            }
            guard.start(Thread.currentThread());

            helpers = installApi();
            source = chooseForm(source);
            Value completion = context.eval(source.toSource());
            return settle(completion);

        } catch (PolyglotException e) {
            return classify(e);
        } catch (SandboxException e) {
            log.warn("sandbox_engine_error scheduleId={} reason={}", invocation.scheduleId(), e.getMessage(), e);
            return finished(ExecutionStatus.ENGINE_ERROR, null, ScriptErrors.engineError(e.getMessage()));
        } catch (RuntimeException e) {
            // cancellation closes the context under the script; anything else is an engine fault
            if (cancelReason != null || guard.violation().isPresent()) {
                return cancelledOutcome();
            }
            log.warn("sandbox_engine_error scheduleId={} reason={}", invocation.scheduleId(), e.toString(), e);
            return finished(ExecutionStatus.ENGINE_ERROR, null, ScriptErrors.engineError(e.toString()));
        } finally {
            guard.stop();
            closeContext();
        }
    }

    /**
     * Forcibly stop the script. The in-flight fetch is aborted first so a thread blocked on I/O is released.
     */
    public void cancel(CancelReason reason) {
        Context target;
        lifecycle.lock();
        try {
            if (cancelReason == null) {
                cancelReason = reason;
            }
            target = context;
        } finally {
            lifecycle.unlock();
        }
        if (invocation.fetch() != null) {
            invocation.fetch().abort();
        }
        if (target != null && !closed.get()) {
            canceller.execute(this::closeContext);
        }
    }

    private Context buildContext() {
        try {
            return Context.newBuilder("js")
                    .allowHostAccess(HostAccess.NONE)
                    .allowHostClassLookup(className -> false)
                    .allowHostClassLoading(false)
                    .allowIO(false)
                    .allowCreateThread(false)
                    .allowCreateProcess(false)
                    .allowNativeAccess(false)
                    .allowPolyglotAccess(PolyglotAccess.NONE)
                    .allowEnvironmentAccess(EnvironmentAccess.NONE)
                    .in(InputStream.nullInputStream())
                    .out(OutputStream.nullOutputStream())
                    .err(OutputStream.nullOutputStream())
                    .option("engine.WarnInterpreterOnly", "false")
                    .resourceLimits(guard.polyglotLimits(s -> ScriptSource.NAME.equals(s.getName())))
                    .build();
        } catch (IllegalArgumentException | IllegalStateException e) {
            throw new SandboxException("failed to create interpreter context", e);
        }
    }

    private Value installApi() {
        Map<String, Object> host = new HashMap<>();
        host.put("fetch", (ProxyExecutable) args -> hostFetch(args[0].asString()));
        host.put("log", (ProxyExecutable) args -> {
            logs.append(LogLevel.parse(args[0].asString()), args.length > 1 ? args[1].asString() : "");
            return null;
        });

        Value prelude = context.eval(Source.newBuilder("js", preludeCode, "prelude.js").buildLiteral());
        return prelude.execute(
                ProxyObject.fromMap(host),
                toJson(limits.deniedGlobals()),
                toJson(invocation.env()),
                toJson(invocation.params()));
    }

    /**
     * Plain scripts keep their completion value. Only a script that does not parse as a program
     * (top-level {@code return} or {@code await}) is retried as an async function body.
     */
    private ScriptSource chooseForm(ScriptSource plain) {
        try {
            context.parse(plain.toSource());
            return plain;
        } catch (PolyglotException e) {
            if (!e.isSyntaxError()) {
                throw e;
            }
        }
        ScriptSource body = plain.asFunctionBody();
        try {
            context.parse(body.toSource());
            return body;
        } catch (PolyglotException e) {
            if (!e.isSyntaxError()) {
                throw e;
            }
            // neither form parses; evaluating the plain form reports the error against the user's lines
            return plain;
        }
    }

    /**
     * Called from script code. Never throws: failures come back as {@code {error, reason}} for the prelude to reject with.
     */
    private String hostFetch(String requestJson) {
        Map<String, Object> reply = new HashMap<>();
        try {
            FetchRequest request = mapper.readValue(requestJson, FetchRequest.class);
            if (invocation.fetch() == null) {
                throw new NetworkRejectedException("network access is not available");
            }
            FetchResponse response = invocation.fetch().fetch(request);
            reply.put("status", response.status());
            reply.put("statusText", response.statusText());
            reply.put("url", response.url());
            reply.put("redirected", response.redirected());
            reply.put("headers", response.headers());
            reply.put("body", response.body());
        } catch (NetworkRejectedException e) {
            log.info("fetch_rejected scheduleId={} reason={}", invocation.scheduleId(), e.getMessage());
            reply.put("error", "request rejected: " + e.getMessage());
            reply.put("reason", "rejected");
        } catch (IOException e) {
            reply.put("error", "network error: " + e.getMessage());
            reply.put("reason", "io");
        }
        return toJson(reply);
    }

    private ScriptOutcome settle(Value completion) {
        Value outcome = completion;
        boolean rejected = false;

        if (isThenable(completion)) {
            AtomicReference<Value> fulfilledWith = new AtomicReference<>();
            AtomicReference<Value> rejectedWith = new AtomicReference<>();
            AtomicBoolean settled = new AtomicBoolean(false);
            AtomicBoolean failed = new AtomicBoolean(false);
            // pending jobs run before invokeMember returns; every await inside the script resolves synchronously
            completion.invokeMember("then",
                    (ProxyExecutable) args -> {
                        fulfilledWith.set(args.length > 0 ? args[0] : null);
                        settled.set(true);
                        return null;
                    },
                    (ProxyExecutable) args -> {
                        rejectedWith.set(args.length > 0 ? args[0] : null);
                        failed.set(true);
                        settled.set(true);
                        return null;
                    });

            if (!settled.get()) {
                return finished(ExecutionStatus.FAILURE, null, ScriptErrors.unsettled(source));
            }
            rejected = failed.get();
            outcome = rejected ? rejectedWith.get() : fulfilledWith.get();
        }

        if (cancelReason != null || guard.violation().isPresent()) {
            return cancelledOutcome();
        }

        if (rejected) {
            if (outcome != null && outcome.isException()) {
                try {
                    throw outcome.throwException();
                } catch (PolyglotException e) {
                    return classify(e);
                }
            }
            Value description = helpers.invokeMember("describe", outcome);
            if (!description.isString()) {
                return finished(ExecutionStatus.FAILURE, null, ScriptErrors.unserializable(source));
            }
            JsonNode described = readJson(description.asString());
            return finished(ExecutionStatus.FAILURE, null,
                    ScriptErrors.thrownValue(described.path("name").asText(), described.path("message").asText(), source));
        }

        Value encoded = helpers.invokeMember("encode", outcome);
        if (!encoded.isString()) {
            return finished(ExecutionStatus.FAILURE, null, ScriptErrors.unserializable(source));
        }
        return finished(ExecutionStatus.SUCCESS, readJson(encoded.asString()), null);
    }

    private ScriptOutcome classify(PolyglotException e) {
        if (cancelReason != null || guard.violation().isPresent()) {
            return cancelledOutcome();
        }
        if (e.isCancelled()) {
            return finished(ExecutionStatus.ENGINE_ERROR, null, ScriptErrors.engineError("execution cancelled"));
        }
        if (e.isResourceExhausted() || (e.isGuestException() && ScriptErrors.isStackOverflow(e))) {
            GuardLimit limit = ScriptErrors.isStackOverflow(e) || isStackMessage(e) ? GuardLimit.STACK : GuardLimit.MEMORY;
            return finished(ExecutionStatus.RESOURCE_EXCEEDED, null, ScriptErrors.resourceExceeded(limit, e.getMessage()));
        }
        if (e.isHostException() || e.isInternalError()) {
            log.warn("sandbox_engine_error scheduleId={} reason={}", invocation.scheduleId(), e.getMessage(), e);
            return finished(ExecutionStatus.ENGINE_ERROR, null, ScriptErrors.engineError(e.getMessage()));
        }
        if (e.isSyntaxError() || e.isGuestException()) {
            ObjectNode details = ScriptErrors.failure(e, source);
            attachExpectation(e, details);
            return finished(ExecutionStatus.FAILURE, null, details);
        }
        return finished(ExecutionStatus.ENGINE_ERROR, null, ScriptErrors.engineError(e.getMessage()));
    }

    private ScriptOutcome cancelledOutcome() {
        if (cancelReason == CancelReason.DEADLINE) {
            return finished(ExecutionStatus.TIMEOUT, null,
                    ScriptErrors.timeout("execution exceeded its outer deadline and was terminated"));
        }
        Optional<ResourceViolation> v = guard.violation();
        if (v.isPresent()) {
            if (v.get().limit() == GuardLimit.WALL_CLOCK) {
                return finished(ExecutionStatus.TIMEOUT, null, ScriptErrors.timeout(v.get().message()));
            }
            return finished(ExecutionStatus.RESOURCE_EXCEEDED, null,
                    ScriptErrors.resourceExceeded(v.get().limit(), v.get().message()));
        }
        return finished(ExecutionStatus.TIMEOUT, null, ScriptErrors.timeout("execution was cancelled"));
    }

    private void attachExpectation(PolyglotException e, ObjectNode details) {
        if (!"ExpectationError".equals(details.path("name").asText())) return;
        Value guest = e.getGuestObject();
        if (guest == null || !guest.hasMembers()) return;
        details.set("actual", readJson(toJsonLiteral(guest.getMember("actual"))));
        details.set("expected", readJson(toJsonLiteral(guest.getMember("expected"))));
    }

    private String toJsonLiteral(Value value) {
        if (helpers == null) {
            return "null";
        }
        Value text = helpers.invokeMember("json", value);
        return text.isString() ? text.asString() : "null";
    }

    private ScriptOutcome finished(ExecutionStatus status, JsonNode result, JsonNode error) {
        return new ScriptOutcome(status, result, error, logs.snapshot());
    }

    private void closeContext() {
        Context target;
        lifecycle.lock();
        try {
            target = context;
        } finally {
            lifecycle.unlock();
        }
        if (target == null || !closed.compareAndSet(false, true)) {
            return;
        }
        try {
            target.close(true);
        } catch (PolyglotException | IllegalStateException e) {
            log.debug("sandbox_close_failed scheduleId={} reason={}", invocation.scheduleId(), e.getMessage());
        }
    }

    private static boolean isThenable(Value v) {
        return v != null && v.hasMembers() && v.hasMember("then") && v.getMember("then").canExecute();
    }

    private static boolean isStackMessage(PolyglotException e) {
        String m = e.getMessage();
        return m != null && m.toLowerCase(Locale.ROOT).contains("stack");
    }

    private JsonNode readJson(String json) {
        try {
            return mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new SandboxException("unreadable value from interpreter", e);
        }
    }

    private String toJson(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new SandboxException("failed to serialize host value", e);
        }
    }
}
